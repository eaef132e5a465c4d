package sitesearch;

// Raw response handed back by a PageFetcher. contentType may be null when the server sent none.
public record FetchResponse(int statusCode, String contentType, String body) {

    private static final String HTML_TYPE = "text/html";

    public boolean isHtml() {
        return contentType != null && contentType.contains(HTML_TYPE);
    }
}
