package sitesearch;

import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.time.Duration;

// PageFetcher backed by a jsoup connection. Status codes and content types are passed through untouched.
public class JsoupPageFetcher implements PageFetcher {

    private final Duration timeout;
    private final String userAgent;

    public JsoupPageFetcher(Duration timeout, String userAgent) {
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    public JsoupPageFetcher(CrawlerConfig config) {
        this(config.fetchTimeout(), config.userAgent());
    }

    @Override
    public FetchResponse fetch(String url) throws IOException {
        Connection.Response response = Jsoup.connect(url)
                .userAgent(userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .timeout((int) timeout.toMillis())
                .followRedirects(true)
                // the crawler decides what to do with non-HTML and error responses
                .ignoreContentType(true)
                .ignoreHttpErrors(true)
                .maxBodySize(0)
                .execute();

        FetchResponse headersOnly = new FetchResponse(response.statusCode(), response.contentType(), "");
        if (!headersOnly.isHtml()) {
            // never buffer archives or media the crawler is going to skip
            response.bodyStream().close();
            return headersOnly;
        }
        return new FetchResponse(response.statusCode(), response.contentType(), response.body());
    }
}
