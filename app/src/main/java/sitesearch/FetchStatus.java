package sitesearch;

// Outcome of visiting a single URL.
public enum FetchStatus {
    OK,
    NOT_HTML,
    TIMEOUT,
    FAILED
}
