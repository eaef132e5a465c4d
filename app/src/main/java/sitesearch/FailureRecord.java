package sitesearch;

// Failure detail for one URL: depth it was reached at, failure type and message.
public record FailureRecord(int depth, String url, String type, String message) { }
