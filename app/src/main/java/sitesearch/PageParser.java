package sitesearch;

// Turns an HTML body into plain text and href values. Must tolerate malformed markup.
public interface PageParser {

    ParsedPage parse(String html);
}
