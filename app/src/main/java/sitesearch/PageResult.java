package sitesearch;

import java.util.List;

// Result of a single visit: URL, in-scope links to follow, and status.
public record PageResult(String url, List<String> extractedUrls, FetchStatus status) {

    static PageResult withoutLinks(String url, FetchStatus status) {
        return new PageResult(url, List.of(), status);
    }
}
