package sitesearch;

import java.time.Duration;

// Parameters for one crawl-and-search run.
public record CrawlerConfig(
        String startUrl,
        String keyword,
        int maxDepth,
        Duration fetchTimeout,
        String userAgent
) {
    public static final String DEFAULT_START_URL = "https://example.com";
    public static final String DEFAULT_KEYWORD = "test";
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(5);
    public static final String DEFAULT_USER_AGENT = "site-search/1.0 (+https://example.com/bot)";

    public static CrawlerConfig defaults() {
        return new CrawlerConfig(DEFAULT_START_URL, DEFAULT_KEYWORD, SiteCrawler.DEFAULT_MAX_DEPTH,
                DEFAULT_FETCH_TIMEOUT, DEFAULT_USER_AGENT);
    }

    public CrawlerConfig withStartUrl(String startUrl) {
        return new CrawlerConfig(startUrl, keyword, maxDepth, fetchTimeout, userAgent);
    }

    public CrawlerConfig withKeyword(String keyword) {
        return new CrawlerConfig(startUrl, keyword, maxDepth, fetchTimeout, userAgent);
    }

    public CrawlerConfig withMaxDepth(int maxDepth) {
        return new CrawlerConfig(startUrl, keyword, maxDepth, fetchTimeout, userAgent);
    }
}
