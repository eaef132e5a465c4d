package sitesearch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

// Depth-first, same-site crawler filling a PageIndex. Not thread-safe.
public class SiteCrawler {

    private static final Logger log = LoggerFactory.getLogger(SiteCrawler.class);

    public static final int DEFAULT_MAX_DEPTH = 3;

    private final PageFetcher pageFetcher;
    private final PageParser pageParser;
    private final FailureLogger failureLogger;

    private final Set<String> visited = new LinkedHashSet<>();
    private final PageIndex index = new PageIndex();

    // Counters for the end-of-run summary
    private int pagesIndexed;
    private int pagesSkipped;
    private int pagesFailed;
    private int pagesTimedOut;

    public SiteCrawler(PageFetcher pageFetcher, PageParser pageParser, FailureLogger failureLogger) {
        this.pageFetcher = Objects.requireNonNull(pageFetcher, "pageFetcher");
        this.pageParser = Objects.requireNonNull(pageParser, "pageParser");
        this.failureLogger = Objects.requireNonNull(failureLogger, "failureLogger");
    }

    public void crawl(String url) {
        crawl(url, null, DEFAULT_MAX_DEPTH, 0);
    }

    public void crawl(String url, int maxDepth) {
        crawl(url, null, maxDepth, 0);
    }

    // scopeBase null on a top-level call scopes links by the seed's host; the seed is depth 0.
    public void crawl(String url, String scopeBase, int maxDepth, int depth) {
        if (url == null || visited.contains(url) || depth > maxDepth) {
            return;
        }
        visited.add(url);

        PageResult result = visit(url, scopeBase, depth);
        if (result.status() != FetchStatus.OK) {
            return;
        }

        String childScope = scopeBase != null ? scopeBase : url;
        for (String link : result.extractedUrls()) {
            crawl(link, childScope, maxDepth, depth + 1);
        }
    }

    public List<String> search(String keyword) {
        return index.search(keyword);
    }

    public Set<String> visited() {
        return Collections.unmodifiableSet(visited);
    }

    public PageIndex index() {
        return index;
    }

    public FailureLogger failures() {
        return failureLogger;
    }

    public int pagesIndexed() {
        return pagesIndexed;
    }

    public int pagesSkipped() {
        return pagesSkipped;
    }

    public int pagesFailed() {
        return pagesFailed;
    }

    public int pagesTimedOut() {
        return pagesTimedOut;
    }

    // Fetch, gate on content type, index, and collect the links worth following.
    private PageResult visit(String url, String scopeBase, int depth) {
        try {
            FetchResponse response = pageFetcher.fetch(url);
            if (!response.isHtml()) {
                log.debug("Skipping {}: content type {}", url, response.contentType());
                pagesSkipped++;
                return PageResult.withoutLinks(url, FetchStatus.NOT_HTML);
            }

            ParsedPage page = pageParser.parse(response.body());
            index.add(url, page.text());
            pagesIndexed++;

            return new PageResult(url, selectLinks(url, scopeBase, page.hrefs()), FetchStatus.OK);

        } catch (SocketTimeoutException e) {
            pagesTimedOut++;
            failureLogger.add(new FailureRecord(depth, url, "TIMEOUT", String.valueOf(e.getMessage())));
            return PageResult.withoutLinks(url, FetchStatus.TIMEOUT);

        } catch (IOException | RuntimeException e) {
            pagesFailed++;
            failureLogger.add(new FailureRecord(depth, url, "FAILED", String.valueOf(e.getMessage())));
            return PageResult.withoutLinks(url, FetchStatus.FAILED);
        }
    }

    // Resolve hrefs and keep the in-scope ones, in order of appearance. Duplicates are left to the visited check.
    private List<String> selectLinks(String url, String scopeBase, List<String> hrefs) {
        String resolutionBase = scopeBase != null ? scopeBase : url;
        String seedHost = UrlUtil.hostOf(url);

        List<String> links = new ArrayList<>();
        for (String raw : hrefs) {
            String href = UrlUtil.cleanHref(raw);
            if (href == null) continue;

            String resolved = UrlUtil.resolveAgainst(resolutionBase, href);
            if (resolved == null) {
                log.debug("Ignoring unresolvable href {} on {}", href, url);
                continue;
            }

            if (scopeBase != null) {
                // Literal prefix: "https://example.com.evil.com" passes for base "https://example.com"
                if (!resolved.startsWith(scopeBase)) continue;
            } else if (seedHost == null || !seedHost.equals(UrlUtil.hostOf(resolved))) {
                continue;
            }
            links.add(resolved);
        }
        return links;
    }
}
