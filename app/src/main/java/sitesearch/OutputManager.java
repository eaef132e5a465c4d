package sitesearch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

// Renders search results for the console and logs the end-of-run summary.
public class OutputManager {

    private static final Logger log = LoggerFactory.getLogger(OutputManager.class);

    static final String NO_RESULTS = "No results found.";
    static final String RESULTS_HEADER = "Search results:";

    public String formatResults(List<String> results) {
        if (results == null || results.isEmpty()) {
            return NO_RESULTS + System.lineSeparator();
        }

        StringBuilder sb = new StringBuilder(RESULTS_HEADER).append(System.lineSeparator());
        for (String url : results) {
            sb.append("- ").append(url).append(System.lineSeparator());
        }
        return sb.toString();
    }

    public void printResults(List<String> results, PrintStream out) {
        out.print(formatResults(results));
        out.flush();
    }

    public void printSummary(SiteCrawler crawler) {
        log.info("==== Run summary ====");
        log.info("Visited  : {}", crawler.visited().size());
        log.info("Indexed  : {}", crawler.pagesIndexed());
        log.info("Skipped  : {}", crawler.pagesSkipped());
        log.info("Timeouts : {}", crawler.pagesTimedOut());
        log.info("Failed   : {}", crawler.pagesFailed());

        for (FailureRecord f : crawler.failures().snapshot()) {
            log.info("  depth={} type={} url={} ({})", f.depth(), f.type(), f.url(), f.message());
        }
    }
}
