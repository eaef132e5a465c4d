package sitesearch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

// Sink for per-page crawl failures: logged when they arrive, kept for the run summary.
public class FailureLogger {

    private static final Logger log = LoggerFactory.getLogger(FailureLogger.class);

    private final List<FailureRecord> failures = new ArrayList<>();

    public void add(FailureRecord record) {
        if (record == null) return;
        log.error("Error crawling {}: {}", record.url(), record.message());
        failures.add(record);
    }

    public boolean isEmpty() {
        return failures.isEmpty();
    }

    public Collection<FailureRecord> snapshot() {
        return new ArrayList<>(failures);
    }
}
