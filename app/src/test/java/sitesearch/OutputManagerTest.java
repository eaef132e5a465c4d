package sitesearch;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OutputManagerTest {

    private static final String NL = System.lineSeparator();

    @Test
    void formatsEachResultOnItsOwnLine() {
        String text = new OutputManager().formatResults(List.of("https://test.com/result", "https://test.com/other"));

        assertEquals("Search results:" + NL
                + "- https://test.com/result" + NL
                + "- https://test.com/other" + NL, text);
    }

    @Test
    void emptyResultsGiveFixedMessage() {
        OutputManager output = new OutputManager();

        assertEquals("No results found." + NL, output.formatResults(List.of()));
        assertEquals("No results found." + NL, output.formatResults(null));
    }

    @Test
    void printResultsWritesToTheGivenStream() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);

        new OutputManager().printResults(List.of("https://test.com/result"), out);

        String printed = buf.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("Search results:"));
        assertTrue(printed.contains("- https://test.com/result"));
    }

    @Test
    void summaryListsFailures() {
        PageFetcher unreachable = url -> {
            throw new IOException("Connection refused");
        };
        SiteCrawler crawler = new SiteCrawler(unreachable, new JsoupPageParser(), new FailureLogger());
        crawler.crawl("https://example.com");

        Logger outputLog = (Logger) LoggerFactory.getLogger(OutputManager.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        outputLog.addAppender(appender);
        try {
            new OutputManager().printSummary(crawler);
        } finally {
            outputLog.detachAppender(appender);
        }

        assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().equals("Failed   : 1")));
        assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().contains("url=https://example.com")));
    }
}
