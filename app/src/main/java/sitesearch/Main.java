package sitesearch;

// CLI entry point: crawl one site, search it for a keyword, print the matches.
public class Main {

    // Usage: [startUrl] [keyword] [maxDepth]; anything left out falls back to CrawlerConfig.defaults().
    public static void main(String[] args) {
        if (args.length > 3) {
            System.err.println("""
                    Usage: [startUrl] [keyword] [maxDepth]
                    Example: https://example.com test 3
                    """);
            System.exit(1);
        }

        CrawlerConfig config = parseArgs(args);

        SiteCrawler crawler = new SiteCrawler(
                new JsoupPageFetcher(config),
                new JsoupPageParser(),
                new FailureLogger());
        crawler.crawl(config.startUrl(), config.maxDepth());

        OutputManager output = new OutputManager();
        output.printResults(crawler.search(config.keyword()), System.out);
        output.printSummary(crawler);
    }

    static CrawlerConfig parseArgs(String[] args) {
        CrawlerConfig config = CrawlerConfig.defaults();
        if (args.length > 0) config = config.withStartUrl(args[0]);
        if (args.length > 1) config = config.withKeyword(args[1]);
        if (args.length > 2) {
            int depth = parseInt(args[2], "maxDepth");
            if (depth < 0) {
                System.err.println("maxDepth must be >= 0");
                System.exit(1);
            }
            config = config.withMaxDepth(depth);
        }
        return config;
    }

    // Strict integer parsing with a clean error message.
    private static int parseInt(String s, String name) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            System.err.println("Invalid integer for " + name + ": " + s);
            System.exit(1);
            return -1; // unreachable, but required by compiler
        }
    }
}
