package sitesearch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

// In-memory full-text index of crawled pages, in the order they were indexed.
public class PageIndex {

    private final Map<String, String> pages = new LinkedHashMap<>();

    // First insertion wins; a URL is only ever indexed once per crawl.
    public boolean add(String url, String text) {
        if (url == null || pages.containsKey(url)) return false;
        pages.put(url, text == null ? "" : text);
        return true;
    }

    public boolean contains(String url) {
        return pages.containsKey(url);
    }

    public Optional<String> textOf(String url) {
        return Optional.ofNullable(pages.get(url));
    }

    public int size() {
        return pages.size();
    }

    public boolean isEmpty() {
        return pages.isEmpty();
    }

    public Set<String> urls() {
        return Collections.unmodifiableSet(pages.keySet());
    }

    // Case-insensitive substring match; null or empty keyword matches nothing.
    public List<String> search(String keyword) {
        if (keyword == null || keyword.isEmpty()) return List.of();

        String needle = keyword.toLowerCase(Locale.ROOT);
        List<String> results = new ArrayList<>();
        for (Map.Entry<String, String> page : pages.entrySet()) {
            if (page.getValue().toLowerCase(Locale.ROOT).contains(needle)) {
                results.add(page.getKey());
            }
        }
        return results;
    }
}
