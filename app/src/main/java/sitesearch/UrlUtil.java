package sitesearch;

import org.jsoup.internal.StringUtil;

import java.net.MalformedURLException;
import java.net.URL;

public class UrlUtil {

    private UrlUtil() {
    }

    // Trim raw href strings from HTML; blank hrefs are dropped.
    public static String cleanHref(String href) {
        if (href == null) return null;
        String s = href.trim();
        return s.isEmpty() ? null : s;
    }

    // Resolve relative hrefs the way jsoup's absUrl does. Returns null for anything that does not resolve.
    public static String resolveAgainst(String baseUrl, String href) {
        if (baseUrl == null || href == null) return null;
        String resolved = StringUtil.resolve(withRootPath(baseUrl), href);
        return resolved.isEmpty() ? null : resolved;
    }

    // Network location (host[:port]) of a URL, or null when it has none.
    public static String hostOf(String url) {
        if (url == null) return null;
        try {
            return new URL(url).getAuthority();
        } catch (MalformedURLException e) {
            return null;
        }
    }

    // "https://example.com?x" -> "https://example.com/?x", so relative hrefs land under the root
    private static String withRootPath(String baseUrl) {
        try {
            URL base = new URL(baseUrl);
            if (base.getAuthority() == null || !base.getPath().isEmpty()) return baseUrl;
            String query = base.getQuery() == null ? "" : "?" + base.getQuery();
            return base.getProtocol() + "://" + base.getAuthority() + "/" + query;
        } catch (MalformedURLException e) {
            // left to StringUtil.resolve, which falls back to an absolute href
            return baseUrl;
        }
    }
}
