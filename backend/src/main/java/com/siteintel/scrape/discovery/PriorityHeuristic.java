package com.siteintel.scrape.discovery;

import com.siteintel.scrape.util.UrlNormalizer;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Path-based priority used when a source gives none: homepage 1.0, key company pages 0.8,
 * content hubs 0.6, everything else 0.5.
 */
public final class PriorityHeuristic {
    public static final double HOMEPAGE = 1.0;
    public static final double KEY_PAGE = 0.8;
    public static final double CONTENT = 0.6;
    public static final double FOOTER_OTHER = 0.55;
    public static final double OTHER = 0.5;

    private static final List<String> KEY_HINTS = List.of(
        "about", "contact", "services", "service", "team", "company", "who-we-are", "products", "pricing"
    );
    private static final List<String> CONTENT_HINTS = List.of(
        "blog", "news", "insights", "articles", "resources", "press", "stories"
    );

    private PriorityHeuristic() {
    }

    public static double priority(String url) {
        if (UrlNormalizer.isRoot(url)) {
            return HOMEPAGE;
        }
        URI uri = UrlNormalizer.safeUri(url);
        String path = uri == null || uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        String firstSegment = firstSegment(path);
        for (String hint : KEY_HINTS) {
            if (firstSegment.equals(hint) || firstSegment.startsWith(hint + "-")) {
                return KEY_PAGE;
            }
        }
        for (String hint : CONTENT_HINTS) {
            if (firstSegment.equals(hint) || path.contains("/" + hint + "/")) {
                return CONTENT;
            }
        }
        return OTHER;
    }

    private static String firstSegment(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        int slash = trimmed.indexOf('/');
        return slash < 0 ? trimmed : trimmed.substring(0, slash);
    }
}
