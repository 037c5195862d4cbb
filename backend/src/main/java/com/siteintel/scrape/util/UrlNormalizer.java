package com.siteintel.scrape.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Canonical URL form used as the dedup key across discovery: lower-case scheme and host, no fragment,
 * no default port, no trailing slash except on the root path.
 */
public final class UrlNormalizer {
    private static final List<String> REJECTED_SCHEMES = List.of("mailto:", "tel:", "javascript:", "data:", "sms:", "ftp:");
    private static final Map<String, String> SOCIAL_HOSTS = Map.ofEntries(
        Map.entry("facebook.com", "facebook"),
        Map.entry("fb.com", "facebook"),
        Map.entry("twitter.com", "twitter"),
        Map.entry("x.com", "twitter"),
        Map.entry("linkedin.com", "linkedin"),
        Map.entry("instagram.com", "instagram"),
        Map.entry("youtube.com", "youtube"),
        Map.entry("youtu.be", "youtube"),
        Map.entry("tiktok.com", "tiktok"),
        Map.entry("pinterest.com", "pinterest"),
        Map.entry("github.com", "github")
    );
    private static final List<String> BINARY_EXTENSIONS = List.of(
        ".jpg", ".jpeg", ".png", ".gif", ".svg", ".webp", ".ico", ".bmp",
        ".pdf", ".zip", ".gz", ".tar", ".rar", ".7z",
        ".mp3", ".mp4", ".mov", ".avi", ".wav", ".webm",
        ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx",
        ".css", ".js", ".json", ".xml", ".woff", ".woff2", ".ttf", ".eot"
    );
    private static final List<String> EXCLUDED_PATH_HINTS = List.of(
        "/wp-admin", "/admin", "/login", "/signin", "/sign-in", "/logout", "/register",
        "/cart", "/checkout", "/my-account", "/wp-login", "/feed"
    );

    private UrlNormalizer() {
    }

    public static String normalize(String url) {
        URI uri = safeUri(url == null ? null : url.trim());
        if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        boolean defaultPort = port < 0
            || (scheme.equals("http") && port == 80)
            || (scheme.equals("https") && port == 443);
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        StringBuilder normalized = new StringBuilder()
            .append(scheme)
            .append("://")
            .append(host);
        if (!defaultPort) {
            normalized.append(':').append(port);
        }
        normalized.append(path);
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            normalized.append('?').append(uri.getRawQuery());
        }
        return normalized.toString();
    }

    /**
     * Resolves {@code href} against {@code baseUrl} and normalizes it. Returns null for anchors,
     * non-navigational schemes and anything unparseable.
     */
    public static String resolve(String baseUrl, String href) {
        if (href == null) {
            return null;
        }
        String trimmed = href.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return null;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String scheme : REJECTED_SCHEMES) {
            if (lower.startsWith(scheme)) {
                return null;
            }
        }
        URI base = safeUri(baseUrl);
        if (base == null) {
            return normalize(trimmed);
        }
        try {
            return normalize(base.resolve(trimmed.replace(" ", "%20")).toString());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Accepts {@code example.com}, {@code https://example.com/anything} and returns the normalized root URL.
     */
    public static String homepageUrl(String domain) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain is required");
        }
        String candidate = domain.trim();
        if (!candidate.contains("://")) {
            candidate = "https://" + candidate;
        }
        URI uri = safeUri(candidate);
        if (uri == null || uri.getHost() == null) {
            throw new IllegalArgumentException("Invalid domain: " + domain);
        }
        return normalize(origin(uri) + "/");
    }

    public static String origin(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return origin(uri);
    }

    private static String origin(URI uri) {
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean defaultPort = uri.getPort() < 0
            || (scheme.equals("http") && uri.getPort() == 80)
            || (scheme.equals("https") && uri.getPort() == 443);
        return defaultPort ? scheme + "://" + host : scheme + "://" + host + ":" + uri.getPort();
    }

    public static String host(String url) {
        URI uri = safeUri(url);
        return uri == null || uri.getHost() == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
    }

    public static boolean isRoot(String url) {
        URI uri = safeUri(url);
        if (uri == null) {
            return false;
        }
        String path = uri.getRawPath();
        return (path == null || path.isEmpty() || path.equals("/"))
            && (uri.getRawQuery() == null || uri.getRawQuery().isBlank());
    }

    /**
     * Hosts match when they are equal ignoring a leading {@code www.}.
     */
    public static boolean sameSite(String hostA, String hostB) {
        if (hostA == null || hostB == null) {
            return false;
        }
        return stripWww(hostA).equalsIgnoreCase(stripWww(hostB));
    }

    private static String stripWww(String host) {
        String h = host.toLowerCase(Locale.ROOT);
        return h.startsWith("www.") ? h.substring(4) : h;
    }

    /**
     * Returns the social platform name for a URL on a known social host, otherwise null.
     */
    public static String socialPlatform(String url) {
        String host = host(url);
        if (host == null) {
            return null;
        }
        String bare = stripWww(host);
        for (Map.Entry<String, String> entry : SOCIAL_HOSTS.entrySet()) {
            if (bare.equals(entry.getKey()) || bare.endsWith("." + entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    public static boolean hasBinaryExtension(String url) {
        URI uri = safeUri(url);
        String path = uri == null || uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        for (String extension : BINARY_EXTENSIONS) {
            if (path.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isExcludedPath(String url) {
        URI uri = safeUri(url);
        String path = uri == null || uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        for (String hint : EXCLUDED_PATH_HINTS) {
            if (path.equals(hint) || path.startsWith(hint + "/") || path.startsWith(hint + ".")) {
                return true;
            }
        }
        return false;
    }

    /**
     * A normalized URL worth scraping for {@code siteHost}: same site, not social, not a binary asset,
     * not an admin/account/cart page.
     */
    public static boolean isCrawlable(String normalizedUrl, String siteHost) {
        if (normalizedUrl == null) {
            return false;
        }
        return sameSite(host(normalizedUrl), siteHost)
            && socialPlatform(normalizedUrl) == null
            && !hasBinaryExtension(normalizedUrl)
            && !isExcludedPath(normalizedUrl);
    }

    public static String generateTitle(String url) {
        URI uri = safeUri(url);
        String path = uri == null || uri.getPath() == null ? "" : uri.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (path.isEmpty()) {
            return "Home";
        }
        String segment = path.substring(path.lastIndexOf('/') + 1);
        int dot = segment.lastIndexOf('.');
        if (dot > 0) {
            segment = segment.substring(0, dot);
        }
        StringBuilder title = new StringBuilder();
        for (String word : segment.split("[-_+\\s]+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.length() == 0 ? "Home" : title.toString();
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
