package com.siteintel.scrape.sitemap;

import com.siteintel.scrape.http.PoliteHttpClient;
import com.siteintel.scrape.model.HttpFetchResult;
import com.siteintel.scrape.model.SitemapDiscoveryResult;
import com.siteintel.scrape.model.SitemapFetchRecord;
import com.siteintel.scrape.model.SitemapUrlEntry;
import com.siteintel.scrape.robots.RobotsTxtService;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Breadth-first sitemap reader. Follows sitemap indexes up to {@code maxDepth} and collects
 * {@code <url>} entries with their lastmod, changefreq and priority.
 */
@Service
public class SitemapService {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);
    private static final int MAX_SITEMAP_BYTES = 5_000_000;
    private static final String SITEMAP_ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";

    private final PoliteHttpClient httpClient;
    private final RobotsTxtService robotsTxtService;

    public SitemapService(PoliteHttpClient httpClient, RobotsTxtService robotsTxtService) {
        this.httpClient = httpClient;
        this.robotsTxtService = robotsTxtService;
    }

    public SitemapDiscoveryResult discover(List<String> seedSitemaps, int maxDepth, int maxSitemaps, int maxUrls) {
        ArrayDeque<SitemapTask> queue = new ArrayDeque<>();
        for (String seed : seedSitemaps) {
            String normalized = normalizeSitemapUrl(seed);
            if (normalized != null) {
                queue.addLast(new SitemapTask(normalized, 0));
            }
        }

        LinkedHashSet<String> visitedSitemaps = new LinkedHashSet<>();
        LinkedHashMap<String, SitemapUrlEntry> discoveredUrls = new LinkedHashMap<>();
        List<SitemapFetchRecord> fetchedRecords = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();

        while (!queue.isEmpty() && visitedSitemaps.size() < maxSitemaps) {
            SitemapTask current = queue.removeFirst();
            if (current.depth() > maxDepth || !visitedSitemaps.add(current.url())) {
                continue;
            }
            if (!robotsTxtService.isAllowed(current.url())) {
                log.debug("Sitemap blocked by robots: {}", current.url());
                increment(errors, "blocked_by_robots");
                continue;
            }

            HttpFetchResult fetch = httpClient.get(current.url(), SITEMAP_ACCEPT, MAX_SITEMAP_BYTES);
            if (!fetch.isSuccessful()) {
                increment(errors, errorKey(fetch));
                continue;
            }
            String xmlPayload;
            try {
                xmlPayload = extractXmlPayload(fetch);
            } catch (IOException e) {
                log.warn("sitemap gzip decode failed url={}", current.url(), e);
                increment(errors, "gzip_decode_error");
                continue;
            }
            if (xmlPayload == null || xmlPayload.isBlank() || !looksLikeXml(xmlPayload)) {
                increment(errors, "empty_sitemap_payload");
                continue;
            }

            Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
            if (current.depth() < maxDepth) {
                for (Element loc : xml.select("sitemap > loc")) {
                    String child = normalizeSitemapUrl(loc.text());
                    if (child != null
                        && !visitedSitemaps.contains(child)
                        && visitedSitemaps.size() + queue.size() < maxSitemaps) {
                        queue.addLast(new SitemapTask(child, current.depth() + 1));
                    }
                }
            }

            int urlCountFromCurrent = 0;
            for (Element urlElement : xml.select("url")) {
                Element locElement = urlElement.selectFirst("loc");
                if (locElement == null) {
                    continue;
                }
                String loc = normalizeSitemapUrl(locElement.text());
                if (loc == null || discoveredUrls.containsKey(loc) || discoveredUrls.size() >= maxUrls) {
                    continue;
                }
                discoveredUrls.put(loc, new SitemapUrlEntry(
                    loc,
                    childText(urlElement, "lastmod"),
                    childText(urlElement, "changefreq"),
                    parsePriority(childText(urlElement, "priority"))
                ));
                urlCountFromCurrent++;
            }

            fetchedRecords.add(new SitemapFetchRecord(current.url(), Instant.now(), urlCountFromCurrent));
            if (discoveredUrls.size() >= maxUrls) {
                break;
            }
        }

        log.debug("sitemap discovery sitemaps={} urls={} errors={}", fetchedRecords.size(), discoveredUrls.size(), errors);
        return new SitemapDiscoveryResult(fetchedRecords, List.copyOf(discoveredUrls.values()), errors);
    }

    private String childText(Element parent, String tag) {
        Element child = parent.selectFirst(tag);
        if (child == null) {
            return null;
        }
        String text = child.text().trim();
        return text.isEmpty() ? null : text;
    }

    static Double parsePriority(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value)) {
                return null;
            }
            return Math.max(0.0, Math.min(1.0, value));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private boolean looksLikeXml(String payload) {
        String head = payload.stripLeading();
        if (head.length() > 512) {
            head = head.substring(0, 512);
        }
        head = head.toLowerCase(Locale.ROOT);
        return head.startsWith("<?xml") || head.contains("<urlset") || head.contains("<sitemapindex");
    }

    private String errorKey(HttpFetchResult fetch) {
        if (fetch.errorCode() != null) {
            return fetch.errorCode();
        }
        if (fetch.statusCode() > 0) {
            return "http_" + fetch.statusCode();
        }
        return "unknown_error";
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.merge(key, 1, Integer::sum);
    }

    private String extractXmlPayload(HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null && fetch.body() != null) {
            bodyBytes = fetch.body().getBytes(StandardCharsets.UTF_8);
        }
        if (bodyBytes == null) {
            return fetch.body();
        }
        if (isGzipPayload(bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return new String(gzipInputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    private boolean isGzipPayload(byte[] bodyBytes) {
        return bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
    }

    private String normalizeSitemapUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String normalized = url.trim();
        if (!normalized.startsWith("http://") && !normalized.startsWith("https://")) {
            if (normalized.contains("://")) {
                return null;
            }
            normalized = "https://" + normalized;
        }
        return normalized;
    }

    private record SitemapTask(String url, int depth) {
    }
}
