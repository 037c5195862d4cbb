package com.siteintel.scrape.discovery;

import com.siteintel.scrape.http.PoliteHttpClient;
import com.siteintel.scrape.model.DiscoveredUrl;
import com.siteintel.scrape.model.DiscoverySource;
import com.siteintel.scrape.model.HttpFetchResult;
import com.siteintel.scrape.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

@Service
public class BlogContentCrawler {
    private static final Logger log = LoggerFactory.getLogger(BlogContentCrawler.class);
    private static final List<String> HUB_SEGMENTS = List.of("blog", "news", "insights", "resources", "articles");
    private static final List<String> ARTICLE_HINTS = List.of(
        "/blog/", "/news/", "/post/", "/posts/", "/article/", "/articles/", "/insights/", "/resources/"
    );
    private static final Pattern DATE_PATH = Pattern.compile("/(19|20)\\d{2}/\\d{1,2}/");

    private final PoliteHttpClient httpClient;

    public BlogContentCrawler(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Crawls blog-like hub pages found among {@code candidates} and returns the article links they list.
     * The first {@code /blog} hub is always visited; other hubs fill the remaining {@code maxHubPages} slots.
     */
    public List<DiscoveredUrl> crawl(List<DiscoveredUrl> candidates, String siteHost, int maxHubPages) {
        List<String> hubs = selectHubs(candidates, maxHubPages);
        if (hubs.isEmpty()) {
            return List.of();
        }
        Map<String, DiscoveredUrl> articles = new LinkedHashMap<>();
        for (String hub : hubs) {
            HttpFetchResult fetch = httpClient.get(hub, HomepageLinkCrawler.HTML_ACCEPT);
            if (!fetch.isSuccessful() || fetch.body() == null) {
                log.debug("blog hub fetch failed url={} status={} errorCode={}", hub, fetch.statusCode(), fetch.errorCode());
                continue;
            }
            Document document = Jsoup.parse(fetch.body(), fetch.finalUrlOrRequested());
            for (Element link : document.select("a[href]")) {
                String normalized = UrlNormalizer.resolve(fetch.finalUrlOrRequested(), link.attr("href"));
                if (normalized == null
                    || normalized.equals(hub)
                    || articles.containsKey(normalized)
                    || !UrlNormalizer.isCrawlable(normalized, siteHost)
                    || !looksLikeArticle(normalized)) {
                    continue;
                }
                String text = link.text().trim();
                String title = text.isEmpty() || text.length() > 160 ? UrlNormalizer.generateTitle(normalized) : text;
                articles.put(normalized, DiscoveredUrl.of(normalized, title, PriorityHeuristic.CONTENT, DiscoverySource.BLOG));
            }
        }
        log.debug("blog discovery hubs={} articles={}", hubs.size(), articles.size());
        return new ArrayList<>(articles.values());
    }

    List<String> selectHubs(List<DiscoveredUrl> candidates, int maxHubPages) {
        List<String> blogHubs = new ArrayList<>();
        List<String> otherHubs = new ArrayList<>();
        for (DiscoveredUrl candidate : candidates) {
            String segment = hubSegment(candidate.url());
            if (segment == null) {
                continue;
            }
            List<String> target = segment.equals("blog") ? blogHubs : otherHubs;
            if (!target.contains(candidate.url())) {
                target.add(candidate.url());
            }
        }
        List<String> selected = new ArrayList<>();
        if (!blogHubs.isEmpty()) {
            selected.add(blogHubs.get(0));
        }
        for (String hub : otherHubs) {
            if (selected.size() >= maxHubPages) {
                break;
            }
            selected.add(hub);
        }
        return selected;
    }

    private String hubSegment(String url) {
        URI uri = UrlNormalizer.safeUri(url);
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath().toLowerCase(Locale.ROOT);
        for (String segment : HUB_SEGMENTS) {
            if (path.equals("/" + segment)) {
                return segment;
            }
        }
        return null;
    }

    static boolean looksLikeArticle(String url) {
        URI uri = UrlNormalizer.safeUri(url);
        String path = uri == null || uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        if (DATE_PATH.matcher(path).find()) {
            return true;
        }
        for (String hint : ARTICLE_HINTS) {
            int idx = path.indexOf(hint);
            if (idx >= 0 && path.length() > idx + hint.length()) {
                return true;
            }
        }
        return false;
    }
}
