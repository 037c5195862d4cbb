package com.siteintel.scrape.robots;

import com.siteintel.scrape.http.PoliteHttpClient;
import com.siteintel.scrape.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);

    private final PoliteHttpClient httpClient;
    private final Map<String, RobotsRules> cache = new ConcurrentHashMap<>();

    public RobotsTxtService(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Rules for {@code origin} (scheme://host[:port]); fetched once and cached.
     */
    public RobotsRules getRules(String origin) {
        if (origin == null || origin.isBlank()) {
            return RobotsRules.allowAll();
        }
        String key = origin.toLowerCase(Locale.ROOT);
        return cache.computeIfAbsent(key, this::loadRules);
    }

    public boolean isAllowed(String url) {
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return true;
        }
        RobotsRules rules = getRules(originOf(uri));
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return rules.isAllowed(path);
    }

    private RobotsRules loadRules(String origin) {
        String robotsUrl = origin + "/robots.txt";
        HttpFetchResult fetch = httpClient.get(robotsUrl, "text/plain,text/*;q=0.9,*/*;q=0.1");
        if (!fetch.isSuccessful()) {
            log.info(
                "robots unavailable origin={} status={} errorCode={} decision=allow_all",
                origin,
                fetch.statusCode(),
                fetch.errorCode()
            );
            return RobotsRules.allowAll();
        }
        RobotsRules rules = RobotsRules.parse(fetch.body());
        log.debug("Loaded robots for {} with {} sitemap hints", origin, rules.getSitemapUrls().size());
        return rules;
    }

    static String originOf(URI uri) {
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return uri.getPort() > 0 ? scheme + "://" + host + ":" + uri.getPort() : scheme + "://" + host;
    }

    private URI toUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
