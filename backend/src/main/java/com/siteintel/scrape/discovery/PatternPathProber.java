package com.siteintel.scrape.discovery;

import com.siteintel.scrape.http.PoliteHttpClient;
import com.siteintel.scrape.model.DiscoveredUrl;
import com.siteintel.scrape.model.DiscoverySource;
import com.siteintel.scrape.model.HttpFetchResult;
import com.siteintel.scrape.util.UrlNormalizer;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Probes conventional company-site paths. Off by default; guessed paths are only kept when they answer.
 */
@Service
public class PatternPathProber {
    static final List<String> CONVENTIONAL_PATHS = List.of(
        "/about",
        "/about-us",
        "/contact",
        "/services",
        "/products",
        "/team",
        "/pricing",
        "/blog",
        "/news",
        "/careers"
    );

    private final PoliteHttpClient httpClient;

    public PatternPathProber(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public List<DiscoveredUrl> probe(String homepageUrl) {
        String origin = UrlNormalizer.origin(homepageUrl);
        List<DiscoveredUrl> found = new ArrayList<>();
        for (String path : CONVENTIONAL_PATHS) {
            String url = UrlNormalizer.normalize(origin + path);
            HttpFetchResult probe = httpClient.head(url);
            if (probe.isReachable()) {
                found.add(DiscoveredUrl.of(
                    url,
                    UrlNormalizer.generateTitle(url),
                    PriorityHeuristic.priority(url),
                    DiscoverySource.PATTERN
                ));
            }
        }
        return found;
    }
}
