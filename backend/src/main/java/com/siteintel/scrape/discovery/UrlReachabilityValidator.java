package com.siteintel.scrape.discovery;

import com.siteintel.scrape.http.PoliteHttpClient;
import com.siteintel.scrape.model.DiscoveredUrl;
import com.siteintel.scrape.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Drops candidates that do not answer with a 2xx or 3xx status. Probes run on the bounded discovery pool.
 */
@Service
public class UrlReachabilityValidator {
    private static final Logger log = LoggerFactory.getLogger(UrlReachabilityValidator.class);

    private final PoliteHttpClient httpClient;
    private final ExecutorService discoveryExecutor;

    public UrlReachabilityValidator(
        PoliteHttpClient httpClient,
        @Qualifier("discoveryExecutor") ExecutorService discoveryExecutor
    ) {
        this.httpClient = httpClient;
        this.discoveryExecutor = discoveryExecutor;
    }

    public List<DiscoveredUrl> retainReachable(List<DiscoveredUrl> candidates) {
        List<CompletableFuture<Boolean>> probes = new ArrayList<>(candidates.size());
        for (DiscoveredUrl candidate : candidates) {
            probes.add(CompletableFuture.supplyAsync(() -> isReachable(candidate.url()), discoveryExecutor));
        }
        List<DiscoveredUrl> reachable = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            boolean ok;
            try {
                ok = probes.get(i).join();
            } catch (CompletionException e) {
                log.warn("reachability probe failed url={}", candidates.get(i).url(), e.getCause());
                ok = false;
            }
            if (ok) {
                reachable.add(candidates.get(i));
            }
        }
        return reachable;
    }

    private boolean isReachable(String url) {
        HttpFetchResult result = httpClient.head(url);
        if (!result.isReachable()) {
            log.debug("dropping unreachable url={} status={} errorCode={}", url, result.statusCode(), result.errorCode());
            return false;
        }
        return true;
    }
}
