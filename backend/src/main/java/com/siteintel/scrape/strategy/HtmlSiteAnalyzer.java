package com.siteintel.scrape.strategy;

import com.siteintel.scrape.http.PoliteHttpClient;
import com.siteintel.scrape.model.HttpFetchResult;
import com.siteintel.scrape.model.SiteMetadata;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Fingerprints the homepage markup (generator meta tag, asset paths, framework root markers).
 */
@Component
public class HtmlSiteAnalyzer implements SiteAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(HtmlSiteAnalyzer.class);

    private final PoliteHttpClient httpClient;

    public HtmlSiteAnalyzer(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public SiteMetadata analyze(String homepageUrl) {
        HttpFetchResult fetch = httpClient.get(homepageUrl, "text/html,application/xhtml+xml;q=0.9,*/*;q=0.1");
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.debug("site analysis skipped url={} status={} errorCode={}", homepageUrl, fetch.statusCode(), fetch.errorCode());
            return SiteMetadata.unknown();
        }
        String technology = detectTechnology(fetch.body());
        return new SiteMetadata(technology, technology == null ? null : "website");
    }

    static String detectTechnology(String html) {
        Document document = Jsoup.parse(html);
        Element generator = document.selectFirst("meta[name=generator]");
        String generatorValue = generator == null ? "" : generator.attr("content").toLowerCase(Locale.ROOT);
        String lower = html.toLowerCase(Locale.ROOT);

        if (lower.contains("woocommerce")) {
            return "WooCommerce";
        }
        if (generatorValue.contains("wordpress") || lower.contains("/wp-content/")) {
            return "WordPress";
        }
        if (generatorValue.contains("drupal")) {
            return "Drupal";
        }
        if (generatorValue.contains("joomla")) {
            return "Joomla";
        }
        if (generatorValue.contains("hugo")) {
            return "Hugo";
        }
        if (generatorValue.contains("jekyll")) {
            return "Jekyll";
        }
        if (generatorValue.contains("gatsby") || document.getElementById("___gatsby") != null) {
            return "Gatsby";
        }
        if (generatorValue.contains("squarespace") || lower.contains("static.squarespace.com")) {
            return "Squarespace";
        }
        if (generatorValue.contains("webflow") || document.selectFirst("html[data-wf-site]") != null) {
            return "Webflow";
        }
        if (document.getElementById("__NEXT_DATA__") != null) {
            return "Next.js";
        }
        if (document.selectFirst("[ng-version]") != null) {
            return "Angular";
        }
        if (document.selectFirst("[data-v-app], #app[data-v-app]") != null || lower.contains("__vue__")) {
            return "Vue";
        }
        if (document.selectFirst("[data-reactroot]") != null || document.getElementById("root") != null) {
            return "React";
        }
        return null;
    }
}
