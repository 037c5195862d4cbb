package com.siteintel.scrape.discovery;

import com.siteintel.config.ScraperProperties;
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

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extracts same-site links from the homepage, section by section. Footer links are read first since
 * footers tend to list pages that navigation and sitemaps leave out.
 */
@Service
public class HomepageLinkCrawler {
    private static final Logger log = LoggerFactory.getLogger(HomepageLinkCrawler.class);
    static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.1";

    enum Section {
        FOOTER,
        NAV,
        HEADER,
        BODY
    }

    private final PoliteHttpClient httpClient;
    private final ScraperProperties properties;

    public HomepageLinkCrawler(PoliteHttpClient httpClient, ScraperProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    public List<DiscoveredUrl> crawl(String homepageUrl) {
        HttpFetchResult fetch = httpClient.get(homepageUrl, HTML_ACCEPT);
        if (!fetch.isSuccessful() || fetch.body() == null) {
            throw new IllegalStateException(
                "homepage fetch failed status=" + fetch.statusCode() + " errorCode=" + fetch.errorCode()
            );
        }
        String baseUrl = fetch.finalUrlOrRequested();
        Document document = Jsoup.parse(fetch.body(), baseUrl);
        String siteHost = UrlNormalizer.host(homepageUrl);

        Map<String, LinkHit> hits = new LinkedHashMap<>();
        Map<Section, List<Element>> linksBySection = new LinkedHashMap<>();
        for (Section section : Section.values()) {
            linksBySection.put(section, new ArrayList<>());
        }
        for (Element link : document.select("a[href], [data-href]")) {
            linksBySection.get(sectionOf(link)).add(link);
        }

        int maxLinks = properties.getDiscovery().getMaxLinksPerPage();
        for (Map.Entry<Section, List<Element>> entry : linksBySection.entrySet()) {
            for (Element link : entry.getValue()) {
                String href = link.hasAttr("href") ? link.attr("href") : link.attr("data-href");
                String normalized = UrlNormalizer.resolve(baseUrl, href);
                // The homepage is listed once; a root link may point at the redirected host.
                if (!UrlNormalizer.isCrawlable(normalized, siteHost) || UrlNormalizer.isRoot(normalized)) {
                    continue;
                }
                LinkHit hit = hits.get(normalized);
                if (hit == null) {
                    if (hits.size() >= maxLinks) {
                        continue;
                    }
                    hit = new LinkHit(linkTitle(link, normalized));
                    hits.put(normalized, hit);
                }
                hit.sections.add(entry.getKey());
            }
        }

        String homepage = UrlNormalizer.normalize(homepageUrl);
        List<DiscoveredUrl> results = new ArrayList<>();
        String homepageTitle = document.title().isBlank() ? "Home" : document.title().trim();
        results.add(DiscoveredUrl.of(homepage, homepageTitle, PriorityHeuristic.HOMEPAGE, DiscoverySource.HOMEPAGE));
        for (Map.Entry<String, LinkHit> entry : hits.entrySet()) {
            if (entry.getKey().equals(homepage)) {
                continue;
            }
            results.add(DiscoveredUrl.of(
                entry.getKey(),
                entry.getValue().title,
                priorityFor(entry.getKey(), entry.getValue().sections),
                DiscoverySource.HOMEPAGE
            ));
        }
        log.debug("homepage crawl url={} links={}", homepageUrl, results.size());
        return results;
    }

    static double priorityFor(String url, Set<Section> sections) {
        double heuristic = PriorityHeuristic.priority(url);
        boolean footerOnly = sections.size() == 1 && sections.contains(Section.FOOTER);
        if (footerOnly && heuristic == PriorityHeuristic.OTHER) {
            return PriorityHeuristic.FOOTER_OTHER;
        }
        return heuristic;
    }

    private Section sectionOf(Element link) {
        for (Element parent : link.parents()) {
            String tag = parent.tagName().toLowerCase(Locale.ROOT);
            String role = parent.attr("role").toLowerCase(Locale.ROOT);
            String id = parent.id().toLowerCase(Locale.ROOT);
            if (tag.equals("footer") || role.equals("contentinfo") || id.equals("footer") || parent.hasClass("footer")) {
                return Section.FOOTER;
            }
            if (tag.equals("nav") || role.equals("navigation")) {
                return Section.NAV;
            }
            if (tag.equals("header") || role.equals("banner") || id.equals("header")) {
                return Section.HEADER;
            }
        }
        return Section.BODY;
    }

    private String linkTitle(Element link, String url) {
        String text = link.text().trim();
        if (text.isEmpty()) {
            text = link.attr("title").trim();
        }
        if (text.isEmpty() || text.length() > 120) {
            return UrlNormalizer.generateTitle(url);
        }
        return text;
    }

    private static final class LinkHit {
        private final String title;
        private final Set<Section> sections = EnumSet.noneOf(Section.class);

        private LinkHit(String title) {
            this.title = title;
        }
    }
}
