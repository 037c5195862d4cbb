package com.siteintel.scrape.strategy;

import com.siteintel.scrape.fetch.PageFetchException;
import com.siteintel.scrape.fetch.ScrapeErrorKind;
import com.siteintel.scrape.http.PoliteHttpClient;
import com.siteintel.scrape.model.HttpFetchResult;
import com.siteintel.scrape.model.PageExtraction;
import com.siteintel.scrape.model.PageRecord;
import com.siteintel.scrape.model.SiteMetadata;
import com.siteintel.scrape.model.StrategyKind;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Plain HTTP fetch plus jsoup parse. No script execution.
 */
@Component
public class JsoupStaticFetchStrategy implements FetchStrategy {
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.1";
    private static final int MAX_PAGE_BYTES = 3_000_000;

    private final PoliteHttpClient httpClient;
    private final PageEntityExtractor entityExtractor;

    public JsoupStaticFetchStrategy(PoliteHttpClient httpClient, PageEntityExtractor entityExtractor) {
        this.httpClient = httpClient;
        this.entityExtractor = entityExtractor;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.STATIC;
    }

    @Override
    public boolean stateful() {
        return false;
    }

    @Override
    public PageRecord fetch(String url, FetchContext context, SiteMetadata siteMetadata) {
        HttpFetchResult fetch = httpClient.get(url, HTML_ACCEPT, MAX_PAGE_BYTES, context.pageTimeout());
        if (!fetch.isSuccessful()) {
            String detail = fetch.errorCode() != null ? fetch.errorCode() : "http_" + fetch.statusCode();
            throw new PageFetchException(ScrapeErrorKind.NETWORK, url, "fetch failed: " + detail);
        }
        String contentType = fetch.contentType() == null ? "" : fetch.contentType().toLowerCase(Locale.ROOT);
        if (!contentType.isEmpty() && !contentType.contains("html") && !contentType.contains("xml")) {
            throw new PageFetchException(ScrapeErrorKind.PARSE, url, "unsupported content type " + contentType);
        }
        String html = fetch.body() == null ? "" : fetch.body();
        Document document = Jsoup.parse(html, fetch.finalUrlOrRequested());
        PageExtraction extraction = PageExtraction.of(entityExtractor.extract(document, url));

        Document textView = document.clone();
        textView.select("script, style, noscript, template, svg").remove();
        String content = textView.body() == null ? "" : textView.body().text().trim();

        return new PageRecord(
            url,
            title(document),
            content,
            html,
            kind(),
            extraction,
            List.of(),
            Instant.now()
        );
    }

    private String title(Document document) {
        String title = document.title().trim();
        if (!title.isEmpty()) {
            return title;
        }
        Element ogTitle = document.selectFirst("meta[property=og:title]");
        if (ogTitle != null && !ogTitle.attr("content").isBlank()) {
            return ogTitle.attr("content").trim();
        }
        Element heading = document.selectFirst("h1");
        if (heading != null && !heading.text().isBlank()) {
            return heading.text().trim();
        }
        return null;
    }
}
