package com.siteintel.scrape.sitemap;

import com.siteintel.scrape.FetchFixtures;
import com.siteintel.scrape.http.PoliteHttpClient;
import com.siteintel.scrape.model.SitemapDiscoveryResult;
import com.siteintel.scrape.model.SitemapUrlEntry;
import com.siteintel.scrape.robots.RobotsTxtService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SitemapServiceTest {
    private static final String INDEX_URL = "https://example.com/sitemap_index.xml";
    private static final String PAGES_URL = "https://example.com/sitemap-pages.xml";

    @Mock
    private PoliteHttpClient httpClient;
    @Mock
    private RobotsTxtService robotsTxtService;

    private SitemapService service;

    @BeforeEach
    void setUp() {
        service = new SitemapService(httpClient, robotsTxtService);
    }

    @Test
    void followsIndexIntoChildSitemapsAndKeepsEntryMetadata() {
        when(robotsTxtService.isAllowed(anyString())).thenReturn(true);
        when(httpClient.get(eq(INDEX_URL), anyString(), anyInt())).thenReturn(FetchFixtures.ok(
            INDEX_URL,
            """
                <?xml version="1.0" encoding="UTF-8"?>
                <sitemapindex xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                  <sitemap><loc>https://example.com/sitemap-pages.xml</loc></sitemap>
                </sitemapindex>
                """,
            "application/xml"
        ));
        when(httpClient.get(eq(PAGES_URL), anyString(), anyInt())).thenReturn(FetchFixtures.ok(
            PAGES_URL,
            """
                <?xml version="1.0" encoding="UTF-8"?>
                <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                  <url>
                    <loc>https://example.com/</loc>
                    <lastmod>2026-01-05</lastmod>
                    <changefreq>weekly</changefreq>
                    <priority>1.4</priority>
                  </url>
                  <url><loc>https://example.com/about</loc><priority>0.7</priority></url>
                  <url><loc>https://example.com/about</loc></url>
                </urlset>
                """,
            "application/xml"
        ));

        SitemapDiscoveryResult result = service.discover(List.of(INDEX_URL), 3, 10, 100);

        assertThat(result.fetchedSitemaps()).hasSize(2);
        assertThat(result.discoveredUrls()).extracting(SitemapUrlEntry::url)
            .containsExactly("https://example.com/", "https://example.com/about");
        SitemapUrlEntry home = result.discoveredUrls().get(0);
        assertThat(home.lastmod()).isEqualTo("2026-01-05");
        assertThat(home.changefreq()).isEqualTo("weekly");
        assertThat(home.priority()).isEqualTo(1.0);
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void decodesGzipPayloadByMagicBytes() throws IOException {
        String gzUrl = "https://example.com/sitemap.xml.gz";
        byte[] gzipped = gzip("""
            <urlset><url><loc>https://example.com/products</loc></url></urlset>
            """);
        when(robotsTxtService.isAllowed(anyString())).thenReturn(true);
        when(httpClient.get(eq(gzUrl), anyString(), anyInt()))
            .thenReturn(FetchFixtures.bytes(gzUrl, gzipped, "application/octet-stream"));

        SitemapDiscoveryResult result = service.discover(List.of(gzUrl), 1, 5, 100);

        assertThat(result.discoveredUrls()).extracting(SitemapUrlEntry::url)
            .containsExactly("https://example.com/products");
    }

    @Test
    void robotsBlockedAndFailedSitemapsAreCountedAsErrors() {
        String blocked = "https://example.com/private-sitemap.xml";
        String missing = "https://example.com/sitemap.xml";
        when(robotsTxtService.isAllowed(blocked)).thenReturn(false);
        when(robotsTxtService.isAllowed(missing)).thenReturn(true);
        when(httpClient.get(eq(missing), anyString(), anyInt())).thenReturn(FetchFixtures.status(missing, 404));

        SitemapDiscoveryResult result = service.discover(List.of(blocked, missing), 2, 10, 100);

        assertThat(result.discoveredUrls()).isEmpty();
        assertThat(result.errors()).containsEntry("blocked_by_robots", 1).containsEntry("http_404", 1);
        verify(httpClient, never()).get(eq(blocked), anyString(), anyInt());
    }

    @Test
    void htmlErrorPageIsNotTreatedAsSitemap() {
        String url = "https://example.com/sitemap.xml";
        when(robotsTxtService.isAllowed(url)).thenReturn(true);
        when(httpClient.get(eq(url), anyString(), anyInt()))
            .thenReturn(FetchFixtures.html(url, "<html><body>Not here</body></html>"));

        SitemapDiscoveryResult result = service.discover(List.of(url), 2, 10, 100);

        assertThat(result.discoveredUrls()).isEmpty();
        assertThat(result.errors()).containsEntry("empty_sitemap_payload", 1);
    }

    @Test
    void priorityIsClampedAndInvalidValuesDropped() {
        assertThat(SitemapService.parsePriority("-0.5")).isEqualTo(0.0);
        assertThat(SitemapService.parsePriority("0.3")).isEqualTo(0.3);
        assertThat(SitemapService.parsePriority("high")).isNull();
    }

    private static byte[] gzip(String value) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(value.getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }
}
