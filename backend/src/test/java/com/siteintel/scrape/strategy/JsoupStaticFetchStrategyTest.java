package com.siteintel.scrape.strategy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteintel.scrape.FetchFixtures;
import com.siteintel.scrape.fetch.PageFetchException;
import com.siteintel.scrape.fetch.ScrapeErrorKind;
import com.siteintel.scrape.http.PoliteHttpClient;
import com.siteintel.scrape.model.PageRecord;
import com.siteintel.scrape.model.RawExtraction;
import com.siteintel.scrape.model.SiteMetadata;
import com.siteintel.scrape.model.StrategyKind;
import com.siteintel.scrape.model.StructuredExtraction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JsoupStaticFetchStrategyTest {
    private static final String URL = "https://acme.test/about";
    private static final FetchContext CONTEXT = new FetchContext("corr-1", "session-1", Duration.ofSeconds(5));

    @Mock
    private PoliteHttpClient httpClient;

    private JsoupStaticFetchStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new JsoupStaticFetchStrategy(httpClient, new PageEntityExtractor(new ObjectMapper()));
    }

    @Test
    void buildsRecordWithVisibleTextOnly() {
        when(httpClient.get(eq(URL), anyString(), anyInt(), eq(CONTEXT.pageTimeout()))).thenReturn(FetchFixtures.html(URL, """
            <html><head><title> About Acme </title><style>.x{color:red}</style></head>
            <body><h1>About</h1><p>We build rockets.</p><script>var hidden = 1;</script>
            <a href="mailto:hi@acme.test">Mail us</a></body></html>
            """));

        PageRecord record = strategy.fetch(URL, CONTEXT, SiteMetadata.unknown());

        assertThat(record.url()).isEqualTo(URL);
        assertThat(record.title()).isEqualTo("About Acme");
        assertThat(record.content()).contains("We build rockets.").doesNotContain("hidden");
        assertThat(record.html()).contains("<script>");
        assertThat(record.strategy()).isEqualTo(StrategyKind.STATIC);
        assertThat(record.extraction()).isInstanceOf(StructuredExtraction.class);
        assertThat(record.entities().contact().emails()).containsExactly("hi@acme.test");
    }

    @Test
    void titleFallsBackToHeadingAndPlainPagesCarryRawExtraction() {
        when(httpClient.get(eq(URL), anyString(), anyInt(), eq(CONTEXT.pageTimeout())))
            .thenReturn(FetchFixtures.html(URL, "<html><body><h1>Our story</h1><p>Text.</p></body></html>"));

        PageRecord record = strategy.fetch(URL, CONTEXT, SiteMetadata.unknown());

        assertThat(record.title()).isEqualTo("Our story");
        assertThat(record.extraction()).isInstanceOf(RawExtraction.class);
    }

    @Test
    void httpFailureIsANetworkError() {
        when(httpClient.get(eq(URL), anyString(), anyInt(), eq(CONTEXT.pageTimeout()))).thenReturn(FetchFixtures.status(URL, 503));

        assertThatThrownBy(() -> strategy.fetch(URL, CONTEXT, SiteMetadata.unknown()))
            .isInstanceOfSatisfying(PageFetchException.class, e -> {
                assertThat(e.getKind()).isEqualTo(ScrapeErrorKind.NETWORK);
                assertThat(e.getUrl()).isEqualTo(URL);
            });
    }

    @Test
    void nonHtmlContentIsAParseError() {
        when(httpClient.get(eq(URL), anyString(), anyInt(), eq(CONTEXT.pageTimeout())))
            .thenReturn(FetchFixtures.ok(URL, "%PDF-1.7", "application/pdf"));

        assertThatThrownBy(() -> strategy.fetch(URL, CONTEXT, SiteMetadata.unknown()))
            .isInstanceOfSatisfying(PageFetchException.class,
                e -> assertThat(e.getKind()).isEqualTo(ScrapeErrorKind.PARSE));
    }
}
