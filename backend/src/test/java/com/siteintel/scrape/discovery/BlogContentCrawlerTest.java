package com.siteintel.scrape.discovery;

import com.siteintel.scrape.FetchFixtures;
import com.siteintel.scrape.http.PoliteHttpClient;
import com.siteintel.scrape.model.DiscoveredUrl;
import com.siteintel.scrape.model.DiscoverySource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BlogContentCrawlerTest {

    @Mock
    private PoliteHttpClient httpClient;

    @Test
    void collectsArticleLinksFromBlogHub() {
        String hub = "https://example.com/blog";
        when(httpClient.get(eq(hub), anyString())).thenReturn(FetchFixtures.html(hub, """
            <html><body>
              <a href="/blog/hello-world">Hello world</a>
              <a href="/blog/2025/03/spring-update">Spring update</a>
              <a href="/blog">All posts</a>
              <a href="/about">About</a>
              <a href="https://elsewhere.com/blog/post">External</a>
            </body></html>
            """));
        BlogContentCrawler crawler = new BlogContentCrawler(httpClient);

        List<DiscoveredUrl> articles = crawler.crawl(
            List.of(DiscoveredUrl.of(hub, "Blog", 0.6, DiscoverySource.SITEMAP)),
            "example.com",
            3
        );

        assertThat(articles).extracting(DiscoveredUrl::url).containsExactly(
            "https://example.com/blog/hello-world",
            "https://example.com/blog/2025/03/spring-update"
        );
        assertThat(articles).allSatisfy(article -> {
            assertThat(article.source()).isEqualTo(DiscoverySource.BLOG);
            assertThat(article.priority()).isEqualTo(PriorityHeuristic.CONTENT);
        });
    }

    @Test
    void blogHubIsAlwaysSelectedBeforeOtherHubs() {
        BlogContentCrawler crawler = new BlogContentCrawler(httpClient);

        List<String> hubs = crawler.selectHubs(List.of(
            DiscoveredUrl.of("https://example.com/news", "News", 0.6, DiscoverySource.SITEMAP),
            DiscoveredUrl.of("https://example.com/resources", "Resources", 0.6, DiscoverySource.SITEMAP),
            DiscoveredUrl.of("https://example.com/blog", "Blog", 0.6, DiscoverySource.SITEMAP)
        ), 2);

        assertThat(hubs).containsExactly("https://example.com/blog", "https://example.com/news");
    }

    @Test
    void articleHeuristicNeedsSomethingAfterTheHubSegment() {
        assertThat(BlogContentCrawler.looksLikeArticle("https://example.com/news/")).isFalse();
        assertThat(BlogContentCrawler.looksLikeArticle("https://example.com/news/funding-round")).isTrue();
        assertThat(BlogContentCrawler.looksLikeArticle("https://example.com/2024/11/launch")).isTrue();
        assertThat(BlogContentCrawler.looksLikeArticle("https://example.com/pricing")).isFalse();
    }
}
