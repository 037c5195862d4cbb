package com.siteintel.scrape.strategy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteintel.scrape.model.PageEntities;
import com.siteintel.scrape.model.SocialLink;
import com.siteintel.scrape.model.TeamMember;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PageEntityExtractorTest {
    private static final String URL = "https://acme.test/";

    private final PageEntityExtractor extractor = new PageEntityExtractor(new ObjectMapper());

    @Test
    void readsOrganizationPeopleAndProductsFromJsonLd() {
        String html = """
            <html><head>
              <script type="application/ld+json">
              {"@context":"https://schema.org","@type":"Organization","name":"Acme",
               "logo":"https://acme.test/logo.png","email":"Hello@Acme.test","telephone":"+1 555 0100",
               "address":{"@type":"PostalAddress","streetAddress":"1 Main St","addressLocality":"Springfield"},
               "sameAs":["https://www.linkedin.com/company/acme","https://twitter.com/acme"]}
              </script>
              <script type="application/ld+json">
              [{"@type":"Person","name":"Ada Lovelace","jobTitle":"CTO"},
               {"@type":"Product","name":"Rocket","offers":{"price":"99.00","priceCurrency":"USD"}}]
              </script>
              <script type="application/ld+json">{ not json</script>
            </head><body></body></html>
            """;

        PageEntities entities = extractor.extract(Jsoup.parse(html, URL), URL);

        assertThat(entities.brand().logoUrl()).isEqualTo("https://acme.test/logo.png");
        assertThat(entities.contact().emails()).containsExactly("hello@acme.test");
        assertThat(entities.contact().phones()).containsExactly("+1 555 0100");
        assertThat(entities.contact().addresses()).containsExactly("1 Main St, Springfield");
        assertThat(entities.socialLinks()).extracting(SocialLink::platform).containsExactly("linkedin", "twitter");
        assertThat(entities.teamMembers()).containsExactly(new TeamMember("Ada Lovelace", "CTO", null));
        assertThat(entities.products()).singleElement()
            .satisfies(product -> assertThat(product.price()).isEqualTo("99.00 USD"));
    }

    @Test
    void readsContactLinksAndMarkupTestimonials() {
        String html = """
            <html><body>
              <a href="mailto:sales@acme.test?subject=hi">Email</a>
              <a href="tel:+15550199">Call</a>
              <a href="https://instagram.com/acme">Insta</a>
              <p>Reach support@acme.test or see sprite@2x.png</p>
              <div class="testimonial">
                <blockquote>They shipped in a week.</blockquote>
                <cite>Grace H.</cite>
              </div>
            </body></html>
            """;

        PageEntities entities = extractor.extract(Jsoup.parse(html, URL), URL);

        assertThat(entities.contact().emails()).containsExactly("sales@acme.test", "support@acme.test");
        assertThat(entities.contact().phones()).containsExactly("+15550199");
        assertThat(entities.socialLinks()).containsExactly(new SocialLink("instagram", "https://instagram.com/acme"));
        assertThat(entities.testimonials()).singleElement().satisfies(testimonial -> {
            assertThat(testimonial.author()).isEqualTo("Grace H.");
            assertThat(testimonial.quote()).isEqualTo("They shipped in a week.");
        });
    }

    @Test
    void collectsBrandAssetsFromMarkupAndStyles() {
        String html = """
            <html><head>
              <meta name="theme-color" content="#1A2B3C">
              <link rel="icon" href="/favicon.ico">
              <style>body { font-family: 'Inter', sans-serif; color: #333; }</style>
            </head><body>
              <img class="site-logo" src="/img/logo.svg">
              <img src="/img/hero.jpg">
            </body></html>
            """;

        PageEntities entities = extractor.extract(Jsoup.parse(html, URL), URL);

        assertThat(entities.brand().logoUrl()).isEqualTo("https://acme.test/img/logo.svg");
        assertThat(entities.brand().faviconUrl()).isEqualTo("https://acme.test/favicon.ico");
        assertThat(entities.brand().colors()).containsExactly("#1a2b3c", "#333");
        assertThat(entities.brand().fonts()).containsExactly("Inter");
        assertThat(entities.images()).containsExactly("https://acme.test/img/logo.svg", "https://acme.test/img/hero.jpg");
    }

    @Test
    void plainTextPageHasNoEntities() {
        PageEntities entities = extractor.extract(Jsoup.parse("<p>Just words.</p>", URL), URL);

        assertThat(entities.isEmpty()).isTrue();
    }
}
