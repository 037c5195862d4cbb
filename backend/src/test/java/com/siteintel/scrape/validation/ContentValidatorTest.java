package com.siteintel.scrape.validation;

import com.siteintel.config.ScraperProperties;
import com.siteintel.scrape.PageFixtures;
import com.siteintel.scrape.model.ContactInfo;
import com.siteintel.scrape.model.PageEntities;
import com.siteintel.scrape.model.PageExtraction;
import com.siteintel.scrape.model.PageRecord;
import com.siteintel.scrape.model.ValidationOutcome;
import com.siteintel.scrape.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ContentValidatorTest {
    private static final String SENTENCE = "Our engineering team plans, builds and ships client projects on a steady weekly cadence. ";
    private static final String LONG_TEXT = SENTENCE.repeat(7).trim();

    private final ContentValidator validator = new ContentValidator(new ScraperProperties());

    @Test
    void substantivePageIsAcceptedWithoutReasons() {
        ValidationResult result = validator.score(PageFixtures.page("https://acme.test/about", "About", LONG_TEXT));

        assertEquals(0.7, result.score());
        assertThat(result.flagged()).isFalse();
        assertThat(result.reasons()).isEmpty();
    }

    @Test
    void structuredEntitiesRaiseTheScore() {
        PageEntities entities = new PageEntities(
            null,
            new ContactInfo(List.of("hi@acme.test"), List.of(), List.of()),
            null,
            null,
            null,
            null,
            List.of("https://acme.test/a.png")
        );
        PageRecord page = new PageRecord(
            "https://acme.test/contact",
            "Contact",
            LONG_TEXT,
            null,
            null,
            PageExtraction.of(entities),
            List.of(),
            PageFixtures.FETCHED_AT
        );

        assertEquals(0.786, validator.score(page).score());
    }

    @Test
    void thinPageIsFlaggedWithEveryReason() {
        ValidationResult result = validator.score(PageFixtures.page("https://acme.test/x", null, "Hi"));

        assertThat(result.flagged()).isTrue();
        assertEquals(0.002, result.score());
        assertThat(result.reasons()).containsExactly(
            ContentValidator.REASON_TOO_SHORT,
            ContentValidator.REASON_NO_TITLE,
            ContentValidator.REASON_NO_BLOCKS,
            ContentValidator.REASON_NO_STRUCTURED
        );
    }

    @Test
    void javascriptPlaceholderIsAlwaysFlagged() {
        String content = "You need to enable JavaScript to run this app. " + LONG_TEXT;

        ValidationResult result = validator.score(PageFixtures.page("https://acme.test/app", "App", content));

        assertThat(result.flagged()).isTrue();
        assertThat(result.reasons()).contains(ContentValidator.REASON_JS_PLACEHOLDER);
        assertEquals(0.4, result.score());
    }

    @Test
    void emptyApplicationRootIsFlagged() {
        String html = "<html><head><title>Shop</title></head><body><div id=\"root\"></div>"
            + "<p>" + SENTENCE + "</p></body></html>";

        ValidationResult result = validator.score(PageFixtures.page("https://acme.test/", "Shop", LONG_TEXT, html));

        assertThat(result.flagged()).isTrue();
        assertThat(result.reasons()).contains(ContentValidator.REASON_EMPTY_ROOT);
    }

    @Test
    void scoringIsDeterministic() {
        PageRecord page = PageFixtures.page("https://acme.test/team", "Team", LONG_TEXT.substring(0, 240));

        assertEquals(validator.score(page), validator.score(page));
    }

    @Test
    void validateSkipsNullSlotsAndKeepsOriginalIndices() {
        PageRecord good = PageFixtures.page("https://acme.test/about", "About", LONG_TEXT);
        PageRecord weak = PageFixtures.page("https://acme.test/weak", null, "Loading...");

        ValidationOutcome outcome = validator.validate(Arrays.asList(good, null, weak));

        assertThat(outcome.accepted()).containsExactly(good);
        assertThat(outcome.needsEnhancement()).singleElement().satisfies(candidate -> {
            assertThat(candidate.index()).isEqualTo(2);
            assertThat(candidate.page()).isSameAs(weak);
            assertThat(candidate.reason()).contains(ContentValidator.REASON_JS_PLACEHOLDER);
        });
        assertThat(outcome.results()).hasSize(2);
        assertEquals(0.35, outcome.averageScore());
    }

    @Test
    void emptyInputAveragesToZero() {
        ValidationOutcome outcome = validator.validate(List.of());

        assertThat(outcome.needsEnhancement()).isEmpty();
        assertEquals(0.0, outcome.averageScore());
    }
}
