package com.siteintel.scrape.validation;

import com.siteintel.config.ScraperProperties;
import com.siteintel.scrape.model.EnhancementCandidate;
import com.siteintel.scrape.model.PageEntities;
import com.siteintel.scrape.model.PageRecord;
import com.siteintel.scrape.model.StructuredExtraction;
import com.siteintel.scrape.model.ValidationOutcome;
import com.siteintel.scrape.model.ValidationResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scores fetched pages without any I/O and splits them into accepted pages and pages worth re-fetching
 * with a heavier strategy.
 *
 * <p>Score components: content length 0.4, title 0.1, substantive text blocks 0.2, populated entity
 * fields 0.3. A JavaScript placeholder or an empty application root costs 0.3 and always flags the page.
 */
@Component
public class ContentValidator {
    static final String REASON_TOO_SHORT = "content too short";
    static final String REASON_NO_STRUCTURED = "no structured data found";
    static final String REASON_NO_TITLE = "missing page title";
    static final String REASON_NO_BLOCKS = "no substantive text blocks";
    static final String REASON_JS_PLACEHOLDER = "javascript placeholder content";
    static final String REASON_EMPTY_ROOT = "empty application root";

    private static final double LENGTH_WEIGHT = 0.4;
    private static final double TITLE_WEIGHT = 0.1;
    private static final double BLOCK_WEIGHT = 0.2;
    private static final double STRUCTURE_WEIGHT = 0.3;
    private static final double PENALTY = 0.3;
    private static final int MIN_BLOCK_LENGTH = 60;
    private static final int EXPECTED_BLOCKS = 3;
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
    private static final List<String> PLACEHOLDER_PHRASES = List.of(
        "enable javascript",
        "javascript is required",
        "javascript is disabled",
        "requires javascript",
        "please wait while"
    );

    private final ScraperProperties properties;

    public ContentValidator(ScraperProperties properties) {
        this.properties = properties;
    }

    public ValidationOutcome validate(List<PageRecord> pages) {
        List<PageRecord> accepted = new ArrayList<>();
        List<EnhancementCandidate> needsEnhancement = new ArrayList<>();
        List<ValidationResult> results = new ArrayList<>();
        double total = 0.0;
        for (int i = 0; i < pages.size(); i++) {
            PageRecord page = pages.get(i);
            if (page == null) {
                continue;
            }
            ValidationResult result = score(page);
            results.add(result);
            total += result.score();
            if (result.flagged()) {
                needsEnhancement.add(new EnhancementCandidate(i, page, result.reasonText()));
            } else {
                accepted.add(page);
            }
        }
        double average = results.isEmpty() ? 0.0 : round(total / results.size());
        return new ValidationOutcome(accepted, needsEnhancement, results, average);
    }

    public ValidationResult score(PageRecord page) {
        int minLength = properties.getValidation().getMinContentLength();
        String content = page.content() == null ? "" : page.content().trim();
        List<String> reasons = new ArrayList<>();
        boolean fatal = false;

        double score = LENGTH_WEIGHT * Math.min(1.0, (double) content.length() / minLength);
        if (content.length() < minLength) {
            reasons.add(REASON_TOO_SHORT);
        }

        if (page.title() != null && !page.title().isBlank()) {
            score += TITLE_WEIGHT;
        } else {
            reasons.add(REASON_NO_TITLE);
        }

        Document html = page.html() == null || page.html().isBlank() ? null : Jsoup.parse(page.html());
        int blocks = countTextBlocks(html, content);
        score += BLOCK_WEIGHT * Math.min(1.0, (double) blocks / EXPECTED_BLOCKS);
        if (blocks == 0) {
            reasons.add(REASON_NO_BLOCKS);
        }

        int populated = 0;
        if (page.extraction() instanceof StructuredExtraction structured) {
            populated = structured.entities().populatedFieldCount();
        }
        score += STRUCTURE_WEIGHT * ((double) populated / PageEntities.FIELD_COUNT);
        if (populated == 0) {
            reasons.add(REASON_NO_STRUCTURED);
        }

        if (hasPlaceholder(content)) {
            score -= PENALTY;
            fatal = true;
            reasons.add(REASON_JS_PLACEHOLDER);
        }
        if (html != null && hasEmptyAppRoot(html)) {
            score -= PENALTY;
            fatal = true;
            reasons.add(REASON_EMPTY_ROOT);
        }

        score = round(Math.max(0.0, Math.min(1.0, score)));
        boolean flagged = fatal || score < properties.getValidation().getAcceptThreshold();
        return new ValidationResult(page, score, flagged ? reasons : List.of(), flagged);
    }

    private int countTextBlocks(Document html, String content) {
        int blocks = 0;
        if (html != null) {
            for (Element element : html.select("p, li, blockquote, article, h1, h2, h3, td")) {
                if (element.ownText().length() >= MIN_BLOCK_LENGTH) {
                    blocks++;
                }
            }
            return blocks;
        }
        for (String sentence : SENTENCE_BREAK.split(content)) {
            if (sentence.trim().length() >= MIN_BLOCK_LENGTH) {
                blocks++;
            }
        }
        return blocks;
    }

    private boolean hasPlaceholder(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        if (lower.equals("loading") || lower.equals("loading...")) {
            return true;
        }
        for (String phrase : PLACEHOLDER_PHRASES) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    private boolean hasEmptyAppRoot(Document html) {
        for (Element root : html.select("#root, #app, #__next, [ng-app], app-root")) {
            if (root.children().isEmpty() && root.text().isBlank()) {
                return true;
            }
        }
        return false;
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
