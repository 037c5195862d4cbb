package com.siteintel.scrape.strategy;

import com.siteintel.scrape.model.SiteMetadata;
import com.siteintel.scrape.model.StrategyKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Maps detected site technology to a fetch strategy. Unknown or missing technology gets the
 * dynamic strategy.
 */
@Component
public class StrategySelector {
    private static final List<String> STATIC_TECHNOLOGIES = List.of(
        "wordpress",
        "jekyll",
        "hugo",
        "drupal",
        "joomla",
        "gatsby",
        "next.js",
        "nextjs",
        "woocommerce",
        "squarespace",
        "webflow"
    );
    private static final List<String> SPA_TECHNOLOGIES = List.of("react", "vue", "vue.js", "angular");

    public StrategyKind select(SiteMetadata metadata) {
        if (metadata == null || !metadata.hasTechnology()) {
            return StrategyKind.DYNAMIC;
        }
        String technology = metadata.technology().trim().toLowerCase(Locale.ROOT);
        if (STATIC_TECHNOLOGIES.contains(technology)) {
            return StrategyKind.STATIC;
        }
        if (SPA_TECHNOLOGIES.contains(technology)) {
            return StrategyKind.SPA;
        }
        return StrategyKind.DYNAMIC;
    }
}
