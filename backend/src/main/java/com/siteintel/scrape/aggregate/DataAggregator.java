package com.siteintel.scrape.aggregate;

import com.siteintel.config.ScraperProperties;
import com.siteintel.scrape.model.AggregatedDataset;
import com.siteintel.scrape.model.BrandAssets;
import com.siteintel.scrape.model.ContactInfo;
import com.siteintel.scrape.model.DatasetMetadata;
import com.siteintel.scrape.model.PageEntities;
import com.siteintel.scrape.model.PageRecord;
import com.siteintel.scrape.model.Product;
import com.siteintel.scrape.model.SocialLink;
import com.siteintel.scrape.model.TeamMember;
import com.siteintel.scrape.model.Testimonial;
import com.siteintel.scrape.util.UrlNormalizer;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Merges per-page entities into one dataset. First occurrence wins for every dedup key: platform for
 * social links, name for people, products and testimonials, exact value for contact fields and images.
 */
@Component
public class DataAggregator {
    private static final Pattern GUIDELINE_PHRASE = Pattern.compile(
        "(brand|style|design)\\s+(guide|guidelines|manual|standards)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern PDF_HREF = Pattern.compile(
        "href\\s*=\\s*[\"']([^\"']+\\.pdf(?:[?#][^\"']*)?)[\"']",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern BARE_PDF = Pattern.compile("(https?://\\S+?\\.pdf|/\\S+?\\.pdf)", Pattern.CASE_INSENSITIVE);
    private static final int GUIDELINE_WINDOW = 500;

    private final ScraperProperties properties;

    public DataAggregator(ScraperProperties properties) {
        this.properties = properties;
    }

    public AggregatedDataset aggregate(List<PageRecord> pages) {
        List<PageRecord> present = new ArrayList<>();
        for (PageRecord page : pages) {
            if (page != null) {
                present.add(page);
            }
        }
        PageRecord homepage = null;
        for (PageRecord page : present) {
            if (UrlNormalizer.isRoot(page.url())) {
                homepage = page;
                break;
            }
        }
        List<PageRecord> brandOrder = new ArrayList<>();
        if (homepage != null) {
            brandOrder.add(homepage);
        }
        for (PageRecord page : present) {
            if (page != homepage) {
                brandOrder.add(page);
            }
        }

        Set<String> colors = new LinkedHashSet<>();
        Set<String> fonts = new LinkedHashSet<>();
        String logo = null;
        String favicon = null;
        for (PageRecord page : brandOrder) {
            BrandAssets brand = page.entities().brand();
            colors.addAll(brand.colors());
            fonts.addAll(brand.fonts());
            logo = logo != null ? logo : brand.logoUrl();
            favicon = favicon != null ? favicon : brand.faviconUrl();
        }

        Map<String, SocialLink> socialLinks = new LinkedHashMap<>();
        Map<String, TeamMember> team = new LinkedHashMap<>();
        Map<String, Product> products = new LinkedHashMap<>();
        Map<String, Testimonial> testimonials = new LinkedHashMap<>();
        Set<String> emails = new LinkedHashSet<>();
        Set<String> phones = new LinkedHashSet<>();
        Set<String> addresses = new LinkedHashSet<>();
        Set<String> images = new LinkedHashSet<>();
        Set<String> strategies = new LinkedHashSet<>();
        String brandGuidelinesUrl = null;

        for (PageRecord page : present) {
            PageEntities entities = page.entities();
            putAllFirst(socialLinks, entities.socialLinks(), link -> key(link.platform()));
            putAllFirst(team, entities.teamMembers(), member -> key(member.name()));
            putAllFirst(products, entities.products(), product -> key(product.name()));
            putAllFirst(testimonials, entities.testimonials(), testimonial -> key(
                testimonial.author() != null ? testimonial.author() : testimonial.quote()
            ));
            ContactInfo contact = entities.contact();
            emails.addAll(contact.emails());
            phones.addAll(contact.phones());
            addresses.addAll(contact.addresses());
            images.addAll(entities.images());
            if (page.strategy() != null) {
                strategies.add(page.strategy().wireName());
            }
            if (brandGuidelinesUrl == null) {
                brandGuidelinesUrl = findBrandGuidelines(page);
            }
        }

        BrandAssets brand = new BrandAssets(
            logo,
            favicon,
            truncate(colors, properties.getAggregation().getMaxColors()),
            truncate(fonts, properties.getAggregation().getMaxFonts())
        );
        DatasetMetadata metadata = new DatasetMetadata(
            present.size(),
            pages.size(),
            pages.size() - present.size(),
            0,
            0.0,
            strategies.isEmpty() ? null : String.join(",", strategies),
            0L
        );
        return new AggregatedDataset(
            brand,
            new ContactInfo(new ArrayList<>(emails), new ArrayList<>(phones), new ArrayList<>(addresses)),
            new ArrayList<>(socialLinks.values()),
            new ArrayList<>(team.values()),
            new ArrayList<>(products.values()),
            new ArrayList<>(testimonials.values()),
            new ArrayList<>(images),
            brandGuidelinesUrl,
            metadata
        );
    }

    /**
     * Looks for a guideline phrase with a PDF link close by and resolves the link against the page origin.
     */
    static String findBrandGuidelines(PageRecord page) {
        String source = page.html() != null && !page.html().isBlank() ? page.html() : page.content();
        if (source == null || source.isBlank()) {
            return null;
        }
        Matcher phrase = GUIDELINE_PHRASE.matcher(source);
        while (phrase.find()) {
            int from = Math.max(0, phrase.start() - GUIDELINE_WINDOW);
            int to = Math.min(source.length(), phrase.end() + GUIDELINE_WINDOW);
            String window = source.substring(from, to);
            Matcher href = PDF_HREF.matcher(window);
            String pdf = href.find() ? href.group(1) : null;
            if (pdf == null) {
                Matcher bare = BARE_PDF.matcher(window);
                pdf = bare.find() ? bare.group(1) : null;
            }
            if (pdf != null) {
                String resolved = resolveAgainstOrigin(page.url(), pdf.trim());
                if (resolved != null) {
                    return resolved;
                }
            }
        }
        return null;
    }

    private static String resolveAgainstOrigin(String pageUrl, String pdf) {
        if (pdf.startsWith("http://") || pdf.startsWith("https://")) {
            return pdf;
        }
        String origin = UrlNormalizer.origin(pageUrl);
        if (origin == null) {
            return null;
        }
        try {
            return URI.create(origin + "/").resolve(pdf.replace(" ", "%20")).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static <T> void putAllFirst(Map<String, T> target, List<T> values, Function<T, String> keyFn) {
        for (T value : values) {
            String key = keyFn.apply(value);
            if (key != null) {
                target.putIfAbsent(key, value);
            }
        }
    }

    private static String key(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    private static List<String> truncate(Set<String> values, int max) {
        List<String> list = new ArrayList<>(values);
        return list.size() > max ? new ArrayList<>(list.subList(0, max)) : list;
    }
}
