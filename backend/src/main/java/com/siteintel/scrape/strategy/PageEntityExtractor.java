package com.siteintel.scrape.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteintel.scrape.model.BrandAssets;
import com.siteintel.scrape.model.ContactInfo;
import com.siteintel.scrape.model.PageEntities;
import com.siteintel.scrape.model.Product;
import com.siteintel.scrape.model.SocialLink;
import com.siteintel.scrape.model.TeamMember;
import com.siteintel.scrape.model.Testimonial;
import com.siteintel.scrape.util.UrlNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls brand, contact, social, team, product, testimonial and image data out of a parsed page.
 * JSON-LD is read first; markup conventions fill in what it leaves out.
 */
@Component
public class PageEntityExtractor {
    private static final Logger log = LoggerFactory.getLogger(PageEntityExtractor.class);
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern HEX_COLOR = Pattern.compile("#(?:[0-9a-fA-F]{6}|[0-9a-fA-F]{3})\\b");
    private static final Pattern FONT_FAMILY = Pattern.compile("font-family\\s*:\\s*([^;}{]+)", Pattern.CASE_INSENSITIVE);
    private static final Set<String> GENERIC_FONTS = Set.of(
        "serif", "sans-serif", "monospace", "cursive", "fantasy", "system-ui", "inherit", "initial", "unset",
        "-apple-system", "blinkmacsystemfont", "ui-sans-serif", "ui-serif", "ui-monospace"
    );
    private static final int MAX_IMAGES = 50;

    private final ObjectMapper objectMapper;

    public PageEntityExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PageEntities extract(Document document, String pageUrl) {
        List<JsonNode> jsonLd = readJsonLd(document);

        Map<String, SocialLink> socialLinks = new LinkedHashMap<>();
        Set<String> emails = new LinkedHashSet<>();
        Set<String> phones = new LinkedHashSet<>();
        Set<String> addresses = new LinkedHashSet<>();
        List<TeamMember> team = new ArrayList<>();
        List<Product> products = new ArrayList<>();
        List<Testimonial> testimonials = new ArrayList<>();
        String logo = null;

        for (JsonNode node : jsonLd) {
            String type = typeOf(node);
            switch (type) {
                case "organization", "corporation", "localbusiness" -> {
                    logo = logo != null ? logo : imageValue(node.get("logo"));
                    addIfPresent(emails, cleanEmail(text(node, "email")));
                    addIfPresent(phones, text(node, "telephone"));
                    addIfPresent(addresses, formatAddress(node.get("address")));
                    JsonNode sameAs = node.get("sameAs");
                    if (sameAs != null && sameAs.isArray()) {
                        for (JsonNode link : sameAs) {
                            addSocial(socialLinks, link.asText(null));
                        }
                    } else if (sameAs != null && sameAs.isTextual()) {
                        addSocial(socialLinks, sameAs.asText());
                    }
                }
                case "person" -> {
                    String name = text(node, "name");
                    if (name != null) {
                        team.add(new TeamMember(name, text(node, "jobTitle"), imageValue(node.get("image"))));
                    }
                }
                case "product" -> {
                    String name = text(node, "name");
                    if (name != null) {
                        products.add(new Product(name, text(node, "description"), price(node.get("offers")), text(node, "url")));
                    }
                }
                case "review" -> {
                    String quote = text(node, "reviewBody");
                    if (quote != null) {
                        testimonials.add(new Testimonial(authorName(node.get("author")), quote, rating(node.get("reviewRating"))));
                    }
                }
                case "postaladdress" -> addIfPresent(addresses, formatAddress(node));
                default -> {
                }
            }
        }

        for (Element link : document.select("a[href]")) {
            String href = absolute(link, "href");
            String raw = link.attr("href").trim();
            String lowerRaw = raw.toLowerCase(Locale.ROOT);
            if (lowerRaw.startsWith("mailto:")) {
                addIfPresent(emails, cleanEmail(raw.substring("mailto:".length())));
            } else if (lowerRaw.startsWith("tel:")) {
                addIfPresent(phones, raw.substring("tel:".length()).trim());
            } else {
                addSocial(socialLinks, href);
            }
        }
        Matcher emailMatcher = EMAIL.matcher(document.text());
        while (emailMatcher.find()) {
            addIfPresent(emails, cleanEmail(emailMatcher.group()));
        }

        collectMarkupTestimonials(document, testimonials);

        BrandAssets brand = new BrandAssets(
            logo != null ? logo : markupLogo(document),
            favicon(document),
            colors(document),
            fonts(document)
        );
        return new PageEntities(
            brand,
            new ContactInfo(new ArrayList<>(emails), new ArrayList<>(phones), new ArrayList<>(addresses)),
            new ArrayList<>(socialLinks.values()),
            team,
            products,
            testimonials,
            images(document)
        );
    }

    private List<JsonNode> readJsonLd(Document document) {
        List<JsonNode> nodes = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                collectTypedNodes(objectMapper.readTree(payload), nodes);
            } catch (JsonProcessingException e) {
                log.debug("skipping malformed json-ld block: {}", e.getOriginalMessage());
            }
        }
        return nodes;
    }

    private void collectTypedNodes(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectTypedNodes(child, out);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        if (node.has("@type")) {
            out.add(node);
        }
        node.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (!entry.getKey().equals("address") && (value.isArray() || value.isObject())) {
                collectTypedNodes(value, out);
            }
        });
    }

    private String typeOf(JsonNode node) {
        JsonNode type = node.get("@type");
        if (type == null) {
            return "";
        }
        if (type.isArray()) {
            return type.isEmpty() ? "" : type.get(0).asText("").toLowerCase(Locale.ROOT);
        }
        return type.asText("").toLowerCase(Locale.ROOT);
    }

    private void addSocial(Map<String, SocialLink> socialLinks, String url) {
        if (url == null || url.isBlank()) {
            return;
        }
        String platform = UrlNormalizer.socialPlatform(url);
        if (platform != null) {
            socialLinks.putIfAbsent(platform, new SocialLink(platform, url.trim()));
        }
    }

    private void collectMarkupTestimonials(Document document, List<Testimonial> testimonials) {
        for (Element block : document.select("[class*=testimonial]")) {
            if (block.select("[class*=testimonial]").size() > 1) {
                continue;
            }
            Element quoteElement = block.selectFirst("blockquote, q, p");
            Element authorElement = block.selectFirst("cite, [class*=author], [class*=name]");
            if (quoteElement == null || authorElement == null) {
                continue;
            }
            String quote = quoteElement.text().trim();
            String author = authorElement.text().trim();
            if (!quote.isEmpty() && !author.isEmpty()) {
                testimonials.add(new Testimonial(author, quote, null));
            }
        }
    }

    private String markupLogo(Document document) {
        for (Element img : document.select("img[src]")) {
            String marker = (img.className() + " " + img.id() + " " + img.attr("alt")).toLowerCase(Locale.ROOT);
            if (marker.contains("logo")) {
                return absolute(img, "src");
            }
        }
        Element ogLogo = document.selectFirst("meta[property=og:logo]");
        return ogLogo == null ? null : blankToNull(ogLogo.attr("content"));
    }

    private String favicon(Document document) {
        Element icon = document.selectFirst("link[rel~=(?i)icon]");
        return icon == null ? null : absolute(icon, "href");
    }

    private List<String> colors(Document document) {
        Set<String> colors = new LinkedHashSet<>();
        for (Element meta : document.select("meta[name=theme-color], meta[name=msapplication-TileColor]")) {
            String value = meta.attr("content").trim().toLowerCase(Locale.ROOT);
            if (HEX_COLOR.matcher(value).matches()) {
                colors.add(value);
            }
        }
        for (String css : styleSources(document)) {
            Matcher matcher = HEX_COLOR.matcher(css);
            while (matcher.find()) {
                colors.add(matcher.group().toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(colors);
    }

    private List<String> fonts(Document document) {
        Set<String> fonts = new LinkedHashSet<>();
        for (String css : styleSources(document)) {
            Matcher matcher = FONT_FAMILY.matcher(css);
            while (matcher.find()) {
                for (String family : matcher.group(1).split(",")) {
                    String cleaned = family.replace("\"", "").replace("'", "").replace("!important", "").trim();
                    if (!cleaned.isEmpty() && !GENERIC_FONTS.contains(cleaned.toLowerCase(Locale.ROOT))) {
                        fonts.add(cleaned);
                        break;
                    }
                }
            }
        }
        return new ArrayList<>(fonts);
    }

    private List<String> styleSources(Document document) {
        List<String> sources = new ArrayList<>();
        for (Element style : document.select("style")) {
            sources.add(style.data());
        }
        for (Element styled : document.select("[style]")) {
            sources.add(styled.attr("style"));
        }
        return sources;
    }

    private List<String> images(Document document) {
        Set<String> images = new LinkedHashSet<>();
        for (Element img : document.select("img[src]")) {
            String src = absolute(img, "src");
            if (src != null && !src.startsWith("data:")) {
                images.add(src);
            }
            if (images.size() >= MAX_IMAGES) {
                break;
            }
        }
        return new ArrayList<>(images);
    }

    private String absolute(Element element, String attribute) {
        String value = element.attr("abs:" + attribute);
        if (value.isBlank()) {
            value = element.attr(attribute);
        }
        return blankToNull(value);
    }

    private String formatAddress(JsonNode address) {
        if (address == null || address.isNull()) {
            return null;
        }
        if (address.isTextual()) {
            return blankToNull(address.asText());
        }
        if (address.isArray()) {
            return address.isEmpty() ? null : formatAddress(address.get(0));
        }
        List<String> parts = new ArrayList<>();
        for (String field : List.of("streetAddress", "addressLocality", "addressRegion", "postalCode", "addressCountry")) {
            JsonNode value = address.get(field);
            if (value != null && value.isObject()) {
                addIfPresent(parts, text(value, "name"));
            } else {
                addIfPresent(parts, text(address, field));
            }
        }
        return parts.isEmpty() ? null : String.join(", ", parts);
    }

    private String price(JsonNode offers) {
        if (offers == null || offers.isNull()) {
            return null;
        }
        JsonNode offer = offers.isArray() ? (offers.isEmpty() ? null : offers.get(0)) : offers;
        if (offer == null) {
            return null;
        }
        String amount = text(offer, "price");
        if (amount == null) {
            amount = text(offer, "lowPrice");
        }
        if (amount == null) {
            return null;
        }
        String currency = text(offer, "priceCurrency");
        return currency == null ? amount : amount + " " + currency;
    }

    private Double rating(JsonNode reviewRating) {
        if (reviewRating == null || reviewRating.isNull()) {
            return null;
        }
        JsonNode value = reviewRating.isObject() ? reviewRating.get("ratingValue") : reviewRating;
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return Double.parseDouble(value.asText());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String authorName(JsonNode author) {
        if (author == null || author.isNull()) {
            return null;
        }
        if (author.isTextual()) {
            return blankToNull(author.asText());
        }
        if (author.isArray()) {
            return author.isEmpty() ? null : authorName(author.get(0));
        }
        return text(author, "name");
    }

    private String imageValue(JsonNode image) {
        if (image == null || image.isNull()) {
            return null;
        }
        if (image.isTextual()) {
            return blankToNull(image.asText());
        }
        if (image.isArray()) {
            return image.isEmpty() ? null : imageValue(image.get(0));
        }
        return text(image, "url");
    }

    private String cleanEmail(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        int query = value.indexOf('?');
        if (query >= 0) {
            value = value.substring(0, query);
        }
        value = value.toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(value).matches() || UrlNormalizer.hasBinaryExtension("https://host/" + value)) {
            return null;
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return blankToNull(value.asText());
    }

    private static void addIfPresent(Collection<String> target, String value) {
        if (value != null && !value.isBlank()) {
            target.add(value.trim());
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
