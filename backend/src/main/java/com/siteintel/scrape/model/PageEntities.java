package com.siteintel.scrape.model;

import java.util.List;

/**
 * Structured entities extracted from a single page.
 */
public record PageEntities(
    BrandAssets brand,
    ContactInfo contact,
    List<SocialLink> socialLinks,
    List<TeamMember> teamMembers,
    List<Product> products,
    List<Testimonial> testimonials,
    List<String> images
) {
    public static final int FIELD_COUNT = 7;

    public PageEntities {
        brand = brand == null ? BrandAssets.empty() : brand;
        contact = contact == null ? ContactInfo.empty() : contact;
        socialLinks = socialLinks == null ? List.of() : List.copyOf(socialLinks);
        teamMembers = teamMembers == null ? List.of() : List.copyOf(teamMembers);
        products = products == null ? List.of() : List.copyOf(products);
        testimonials = testimonials == null ? List.of() : List.copyOf(testimonials);
        images = images == null ? List.of() : List.copyOf(images);
    }

    public static PageEntities empty() {
        return new PageEntities(null, null, null, null, null, null, null);
    }

    public int populatedFieldCount() {
        int count = 0;
        if (!brand.isEmpty()) {
            count++;
        }
        if (!contact.isEmpty()) {
            count++;
        }
        if (!socialLinks.isEmpty()) {
            count++;
        }
        if (!teamMembers.isEmpty()) {
            count++;
        }
        if (!products.isEmpty()) {
            count++;
        }
        if (!testimonials.isEmpty()) {
            count++;
        }
        if (!images.isEmpty()) {
            count++;
        }
        return count;
    }

    public boolean isEmpty() {
        return populatedFieldCount() == 0;
    }
}
