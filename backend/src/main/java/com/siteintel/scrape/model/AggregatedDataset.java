package com.siteintel.scrape.model;

import java.util.List;

public record AggregatedDataset(
    BrandAssets brand,
    ContactInfo contact,
    List<SocialLink> socialLinks,
    List<TeamMember> teamMembers,
    List<Product> products,
    List<Testimonial> testimonials,
    List<String> images,
    String brandGuidelinesUrl,
    DatasetMetadata metadata
) {
    public static AggregatedDataset empty() {
        return new AggregatedDataset(
            BrandAssets.empty(),
            ContactInfo.empty(),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            null,
            DatasetMetadata.empty()
        );
    }

    public AggregatedDataset withMetadata(DatasetMetadata newMetadata) {
        return new AggregatedDataset(
            brand,
            contact,
            socialLinks,
            teamMembers,
            products,
            testimonials,
            images,
            brandGuidelinesUrl,
            newMetadata
        );
    }
}
