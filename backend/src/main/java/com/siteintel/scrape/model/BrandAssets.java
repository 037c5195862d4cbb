package com.siteintel.scrape.model;

import java.util.List;

public record BrandAssets(
    String logoUrl,
    String faviconUrl,
    List<String> colors,
    List<String> fonts
) {
    public BrandAssets {
        colors = colors == null ? List.of() : List.copyOf(colors);
        fonts = fonts == null ? List.of() : List.copyOf(fonts);
    }

    public static BrandAssets empty() {
        return new BrandAssets(null, null, List.of(), List.of());
    }

    public boolean isEmpty() {
        return logoUrl == null && faviconUrl == null && colors.isEmpty() && fonts.isEmpty();
    }
}
