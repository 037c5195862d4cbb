package com.siteintel.scrape.strategy;

import com.siteintel.scrape.model.SiteMetadata;

@FunctionalInterface
public interface SiteAnalyzer {

    SiteMetadata analyze(String homepageUrl);
}
