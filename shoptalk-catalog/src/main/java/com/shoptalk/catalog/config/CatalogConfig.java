package com.shoptalk.catalog.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the product catalog.
 * Maps to shoptalk.catalog.* properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "shoptalk.catalog")
public class CatalogConfig {

    /** Spring resource location of the catalog export (classpath:, file:) */
    private String source = "classpath:catalog/products.json";

    /** Whether to load the catalog when the application is ready */
    private boolean syncOnStartup = true;

    private Search search = new Search();
    private Refresh refresh = new Refresh();

    @Data
    public static class Search {
        /** Results returned when the caller passes no limit */
        private int defaultLimit = 10;
        /** Hard upper bound on results per search */
        private int maxLimit = 50;
        /** Cached search outcomes per catalog generation */
        private int cacheSize = 500;
        /** Score multiplier when the query appears verbatim in the title */
        private double titlePhraseBoost = 1.5;
    }

    @Data
    public static class Refresh {
        /** Whether to periodically re-sync from the source */
        private boolean enabled = false;
        /** Delay between re-syncs in milliseconds */
        private long intervalMs = 3_600_000;
    }
}
