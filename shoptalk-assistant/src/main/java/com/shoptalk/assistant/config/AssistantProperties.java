package com.shoptalk.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for conversation handling.
 * Maps to shoptalk.assistant.* properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "shoptalk.assistant")
public class AssistantProperties {

    private Vague vague = new Vague();
    private Filters filters = new Filters();
    private Search search = new Search();
    private Clarification clarification = new Clarification();
    private Bundle bundle = new Bundle();
    private Availability availability = new Availability();

    /**
     * Store policy answers keyed by policy type (returns, shipping, payment, warranty).
     */
    private Map<String, String> policies = defaultPolicies();

    @Data
    public static class Vague {
        /** Minimum confidence (0-1) to act on an interpretation instead of asking */
        private double confidenceThreshold = 0.55;
        /** Confidence added when the message also names a concrete product */
        private double groundingBonus = 0.2;
    }

    @Data
    public static class Filters {
        /** Minimum accumulated filter weight before a search is considered specific enough */
        private double minWeight = 1.0;
        /** Weight contributed by each subjective term ("nice", "comfy") */
        private double subjectiveTermWeight = 0.3;
        /** Subjective terms counted at most */
        private int maxSubjectiveTerms = 3;
    }

    @Data
    public static class Search {
        /** Products returned per conversational search */
        private int resultLimit = 5;
    }

    @Data
    public static class Clarification {
        /** Questions asked for one request before searching with what we have */
        private int maxAttempts = 2;
    }

    @Data
    public static class Bundle {
        /** Cheapest matches kept as candidates per item search term */
        private int searchLimit = 10;
        /** Threads used for concurrent candidate searches */
        private int searchThreads = 4;
    }

    @Data
    public static class Availability {
        /** Delivery estimate quoted for in-stock items */
        private String deliveryEstimate = "5-10 business days";
        /** Quantities at or below this are reported as low stock */
        private int lowStockThreshold = 5;
        /** Similar products offered for a referenced one */
        private int similarLimit = 5;
    }

    private static Map<String, String> defaultPolicies() {
        Map<String, String> policies = new LinkedHashMap<>();
        policies.put("returns", "We offer a 30 day return period. Items must be unused and in original packaging. "
                + "Custom-made items, final sale items and mattresses are excluded. "
                + "Refunds go back to the original payment method within 5-10 business days.");
        policies.put("shipping", "Shipping is free on orders over $199. Standard delivery costs $15 and takes "
                + "5-10 business days (metro) or 10-15 (regional). Express delivery is $35 and takes 2-5 business days.");
        policies.put("payment", "We accept Visa, Mastercard, American Express and PayPal. "
                + "You can also pay later with Afterpay or Zip Pay.");
        policies.put("warranty", "Products carry a 12 month warranty covering manufacturing defects and structural "
                + "issues. Normal wear and tear, misuse and accidental damage are not covered.");
        return policies;
    }
}
