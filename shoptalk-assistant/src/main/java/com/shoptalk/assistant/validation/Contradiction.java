package com.shoptalk.assistant.validation;

/**
 * Two requirements in one request that no product can satisfy together.
 *
 * @param kind what the terms disagree on: price, size, style or price_range
 */
public record Contradiction(String kind, String first, String second, String message) {}
