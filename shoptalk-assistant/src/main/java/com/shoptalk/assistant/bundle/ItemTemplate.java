package com.shoptalk.assistant.bundle;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * One item type a bundle should contain.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ItemTemplate {

    private final String itemType;

    @Builder.Default
    private final int quantity = 1;

    /** Tried in order; the first term that finds an in-stock product wins */
    @Singular
    private final List<String> searchTerms;

    @Builder.Default
    private final boolean required = true;

    /** Catalog categories this item may come from; empty means the request's allowed categories */
    @Singular
    private final List<String> categories;
}
