package com.shoptalk.catalog.index;

/**
 * How query tokens combine when collecting candidate products.
 */
public enum MatchMode {
    /** Products containing any of the tokens */
    UNION,
    /** Products containing all of the tokens */
    INTERSECTION
}
