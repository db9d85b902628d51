package com.shoptalk.assistant.reply;

/**
 * What a reply has to say, decided before any text is written.
 */
public enum ReplyKind {
    GREETING,
    HELP,
    PRODUCTS,
    REFERENCE,
    COMPARISON,
    AVAILABILITY,
    SIMILAR,
    NO_RESULTS,
    NO_ATTRIBUTE_MATCH,
    CATALOG_NOT_READY,
    CLARIFICATION,
    POLICY,
    BUNDLE
}
