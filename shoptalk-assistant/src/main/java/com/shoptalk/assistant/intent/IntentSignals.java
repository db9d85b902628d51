package com.shoptalk.assistant.intent;

/**
 * Everything the intent detector looks at for one message.
 *
 * @param message the message after reference resolution
 * @param referencesResolved whether reference resolution rewrote anything
 * @param resolvedCount how many products the message now refers to
 * @param pendingClarification whether the assistant is waiting on an answer
 * @param hasShownProducts whether the session has results on screen
 * @param hasActiveSearch whether a previous search can be refined
 */
public record IntentSignals(
        String message,
        boolean referencesResolved,
        int resolvedCount,
        boolean pendingClarification,
        boolean hasShownProducts,
        boolean hasActiveSearch) {
}
