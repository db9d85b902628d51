package com.shoptalk.assistant.intent;

import com.shoptalk.common.enums.MessageIntent;

/**
 * Classified intent, the winning score and the rule that produced it.
 */
public record IntentDetection(MessageIntent intent, double score, String rule) {
}
