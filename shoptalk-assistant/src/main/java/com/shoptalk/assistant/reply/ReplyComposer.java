package com.shoptalk.assistant.reply;

/**
 * Writes the assistant's message for a turn. The text is for the shopper only;
 * nothing downstream reads it back.
 */
public interface ReplyComposer {

    String compose(ReplyContext context);
}
