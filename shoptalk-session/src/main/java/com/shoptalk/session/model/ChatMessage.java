package com.shoptalk.session.model;

import com.shoptalk.common.enums.MessageRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    private MessageRole role;
    private String content;
    private Instant timestamp;

    /**
     * Arrival sequence of the turn that produced this message.
     */
    private long sequence;
}
