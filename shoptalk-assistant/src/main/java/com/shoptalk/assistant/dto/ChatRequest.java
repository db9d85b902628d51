package com.shoptalk.assistant.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for chat endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    /**
     * The shopper's chat message.
     */
    @NotBlank
    @Size(max = 2000)
    private String message;

    /**
     * User ID (optional, can also come from the X-User-Id header).
     */
    private String userId;
}
