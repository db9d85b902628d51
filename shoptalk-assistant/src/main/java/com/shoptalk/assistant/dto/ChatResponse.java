package com.shoptalk.assistant.dto;

import com.shoptalk.catalog.dto.ProductDTO;
import com.shoptalk.common.enums.MessageIntent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for chat endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    /**
     * Session ID for conversation continuity.
     */
    private String sessionId;

    /**
     * Assistant reply text.
     */
    private String message;

    private MessageIntent messageIntent;

    /**
     * Products in display order; "option 1" refers to the first.
     */
    private List<ProductDTO> products;

    private Boolean hasProducts;

    /**
     * Present for multi-item requests.
     */
    private BundlePlanDTO bundlePlan;

    private Boolean clarificationNeeded;

    private String clarificationMessage;

    private Map<String, Object> metadata;

    /**
     * Processing time in milliseconds.
     */
    private Long processingTimeMs;
}
