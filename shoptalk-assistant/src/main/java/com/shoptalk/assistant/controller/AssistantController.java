package com.shoptalk.assistant.controller;

import com.shoptalk.assistant.dto.BundlePlanDTO;
import com.shoptalk.assistant.dto.ChatRequest;
import com.shoptalk.assistant.dto.ChatResponse;
import com.shoptalk.assistant.dto.SessionSummaryDTO;
import com.shoptalk.assistant.exception.AssistantException;
import com.shoptalk.assistant.service.ConversationHandler;
import com.shoptalk.assistant.service.ConversationResult;
import com.shoptalk.catalog.dto.ProductDTO;
import com.shoptalk.session.service.SessionStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Shopping assistant chat controller.
 *
 * Flow:
 * 1. Client sends a message via POST /api/chat with an optional X-Session-Id
 * 2. ConversationHandler interprets it against the session and the catalog
 * 3. Products, a bundle or a clarification question are returned with the reply text
 * 4. The client sends X-Session-Id on later turns so "option 2" keeps its meaning
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class AssistantController {

    private final ConversationHandler conversationHandler;
    private final SessionStore sessionStore;

    /**
     * Send a chat message to the assistant.
     *
     * @param request chat request containing the message
     * @param sessionId session ID for conversation continuity; generated when absent
     * @return reply with products, bundle plan or clarification question
     */
    @PostMapping
    public ResponseEntity<ChatResponse> chat(
            @Valid @RequestBody ChatRequest request,
            @RequestHeader(value = "X-Session-Id", required = false) String sessionId,
            @RequestHeader(value = "X-User-Id", required = false) String userIdHeader) {

        String finalSessionId = sessionId != null && !sessionId.isBlank() ? sessionId : UUID.randomUUID().toString();
        String userId = request.getUserId() != null ? request.getUserId() : userIdHeader;

        log.info("Chat request: userId={}, sessionId={}, message={}",
                userId, finalSessionId, truncate(request.getMessage(), 100));

        ConversationResult result = conversationHandler.handle(finalSessionId, userId, request.getMessage());

        Object processingTime = result.getMetadata().get("processing_time_ms");
        ChatResponse response = ChatResponse.builder()
                .sessionId(result.getSessionId())
                .message(result.getMessage())
                .messageIntent(result.getMessageIntent())
                .products(result.getProducts().stream().map(ProductDTO::fromEntity).toList())
                .hasProducts(result.hasProducts())
                .bundlePlan(result.getBundlePlan() != null ? BundlePlanDTO.fromPlan(result.getBundlePlan()) : null)
                .clarificationNeeded(result.isClarificationNeeded())
                .clarificationMessage(result.getClarificationMessage())
                .metadata(result.getMetadata())
                .processingTimeMs(processingTime instanceof Number number ? number.longValue() : null)
                .build();

        log.info("Chat response: sessionId={}, intent={}, productsCount={}, processingTimeMs={}",
                finalSessionId, result.getMessageIntent(), response.getProducts().size(),
                response.getProcessingTimeMs());

        return ResponseEntity.ok(response);
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionSummaryDTO> getSession(@PathVariable String sessionId) {
        return sessionStore.find(sessionId)
                .map(SessionSummaryDTO::fromState)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> AssistantException.sessionNotFound(sessionId));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> deleteSession(@PathVariable String sessionId) {
        if (!sessionStore.delete(sessionId)) {
            throw AssistantException.sessionNotFound(sessionId);
        }
        log.info("Session deleted: sessionId={}", sessionId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Health check endpoint for the assistant.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "ShopTalk Assistant");
        health.put("activeSessions", sessionStore.size());
        health.put("features", Map.of(
                "vagueQueries", true,
                "references", true,
                "clarifications", true,
                "bundles", true
        ));
        return ResponseEntity.ok(health);
    }

    // ==================== Helper Methods ====================

    private String truncate(String str, int maxLength) {
        if (str == null) return null;
        return str.length() > maxLength ? str.substring(0, maxLength) + "..." : str;
    }
}
