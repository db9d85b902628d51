package com.shoptalk.assistant.reply;

import com.google.genai.Client;
import com.google.genai.types.Candidate;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.Part;
import com.shoptalk.assistant.bundle.BundleLine;
import com.shoptalk.catalog.model.Product;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Phrases product replies with Google Gemini via Vertex AI.
 *
 * Only the wording comes from the model: the products, their order and the bundle
 * contents are fixed before this runs. Fixed texts (clarifications, policies, catalog
 * status) and every failure go through {@link TemplateReplyComposer}.
 */
@Slf4j
@Primary
@Component
public class GeminiReplyComposer implements ReplyComposer {

    private static final Set<ReplyKind> GENERATED_KINDS = EnumSet.of(
            ReplyKind.PRODUCTS, ReplyKind.REFERENCE, ReplyKind.COMPARISON, ReplyKind.SIMILAR, ReplyKind.BUNDLE);

    private static final String SYSTEM_PROMPT = """
            You are a friendly shopping assistant for an online furniture, office, pet and fitness store.
            Rewrite the draft reply below in a warm, concise tone (at most 120 words).
            Rules:
            - Mention only the products listed, in the same order and with the same numbers.
            - Never change a price, a quantity or a total.
            - Do not invent products, features, discounts or policies.
            - Keep numbering so the shopper can say "option 2".
            """;

    private final TemplateReplyComposer templateReplyComposer;
    private final Client client;
    private final String modelName;

    public GeminiReplyComposer(
            TemplateReplyComposer templateReplyComposer,
            @Value("${vertex.ai.project-id:}") String projectId,
            @Value("${vertex.ai.location:us-central1}") String location,
            @Value("${vertex.ai.model:gemini-2.0-flash}") String modelName) {
        this.templateReplyComposer = templateReplyComposer;
        this.modelName = modelName;

        // Initialize Vertex AI client
        Client tempClient = null;
        if (projectId != null && !projectId.isBlank()) {
            try {
                tempClient = Client.builder()
                        .project(projectId)
                        .location(location)
                        .vertexAI(true)
                        .build();
                log.info("Initialized Gemini client for Vertex AI: project={}, location={}, model={}",
                        projectId, location, modelName);
            } catch (Exception e) {
                log.error("Failed to initialize Gemini client: {}", e.getMessage());
                tempClient = null;
            }
        } else {
            log.info("Vertex AI not configured, replies use templates. Set vertex.ai.project-id to enable.");
        }
        this.client = tempClient;
    }

    @Override
    public String compose(ReplyContext context) {
        String draft = templateReplyComposer.compose(context);
        if (client == null || !GENERATED_KINDS.contains(context.getKind())) {
            return draft;
        }

        long startTime = System.currentTimeMillis();
        try {
            List<Content> contents = List.of(Content.builder()
                    .role("user")
                    .parts(List.of(Part.builder().text(buildPrompt(context, draft)).build()))
                    .build());

            GenerateContentConfig config = GenerateContentConfig.builder()
                    .systemInstruction(Content.builder()
                            .parts(List.of(Part.builder().text(SYSTEM_PROMPT).build()))
                            .build())
                    .temperature(0.3f)
                    .build();

            GenerateContentResponse response = client.models.generateContent(modelName, contents, config);
            Optional<String> text = extractTextResponse(response);
            log.info("Gemini reply composed: kind={}, generated={}, timeMs={}",
                    context.getKind(), text.isPresent(), System.currentTimeMillis() - startTime);
            return text.orElse(draft);
        } catch (Exception e) {
            log.error("Error calling Gemini, using template reply: {}", e.getMessage());
            return draft;
        }
    }

    // ==================== Helper Methods ====================

    private String buildPrompt(ReplyContext context, String draft) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Shopper said: ").append(context.getUserMessage()).append("\n\n");
        if (context.getBundlePlan() != null) {
            prompt.append("Bundle items:\n");
            for (BundleLine line : context.getBundlePlan().getItems()) {
                prompt.append("- ").append(line.getProduct().getTitle())
                        .append(" x").append(line.getQuantity())
                        .append(" = ").append(TemplateReplyComposer.price(line.getLineTotal())).append('\n');
            }
        } else {
            prompt.append("Products:\n");
            List<Product> products = context.getProducts();
            for (int i = 0; i < products.size(); i++) {
                Product product = products.get(i);
                prompt.append(i + 1).append(". ").append(product.getTitle())
                        .append(" | ").append(TemplateReplyComposer.price(product.priceOrZero()))
                        .append(" | ").append(product.getSubcategory() != null ? product.getSubcategory() : product.getCategory())
                        .append('\n');
            }
        }
        prompt.append("\nDraft reply:\n").append(draft);
        return prompt.toString();
    }

    private Optional<String> extractTextResponse(GenerateContentResponse response) {
        Optional<List<Candidate>> candidatesOpt = response.candidates();
        if (candidatesOpt.isEmpty() || candidatesOpt.get().isEmpty()) {
            return Optional.empty();
        }
        Optional<Content> contentOpt = candidatesOpt.get().get(0).content();
        if (contentOpt.isEmpty()) {
            return Optional.empty();
        }
        Optional<List<Part>> partsOpt = contentOpt.get().parts();
        if (partsOpt.isPresent()) {
            for (Part part : partsOpt.get()) {
                Optional<String> textOpt = part.text();
                if (textOpt.isPresent() && !textOpt.get().isBlank()) {
                    return Optional.of(textOpt.get().trim());
                }
            }
        }
        return Optional.empty();
    }
}
