package com.shoptalk.assistant.reference;

import com.shoptalk.assistant.AssistantFixtures;
import com.shoptalk.catalog.model.Product;
import com.shoptalk.session.model.SessionState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceResolverTest {

    private final ReferenceResolver resolver = new ReferenceResolver();

    private final List<Product> shown = AssistantFixtures.store().subList(0, 3);

    private final SessionState session = SessionState.builder()
            .sessionId("s-1")
            .lastShownProducts(shown)
            .build();

    @Test
    void numberedOptionBecomesToken() {
        ResolvedReferences resolved = resolver.resolveDetailed(session, "tell me about option 1");

        assertThat(resolved.rewrittenText()).isEqualTo("tell me about [product:artiss-1]");
        assertThat(resolved.products()).extracting(Product::getId).containsExactly("artiss-1");
        assertThat(resolved.unresolvedPhrases()).isEmpty();
    }

    @Test
    void resolvingTwiceChangesNothing() {
        String once = resolver.resolve(session, "compare option 1 and the third one");

        assertThat(once).isEqualTo("compare [product:artiss-1] and [product:desk-1]");
        assertThat(resolver.resolve(session, once)).isEqualTo(once);
    }

    @Test
    void outOfRangeIsLeftAsWritten() {
        ResolvedReferences resolved = resolver.resolveDetailed(session, "what about option 12");

        assertThat(resolved.rewrittenText()).isEqualTo("what about option 12");
        assertThat(resolved.products()).isEmpty();
        assertThat(resolved.unresolvedPhrases()).containsExactly("option 12");
    }

    @Test
    void hugePositionIsUnresolvedNotAnError() {
        ResolvedReferences resolved = resolver.resolveDetailed(session, "tell me about option 99999999999");

        assertThat(resolved.rewrittenText()).isEqualTo("tell me about option 99999999999");
        assertThat(resolved.products()).isEmpty();
        assertThat(resolved.unresolvedPhrases()).containsExactly("option 99999999999");
        assertThat(resolver.resolve(session, "compare 1 and 123456789012")).isEqualTo("compare 1 and 123456789012");
    }

    @Test
    void listsResolveInOrder() {
        assertThat(resolver.resolveDetailed(session, "compare options 3, 1").products())
                .extracting(Product::getId).containsExactly("desk-1", "artiss-1");
        assertThat(resolver.resolveDetailed(session, "compare 1 and 2").products())
                .extracting(Product::getId).containsExactly("artiss-1", "chair-2");
    }

    @Test
    void ordinalsAndLast() {
        assertThat(resolver.resolveDetailed(session, "I like the second chair").products())
                .extracting(Product::getId).containsExactly("chair-2");
        assertThat(resolver.resolveDetailed(session, "show me the last one").products())
                .extracting(Product::getId).containsExactly("desk-1");
    }

    @Test
    void nothingShownLeavesReferencesUnresolved() {
        ResolvedReferences resolved = resolver.resolveDetailed(SessionState.create("s-2", null, null), "option 1");

        assertThat(resolved.rewrittenText()).isEqualTo("option 1");
        assertThat(resolved.unresolvedPhrases()).containsExactly("option 1");
    }

    @Test
    void pricesAreNotPositions() {
        assertThat(resolver.resolve(session, "a desk under $500")).isEqualTo("a desk under $500");
    }
}
