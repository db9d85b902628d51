package com.shoptalk.assistant.reply;

import com.shoptalk.assistant.AssistantFixtures;
import com.shoptalk.assistant.lookup.ProductAvailability;
import com.shoptalk.catalog.model.Product;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateReplyComposerTest {

    private final TemplateReplyComposer composer = new TemplateReplyComposer();

    private final List<Product> store = AssistantFixtures.store();

    @Test
    void productsAreNumberedInOrder() {
        String reply = composer.compose(ReplyContext.builder()
                .kind(ReplyKind.PRODUCTS)
                .product(store.get(0))
                .product(store.get(1))
                .build());

        assertThat(reply).isEqualTo("Here are 2 options I found:\n"
                + "1. Artiss Office Chair Gaming Computer Mesh Chairs Executive Seat - $129.95\n"
                + "2. Wooden Dining Chair Set of 2 - $89.00");
    }

    @Test
    void comparisonNamesTheCheapest() {
        String reply = composer.compose(ReplyContext.builder()
                .kind(ReplyKind.COMPARISON)
                .products(store.subList(0, 2))
                .build());

        assertThat(reply).startsWith("Comparing 2 products:")
                .endsWith("The most affordable is Wooden Dining Chair Set of 2.");
    }

    @Test
    void missingAttributeListsAlternatives() {
        String reply = composer.compose(ReplyContext.builder()
                .kind(ReplyKind.NO_ATTRIBUTE_MATCH)
                .attribute("color")
                .requestedValue("red")
                .availableValue("black")
                .availableValue("brown")
                .build());

        assertThat(reply).isEqualTo("I couldn't find that in red. It is available in black, brown. Would any of those work?");
    }

    @Test
    void unresolvedReferencesArePrefixedToNoResults() {
        String reply = composer.compose(ReplyContext.builder()
                .kind(ReplyKind.NO_RESULTS)
                .query("option 9")
                .unresolvedReference("option 9")
                .build());

        assertThat(reply).startsWith("I couldn't match \"option 9\" to the products I showed");
    }

    @Test
    void fixedTexts() {
        assertThat(composer.compose(ReplyContext.builder().kind(ReplyKind.CATALOG_NOT_READY).build()))
                .isEqualTo(TemplateReplyComposer.CATALOG_NOT_READY);
        assertThat(composer.compose(ReplyContext.builder().kind(ReplyKind.POLICY).policyText("30 days").build()))
                .isEqualTo("30 days");
        assertThat(TemplateReplyComposer.price(new java.math.BigDecimal("5"))).isEqualTo("$5.00");
    }

    @Test
    void stockLinesCoverEveryStatus() {
        String reply = composer.compose(ReplyContext.builder()
                .kind(ReplyKind.AVAILABILITY)
                .productAvailability(new ProductAvailability(store.get(0), true, true, 3, true, "5-10 business days"))
                .productAvailability(new ProductAvailability(store.get(1), true, true, 40, false, "5-10 business days"))
                .productAvailability(new ProductAvailability(store.get(2), true, false, 0, false, null))
                .productAvailability(new ProductAvailability(store.get(3), false, false, 0, false, null))
                .build());

        assertThat(reply).isEqualTo("Here is what we have in stock:\n"
                + "- Artiss Office Chair Gaming Computer Mesh Chairs Executive Seat is in stock, but only 3 left. "
                + "Estimated delivery: 5-10 business days.\n"
                + "- Wooden Dining Chair Set of 2 is in stock (40 available). Estimated delivery: 5-10 business days.\n"
                + "- Oak Wooden Computer Desk is currently out of stock.\n"
                + "- Standing Desk Sit Stand Steel Frame is no longer in our catalog.");
    }

    @Test
    void similarRepliesNameTheSource() {
        String reply = composer.compose(ReplyContext.builder()
                .kind(ReplyKind.SIMILAR)
                .similarTo(store.get(7))
                .product(store.get(8))
                .build());

        assertThat(reply).isEqualTo("Here are some options similar to Bird Toy Swing with Bells:\n"
                + "1. Parrot Toy Foraging Ball - $12.00");
    }

    @Test
    void unconfiguredGeminiFallsBackToTemplates() {
        GeminiReplyComposer gemini = new GeminiReplyComposer(composer, "", "us-central1", "gemini-2.0-flash");
        ReplyContext context = ReplyContext.builder().kind(ReplyKind.PRODUCTS).product(store.get(2)).build();

        assertThat(gemini.compose(context)).isEqualTo(composer.compose(context));
    }
}
