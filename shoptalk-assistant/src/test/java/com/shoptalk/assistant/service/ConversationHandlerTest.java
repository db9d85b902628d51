package com.shoptalk.assistant.service;

import com.shoptalk.assistant.AssistantFixtures;
import com.shoptalk.assistant.bundle.BundlePlanner;
import com.shoptalk.assistant.bundle.BundleRequestParser;
import com.shoptalk.assistant.config.AssistantProperties;
import com.shoptalk.assistant.events.ConversationEvent;
import com.shoptalk.assistant.events.ConversationEventPublisher;
import com.shoptalk.assistant.exception.AssistantException;
import com.shoptalk.assistant.intent.ClarificationMerger;
import com.shoptalk.assistant.intent.IntentDetector;
import com.shoptalk.assistant.lookup.AvailabilityChecker;
import com.shoptalk.assistant.lookup.SimilarProductFinder;
import com.shoptalk.assistant.reference.ReferenceResolver;
import com.shoptalk.assistant.reply.TemplateReplyComposer;
import com.shoptalk.assistant.taxonomy.CategoryIntelligence;
import com.shoptalk.assistant.taxonomy.CategoryTaxonomy;
import com.shoptalk.assistant.validation.FilterValidator;
import com.shoptalk.assistant.vague.VagueQueryInterpreter;
import com.shoptalk.catalog.model.Product;
import com.shoptalk.catalog.service.ProductSearcher;
import com.shoptalk.common.enums.MessageIntent;
import com.shoptalk.session.config.SessionProperties;
import com.shoptalk.session.persistence.InMemorySessionPersistence;
import com.shoptalk.session.service.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ConversationHandlerTest {

    private static final String SESSION = "session-1";

    @Mock
    private ConversationEventPublisher eventPublisher;

    private AssistantProperties properties;
    private SessionStore sessionStore;

    @BeforeEach
    void setUp() {
        properties = new AssistantProperties();
        sessionStore = new SessionStore(new InMemorySessionPersistence(), new SessionProperties());
    }

    private ConversationHandler handler(List<Product> catalog) {
        CategoryTaxonomy categoryTaxonomy = new CategoryTaxonomy();
        CategoryIntelligence categoryIntelligence = new CategoryIntelligence();
        FilterValidator filterValidator = new FilterValidator(properties, categoryTaxonomy);
        ProductSearcher productSearcher = AssistantFixtures.searcher(catalog);
        return new ConversationHandler(
                sessionStore,
                new ReferenceResolver(),
                new IntentDetector(categoryTaxonomy, filterValidator),
                new ClarificationMerger(),
                new VagueQueryInterpreter(categoryIntelligence, properties),
                filterValidator,
                productSearcher,
                new BundleRequestParser(categoryIntelligence),
                new BundlePlanner(productSearcher, properties, Runnable::run),
                new AvailabilityChecker(productSearcher, properties),
                new SimilarProductFinder(productSearcher),
                new TemplateReplyComposer(),
                eventPublisher,
                properties);
    }

    private static List<String> ids(ConversationResult result) {
        return result.getProducts().stream().map(Product::getId).toList();
    }

    @Test
    void clearSearchShowsMatchingProducts() {
        ConversationResult result = handler(AssistantFixtures.store()).handle(SESSION, "user-1", "show me an office chair");

        assertThat(result.getMessageIntent()).isEqualTo(MessageIntent.NEW_SEARCH);
        assertThat(ids(result)).first().isEqualTo("artiss-1");
        assertThat(result.getMessage()).startsWith("Here ");
        assertThat(sessionStore.find(SESSION)).hasValueSatisfying(session -> {
            assertThat(session.getLastShownProducts()).extracting(Product::getId).containsExactlyElementsOf(ids(result));
            assertThat(session.getMessageHistory()).hasSize(2);
        });
    }

    @Test
    void optionReferenceReturnsExactlyThatProduct() {
        ConversationHandler handler = handler(AssistantFixtures.store());
        ConversationResult search = handler.handle(SESSION, null, "show me an office chair");

        ConversationResult result = handler.handle(SESSION, null, "tell me about option 1");

        assertThat(result.getMessageIntent()).isEqualTo(MessageIntent.REFERENCE);
        assertThat(ids(result)).containsExactly("artiss-1");
        assertThat(result.getMessage()).startsWith("Artiss Office Chair");
        // the shown list is unchanged by a reference
        assertThat(sessionStore.find(SESSION).orElseThrow().getLastShownProducts())
                .extracting(Product::getId).containsExactlyElementsOf(ids(search));
    }

    @Test
    void stockQuestionAboutAnOptionReportsAvailability() {
        ConversationHandler handler = handler(AssistantFixtures.store());
        ConversationResult search = handler.handle(SESSION, null, "show me an office chair");

        ConversationResult result = handler.handle(SESSION, null, "is option 1 in stock?");

        assertThat(result.getMessageIntent()).isEqualTo(MessageIntent.REFERENCE);
        assertThat(result.getMetadata()).containsEntry("outcome", "availability");
        assertThat(ids(result)).containsExactly("artiss-1");
        assertThat(result.getMessage()).contains("is in stock, but only 5 left")
                .contains("Estimated delivery: 5-10 business days");
        assertThat(sessionStore.find(SESSION).orElseThrow().getLastShownProducts())
                .extracting(Product::getId).containsExactlyElementsOf(ids(search));
    }

    @Test
    void similarToAnOptionReplacesTheShownList() {
        ConversationHandler handler = handler(AssistantFixtures.store());
        handler.handle(SESSION, null, "show me an office chair");

        ConversationResult result = handler.handle(SESSION, null, "show me more like option 1");

        assertThat(result.getMessageIntent()).isEqualTo(MessageIntent.REFERENCE);
        assertThat(result.getMetadata()).containsEntry("similar_to", "artiss-1").containsEntry("outcome", "similar");
        assertThat(ids(result)).containsExactly("chair-2");
        assertThat(result.getMessage()).startsWith("Here are some options similar to Artiss Office Chair");

        ConversationResult next = handler.handle(SESSION, null, "tell me about option 1");
        assertThat(ids(next)).containsExactly("chair-2");
    }

    @Test
    void unresolvedReferenceIsReported() {
        ConversationHandler handler = handler(AssistantFixtures.store());
        handler.handle(SESSION, null, "show me an office chair");

        ConversationResult result = handler.handle(SESSION, null, "what about option 9");

        assertThat(result.getMetadata()).containsKey("unresolved_references");
        assertThat(result.getMessageIntent()).isNotEqualTo(MessageIntent.REFERENCE);
    }

    @Test
    void categoryOnlyRequestIsClarifiedThenMerged() {
        properties.getFilters().setMinWeight(1.5);
        ConversationHandler handler = handler(AssistantFixtures.store());

        ConversationResult question = handler.handle(SESSION, null, "I need a desk");

        assertThat(question.isClarificationNeeded()).isTrue();
        assertThat(question.getClarificationMessage()).startsWith("What kind of desk");
        assertThat(question.getMetadata()).containsEntry("clarification_type", "category_only");
        assertThat(sessionStore.find(SESSION).orElseThrow().getPendingClarification()).isNotNull();

        ConversationResult answer = handler.handle(SESSION, null, "wooden");

        assertThat(answer.getMessageIntent()).isEqualTo(MessageIntent.CLARIFICATION_ANSWER);
        assertThat(answer.getMetadata()).containsEntry("merged_query", "desk wood");
        assertThat(ids(answer)).first().isEqualTo("desk-1");
        assertThat(ids(answer)).doesNotContain("desk-2");
        assertThat(sessionStore.find(SESSION).orElseThrow().getPendingClarification()).isNull();
    }

    @Test
    void bypassAnswerSearchesWithWhatWeHave() {
        properties.getFilters().setMinWeight(1.5);
        ConversationHandler handler = handler(AssistantFixtures.store());
        handler.handle(SESSION, null, "I need a desk");

        ConversationResult result = handler.handle(SESSION, null, "surprise me");

        assertThat(result.isClarificationNeeded()).isFalse();
        assertThat(ids(result)).contains("desk-1", "desk-2");
    }

    @Test
    void attributeRefinesTheCurrentSearch() {
        ConversationHandler handler = handler(AssistantFixtures.store());
        handler.handle(SESSION, null, "show me an office chair");

        ConversationResult result = handler.handle(SESSION, null, "in black");

        assertThat(result.getMessageIntent()).isEqualTo(MessageIntent.REFINEMENT);
        assertThat(ids(result)).containsExactly("artiss-1");
        assertThat(result.getMetadata()).containsEntry("refined_from", "show me an office chair");
    }

    @Test
    void negatedMaterialRefinementExcludesIt() {
        ConversationHandler handler = handler(AssistantFixtures.store());
        ConversationResult chairs = handler.handle(SESSION, null, "show me chairs");
        assertThat(ids(chairs)).contains("artiss-1", "chair-2");

        ConversationResult result = handler.handle(SESSION, null, "without wood");

        assertThat(result.getMessageIntent()).isEqualTo(MessageIntent.REFINEMENT);
        assertThat(ids(result)).containsExactly("artiss-1");
        assertThat(result.getMetadata()).containsEntry("excluded_terms", List.of("wood"));
        assertThat(sessionStore.find(SESSION).orElseThrow().getAccumulatedFilters())
                .doesNotContainKey("material")
                .containsEntry(ClarificationMerger.EXCLUDED, List.of("wood"));
    }

    @Test
    void newSearchDropsFiltersOfThePreviousOne() {
        ConversationHandler handler = handler(AssistantFixtures.store());
        handler.handle(SESSION, null, "show me a black office chair");
        handler.handle(SESSION, null, "show me a desk");

        assertThat(sessionStore.find(SESSION).orElseThrow().getAccumulatedFilters())
                .doesNotContainKeys("color", "room_type");

        ConversationResult result = handler.handle(SESSION, null, "under 300");

        assertThat(result.getMessageIntent()).isEqualTo(MessageIntent.REFINEMENT);
        assertThat(ids(result)).contains("desk-1").doesNotContain("artiss-1", "desk-2");
    }

    @Test
    void missingColorOffersAvailableOnes() {
        ConversationResult result = handler(AssistantFixtures.store()).handle(SESSION, null, "show me a red office chair");

        assertThat(result.getProducts()).isEmpty();
        assertThat(result.getMessage()).startsWith("I couldn't find that in red.").contains("black");
        assertThat(sessionStore.find(SESSION).orElseThrow().hasShownProducts()).isFalse();
    }

    @Test
    void compareUsesShownProducts() {
        ConversationHandler handler = handler(AssistantFixtures.store());
        ConversationResult search = handler.handle(SESSION, null, "show me an office chair");

        ConversationResult result = handler.handle(SESSION, null, "compare them");

        assertThat(result.getMessageIntent()).isEqualTo(MessageIntent.COMPARISON);
        assertThat(ids(result)).containsExactlyElementsOf(ids(search));
        assertThat(result.getMessage()).startsWith("Comparing");
    }

    @Test
    void starterKitBuildsBundle() {
        ConversationResult result = handler(AssistantFixtures.store()).handle(SESSION, null, "I need a bird starter kit under 30");

        assertThat(result.getBundlePlan()).isNotNull();
        assertThat(result.getBundlePlan().getUnmetItemTypes()).containsExactly("bird_cage");
        assertThat(ids(result)).containsExactly("toy-1");
        assertThat(result.getMetadata()).containsEntry("bundle_template", "bird");
        assertThat(result.getMessage()).contains("I couldn't find: bird cage.");
    }

    @Test
    void complaintAnswersWithReturnsPolicy() {
        ConversationResult result = handler(AssistantFixtures.store()).handle(SESSION, null, "how do i get a refund");

        assertThat(result.getMetadata()).containsEntry("policy_type", "returns");
        assertThat(result.getMessage()).isEqualTo(properties.getPolicies().get("returns"));
    }

    @Test
    void greetingNeedsNoSearch() {
        ConversationResult result = handler(AssistantFixtures.store()).handle(SESSION, null, "hello");

        assertThat(result.getMessageIntent()).isEqualTo(MessageIntent.CHIT_CHAT);
        assertThat(result.getMessage()).startsWith("Hi!");
        assertThat(result.hasProducts()).isFalse();
    }

    @Test
    void emptyCatalogIsReportedNotSearched() {
        ConversationResult result = handler(List.of()).handle(SESSION, null, "show me an office chair");

        assertThat(result.getMessage()).contains("catalog is still loading");
        assertThat(result.hasProducts()).isFalse();
    }

    @Test
    void eachTurnPublishesOneEvent() {
        handler(AssistantFixtures.store()).handle(SESSION, "user-1", "show me an office chair");

        ArgumentCaptor<ConversationEvent> captor = ArgumentCaptor.forClass(ConversationEvent.class);
        verify(eventPublisher).publish(captor.capture());
        assertThat(captor.getValue().getSessionId()).isEqualTo(SESSION);
        assertThat(captor.getValue().getUserId()).isEqualTo("user-1");
        assertThat(captor.getValue().getIntent()).isEqualTo("new_search");
        assertThat(captor.getValue().getReturnedProductIds()).first().isEqualTo("artiss-1");
    }

    @Test
    void publishFailureDoesNotFailTheTurn() {
        doThrow(new IllegalStateException("broker down")).when(eventPublisher).publish(any());

        ConversationResult result = handler(AssistantFixtures.store()).handle(SESSION, null, "show me an office chair");

        assertThat(result.hasProducts()).isTrue();
    }

    @Test
    void blankMessageIsRejected() {
        ConversationHandler handler = handler(AssistantFixtures.store());

        assertThatThrownBy(() -> handler.handle(SESSION, null, "  "))
                .isInstanceOf(AssistantException.class)
                .hasMessageContaining("message must not be empty");
    }
}
