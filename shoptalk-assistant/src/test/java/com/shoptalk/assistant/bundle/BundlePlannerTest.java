package com.shoptalk.assistant.bundle;

import com.shoptalk.assistant.AssistantFixtures;
import com.shoptalk.assistant.config.AssistantProperties;
import com.shoptalk.catalog.model.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BundlePlannerTest {

    private BundlePlanner planner;

    @BeforeEach
    void setUp() {
        planner = new BundlePlanner(AssistantFixtures.searcher(AssistantFixtures.store()),
                new AssistantProperties(), Runnable::run);
    }

    private static BundleRequest template(String name, String budget) {
        BundleTemplates.Template template = BundleTemplates.byName(name).orElseThrow();
        return BundleRequest.builder()
                .templateName(template.name())
                .itemTemplates(template.items())
                .budget(budget != null ? new BigDecimal(budget) : null)
                .build();
    }

    private static String productId(BundleLine line) {
        return line.getProduct().getId();
    }

    @Test
    void missingRequiredItemIsReportedAndOptionalsStillPlanned() {
        BundlePlan plan = planner.plan(template("bird", null));

        assertThat(plan.getUnmetItemTypes()).containsExactly("bird_cage");
        assertThat(plan.getItems()).extracting(BundlePlannerTest::productId)
                .containsExactly("toy-1", "feeder-1", "perch-1");
        assertThat(plan.getItems().get(0).getQuantity()).isEqualTo(2);
        assertThat(plan.getTotalCost()).isEqualByComparingTo("46.35");
        assertThat(plan.isFeasible()).isTrue();
        assertThat(plan.isComplete()).isFalse();
        assertThat(plan.getRemainingBudget()).isNull();
    }

    @Test
    void optionalItemsAreTrimmedToTheBudget() {
        BundlePlan plan = planner.plan(template("bird", "30"));

        assertThat(plan.getItems()).extracting(BundlePlannerTest::productId).containsExactly("toy-1");
        assertThat(plan.getSkippedOptionalItemTypes()).containsExactlyInAnyOrder("feeder", "perch");
        assertThat(plan.getTotalCost()).isEqualByComparingTo("19.90");
        assertThat(plan.getRemainingBudget()).isEqualByComparingTo("10.10");
        assertThat(plan.isUsedFallbackSearch()).isTrue();
    }

    @Test
    void sufficientBudgetCoversEveryRequiredItem() {
        BundlePlan plan = planner.plan(template("home_office", "500"));

        assertThat(plan.getUnmetItemTypes()).isEmpty();
        assertThat(plan.isFeasible()).isTrue();
        assertThat(plan.getTotalCost()).isLessThanOrEqualTo(new BigDecimal("500"));
        assertThat(plan.getItems()).extracting(BundlePlannerTest::productId)
                .containsExactly("desk-1", "chair-2", "lamp-1");
        assertThat(plan.getSkippedOptionalItemTypes()).containsExactlyInAnyOrder("monitor_arm", "filing_cabinet");
        assertThat(plan.getBudgetShortfall()).isEqualByComparingTo("0");
    }

    @Test
    void overBudgetRequiredItemsReportShortfall() {
        BundlePlan plan = planner.plan(template("home_office", "300"));

        assertThat(plan.isFeasible()).isFalse();
        // uncapped chair search prefers the full "office chair" match
        assertThat(plan.getItems()).extracting(BundlePlannerTest::productId).containsExactly("desk-1", "artiss-1");
        assertThat(plan.getTotalCost()).isEqualByComparingTo("418.95");
        assertThat(plan.getBudgetShortfall()).isEqualByComparingTo("118.95");
        assertThat(plan.getRemainingBudget()).isEqualByComparingTo("0");
        assertThat(plan.getSkippedOptionalItemTypes()).contains("desk_lamp");
    }

    @Test
    void cheapestMatchIsFoundBeyondTheTopRanked() {
        List<Product> catalog = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            catalog.add(AssistantFixtures.product("premium-" + i, "Bird Toy Bird Toy Bird Toy Premium",
                    "Bird Supplies", String.valueOf(20 + i)));
        }
        catalog.add(AssistantFixtures.product("rope-1", "Rope Bird Toy With Bells And Chime For Large Parrots",
                "Bird Supplies", "4.00"));
        BundlePlanner crowded = new BundlePlanner(AssistantFixtures.searcher(catalog), new AssistantProperties(), Runnable::run);
        BundleRequest request = BundleRequest.builder()
                .itemTemplate(ItemTemplate.builder().itemType("bird_toy").searchTerm("bird toy").build())
                .build();

        BundlePlan plan = crowded.plan(request);

        assertThat(plan.getUnmetItemTypes()).isEmpty();
        assertThat(plan.getItems()).extracting(BundlePlannerTest::productId).containsExactly("rope-1");
        assertThat(plan.getTotalCost()).isEqualByComparingTo("4.00");
    }

    @Test
    void sameRequestGivesSamePlan() {
        BundleRequest request = template("home_office", "500");

        BundlePlan first = planner.plan(request);
        BundlePlan second = planner.plan(request);

        assertThat(second.getItems()).extracting(BundlePlannerTest::productId)
                .containsExactlyElementsOf(first.getItems().stream().map(BundlePlannerTest::productId).toList());
        assertThat(second.getTotalCost()).isEqualByComparingTo(first.getTotalCost());
    }

    @Test
    void productIsNeverPickedTwice() {
        BundleRequest request = BundleRequest.builder()
                .itemTemplate(ItemTemplate.builder().itemType("chair").searchTerm("chair").category("Chairs").build())
                .itemTemplate(ItemTemplate.builder().itemType("second_chair").searchTerm("chair").category("Chairs").build())
                .build();

        BundlePlan plan = planner.plan(request);

        assertThat(plan.getItems()).extracting(BundlePlannerTest::productId).containsExactly("chair-2", "artiss-1");
    }

    @Test
    void fullTermMatchesBeatNeighbours() {
        Product toy = AssistantFixtures.store().stream().filter(p -> p.getId().equals("toy-1")).findFirst().orElseThrow();

        assertThat(BundlePlanner.coversTerm(toy, "bird toy")).isTrue();
        assertThat(BundlePlanner.coversTerm(toy, "bird perch")).isFalse();
    }
}
