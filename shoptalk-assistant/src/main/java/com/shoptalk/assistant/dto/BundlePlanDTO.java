package com.shoptalk.assistant.dto;

import com.shoptalk.assistant.bundle.BundlePlan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BundlePlanDTO {

    private String templateName;
    private List<BundleItemDTO> items;
    private BigDecimal totalCost;
    private BigDecimal budget;
    private BigDecimal remainingBudget;
    private BigDecimal budgetShortfall;
    private List<String> unmetItemTypes;
    private List<String> skippedOptionalItemTypes;
    private Boolean feasible;
    private Boolean usedFallbackSearch;

    public static BundlePlanDTO fromPlan(BundlePlan plan) {
        return BundlePlanDTO.builder()
                .templateName(plan.getTemplateName())
                .items(plan.getItems().stream().map(BundleItemDTO::fromLine).toList())
                .totalCost(plan.getTotalCost())
                .budget(plan.getBudget())
                .remainingBudget(plan.getRemainingBudget())
                .budgetShortfall(plan.getBudgetShortfall())
                .unmetItemTypes(List.copyOf(plan.getUnmetItemTypes()))
                .skippedOptionalItemTypes(List.copyOf(plan.getSkippedOptionalItemTypes()))
                .feasible(plan.isFeasible())
                .usedFallbackSearch(plan.isUsedFallbackSearch())
                .build();
    }
}
