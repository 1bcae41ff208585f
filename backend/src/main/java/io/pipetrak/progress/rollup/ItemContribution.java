package io.pipetrak.progress.rollup;

import io.pipetrak.progress.dimension.DimensionType;
import io.pipetrak.progress.progress.CategoryHours;
import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * What one active item adds to the rollup rows of its dimension values. Missing dimension keys mean
 * the item falls into the unassigned row.
 */
public record ItemContribution(
    UUID projectId,
    Map<DimensionType, UUID> dimensionValues,
    BigDecimal budgetedHours,
    BigDecimal earnedHours,
    CategoryHours categoryBudget,
    CategoryHours categoryEarned) {

  public UUID valueFor(DimensionType dimension) {
    return dimensionValues.get(dimension);
  }
}
