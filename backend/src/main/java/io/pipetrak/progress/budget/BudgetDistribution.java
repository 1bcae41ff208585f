package io.pipetrak.progress.budget;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Outcome of distributing a new budget version across a project's active items. */
public record BudgetDistribution(
    ManhourBudget budget,
    int itemsAllocated,
    BigDecimal totalWeight,
    BigDecimal allocatedHours,
    List<Warning> warnings) {

  public BudgetDistribution {
    warnings = List.copyOf(warnings);
  }

  public record Warning(UUID itemId, Map<String, Object> identityKey, String reason) {}
}
