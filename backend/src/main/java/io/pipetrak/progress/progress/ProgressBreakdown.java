package io.pipetrak.progress.progress;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of evaluating one item's milestone values against its resolved schedule.
 *
 * @param percentComplete weighted completion, clamped to 0-100
 * @param earnedHours budgeted hours times percent complete
 * @param categoryEarned earned hours per category; reconciles with {@code earnedHours}
 * @param categoryBudget budgeted hours per category (budget times category weight)
 * @param unknownMilestones recorded milestone names with no schedule entry, excluded from sums
 */
public record ProgressBreakdown(
    BigDecimal percentComplete,
    BigDecimal earnedHours,
    CategoryHours categoryEarned,
    CategoryHours categoryBudget,
    List<String> unknownMilestones) {

  public ProgressBreakdown {
    unknownMilestones = List.copyOf(unknownMilestones);
  }
}
