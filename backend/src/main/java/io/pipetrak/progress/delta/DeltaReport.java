package io.pipetrak.progress.delta;

import io.pipetrak.progress.dimension.DimensionType;
import io.pipetrak.progress.progress.CategoryHours;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Earned hours attributable to events inside [start, end), grouped by one dimension.
 *
 * <p>Budgets count each item once, and only items with at least one in-window event. Signed net
 * changes are reported as computed, so corrections show up as negative deltas. Cached progress
 * with no event history is listed separately and never folded into the totals.
 */
public record DeltaReport(
    UUID projectId,
    DimensionType dimension,
    Instant start,
    Instant end,
    List<Row> rows,
    Row grandTotal,
    CrossCheck crossCheck,
    List<UntrackedItem> untrackedProgress,
    List<UnknownMilestone> unknownMilestones) {

  public DeltaReport {
    rows = List.copyOf(rows);
    untrackedProgress = List.copyOf(untrackedProgress);
    unknownMilestones = List.copyOf(unknownMilestones);
  }

  public record Row(
      UUID dimensionValueId,
      String dimensionName,
      int itemCount,
      BigDecimal budgetedHours,
      CategoryHours categoryBudget,
      CategoryHours earnedDelta,
      BigDecimal earnedDeltaTotal,
      BigDecimal percentDelta) {}

  /**
   * Replay of each fully-logged item up to the window end compared with its cached percent. Items
   * changed at or after the end are skipped, their cache no longer reflects the window end.
   */
  public record CrossCheck(int itemsChecked, int itemsSkipped, List<Discrepancy> discrepancies) {

    public CrossCheck {
      discrepancies = List.copyOf(discrepancies);
    }
  }

  public record Discrepancy(
      UUID itemId, BigDecimal replayedPercent, BigDecimal cachedPercent, BigDecimal difference) {}

  public record UntrackedItem(
      UUID itemId,
      String itemType,
      UUID dimensionValueId,
      BigDecimal cachedPercent,
      BigDecimal cachedEarnedHours) {}

  public record UnknownMilestone(UUID itemId, String milestoneName) {}
}
