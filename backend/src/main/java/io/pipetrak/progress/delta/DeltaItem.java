package io.pipetrak.progress.delta;

import io.pipetrak.progress.milestone.MilestoneEvent;
import io.pipetrak.progress.template.MilestoneSchedule;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * One active item as seen by a delta report.
 *
 * @param dimensionValueId the item's value for the reported dimension; null when unassigned
 * @param windowEvents the item's events inside the window, in log order
 * @param history the item's events strictly before the window end, in log order; only loaded for
 *     items without events at or after the window end, empty otherwise
 * @param eventsAtOrAfterEnd whether the log holds events at or after the window end
 */
public record DeltaItem(
    UUID itemId,
    String itemType,
    UUID dimensionValueId,
    BigDecimal budgetedHours,
    BigDecimal cachedPercent,
    MilestoneSchedule schedule,
    List<MilestoneEvent> windowEvents,
    List<MilestoneEvent> history,
    boolean eventsAtOrAfterEnd) {

  public DeltaItem {
    windowEvents = List.copyOf(windowEvents);
    history = List.copyOf(history);
  }
}
