package io.pipetrak.progress.delta;

import io.pipetrak.progress.config.ProgressProperties;
import io.pipetrak.progress.dimension.DimensionType;
import io.pipetrak.progress.exception.InvalidStateException;
import io.pipetrak.progress.milestone.MilestoneEvent;
import io.pipetrak.progress.milestone.MilestoneReplay;
import io.pipetrak.progress.progress.CategoryHours;
import io.pipetrak.progress.progress.ProgressCalculator;
import io.pipetrak.progress.template.MilestoneCategory;
import io.pipetrak.progress.template.ResolvedMilestone;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconstructs a window's earned hours from the milestone log alone. Reads nothing but its
 * arguments; the cached item state only feeds the cross-check and the untracked-progress list.
 */
@Component
public class DeltaAggregator {

  private static final Logger log = LoggerFactory.getLogger(DeltaAggregator.class);

  public static final String UNASSIGNED = "Unassigned";
  public static final String TOTAL = "Total";

  private static final int SCALE = ProgressCalculator.HOURS_SCALE;
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final ProgressCalculator progressCalculator;
  private final BigDecimal percentTolerance;

  public DeltaAggregator(ProgressCalculator progressCalculator, ProgressProperties properties) {
    this.progressCalculator = progressCalculator;
    this.percentTolerance = properties.weightTolerance();
  }

  public DeltaReport aggregate(
      UUID projectId,
      DimensionType dimension,
      Instant start,
      Instant end,
      List<DeltaItem> items,
      Map<UUID, String> dimensionNames) {
    if (start == null || end == null || !start.isBefore(end)) {
      throw new InvalidStateException("Invalid window", "Window start must be before window end");
    }

    var groups = new LinkedHashMap<UUID, RowAccumulator>();
    var total = new RowAccumulator();
    var discrepancies = new ArrayList<DeltaReport.Discrepancy>();
    var untracked = new ArrayList<DeltaReport.UntrackedItem>();
    var unknown = new ArrayList<DeltaReport.UnknownMilestone>();
    int checked = 0;
    int skipped = 0;

    for (var item : items) {
      var windowEvents = item.windowEvents();

      if (!item.eventsAtOrAfterEnd() && item.history().isEmpty()) {
        if (item.cachedPercent().signum() > 0) {
          untracked.add(
              new DeltaReport.UntrackedItem(
                  item.itemId(),
                  item.itemType(),
                  item.dimensionValueId(),
                  item.cachedPercent(),
                  progressCalculator.earnedHours(item.budgetedHours(), item.cachedPercent())));
        }
        continue;
      }

      if (item.eventsAtOrAfterEnd()) {
        skipped++;
      } else {
        checked++;
        crossCheck(item).ifPresent(discrepancies::add);
      }

      if (windowEvents.isEmpty()) {
        continue;
      }

      var hours = new EnumMap<MilestoneCategory, BigDecimal>(MilestoneCategory.class);
      for (var entry : groupByMilestone(windowEvents).entrySet()) {
        var events = entry.getValue();
        String name = events.get(0).getMilestoneName();
        var milestone = item.schedule().find(name);
        if (milestone.isEmpty()) {
          unknown.add(new DeltaReport.UnknownMilestone(item.itemId(), name));
          continue;
        }
        hours.merge(
            milestone.get().category(),
            netHours(milestone.get(), events, item.budgetedHours()),
            BigDecimal::add);
      }

      var earned = CategoryHours.of(hours);
      var budget = progressCalculator.categoryBudgetHours(item.schedule(), item.budgetedHours());
      groups
          .computeIfAbsent(item.dimensionValueId(), k -> new RowAccumulator())
          .add(item.budgetedHours(), budget, earned);
      total.add(item.budgetedHours(), budget, earned);
    }

    if (!unknown.isEmpty()) {
      log.warn(
          "Delta for project {} excluded {} unknown milestones", projectId, unknown.size());
    }
    if (!untracked.isEmpty()) {
      log.warn(
          "Delta for project {} found {} items with progress but no event history",
          projectId,
          untracked.size());
    }

    var rows = new ArrayList<DeltaReport.Row>();
    groups.forEach(
        (valueId, acc) -> {
          String name =
              valueId == null
                  ? UNASSIGNED
                  : dimensionNames.getOrDefault(valueId, valueId.toString());
          rows.add(acc.toRow(valueId, name));
        });
    rows.sort(
        Comparator.comparing((DeltaReport.Row r) -> r.dimensionValueId() == null)
            .thenComparing(DeltaReport.Row::dimensionName, String.CASE_INSENSITIVE_ORDER));

    return new DeltaReport(
        projectId,
        dimension,
        start,
        end,
        rows,
        total.toRow(null, TOTAL),
        new DeltaReport.CrossCheck(checked, skipped, discrepancies),
        untracked,
        unknown);
  }

  /**
   * Hours between the value before the first in-window event and the value after the last one. A
   * first event with no previous value starts from zero.
   */
  static BigDecimal netHours(
      ResolvedMilestone milestone, List<MilestoneEvent> events, BigDecimal budgetedHours) {
    var first = events.get(0);
    var last = events.get(events.size() - 1);
    BigDecimal startValue =
        first.getPreviousValue() != null ? first.getPreviousValue() : BigDecimal.ZERO;
    BigDecimal endValue = last.getNewValue();
    BigDecimal points =
        ProgressCalculator.contribution(milestone, endValue)
            .subtract(ProgressCalculator.contribution(milestone, startValue));
    return budgetedHours.multiply(points).movePointLeft(2);
  }

  private Optional<DeltaReport.Discrepancy> crossCheck(DeltaItem item) {
    var replayed = MilestoneReplay.replay(item.history());
    var replayedPercent = progressCalculator.percentComplete(item.schedule(), replayed);
    var difference = replayedPercent.subtract(item.cachedPercent());
    if (difference.abs().compareTo(percentTolerance) <= 0) {
      return Optional.empty();
    }
    log.warn(
        "Cross-check mismatch for item {}: log replays to {}%, cache holds {}%",
        item.itemId(),
        replayedPercent,
        item.cachedPercent());
    return Optional.of(
        new DeltaReport.Discrepancy(
            item.itemId(), replayedPercent, item.cachedPercent(), difference));
  }

  private static Map<String, List<MilestoneEvent>> groupByMilestone(List<MilestoneEvent> events) {
    var groups = new LinkedHashMap<String, List<MilestoneEvent>>();
    for (var event : events) {
      groups
          .computeIfAbsent(
              event.getMilestoneName().toLowerCase(Locale.ROOT), k -> new ArrayList<>())
          .add(event);
    }
    return groups;
  }

  private static final class RowAccumulator {

    private int itemCount;
    private BigDecimal budgetedHours = BigDecimal.ZERO;
    private CategoryHours categoryBudget = CategoryHours.ZERO;
    private CategoryHours earned = CategoryHours.ZERO;

    void add(BigDecimal budget, CategoryHours budgetByCategory, CategoryHours earnedDelta) {
      itemCount++;
      budgetedHours = budgetedHours.add(budget);
      categoryBudget = categoryBudget.plus(budgetByCategory);
      earned = earned.plus(earnedDelta);
    }

    DeltaReport.Row toRow(UUID valueId, String name) {
      var roundedEarned = earned.rounded(SCALE);
      var earnedTotal = roundedEarned.total();
      BigDecimal percent =
          budgetedHours.signum() == 0
              ? BigDecimal.ZERO.setScale(2)
              : earnedTotal.multiply(HUNDRED).divide(budgetedHours, 2, RoundingMode.HALF_UP);
      return new DeltaReport.Row(
          valueId,
          name,
          itemCount,
          budgetedHours.setScale(SCALE, RoundingMode.HALF_UP),
          categoryBudget.rounded(SCALE),
          roundedEarned,
          earnedTotal,
          percent);
    }
  }
}
