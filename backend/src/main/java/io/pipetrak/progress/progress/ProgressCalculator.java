package io.pipetrak.progress.progress;

import io.pipetrak.progress.exception.InvalidStateException;
import io.pipetrak.progress.template.CompletionKind;
import io.pipetrak.progress.template.MilestoneCategory;
import io.pipetrak.progress.template.MilestoneSchedule;
import io.pipetrak.progress.template.ResolvedMilestone;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a resolved schedule plus an item's current milestone values into percent complete, earned
 * hours and per-category earned hours. Stateless; safe for concurrent use.
 *
 * <p>Total earned hours come from the overall percent, category earned hours from each category's
 * own normalised completion. The two paths are reconciled by {@link ProgressInvariants}.
 */
@Component
public class ProgressCalculator {

  private static final Logger log = LoggerFactory.getLogger(ProgressCalculator.class);

  public static final int PERCENT_SCALE = 4;
  public static final int HOURS_SCALE = 4;

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
  private static final MathContext INTERMEDIATE = MathContext.DECIMAL64;

  /**
   * Weighted completion one milestone contributes for a value: the full weight for a complete
   * discrete milestone, {@code weight * value / 100} for a partial one.
   */
  public static BigDecimal contribution(ResolvedMilestone milestone, BigDecimal value) {
    if (value == null) {
      return BigDecimal.ZERO;
    }
    if (milestone.kind() == CompletionKind.DISCRETE) {
      return MilestoneValues.isComplete(value) ? milestone.weight() : BigDecimal.ZERO;
    }
    return milestone.weight().multiply(value).movePointLeft(2);
  }

  public BigDecimal percentComplete(MilestoneSchedule schedule, Map<String, BigDecimal> values) {
    requireSchedule(schedule);
    var lookup = lowerCaseLookup(values);
    BigDecimal sum = BigDecimal.ZERO;
    for (var milestone : schedule.milestones()) {
      sum = sum.add(contribution(milestone, lookup.get(key(milestone.name()))));
    }
    return clamp(sum).setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
  }

  public BigDecimal earnedHours(BigDecimal budgetedHours, BigDecimal percentComplete) {
    requireBudget(budgetedHours);
    return budgetedHours
        .multiply(percentComplete)
        .movePointLeft(2)
        .setScale(HOURS_SCALE, RoundingMode.HALF_UP);
  }

  /**
   * Earned hours per category: {@code budget * categoryWeight/100 * categoryPct/100}, where {@code
   * categoryPct} is the category's weighted completion normalised to its own weight. Categories the
   * schedule does not use report zero. When completed weight exceeds 100 within the weight
   * tolerance, every category is scaled by {@code 100 / completed} so the categories add up to the
   * capped total.
   */
  public CategoryHours categoryEarnedHours(
      MilestoneSchedule schedule, Map<String, BigDecimal> values, BigDecimal budgetedHours) {
    requireSchedule(schedule);
    requireBudget(budgetedHours);
    var lookup = lowerCaseLookup(values);

    var completed = new EnumMap<MilestoneCategory, BigDecimal>(MilestoneCategory.class);
    BigDecimal total = BigDecimal.ZERO;
    for (var milestone : schedule.milestones()) {
      var contribution = contribution(milestone, lookup.get(key(milestone.name())));
      completed.merge(milestone.category(), contribution, BigDecimal::add);
      total = total.add(contribution);
    }
    // percent complete is capped at 100; scale categories down to the same cap
    BigDecimal cap =
        total.compareTo(HUNDRED) > 0 ? HUNDRED.divide(total, INTERMEDIATE) : BigDecimal.ONE;

    var earned = new EnumMap<MilestoneCategory, BigDecimal>(MilestoneCategory.class);
    for (var category : MilestoneCategory.values()) {
      BigDecimal categoryWeight = schedule.categoryWeight(category);
      if (categoryWeight.signum() == 0) {
        earned.put(category, BigDecimal.ZERO.setScale(HOURS_SCALE));
        continue;
      }
      BigDecimal categoryPct =
          completed
              .getOrDefault(category, BigDecimal.ZERO)
              .multiply(HUNDRED)
              .divide(categoryWeight, INTERMEDIATE);
      BigDecimal hours =
          budgetedHours
              .multiply(categoryWeight)
              .movePointLeft(2)
              .multiply(categoryPct)
              .movePointLeft(2)
              .multiply(cap)
              .setScale(HOURS_SCALE, RoundingMode.HALF_UP);
      earned.put(category, hours);
    }
    return CategoryHours.of(earned);
  }

  /** Budgeted hours per category: {@code budget * categoryWeight / 100}. */
  public CategoryHours categoryBudgetHours(MilestoneSchedule schedule, BigDecimal budgetedHours) {
    requireSchedule(schedule);
    requireBudget(budgetedHours);
    var budget = new EnumMap<MilestoneCategory, BigDecimal>(MilestoneCategory.class);
    for (var category : MilestoneCategory.values()) {
      budget.put(
          category,
          budgetedHours
              .multiply(schedule.categoryWeight(category))
              .movePointLeft(2)
              .setScale(HOURS_SCALE, RoundingMode.HALF_UP));
    }
    return CategoryHours.of(budget);
  }

  /** Evaluates all figures for one item and reports milestones the schedule does not know. */
  public ProgressBreakdown calculate(
      MilestoneSchedule schedule, Map<String, BigDecimal> values, BigDecimal budgetedHours) {
    var percent = percentComplete(schedule, values);
    var earned = earnedHours(budgetedHours, percent);
    var categories = categoryEarnedHours(schedule, values, budgetedHours);
    var categoryBudget = categoryBudgetHours(schedule, budgetedHours);
    return new ProgressBreakdown(
        percent, earned, categories, categoryBudget, unknownMilestones(schedule, values));
  }

  /** Names present in the values map with no matching schedule entry. Logged at warn. */
  public List<String> unknownMilestones(
      MilestoneSchedule schedule, Map<String, BigDecimal> values) {
    var unknown = new ArrayList<String>();
    if (values == null) {
      return unknown;
    }
    for (var name : values.keySet()) {
      if (schedule.find(name).isEmpty()) {
        unknown.add(name);
      }
    }
    if (!unknown.isEmpty()) {
      log.warn(
          "Unknown milestones excluded from weighted sums: itemType={}, project={}, names={}",
          schedule.itemType(),
          schedule.projectId(),
          unknown);
    }
    return unknown;
  }

  private static BigDecimal clamp(BigDecimal percent) {
    if (percent.signum() < 0) {
      return BigDecimal.ZERO;
    }
    return percent.compareTo(HUNDRED) > 0 ? HUNDRED : percent;
  }

  private static Map<String, BigDecimal> lowerCaseLookup(Map<String, BigDecimal> values) {
    var lookup = new HashMap<String, BigDecimal>();
    if (values != null) {
      values.forEach((name, value) -> lookup.put(key(name), value));
    }
    return lookup;
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }

  private static void requireSchedule(MilestoneSchedule schedule) {
    if (schedule == null || schedule.milestones().isEmpty()) {
      throw new InvalidStateException(
          "Missing schedule", "A resolved milestone schedule is required to calculate progress");
    }
  }

  private static void requireBudget(BigDecimal budgetedHours) {
    if (budgetedHours == null) {
      throw new InvalidStateException("Invalid budget", "Budgeted hours are required");
    }
    if (budgetedHours.signum() < 0) {
      throw new InvalidStateException(
          "Invalid budget",
          "Budgeted hours must not be negative (got " + budgetedHours.toPlainString() + ")");
    }
  }
}
