package io.pipetrak.progress.progress;

import io.pipetrak.progress.exception.InvariantViolationException;
import io.pipetrak.progress.exception.SchemaInvalidException;
import io.pipetrak.progress.template.MilestoneSchedule;
import java.math.BigDecimal;
import java.util.UUID;

/** The two checks every schedule and every item must pass. */
public final class ProgressInvariants {

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private ProgressInvariants() {}

  public static boolean weightsSumTo100(MilestoneSchedule schedule, BigDecimal tolerance) {
    return schedule.totalWeight().subtract(HUNDRED).abs().compareTo(tolerance) <= 0;
  }

  /**
   * @throws SchemaInvalidException if the schedule's weights are not 100 within tolerance
   */
  public static void requireWeightsSumTo100(MilestoneSchedule schedule, BigDecimal tolerance) {
    if (!weightsSumTo100(schedule, tolerance)) {
      throw new SchemaInvalidException(
          schedule.projectId(), schedule.itemType(), schedule.totalWeight());
    }
  }

  public static boolean categoriesReconcile(ProgressBreakdown breakdown, BigDecimal tolerance) {
    return breakdown
            .categoryEarned()
            .total()
            .subtract(breakdown.earnedHours())
            .abs()
            .compareTo(tolerance)
        <= 0;
  }

  /**
   * @throws InvariantViolationException if category earned hours do not sum to earned hours
   */
  public static void requireCategoriesReconcile(
      UUID itemId, ProgressBreakdown breakdown, BigDecimal tolerance) {
    if (!categoriesReconcile(breakdown, tolerance)) {
      throw new InvariantViolationException(
          itemId, breakdown.earnedHours(), breakdown.categoryEarned().total());
    }
  }
}
