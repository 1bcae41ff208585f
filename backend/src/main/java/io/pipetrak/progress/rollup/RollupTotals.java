package io.pipetrak.progress.rollup;

import io.pipetrak.progress.progress.CategoryHours;
import java.math.BigDecimal;
import java.math.RoundingMode;

/** Additive figures held by one rollup row. */
public record RollupTotals(
    int itemCount,
    BigDecimal budgetedHours,
    BigDecimal earnedHours,
    CategoryHours categoryBudget,
    CategoryHours categoryEarned) {

  public static final RollupTotals ZERO =
      new RollupTotals(0, BigDecimal.ZERO, BigDecimal.ZERO, CategoryHours.ZERO, CategoryHours.ZERO);

  public static RollupTotals of(ItemContribution contribution) {
    return new RollupTotals(
        1,
        contribution.budgetedHours(),
        contribution.earnedHours(),
        contribution.categoryBudget(),
        contribution.categoryEarned());
  }

  public RollupTotals plus(RollupTotals other) {
    return new RollupTotals(
        itemCount + other.itemCount,
        budgetedHours.add(other.budgetedHours),
        earnedHours.add(other.earnedHours),
        categoryBudget.plus(other.categoryBudget),
        categoryEarned.plus(other.categoryEarned));
  }

  public RollupTotals negate() {
    return ZERO.minus(this);
  }

  public RollupTotals minus(RollupTotals other) {
    return new RollupTotals(
        itemCount - other.itemCount,
        budgetedHours.subtract(other.budgetedHours),
        earnedHours.subtract(other.earnedHours),
        categoryBudget.minus(other.categoryBudget),
        categoryEarned.minus(other.categoryEarned));
  }

  /** Earned over budgeted, as a percentage; zero for an empty budget. */
  public BigDecimal percentComplete() {
    if (budgetedHours.signum() == 0) {
      return BigDecimal.ZERO.setScale(2);
    }
    return earnedHours
        .multiply(BigDecimal.valueOf(100))
        .divide(budgetedHours, 2, RoundingMode.HALF_UP);
  }

  /** Whether every figure matches {@code other} within {@code tolerance}. */
  public boolean matches(RollupTotals other, BigDecimal tolerance) {
    if (itemCount != other.itemCount) {
      return false;
    }
    return within(budgetedHours, other.budgetedHours, tolerance)
        && within(earnedHours, other.earnedHours, tolerance)
        && within(categoryBudget.total(), other.categoryBudget.total(), tolerance)
        && within(categoryEarned.receive(), other.categoryEarned.receive(), tolerance)
        && within(categoryEarned.install(), other.categoryEarned.install(), tolerance)
        && within(categoryEarned.punch(), other.categoryEarned.punch(), tolerance)
        && within(categoryEarned.test(), other.categoryEarned.test(), tolerance)
        && within(categoryEarned.restore(), other.categoryEarned.restore(), tolerance);
  }

  private static boolean within(BigDecimal a, BigDecimal b, BigDecimal tolerance) {
    return a.subtract(b).abs().compareTo(tolerance) <= 0;
  }
}
