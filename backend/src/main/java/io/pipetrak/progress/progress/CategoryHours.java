package io.pipetrak.progress.progress;

import io.pipetrak.progress.template.MilestoneCategory;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/** Hours split across the five reporting categories. A category without weight is zero. */
public record CategoryHours(
    BigDecimal receive, BigDecimal install, BigDecimal punch, BigDecimal test, BigDecimal restore) {

  public static final CategoryHours ZERO =
      new CategoryHours(
          BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

  public static CategoryHours of(Map<MilestoneCategory, BigDecimal> values) {
    return new CategoryHours(
        values.getOrDefault(MilestoneCategory.RECEIVE, BigDecimal.ZERO),
        values.getOrDefault(MilestoneCategory.INSTALL, BigDecimal.ZERO),
        values.getOrDefault(MilestoneCategory.PUNCH, BigDecimal.ZERO),
        values.getOrDefault(MilestoneCategory.TEST, BigDecimal.ZERO),
        values.getOrDefault(MilestoneCategory.RESTORE, BigDecimal.ZERO));
  }

  public BigDecimal get(MilestoneCategory category) {
    return switch (category) {
      case RECEIVE -> receive;
      case INSTALL -> install;
      case PUNCH -> punch;
      case TEST -> test;
      case RESTORE -> restore;
    };
  }

  public CategoryHours plus(CategoryHours other) {
    return new CategoryHours(
        receive.add(other.receive),
        install.add(other.install),
        punch.add(other.punch),
        test.add(other.test),
        restore.add(other.restore));
  }

  public CategoryHours minus(CategoryHours other) {
    return new CategoryHours(
        receive.subtract(other.receive),
        install.subtract(other.install),
        punch.subtract(other.punch),
        test.subtract(other.test),
        restore.subtract(other.restore));
  }

  public BigDecimal total() {
    return receive.add(install).add(punch).add(test).add(restore);
  }

  public CategoryHours rounded(int scale) {
    return new CategoryHours(
        receive.setScale(scale, RoundingMode.HALF_UP),
        install.setScale(scale, RoundingMode.HALF_UP),
        punch.setScale(scale, RoundingMode.HALF_UP),
        test.setScale(scale, RoundingMode.HALF_UP),
        restore.setScale(scale, RoundingMode.HALF_UP));
  }
}
