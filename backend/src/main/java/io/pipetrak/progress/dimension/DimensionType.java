package io.pipetrak.progress.dimension;

import io.pipetrak.progress.exception.InvalidStateException;
import java.util.Locale;

/** Organizational grouping axes an item can be assigned to. */
public enum DimensionType {
  AREA(true),
  SYSTEM(true),
  TEST_PACKAGE(true),
  DRAWING(false),
  WELDER(true);

  private final boolean reportable;

  DimensionType(boolean reportable) {
    this.reportable = reportable;
  }

  /** Whether rollups and deltas are produced for this dimension. */
  public boolean isReportable() {
    return reportable;
  }

  public static DimensionType fromCode(String code) {
    if (code == null || code.isBlank()) {
      throw new InvalidStateException("Invalid dimension", "Dimension is required");
    }
    try {
      return valueOf(code.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException(
          "Invalid dimension",
          "Unknown dimension '"
              + code
              + "'; expected area, system, test_package, drawing or welder");
    }
  }

  public static DimensionType requireReportable(String code) {
    var type = fromCode(code);
    if (!type.isReportable()) {
      throw new InvalidStateException(
          "Invalid dimension", "Dimension '" + code + "' is not available for reporting");
    }
    return type;
  }
}
