package io.pipetrak.progress.template;

import io.pipetrak.progress.exception.InvalidStateException;
import java.util.Locale;

/** Fixed reporting grouping of milestones, independent of milestone naming. */
public enum MilestoneCategory {
  RECEIVE,
  INSTALL,
  PUNCH,
  TEST,
  RESTORE;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static MilestoneCategory fromCode(String code) {
    if (code == null || code.isBlank()) {
      throw new InvalidStateException("Invalid category", "Milestone category is required");
    }
    try {
      return valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException(
          "Invalid category",
          "Unknown milestone category '"
              + code
              + "'; expected receive, install, punch, test or restore");
    }
  }
}
