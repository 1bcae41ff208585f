package io.pipetrak.progress.template;

import java.math.BigDecimal;

/** One entry of a resolved schedule: default values with any project override applied. */
public record ResolvedMilestone(
    String name,
    BigDecimal weight,
    CompletionKind kind,
    MilestoneCategory category,
    int order,
    boolean requiresWelder) {

  public boolean matches(String milestoneName) {
    return name.equalsIgnoreCase(milestoneName);
  }
}
