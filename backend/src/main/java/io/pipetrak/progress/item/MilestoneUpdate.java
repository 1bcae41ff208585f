package io.pipetrak.progress.item;

import io.pipetrak.progress.milestone.MilestoneEvent;
import io.pipetrak.progress.progress.ProgressBreakdown;

/**
 * Outcome of a milestone write. {@code event} is null when the value was already current and
 * nothing was appended.
 */
public record MilestoneUpdate(Item item, MilestoneEvent event, ProgressBreakdown breakdown) {

  public boolean changed() {
    return event != null;
  }
}
