package io.pipetrak.progress.template;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ordered, validated milestone schedule for one (project, item type). Immutable; instances are
 * shared through the resolver cache.
 */
public record MilestoneSchedule(
    UUID projectId, String itemType, TemplateScope scope, List<ResolvedMilestone> milestones) {

  public MilestoneSchedule {
    milestones = List.copyOf(milestones);
  }

  public Optional<ResolvedMilestone> find(String milestoneName) {
    if (milestoneName == null) {
      return Optional.empty();
    }
    return milestones.stream().filter(m -> m.matches(milestoneName)).findFirst();
  }

  public BigDecimal totalWeight() {
    return milestones.stream()
        .map(ResolvedMilestone::weight)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  /** Sum of weights tagged with the category; zero when the item type has no such milestone. */
  public BigDecimal categoryWeight(MilestoneCategory category) {
    return milestones.stream()
        .filter(m -> m.category() == category)
        .map(ResolvedMilestone::weight)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
