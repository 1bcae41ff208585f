package io.pipetrak.progress.item;

import io.pipetrak.progress.progress.ProgressBreakdown;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Result of replaying an item's full event log over its cached milestone map.
 *
 * @param drifted whether the cached map differed from the replayed one
 */
public record ProjectionRebuild(
    Item item,
    boolean drifted,
    Map<String, BigDecimal> previousMilestones,
    Map<String, BigDecimal> rebuiltMilestones,
    ProgressBreakdown breakdown) {}
