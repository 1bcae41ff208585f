package io.pipetrak.progress.item;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/** Everything the item creation tooling supplies for a new item. */
public record NewItem(
    String itemType,
    Map<String, Object> identityKey,
    Map<String, Object> attributes,
    BigDecimal budgetedHours,
    UUID areaId,
    UUID systemId,
    UUID testPackageId,
    UUID drawingId,
    UUID welderId,
    Map<String, Object> initialMilestones) {}
