package io.pipetrak.progress.rollup;

import io.pipetrak.progress.dimension.DimensionType;
import java.util.UUID;

/** A cached rollup row that no longer matches a fresh computation from current items. */
public record RollupDrift(
    DimensionType dimension, UUID dimensionValueId, RollupTotals cached, RollupTotals expected) {}
