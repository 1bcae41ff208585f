package io.pipetrak.progress.rollup;

import io.pipetrak.progress.dimension.DimensionType;
import java.util.UUID;

record RollupKey(DimensionType dimension, UUID dimensionValueId) {}
