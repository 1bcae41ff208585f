package io.pipetrak.progress.rollup;

import io.pipetrak.progress.dimension.DimensionType;
import java.util.List;
import java.util.UUID;

public record RollupSnapshot(
    UUID projectId, DimensionType dimension, List<RollupRow> rows, RollupTotals total) {

  public RollupSnapshot {
    rows = List.copyOf(rows);
  }
}
