package io.pipetrak.progress.rollup;

import java.util.UUID;

/** One reported rollup row. A null value id with name "Unassigned" groups items without a value. */
public record RollupRow(UUID dimensionValueId, String dimensionName, RollupTotals totals) {

  public static final String UNASSIGNED = "Unassigned";
}
