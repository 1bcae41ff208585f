package io.pipetrak.progress.rollup;

import io.pipetrak.progress.dimension.DimensionType;
import io.pipetrak.progress.progress.CategoryHours;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects/{projectId}/rollups")
public class RollupController {

  private final RollupService rollupService;

  public RollupController(RollupService rollupService) {
    this.rollupService = rollupService;
  }

  @GetMapping
  public ResponseEntity<RollupSnapshotResponse> getSnapshot(
      @PathVariable UUID projectId, @RequestParam String dimension) {
    var snapshot = rollupService.snapshot(projectId, DimensionType.requireReportable(dimension));
    return ResponseEntity.ok(RollupSnapshotResponse.from(snapshot));
  }

  @PostMapping("/rebuild")
  public ResponseEntity<RebuildResponse> rebuild(@PathVariable UUID projectId) {
    return ResponseEntity.ok(new RebuildResponse(projectId, rollupService.rebuild(projectId)));
  }

  @GetMapping("/drift")
  public ResponseEntity<List<DriftResponse>> detectDrift(@PathVariable UUID projectId) {
    return ResponseEntity.ok(
        rollupService.detectDrift(projectId).stream().map(DriftResponse::from).toList());
  }

  // --- DTOs ---

  public record TotalsResponse(
      int itemCount,
      BigDecimal budgetedHours,
      BigDecimal earnedHours,
      BigDecimal percentComplete,
      CategoryHours categoryBudget,
      CategoryHours categoryEarned) {

    public static TotalsResponse from(RollupTotals t) {
      return new TotalsResponse(
          t.itemCount(),
          t.budgetedHours(),
          t.earnedHours(),
          t.percentComplete(),
          t.categoryBudget(),
          t.categoryEarned());
    }
  }

  public record RollupRowResponse(
      UUID dimensionValueId, String dimensionName, TotalsResponse totals) {}

  public record RollupSnapshotResponse(
      UUID projectId, String dimension, List<RollupRowResponse> rows, TotalsResponse total) {

    public static RollupSnapshotResponse from(RollupSnapshot s) {
      return new RollupSnapshotResponse(
          s.projectId(),
          s.dimension().name(),
          s.rows().stream()
              .map(
                  r ->
                      new RollupRowResponse(
                          r.dimensionValueId(), r.dimensionName(), TotalsResponse.from(r.totals())))
              .toList(),
          TotalsResponse.from(s.total()));
    }
  }

  public record RebuildResponse(UUID projectId, int rows) {}

  public record DriftResponse(
      String dimension, UUID dimensionValueId, TotalsResponse cached, TotalsResponse expected) {

    public static DriftResponse from(RollupDrift d) {
      return new DriftResponse(
          d.dimension().name(),
          d.dimensionValueId(),
          TotalsResponse.from(d.cached()),
          TotalsResponse.from(d.expected()));
    }
  }
}
