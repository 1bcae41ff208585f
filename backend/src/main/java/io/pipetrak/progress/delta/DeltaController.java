package io.pipetrak.progress.delta;

import io.pipetrak.progress.dimension.DimensionType;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects/{projectId}/deltas")
public class DeltaController {

  private final DeltaReportService deltaReportService;

  public DeltaController(DeltaReportService deltaReportService) {
    this.deltaReportService = deltaReportService;
  }

  /** Window bounds are ISO-8601 instants; the window is start-inclusive, end-exclusive. */
  @GetMapping
  public ResponseEntity<DeltaReport> getDelta(
      @PathVariable UUID projectId,
      @RequestParam String dimension,
      @RequestParam Instant start,
      @RequestParam Instant end) {
    return ResponseEntity.ok(
        deltaReportService.report(
            projectId, DimensionType.requireReportable(dimension), start, end));
  }
}
