package io.pipetrak.progress.dimension;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects/{projectId}/dimensions")
public class DimensionController {

  private final DimensionService dimensionService;

  public DimensionController(DimensionService dimensionService) {
    this.dimensionService = dimensionService;
  }

  @PostMapping
  public ResponseEntity<DimensionValueResponse> createValue(
      @PathVariable UUID projectId, @Valid @RequestBody CreateDimensionValueRequest request) {
    var value =
        dimensionService.createValue(
            projectId, DimensionType.fromCode(request.dimension()), request.name());
    return ResponseEntity.created(
            URI.create("/api/projects/" + projectId + "/dimensions/" + value.getId()))
        .body(DimensionValueResponse.from(value));
  }

  @GetMapping
  public ResponseEntity<List<DimensionValueResponse>> listValues(
      @PathVariable UUID projectId, @RequestParam(required = false) String dimension) {
    var type = dimension != null ? DimensionType.fromCode(dimension) : null;
    return ResponseEntity.ok(
        dimensionService.listValues(projectId, type).stream()
            .map(DimensionValueResponse::from)
            .toList());
  }

  // --- DTOs ---

  public record CreateDimensionValueRequest(
      @NotBlank(message = "dimension is required") String dimension,
      @NotBlank(message = "name is required")
          @Size(max = 200, message = "name must be at most 200 characters")
          String name) {}

  public record DimensionValueResponse(
      UUID id, UUID projectId, String dimension, String name, Instant createdAt) {

    public static DimensionValueResponse from(DimensionValue v) {
      return new DimensionValueResponse(
          v.getId(), v.getProjectId(), v.getDimension().name(), v.getName(), v.getCreatedAt());
    }
  }
}
