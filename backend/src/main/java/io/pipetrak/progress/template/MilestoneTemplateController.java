package io.pipetrak.progress.template;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MilestoneTemplateController {

  private final TemplateRegistryService registryService;

  public MilestoneTemplateController(TemplateRegistryService registryService) {
    this.registryService = registryService;
  }

  @GetMapping("/api/milestone-templates")
  public ResponseEntity<List<String>> listItemTypes() {
    return ResponseEntity.ok(registryService.listItemTypes());
  }

  @GetMapping("/api/milestone-templates/{itemType}")
  public ResponseEntity<ScheduleResponse> getDefaultSchedule(@PathVariable String itemType) {
    return ResponseEntity.ok(
        ScheduleResponse.from(registryService.getDefaultSchedule(itemType), null));
  }

  @PutMapping("/api/milestone-templates/{itemType}")
  public ResponseEntity<ScheduleResponse> upsertDefaultSchedule(
      @PathVariable String itemType,
      @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId,
      @Valid @RequestBody DefaultScheduleRequest request) {
    var definitions =
        request.milestones().stream()
            .map(
                m ->
                    new MilestoneDefinition(
                        m.name(),
                        m.weight(),
                        m.kind(),
                        m.category() != null ? MilestoneCategory.fromCode(m.category()) : null,
                        Boolean.TRUE.equals(m.requiresWelder())))
            .toList();
    var schedule = registryService.upsertDefaultSchedule(itemType, definitions, actorId);
    return ResponseEntity.ok(ScheduleResponse.from(schedule, null));
  }

  @GetMapping("/api/projects/{projectId}/milestone-templates/{itemType}")
  public ResponseEntity<ScheduleResponse> resolveSchedule(
      @PathVariable UUID projectId, @PathVariable String itemType) {
    var schedule = registryService.resolve(projectId, itemType);
    return ResponseEntity.ok(
        ScheduleResponse.from(schedule, registryService.lastOverrideUpdate(projectId, itemType)));
  }

  @PutMapping("/api/projects/{projectId}/milestone-templates/{itemType}/overrides")
  public ResponseEntity<OverrideResponse> putOverrides(
      @PathVariable UUID projectId,
      @PathVariable String itemType,
      @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId,
      @Valid @RequestBody OverridesRequest request) {
    var definitions =
        request.overrides().stream()
            .map(
                o ->
                    new MilestoneDefinition(
                        o.name(),
                        o.weight(),
                        o.kind(),
                        o.category() != null ? MilestoneCategory.fromCode(o.category()) : null,
                        false))
            .toList();
    var result =
        registryService.putProjectOverrides(
            projectId,
            itemType,
            definitions,
            request.expectedLastUpdated(),
            Boolean.TRUE.equals(request.recalculateExisting()),
            actorId);
    return ResponseEntity.ok(
        new OverrideResponse(
            ScheduleResponse.from(
                result.schedule(), registryService.lastOverrideUpdate(projectId, itemType)),
            result.recalculatedItems()));
  }

  @DeleteMapping("/api/projects/{projectId}/milestone-templates/{itemType}/overrides")
  public ResponseEntity<Void> deleteOverrides(
      @PathVariable UUID projectId,
      @PathVariable String itemType,
      @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId) {
    registryService.deleteProjectOverrides(projectId, itemType, actorId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/api/projects/{projectId}/milestone-templates/clone")
  public ResponseEntity<CloneResponse> cloneDefaults(
      @PathVariable UUID projectId,
      @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId) {
    int rows = registryService.cloneDefaultsForProject(projectId, actorId);
    return ResponseEntity.status(HttpStatus.CREATED).body(new CloneResponse(projectId, rows));
  }

  // --- DTOs ---

  public record MilestoneRequest(
      @NotBlank(message = "name is required") String name,
      @NotNull(message = "weight is required")
          @DecimalMin(value = "0", message = "weight must be at least 0")
          @DecimalMax(value = "100", message = "weight must be at most 100")
          @Digits(integer = 3, fraction = 2, message = "weight allows at most 2 decimal places")
          BigDecimal weight,
      CompletionKind kind,
      String category,
      Boolean requiresWelder) {}

  public record DefaultScheduleRequest(
      @NotEmpty(message = "milestones must not be empty")
          List<@Valid MilestoneRequest> milestones) {}

  public record OverridesRequest(
      @NotNull(message = "overrides is required") List<@Valid MilestoneRequest> overrides,
      Instant expectedLastUpdated,
      Boolean recalculateExisting) {}

  public record MilestoneResponse(
      String name,
      BigDecimal weight,
      String kind,
      String category,
      int order,
      boolean requiresWelder) {

    public static MilestoneResponse from(ResolvedMilestone m) {
      return new MilestoneResponse(
          m.name(),
          m.weight(),
          m.kind().name(),
          m.category().code(),
          m.order(),
          m.requiresWelder());
    }
  }

  public record ScheduleResponse(
      UUID projectId,
      String itemType,
      String scope,
      BigDecimal totalWeight,
      Instant lastUpdated,
      List<MilestoneResponse> milestones) {

    public static ScheduleResponse from(MilestoneSchedule schedule, Instant lastUpdated) {
      return new ScheduleResponse(
          schedule.projectId(),
          schedule.itemType(),
          schedule.scope().name(),
          schedule.totalWeight(),
          lastUpdated,
          schedule.milestones().stream().map(MilestoneResponse::from).toList());
    }
  }

  public record OverrideResponse(ScheduleResponse schedule, int recalculatedItems) {}

  public record CloneResponse(UUID projectId, int clonedRows) {}
}
