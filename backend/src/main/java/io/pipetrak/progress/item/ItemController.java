package io.pipetrak.progress.item;

import io.pipetrak.progress.milestone.MilestoneEvent;
import io.pipetrak.progress.progress.CategoryHours;
import io.pipetrak.progress.progress.ProgressBreakdown;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ItemController {

  private final ItemService itemService;

  public ItemController(ItemService itemService) {
    this.itemService = itemService;
  }

  @PostMapping("/api/projects/{projectId}/items")
  public ResponseEntity<ItemResponse> createItem(
      @PathVariable UUID projectId,
      @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId,
      @Valid @RequestBody CreateItemRequest request) {
    var item =
        itemService.createItem(
            projectId,
            new NewItem(
                request.itemType(),
                request.identityKey(),
                request.attributes(),
                request.budgetedHours(),
                request.areaId(),
                request.systemId(),
                request.testPackageId(),
                request.drawingId(),
                request.welderId(),
                request.milestones()),
            actorId);
    return ResponseEntity.created(
            URI.create("/api/projects/" + projectId + "/items/" + item.getId()))
        .body(ItemResponse.from(item));
  }

  @GetMapping("/api/projects/{projectId}/items")
  public ResponseEntity<Page<ItemResponse>> listItems(
      @PathVariable UUID projectId,
      @RequestParam(required = false) String itemType,
      @PageableDefault(size = 50) Pageable pageable) {
    return ResponseEntity.ok(
        itemService.listItems(projectId, itemType, pageable).map(ItemResponse::from));
  }

  @GetMapping("/api/projects/{projectId}/items/{itemId}/progress")
  public ResponseEntity<ProgressResponse> getProgress(
      @PathVariable UUID projectId, @PathVariable UUID itemId) {
    var progress = itemService.getProgress(projectId, itemId);
    return ResponseEntity.ok(
        ProgressResponse.from(
            progress.item(), progress.schedule().scope().name(), progress.breakdown()));
  }

  @PostMapping("/api/projects/{projectId}/items/{itemId}/milestones")
  public ResponseEntity<MilestoneUpdateResponse> recordMilestone(
      @PathVariable UUID projectId,
      @PathVariable UUID itemId,
      @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId,
      @Valid @RequestBody RecordMilestoneRequest request) {
    var update =
        itemService.recordMilestone(
            projectId, itemId, request.milestone(), request.value(), request.welderId(), actorId);
    return ResponseEntity.ok(MilestoneUpdateResponse.from(update));
  }

  @GetMapping("/api/projects/{projectId}/items/{itemId}/events")
  public ResponseEntity<List<EventResponse>> listEvents(
      @PathVariable UUID projectId, @PathVariable UUID itemId) {
    return ResponseEntity.ok(
        itemService.listEvents(projectId, itemId).stream().map(EventResponse::from).toList());
  }

  @PostMapping("/api/projects/{projectId}/items/{itemId}/retire")
  public ResponseEntity<ItemResponse> retireItem(
      @PathVariable UUID projectId,
      @PathVariable UUID itemId,
      @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId) {
    return ResponseEntity.ok(ItemResponse.from(itemService.retireItem(projectId, itemId, actorId)));
  }

  @PostMapping("/api/projects/{projectId}/items/{itemId}/projection/rebuild")
  public ResponseEntity<ProjectionRebuildResponse> rebuildProjection(
      @PathVariable UUID projectId,
      @PathVariable UUID itemId,
      @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId) {
    var result = itemService.rebuildProjection(projectId, itemId, actorId);
    return ResponseEntity.ok(
        new ProjectionRebuildResponse(
            itemId,
            result.drifted(),
            result.previousMilestones(),
            result.rebuiltMilestones(),
            result.breakdown().percentComplete(),
            result.breakdown().earnedHours()));
  }

  @PostMapping("/api/milestone-events/{eventId}/corrections")
  public ResponseEntity<MilestoneUpdateResponse> correctEvent(
      @PathVariable UUID eventId,
      @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId,
      @Valid @RequestBody CorrectionRequest request) {
    var update = itemService.correctEvent(eventId, request.value(), request.reason(), actorId);
    return ResponseEntity.status(HttpStatus.CREATED).body(MilestoneUpdateResponse.from(update));
  }

  // --- DTOs ---

  public record CreateItemRequest(
      @NotBlank(message = "itemType is required") String itemType,
      @NotEmpty(message = "identityKey is required") Map<String, Object> identityKey,
      Map<String, Object> attributes,
      @PositiveOrZero(message = "budgetedHours must not be negative") BigDecimal budgetedHours,
      UUID areaId,
      UUID systemId,
      UUID testPackageId,
      UUID drawingId,
      UUID welderId,
      Map<String, Object> milestones) {}

  public record RecordMilestoneRequest(
      @NotBlank(message = "milestone is required") String milestone,
      @NotNull(message = "value is required") Object value,
      UUID welderId) {}

  public record CorrectionRequest(
      @NotNull(message = "value is required") Object value,
      @NotBlank(message = "reason is required") String reason) {}

  public record ItemResponse(
      UUID id,
      UUID projectId,
      String itemType,
      Map<String, Object> identityKey,
      Map<String, Object> attributes,
      BigDecimal budgetedHours,
      BigDecimal percentComplete,
      BigDecimal earnedHours,
      Map<String, Object> milestones,
      String templateScope,
      UUID areaId,
      UUID systemId,
      UUID testPackageId,
      UUID drawingId,
      UUID welderId,
      boolean retired,
      Instant createdAt,
      Instant updatedAt) {

    public static ItemResponse from(Item item) {
      return new ItemResponse(
          item.getId(),
          item.getProjectId(),
          item.getItemType(),
          item.getIdentityKey(),
          item.getAttributes(),
          item.getBudgetedHours(),
          item.getPercentComplete(),
          item.getEarnedHours(),
          item.getCurrentMilestones(),
          item.getTemplateScope().name(),
          item.getAreaId(),
          item.getSystemId(),
          item.getTestPackageId(),
          item.getDrawingId(),
          item.getWelderId(),
          item.isRetired(),
          item.getCreatedAt(),
          item.getUpdatedAt());
    }
  }

  public record ProgressResponse(
      UUID itemId,
      String itemType,
      String templateScope,
      BigDecimal budgetedHours,
      BigDecimal percentComplete,
      BigDecimal earnedHours,
      CategoryHours categoryEarnedHours,
      CategoryHours categoryBudgetedHours,
      List<String> unknownMilestones) {

    public static ProgressResponse from(Item item, String scope, ProgressBreakdown b) {
      return new ProgressResponse(
          item.getId(),
          item.getItemType(),
          scope,
          item.getBudgetedHours(),
          b.percentComplete(),
          b.earnedHours(),
          b.categoryEarned(),
          b.categoryBudget(),
          b.unknownMilestones());
    }
  }

  public record EventResponse(
      UUID id,
      UUID itemId,
      String milestone,
      BigDecimal previousValue,
      BigDecimal newValue,
      UUID actorId,
      Instant occurredAt,
      UUID correctionOf,
      String correctionReason) {

    public static EventResponse from(MilestoneEvent e) {
      return new EventResponse(
          e.getId(),
          e.getItemId(),
          e.getMilestoneName(),
          e.getPreviousValue(),
          e.getNewValue(),
          e.getActorId(),
          e.getOccurredAt(),
          e.getCorrectionOf(),
          e.getCorrectionReason());
    }
  }

  public record MilestoneUpdateResponse(
      boolean changed, EventResponse event, ProgressResponse progress) {

    public static MilestoneUpdateResponse from(MilestoneUpdate update) {
      return new MilestoneUpdateResponse(
          update.changed(),
          update.event() != null ? EventResponse.from(update.event()) : null,
          ProgressResponse.from(
              update.item(), update.item().getTemplateScope().name(), update.breakdown()));
    }
  }

  public record ProjectionRebuildResponse(
      UUID itemId,
      boolean drifted,
      Map<String, BigDecimal> previousMilestones,
      Map<String, BigDecimal> rebuiltMilestones,
      BigDecimal percentComplete,
      BigDecimal earnedHours) {}
}
