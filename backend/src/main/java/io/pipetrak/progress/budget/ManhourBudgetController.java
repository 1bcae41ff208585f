package io.pipetrak.progress.budget;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects/{projectId}/manhour-budgets")
public class ManhourBudgetController {

  private final ManhourBudgetService budgetService;

  public ManhourBudgetController(ManhourBudgetService budgetService) {
    this.budgetService = budgetService;
  }

  @PostMapping
  public ResponseEntity<DistributionResponse> createBudget(
      @PathVariable UUID projectId,
      @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId,
      @Valid @RequestBody CreateBudgetRequest request) {
    var distribution =
        budgetService.createBudget(
            projectId,
            request.totalBudgetedHours(),
            request.revisionReason(),
            request.effectiveDate(),
            actorId);
    return ResponseEntity.status(HttpStatus.CREATED).body(DistributionResponse.from(distribution));
  }

  @GetMapping
  public ResponseEntity<List<BudgetResponse>> listBudgets(@PathVariable UUID projectId) {
    return ResponseEntity.ok(
        budgetService.listBudgets(projectId).stream().map(BudgetResponse::from).toList());
  }

  @GetMapping("/active")
  public ResponseEntity<BudgetResponse> getActiveBudget(@PathVariable UUID projectId) {
    return ResponseEntity.ok(BudgetResponse.from(budgetService.getActiveBudget(projectId)));
  }

  // --- DTOs ---

  public record CreateBudgetRequest(
      @NotNull(message = "totalBudgetedHours is required")
          @Positive(message = "totalBudgetedHours must be positive")
          BigDecimal totalBudgetedHours,
      String revisionReason,
      LocalDate effectiveDate) {}

  public record BudgetResponse(
      UUID id,
      UUID projectId,
      int versionNumber,
      BigDecimal totalBudgetedHours,
      String revisionReason,
      LocalDate effectiveDate,
      boolean active,
      UUID createdBy,
      Instant createdAt) {

    public static BudgetResponse from(ManhourBudget b) {
      return new BudgetResponse(
          b.getId(),
          b.getProjectId(),
          b.getVersionNumber(),
          b.getTotalBudgetedHours(),
          b.getRevisionReason(),
          b.getEffectiveDate(),
          b.isActive(),
          b.getCreatedBy(),
          b.getCreatedAt());
    }
  }

  public record DistributionResponse(
      BudgetResponse budget,
      int itemsAllocated,
      BigDecimal totalWeight,
      BigDecimal allocatedHours,
      List<BudgetDistribution.Warning> warnings) {

    public static DistributionResponse from(BudgetDistribution d) {
      return new DistributionResponse(
          BudgetResponse.from(d.budget()),
          d.itemsAllocated(),
          d.totalWeight(),
          d.allocatedHours(),
          d.warnings());
    }
  }
}
