package io.pipetrak.progress.budget;

import io.pipetrak.progress.audit.AuditEventBuilder;
import io.pipetrak.progress.audit.AuditService;
import io.pipetrak.progress.exception.InvalidStateException;
import io.pipetrak.progress.exception.ResourceNotFoundException;
import io.pipetrak.progress.item.ItemRepository;
import io.pipetrak.progress.item.ItemService;
import io.pipetrak.progress.rollup.RollupService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ManhourBudgetService {

  private static final Logger log = LoggerFactory.getLogger(ManhourBudgetService.class);

  private static final int HOURS_SCALE = 4;

  private final ManhourBudgetRepository budgetRepository;
  private final ItemRepository itemRepository;
  private final ItemService itemService;
  private final RollupService rollupService;
  private final SizeWeightCalculator sizeWeightCalculator;
  private final AuditService auditService;

  public ManhourBudgetService(
      ManhourBudgetRepository budgetRepository,
      ItemRepository itemRepository,
      ItemService itemService,
      RollupService rollupService,
      SizeWeightCalculator sizeWeightCalculator,
      AuditService auditService) {
    this.budgetRepository = budgetRepository;
    this.itemRepository = itemRepository;
    this.itemService = itemService;
    this.rollupService = rollupService;
    this.sizeWeightCalculator = sizeWeightCalculator;
    this.auditService = auditService;
  }

  /**
   * Creates the next budget version, deactivates the previous one and splits the total across
   * active items in proportion to their size weight. Cached earned hours and rollups are
   * recomputed against the new allocation.
   *
   * @throws InvalidStateException if the total is not positive or the project has no active items
   */
  @Transactional
  public BudgetDistribution createBudget(
      UUID projectId,
      BigDecimal totalHours,
      String revisionReason,
      LocalDate effectiveDate,
      UUID actorId) {
    if (totalHours == null || totalHours.signum() <= 0) {
      throw new InvalidStateException(
          "Invalid budget", "Total budgeted manhours must be greater than 0");
    }
    var items = itemRepository.findByProjectIdAndRetiredFalse(projectId);
    if (items.isEmpty()) {
      throw new InvalidStateException(
          "Invalid budget", "Project " + projectId + " has no active items to distribute to");
    }

    var weights = new ArrayList<BigDecimal>(items.size());
    var warnings = new ArrayList<BudgetDistribution.Warning>();
    BigDecimal totalWeight = BigDecimal.ZERO;
    for (var item : items) {
      var weight =
          sizeWeightCalculator.weigh(
              item.getItemType(), item.getIdentityKey(), item.getAttributes());
      if (weight.hasWarning()) {
        warnings.add(
            new BudgetDistribution.Warning(item.getId(), item.getIdentityKey(), weight.reason()));
      }
      var decimal = BigDecimal.valueOf(weight.weight());
      weights.add(decimal);
      totalWeight = totalWeight.add(decimal);
    }
    if (totalWeight.signum() == 0) {
      throw new InvalidStateException(
          "Invalid budget", "Sum of item weights is zero, cannot distribute budget");
    }

    budgetRepository
        .findByProjectIdAndActiveTrue(projectId)
        .ifPresent(
            previous -> {
              previous.deactivate();
              budgetRepository.saveAndFlush(previous);
            });
    int version =
        budgetRepository
                .findTopByProjectIdOrderByVersionNumberDesc(projectId)
                .map(ManhourBudget::getVersionNumber)
                .orElse(0)
            + 1;
    var budget =
        budgetRepository.save(
            new ManhourBudget(
                projectId,
                version,
                totalHours,
                revisionReason,
                effectiveDate != null ? effectiveDate : LocalDate.now(),
                actorId));

    BigDecimal allocated = BigDecimal.ZERO;
    for (int i = 0; i < items.size(); i++) {
      BigDecimal hours =
          weights
              .get(i)
              .multiply(totalHours)
              .divide(totalWeight, HOURS_SCALE, RoundingMode.HALF_UP);
      items.get(i).updateBudgetedHours(hours);
      allocated = allocated.add(hours);
    }
    itemService.recalculateProject(projectId);
    rollupService.rebuild(projectId);

    log.info(
        "Created manhour budget v{} for project {}: {} hours over {} items ({} warnings)",
        version,
        projectId,
        totalHours,
        items.size(),
        warnings.size());

    var details = new LinkedHashMap<String, Object>();
    details.put("project_id", projectId.toString());
    details.put("version_number", version);
    details.put("total_budgeted_hours", totalHours.toPlainString());
    details.put("items_allocated", items.size());
    details.put("items_with_warnings", warnings.size());
    if (revisionReason != null) {
      details.put("revision_reason", revisionReason);
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("manhour_budget.created")
            .entityType("manhour_budget")
            .entityId(budget.getId())
            .actorId(actorId)
            .details(details)
            .build());

    return new BudgetDistribution(
        budget,
        items.size(),
        totalWeight.setScale(HOURS_SCALE, RoundingMode.HALF_UP),
        allocated,
        warnings);
  }

  @Transactional(readOnly = true)
  public List<ManhourBudget> listBudgets(UUID projectId) {
    return budgetRepository.findByProjectIdOrderByVersionNumberDesc(projectId);
  }

  @Transactional(readOnly = true)
  public ManhourBudget getActiveBudget(UUID projectId) {
    return budgetRepository
        .findByProjectIdAndActiveTrue(projectId)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Manhour budget not found", "Project " + projectId + " has no active budget"));
  }
}
