package io.pipetrak.progress.rollup;

import io.pipetrak.progress.config.ProgressProperties;
import io.pipetrak.progress.config.ProgressProperties.RefreshMode;
import io.pipetrak.progress.dimension.DimensionService;
import io.pipetrak.progress.dimension.DimensionType;
import io.pipetrak.progress.item.Item;
import io.pipetrak.progress.item.ItemRepository;
import io.pipetrak.progress.progress.ProgressCalculator;
import io.pipetrak.progress.template.TemplateResolver;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maintains the dimension rollup cache. Rows are a pure function of active items and their
 * resolved schedules: in EAGER mode each item change is applied as a signed difference in the
 * writing transaction, and {@link #rebuild(UUID)} recomputes a project from scratch in any mode.
 */
@Service
public class RollupService {

  private static final Logger log = LoggerFactory.getLogger(RollupService.class);

  private static final Comparator<RollupRow> ROW_ORDER =
      Comparator.comparing((RollupRow r) -> r.dimensionValueId() == null)
          .thenComparing(RollupRow::dimensionName, String.CASE_INSENSITIVE_ORDER);

  private final DimensionRollupRepository rollupRepository;
  private final ItemRepository itemRepository;
  private final TemplateResolver templateResolver;
  private final ProgressCalculator progressCalculator;
  private final DimensionService dimensionService;
  private final ProgressProperties properties;

  public RollupService(
      DimensionRollupRepository rollupRepository,
      ItemRepository itemRepository,
      TemplateResolver templateResolver,
      ProgressCalculator progressCalculator,
      DimensionService dimensionService,
      ProgressProperties properties) {
    this.rollupRepository = rollupRepository;
    this.itemRepository = itemRepository;
    this.templateResolver = templateResolver;
    this.progressCalculator = progressCalculator;
    this.dimensionService = dimensionService;
    this.properties = properties;
  }

  /** The item's current contribution, or null for a retired item. */
  public ItemContribution contributionOf(Item item) {
    if (item.isRetired()) {
      return null;
    }
    var schedule = templateResolver.resolve(item.getProjectId(), item.getItemType());
    var breakdown =
        progressCalculator.calculate(schedule, item.milestoneValues(), item.getBudgetedHours());
    var dimensions = new EnumMap<DimensionType, UUID>(DimensionType.class);
    for (var dimension : DimensionType.values()) {
      if (dimension.isReportable() && item.dimensionValue(dimension) != null) {
        dimensions.put(dimension, item.dimensionValue(dimension));
      }
    }
    return new ItemContribution(
        item.getProjectId(),
        dimensions,
        item.getBudgetedHours(),
        breakdown.earnedHours(),
        breakdown.categoryBudget(),
        breakdown.categoryEarned());
  }

  /**
   * Applies an item's change to its rollup rows: {@code before} is removed and {@code after} added.
   * Either side may be null (new or retired item). No-op in SCHEDULED mode.
   */
  @Transactional
  public void applyChange(ItemContribution before, ItemContribution after) {
    if (properties.rollup().refreshMode() != RefreshMode.EAGER) {
      return;
    }
    UUID projectId = before != null ? before.projectId() : after != null ? after.projectId() : null;
    if (projectId == null) {
      return;
    }
    var deltas = new LinkedHashMap<RollupKey, RollupTotals>();
    if (before != null) {
      accumulate(deltas, before, RollupTotals.of(before).negate());
    }
    if (after != null) {
      accumulate(deltas, after, RollupTotals.of(after));
    }
    deltas.forEach(
        (key, delta) -> {
          if (!delta.matches(RollupTotals.ZERO, BigDecimal.ZERO)) {
            upsert(projectId, key, delta);
          }
        });
  }

  @Transactional(readOnly = true)
  public RollupSnapshot snapshot(UUID projectId, DimensionType dimension) {
    var names = dimensionService.names(projectId, dimension);
    var rows = new ArrayList<RollupRow>();
    var total = RollupTotals.ZERO;
    for (var rollup : rollupRepository.findByProjectIdAndDimension(projectId, dimension)) {
      if (rollup.getItemCount() <= 0) {
        continue;
      }
      var totals = rollup.toTotals();
      UUID valueId = rollup.getDimensionValueId();
      String name =
          valueId == null ? RollupRow.UNASSIGNED : names.getOrDefault(valueId, valueId.toString());
      rows.add(new RollupRow(valueId, name, totals));
      total = total.plus(totals);
    }
    rows.sort(ROW_ORDER);
    return new RollupSnapshot(projectId, dimension, rows, total);
  }

  /** Drops and recomputes every rollup row of the project. */
  @Transactional
  public int rebuild(UUID projectId) {
    var fresh = compute(projectId);
    int deleted = rollupRepository.deleteByProjectId(projectId);
    rollupRepository.saveAll(
        fresh.entrySet().stream()
            .map(
                e ->
                    new DimensionRollup(
                        projectId,
                        e.getKey().dimension(),
                        e.getKey().dimensionValueId(),
                        e.getValue()))
            .toList());
    log.info(
        "Rebuilt rollups for project {}: {} rows replaced by {}", projectId, deleted, fresh.size());
    return fresh.size();
  }

  /** Projects with at least one active item, the scope of a full rebuild. */
  @Transactional(readOnly = true)
  public List<UUID> activeProjects() {
    return itemRepository.findActiveProjectIds();
  }

  /** Rows whose cached figures differ from a fresh computation by more than the hours tolerance. */
  @Transactional(readOnly = true)
  public List<RollupDrift> detectDrift(UUID projectId) {
    var fresh = compute(projectId);
    var cached = new HashMap<RollupKey, RollupTotals>();
    for (var rollup : rollupRepository.findByProjectId(projectId)) {
      cached.put(
          new RollupKey(rollup.getDimension(), rollup.getDimensionValueId()), rollup.toTotals());
    }

    var keys = new HashSet<RollupKey>(fresh.keySet());
    keys.addAll(cached.keySet());
    var drift = new ArrayList<RollupDrift>();
    for (var key : keys) {
      var expected = fresh.getOrDefault(key, RollupTotals.ZERO);
      var stored = cached.getOrDefault(key, RollupTotals.ZERO);
      if (!stored.matches(expected, properties.hoursTolerance())) {
        drift.add(new RollupDrift(key.dimension(), key.dimensionValueId(), stored, expected));
      }
    }
    drift.sort(
        Comparator.comparing(RollupDrift::dimension)
            .thenComparing(
                d -> d.dimensionValueId() != null ? d.dimensionValueId().toString() : ""));
    if (!drift.isEmpty()) {
      log.warn("Detected {} drifted rollup rows in project {}", drift.size(), projectId);
    }
    return drift;
  }

  private Map<RollupKey, RollupTotals> compute(UUID projectId) {
    var totals = new LinkedHashMap<RollupKey, RollupTotals>();
    for (var item : itemRepository.findByProjectIdAndRetiredFalse(projectId)) {
      var contribution = contributionOf(item);
      accumulate(totals, contribution, RollupTotals.of(contribution));
    }
    return totals;
  }

  private static void accumulate(
      Map<RollupKey, RollupTotals> target, ItemContribution contribution, RollupTotals amount) {
    for (var dimension : DimensionType.values()) {
      if (!dimension.isReportable()) {
        continue;
      }
      target.merge(
          new RollupKey(dimension, contribution.valueFor(dimension)), amount, RollupTotals::plus);
    }
  }

  private void upsert(UUID projectId, RollupKey key, RollupTotals delta) {
    var budget = delta.categoryBudget();
    var earned = delta.categoryEarned();
    rollupRepository.addDelta(
        projectId,
        key.dimension().name(),
        key.dimensionValueId() != null ? key.dimensionValueId().toString() : null,
        delta.itemCount(),
        delta.budgetedHours(),
        delta.earnedHours(),
        budget.receive(),
        budget.install(),
        budget.punch(),
        budget.test(),
        budget.restore(),
        earned.receive(),
        earned.install(),
        earned.punch(),
        earned.test(),
        earned.restore());
  }
}
