package io.pipetrak.progress.template;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.pipetrak.progress.config.ProgressProperties;
import io.pipetrak.progress.exception.InvalidStateException;
import io.pipetrak.progress.exception.ResourceNotFoundException;
import io.pipetrak.progress.progress.ProgressInvariants;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Resolves the milestone schedule of a (project, item type) by merging the type's default rows with
 * the project's overrides. Results are cached per key in Caffeine and evicted whenever the registry
 * writes either tier.
 */
@Service
public class TemplateResolver {

  private static final Logger log = LoggerFactory.getLogger(TemplateResolver.class);

  private final MilestoneTemplateRepository templateRepository;
  private final BigDecimal weightTolerance;
  private final Cache<ScheduleKey, MilestoneSchedule> cache;

  public TemplateResolver(
      MilestoneTemplateRepository templateRepository, ProgressProperties properties) {
    this.templateRepository = templateRepository;
    this.weightTolerance = properties.weightTolerance();
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.resolverCache().maximumSize())
            .expireAfterWrite(properties.resolverCache().expireAfterWrite())
            .build();
  }

  /**
   * Returns the resolved schedule. A null project id resolves the plain default schedule.
   *
   * @throws ResourceNotFoundException if the item type has no default schedule
   */
  public MilestoneSchedule resolve(UUID projectId, String itemType) {
    var key = new ScheduleKey(projectId, normalizeItemType(itemType));
    return cache.get(key, this::load);
  }

  public void invalidate(UUID projectId, String itemType) {
    var key = new ScheduleKey(projectId, normalizeItemType(itemType));
    cache.invalidate(key);
    afterCommit(() -> cache.invalidate(key));
  }

  /** Evicts every cached schedule of the item type, defaults and all project resolutions. */
  public void invalidateItemType(String itemType) {
    String normalized = normalizeItemType(itemType);
    Runnable evict = () -> cache.asMap().keySet().removeIf(k -> k.itemType().equals(normalized));
    evict.run();
    afterCommit(evict);
  }

  public void invalidateAll() {
    cache.invalidateAll();
    afterCommit(cache::invalidateAll);
  }

  /**
   * The single two-tier merge: every default milestone is kept in default order; an override
   * matched by case-insensitive name replaces its weight, kind and category. Overrides naming no
   * default milestone are rejected, and the merged weights must sum to 100.
   *
   * @throws InvalidStateException if an override names a milestone the defaults do not have
   * @throws io.pipetrak.progress.exception.SchemaInvalidException if weights do not sum to 100
   */
  public static MilestoneSchedule merge(
      List<ResolvedMilestone> defaults,
      List<ResolvedMilestone> overrides,
      UUID projectId,
      String itemType,
      BigDecimal tolerance) {
    for (var override : overrides) {
      boolean known = defaults.stream().anyMatch(d -> d.matches(override.name()));
      if (!known) {
        throw new InvalidStateException(
            "Invalid milestone name",
            "Override milestone '"
                + override.name()
                + "' does not exist in the default schedule for item type '"
                + itemType
                + "'");
      }
    }

    var merged = new ArrayList<ResolvedMilestone>(defaults.size());
    defaults.stream()
        .sorted(Comparator.comparingInt(ResolvedMilestone::order))
        .forEach(
            def -> {
              var override =
                  overrides.stream().filter(o -> o.matches(def.name())).findFirst().orElse(null);
              if (override == null) {
                merged.add(def);
              } else {
                merged.add(
                    new ResolvedMilestone(
                        def.name(),
                        override.weight(),
                        override.kind(),
                        override.category(),
                        def.order(),
                        def.requiresWelder()));
              }
            });

    var scope =
        projectId != null && !overrides.isEmpty()
            ? TemplateScope.PROJECT_OVERRIDE
            : TemplateScope.DEFAULT;
    var schedule = new MilestoneSchedule(projectId, itemType, scope, merged);
    ProgressInvariants.requireWeightsSumTo100(schedule, tolerance);
    return schedule;
  }

  public static String normalizeItemType(String itemType) {
    if (itemType == null || itemType.isBlank()) {
      throw new InvalidStateException("Invalid item type", "Item type is required");
    }
    return itemType.trim().toLowerCase(Locale.ROOT);
  }

  private MilestoneSchedule load(ScheduleKey key) {
    var defaults = templateRepository.findDefaults(key.itemType());
    if (defaults.isEmpty()) {
      throw ResourceNotFoundException.withDetail(
          "Milestone schedule not found",
          "No default milestone schedule exists for item type '" + key.itemType() + "'");
    }
    List<MilestoneTemplate> overrides =
        key.projectId() != null
            ? templateRepository.findOverrides(key.projectId(), key.itemType())
            : List.of();
    var schedule =
        merge(
            defaults.stream().map(MilestoneTemplate::toResolved).toList(),
            overrides.stream().map(MilestoneTemplate::toResolved).toList(),
            key.projectId(),
            key.itemType(),
            weightTolerance);
    log.debug(
        "Resolved schedule: project={}, itemType={}, scope={}, milestones={}",
        key.projectId(),
        key.itemType(),
        schedule.scope(),
        schedule.milestones().size());
    return schedule;
  }

  private static void afterCommit(Runnable action) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              action.run();
            }
          });
    }
  }

  private record ScheduleKey(UUID projectId, String itemType) {}
}
