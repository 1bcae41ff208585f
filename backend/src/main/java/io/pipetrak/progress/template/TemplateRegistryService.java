package io.pipetrak.progress.template;

import io.pipetrak.progress.audit.AuditEventBuilder;
import io.pipetrak.progress.audit.AuditService;
import io.pipetrak.progress.config.ProgressProperties;
import io.pipetrak.progress.exception.InvalidStateException;
import io.pipetrak.progress.exception.ResourceConflictException;
import io.pipetrak.progress.exception.ResourceNotFoundException;
import io.pipetrak.progress.item.ItemService;
import io.pipetrak.progress.rollup.RollupService;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Write surface over milestone schedules. Every write re-validates each schedule the affected
 * (project, item type) pairs resolve to before anything is persisted, then evicts the resolver
 * cache.
 */
@Service
public class TemplateRegistryService {

  private static final Logger log = LoggerFactory.getLogger(TemplateRegistryService.class);

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
  private static final int WEIGHT_SCALE = 2;

  private final MilestoneTemplateRepository templateRepository;
  private final TemplateResolver templateResolver;
  private final ItemService itemService;
  private final RollupService rollupService;
  private final AuditService auditService;
  private final BigDecimal weightTolerance;

  public TemplateRegistryService(
      MilestoneTemplateRepository templateRepository,
      TemplateResolver templateResolver,
      ItemService itemService,
      RollupService rollupService,
      AuditService auditService,
      ProgressProperties properties) {
    this.templateRepository = templateRepository;
    this.templateResolver = templateResolver;
    this.itemService = itemService;
    this.rollupService = rollupService;
    this.auditService = auditService;
    this.weightTolerance = properties.weightTolerance();
  }

  /** Item types that have a default schedule, alphabetically. */
  @Transactional(readOnly = true)
  public List<String> listItemTypes() {
    return templateRepository.findAllDefaults().stream()
        .map(MilestoneTemplate::getItemType)
        .distinct()
        .sorted()
        .toList();
  }

  @Transactional(readOnly = true)
  public MilestoneSchedule getDefaultSchedule(String itemType) {
    return templateResolver.resolve(null, itemType);
  }

  @Transactional(readOnly = true)
  public MilestoneSchedule resolve(UUID projectId, String itemType) {
    return templateResolver.resolve(projectId, itemType);
  }

  /** Timestamp of the newest override row of the pair, empty when the pair has no overrides. */
  @Transactional(readOnly = true)
  public Instant lastOverrideUpdate(UUID projectId, String itemType) {
    return templateRepository
        .findLastOverrideUpdate(projectId, TemplateResolver.normalizeItemType(itemType))
        .orElse(null);
  }

  /**
   * Replaces the default schedule of an item type. Every project that overrides the type must
   * still resolve to a valid schedule against the new defaults, otherwise nothing is written.
   */
  @Transactional
  public MilestoneSchedule upsertDefaultSchedule(
      String itemType, List<MilestoneDefinition> definitions, UUID actorId) {
    String type = TemplateResolver.normalizeItemType(itemType);
    requireDistinctNames(definitions);

    var defaults = new ArrayList<ResolvedMilestone>(definitions.size());
    int order = 1;
    for (var def : definitions) {
      if (def.kind() == null || def.category() == null) {
        throw new InvalidStateException(
            "Invalid milestone",
            "Default milestone '" + def.name() + "' requires a completion kind and a category");
      }
      requireWeightInRange(def);
      defaults.add(
          new ResolvedMilestone(
              def.name().trim(),
              def.weight(),
              def.kind(),
              def.category(),
              order++,
              def.requiresWelder()));
    }
    var schedule = TemplateResolver.merge(defaults, List.of(), null, type, weightTolerance);

    var affectedProjects = templateRepository.findProjectsWithOverrides(type);
    for (UUID projectId : affectedProjects) {
      var overrides =
          templateRepository.findOverrides(projectId, type).stream()
              .map(MilestoneTemplate::toResolved)
              .toList();
      TemplateResolver.merge(defaults, overrides, projectId, type, weightTolerance);
    }

    boolean existed = !templateRepository.findDefaults(type).isEmpty();
    templateRepository.deleteDefaults(type);
    templateRepository.saveAll(
        defaults.stream()
            .map(
                m ->
                    new MilestoneTemplate(
                        null,
                        type,
                        m.name(),
                        m.weight(),
                        m.kind(),
                        m.category(),
                        m.order(),
                        m.requiresWelder()))
            .toList());
    templateResolver.invalidateItemType(type);

    log.info(
        "Updated default schedule for item type {} ({} milestones, {} override sets revalidated)",
        type,
        defaults.size(),
        affectedProjects.size());

    var details = new LinkedHashMap<String, Object>();
    details.put("item_type", type);
    details.put("created", !existed);
    details.put("milestones", describe(schedule.milestones()));
    details.put("revalidated_projects", affectedProjects.size());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("milestone_schedule.default_updated")
            .entityType("milestone_schedule")
            .entityId(scheduleEntityId(null, type))
            .actorId(actorId)
            .details(details)
            .build());

    return schedule;
  }

  /**
   * Replaces a project's overrides for one item type. An empty list removes them.
   *
   * @param expectedLastUpdated when set, the write fails with a conflict if the stored overrides
   *     were changed after this instant
   * @param recalculateExisting re-derives cached progress of the pair's items and rebuilds the
   *     project's rollups
   */
  @Transactional
  public OverrideResult putProjectOverrides(
      UUID projectId,
      String itemType,
      List<MilestoneDefinition> overrides,
      Instant expectedLastUpdated,
      boolean recalculateExisting,
      UUID actorId) {
    String type = TemplateResolver.normalizeItemType(itemType);
    requireDistinctNames(overrides);

    if (expectedLastUpdated != null) {
      var stored = templateRepository.findLastOverrideUpdate(projectId, type);
      if (stored.isPresent() && stored.get().isAfter(expectedLastUpdated)) {
        throw new ResourceConflictException(
            "Schedule modified",
            "Overrides for item type '"
                + type
                + "' were modified at "
                + stored.get()
                + ", after the expected "
                + expectedLastUpdated);
      }
    }

    var defaults = loadDefaults(type);
    var resolvedOverrides = new ArrayList<ResolvedMilestone>(overrides.size());
    for (var def : overrides) {
      requireWeightInRange(def);
      var base =
          defaults.stream()
              .filter(d -> d.matches(def.name()))
              .findFirst()
              .orElseThrow(
                  () ->
                      new InvalidStateException(
                          "Invalid milestone name",
                          "Override milestone '"
                              + def.name()
                              + "' does not exist in the default schedule for item type '"
                              + type
                              + "'"));
      resolvedOverrides.add(
          new ResolvedMilestone(
              base.name(),
              def.weight(),
              def.kind() != null ? def.kind() : base.kind(),
              def.category() != null ? def.category() : base.category(),
              base.order(),
              base.requiresWelder()));
    }
    var schedule =
        TemplateResolver.merge(defaults, resolvedOverrides, projectId, type, weightTolerance);

    templateRepository.deleteOverrides(projectId, type);
    templateRepository.saveAll(
        resolvedOverrides.stream()
            .map(
                m ->
                    new MilestoneTemplate(
                        projectId,
                        type,
                        m.name(),
                        m.weight(),
                        m.kind(),
                        m.category(),
                        m.order(),
                        m.requiresWelder()))
            .toList());
    templateResolver.invalidate(projectId, type);

    int recalculated = 0;
    if (recalculateExisting) {
      recalculated = itemService.recalculateItems(projectId, type);
      rollupService.rebuild(projectId);
    }

    log.info(
        "Updated overrides for project {} item type {}: {} overrides, {} items recalculated",
        projectId,
        type,
        resolvedOverrides.size(),
        recalculated);

    var details = new LinkedHashMap<String, Object>();
    details.put("project_id", projectId.toString());
    details.put("item_type", type);
    details.put("overrides", describe(resolvedOverrides));
    details.put("recalculated_items", recalculated);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("milestone_schedule.override_updated")
            .entityType("milestone_schedule")
            .entityId(scheduleEntityId(projectId, type))
            .actorId(actorId)
            .details(details)
            .build());

    return new OverrideResult(schedule, recalculated);
  }

  @Transactional
  public void deleteProjectOverrides(UUID projectId, String itemType, UUID actorId) {
    String type = TemplateResolver.normalizeItemType(itemType);
    int deleted = templateRepository.deleteOverrides(projectId, type);
    if (deleted == 0) {
      throw ResourceNotFoundException.withDetail(
          "Overrides not found",
          "Project " + projectId + " has no overrides for item type '" + type + "'");
    }
    templateResolver.invalidate(projectId, type);
    log.info("Deleted {} overrides for project {} item type {}", deleted, projectId, type);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("milestone_schedule.override_deleted")
            .entityType("milestone_schedule")
            .entityId(scheduleEntityId(projectId, type))
            .actorId(actorId)
            .details(Map.of("project_id", projectId.toString(), "item_type", type))
            .build());
  }

  /**
   * Copies every default schedule into override rows of the project so it can be edited locally.
   *
   * @throws ResourceConflictException if the project already has overrides
   */
  @Transactional
  public int cloneDefaultsForProject(UUID projectId, UUID actorId) {
    if (templateRepository.existsByProjectId(projectId)) {
      throw new ResourceConflictException(
          "Overrides exist", "Project " + projectId + " already has milestone overrides");
    }
    var defaults = templateRepository.findAllDefaults();
    templateRepository.saveAll(
        defaults.stream()
            .map(
                d ->
                    new MilestoneTemplate(
                        projectId,
                        d.getItemType(),
                        d.getMilestoneName(),
                        d.getWeight(),
                        d.getCompletionKind(),
                        d.getCategory(),
                        d.getMilestoneOrder(),
                        d.isRequiresWelder()))
            .toList());
    defaults.stream()
        .map(MilestoneTemplate::getItemType)
        .distinct()
        .forEach(type -> templateResolver.invalidate(projectId, type));

    log.info("Cloned {} default milestone rows into project {}", defaults.size(), projectId);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("milestone_schedule.cloned")
            .entityType("milestone_schedule")
            .entityId(projectId)
            .actorId(actorId)
            .details(Map.of("project_id", projectId.toString(), "rows", defaults.size()))
            .build());
    return defaults.size();
  }

  private List<ResolvedMilestone> loadDefaults(String itemType) {
    var defaults = templateRepository.findDefaults(itemType);
    if (defaults.isEmpty()) {
      throw ResourceNotFoundException.withDetail(
          "Milestone schedule not found",
          "No default milestone schedule exists for item type '" + itemType + "'");
    }
    return defaults.stream().map(MilestoneTemplate::toResolved).toList();
  }

  private static void requireDistinctNames(List<MilestoneDefinition> definitions) {
    var seen = new HashSet<String>();
    for (var def : definitions) {
      if (def.name() == null || def.name().isBlank()) {
        throw new InvalidStateException("Invalid milestone", "Milestone name is required");
      }
      if (!seen.add(def.name().trim().toLowerCase(Locale.ROOT))) {
        throw new InvalidStateException(
            "Duplicate milestone", "Milestone '" + def.name() + "' appears more than once");
      }
    }
  }

  private static void requireWeightInRange(MilestoneDefinition def) {
    if (def.weight() == null
        || def.weight().signum() < 0
        || def.weight().compareTo(HUNDRED) > 0) {
      throw new InvalidStateException(
          "Invalid weight", "Weight of milestone '" + def.name() + "' must be between 0 and 100");
    }
    // stored as NUMERIC(5, 2)
    if (def.weight().stripTrailingZeros().scale() > WEIGHT_SCALE) {
      throw new InvalidStateException(
          "Invalid weight",
          "Weight of milestone '"
              + def.name()
              + "' must have at most "
              + WEIGHT_SCALE
              + " decimal places (got "
              + def.weight().toPlainString()
              + ")");
    }
  }

  private static List<Map<String, Object>> describe(List<ResolvedMilestone> milestones) {
    return milestones.stream()
        .map(
            m -> {
              Map<String, Object> entry = new LinkedHashMap<>();
              entry.put("name", m.name());
              entry.put("weight", m.weight().toPlainString());
              entry.put("kind", m.kind().name());
              entry.put("category", m.category().code());
              return entry;
            })
        .toList();
  }

  /** Stable audit entity id for a (project, item type) schedule. */
  static UUID scheduleEntityId(UUID projectId, String itemType) {
    String key = (projectId != null ? projectId.toString() : "default") + ":" + itemType;
    return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
  }

  public record OverrideResult(MilestoneSchedule schedule, int recalculatedItems) {}
}
