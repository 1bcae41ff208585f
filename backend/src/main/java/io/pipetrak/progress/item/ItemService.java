package io.pipetrak.progress.item;

import io.pipetrak.progress.audit.AuditEventBuilder;
import io.pipetrak.progress.audit.AuditService;
import io.pipetrak.progress.config.ProgressProperties;
import io.pipetrak.progress.dimension.DimensionService;
import io.pipetrak.progress.dimension.DimensionType;
import io.pipetrak.progress.exception.InvalidStateException;
import io.pipetrak.progress.exception.ResourceConflictException;
import io.pipetrak.progress.exception.ResourceNotFoundException;
import io.pipetrak.progress.milestone.MilestoneEvent;
import io.pipetrak.progress.milestone.MilestoneEventRepository;
import io.pipetrak.progress.milestone.MilestoneReplay;
import io.pipetrak.progress.progress.MilestoneValues;
import io.pipetrak.progress.progress.ProgressBreakdown;
import io.pipetrak.progress.progress.ProgressCalculator;
import io.pipetrak.progress.progress.ProgressInvariants;
import io.pipetrak.progress.rollup.RollupService;
import io.pipetrak.progress.template.MilestoneSchedule;
import io.pipetrak.progress.template.ResolvedMilestone;
import io.pipetrak.progress.template.TemplateResolver;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the item write path. Appending a milestone event and refreshing the item's cached map,
 * percent complete and earned hours always happen in one transaction, together with the EAGER
 * rollup update.
 */
@Service
public class ItemService {

  private static final Logger log = LoggerFactory.getLogger(ItemService.class);

  private final ItemRepository itemRepository;
  private final MilestoneEventRepository eventRepository;
  private final TemplateResolver templateResolver;
  private final ProgressCalculator progressCalculator;
  private final RollupService rollupService;
  private final DimensionService dimensionService;
  private final AuditService auditService;
  private final BigDecimal hoursTolerance;

  public ItemService(
      ItemRepository itemRepository,
      MilestoneEventRepository eventRepository,
      TemplateResolver templateResolver,
      ProgressCalculator progressCalculator,
      RollupService rollupService,
      DimensionService dimensionService,
      AuditService auditService,
      ProgressProperties properties) {
    this.itemRepository = itemRepository;
    this.eventRepository = eventRepository;
    this.templateResolver = templateResolver;
    this.progressCalculator = progressCalculator;
    this.rollupService = rollupService;
    this.dimensionService = dimensionService;
    this.auditService = auditService;
    this.hoursTolerance = properties.hoursTolerance();
  }

  /**
   * Creates an item against its resolved schedule. Nonzero initial milestone values are written to
   * the event log as well, so replaying the log reproduces the cached map from the start.
   *
   * @throws ResourceConflictException if the identity key is already used for the item type
   */
  @Transactional
  public Item createItem(UUID projectId, NewItem request, UUID actorId) {
    String itemType = TemplateResolver.normalizeItemType(request.itemType());
    var schedule = templateResolver.resolve(projectId, itemType);

    if (request.identityKey() == null || request.identityKey().isEmpty()) {
      throw new InvalidStateException("Invalid item", "Identity key is required");
    }
    BigDecimal budget = request.budgetedHours() != null ? request.budgetedHours() : BigDecimal.ZERO;
    if (budget.signum() < 0) {
      throw new InvalidStateException("Invalid budget", "Budgeted hours must not be negative");
    }

    var item = new Item(projectId, itemType, request.identityKey(), request.attributes(), budget);
    item.assignDimensions(
        dimensionService.requireValue(projectId, request.areaId(), DimensionType.AREA),
        dimensionService.requireValue(projectId, request.systemId(), DimensionType.SYSTEM),
        dimensionService.requireValue(
            projectId, request.testPackageId(), DimensionType.TEST_PACKAGE),
        dimensionService.requireValue(projectId, request.drawingId(), DimensionType.DRAWING),
        dimensionService.requireValue(projectId, request.welderId(), DimensionType.WELDER));

    var initial = new LinkedHashMap<String, BigDecimal>();
    if (request.initialMilestones() != null) {
      request
          .initialMilestones()
          .forEach(
              (name, raw) -> {
                var milestone = requireMilestone(schedule, name);
                var value = MilestoneValues.normalize(raw, milestone.kind());
                requireWelderIfGated(item, milestone, value);
                if (value.signum() > 0) {
                  initial.put(milestone.name(), value);
                }
              });
    }

    Item saved;
    try {
      saved = itemRepository.saveAndFlush(item);
    } catch (DataIntegrityViolationException e) {
      throw new ResourceConflictException(
          "Item exists",
          "An item of type '"
              + itemType
              + "' with this identity key already exists in the project");
    }

    Instant now = Instant.now();
    initial.forEach(
        (name, value) -> {
          saved.putMilestone(name, value);
          eventRepository.save(
              new MilestoneEvent(saved.getId(), projectId, name, null, value, actorId, now));
        });
    refresh(saved, schedule);
    rollupService.applyChange(null, rollupService.contributionOf(saved));

    log.info(
        "Created {} item {} in project {} with {} initial milestones",
        itemType,
        saved.getId(),
        projectId,
        initial.size());
    return saved;
  }

  /**
   * Records a new value for one milestone: appends the event, refreshes the cached projection and
   * applies the rollup difference. Writing the value the item already holds is a no-op.
   *
   * @throws InvalidStateException for an unknown milestone, a malformed value, a retired item or a
   *     welder-gated milestone without a welder
   */
  @Transactional
  public MilestoneUpdate recordMilestone(
      UUID projectId,
      UUID itemId,
      String milestoneName,
      Object rawValue,
      UUID welderId,
      UUID actorId) {
    var item = requireItem(projectId, itemId);
    requireActive(item);
    var schedule = templateResolver.resolve(projectId, item.getItemType());
    var milestone = requireMilestone(schedule, milestoneName);
    var value = MilestoneValues.normalize(rawValue, milestone.kind());

    var before = rollupService.contributionOf(item);
    boolean welderChanged = welderId != null && !welderId.equals(item.getWelderId());
    if (welderChanged) {
      item.assignWelder(dimensionService.requireValue(projectId, welderId, DimensionType.WELDER));
    }
    requireWelderIfGated(item, milestone, value);

    BigDecimal previous = item.milestoneValue(milestone.name());
    BigDecimal effectivePrevious = previous != null ? previous : BigDecimal.ZERO;
    if (effectivePrevious.compareTo(value) == 0) {
      var breakdown =
          progressCalculator.calculate(schedule, item.milestoneValues(), item.getBudgetedHours());
      if (welderChanged) {
        rollupService.applyChange(before, rollupService.contributionOf(item));
      }
      log.debug("Milestone {} of item {} already at {}", milestone.name(), itemId, value);
      return new MilestoneUpdate(item, null, breakdown);
    }

    item.putMilestone(milestone.name(), value);
    var event =
        eventRepository.save(
            new MilestoneEvent(
                itemId, projectId, milestone.name(), previous, value, actorId, Instant.now()));
    var breakdown = refresh(item, schedule);
    rollupService.applyChange(before, rollupService.contributionOf(item));

    log.info(
        "Recorded milestone {} = {} on item {} (was {}), percent complete {}",
        milestone.name(),
        value.toPlainString(),
        itemId,
        previous,
        breakdown.percentComplete());
    return new MilestoneUpdate(item, event, breakdown);
  }

  /** Current figures of one item, computed from its cached milestone map. */
  @Transactional(readOnly = true)
  public ItemProgress getProgress(UUID projectId, UUID itemId) {
    var item = requireItem(projectId, itemId);
    var schedule = templateResolver.resolve(projectId, item.getItemType());
    var breakdown =
        progressCalculator.calculate(schedule, item.milestoneValues(), item.getBudgetedHours());
    ProgressInvariants.requireCategoriesReconcile(item.getId(), breakdown, hoursTolerance);
    return new ItemProgress(item, schedule, breakdown);
  }

  @Transactional(readOnly = true)
  public Page<Item> listItems(UUID projectId, String itemType, Pageable pageable) {
    String type = itemType != null ? TemplateResolver.normalizeItemType(itemType) : null;
    return itemRepository.findByFilter(projectId, type, pageable);
  }

  @Transactional(readOnly = true)
  public List<MilestoneEvent> listEvents(UUID projectId, UUID itemId) {
    requireItem(projectId, itemId);
    return eventRepository.findByItemIdOrdered(itemId);
  }

  @Transactional
  public Item retireItem(UUID projectId, UUID itemId, UUID actorId) {
    var item = requireItem(projectId, itemId);
    requireActive(item);
    var before = rollupService.contributionOf(item);
    item.retire();
    rollupService.applyChange(before, null);
    log.info("Retired item {} in project {}", itemId, projectId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("item.retired")
            .entityType("item")
            .entityId(itemId)
            .actorId(actorId)
            .details(Map.of("project_id", projectId.toString(), "item_type", item.getItemType()))
            .build());
    return item;
  }

  /**
   * Replays the item's whole event log from an empty map and overwrites the cached projection with
   * the result.
   */
  @Transactional
  public ProjectionRebuild rebuildProjection(UUID projectId, UUID itemId, UUID actorId) {
    var item = requireItem(projectId, itemId);
    var schedule = templateResolver.resolve(projectId, item.getItemType());
    var previous = item.milestoneValues();
    var rebuilt = MilestoneReplay.replay(eventRepository.findByItemIdOrdered(itemId));
    boolean drifted = !MilestoneReplay.sameValues(previous, rebuilt);

    var before = rollupService.contributionOf(item);
    item.replaceMilestones(rebuilt);
    var breakdown = refresh(item, schedule);
    rollupService.applyChange(before, rollupService.contributionOf(item));

    if (drifted) {
      log.warn(
          "Rebuilt drifted projection of item {}: cached {} replaced by {}",
          itemId,
          previous,
          rebuilt);
    } else {
      log.info("Rebuilt projection of item {}; no drift", itemId);
    }

    var details = new LinkedHashMap<String, Object>();
    details.put("project_id", projectId.toString());
    details.put("drifted", drifted);
    details.put("percent_complete", breakdown.percentComplete().toPlainString());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("item.projection_rebuilt")
            .entityType("item")
            .entityId(itemId)
            .actorId(actorId)
            .details(details)
            .build());
    return new ProjectionRebuild(item, drifted, previous, rebuilt, breakdown);
  }

  /**
   * Corrects a logged event by appending a compensating event that sets the milestone to {@code
   * correctedValue}. The corrected event itself is left untouched.
   */
  @Transactional
  public MilestoneUpdate correctEvent(
      UUID eventId, Object correctedValue, String reason, UUID actorId) {
    if (reason == null || reason.isBlank()) {
      throw new InvalidStateException("Invalid correction", "A correction reason is required");
    }
    var original =
        eventRepository
            .findById(eventId)
            .orElseThrow(() -> new ResourceNotFoundException("MilestoneEvent", eventId));
    var item = requireItem(original.getProjectId(), original.getItemId());
    requireActive(item);
    var schedule = templateResolver.resolve(item.getProjectId(), item.getItemType());
    var milestone = requireMilestone(schedule, original.getMilestoneName());
    var value = MilestoneValues.normalize(correctedValue, milestone.kind());
    requireWelderIfGated(item, milestone, value);

    var before = rollupService.contributionOf(item);
    BigDecimal current = item.milestoneValue(milestone.name());
    var correction =
        eventRepository.save(
            MilestoneEvent.correction(
                original, current, value, reason.trim(), actorId, Instant.now()));
    item.putMilestone(milestone.name(), value);
    var breakdown = refresh(item, schedule);
    rollupService.applyChange(before, rollupService.contributionOf(item));

    log.info(
        "Corrected event {} on item {}: {} set to {} ({})",
        eventId,
        item.getId(),
        milestone.name(),
        value.toPlainString(),
        reason);

    var details = new LinkedHashMap<String, Object>();
    details.put("item_id", item.getId().toString());
    details.put("correction_event_id", correction.getId().toString());
    details.put("milestone", milestone.name());
    details.put("from", current != null ? current.toPlainString() : null);
    details.put("to", value.toPlainString());
    details.put("reason", reason.trim());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("milestone_event.corrected")
            .entityType("milestone_event")
            .entityId(eventId)
            .actorId(actorId)
            .details(details)
            .build());
    return new MilestoneUpdate(item, correction, breakdown);
  }

  /**
   * Re-derives cached percent complete and earned hours of every active item of the pair, e.g.
   * after a schedule change. Rollups are left to the caller.
   */
  @Transactional
  public int recalculateItems(UUID projectId, String itemType) {
    var items =
        itemRepository.findByProjectIdAndItemTypeAndRetiredFalse(
            projectId, TemplateResolver.normalizeItemType(itemType));
    items.forEach(item -> refresh(item, templateResolver.resolve(projectId, item.getItemType())));
    log.info("Recalculated {} {} items in project {}", items.size(), itemType, projectId);
    return items.size();
  }

  /** Same as {@link #recalculateItems} for every active item of the project. */
  @Transactional
  public int recalculateProject(UUID projectId) {
    var items = itemRepository.findByProjectIdAndRetiredFalse(projectId);
    items.forEach(item -> refresh(item, templateResolver.resolve(projectId, item.getItemType())));
    log.info("Recalculated {} items in project {}", items.size(), projectId);
    return items.size();
  }

  private ProgressBreakdown refresh(Item item, MilestoneSchedule schedule) {
    var breakdown =
        progressCalculator.calculate(schedule, item.milestoneValues(), item.getBudgetedHours());
    ProgressInvariants.requireCategoriesReconcile(item.getId(), breakdown, hoursTolerance);
    item.applyProgress(breakdown.percentComplete(), breakdown.earnedHours(), schedule.scope());
    return breakdown;
  }

  private Item requireItem(UUID projectId, UUID itemId) {
    return itemRepository
        .findByIdAndProjectId(itemId, projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Item", itemId));
  }

  private static void requireActive(Item item) {
    if (item.isRetired()) {
      throw new InvalidStateException(
          "Item retired", "Item " + item.getId() + " is retired and cannot be changed");
    }
  }

  private static ResolvedMilestone requireMilestone(MilestoneSchedule schedule, String name) {
    return schedule
        .find(name)
        .orElseThrow(
            () ->
                new InvalidStateException(
                    "Unknown milestone",
                    "Milestone '"
                        + name
                        + "' is not part of the schedule for item type '"
                        + schedule.itemType()
                        + "'"));
  }

  private static void requireWelderIfGated(
      Item item, ResolvedMilestone milestone, BigDecimal value) {
    if (milestone.requiresWelder() && value.signum() > 0 && item.getWelderId() == null) {
      throw new InvalidStateException(
          "Welder required",
          "Milestone '" + milestone.name() + "' can only be recorded once a welder is assigned");
    }
  }
}
