package io.pipetrak.progress.delta;

import io.pipetrak.progress.dimension.DimensionService;
import io.pipetrak.progress.dimension.DimensionType;
import io.pipetrak.progress.exception.InvalidStateException;
import io.pipetrak.progress.item.ItemRepository;
import io.pipetrak.progress.milestone.MilestoneEvent;
import io.pipetrak.progress.milestone.MilestoneEventRepository;
import io.pipetrak.progress.template.TemplateResolver;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Loads the log and item state a delta report needs and hands them to {@link DeltaAggregator}. */
@Service
public class DeltaReportService {

  private static final Logger log = LoggerFactory.getLogger(DeltaReportService.class);

  private final ItemRepository itemRepository;
  private final MilestoneEventRepository eventRepository;
  private final TemplateResolver templateResolver;
  private final DimensionService dimensionService;
  private final DeltaAggregator deltaAggregator;

  public DeltaReportService(
      ItemRepository itemRepository,
      MilestoneEventRepository eventRepository,
      TemplateResolver templateResolver,
      DimensionService dimensionService,
      DeltaAggregator deltaAggregator) {
    this.itemRepository = itemRepository;
    this.eventRepository = eventRepository;
    this.templateResolver = templateResolver;
    this.dimensionService = dimensionService;
    this.deltaAggregator = deltaAggregator;
  }

  @Transactional(readOnly = true)
  public DeltaReport report(UUID projectId, DimensionType dimension, Instant start, Instant end) {
    if (!dimension.isReportable()) {
      throw new InvalidStateException(
          "Invalid dimension", "Dimension " + dimension + " is not available for reporting");
    }
    if (start == null || end == null || !start.isBefore(end)) {
      throw new InvalidStateException("Invalid window", "Window start must be before window end");
    }

    var windowByItem = groupByItem(eventRepository.findProjectEventsBetween(projectId, start, end));
    // full history only for items the cross-check replays
    var historyByItem = groupByItem(eventRepository.findSettledHistoryBefore(projectId, end));
    var changedSinceEnd = new HashSet<>(eventRepository.findItemIdsWithEventsSince(projectId, end));

    var items = new ArrayList<DeltaItem>();
    for (var item : itemRepository.findByProjectIdAndRetiredFalse(projectId)) {
      items.add(
          new DeltaItem(
              item.getId(),
              item.getItemType(),
              item.dimensionValue(dimension),
              item.getBudgetedHours(),
              item.getPercentComplete(),
              templateResolver.resolve(projectId, item.getItemType()),
              windowByItem.getOrDefault(item.getId(), List.of()),
              historyByItem.getOrDefault(item.getId(), List.of()),
              changedSinceEnd.contains(item.getId())));
    }

    var report =
        deltaAggregator.aggregate(
            projectId, dimension, start, end, items, dimensionService.names(projectId, dimension));
    log.debug(
        "Delta report for project {} by {} over [{}, {}): {} rows, {} earned hours",
        projectId,
        dimension,
        start,
        end,
        report.rows().size(),
        report.grandTotal().earnedDeltaTotal());
    return report;
  }

  private static Map<UUID, List<MilestoneEvent>> groupByItem(List<MilestoneEvent> events) {
    var byItem = new HashMap<UUID, List<MilestoneEvent>>();
    for (var event : events) {
      byItem.computeIfAbsent(event.getItemId(), k -> new ArrayList<>()).add(event);
    }
    return byItem;
  }
}
