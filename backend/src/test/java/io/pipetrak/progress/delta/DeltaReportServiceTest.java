package io.pipetrak.progress.delta;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.pipetrak.progress.config.ProgressProperties;
import io.pipetrak.progress.dimension.DimensionService;
import io.pipetrak.progress.dimension.DimensionType;
import io.pipetrak.progress.exception.InvalidStateException;
import io.pipetrak.progress.item.Item;
import io.pipetrak.progress.item.ItemRepository;
import io.pipetrak.progress.milestone.MilestoneEvent;
import io.pipetrak.progress.milestone.MilestoneEventRepository;
import io.pipetrak.progress.progress.MilestoneValues;
import io.pipetrak.progress.progress.ProgressCalculator;
import io.pipetrak.progress.template.TemplateResolver;
import io.pipetrak.progress.template.TemplateScope;
import io.pipetrak.progress.testutil.Schedules;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class DeltaReportServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final Instant START = Instant.parse("2026-03-02T00:00:00Z");
  private static final Instant END = Instant.parse("2026-03-09T00:00:00Z");

  @Mock private ItemRepository itemRepository;
  @Mock private MilestoneEventRepository eventRepository;
  @Mock private TemplateResolver templateResolver;
  @Mock private DimensionService dimensionService;

  private DeltaReportService service;

  @BeforeEach
  void setUp() {
    service =
        new DeltaReportService(
            itemRepository,
            eventRepository,
            templateResolver,
            dimensionService,
            new DeltaAggregator(new ProgressCalculator(), ProgressProperties.defaults()));
  }

  @Test
  void deltaComesFromWindowEventsAndReplayOnlyFromSettledHistory() {
    var settled = spoolItem(new BigDecimal("45"));
    var changedLater = spoolItem(new BigDecimal("40"));
    var receivedBefore = event(settled, "Receive", START.minus(Duration.ofDays(3)));
    var settledErect = event(settled, "Erect", START.plus(Duration.ofHours(2)));
    var laterErect = event(changedLater, "Erect", START.plus(Duration.ofHours(5)));

    when(itemRepository.findByProjectIdAndRetiredFalse(PROJECT_ID))
        .thenReturn(List.of(settled, changedLater));
    when(templateResolver.resolve(PROJECT_ID, "spool")).thenReturn(Schedules.spool(PROJECT_ID));
    when(dimensionService.names(PROJECT_ID, DimensionType.AREA)).thenReturn(Map.of());
    when(eventRepository.findProjectEventsBetween(PROJECT_ID, START, END))
        .thenReturn(List.of(settledErect, laterErect));
    when(eventRepository.findSettledHistoryBefore(PROJECT_ID, END))
        .thenReturn(List.of(receivedBefore, settledErect));
    when(eventRepository.findItemIdsWithEventsSince(PROJECT_ID, END))
        .thenReturn(List.of(changedLater.getId()));

    var report = service.report(PROJECT_ID, DimensionType.AREA, START, END);

    // Erect on both items; the earlier Receive is history only
    assertThat(report.grandTotal().earnedDeltaTotal()).isEqualByComparingTo("8.0");
    assertThat(report.crossCheck().itemsChecked()).isEqualTo(1);
    assertThat(report.crossCheck().itemsSkipped()).isEqualTo(1);
    assertThat(report.crossCheck().discrepancies()).isEmpty();
    assertThat(report.untrackedProgress()).isEmpty();
  }

  @Test
  void invalidWindowLoadsNothing() {
    assertThatThrownBy(() -> service.report(PROJECT_ID, DimensionType.AREA, END, START))
        .isInstanceOf(InvalidStateException.class);
    verify(eventRepository, never()).findProjectEventsBetween(PROJECT_ID, END, START);
  }

  private static Item spoolItem(BigDecimal cachedPercent) {
    var item =
        new Item(
            PROJECT_ID,
            "spool",
            Map.of("spool_id", UUID.randomUUID().toString()),
            null,
            BigDecimal.TEN);
    ReflectionTestUtils.setField(item, "id", UUID.randomUUID());
    item.applyProgress(cachedPercent, cachedPercent.movePointLeft(1), TemplateScope.DEFAULT);
    return item;
  }

  private static MilestoneEvent event(Item item, String milestone, Instant at) {
    return new MilestoneEvent(
        item.getId(), PROJECT_ID, milestone, null, MilestoneValues.COMPLETE, null, at);
  }
}
