package io.pipetrak.progress.item;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.pipetrak.progress.audit.AuditEventRecord;
import io.pipetrak.progress.audit.AuditService;
import io.pipetrak.progress.config.ProgressProperties;
import io.pipetrak.progress.dimension.DimensionService;
import io.pipetrak.progress.dimension.DimensionType;
import io.pipetrak.progress.exception.InvalidStateException;
import io.pipetrak.progress.exception.ResourceConflictException;
import io.pipetrak.progress.milestone.MilestoneEvent;
import io.pipetrak.progress.milestone.MilestoneEventRepository;
import io.pipetrak.progress.milestone.MilestoneReplay;
import io.pipetrak.progress.progress.MilestoneValues;
import io.pipetrak.progress.progress.ProgressCalculator;
import io.pipetrak.progress.rollup.RollupService;
import io.pipetrak.progress.template.TemplateResolver;
import io.pipetrak.progress.testutil.Schedules;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class ItemServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final UUID ITEM_ID = UUID.randomUUID();
  private static final UUID ACTOR_ID = UUID.randomUUID();

  @Mock private ItemRepository itemRepository;
  @Mock private MilestoneEventRepository eventRepository;
  @Mock private TemplateResolver templateResolver;
  @Mock private RollupService rollupService;
  @Mock private DimensionService dimensionService;
  @Mock private AuditService auditService;

  private ItemService service;

  @BeforeEach
  void setUp() {
    service =
        new ItemService(
            itemRepository,
            eventRepository,
            templateResolver,
            new ProgressCalculator(),
            rollupService,
            dimensionService,
            auditService,
            ProgressProperties.defaults());
  }

  @Test
  void recordMilestoneAppendsEventAndRefreshesCache() {
    var item = spoolItem();
    stubItem(item, "spool");
    stubEventSave();

    var update = service.recordMilestone(PROJECT_ID, ITEM_ID, "erect", true, null, ACTOR_ID);

    assertThat(update.changed()).isTrue();
    assertThat(update.event().getMilestoneName()).isEqualTo("Erect");
    assertThat(update.event().getPreviousValue()).isNull();
    assertThat(update.event().getNewValue()).isEqualByComparingTo("100");
    assertThat(item.getPercentComplete()).isEqualByComparingTo("40");
    assertThat(item.getEarnedHours()).isEqualByComparingTo("4");
    assertThat(item.milestoneValue("Erect")).isEqualByComparingTo("100");
    verify(rollupService).applyChange(any(), any());
  }

  @Test
  void recordingTheCurrentValueAppendsNothing() {
    var item = spoolItem();
    item.putMilestone("Erect", MilestoneValues.COMPLETE);
    stubItem(item, "spool");

    var update = service.recordMilestone(PROJECT_ID, ITEM_ID, "Erect", 1, null, ACTOR_ID);

    assertThat(update.changed()).isFalse();
    assertThat(update.breakdown().percentComplete()).isEqualByComparingTo("40");
    verify(eventRepository, never()).save(any());
  }

  @Test
  void clearingAnUnsetMilestoneAppendsNothing() {
    stubItem(spoolItem(), "spool");

    var update = service.recordMilestone(PROJECT_ID, ITEM_ID, "Punch", false, null, ACTOR_ID);

    assertThat(update.changed()).isFalse();
    verify(eventRepository, never()).save(any());
  }

  @Test
  void clearingMatchesCachedNameIgnoringCase() {
    var item = spoolItem();
    item.putMilestone("erect", MilestoneValues.COMPLETE);
    stubItem(item, "spool");
    stubEventSave();

    var update = service.recordMilestone(PROJECT_ID, ITEM_ID, "Erect", false, null, ACTOR_ID);

    assertThat(update.changed()).isTrue();
    assertThat(update.event().getPreviousValue()).isEqualByComparingTo("100");
    assertThat(update.event().getNewValue()).isEqualByComparingTo("0");
    assertThat(item.milestoneValues()).containsOnlyKeys("Erect");
    assertThat(item.getPercentComplete()).isEqualByComparingTo("0");
  }

  @Test
  void settingCachedValueUnderDifferentCaseAppendsNothing() {
    var item = spoolItem();
    item.putMilestone("erect", MilestoneValues.COMPLETE);
    stubItem(item, "spool");

    var update = service.recordMilestone(PROJECT_ID, ITEM_ID, "ERECT", true, null, ACTOR_ID);

    assertThat(update.changed()).isFalse();
    assertThat(item.milestoneValues()).hasSize(1);
    verify(eventRepository, never()).save(any());
  }

  @Test
  void replayingLoggedEventsReproducesCachedMilestones() {
    var logged = new ArrayList<MilestoneEvent>();
    when(templateResolver.resolve(PROJECT_ID, "spool")).thenReturn(Schedules.spool(PROJECT_ID));
    when(itemRepository.saveAndFlush(any(Item.class)))
        .thenAnswer(
            inv -> {
              Item saved = inv.getArgument(0);
              ReflectionTestUtils.setField(saved, "id", ITEM_ID);
              return saved;
            });
    when(eventRepository.save(any(MilestoneEvent.class)))
        .thenAnswer(
            inv -> {
              MilestoneEvent event = inv.getArgument(0);
              ReflectionTestUtils.setField(event, "id", UUID.randomUUID());
              logged.add(event);
              return event;
            });
    var request =
        new NewItem(
            "spool",
            Map.of("spool_id", "SP-002"),
            null,
            BigDecimal.TEN,
            null,
            null,
            null,
            null,
            null,
            Map.<String, Object>of("Receive", true));

    var item = service.createItem(PROJECT_ID, request, ACTOR_ID);
    when(itemRepository.findByIdAndProjectId(ITEM_ID, PROJECT_ID)).thenReturn(Optional.of(item));
    service.recordMilestone(PROJECT_ID, ITEM_ID, "Erect", true, null, ACTOR_ID);
    var connect = service.recordMilestone(PROJECT_ID, ITEM_ID, "connect", 1, null, ACTOR_ID);
    service.recordMilestone(PROJECT_ID, ITEM_ID, "ERECT", false, null, ACTOR_ID);
    service.recordMilestone(PROJECT_ID, ITEM_ID, "Punch", 100, null, ACTOR_ID);
    when(eventRepository.findById(connect.event().getId()))
        .thenReturn(Optional.of(connect.event()));
    service.correctEvent(connect.event().getId(), false, "connected wrong flange", ACTOR_ID);

    assertThat(logged).hasSize(6);
    assertThat(MilestoneReplay.sameValues(item.milestoneValues(), MilestoneReplay.replay(logged)))
        .as("cached=%s replayed=%s", item.milestoneValues(), MilestoneReplay.replay(logged))
        .isTrue();
    // Receive + Punch
    assertThat(item.getPercentComplete()).isEqualByComparingTo("10");
  }

  @Test
  void unknownMilestoneIsRejected() {
    stubItem(spoolItem(), "spool");

    assertThatThrownBy(
            () -> service.recordMilestone(PROJECT_ID, ITEM_ID, "Hydro", true, null, ACTOR_ID))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Unknown milestone");
    verify(eventRepository, never()).save(any());
  }

  @Test
  void intermediateValueOnDiscreteMilestoneIsRejected() {
    stubItem(spoolItem(), "spool");

    assertThatThrownBy(
            () -> service.recordMilestone(PROJECT_ID, ITEM_ID, "Erect", 50, null, ACTOR_ID))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void weldMadeRequiresWelder() {
    var weld = new Item(PROJECT_ID, "field_weld", Map.of("weld_id", "W-1"), null, BigDecimal.TEN);
    stubItem(weld, "field_weld");

    assertThatThrownBy(
            () -> service.recordMilestone(PROJECT_ID, ITEM_ID, "Weld Made", true, null, ACTOR_ID))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Welder required");
  }

  @Test
  void weldMadeWithWelderAssignsAndRecords() {
    var welderId = UUID.randomUUID();
    var weld = new Item(PROJECT_ID, "field_weld", Map.of("weld_id", "W-1"), null, BigDecimal.TEN);
    stubItem(weld, "field_weld");
    stubEventSave();
    when(dimensionService.requireValue(PROJECT_ID, welderId, DimensionType.WELDER))
        .thenReturn(welderId);

    var update =
        service.recordMilestone(PROJECT_ID, ITEM_ID, "Weld Made", true, welderId, ACTOR_ID);

    assertThat(update.changed()).isTrue();
    assertThat(weld.getWelderId()).isEqualTo(welderId);
    assertThat(weld.getPercentComplete()).isEqualByComparingTo("60");
  }

  @Test
  void retiredItemCannotBeChanged() {
    var item = spoolItem();
    item.retire();
    when(itemRepository.findByIdAndProjectId(ITEM_ID, PROJECT_ID)).thenReturn(Optional.of(item));

    assertThatThrownBy(
            () -> service.recordMilestone(PROJECT_ID, ITEM_ID, "Erect", true, null, ACTOR_ID))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Item retired");
  }

  @Test
  void rebuildProjectionReplacesDriftedCache() {
    var item = spoolItem();
    item.putMilestone("Erect", MilestoneValues.COMPLETE);
    stubItem(item, "spool");
    when(eventRepository.findByItemIdOrdered(ITEM_ID))
        .thenReturn(
            List.of(
                new MilestoneEvent(
                    ITEM_ID,
                    PROJECT_ID,
                    "Receive",
                    null,
                    MilestoneValues.COMPLETE,
                    ACTOR_ID,
                    Instant.now())));

    var rebuild = service.rebuildProjection(PROJECT_ID, ITEM_ID, ACTOR_ID);

    assertThat(rebuild.drifted()).isTrue();
    assertThat(item.milestoneValues()).containsOnlyKeys("Receive");
    assertThat(item.getPercentComplete()).isEqualByComparingTo("5");
    verify(auditService).log(any(AuditEventRecord.class));
  }

  @Test
  void correctionAppendsCompensatingEvent() {
    var item = spoolItem();
    item.putMilestone("Erect", MilestoneValues.COMPLETE);
    var original =
        new MilestoneEvent(
            ITEM_ID, PROJECT_ID, "Erect", null, MilestoneValues.COMPLETE, ACTOR_ID, Instant.now());
    var originalId = UUID.randomUUID();
    ReflectionTestUtils.setField(original, "id", originalId);
    when(eventRepository.findById(originalId)).thenReturn(Optional.of(original));
    stubItem(item, "spool");
    stubEventSave();

    var update = service.correctEvent(originalId, false, "wrong spool", ACTOR_ID);

    assertThat(update.event().isCorrection()).isTrue();
    assertThat(update.event().getCorrectionOf()).isEqualTo(originalId);
    assertThat(update.event().getPreviousValue()).isEqualByComparingTo("100");
    assertThat(update.event().getNewValue()).isEqualByComparingTo("0");
    assertThat(item.getPercentComplete()).isEqualByComparingTo("0");

    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().eventType()).isEqualTo("milestone_event.corrected");
  }

  @Test
  void correctionRequiresReason() {
    assertThatThrownBy(() -> service.correctEvent(UUID.randomUUID(), false, " ", ACTOR_ID))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void createItemLogsNonzeroInitialValues() {
    when(templateResolver.resolve(PROJECT_ID, "spool")).thenReturn(Schedules.spool(PROJECT_ID));
    when(itemRepository.saveAndFlush(any(Item.class)))
        .thenAnswer(
            inv -> {
              Item saved = inv.getArgument(0);
              ReflectionTestUtils.setField(saved, "id", ITEM_ID);
              return saved;
            });
    var request =
        new NewItem(
            "Spool",
            Map.of("spool_id", "SP-001"),
            null,
            BigDecimal.TEN,
            null,
            null,
            null,
            null,
            null,
            Map.<String, Object>of("Receive", true, "Erect", false));

    var item = service.createItem(PROJECT_ID, request, ACTOR_ID);

    assertThat(item.getItemType()).isEqualTo("spool");
    assertThat(item.milestoneValues()).containsOnlyKeys("Receive");
    assertThat(item.getPercentComplete()).isEqualByComparingTo("5");
    var captor = ArgumentCaptor.forClass(MilestoneEvent.class);
    verify(eventRepository).save(captor.capture());
    assertThat(captor.getValue().getMilestoneName()).isEqualTo("Receive");
  }

  @Test
  void duplicateIdentityKeyConflicts() {
    when(templateResolver.resolve(PROJECT_ID, "spool")).thenReturn(Schedules.spool(PROJECT_ID));
    when(itemRepository.saveAndFlush(any(Item.class)))
        .thenThrow(new DataIntegrityViolationException("items_identity_unique"));
    var request =
        new NewItem(
            "spool",
            Map.of("spool_id", "SP-001"),
            null,
            BigDecimal.TEN,
            null,
            null,
            null,
            null,
            null,
            null);

    assertThatThrownBy(() -> service.createItem(PROJECT_ID, request, ACTOR_ID))
        .isInstanceOf(ResourceConflictException.class);
  }

  private static Item spoolItem() {
    var item = new Item(PROJECT_ID, "spool", Map.of("spool_id", "SP-001"), null, BigDecimal.TEN);
    ReflectionTestUtils.setField(item, "id", ITEM_ID);
    return item;
  }

  private void stubItem(Item item, String itemType) {
    ReflectionTestUtils.setField(item, "id", ITEM_ID);
    when(itemRepository.findByIdAndProjectId(ITEM_ID, PROJECT_ID)).thenReturn(Optional.of(item));
    var schedule =
        "field_weld".equals(itemType)
            ? Schedules.fieldWeld(PROJECT_ID)
            : Schedules.spool(PROJECT_ID);
    when(templateResolver.resolve(PROJECT_ID, itemType)).thenReturn(schedule);
  }

  private void stubEventSave() {
    when(eventRepository.save(any(MilestoneEvent.class)))
        .thenAnswer(
            inv -> {
              MilestoneEvent event = inv.getArgument(0);
              ReflectionTestUtils.setField(event, "id", UUID.randomUUID());
              return event;
            });
  }
}
