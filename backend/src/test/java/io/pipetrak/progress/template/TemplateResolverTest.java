package io.pipetrak.progress.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.pipetrak.progress.config.ProgressProperties;
import io.pipetrak.progress.exception.InvalidStateException;
import io.pipetrak.progress.exception.ResourceNotFoundException;
import io.pipetrak.progress.exception.SchemaInvalidException;
import io.pipetrak.progress.testutil.Schedules;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TemplateResolverTest {

  private static final UUID PROJECT_A = UUID.randomUUID();
  private static final UUID PROJECT_B = UUID.randomUUID();
  private static final BigDecimal TOLERANCE = new BigDecimal("0.01");

  @Mock private MilestoneTemplateRepository templateRepository;

  private TemplateResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new TemplateResolver(templateRepository, ProgressProperties.defaults());
  }

  @Test
  void mergeWithoutOverridesKeepsDefaults() {
    var defaults = Schedules.spool(null).milestones();

    var schedule = TemplateResolver.merge(defaults, List.of(), PROJECT_A, "spool", TOLERANCE);

    assertThat(schedule.scope()).isEqualTo(TemplateScope.DEFAULT);
    assertThat(schedule.milestones()).isEqualTo(defaults);
  }

  @Test
  void mergeReplacesMatchedWeightsAndKeepsOrder() {
    var defaults = Schedules.spool(null).milestones();
    var overrides =
        List.of(
            Schedules.discrete("erect", 43, MilestoneCategory.INSTALL, 2),
            Schedules.discrete("RECEIVE", 2, MilestoneCategory.RECEIVE, 1));

    var schedule = TemplateResolver.merge(defaults, overrides, PROJECT_A, "spool", TOLERANCE);

    assertThat(schedule.scope()).isEqualTo(TemplateScope.PROJECT_OVERRIDE);
    assertThat(schedule.milestones())
        .extracting(ResolvedMilestone::name)
        .containsExactly("Receive", "Erect", "Connect", "Punch", "Test", "Restore");
    assertThat(schedule.find("Receive").orElseThrow().weight()).isEqualByComparingTo("2");
    assertThat(schedule.find("Erect").orElseThrow().weight()).isEqualByComparingTo("43");
    assertThat(schedule.totalWeight()).isEqualByComparingTo("100");
  }

  @Test
  void mergeRejectsWeightsNotSummingToHundred() {
    var overrides = List.of(Schedules.discrete("Receive", 2, MilestoneCategory.RECEIVE, 1));

    assertThatThrownBy(
            () ->
                TemplateResolver.merge(
                    Schedules.spool(null).milestones(), overrides, PROJECT_A, "spool", TOLERANCE))
        .isInstanceOf(SchemaInvalidException.class);
  }

  @Test
  void mergeRejectsOverrideOfUnknownMilestone() {
    var overrides = List.of(Schedules.discrete("Hydro", 5, MilestoneCategory.TEST, 7));

    assertThatThrownBy(
            () ->
                TemplateResolver.merge(
                    Schedules.spool(null).milestones(), overrides, PROJECT_A, "spool", TOLERANCE))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Invalid milestone name");
  }

  @Test
  void overrideAffectsOnlyItsProject() {
    when(templateRepository.findDefaults("spool")).thenReturn(spoolDefaults());
    when(templateRepository.findOverrides(PROJECT_A, "spool"))
        .thenReturn(
            List.of(
                row(PROJECT_A, "Receive", 2, MilestoneCategory.RECEIVE, 1),
                row(PROJECT_A, "Erect", 43, MilestoneCategory.INSTALL, 2)));
    when(templateRepository.findOverrides(PROJECT_B, "spool")).thenReturn(List.of());

    var scheduleA = resolver.resolve(PROJECT_A, "spool");
    var scheduleB = resolver.resolve(PROJECT_B, "Spool");

    assertThat(scheduleA.find("Receive").orElseThrow().weight()).isEqualByComparingTo("2");
    assertThat(scheduleA.scope()).isEqualTo(TemplateScope.PROJECT_OVERRIDE);
    assertThat(scheduleB.find("Receive").orElseThrow().weight()).isEqualByComparingTo("5");
    assertThat(scheduleB.scope()).isEqualTo(TemplateScope.DEFAULT);
  }

  @Test
  void resolvedSchedulesAreCachedUntilInvalidated() {
    when(templateRepository.findDefaults("spool")).thenReturn(spoolDefaults());
    when(templateRepository.findOverrides(PROJECT_A, "spool")).thenReturn(List.of());

    var first = resolver.resolve(PROJECT_A, "spool");
    var second = resolver.resolve(PROJECT_A, " SPOOL ");
    resolver.invalidate(PROJECT_A, "spool");
    resolver.resolve(PROJECT_A, "spool");

    assertThat(second).isSameAs(first);
    verify(templateRepository, times(2)).findDefaults("spool");
  }

  @Test
  void invalidateItemTypeEvictsEveryProject() {
    when(templateRepository.findDefaults("spool")).thenReturn(spoolDefaults());
    when(templateRepository.findOverrides(PROJECT_A, "spool")).thenReturn(List.of());
    when(templateRepository.findOverrides(PROJECT_B, "spool")).thenReturn(List.of());

    resolver.resolve(PROJECT_A, "spool");
    resolver.resolve(PROJECT_B, "spool");
    resolver.invalidateItemType("spool");
    resolver.resolve(PROJECT_A, "spool");
    resolver.resolve(PROJECT_B, "spool");

    verify(templateRepository, times(4)).findDefaults("spool");
  }

  @Test
  void unknownItemTypeIsNotFound() {
    when(templateRepository.findDefaults("gizmo")).thenReturn(List.of());

    assertThatThrownBy(() -> resolver.resolve(PROJECT_A, "gizmo"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void blankItemTypeIsRejected() {
    assertThatThrownBy(() -> resolver.resolve(PROJECT_A, "  "))
        .isInstanceOf(InvalidStateException.class);
  }

  private static List<MilestoneTemplate> spoolDefaults() {
    return Schedules.spool(null).milestones().stream()
        .map(
            m ->
                new MilestoneTemplate(
                    null,
                    "spool",
                    m.name(),
                    m.weight(),
                    m.kind(),
                    m.category(),
                    m.order(),
                    m.requiresWelder()))
        .toList();
  }

  private static MilestoneTemplate row(
      UUID projectId, String name, int weight, MilestoneCategory category, int order) {
    return new MilestoneTemplate(
        projectId,
        "spool",
        name,
        BigDecimal.valueOf(weight),
        CompletionKind.DISCRETE,
        category,
        order,
        false);
  }
}
