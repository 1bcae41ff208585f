package io.pipetrak.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class ProgressTrackingIntegrationTest {

  private static final String ACTOR = UUID.randomUUID().toString();

  @Autowired private MockMvc mockMvc;

  private final UUID projectId = UUID.randomUUID();
  private final UUID otherProjectId = UUID.randomUUID();
  private final Instant windowStart = Instant.now().minus(1, ChronoUnit.MINUTES);

  private String areaId;
  private String spoolId;

  @BeforeAll
  void setup() throws Exception {
    var area =
        mockMvc
            .perform(
                post("/api/projects/{projectId}/dimensions", projectId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"dimension": "area", "name": "North"}
                        """))
            .andExpect(status().isCreated())
            .andReturn();
    areaId = JsonPath.read(area.getResponse().getContentAsString(), "$.id");
  }

  @Test
  @Order(1)
  void seededSchedulesAreAvailable() throws Exception {
    mockMvc
        .perform(get("/api/milestone-templates/spool"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.scope").value("DEFAULT"))
        .andExpect(jsonPath("$.milestones.length()").value(6))
        .andExpect(jsonPath("$.milestones[0].name").value("Receive"));
  }

  @Test
  @Order(2)
  void createsItemWithInitialMilestone() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/projects/{projectId}/items", projectId)
                    .header("X-Actor-Id", ACTOR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {
                          "itemType": "spool",
                          "identityKey": {"spool_id": "SP-001", "size": "4"},
                          "budgetedHours": 10,
                          "areaId": "%s",
                          "milestones": {"Receive": true}
                        }
                        """
                            .formatted(areaId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.templateScope").value("DEFAULT"))
            .andReturn();
    spoolId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");
    assertThat(number(result, "$.percentComplete")).isCloseTo(5.0, within(0.0001));
  }

  @Test
  @Order(3)
  void duplicateIdentityKeyConflicts() throws Exception {
    mockMvc
        .perform(
            post("/api/projects/{projectId}/items", projectId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"itemType": "spool", "identityKey": {"spool_id": "SP-001", "size": "4"}}
                    """))
        .andExpect(status().isConflict());
  }

  @Test
  @Order(4)
  void recordingMilestonesUpdatesProgress() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/projects/{projectId}/items/{itemId}/milestones", projectId, spoolId)
                    .header("X-Actor-Id", ACTOR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"milestone": "Erect", "value": true}
                        """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.changed").value(true))
            .andReturn();

    assertThat(number(result, "$.progress.percentComplete")).isCloseTo(45.0, within(0.0001));
    assertThat(number(result, "$.progress.earnedHours")).isCloseTo(4.5, within(0.0001));
    assertThat(number(result, "$.progress.categoryEarnedHours.receive"))
        .isCloseTo(0.5, within(0.0001));
    assertThat(number(result, "$.progress.categoryEarnedHours.install"))
        .isCloseTo(4.0, within(0.0001));
  }

  @Test
  @Order(5)
  void repeatingTheSameValueIsANoOp() throws Exception {
    mockMvc
        .perform(
            post("/api/projects/{projectId}/items/{itemId}/milestones", projectId, spoolId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"milestone": "erect", "value": 100}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.changed").value(false));

    mockMvc
        .perform(get("/api/projects/{projectId}/items/{itemId}/events", projectId, spoolId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2));
  }

  @Test
  @Order(6)
  void unknownMilestoneIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/projects/{projectId}/items/{itemId}/milestones", projectId, spoolId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"milestone": "Hydro", "value": true}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  @Order(7)
  void rollupReflectsTheItem() throws Exception {
    var result =
        mockMvc
            .perform(
                get("/api/projects/{projectId}/rollups", projectId).param("dimension", "area"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rows[0].dimensionName").value("North"))
            .andExpect(jsonPath("$.rows[0].totals.itemCount").value(1))
            .andReturn();
    assertThat(number(result, "$.rows[0].totals.earnedHours")).isCloseTo(4.5, within(0.0001));

    mockMvc
        .perform(get("/api/projects/{projectId}/rollups/drift", projectId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));
  }

  @Test
  @Order(8)
  void deltaMatchesLoggedChanges() throws Exception {
    var result =
        mockMvc
            .perform(
                get("/api/projects/{projectId}/deltas", projectId)
                    .param("dimension", "area")
                    .param("start", windowStart.toString())
                    .param("end", Instant.now().plus(1, ChronoUnit.HOURS).toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rows[0].dimensionName").value("North"))
            .andExpect(jsonPath("$.crossCheck.discrepancies.length()").value(0))
            .andReturn();
    assertThat(number(result, "$.grandTotal.earnedDeltaTotal")).isCloseTo(4.5, within(0.0001));
    assertThat(number(result, "$.grandTotal.budgetedHours")).isCloseTo(10.0, within(0.0001));
  }

  @Test
  @Order(9)
  void windowBeforeAnyEventIsEmpty() throws Exception {
    var result =
        mockMvc
            .perform(
                get("/api/projects/{projectId}/deltas", projectId)
                    .param("dimension", "area")
                    .param("start", windowStart.minus(2, ChronoUnit.DAYS).toString())
                    .param("end", windowStart.minus(1, ChronoUnit.DAYS).toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rows.length()").value(0))
            .andReturn();
    assertThat(number(result, "$.grandTotal.budgetedHours")).isCloseTo(0.0, within(0.0001));
  }

  @Test
  @Order(10)
  void projectOverrideIsIsolatedAndRecalculates() throws Exception {
    var result =
        mockMvc
            .perform(
                put(
                        "/api/projects/{projectId}/milestone-templates/{itemType}/overrides",
                        projectId,
                        "spool")
                    .header("X-Actor-Id", ACTOR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {
                          "overrides": [
                            {"name": "Receive", "weight": 2},
                            {"name": "Connect", "weight": 43}
                          ],
                          "recalculateExisting": true
                        }
                        """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.schedule.scope").value("PROJECT_OVERRIDE"))
            .andExpect(jsonPath("$.recalculatedItems").value(1))
            .andReturn();
    assertThat(number(result, "$.schedule.totalWeight")).isCloseTo(100.0, within(0.0001));

    var progress =
        mockMvc
            .perform(
                get("/api/projects/{projectId}/items/{itemId}/progress", projectId, spoolId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.templateScope").value("PROJECT_OVERRIDE"))
            .andReturn();
    // Receive 2 + Erect 40
    assertThat(number(progress, "$.percentComplete")).isCloseTo(42.0, within(0.0001));

    var other =
        mockMvc
            .perform(
                get(
                    "/api/projects/{projectId}/milestone-templates/{itemType}",
                    otherProjectId,
                    "spool"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scope").value("DEFAULT"))
            .andReturn();
    assertThat(number(other, "$.milestones[0].weight")).isCloseTo(5.0, within(0.0001));
  }

  @Test
  @Order(11)
  void overridesNotSummingToHundredAreRejected() throws Exception {
    mockMvc
        .perform(
            put(
                    "/api/projects/{projectId}/milestone-templates/{itemType}/overrides",
                    projectId,
                    "spool")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"overrides": [{"name": "Receive", "weight": 9}]}
                    """))
        .andExpect(status().isUnprocessableEntity());
  }

  @Test
  @Order(12)
  void weldNeedsWelderBeforeWeldMade() throws Exception {
    var weld =
        mockMvc
            .perform(
                post("/api/projects/{projectId}/items", projectId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"itemType": "field_weld", "identityKey": {"weld_id": "W-7"}}
                        """))
            .andExpect(status().isCreated())
            .andReturn();
    String weldId = JsonPath.read(weld.getResponse().getContentAsString(), "$.id");

    mockMvc
        .perform(
            post("/api/projects/{projectId}/items/{itemId}/milestones", projectId, weldId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"milestone": "Weld Made", "value": true}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  @Order(13)
  void budgetIsDistributedAcrossActiveItems() throws Exception {
    mockMvc
        .perform(
            post("/api/projects/{projectId}/manhour-budgets", projectId)
                .header("X-Actor-Id", ACTOR)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"totalBudgetedHours": 200, "revisionReason": "baseline"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.budget.versionNumber").value(1))
        .andExpect(jsonPath("$.itemsAllocated").value(2))
        .andExpect(jsonPath("$.warnings.length()").value(1));

    mockMvc
        .perform(get("/api/projects/{projectId}/rollups/drift", projectId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));
  }

  private static double number(MvcResult result, String path) throws Exception {
    Number value = JsonPath.read(result.getResponse().getContentAsString(), path);
    return value.doubleValue();
  }
}
