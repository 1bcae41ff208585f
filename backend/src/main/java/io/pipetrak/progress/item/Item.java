package io.pipetrak.progress.item;

import io.pipetrak.progress.dimension.DimensionType;
import io.pipetrak.progress.progress.MilestoneValues;
import io.pipetrak.progress.template.TemplateScope;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A trackable unit of construction work. Percent complete, earned hours and the milestone map are
 * cached projections of the item's milestone event log; they are only changed together with an
 * appended event or by a full projection rebuild.
 */
@Entity
@Table(name = "items")
public class Item {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "item_type", nullable = false, length = 50, updatable = false)
  private String itemType;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "identity_key", columnDefinition = "jsonb", nullable = false, updatable = false)
  private Map<String, Object> identityKey;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "attributes", columnDefinition = "jsonb")
  private Map<String, Object> attributes;

  @Column(name = "budgeted_hours", nullable = false, precision = 12, scale = 4)
  private BigDecimal budgetedHours;

  @Column(name = "percent_complete", nullable = false, precision = 7, scale = 4)
  private BigDecimal percentComplete;

  @Column(name = "earned_hours", nullable = false, precision = 12, scale = 4)
  private BigDecimal earnedHours;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "current_milestones", columnDefinition = "jsonb", nullable = false)
  private Map<String, Object> currentMilestones;

  @Enumerated(EnumType.STRING)
  @Column(name = "template_scope", nullable = false, length = 20)
  private TemplateScope templateScope;

  @Column(name = "area_id")
  private UUID areaId;

  @Column(name = "system_id")
  private UUID systemId;

  @Column(name = "test_package_id")
  private UUID testPackageId;

  @Column(name = "drawing_id")
  private UUID drawingId;

  @Column(name = "welder_id")
  private UUID welderId;

  @Column(name = "retired", nullable = false)
  private boolean retired;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Item() {}

  public Item(
      UUID projectId,
      String itemType,
      Map<String, Object> identityKey,
      Map<String, Object> attributes,
      BigDecimal budgetedHours) {
    this.projectId = projectId;
    this.itemType = itemType;
    this.identityKey = new LinkedHashMap<>(identityKey);
    this.attributes = attributes != null ? new LinkedHashMap<>(attributes) : null;
    this.budgetedHours = budgetedHours;
    this.percentComplete = BigDecimal.ZERO;
    this.earnedHours = BigDecimal.ZERO;
    this.currentMilestones = new LinkedHashMap<>();
    this.templateScope = TemplateScope.DEFAULT;
    this.retired = false;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Current milestone values in canonical form. */
  public Map<String, BigDecimal> milestoneValues() {
    return MilestoneValues.fromStoredMap(currentMilestones);
  }

  /** Cached value of a milestone, matching the name case-insensitively. */
  public BigDecimal milestoneValue(String milestoneName) {
    for (var entry : milestoneValues().entrySet()) {
      if (entry.getKey().equalsIgnoreCase(milestoneName)) {
        return entry.getValue();
      }
    }
    return null;
  }

  /**
   * Sets one milestone in the cached map. A key differing only in case is replaced by {@code
   * milestoneName}. The map is replaced so the JSON column is dirty.
   */
  public void putMilestone(String milestoneName, BigDecimal value) {
    var next = new LinkedHashMap<String, Object>(currentMilestones);
    next.keySet().removeIf(name -> name.equalsIgnoreCase(milestoneName));
    next.put(milestoneName, value);
    this.currentMilestones = next;
    this.updatedAt = Instant.now();
  }

  public void replaceMilestones(Map<String, BigDecimal> values) {
    this.currentMilestones = new LinkedHashMap<>(values);
    this.updatedAt = Instant.now();
  }

  public void applyProgress(
      BigDecimal percentComplete, BigDecimal earnedHours, TemplateScope templateScope) {
    this.percentComplete = percentComplete;
    this.earnedHours = earnedHours;
    this.templateScope = templateScope;
    this.updatedAt = Instant.now();
  }

  public void assignDimensions(
      UUID areaId, UUID systemId, UUID testPackageId, UUID drawingId, UUID welderId) {
    this.areaId = areaId;
    this.systemId = systemId;
    this.testPackageId = testPackageId;
    this.drawingId = drawingId;
    this.welderId = welderId;
    this.updatedAt = Instant.now();
  }

  public void assignWelder(UUID welderId) {
    this.welderId = welderId;
    this.updatedAt = Instant.now();
  }

  public void updateBudgetedHours(BigDecimal budgetedHours) {
    this.budgetedHours = budgetedHours;
    this.updatedAt = Instant.now();
  }

  public void retire() {
    this.retired = true;
    this.updatedAt = Instant.now();
  }

  /** The item's value for a dimension, null when unassigned. */
  public UUID dimensionValue(DimensionType dimension) {
    return switch (dimension) {
      case AREA -> areaId;
      case SYSTEM -> systemId;
      case TEST_PACKAGE -> testPackageId;
      case DRAWING -> drawingId;
      case WELDER -> welderId;
    };
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getItemType() {
    return itemType;
  }

  public Map<String, Object> getIdentityKey() {
    return identityKey;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public BigDecimal getBudgetedHours() {
    return budgetedHours;
  }

  public BigDecimal getPercentComplete() {
    return percentComplete;
  }

  public BigDecimal getEarnedHours() {
    return earnedHours;
  }

  public Map<String, Object> getCurrentMilestones() {
    return currentMilestones;
  }

  public TemplateScope getTemplateScope() {
    return templateScope;
  }

  public UUID getAreaId() {
    return areaId;
  }

  public UUID getSystemId() {
    return systemId;
  }

  public UUID getTestPackageId() {
    return testPackageId;
  }

  public UUID getDrawingId() {
    return drawingId;
  }

  public UUID getWelderId() {
    return welderId;
  }

  public boolean isRetired() {
    return retired;
  }

  public long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
