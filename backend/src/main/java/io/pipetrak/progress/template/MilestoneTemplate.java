package io.pipetrak.progress.template;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One milestone row of a schedule. Rows with a null {@code projectId} form the default schedule of
 * an item type; rows with a project id are that project's overrides, matched to the default by
 * case-insensitive milestone name.
 */
@Entity
@Table(name = "milestone_templates")
public class MilestoneTemplate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id")
  private UUID projectId;

  @Column(name = "item_type", nullable = false, length = 50)
  private String itemType;

  @Column(name = "milestone_name", nullable = false, length = 100)
  private String milestoneName;

  @Column(name = "weight", nullable = false, precision = 5, scale = 2)
  private BigDecimal weight;

  @Enumerated(EnumType.STRING)
  @Column(name = "completion_kind", nullable = false, length = 20)
  private CompletionKind completionKind;

  @Enumerated(EnumType.STRING)
  @Column(name = "category", nullable = false, length = 20)
  private MilestoneCategory category;

  @Column(name = "milestone_order", nullable = false)
  private int milestoneOrder;

  @Column(name = "requires_welder", nullable = false)
  private boolean requiresWelder;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected MilestoneTemplate() {}

  public MilestoneTemplate(
      UUID projectId,
      String itemType,
      String milestoneName,
      BigDecimal weight,
      CompletionKind completionKind,
      MilestoneCategory category,
      int milestoneOrder,
      boolean requiresWelder) {
    this.projectId = projectId;
    this.itemType = itemType;
    this.milestoneName = milestoneName;
    this.weight = weight;
    this.completionKind = completionKind;
    this.category = category;
    this.milestoneOrder = milestoneOrder;
    this.requiresWelder = requiresWelder;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean isDefault() {
    return projectId == null;
  }

  public boolean matches(String name) {
    return milestoneName.equalsIgnoreCase(name);
  }

  public ResolvedMilestone toResolved() {
    return new ResolvedMilestone(
        milestoneName, weight, completionKind, category, milestoneOrder, requiresWelder);
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

  public String getMilestoneName() {
    return milestoneName;
  }

  public BigDecimal getWeight() {
    return weight;
  }

  public CompletionKind getCompletionKind() {
    return completionKind;
  }

  public MilestoneCategory getCategory() {
    return category;
  }

  public int getMilestoneOrder() {
    return milestoneOrder;
  }

  public boolean isRequiresWelder() {
    return requiresWelder;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
