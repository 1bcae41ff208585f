package io.pipetrak.progress.budget;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** One version of a project's manhour budget. At most one version per project is active. */
@Entity
@Table(name = "manhour_budgets")
public class ManhourBudget {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "version_number", nullable = false, updatable = false)
  private int versionNumber;

  @Column(name = "total_budgeted_hours", nullable = false, precision = 12, scale = 2)
  private BigDecimal totalBudgetedHours;

  @Column(name = "revision_reason", columnDefinition = "TEXT")
  private String revisionReason;

  @Column(name = "effective_date", nullable = false)
  private LocalDate effectiveDate;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ManhourBudget() {}

  public ManhourBudget(
      UUID projectId,
      int versionNumber,
      BigDecimal totalBudgetedHours,
      String revisionReason,
      LocalDate effectiveDate,
      UUID createdBy) {
    this.projectId = projectId;
    this.versionNumber = versionNumber;
    this.totalBudgetedHours = totalBudgetedHours;
    this.revisionReason = revisionReason;
    this.effectiveDate = effectiveDate;
    this.active = true;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public int getVersionNumber() {
    return versionNumber;
  }

  public BigDecimal getTotalBudgetedHours() {
    return totalBudgetedHours;
  }

  public String getRevisionReason() {
    return revisionReason;
  }

  public LocalDate getEffectiveDate() {
    return effectiveDate;
  }

  public boolean isActive() {
    return active;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
