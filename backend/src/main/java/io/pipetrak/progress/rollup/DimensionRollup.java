package io.pipetrak.progress.rollup;

import io.pipetrak.progress.dimension.DimensionType;
import io.pipetrak.progress.progress.CategoryHours;
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
 * Cached totals for one (project, dimension, dimension value). A null dimension value is the
 * unassigned row. Rows are derived data and can be dropped and rebuilt at any time.
 */
@Entity
@Table(name = "dimension_rollups")
public class DimensionRollup {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Enumerated(EnumType.STRING)
  @Column(name = "dimension", nullable = false, length = 20)
  private DimensionType dimension;

  @Column(name = "dimension_value_id")
  private UUID dimensionValueId;

  @Column(name = "item_count", nullable = false)
  private int itemCount;

  @Column(name = "budgeted_hours", nullable = false, precision = 14, scale = 4)
  private BigDecimal budgetedHours;

  @Column(name = "earned_hours", nullable = false, precision = 14, scale = 4)
  private BigDecimal earnedHours;

  @Column(name = "receive_budget", nullable = false, precision = 14, scale = 4)
  private BigDecimal receiveBudget;

  @Column(name = "install_budget", nullable = false, precision = 14, scale = 4)
  private BigDecimal installBudget;

  @Column(name = "punch_budget", nullable = false, precision = 14, scale = 4)
  private BigDecimal punchBudget;

  @Column(name = "test_budget", nullable = false, precision = 14, scale = 4)
  private BigDecimal testBudget;

  @Column(name = "restore_budget", nullable = false, precision = 14, scale = 4)
  private BigDecimal restoreBudget;

  @Column(name = "receive_earned", nullable = false, precision = 14, scale = 4)
  private BigDecimal receiveEarned;

  @Column(name = "install_earned", nullable = false, precision = 14, scale = 4)
  private BigDecimal installEarned;

  @Column(name = "punch_earned", nullable = false, precision = 14, scale = 4)
  private BigDecimal punchEarned;

  @Column(name = "test_earned", nullable = false, precision = 14, scale = 4)
  private BigDecimal testEarned;

  @Column(name = "restore_earned", nullable = false, precision = 14, scale = 4)
  private BigDecimal restoreEarned;

  @Column(name = "refreshed_at", nullable = false)
  private Instant refreshedAt;

  protected DimensionRollup() {}

  public DimensionRollup(
      UUID projectId, DimensionType dimension, UUID dimensionValueId, RollupTotals totals) {
    this.projectId = projectId;
    this.dimension = dimension;
    this.dimensionValueId = dimensionValueId;
    this.itemCount = totals.itemCount();
    this.budgetedHours = totals.budgetedHours();
    this.earnedHours = totals.earnedHours();
    var budget = totals.categoryBudget();
    this.receiveBudget = budget.receive();
    this.installBudget = budget.install();
    this.punchBudget = budget.punch();
    this.testBudget = budget.test();
    this.restoreBudget = budget.restore();
    var earned = totals.categoryEarned();
    this.receiveEarned = earned.receive();
    this.installEarned = earned.install();
    this.punchEarned = earned.punch();
    this.testEarned = earned.test();
    this.restoreEarned = earned.restore();
    this.refreshedAt = Instant.now();
  }

  public RollupTotals toTotals() {
    return new RollupTotals(
        itemCount,
        budgetedHours,
        earnedHours,
        new CategoryHours(receiveBudget, installBudget, punchBudget, testBudget, restoreBudget),
        new CategoryHours(receiveEarned, installEarned, punchEarned, testEarned, restoreEarned));
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public DimensionType getDimension() {
    return dimension;
  }

  public UUID getDimensionValueId() {
    return dimensionValueId;
  }

  public int getItemCount() {
    return itemCount;
  }

  public BigDecimal getBudgetedHours() {
    return budgetedHours;
  }

  public BigDecimal getEarnedHours() {
    return earnedHours;
  }

  public Instant getRefreshedAt() {
    return refreshedAt;
  }
}
