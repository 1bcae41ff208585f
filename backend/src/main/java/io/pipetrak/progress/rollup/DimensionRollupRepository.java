package io.pipetrak.progress.rollup;

import io.pipetrak.progress.dimension.DimensionType;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DimensionRollupRepository extends JpaRepository<DimensionRollup, UUID> {

  List<DimensionRollup> findByProjectIdAndDimension(UUID projectId, DimensionType dimension);

  List<DimensionRollup> findByProjectId(UUID projectId);

  @Modifying
  @Query("DELETE FROM DimensionRollup r WHERE r.projectId = :projectId")
  int deleteByProjectId(@Param("projectId") UUID projectId);

  /**
   * Adds signed deltas to a row, creating it when absent. Runs as one statement so concurrent
   * writers to the same row serialize on its lock. The value id is passed as text; null selects the
   * unassigned row.
   */
  @Modifying
  @Query(
      value =
          """
          INSERT INTO dimension_rollups (
              id, project_id, dimension, dimension_value_id, item_count,
              budgeted_hours, earned_hours,
              receive_budget, install_budget, punch_budget, test_budget, restore_budget,
              receive_earned, install_earned, punch_earned, test_earned, restore_earned,
              refreshed_at)
          VALUES (
              gen_random_uuid(), :projectId, :dimension,
              CAST(:dimensionValueId AS uuid), :itemCount,
              :budgetedHours, :earnedHours,
              :receiveBudget, :installBudget, :punchBudget, :testBudget, :restoreBudget,
              :receiveEarned, :installEarned, :punchEarned, :testEarned, :restoreEarned,
              now())
          ON CONFLICT (project_id, dimension,
              COALESCE(dimension_value_id, '00000000-0000-0000-0000-000000000000'::uuid))
          DO UPDATE SET
              item_count = dimension_rollups.item_count + EXCLUDED.item_count,
              budgeted_hours = dimension_rollups.budgeted_hours + EXCLUDED.budgeted_hours,
              earned_hours = dimension_rollups.earned_hours + EXCLUDED.earned_hours,
              receive_budget = dimension_rollups.receive_budget + EXCLUDED.receive_budget,
              install_budget = dimension_rollups.install_budget + EXCLUDED.install_budget,
              punch_budget = dimension_rollups.punch_budget + EXCLUDED.punch_budget,
              test_budget = dimension_rollups.test_budget + EXCLUDED.test_budget,
              restore_budget = dimension_rollups.restore_budget + EXCLUDED.restore_budget,
              receive_earned = dimension_rollups.receive_earned + EXCLUDED.receive_earned,
              install_earned = dimension_rollups.install_earned + EXCLUDED.install_earned,
              punch_earned = dimension_rollups.punch_earned + EXCLUDED.punch_earned,
              test_earned = dimension_rollups.test_earned + EXCLUDED.test_earned,
              restore_earned = dimension_rollups.restore_earned + EXCLUDED.restore_earned,
              refreshed_at = now()
          """,
      nativeQuery = true)
  int addDelta(
      @Param("projectId") UUID projectId,
      @Param("dimension") String dimension,
      @Param("dimensionValueId") String dimensionValueId,
      @Param("itemCount") int itemCount,
      @Param("budgetedHours") BigDecimal budgetedHours,
      @Param("earnedHours") BigDecimal earnedHours,
      @Param("receiveBudget") BigDecimal receiveBudget,
      @Param("installBudget") BigDecimal installBudget,
      @Param("punchBudget") BigDecimal punchBudget,
      @Param("testBudget") BigDecimal testBudget,
      @Param("restoreBudget") BigDecimal restoreBudget,
      @Param("receiveEarned") BigDecimal receiveEarned,
      @Param("installEarned") BigDecimal installEarned,
      @Param("punchEarned") BigDecimal punchEarned,
      @Param("testEarned") BigDecimal testEarned,
      @Param("restoreEarned") BigDecimal restoreEarned);
}
