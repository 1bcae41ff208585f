package io.pipetrak.progress.template;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MilestoneTemplateRepository extends JpaRepository<MilestoneTemplate, UUID> {

  @Query(
      """
      SELECT t FROM MilestoneTemplate t
      WHERE t.projectId IS NULL AND t.itemType = :itemType
      ORDER BY t.milestoneOrder
      """)
  List<MilestoneTemplate> findDefaults(@Param("itemType") String itemType);

  @Query(
      """
      SELECT t FROM MilestoneTemplate t
      WHERE t.projectId IS NULL
      ORDER BY t.itemType, t.milestoneOrder
      """)
  List<MilestoneTemplate> findAllDefaults();

  @Query(
      """
      SELECT t FROM MilestoneTemplate t
      WHERE t.projectId = :projectId AND t.itemType = :itemType
      ORDER BY t.milestoneOrder
      """)
  List<MilestoneTemplate> findOverrides(
      @Param("projectId") UUID projectId, @Param("itemType") String itemType);

  boolean existsByProjectId(UUID projectId);

  /** Projects that hold at least one override for the item type. */
  @Query(
      """
      SELECT DISTINCT t.projectId FROM MilestoneTemplate t
      WHERE t.projectId IS NOT NULL AND t.itemType = :itemType
      """)
  List<UUID> findProjectsWithOverrides(@Param("itemType") String itemType);

  @Query(
      """
      SELECT MAX(t.updatedAt) FROM MilestoneTemplate t
      WHERE t.projectId = :projectId AND t.itemType = :itemType
      """)
  Optional<Instant> findLastOverrideUpdate(
      @Param("projectId") UUID projectId, @Param("itemType") String itemType);

  @Modifying
  @Query(
      """
      DELETE FROM MilestoneTemplate t
      WHERE t.projectId = :projectId AND t.itemType = :itemType
      """)
  int deleteOverrides(@Param("projectId") UUID projectId, @Param("itemType") String itemType);

  @Modifying
  @Query("DELETE FROM MilestoneTemplate t WHERE t.projectId IS NULL AND t.itemType = :itemType")
  int deleteDefaults(@Param("itemType") String itemType);
}
