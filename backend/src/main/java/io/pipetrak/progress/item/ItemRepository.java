package io.pipetrak.progress.item;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ItemRepository extends JpaRepository<Item, UUID> {

  Optional<Item> findByIdAndProjectId(UUID id, UUID projectId);

  List<Item> findByProjectIdAndRetiredFalse(UUID projectId);

  List<Item> findByProjectIdAndItemTypeAndRetiredFalse(UUID projectId, String itemType);

  @Query(
      """
      SELECT i FROM Item i
      WHERE i.projectId = :projectId
        AND (CAST(:itemType AS string) IS NULL OR i.itemType = :itemType)
      ORDER BY i.createdAt, i.id
      """)
  Page<Item> findByFilter(
      @Param("projectId") UUID projectId, @Param("itemType") String itemType, Pageable pageable);

  @Query("SELECT DISTINCT i.projectId FROM Item i WHERE i.retired = false")
  List<UUID> findActiveProjectIds();

  /** Active items carrying cached progress with no event in the log to support it. */
  @Query(
      """
      SELECT i FROM Item i
      WHERE i.projectId = :projectId
        AND i.retired = false
        AND i.percentComplete > 0
        AND NOT EXISTS (SELECT e.id FROM MilestoneEvent e WHERE e.itemId = i.id)
      """)
  List<Item> findUntrackedProgress(@Param("projectId") UUID projectId);
}
