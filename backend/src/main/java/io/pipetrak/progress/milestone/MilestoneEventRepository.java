package io.pipetrak.progress.milestone;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MilestoneEventRepository extends JpaRepository<MilestoneEvent, UUID> {

  @Query(
      """
      SELECT e FROM MilestoneEvent e
      WHERE e.itemId = :itemId
      ORDER BY e.occurredAt, e.seq
      """)
  List<MilestoneEvent> findByItemIdOrdered(@Param("itemId") UUID itemId);

  /** Events of the project in {@code [start, end)}, in log order. */
  @Query(
      """
      SELECT e FROM MilestoneEvent e
      WHERE e.projectId = :projectId AND e.occurredAt >= :start AND e.occurredAt < :end
      ORDER BY e.occurredAt, e.seq
      """)
  List<MilestoneEvent> findProjectEventsBetween(
      @Param("projectId") UUID projectId,
      @Param("start") Instant start,
      @Param("end") Instant end);

  /**
   * Events strictly before {@code end} of the project's items whose log holds nothing at or after
   * {@code end}, in log order.
   */
  @Query(
      """
      SELECT e FROM MilestoneEvent e
      WHERE e.projectId = :projectId AND e.occurredAt < :end
        AND NOT EXISTS (
          SELECT 1 FROM MilestoneEvent newer
          WHERE newer.itemId = e.itemId AND newer.occurredAt >= :end)
      ORDER BY e.occurredAt, e.seq
      """)
  List<MilestoneEvent> findSettledHistoryBefore(
      @Param("projectId") UUID projectId, @Param("end") Instant end);

  @Query(
      """
      SELECT DISTINCT e.itemId FROM MilestoneEvent e
      WHERE e.projectId = :projectId AND e.occurredAt >= :since
      """)
  List<UUID> findItemIdsWithEventsSince(
      @Param("projectId") UUID projectId, @Param("since") Instant since);

  boolean existsByItemId(UUID itemId);
}
