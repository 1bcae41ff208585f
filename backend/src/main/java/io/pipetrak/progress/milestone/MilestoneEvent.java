package io.pipetrak.progress.milestone;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * One append-only milestone change. Rows are never updated or deleted; a correction is a new row
 * pointing at the event it compensates.
 */
@Entity
@Immutable
@Table(name = "milestone_events")
public class MilestoneEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  /** Insertion order assigned by the database; breaks ties between equal timestamps. */
  @Column(name = "seq", insertable = false, updatable = false)
  private Long seq;

  @Column(name = "item_id", nullable = false, updatable = false)
  private UUID itemId;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "milestone_name", nullable = false, length = 100, updatable = false)
  private String milestoneName;

  @Column(name = "previous_value", precision = 7, scale = 4, updatable = false)
  private BigDecimal previousValue;

  @Column(name = "new_value", nullable = false, precision = 7, scale = 4, updatable = false)
  private BigDecimal newValue;

  @Column(name = "actor_id", updatable = false)
  private UUID actorId;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  @Column(name = "correction_of", updatable = false)
  private UUID correctionOf;

  @Column(name = "correction_reason", updatable = false)
  private String correctionReason;

  protected MilestoneEvent() {}

  public MilestoneEvent(
      UUID itemId,
      UUID projectId,
      String milestoneName,
      BigDecimal previousValue,
      BigDecimal newValue,
      UUID actorId,
      Instant occurredAt) {
    this.itemId = itemId;
    this.projectId = projectId;
    this.milestoneName = milestoneName;
    this.previousValue = previousValue;
    this.newValue = newValue;
    this.actorId = actorId;
    this.occurredAt = occurredAt;
  }

  /** Compensating event that sets the corrected event's milestone to {@code correctedValue}. */
  public static MilestoneEvent correction(
      MilestoneEvent corrected,
      BigDecimal currentValue,
      BigDecimal correctedValue,
      String reason,
      UUID actorId,
      Instant occurredAt) {
    var event =
        new MilestoneEvent(
            corrected.getItemId(),
            corrected.getProjectId(),
            corrected.getMilestoneName(),
            currentValue,
            correctedValue,
            actorId,
            occurredAt);
    event.correctionOf = corrected.getId();
    event.correctionReason = reason;
    return event;
  }

  public boolean isCorrection() {
    return correctionOf != null;
  }

  public UUID getId() {
    return id;
  }

  public Long getSeq() {
    return seq;
  }

  public UUID getItemId() {
    return itemId;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getMilestoneName() {
    return milestoneName;
  }

  public BigDecimal getPreviousValue() {
    return previousValue;
  }

  public BigDecimal getNewValue() {
    return newValue;
  }

  public UUID getActorId() {
    return actorId;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }

  public UUID getCorrectionOf() {
    return correctionOf;
  }

  public String getCorrectionReason() {
    return correctionReason;
  }
}
