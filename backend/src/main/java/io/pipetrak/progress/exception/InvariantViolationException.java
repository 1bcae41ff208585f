package io.pipetrak.progress.exception;

import java.math.BigDecimal;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Data-integrity alert: the per-category earned hours of an item do not reconcile with its total
 * earned hours. Never auto-corrected; the enclosing write is rolled back.
 */
public class InvariantViolationException extends ErrorResponseException {

  private final UUID itemId;
  private final BigDecimal earnedHours;
  private final BigDecimal categorySum;

  public InvariantViolationException(UUID itemId, BigDecimal earnedHours, BigDecimal categorySum) {
    super(
        HttpStatus.INTERNAL_SERVER_ERROR,
        createProblem(itemId, earnedHours, categorySum),
        null);
    this.itemId = itemId;
    this.earnedHours = earnedHours;
    this.categorySum = categorySum;
  }

  public UUID getItemId() {
    return itemId;
  }

  public BigDecimal getEarnedHours() {
    return earnedHours;
  }

  public BigDecimal getCategorySum() {
    return categorySum;
  }

  private static ProblemDetail createProblem(
      UUID itemId, BigDecimal earnedHours, BigDecimal categorySum) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Data integrity alert");
    problem.setDetail(
        "Category earned hours ("
            + categorySum.toPlainString()
            + ") do not reconcile with earned hours ("
            + earnedHours.toPlainString()
            + ")"
            + (itemId != null ? " for item " + itemId : ""));
    if (itemId != null) {
      problem.setProperty("itemId", itemId);
    }
    problem.setProperty("earnedHours", earnedHours);
    problem.setProperty("categorySum", categorySum);
    return problem;
  }
}
