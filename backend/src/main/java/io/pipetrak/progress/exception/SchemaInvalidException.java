package io.pipetrak.progress.exception;

import java.math.BigDecimal;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when a resolved milestone schedule does not sum to 100. Thrown at schedule-write time so a
 * bad override is rejected before any calculation can read it.
 */
public class SchemaInvalidException extends ErrorResponseException {

  private final UUID projectId;
  private final String itemType;
  private final BigDecimal weightSum;

  public SchemaInvalidException(UUID projectId, String itemType, BigDecimal weightSum) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        createProblem(
            "Schema invalid",
            "Milestone weights for item type '"
                + itemType
                + "'"
                + (projectId != null ? " in project " + projectId : "")
                + " must sum to 100 (current: "
                + weightSum.stripTrailingZeros().toPlainString()
                + ")"),
        null);
    this.projectId = projectId;
    this.itemType = itemType;
    this.weightSum = weightSum;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getItemType() {
    return itemType;
  }

  public BigDecimal getWeightSum() {
    return weightSum;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
