package io.pipetrak.progress.progress;

import io.pipetrak.progress.exception.InvalidStateException;
import io.pipetrak.progress.template.CompletionKind;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Boundary normalisation of milestone values. Every value entering the system passes through here
 * once; downstream code only ever sees canonical decimals where discrete completion is exactly
 * {@link #COMPLETE}.
 */
public final class MilestoneValues {

  public static final BigDecimal COMPLETE = BigDecimal.valueOf(100);
  public static final BigDecimal NOT_STARTED = BigDecimal.ZERO;

  /** Decimal places the event log keeps for a milestone value. */
  public static final int STORED_SCALE = 4;

  private MilestoneValues() {}

  /**
   * Normalises a raw value for a milestone of the given kind. Discrete milestones accept {@code
   * true}/{@code false}, {@code 1}/{@code 0} and {@code 100}; partial milestones accept any number
   * in 0-100 (booleans map to 100/0).
   *
   * @throws InvalidStateException if the value cannot be represented for the kind
   */
  public static BigDecimal normalize(Object raw, CompletionKind kind) {
    if (raw == null) {
      throw new InvalidStateException("Invalid milestone value", "Milestone value is required");
    }
    if (raw instanceof Boolean b) {
      return b ? COMPLETE : NOT_STARTED;
    }
    if (raw instanceof String s
        && ("true".equalsIgnoreCase(s.trim()) || "false".equalsIgnoreCase(s.trim()))) {
      return Boolean.parseBoolean(s.trim()) ? COMPLETE : NOT_STARTED;
    }
    BigDecimal value = toDecimal(raw);
    if (kind == CompletionKind.DISCRETE) {
      if (value.compareTo(BigDecimal.ZERO) == 0) {
        return NOT_STARTED;
      }
      if (value.compareTo(BigDecimal.ONE) == 0 || value.compareTo(COMPLETE) == 0) {
        return COMPLETE;
      }
      throw new InvalidStateException(
          "Invalid milestone value",
          "Discrete milestone value must be true/false, 0/1 or 0/100 (got "
              + value.toPlainString()
              + ")");
    }
    if (value.signum() < 0 || value.compareTo(COMPLETE) > 0) {
      throw new InvalidStateException(
          "Invalid milestone value",
          "Partial milestone value must be between 0 and 100 (got " + value.toPlainString() + ")");
    }
    return value.scale() > STORED_SCALE
        ? value.setScale(STORED_SCALE, RoundingMode.HALF_UP)
        : value;
  }

  public static boolean isComplete(BigDecimal value) {
    return value != null && value.compareTo(COMPLETE) == 0;
  }

  /**
   * Reads a value back from the persisted milestone map. Legacy boolean entries written before
   * normalisation was enforced read as 100/0.
   */
  public static BigDecimal fromStored(Object stored) {
    if (stored == null) {
      return NOT_STARTED;
    }
    if (stored instanceof Boolean b) {
      return b ? COMPLETE : NOT_STARTED;
    }
    return toDecimal(stored);
  }

  public static Map<String, BigDecimal> fromStoredMap(Map<String, Object> stored) {
    var values = new LinkedHashMap<String, BigDecimal>();
    if (stored != null) {
      stored.forEach((name, value) -> values.put(name, fromStored(value)));
    }
    return values;
  }

  private static BigDecimal toDecimal(Object raw) {
    if (raw instanceof BigDecimal d) {
      return d;
    }
    if (raw instanceof Number n) {
      return new BigDecimal(n.toString());
    }
    try {
      return new BigDecimal(raw.toString().trim());
    } catch (NumberFormatException e) {
      throw new InvalidStateException(
          "Invalid milestone value", "Milestone value '" + raw + "' is not a number or boolean");
    }
  }
}
