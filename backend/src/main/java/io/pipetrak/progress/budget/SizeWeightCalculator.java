package io.pipetrak.progress.budget;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Relative size weight of an item for distributing a manhour budget. Larger bore means more work:
 * {@code diameter^1.5}, scaled by run length for pipe, with a fixed fallback when no size can be
 * read.
 */
@Component
public class SizeWeightCalculator {

  public enum Basis {
    DIMENSION,
    LINEAR_FEET,
    FIXED
  }

  /**
   * @param reason why a fixed or reduced basis was used; null for a normal dimension weight
   */
  public record ItemWeight(double weight, Basis basis, String reason) {

    public boolean hasWarning() {
      return basis == Basis.FIXED;
    }
  }

  private static final Pattern NUMBER = Pattern.compile("^\\d+(\\.\\d+)?$");
  private static final Pattern FRACTION = Pattern.compile("^(\\d+)/(\\d+)$");
  private static final Pattern MIXED_NUMBER = Pattern.compile("^(\\d+)\\s+(\\d+)/(\\d+)$");
  private static final Pattern REDUCER_SEPARATOR = Pattern.compile("\\s*[Xx]\\s*");

  public ItemWeight weigh(
      String itemType, Map<String, Object> identityKey, Map<String, Object> attributes) {
    var key = effectiveKey(identityKey, attributes);
    double fallback = fallbackWeight(itemType);

    Object rawSize = key.containsKey("size") ? key.get("size") : key.get("SIZE");
    if (rawSize == null) {
      return new ItemWeight(
          fallback, Basis.FIXED, "No size, fixed weight " + fallback + " assigned");
    }
    Double diameter = parseDiameter(rawSize.toString());
    if (diameter == null) {
      return new ItemWeight(
          fallback,
          Basis.FIXED,
          "No parseable size '" + rawSize + "', fixed weight " + fallback + " assigned");
    }

    double base = Math.pow(diameter, 1.5);
    Object rawFeet =
        key.containsKey("linear_feet") ? key.get("linear_feet") : key.get("LINEAR_FEET");
    if (usesLinearFeet(itemType) && rawFeet != null) {
      Double feet = parseLinearFeet(rawFeet);
      if (feet == null || feet < 0) {
        return new ItemWeight(base, Basis.DIMENSION, "Invalid linear feet '" + rawFeet + "'");
      }
      return new ItemWeight(base * feet * 0.1, Basis.LINEAR_FEET, null);
    }
    return new ItemWeight(base, Basis.DIMENSION, null);
  }

  /**
   * Nominal diameter in inches: whole and decimal numbers, fractions ({@code 1/2}), mixed numbers
   * ({@code 1 1/2}), {@code HALF}, inch marks, and reducers ({@code 2X4}, averaged). Null when the
   * text cannot be read or is not positive.
   */
  public static Double parseDiameter(String size) {
    if (size == null) {
      return null;
    }
    String text = size.trim().replace("\"", "").replaceAll("\\s*/\\s*", "/");
    if (text.isEmpty()) {
      return null;
    }
    Matcher mixed = MIXED_NUMBER.matcher(text);
    if (mixed.matches()) {
      double denominator = Double.parseDouble(mixed.group(3));
      if (denominator == 0) {
        return null;
      }
      return positive(
          Double.parseDouble(mixed.group(1)) + Double.parseDouble(mixed.group(2)) / denominator);
    }

    String[] parts = REDUCER_SEPARATOR.split(text, -1);
    if (parts.length == 2) {
      Double first = parseSingle(parts[0]);
      Double second = parseSingle(parts[1]);
      if (first == null || second == null) {
        return null;
      }
      return positive((first + second) / 2);
    }
    if (parts.length > 2) {
      return null;
    }
    return positive(parseSingle(text));
  }

  private static Double parseSingle(String text) {
    String value = text.trim();
    if (value.isEmpty()) {
      return null;
    }
    String upper = value.toUpperCase(Locale.ROOT);
    if (upper.equals("HALF")) {
      return 0.5;
    }
    if (upper.equals("NOSIZE")) {
      return null;
    }
    Matcher fraction = FRACTION.matcher(value);
    if (fraction.matches()) {
      double denominator = Double.parseDouble(fraction.group(2));
      return denominator == 0 ? null : Double.parseDouble(fraction.group(1)) / denominator;
    }
    if (NUMBER.matcher(value).matches()) {
      return Double.parseDouble(value);
    }
    return null;
  }

  private static Double positive(Double value) {
    return value != null && value > 0 ? value : null;
  }

  private static Double parseLinearFeet(Object raw) {
    if (raw instanceof Number n) {
      return n.doubleValue();
    }
    try {
      return Double.parseDouble(raw.toString().trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Aggregated pipe runs keep size and footage in attributes rather than in the identity key. */
  private static Map<String, Object> effectiveKey(
      Map<String, Object> identityKey, Map<String, Object> attributes) {
    if (identityKey == null) {
      return Map.of();
    }
    if (!identityKey.containsKey("pipe_id") || attributes == null) {
      return identityKey;
    }
    var effective = new HashMap<String, Object>(identityKey);
    if (attributes.containsKey("size")) {
      effective.put("size", attributes.get("size"));
    }
    if (attributes.containsKey("total_linear_feet")) {
      effective.put("linear_feet", attributes.get("total_linear_feet"));
    }
    return effective;
  }

  private static boolean usesLinearFeet(String itemType) {
    String upper = itemType.toUpperCase(Locale.ROOT);
    return upper.contains("THREADED") || upper.equals("PIPE");
  }

  private static double fallbackWeight(String itemType) {
    return itemType.toUpperCase(Locale.ROOT).contains("THREADED") ? 1.0 : 0.5;
  }
}
