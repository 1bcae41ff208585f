package io.pipetrak.progress.milestone;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds an item's milestone map from its event log. The cached map on the item is a projection
 * of exactly this function.
 */
public final class MilestoneReplay {

  private MilestoneReplay() {}

  /**
   * Applies every event in the given order, starting from an empty map. Names match
   * case-insensitively; the latest event's spelling is kept.
   */
  public static Map<String, BigDecimal> replay(List<MilestoneEvent> events) {
    var state = new LinkedHashMap<String, BigDecimal>();
    for (var event : events) {
      String name = event.getMilestoneName();
      state.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
      state.put(name, event.getNewValue());
    }
    return state;
  }

  /** Replays only events that occurred strictly before {@code end}. */
  public static Map<String, BigDecimal> replayBefore(List<MilestoneEvent> events, Instant end) {
    return replay(events.stream().filter(e -> e.getOccurredAt().isBefore(end)).toList());
  }

  /** Whether two milestone maps hold the same values, ignoring decimal scale. */
  public static boolean sameValues(Map<String, BigDecimal> left, Map<String, BigDecimal> right) {
    if (left.size() != right.size()) {
      return false;
    }
    for (var entry : left.entrySet()) {
      BigDecimal other = right.get(entry.getKey());
      if (other == null || other.compareTo(entry.getValue()) != 0) {
        return false;
      }
    }
    return true;
  }
}
