package io.pipetrak.progress.template;

/**
 * How a milestone value turns into weighted completion. DISCRETE counts only the canonical
 * "complete" value; PARTIAL contributes proportionally to any value in 0-100.
 */
public enum CompletionKind {
  DISCRETE,
  PARTIAL
}
