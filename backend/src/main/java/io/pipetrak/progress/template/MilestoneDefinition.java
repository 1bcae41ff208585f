package io.pipetrak.progress.template;

import java.math.BigDecimal;

/**
 * Write-side description of one schedule entry. For default schedules every field is required; for
 * project overrides a null kind or category keeps the default's value.
 */
public record MilestoneDefinition(
    String name,
    BigDecimal weight,
    CompletionKind kind,
    MilestoneCategory category,
    boolean requiresWelder) {}
