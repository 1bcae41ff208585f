package io.pipetrak.progress.item;

import io.pipetrak.progress.progress.ProgressBreakdown;
import io.pipetrak.progress.template.MilestoneSchedule;

public record ItemProgress(Item item, MilestoneSchedule schedule, ProgressBreakdown breakdown) {}
