package com.herzen.unlock.overlay;

import java.time.LocalDate;

public class OverlayModels {
    /** One day of attempts on one activity, as produced by the attempts aggregation job. */
    public record DailyActivityMetric(LocalDate date,
                                      String moduleId,
                                      String objectiveId,
                                      String activityId,
                                      long attempts,
                                      double successRate,
                                      double repeatAttemptRate) {}
}
