package com.insightreel.pipeline.entity;

import java.time.LocalDateTime;

/**
 * How often a campaign fires.
 */
public enum CampaignFrequency {
    DAILY,
    WEEKLY,
    BIWEEKLY,
    MONTHLY;

    /**
     * The run time one period after {@code from}.
     */
    public LocalDateTime advance(LocalDateTime from) {
        return switch (this) {
            case DAILY -> from.plusDays(1);
            case WEEKLY -> from.plusWeeks(1);
            case BIWEEKLY -> from.plusWeeks(2);
            case MONTHLY -> from.plusMonths(1);
        };
    }
}
