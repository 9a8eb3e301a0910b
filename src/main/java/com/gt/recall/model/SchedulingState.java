package com.gt.recall.model;

import java.time.Duration;
import java.time.Instant;

public record SchedulingState(double easeFactor,
                              int intervalDays,
                              int streak,
                              int reviewCount,
                              Instant lastReviewedAt,
                              double decayHalfLifeDays) {

    public boolean isReviewed() {
        return lastReviewedAt != null;
    }

    // Items never reviewed are due from their creation time
    public Instant nextDueAt(Instant itemCreatedAt) {
        if (lastReviewedAt == null) {
            return itemCreatedAt;
        }

        return lastReviewedAt.plus(Duration.ofDays(intervalDays));
    }
}
