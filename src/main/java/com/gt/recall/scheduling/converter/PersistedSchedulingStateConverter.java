package com.gt.recall.scheduling.converter;

import com.gt.recall.model.SchedulingState;
import com.gt.recall.scheduling.model.PersistedSchedulingState;

public class PersistedSchedulingStateConverter {

    public static SchedulingState convertPersistedSchedulingState(PersistedSchedulingState persistedState) {
        return new SchedulingState(
                persistedState.easeFactor(),
                persistedState.intervalDays(),
                persistedState.streak(),
                persistedState.reviewCount(),
                persistedState.lastReviewedAt(),
                persistedState.decayHalfLifeDays());
    }

    public static PersistedSchedulingState convertSchedulingState(String itemId, SchedulingState schedulingState) {
        return new PersistedSchedulingState(
                itemId,
                schedulingState.easeFactor(),
                schedulingState.intervalDays(),
                schedulingState.streak(),
                schedulingState.reviewCount(),
                schedulingState.lastReviewedAt(),
                schedulingState.decayHalfLifeDays());
    }
}
