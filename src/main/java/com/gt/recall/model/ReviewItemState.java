package com.gt.recall.model;

import java.time.Instant;

public record ReviewItemState(ReviewItem item, SchedulingState state) {

    public String itemId() {
        return item.id();
    }

    public Instant nextDueAt() {
        return state.nextDueAt(item.createdAt());
    }

    public boolean isDue(Instant now) {
        return !now.isBefore(nextDueAt());
    }

    public ReviewItemState withState(SchedulingState newState) {
        return new ReviewItemState(item, newState);
    }
}
