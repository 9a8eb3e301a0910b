package com.gt.recall.decay;

import com.gt.recall.exception.InvalidArgumentException;
import com.gt.recall.exception.InvalidStateException;
import com.gt.recall.model.SchedulingState;
import com.gt.recall.scheduling.SchedulingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential forgetting curve, {@code p = 2^(-elapsedDays / halfLifeDays)}. Decay only starts at the first review;
 * items never reviewed report full retention.
 */
@Component
public class DecayModel {

    private static final Logger log = LoggerFactory.getLogger(DecayModel.class);

    static final double SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

    private final double retentionFloor;

    @Autowired
    public DecayModel(@Value("${recall.decay.retentionFloor}") double retentionFloor) {
        if (retentionFloor <= 0 || retentionFloor >= 1) {
            throw new IllegalArgumentException("Retention floor must be in (0,1): " + retentionFloor);
        }

        this.retentionFloor = retentionFloor;
    }

    public double retentionProbability(SchedulingState state, Instant now) {
        verifyState(state);
        if (now == null) {
            throw new InvalidArgumentException("Evaluation time is required");
        }

        return retentionAt(state, elapsedDays(state, now));
    }

    public double retentionAt(SchedulingState state, double elapsedDays) {
        verifyState(state);

        if (elapsedDays <= 0) {
            return 1.0;
        }

        return Math.max(retentionFloor, Math.pow(2, -elapsedDays / state.decayHalfLifeDays()));
    }

    public Duration timeUntilRetention(SchedulingState state, double targetRetention) {
        verifyState(state);
        // Retention never drops below the floor, so lower targets are never reached
        if (Double.isNaN(targetRetention) || targetRetention < retentionFloor || targetRetention > 1) {
            throw new InvalidArgumentException("Target retention must be in [" + retentionFloor + ",1]: " + targetRetention);
        }

        double days = state.decayHalfLifeDays() * (Math.log(1 / targetRetention) / Math.log(2));
        return Duration.ofSeconds(Math.round(days * SECONDS_PER_DAY));
    }

    // Null for items that have never been reviewed, since their retention does not decay
    public Instant retentionReachedAt(SchedulingState state, double targetRetention) {
        Duration untilTarget = timeUntilRetention(state, targetRetention);

        return state.isReviewed() ? state.lastReviewedAt().plus(untilTarget) : null;
    }

    public double getRetentionFloor() {
        return retentionFloor;
    }

    private double elapsedDays(SchedulingState state, Instant now) {
        if (!state.isReviewed()) {
            return 0;
        }

        return Math.max(0, Duration.between(state.lastReviewedAt(), now).getSeconds() / SECONDS_PER_DAY);
    }

    private void verifyState(SchedulingState state) {
        if (state == null) {
            throw new InvalidArgumentException("Scheduling state is required");
        }
        if (Double.isNaN(state.decayHalfLifeDays()) || state.decayHalfLifeDays() < SchedulingEngine.MIN_HALF_LIFE_DAYS) {
            String errMsg = "Corrupted scheduling state: half-life " + state.decayHalfLifeDays() + " is below " + SchedulingEngine.MIN_HALF_LIFE_DAYS;

            log.error(errMsg);
            throw new InvalidStateException(errMsg);
        }
    }
}
