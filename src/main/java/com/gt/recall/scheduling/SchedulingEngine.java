package com.gt.recall.scheduling;

import com.gt.recall.exception.InvalidArgumentException;
import com.gt.recall.exception.InvalidOutcomeException;
import com.gt.recall.exception.InvalidStateException;
import com.gt.recall.model.ReviewEvent;
import com.gt.recall.model.ReviewSignal;
import com.gt.recall.model.SchedulingState;
import com.gt.recall.outcome.ReviewOutcomeEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * SM-2 derived scheduler. Every operation is a pure transition from one {@link SchedulingState} snapshot to its
 * successor, so the caller is free to persist, retry or discard the result.
 */
@Component
public class SchedulingEngine {

    private static final Logger log = LoggerFactory.getLogger(SchedulingEngine.class);

    public static final double MIN_EASE_FACTOR = 1.3;
    public static final double PASS_THRESHOLD = 3;
    public static final double MIN_HALF_LIFE_DAYS = 1;

    static final int FIRST_INTERVAL_DAYS = 1;
    static final int SECOND_INTERVAL_DAYS = 6;
    static final int FAILED_INTERVAL_DAYS = 1;

    private final ReviewOutcomeEvaluator reviewOutcomeEvaluator;
    private final double initialEaseFactor;
    private final double initialHalfLifeDays;
    private final int maxIntervalDays;
    private final double halfLifeGrowth;
    private final double halfLifeShrink;
    private final double maxHalfLifeDays;

    @Autowired
    public SchedulingEngine(ReviewOutcomeEvaluator reviewOutcomeEvaluator,
                            @Value("${recall.scheduling.initialEaseFactor}") double initialEaseFactor,
                            @Value("${recall.scheduling.initialHalfLifeDays}") double initialHalfLifeDays,
                            @Value("${recall.scheduling.maxIntervalDays}") int maxIntervalDays,
                            @Value("${recall.scheduling.halfLifeGrowth}") double halfLifeGrowth,
                            @Value("${recall.scheduling.halfLifeShrink}") double halfLifeShrink,
                            @Value("${recall.scheduling.maxHalfLifeDays}") double maxHalfLifeDays) {
        if (initialEaseFactor < MIN_EASE_FACTOR) {
            throw new IllegalArgumentException("Initial ease factor " + initialEaseFactor + " is below " + MIN_EASE_FACTOR);
        }
        if (initialHalfLifeDays < MIN_HALF_LIFE_DAYS || maxHalfLifeDays < initialHalfLifeDays) {
            throw new IllegalArgumentException("Half-life configuration must satisfy 1 <= initial <= max. initial=" + initialHalfLifeDays + " max=" + maxHalfLifeDays);
        }
        if (halfLifeGrowth < 1 || halfLifeShrink <= 0 || halfLifeShrink > 1) {
            throw new IllegalArgumentException("Half-life growth must be >= 1 and shrink in (0,1]. growth=" + halfLifeGrowth + " shrink=" + halfLifeShrink);
        }
        if (maxIntervalDays < SECOND_INTERVAL_DAYS) {
            throw new IllegalArgumentException("Max interval " + maxIntervalDays + " is shorter than the second review interval");
        }

        this.reviewOutcomeEvaluator = reviewOutcomeEvaluator;
        this.initialEaseFactor = initialEaseFactor;
        this.initialHalfLifeDays = initialHalfLifeDays;
        this.maxIntervalDays = maxIntervalDays;
        this.halfLifeGrowth = halfLifeGrowth;
        this.halfLifeShrink = halfLifeShrink;
        this.maxHalfLifeDays = maxHalfLifeDays;
    }

    // State assigned when an item is first registered
    public SchedulingState initialState() {
        return new SchedulingState(initialEaseFactor, 0, 0, 0, null, initialHalfLifeDays);
    }

    public SchedulingState apply(SchedulingState state, double quality, Instant now) {
        verifyState(state);
        if (!ReviewOutcomeEvaluator.isValidQuality(quality)) {
            throw new InvalidOutcomeException("Quality " + quality + " is outside [" + ReviewOutcomeEvaluator.MIN_QUALITY + "," + ReviewOutcomeEvaluator.MAX_QUALITY + "]");
        }
        if (now == null) {
            throw new InvalidArgumentException("Review time is required");
        }

        double newEaseFactor = calculateEaseFactor(state.easeFactor(), quality);
        boolean passed = isPassing(quality);

        int newStreak;
        int newIntervalDays;
        if (passed) {
            newStreak = state.streak() + 1;
            newIntervalDays = calculatePassingInterval(newStreak, state.intervalDays(), newEaseFactor);
        } else {
            newStreak = 0;
            newIntervalDays = FAILED_INTERVAL_DAYS;
        }

        SchedulingState newState = new SchedulingState(
                newEaseFactor,
                newIntervalDays,
                newStreak,
                state.reviewCount() + 1,
                now,
                calculateHalfLife(state.decayHalfLifeDays(), passed));

        log.debug("Applied quality {} -> ease {} interval {}d streak {} half-life {}d",
                quality, newState.easeFactor(), newState.intervalDays(), newState.streak(), newState.decayHalfLifeDays());

        return newState;
    }

    public ReviewEvent review(String itemId, SchedulingState state, ReviewSignal signal, Instant now) {
        double quality = reviewOutcomeEvaluator.normalize(signal);
        SchedulingState newState = apply(state, quality, now);

        return new ReviewEvent(itemId, now, signal, quality, newState, null, false);
    }

    public static boolean isPassing(double quality) {
        return quality >= PASS_THRESHOLD;
    }

    double calculateHalfLife(double halfLifeDays, boolean passed) {
        if (passed) {
            // A half-life already past the cap is kept, never lowered by a pass
            return Math.max(halfLifeDays, Math.min(maxHalfLifeDays, halfLifeDays * halfLifeGrowth));
        }

        return Math.max(MIN_HALF_LIFE_DAYS, halfLifeDays * halfLifeShrink);
    }

    private double calculateEaseFactor(double easeFactor, double quality) {
        double missing = ReviewOutcomeEvaluator.MAX_QUALITY - quality;

        return Math.max(MIN_EASE_FACTOR, easeFactor + (0.1 - missing * (0.08 + missing * 0.02)));
    }

    private int calculatePassingInterval(int newStreak, int currentIntervalDays, double newEaseFactor) {
        if (newStreak == 1) {
            return FIRST_INTERVAL_DAYS;
        } else if (newStreak == 2) {
            return SECOND_INTERVAL_DAYS;
        }

        // Growth is capped, but an interval already past the cap is never shortened by a passing review
        int baseIntervalDays = Math.max(FIRST_INTERVAL_DAYS, currentIntervalDays);
        long grownIntervalDays = Math.round(baseIntervalDays * newEaseFactor);
        return (int) Math.max(baseIntervalDays, Math.min(maxIntervalDays, grownIntervalDays));
    }

    private void verifyState(SchedulingState state) {
        if (state == null) {
            throw new InvalidArgumentException("Scheduling state is required");
        }

        String violation = null;
        if (Double.isNaN(state.easeFactor()) || state.easeFactor() < MIN_EASE_FACTOR) {
            violation = "ease factor " + state.easeFactor() + " is below " + MIN_EASE_FACTOR;
        } else if (state.intervalDays() < 0) {
            violation = "interval " + state.intervalDays() + " is negative";
        } else if (state.streak() < 0) {
            violation = "streak " + state.streak() + " is negative";
        } else if (state.reviewCount() < 0) {
            violation = "review count " + state.reviewCount() + " is negative";
        } else if (Double.isNaN(state.decayHalfLifeDays()) || state.decayHalfLifeDays() < MIN_HALF_LIFE_DAYS) {
            violation = "half-life " + state.decayHalfLifeDays() + " is below " + MIN_HALF_LIFE_DAYS;
        }

        if (violation != null) {
            String errMsg = "Corrupted scheduling state: " + violation;

            log.error(errMsg);
            throw new InvalidStateException(errMsg);
        }
    }
}
