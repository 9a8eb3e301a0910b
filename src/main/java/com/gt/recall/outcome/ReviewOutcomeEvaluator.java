package com.gt.recall.outcome;

import com.gt.recall.exception.InvalidOutcomeException;
import com.gt.recall.model.ResponseSpeed;
import com.gt.recall.model.ReviewSignal;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ReviewOutcomeEvaluator {

    public static final double MIN_QUALITY = 0;
    public static final double MAX_QUALITY = 5;

    static final double INCORRECT_QUALITY = 1;
    static final double INCORRECT_NEAR_MISS_QUALITY = 2;
    static final double CORRECT_SLOW_QUALITY = 3;
    static final double CORRECT_NORMAL_QUALITY = 4;
    static final double CORRECT_FAST_QUALITY = 5;

    private final long fastResponseMs;
    private final long slowResponseMs;

    @Autowired
    public ReviewOutcomeEvaluator(@Value("${recall.outcome.fastResponseMs}") long fastResponseMs,
                                  @Value("${recall.outcome.slowResponseMs}") long slowResponseMs) {
        if (fastResponseMs < 0 || slowResponseMs < fastResponseMs) {
            throw new IllegalArgumentException("Response buckets must satisfy 0 <= fast <= slow. fast=" + fastResponseMs + " slow=" + slowResponseMs);
        }

        this.fastResponseMs = fastResponseMs;
        this.slowResponseMs = slowResponseMs;
    }

    public double normalize(ReviewSignal signal) {
        if (signal == null) {
            throw new InvalidOutcomeException("Review signal is missing");
        }

        if (signal.selfRating() != null) {
            return normalizeSelfRating(signal.selfRating());
        }

        if (signal.correct() == null) {
            throw new InvalidOutcomeException("Review signal has neither a self-rating nor a correctness flag");
        }
        if (signal.elapsedTimeMs() != null && signal.elapsedTimeMs() < 0) {
            throw new InvalidOutcomeException("Elapsed time cannot be negative: " + signal.elapsedTimeMs());
        }

        if (!signal.correct()) {
            return signal.nearMiss() ? INCORRECT_NEAR_MISS_QUALITY : INCORRECT_QUALITY;
        }

        return switch (resolveResponseSpeed(signal)) {
            case Fast -> CORRECT_FAST_QUALITY;
            case Normal -> CORRECT_NORMAL_QUALITY;
            case Slow -> CORRECT_SLOW_QUALITY;
        };
    }

    public static boolean isValidQuality(double quality) {
        return !Double.isNaN(quality) && quality >= MIN_QUALITY && quality <= MAX_QUALITY;
    }

    private double normalizeSelfRating(double selfRating) {
        if (!isValidQuality(selfRating)) {
            throw new InvalidOutcomeException("Self-rating " + selfRating + " is outside [" + MIN_QUALITY + "," + MAX_QUALITY + "]");
        }

        return selfRating;
    }

    private ResponseSpeed resolveResponseSpeed(ReviewSignal signal) {
        if (signal.responseSpeed() != null) {
            return signal.responseSpeed();
        }

        if (signal.elapsedTimeMs() == null) {
            throw new InvalidOutcomeException("Correct answer reported without a response speed or elapsed time");
        }

        long elapsedTimeMs = signal.elapsedTimeMs();
        if (elapsedTimeMs <= fastResponseMs) {
            return ResponseSpeed.Fast;
        } else if (elapsedTimeMs >= slowResponseMs) {
            return ResponseSpeed.Slow;
        }

        return ResponseSpeed.Normal;
    }
}
