package com.gt.recall.model;

// Either selfRating, or correct with a responseSpeed bucket or elapsedTimeMs
public record ReviewSignal(Double selfRating,
                           Boolean correct,
                           boolean nearMiss,
                           ResponseSpeed responseSpeed,
                           Long elapsedTimeMs) {

    public static ReviewSignal selfRated(double rating) {
        return new ReviewSignal(rating, null, false, null, null);
    }

    public static ReviewSignal answered(boolean correct, ResponseSpeed responseSpeed) {
        return new ReviewSignal(null, correct, false, responseSpeed, null);
    }

    public static ReviewSignal answered(boolean correct, long elapsedTimeMs) {
        return new ReviewSignal(null, correct, false, null, elapsedTimeMs);
    }

    public static ReviewSignal nearMiss(long elapsedTimeMs) {
        return new ReviewSignal(null, false, true, null, elapsedTimeMs);
    }
}
