package com.gt.recall.model;

public enum EaseBand {
    VeryEasy(2.5),
    Easy(2.2),
    Medium(1.8),
    Hard(1.5),
    VeryHard(Double.NEGATIVE_INFINITY);

    private double lowerBound;

    EaseBand(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public static EaseBand forEaseFactor(double easeFactor) {
        for (EaseBand band : values()) {
            if (easeFactor >= band.lowerBound) {
                return band;
            }
        }

        return VeryHard;
    }
}
