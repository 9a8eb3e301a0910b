package com.gt.recall.model;

public enum ReviewCountBand {
    New(0),
    Few(2),
    Some(5),
    Many(10),
    Mastered(Integer.MAX_VALUE);

    private int upperBound;

    ReviewCountBand(int upperBound) {
        this.upperBound = upperBound;
    }

    public static ReviewCountBand forReviewCount(int reviewCount) {
        for (ReviewCountBand band : values()) {
            if (reviewCount <= band.upperBound) {
                return band;
            }
        }

        return Mastered;
    }
}
