package com.gt.recall.stats.model;

import java.time.Instant;

public record ItemPerformance(String itemId,
                              int reviewCount,
                              double averageQuality,
                              double qualityTrend,
                              Instant lastReviewedAt) { }
