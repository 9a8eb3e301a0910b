package com.gt.recall.model;

import java.time.Instant;

public record RefreshSuggestion(ReviewItem item,
                                SchedulingState state,
                                double retentionProbability,
                                boolean due,
                                Instant thresholdReachedAt) { }
