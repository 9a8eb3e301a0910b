package com.gt.recall.scheduling.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.Instant;

// Layout the external store keeps per item id
public record PersistedSchedulingState(String itemId,
                                       double easeFactor,
                                       int intervalDays,
                                       int streak,
                                       int reviewCount,
                                       @JsonFormat(shape = JsonFormat.Shape.STRING) Instant lastReviewedAt,
                                       double decayHalfLifeDays) { }
