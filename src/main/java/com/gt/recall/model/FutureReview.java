package com.gt.recall.model;

import java.time.Instant;

public record FutureReview(String itemId,
                           Instant reviewAt,
                           boolean inferred) { }
