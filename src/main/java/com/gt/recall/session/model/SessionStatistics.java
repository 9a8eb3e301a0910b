package com.gt.recall.session.model;

import java.time.Duration;

public record SessionStatistics(String sessionId,
                                int itemsReviewed,
                                int passed,
                                int failed,
                                double passRate,
                                int redrills,
                                int unanswered,
                                Duration elapsed) { }
