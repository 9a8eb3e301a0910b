package com.gt.recall.model;

import java.util.Map;

public record CollectionReviewSummary(int totalItems,
                                      int newItems,
                                      int dueItems,
                                      double averageRetention,
                                      double averageMastery,
                                      Map<EaseBand, Integer> itemsByEaseBand,
                                      Map<ReviewCountBand, Integer> itemsByReviewCountBand) { }
