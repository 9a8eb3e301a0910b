package com.gt.recall.stats.model;

import java.util.List;
import java.util.Map;

public record PerformanceAnalysis(double overallAverageQuality,
                                  Map<String, ItemPerformance> itemPerformance,
                                  List<String> difficultItemIds,
                                  List<String> improvingItemIds) { }
