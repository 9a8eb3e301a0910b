package com.gt.recall.stats;

import com.gt.recall.decay.DecayModel;
import com.gt.recall.exception.InvalidArgumentException;
import com.gt.recall.model.CollectionReviewSummary;
import com.gt.recall.model.EaseBand;
import com.gt.recall.model.ReviewCountBand;
import com.gt.recall.model.ReviewEvent;
import com.gt.recall.model.ReviewItemState;
import com.gt.recall.model.SchedulingState;
import com.gt.recall.outcome.ReviewOutcomeEvaluator;
import com.gt.recall.scheduling.SchedulingEngine;
import com.gt.recall.stats.model.ItemPerformance;
import com.gt.recall.stats.model.PerformanceAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

@Component
public class ReviewStatisticsService {

    private static final Logger log = LoggerFactory.getLogger(ReviewStatisticsService.class);

    static final double EASE_RANGE = 1.2;
    static final int MASTERED_STREAK = 10;

    private final DecayModel decayModel;
    private final int recentReviewWindow;
    private final double difficultAverageQuality;
    private final double improvingTrend;

    @Autowired
    public ReviewStatisticsService(DecayModel decayModel,
                                   @Value("${recall.stats.recentReviewWindow}") int recentReviewWindow,
                                   @Value("${recall.stats.difficultAverageQuality}") double difficultAverageQuality,
                                   @Value("${recall.stats.improvingTrend}") double improvingTrend) {
        if (recentReviewWindow < 1) {
            throw new IllegalArgumentException("Recent review window must be positive: " + recentReviewWindow);
        }
        if (!ReviewOutcomeEvaluator.isValidQuality(difficultAverageQuality)) {
            throw new IllegalArgumentException("Difficult average quality must be a valid quality: " + difficultAverageQuality);
        }

        this.decayModel = decayModel;
        this.recentReviewWindow = recentReviewWindow;
        this.difficultAverageQuality = difficultAverageQuality;
        this.improvingTrend = improvingTrend;
    }

    // Average of the normalized ease factor and the normalized streak, in [0,1]
    public double masteryScore(SchedulingState state) {
        if (state == null) {
            throw new InvalidArgumentException("Scheduling state is required");
        }

        double easeScore = Math.min(1.0, Math.max(0.0, (state.easeFactor() - SchedulingEngine.MIN_EASE_FACTOR) / EASE_RANGE));
        double streakScore = Math.min(1.0, (double) state.streak() / MASTERED_STREAK);

        return (easeScore + streakScore) / 2;
    }

    public CollectionReviewSummary summarize(Collection<ReviewItemState> items, Instant now) {
        if (items == null || now == null) {
            throw new InvalidArgumentException("Items and evaluation time are required");
        }

        Map<EaseBand, Integer> itemsByEaseBand = new EnumMap<>(EaseBand.class);
        Map<ReviewCountBand, Integer> itemsByReviewCountBand = new EnumMap<>(ReviewCountBand.class);
        for (EaseBand band : EaseBand.values()) {
            itemsByEaseBand.put(band, 0);
        }
        for (ReviewCountBand band : ReviewCountBand.values()) {
            itemsByReviewCountBand.put(band, 0);
        }

        int newItems = 0;
        int dueItems = 0;
        double totalRetention = 0;
        double totalMastery = 0;
        for (ReviewItemState itemState : items) {
            SchedulingState state = itemState.state();

            if (!state.isReviewed()) {
                newItems++;
            }
            if (itemState.isDue(now)) {
                dueItems++;
            }
            totalRetention += decayModel.retentionProbability(state, now);
            totalMastery += masteryScore(state);

            itemsByEaseBand.merge(EaseBand.forEaseFactor(state.easeFactor()), 1, Integer::sum);
            itemsByReviewCountBand.merge(ReviewCountBand.forReviewCount(state.reviewCount()), 1, Integer::sum);
        }

        int totalItems = items.size();
        return new CollectionReviewSummary(
                totalItems,
                newItems,
                dueItems,
                totalItems == 0 ? 0 : totalRetention / totalItems,
                totalItems == 0 ? 0 : totalMastery / totalItems,
                Collections.unmodifiableMap(itemsByEaseBand),
                Collections.unmodifiableMap(itemsByReviewCountBand));
    }

    // Per item quality history from the review log. Re-drill answers are left out.
    public PerformanceAnalysis analyzePerformance(List<ReviewEvent> events) {
        if (events == null) {
            throw new InvalidArgumentException("Review events are required");
        }

        Map<String, List<ReviewEvent>> eventsByItem = new TreeMap<>();
        for (ReviewEvent event : events) {
            if (!event.redrill()) {
                eventsByItem.computeIfAbsent(event.itemId(), itemId -> new ArrayList<>()).add(event);
            }
        }

        if (eventsByItem.isEmpty()) {
            log.warn("No review history available for performance analysis");
            return new PerformanceAnalysis(0, Map.of(), List.of(), List.of());
        }

        Map<String, ItemPerformance> itemPerformance = new LinkedHashMap<>();
        List<String> difficultItemIds = new ArrayList<>();
        List<String> improvingItemIds = new ArrayList<>();
        double totalAverageQuality = 0;
        for (Map.Entry<String, List<ReviewEvent>> itemEvents : eventsByItem.entrySet()) {
            ItemPerformance performance = buildItemPerformance(itemEvents.getKey(), itemEvents.getValue());

            itemPerformance.put(performance.itemId(), performance);
            totalAverageQuality += performance.averageQuality();

            if (performance.averageQuality() < difficultAverageQuality) {
                difficultItemIds.add(performance.itemId());
            }
            if (performance.qualityTrend() > improvingTrend) {
                improvingItemIds.add(performance.itemId());
            }
        }

        log.info("Analyzed performance of {} items: {} difficult, {} improving", itemPerformance.size(),
                difficultItemIds.size(), improvingItemIds.size());

        return new PerformanceAnalysis(
                totalAverageQuality / itemPerformance.size(),
                Collections.unmodifiableMap(itemPerformance),
                List.copyOf(difficultItemIds),
                List.copyOf(improvingItemIds));
    }

    private ItemPerformance buildItemPerformance(String itemId, List<ReviewEvent> itemEvents) {
        itemEvents.sort(Comparator.comparing(ReviewEvent::eventInstant));
        int reviewCount = itemEvents.size();

        // Recent window average minus the average of every older review, 0 without older reviews
        double qualityTrend = 0;
        if (reviewCount > recentReviewWindow) {
            int windowStart = reviewCount - recentReviewWindow;
            qualityTrend = averageQuality(itemEvents.subList(windowStart, reviewCount)) - averageQuality(itemEvents.subList(0, windowStart));
        }

        return new ItemPerformance(
                itemId,
                reviewCount,
                averageQuality(itemEvents),
                qualityTrend,
                itemEvents.get(reviewCount - 1).eventInstant());
    }

    private double averageQuality(List<ReviewEvent> events) {
        double totalQuality = 0;
        for (ReviewEvent event : events) {
            totalQuality += event.quality();
        }

        return totalQuality / events.size();
    }
}
