package com.gt.recall.forecast;

import com.gt.recall.exception.InvalidArgumentException;
import com.gt.recall.model.FutureReview;
import com.gt.recall.model.ReviewItemState;
import com.gt.recall.model.SchedulingState;
import com.gt.recall.outcome.ReviewOutcomeEvaluator;
import com.gt.recall.scheduling.SchedulingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;

@Component
public class ReviewForecaster {

    private static final Logger log = LoggerFactory.getLogger(ReviewForecaster.class);

    private final SchedulingEngine schedulingEngine;
    private final double assumedQuality;
    private final int maxEventsPerItem;

    @Autowired
    public ReviewForecaster(SchedulingEngine schedulingEngine,
                            @Value("${recall.forecast.assumedQuality}") double assumedQuality,
                            @Value("${recall.forecast.maxEventsPerItem}") int maxEventsPerItem) {
        if (!ReviewOutcomeEvaluator.isValidQuality(assumedQuality) || !SchedulingEngine.isPassing(assumedQuality)) {
            throw new IllegalArgumentException("Assumed forecast quality must be a passing quality: " + assumedQuality);
        }

        this.schedulingEngine = schedulingEngine;
        this.assumedQuality = assumedQuality;
        this.maxEventsPerItem = maxEventsPerItem;
    }

    public List<FutureReview> forecast(Collection<ReviewItemState> items, Instant now, Instant cutoff) {
        if (items == null || now == null || cutoff == null) {
            throw new InvalidArgumentException("Items, evaluation time and cutoff are required");
        }
        if (cutoff.isBefore(now)) {
            throw new InvalidArgumentException("Forecast cutoff " + cutoff + " is before " + now);
        }

        List<FutureReview> futureReviews = new ArrayList<>();
        for (ReviewItemState itemState : items) {
            futureReviews.addAll(forecastItem(itemState, now, cutoff));
        }
        futureReviews.sort(Comparator.comparing(FutureReview::reviewAt).thenComparing(FutureReview::itemId));

        log.info("Forecast {} reviews for {} items until {}", futureReviews.size(), items.size(), cutoff);
        return futureReviews;
    }

    public SortedMap<LocalDate, Integer> reviewsPerDay(Collection<ReviewItemState> items, Instant now, Instant cutoff, ZoneId zone) {
        SortedMap<LocalDate, Integer> reviewsPerDay = new TreeMap<>();

        for (FutureReview futureReview : forecast(items, now, cutoff)) {
            reviewsPerDay.merge(LocalDate.ofInstant(futureReview.reviewAt(), zone), 1, Integer::sum);
        }

        return reviewsPerDay;
    }

    private List<FutureReview> forecastItem(ReviewItemState itemState, Instant now, Instant cutoff) {
        List<FutureReview> futureReviews = new ArrayList<>();

        // Overdue items are assumed to be reviewed right away
        Instant reviewTime = itemState.nextDueAt().isAfter(now) ? itemState.nextDueAt() : now;
        if (reviewTime.isAfter(cutoff)) {
            return futureReviews;
        }
        futureReviews.add(new FutureReview(itemState.itemId(), reviewTime, false));

        SchedulingState state = schedulingEngine.apply(itemState.state(), assumedQuality, reviewTime);
        Instant nextReviewTime = reviewTime.plus(Duration.ofDays(state.intervalDays()));

        // Later reviews assume every answer passes with assumedQuality
        while (!nextReviewTime.isAfter(cutoff) && futureReviews.size() < maxEventsPerItem) {
            futureReviews.add(new FutureReview(itemState.itemId(), nextReviewTime, true));

            state = schedulingEngine.apply(state, assumedQuality, nextReviewTime);
            nextReviewTime = nextReviewTime.plus(Duration.ofDays(state.intervalDays()));
        }

        return futureReviews;
    }
}
