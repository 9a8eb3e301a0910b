package com.gt.recall.decay;

import com.gt.recall.exception.InvalidArgumentException;
import com.gt.recall.model.RefreshSuggestion;
import com.gt.recall.model.ReviewItemState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

@Component
public class RefreshSuggestionGenerator {

    private static final Logger log = LoggerFactory.getLogger(RefreshSuggestionGenerator.class);

    private static final Comparator<RefreshSuggestion> MOST_AT_RISK_FIRST =
            Comparator.comparingDouble(RefreshSuggestion::retentionProbability)
                    .thenComparingDouble(suggestion -> suggestion.state().easeFactor())
                    .thenComparing(suggestion -> suggestion.item().id());

    private final DecayModel decayModel;

    @Autowired
    public RefreshSuggestionGenerator(DecayModel decayModel) {
        this.decayModel = decayModel;
    }

    public List<RefreshSuggestion> rank(Collection<ReviewItemState> items, Instant now, Double threshold) {
        return rank(items, now, threshold, Integer.MAX_VALUE);
    }

    public List<RefreshSuggestion> rank(Collection<ReviewItemState> items, Instant now, Double threshold, int limit) {
        if (threshold == null) {
            throw new InvalidArgumentException("Retention threshold is required");
        }
        if (threshold.isNaN() || threshold <= 0 || threshold > 1) {
            throw new InvalidArgumentException("Retention threshold must be in (0,1]: " + threshold);
        }
        if (items == null || now == null) {
            throw new InvalidArgumentException("Candidate items and evaluation time are required");
        }
        if (limit <= 0) {
            throw new InvalidArgumentException("Limit must be positive: " + limit);
        }

        List<RefreshSuggestion> suggestions = items.stream()
                .map(itemState -> buildSuggestion(itemState, now, threshold))
                .filter(suggestion -> suggestion.retentionProbability() < threshold)
                .sorted(MOST_AT_RISK_FIRST)
                .limit(limit)
                .toList();

        log.debug("{} of {} items below retention threshold {}", suggestions.size(), items.size(), threshold);

        return suggestions;
    }

    private RefreshSuggestion buildSuggestion(ReviewItemState itemState, Instant now, double threshold) {
        double retention = decayModel.retentionProbability(itemState.state(), now);

        return new RefreshSuggestion(
                itemState.item(),
                itemState.state(),
                retention,
                itemState.isDue(now),
                retention < threshold ? decayModel.retentionReachedAt(itemState.state(), threshold) : null);
    }
}
