package com.gt.recall.due;

import com.gt.recall.exception.InvalidArgumentException;
import com.gt.recall.model.ReviewItemState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

@Component
public class DueSetSelector {

    private static final Logger log = LoggerFactory.getLogger(DueSetSelector.class);

    public List<ReviewItemState> selectDue(Collection<ReviewItemState> items, Instant now, int limit) {
        return selectDue(items, now, limit, Set.of());
    }

    // Restricts the selection to items carrying every tag in requiredTags
    public List<ReviewItemState> selectDue(Collection<ReviewItemState> items, Instant now, int limit, Set<String> requiredTags) {
        verifyArguments(items, now);
        if (limit <= 0) {
            throw new InvalidArgumentException("Limit must be positive: " + limit);
        }

        Set<String> tags = requiredTags == null ? Set.of() : requiredTags;

        List<ReviewItemState> dueItems = items.stream()
                .filter(itemState -> itemState.isDue(now))
                .filter(itemState -> tags.stream().allMatch(itemState.item()::hasTag))
                .sorted(dueOrder())
                .limit(limit)
                .toList();

        log.debug("Selected {} due items from {} candidates", dueItems.size(), items.size());

        return dueItems;
    }

    public int countDue(Collection<ReviewItemState> items, Instant now) {
        verifyArguments(items, now);

        return (int) items.stream().filter(itemState -> itemState.isDue(now)).count();
    }

    // Earliest due time is the same as most overdue for a fixed now
    static Comparator<ReviewItemState> dueOrder() {
        return Comparator.comparing(ReviewItemState::nextDueAt)
                .thenComparingDouble(itemState -> itemState.state().easeFactor())
                .thenComparing(ReviewItemState::itemId);
    }

    private void verifyArguments(Collection<ReviewItemState> items, Instant now) {
        if (items == null) {
            throw new InvalidArgumentException("Candidate items are required");
        }
        if (now == null) {
            throw new InvalidArgumentException("Evaluation time is required");
        }
    }
}
