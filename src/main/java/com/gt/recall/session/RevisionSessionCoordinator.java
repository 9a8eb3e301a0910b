package com.gt.recall.session;

import com.gt.recall.due.DueSetSelector;
import com.gt.recall.exception.InvalidArgumentException;
import com.gt.recall.exception.UnknownItemException;
import com.gt.recall.model.ReviewEvent;
import com.gt.recall.model.ReviewItemState;
import com.gt.recall.model.ReviewSignal;
import com.gt.recall.model.SessionStatus;
import com.gt.recall.outcome.ReviewOutcomeEvaluator;
import com.gt.recall.scheduling.SchedulingEngine;
import com.gt.recall.session.model.SessionStatistics;
import com.gt.recall.session.model.SubmissionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

@Component
public class RevisionSessionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RevisionSessionCoordinator.class);

    private final DueSetSelector dueSetSelector;
    private final SchedulingEngine schedulingEngine;
    private final ReviewOutcomeEvaluator reviewOutcomeEvaluator;
    private final int maxSessionSize;
    private final int maxRedrillsPerItem;

    @Autowired
    public RevisionSessionCoordinator(DueSetSelector dueSetSelector,
                                      SchedulingEngine schedulingEngine,
                                      ReviewOutcomeEvaluator reviewOutcomeEvaluator,
                                      @Value("${recall.session.maxSessionSize}") int maxSessionSize,
                                      @Value("${recall.session.maxRedrillsPerItem}") int maxRedrillsPerItem) {
        this.dueSetSelector = dueSetSelector;
        this.schedulingEngine = schedulingEngine;
        this.reviewOutcomeEvaluator = reviewOutcomeEvaluator;
        this.maxSessionSize = maxSessionSize;
        this.maxRedrillsPerItem = maxRedrillsPerItem;
    }

    // Returns an empty session when nothing is due
    public RevisionSession start(Collection<ReviewItemState> candidatePool, Instant now, int sessionSize) {
        if (sessionSize <= 0) {
            throw new InvalidArgumentException("Session size must be positive: " + sessionSize);
        }
        if (candidatePool == null) {
            throw new InvalidArgumentException("Candidate pool is required");
        }

        if (sessionSize > maxSessionSize) {
            sessionSize = maxSessionSize;
        }

        List<ReviewItemState> dueItems = dueSetSelector.selectDue(dedupeById(candidatePool), now, sessionSize);

        RevisionSession session = new RevisionSession(UUID.randomUUID().toString());
        session.begin(dueItems, now);

        log.info("Started revision session {} with {} of {} candidate items", session.getId(), session.size(), candidatePool.size());
        return session;
    }

    /**
     * Applies a review answer for a queued item. The first answer for an item updates its scheduling state; a failing
     * answer puts the item back at the end of the queue for an in-session re-drill. Re-drill answers are recorded but
     * leave the scheduling state produced by the first answer unchanged.
     *
     * @throws UnknownItemException if the item is not waiting in the session queue
     */
    public SubmissionResult submitOutcome(RevisionSession session, String itemId, ReviewSignal signal, Instant now) {
        verifySessionActive(session);
        if (!session.isQueued(itemId)) {
            throw new UnknownItemException("Item " + itemId + " is not queued in session " + session.getId());
        }

        boolean isRedrill = session.isAnswered(itemId);
        ReviewEvent event;
        if (isRedrill) {
            double quality = reviewOutcomeEvaluator.normalize(signal);
            event = new ReviewEvent(itemId, now, signal, quality, session.currentState(itemId), session.getId(), true);

            session.dequeue(itemId);
            session.recordRedrill(event);
        } else {
            event = schedulingEngine.review(itemId, session.currentState(itemId), signal, now).withSession(session.getId(), false);

            session.dequeue(itemId);
            session.recordFirstAnswer(event, SchedulingEngine.isPassing(event.quality()));
        }

        boolean requeued = false;
        if (!SchedulingEngine.isPassing(event.quality())) {
            requeued = session.requeue(itemId, maxRedrillsPerItem);
            if (!requeued) {
                log.debug("Item {} reached the re-drill limit in session {}", itemId, session.getId());
            }
        }

        return new SubmissionResult(event, requeued, session.getQueue().size());
    }

    public SessionStatistics complete(RevisionSession session, Instant now) {
        verifySessionActive(session);

        session.end(SessionStatus.Completed, now);
        SessionStatistics statistics = buildStatistics(session, now);

        log.info("Completed revision session {}: {} reviewed, {} passed, {} re-drills", session.getId(),
                statistics.itemsReviewed(), statistics.passed(), statistics.redrills());
        return statistics;
    }

    public void abandon(RevisionSession session, Instant now) {
        verifySessionActive(session);

        session.end(SessionStatus.Abandoned, now);

        log.info("Abandoned revision session {} with {} unanswered items", session.getId(), session.getUnanswered());
    }

    private SessionStatistics buildStatistics(RevisionSession session, Instant now) {
        int itemsReviewed = session.getPassed() + session.getFailed();
        Duration elapsed = Duration.between(session.getStartedAt(), now);

        return new SessionStatistics(
                session.getId(),
                itemsReviewed,
                session.getPassed(),
                session.getFailed(),
                itemsReviewed == 0 ? 0 : (double) session.getPassed() / itemsReviewed,
                session.getRedrills(),
                session.getUnanswered(),
                elapsed.isNegative() ? Duration.ZERO : elapsed);
    }

    private Collection<ReviewItemState> dedupeById(Collection<ReviewItemState> candidatePool) {
        Map<String, ReviewItemState> itemsById = new LinkedHashMap<>();
        for (ReviewItemState itemState : candidatePool) {
            if (itemsById.putIfAbsent(itemState.itemId(), itemState) != null) {
                log.warn("Duplicate item {} in candidate pool. Keeping the first occurrence.", itemState.itemId());
            }
        }

        return itemsById.values();
    }

    private void verifySessionActive(RevisionSession session) {
        if (session == null) {
            throw new InvalidArgumentException("Session is required");
        }
        if (session.getStatus().isTerminal()) {
            throw new IllegalStateException("Session " + session.getId() + " is " + session.getStatus() + " and no longer accepts changes");
        }
    }
}
