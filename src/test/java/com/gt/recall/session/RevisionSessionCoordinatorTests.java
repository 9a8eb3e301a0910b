package com.gt.recall.session;

import com.gt.recall.due.DueSetSelector;
import com.gt.recall.exception.InvalidArgumentException;
import com.gt.recall.exception.InvalidOutcomeException;
import com.gt.recall.exception.UnknownItemException;
import com.gt.recall.model.ResponseSpeed;
import com.gt.recall.model.ReviewEvent;
import com.gt.recall.model.ReviewItemState;
import com.gt.recall.model.ReviewSignal;
import com.gt.recall.model.SchedulingState;
import com.gt.recall.model.SessionStatus;
import com.gt.recall.scheduling.SchedulingEngine;
import com.gt.recall.session.model.SessionStatistics;
import com.gt.recall.session.model.SubmissionResult;
import com.gt.recall.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

import static com.gt.recall.util.TestUtils.day;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(SpringExtension.class)
public class RevisionSessionCoordinatorTests {

    private static final int MAX_SESSION_SIZE = 20;
    private static final int MAX_REDRILLS_PER_ITEM = 2;
    private static final Instant SESSION_START = day(10);

    private static final ReviewItemState MOST_OVERDUE = TestUtils.reviewedItemState("most-overdue", 2.5, 1, day(0), 10);
    private static final ReviewItemState OVERDUE = TestUtils.reviewedItemState("overdue", 2.5, 6, day(0), 10);
    private static final ReviewItemState NEW_ITEM = TestUtils.newItemState("new-item", day(8));
    private static final ReviewItemState NOT_DUE = TestUtils.reviewedItemState("not-due", 2.5, 30, day(0), 10);

    private static final List<ReviewItemState> POOL = List.of(NOT_DUE, NEW_ITEM, OVERDUE, MOST_OVERDUE);

    @Mock private DueSetSelector mockDueSetSelector;

    private SchedulingEngine schedulingEngine;
    private RevisionSessionCoordinator revisionSessionCoordinator;

    @BeforeEach
    public void setup() {
        schedulingEngine = TestUtils.buildSchedulingEngine();
        revisionSessionCoordinator = new RevisionSessionCoordinator(new DueSetSelector(), schedulingEngine,
                TestUtils.buildReviewOutcomeEvaluator(), MAX_SESSION_SIZE, MAX_REDRILLS_PER_ITEM);
    }

    @Test
    public void testStart() {
        RevisionSession session = revisionSessionCoordinator.start(POOL, SESSION_START, 10);

        assertNotNull(session.getId());
        assertEquals(SessionStatus.InProgress, session.getStatus());
        assertEquals(SESSION_START, session.getStartedAt());
        assertEquals(3, session.size());
        assertEquals(List.of(MOST_OVERDUE.itemId(), OVERDUE.itemId(), NEW_ITEM.itemId()), session.getQueue());
        assertEquals(MOST_OVERDUE.itemId(), session.peekNext().orElseThrow());
        assertTrue(session.getUpdatedStates().isEmpty());
        assertTrue(session.getEvents().isEmpty());
    }

    @Test
    public void testStart_SessionSizeTruncatesQueue() {
        RevisionSession session = revisionSessionCoordinator.start(POOL, SESSION_START, 2);

        assertEquals(List.of(MOST_OVERDUE.itemId(), OVERDUE.itemId()), session.getQueue());
    }

    @Test
    public void testStart_NothingDue() {
        RevisionSession session = revisionSessionCoordinator.start(List.of(NOT_DUE), SESSION_START, 10);

        assertTrue(session.isEmpty());
        assertEquals(SessionStatus.InProgress, session.getStatus());
        assertTrue(session.peekNext().isEmpty());

        SessionStatistics statistics = revisionSessionCoordinator.complete(session, SESSION_START.plusSeconds(5));
        assertEquals(0, statistics.itemsReviewed());
        assertEquals(0, statistics.passRate());
        assertEquals(0, statistics.unanswered());
    }

    @Test
    public void testStart_CapsSessionSizeAndDedupesPool() {
        RevisionSessionCoordinator mockedCoordinator = new RevisionSessionCoordinator(mockDueSetSelector, schedulingEngine,
                TestUtils.buildReviewOutcomeEvaluator(), MAX_SESSION_SIZE, MAX_REDRILLS_PER_ITEM);

        mockedCoordinator.start(List.of(OVERDUE, NEW_ITEM, OVERDUE), SESSION_START, 500);

        ArgumentCaptor<Collection<ReviewItemState>> poolCaptor = ArgumentCaptor.forClass(Collection.class);
        verify(mockDueSetSelector).selectDue(poolCaptor.capture(), eq(SESSION_START), eq(MAX_SESSION_SIZE));
        assertEquals(List.of(OVERDUE, NEW_ITEM), List.copyOf(poolCaptor.getValue()));
    }

    @Test
    public void testStart_InvalidArguments() {
        assertThrows(InvalidArgumentException.class, () -> revisionSessionCoordinator.start(POOL, SESSION_START, 0));
        assertThrows(InvalidArgumentException.class, () -> revisionSessionCoordinator.start(null, SESSION_START, 10));
    }

    @Test
    public void testSubmitOutcome_Pass() {
        RevisionSession session = revisionSessionCoordinator.start(POOL, SESSION_START, 10);
        Instant answerTime = SESSION_START.plusSeconds(30);

        SubmissionResult result = revisionSessionCoordinator.submitOutcome(session, MOST_OVERDUE.itemId(), ReviewSignal.answered(true, ResponseSpeed.Fast), answerTime);

        ReviewEvent event = result.event();
        assertEquals(MOST_OVERDUE.itemId(), event.itemId());
        assertEquals(answerTime, event.eventInstant());
        assertEquals(5, event.quality());
        assertEquals(session.getId(), event.sessionId());
        assertFalse(event.redrill());
        assertEquals(schedulingEngine.apply(MOST_OVERDUE.state(), 5, answerTime), event.resultingState());

        assertFalse(result.requeued());
        assertEquals(2, result.remainingInQueue());
        assertEquals(List.of(OVERDUE.itemId(), NEW_ITEM.itemId()), session.getQueue());
        assertEquals(event.resultingState(), session.getUpdatedStates().get(MOST_OVERDUE.itemId()));
        assertEquals(List.of(event), session.getEvents());
    }

    @Test
    public void testSubmitOutcome_FailRequeuesAtBack() {
        RevisionSession session = revisionSessionCoordinator.start(POOL, SESSION_START, 10);

        SubmissionResult result = revisionSessionCoordinator.submitOutcome(session, MOST_OVERDUE.itemId(), ReviewSignal.answered(false, 4000), SESSION_START.plusSeconds(10));

        assertTrue(result.requeued());
        assertEquals(3, result.remainingInQueue());
        assertEquals(List.of(OVERDUE.itemId(), NEW_ITEM.itemId(), MOST_OVERDUE.itemId()), session.getQueue());

        SchedulingState persistedState = session.getUpdatedStates().get(MOST_OVERDUE.itemId());
        assertEquals(0, persistedState.streak());
        assertEquals(1, persistedState.intervalDays());
    }

    @Test
    public void testSubmitOutcome_RedrillLeavesSchedulingStateUnchanged() {
        RevisionSession session = revisionSessionCoordinator.start(POOL, SESSION_START, 10);

        revisionSessionCoordinator.submitOutcome(session, NEW_ITEM.itemId(), ReviewSignal.selfRated(1), SESSION_START.plusSeconds(10));
        SchedulingState stateAfterFailure = session.getUpdatedStates().get(NEW_ITEM.itemId());

        SubmissionResult redrillResult = revisionSessionCoordinator.submitOutcome(session, NEW_ITEM.itemId(), ReviewSignal.selfRated(5), SESSION_START.plusSeconds(90));

        assertTrue(redrillResult.event().redrill());
        assertEquals(5, redrillResult.event().quality());
        assertEquals(stateAfterFailure, redrillResult.event().resultingState());
        assertFalse(redrillResult.requeued());
        assertEquals(stateAfterFailure, session.getUpdatedStates().get(NEW_ITEM.itemId()));
        assertEquals(1, stateAfterFailure.reviewCount());
        assertEquals(2, session.getEvents().size());
        assertFalse(session.getQueue().contains(NEW_ITEM.itemId()));
    }

    @Test
    public void testSubmitOutcome_RedrillLimit() {
        RevisionSession session = revisionSessionCoordinator.start(List.of(NEW_ITEM), SESSION_START, 10);
        ReviewSignal failure = ReviewSignal.selfRated(0);

        assertTrue(revisionSessionCoordinator.submitOutcome(session, NEW_ITEM.itemId(), failure, SESSION_START.plusSeconds(10)).requeued());
        assertTrue(revisionSessionCoordinator.submitOutcome(session, NEW_ITEM.itemId(), failure, SESSION_START.plusSeconds(20)).requeued());

        SubmissionResult lastResult = revisionSessionCoordinator.submitOutcome(session, NEW_ITEM.itemId(), failure, SESSION_START.plusSeconds(30));
        assertFalse(lastResult.requeued());
        assertEquals(0, lastResult.remainingInQueue());
        assertTrue(session.getQueue().isEmpty());

        SessionStatistics statistics = revisionSessionCoordinator.complete(session, SESSION_START.plusSeconds(40));
        assertEquals(1, statistics.itemsReviewed());
        assertEquals(1, statistics.failed());
        assertEquals(2, statistics.redrills());
    }

    @Test
    public void testSubmitOutcome_UnknownItem() {
        RevisionSession session = revisionSessionCoordinator.start(POOL, SESSION_START, 10);

        assertThrows(UnknownItemException.class,
                () -> revisionSessionCoordinator.submitOutcome(session, NOT_DUE.itemId(), ReviewSignal.selfRated(4), SESSION_START));
        assertThrows(UnknownItemException.class,
                () -> revisionSessionCoordinator.submitOutcome(session, "missing", ReviewSignal.selfRated(4), SESSION_START));

        revisionSessionCoordinator.submitOutcome(session, OVERDUE.itemId(), ReviewSignal.selfRated(4), SESSION_START);
        assertThrows(UnknownItemException.class,
                () -> revisionSessionCoordinator.submitOutcome(session, OVERDUE.itemId(), ReviewSignal.selfRated(4), SESSION_START));
    }

    @Test
    public void testSubmitOutcome_InvalidSignalLeavesQueueUnchanged() {
        RevisionSession session = revisionSessionCoordinator.start(POOL, SESSION_START, 10);
        List<String> queueBefore = session.getQueue();

        assertThrows(InvalidOutcomeException.class,
                () -> revisionSessionCoordinator.submitOutcome(session, OVERDUE.itemId(), ReviewSignal.selfRated(7), SESSION_START));

        assertEquals(queueBefore, session.getQueue());
        assertTrue(session.getEvents().isEmpty());
    }

    @Test
    public void testComplete() {
        RevisionSession session = revisionSessionCoordinator.start(POOL, SESSION_START, 10);

        revisionSessionCoordinator.submitOutcome(session, MOST_OVERDUE.itemId(), ReviewSignal.selfRated(5), SESSION_START.plusSeconds(10));
        revisionSessionCoordinator.submitOutcome(session, OVERDUE.itemId(), ReviewSignal.selfRated(2), SESSION_START.plusSeconds(20));
        revisionSessionCoordinator.submitOutcome(session, OVERDUE.itemId(), ReviewSignal.selfRated(4), SESSION_START.plusSeconds(30));

        SessionStatistics statistics = revisionSessionCoordinator.complete(session, SESSION_START.plus(Duration.ofMinutes(5)));

        assertEquals(SessionStatus.Completed, session.getStatus());
        assertEquals(SESSION_START.plus(Duration.ofMinutes(5)), session.getEndedAt());
        assertEquals(session.getId(), statistics.sessionId());
        assertEquals(2, statistics.itemsReviewed());
        assertEquals(1, statistics.passed());
        assertEquals(1, statistics.failed());
        assertEquals(0.5, statistics.passRate());
        assertEquals(1, statistics.redrills());
        assertEquals(1, statistics.unanswered());
        assertEquals(Duration.ofMinutes(5), statistics.elapsed());
        assertEquals(2, session.getUpdatedStates().size());
    }

    @Test
    public void testTerminalSessionRejectsChanges() {
        RevisionSession completed = revisionSessionCoordinator.start(POOL, SESSION_START, 10);
        revisionSessionCoordinator.complete(completed, SESSION_START);

        assertThrows(IllegalStateException.class,
                () -> revisionSessionCoordinator.submitOutcome(completed, OVERDUE.itemId(), ReviewSignal.selfRated(4), SESSION_START));
        assertThrows(IllegalStateException.class, () -> revisionSessionCoordinator.complete(completed, SESSION_START));
        assertThrows(IllegalStateException.class, () -> revisionSessionCoordinator.abandon(completed, SESSION_START));
    }

    @Test
    public void testAbandon() {
        RevisionSession session = revisionSessionCoordinator.start(POOL, SESSION_START, 10);
        revisionSessionCoordinator.submitOutcome(session, MOST_OVERDUE.itemId(), ReviewSignal.selfRated(4), SESSION_START.plusSeconds(10));

        revisionSessionCoordinator.abandon(session, SESSION_START.plusSeconds(60));

        assertEquals(SessionStatus.Abandoned, session.getStatus());
        assertEquals(SESSION_START.plusSeconds(60), session.getEndedAt());
        assertEquals(1, session.getUpdatedStates().size());
        assertThrows(IllegalStateException.class,
                () -> revisionSessionCoordinator.submitOutcome(session, OVERDUE.itemId(), ReviewSignal.selfRated(4), SESSION_START));
        assertThrows(IllegalStateException.class, () -> revisionSessionCoordinator.complete(session, SESSION_START));
    }
}
