package com.gt.recall.session;

import com.gt.recall.model.ReviewEvent;
import com.gt.recall.model.ReviewItemState;
import com.gt.recall.model.SchedulingState;
import com.gt.recall.model.SessionStatus;

import java.time.Instant;
import java.util.*;

// Not thread safe. Mutated only through RevisionSessionCoordinator.
public class RevisionSession {

    private final String id;
    private final Map<String, ReviewItemState> itemsById = new LinkedHashMap<>();
    private final Deque<String> queue = new ArrayDeque<>();
    private final Map<String, SchedulingState> updatedStates = new LinkedHashMap<>();
    private final Map<String, Integer> redrillCounts = new HashMap<>();
    private final List<ReviewEvent> events = new ArrayList<>();

    private SessionStatus status = SessionStatus.Created;
    private Instant startedAt;
    private Instant endedAt;
    private int passed;
    private int failed;
    private int redrills;

    RevisionSession(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public boolean isEmpty() {
        return itemsById.isEmpty();
    }

    public int size() {
        return itemsById.size();
    }

    // Item ids still waiting for an answer, in presentation order
    public List<String> getQueue() {
        return List.copyOf(queue);
    }

    public Optional<String> peekNext() {
        return Optional.ofNullable(queue.peekFirst());
    }

    public Map<String, SchedulingState> getUpdatedStates() {
        return Collections.unmodifiableMap(updatedStates);
    }

    public List<ReviewEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    int getPassed() {
        return passed;
    }

    int getFailed() {
        return failed;
    }

    int getRedrills() {
        return redrills;
    }

    int getUnanswered() {
        return (int) itemsById.keySet().stream().filter(itemId -> !updatedStates.containsKey(itemId)).count();
    }

    void begin(List<ReviewItemState> dueItems, Instant now) {
        for (ReviewItemState itemState : dueItems) {
            itemsById.put(itemState.itemId(), itemState);
            queue.addLast(itemState.itemId());
        }

        startedAt = now;
        status = SessionStatus.InProgress;
    }

    boolean isQueued(String itemId) {
        return queue.contains(itemId);
    }

    boolean isAnswered(String itemId) {
        return updatedStates.containsKey(itemId);
    }

    SchedulingState currentState(String itemId) {
        SchedulingState updatedState = updatedStates.get(itemId);
        return updatedState != null ? updatedState : itemsById.get(itemId).state();
    }

    void dequeue(String itemId) {
        queue.removeFirstOccurrence(itemId);
    }

    void recordFirstAnswer(ReviewEvent event, boolean isPassing) {
        updatedStates.put(event.itemId(), event.resultingState());
        events.add(event);

        if (isPassing) {
            passed++;
        } else {
            failed++;
        }
    }

    void recordRedrill(ReviewEvent event) {
        events.add(event);
        redrills++;
    }

    boolean requeue(String itemId, int maxRedrillsPerItem) {
        int itemRedrills = redrillCounts.getOrDefault(itemId, 0);
        if (itemRedrills >= maxRedrillsPerItem) {
            return false;
        }

        redrillCounts.put(itemId, itemRedrills + 1);
        queue.addLast(itemId);
        return true;
    }

    void end(SessionStatus terminalStatus, Instant now) {
        status = terminalStatus;
        endedAt = now;
    }
}
