package com.gt.recall.scheduling;

import com.gt.recall.exception.InvalidArgumentException;
import com.gt.recall.model.ReviewEvent;
import com.gt.recall.model.ReviewItem;
import com.gt.recall.model.SchedulingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
public class ReviewEventReplayer {

    private static final Logger log = LoggerFactory.getLogger(ReviewEventReplayer.class);

    private final SchedulingEngine schedulingEngine;

    @Autowired
    public ReviewEventReplayer(SchedulingEngine schedulingEngine) {
        this.schedulingEngine = schedulingEngine;
    }

    public SchedulingState replay(ReviewItem item, List<ReviewEvent> events) {
        SchedulingState state = schedulingEngine.initialState();

        List<ReviewEvent> schedulingEvents = sortedSchedulingEvents(item, events);
        for (ReviewEvent event : schedulingEvents) {
            state = schedulingEngine.apply(state, event.quality(), event.eventInstant());
        }

        log.info("Replayed {} review events for item {}", schedulingEvents.size(), item.id());
        return state;
    }

    public double recalibrateHalfLife(ReviewItem item, List<ReviewEvent> events) {
        double halfLifeDays = schedulingEngine.initialState().decayHalfLifeDays();

        for (ReviewEvent event : sortedSchedulingEvents(item, events)) {
            halfLifeDays = schedulingEngine.calculateHalfLife(halfLifeDays, SchedulingEngine.isPassing(event.quality()));
        }

        return halfLifeDays;
    }

    private List<ReviewEvent> sortedSchedulingEvents(ReviewItem item, List<ReviewEvent> events) {
        if (item == null || events == null) {
            throw new InvalidArgumentException("Item and event history are required");
        }

        // Re-drill events never changed the persisted state
        List<ReviewEvent> sortedEvents = new ArrayList<>();
        for (ReviewEvent event : events) {
            if (!item.id().equals(event.itemId())) {
                log.warn("Skipping event for item {} while replaying item {}", event.itemId(), item.id());
            } else if (!event.redrill()) {
                sortedEvents.add(event);
            }
        }
        sortedEvents.sort(Comparator.comparing(ReviewEvent::eventInstant));

        return sortedEvents;
    }
}
