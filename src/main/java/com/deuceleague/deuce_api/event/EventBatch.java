package com.deuceleague.deuce_api.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Events collected during one operation's transaction. Handed to
 * {@link MatchEventDispatcher} once the transaction has committed; discarded
 * if it rolls back.
 */
public class EventBatch {

    private final List<MatchEvent> events = new ArrayList<>();

    public void add(MatchEvent event) {
        events.add(event);
    }

    public List<MatchEvent> events() {
        return Collections.unmodifiableList(events);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
