package dev.eventsourced.components.eventsourced.aggregates.repository;

import dev.eventsourced.components.eventsourced.eventstore.Event;
import dev.eventsourced.components.eventsourced.eventstore.publisher.EventPublisher;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingEventPublisher<EVENT extends Event> implements EventPublisher<EVENT> {
    final List<List<EVENT>> published = new CopyOnWriteArrayList<>();

    @Override
    public void publish(List<? extends EVENT> events) {
        published.add(List.copyOf(events));
    }

    @Override
    public void publishAndForget(List<? extends EVENT> events) {
        published.add(List.copyOf(events));
    }

    List<EVENT> allPublishedEvents() {
        var all = new ArrayList<EVENT>();
        published.forEach(all::addAll);
        return all;
    }
}
