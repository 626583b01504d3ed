package droidreplay.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Events still to be replayed. The head is the next event in replay order;
 * {@link #push(ReplayEvent)} puts an event back at the head.
 */
public class EventQueue {

    private final Deque<ReplayEvent> events;

    /** @param events events in replay order */
    public EventQueue(List<? extends ReplayEvent> events) {
        this.events = new ArrayDeque<>(events);
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /** Next event without removing it, or null. */
    public ReplayEvent top() {
        return events.peekFirst();
    }

    /** Up to {@code n} next events in replay order, without removing them. */
    public List<ReplayEvent> topN(int n) {
        List<ReplayEvent> top = new ArrayList<>(Math.min(n, events.size()));
        Iterator<ReplayEvent> it = events.iterator();
        while (top.size() < n && it.hasNext()) {
            top.add(it.next());
        }
        return top;
    }

    public ReplayEvent pop() {
        return events.pollFirst();
    }

    /** Removes and returns up to {@code n} next events in replay order. */
    public List<ReplayEvent> popN(int n) {
        List<ReplayEvent> popped = new ArrayList<>();
        while (popped.size() < n && !events.isEmpty()) {
            popped.add(events.pollFirst());
        }
        return popped;
    }

    public void push(ReplayEvent event) {
        events.addFirst(event);
    }
}
