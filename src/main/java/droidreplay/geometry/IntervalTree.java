package droidreplay.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 1-D interval tree answering "which stored intervals overlap this one".
 *
 * <p>The line is partitioned into half-open elementary intervals kept in a
 * singly linked list, and a {@link TreeMap} keyed on their start points acts
 * as the search tree over endpoints. Inserting a new endpoint splits the
 * elementary interval containing it; the new half starts with a copy of the
 * entries of the old one. Each stored interval is attached to every
 * elementary interval it spans.
 *
 * <p>Queries use strict overlap, so intervals that only touch are not
 * reported and zero-width intervals are never reported.
 *
 * @param <T> payload type; {@code null} payloads are allowed
 */
public class IntervalTree<T> {

    /** A stored interval with its payload. Identity matters: the same interval may be stored twice. */
    public static final class Entry<T> {
        private final Interval interval;
        private final T data;

        Entry(Interval interval, T data) {
            this.interval = interval;
            this.data     = data;
        }

        public Interval interval() { return interval; }
        public T data()            { return data; }

        @Override
        public String toString() {
            return interval + "=" + data;
        }
    }

    private static final class Elementary<T> {
        final int start;
        Elementary<T> next;
        final List<Entry<T>> entries;

        Elementary(int start, List<Entry<T>> entries) {
            this.start   = start;
            this.entries = entries;
        }

        int end() {
            return next == null ? Integer.MAX_VALUE : next.start;
        }
    }

    private final TreeMap<Integer, Elementary<T>> index = new TreeMap<>();
    private int size;

    public IntervalTree() {
        index.put(Integer.MIN_VALUE, new Elementary<>(Integer.MIN_VALUE, new ArrayList<>()));
    }

    public int size() {
        return size;
    }

    /** Stores {@code data} under {@code interval}. */
    public void insert(Interval interval, T data) {
        Entry<T> entry = new Entry<>(interval, data);
        size++;
        if (interval.isEmpty()) {
            return;
        }
        split(interval.low());
        split(interval.high());
        for (Elementary<T> e = index.get(interval.low()); e != null && e.start < interval.high(); e = e.next) {
            e.entries.add(entry);
        }
    }

    /** Returns all stored entries strictly overlapping {@code query}, in insertion order per elementary interval. */
    public List<Entry<T>> query(Interval query) {
        if (query.isEmpty()) {
            return Collections.emptyList();
        }
        Set<Entry<T>> found = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Entry<T>> ordered = new ArrayList<>();
        Map.Entry<Integer, Elementary<T>> first = index.floorEntry(query.low());
        for (Elementary<T> e = first.getValue(); e != null && e.start < query.high(); e = e.next) {
            if (e.end() <= query.low()) {
                continue;
            }
            for (Entry<T> entry : e.entries) {
                if (found.add(entry)) {
                    ordered.add(entry);
                }
            }
        }
        return ordered;
    }

    /** Payloads of {@link #query(Interval)}, duplicates by identity removed. */
    public Set<T> queryData(Interval query) {
        Set<T> data = new LinkedHashSet<>();
        for (Entry<T> entry : query(query)) {
            data.add(entry.data());
        }
        return data;
    }

    private void split(int point) {
        Map.Entry<Integer, Elementary<T>> floor = index.floorEntry(point);
        Elementary<T> current = floor.getValue();
        if (current.start == point) {
            return;
        }
        Elementary<T> tail = new Elementary<>(point, new ArrayList<>(current.entries));
        tail.next    = current.next;
        current.next = tail;
        index.put(point, tail);
    }
}
