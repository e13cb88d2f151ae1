package co.codecraft.jresilience;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the most recent entries up to a fixed capacity. Appending is O(1); once full, each append evicts the
 * oldest entry. Not threadsafe; owners guard it with their own monitor.
 */
public class BoundedHistory<T> {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final ArrayDeque<T> entries;

    public BoundedHistory() {
        this(DEFAULT_CAPACITY);
    }

    public BoundedHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<T>(capacity);
    }

    public void add(T entry) {
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(entry);
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return a copy of the retained entries, oldest first.
     */
    public List<T> toList() {
        return new ArrayList<T>(entries);
    }
}
