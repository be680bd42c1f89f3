package dev.catananti.resumeengine.service.customization;

import dev.catananti.resumeengine.dto.CustomizationChange;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity ring buffer of changes. Pushing onto a full buffer overwrites the oldest entry.
 * Not thread-safe.
 */
public class ChangeHistory {

    public static final int DEFAULT_CAPACITY = 50;

    private final CustomizationChange[] entries;
    private int head;
    private int size;

    public ChangeHistory() {
        this(DEFAULT_CAPACITY);
    }

    public ChangeHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.entries = new CustomizationChange[capacity];
    }

    public void push(CustomizationChange change) {
        int tail = (head + size) % entries.length;
        entries[tail] = change;
        if (size == entries.length) {
            head = (head + 1) % entries.length;
        } else {
            size++;
        }
    }

    /**
     * Removes and returns the newest entry.
     */
    public Optional<CustomizationChange> pop() {
        if (size == 0) {
            return Optional.empty();
        }
        int newest = (head + size - 1) % entries.length;
        CustomizationChange change = entries[newest];
        entries[newest] = null;
        size--;
        return Optional.of(change);
    }

    public void clear() {
        for (int i = 0; i < entries.length; i++) {
            entries[i] = null;
        }
        head = 0;
        size = 0;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return entries.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Oldest first.
     */
    public List<CustomizationChange> toList() {
        List<CustomizationChange> list = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            list.add(entries[(head + i) % entries.length]);
        }
        return list;
    }
}
