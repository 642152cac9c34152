package com.nilsson.imagecropper.service;

import com.nilsson.imagecropper.model.ImageRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 Fixed-capacity ring of recently left records, newest at the back. Pushing at capacity drops the
 oldest entry so undo memory stays bounded.
 */
public class ImageHistory {

    private final int capacity;
    private final Deque<ImageRecord> entries;

    public ImageHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be positive");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public void push(ImageRecord record) {
        if (entries.size() >= capacity) {
            entries.pollFirst();
        }
        entries.addLast(record);
    }

    /**
     Removes and returns the most recently pushed record.
     */
    public Optional<ImageRecord> pop() {
        return Optional.ofNullable(entries.pollLast());
    }

    public Optional<ImageRecord> peekOldest() {
        return Optional.ofNullable(entries.peekFirst());
    }

    public Optional<ImageRecord> peekNewest() {
        return Optional.ofNullable(entries.peekLast());
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void clear() {
        entries.clear();
    }
}
