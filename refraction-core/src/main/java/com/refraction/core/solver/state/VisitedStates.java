package com.refraction.core.solver.state;

import java.util.Arrays;

/**
 * Open-addressing hash set of packed joint states. Keys are stored widened to {@code long} so
 * every 32-bit pattern is a legal key and {@code -1} can mark free slots.
 */
public final class VisitedStates {

    private static final long EMPTY = -1L;
    private static final int MIN_CAPACITY = 16;

    private long[] slots;
    private int mask;
    private int size;
    private int resizeThreshold;

    public VisitedStates() {
        this(1 << 12);
    }

    public VisitedStates(int expectedSize) {
        if (expectedSize < 0) {
            throw new IllegalArgumentException("expectedSize must not be negative");
        }
        allocate(capacityFor(expectedSize));
    }

    /**
     * Adds {@code key} and returns {@code true} if it was not present yet.
     */
    public boolean add(int key) {
        long stored = key & 0xFFFFFFFFL;
        int index = indexFor(stored);
        while (slots[index] != EMPTY) {
            if (slots[index] == stored) {
                return false;
            }
            index = (index + 1) & mask;
        }
        slots[index] = stored;
        size++;
        if (size > resizeThreshold) {
            grow();
        }
        return true;
    }

    public boolean contains(int key) {
        long stored = key & 0xFFFFFFFFL;
        int index = indexFor(stored);
        while (slots[index] != EMPTY) {
            if (slots[index] == stored) {
                return true;
            }
            index = (index + 1) & mask;
        }
        return false;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return slots.length;
    }

    public void clear() {
        Arrays.fill(slots, EMPTY);
        size = 0;
    }

    private void grow() {
        long[] previous = slots;
        allocate(previous.length << 1);
        for (long stored : previous) {
            if (stored != EMPTY) {
                int index = indexFor(stored);
                while (slots[index] != EMPTY) {
                    index = (index + 1) & mask;
                }
                slots[index] = stored;
            }
        }
    }

    private void allocate(int capacity) {
        slots = new long[capacity];
        Arrays.fill(slots, EMPTY);
        mask = capacity - 1;
        resizeThreshold = (int) (capacity * 0.6);
    }

    private int indexFor(long stored) {
        long h = stored * 0x9E3779B97F4A7C15L;
        return (int) (h ^ (h >>> 32)) & mask;
    }

    private static int capacityFor(int expectedSize) {
        int needed = (int) Math.min(1L << 30, (long) Math.ceil(expectedSize / 0.6) + 1);
        int capacity = MIN_CAPACITY;
        while (capacity < needed) {
            capacity <<= 1;
        }
        return capacity;
    }
}
