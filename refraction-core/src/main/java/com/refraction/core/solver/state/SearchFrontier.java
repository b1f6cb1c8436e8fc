package com.refraction.core.solver.state;

import java.util.Arrays;

/**
 * Append-only node buffer backing a breadth-first search. Every node keeps its packed state,
 * the index of its parent node, the move that produced it and its depth; nodes are consumed in
 * insertion order, so the buffer doubles as the FIFO queue and the parent tree.
 *
 * <p>Moves are encoded as {@code tokenSlot * 4 + direction.ordinal()}; the root carries
 * {@link #NO_MOVE} and {@link #NO_PARENT}.
 */
public final class SearchFrontier {

    public static final int NO_PARENT = -1;
    public static final int NO_MOVE = -1;

    private int[] keys;
    private int[] parents;
    private int[] moves;
    private int[] depths;
    private int size;
    private int head;

    public SearchFrontier() {
        this(1 << 12);
    }

    public SearchFrontier(int initialCapacity) {
        int capacity = Math.max(16, initialCapacity);
        keys = new int[capacity];
        parents = new int[capacity];
        moves = new int[capacity];
        depths = new int[capacity];
    }

    /**
     * Appends a node and returns its index.
     */
    public int add(int key, int parent, int move, int depth) {
        if (size == keys.length) {
            int capacity = keys.length << 1;
            keys = Arrays.copyOf(keys, capacity);
            parents = Arrays.copyOf(parents, capacity);
            moves = Arrays.copyOf(moves, capacity);
            depths = Arrays.copyOf(depths, capacity);
        }
        keys[size] = key;
        parents[size] = parent;
        moves[size] = move;
        depths[size] = depth;
        return size++;
    }

    public boolean hasPending() {
        return head < size;
    }

    /**
     * Returns the index of the oldest node not yet consumed.
     */
    public int poll() {
        if (head >= size) {
            throw new IllegalStateException("Frontier is empty");
        }
        return head++;
    }

    public int pending() {
        return size - head;
    }

    public int size() {
        return size;
    }

    public int key(int node) {
        return keys[checked(node)];
    }

    public int parent(int node) {
        return parents[checked(node)];
    }

    public int move(int node) {
        return moves[checked(node)];
    }

    public int depth(int node) {
        return depths[checked(node)];
    }

    public static int encodeMove(int tokenSlot, int directionOrdinal) {
        return tokenSlot * 4 + directionOrdinal;
    }

    public static int moveSlot(int move) {
        return move >>> 2;
    }

    public static int moveDirection(int move) {
        return move & 3;
    }

    /**
     * Returns the moves leading from the root to {@code node}, first move first.
     */
    public int[] pathTo(int node) {
        int length = depth(node);
        int[] path = new int[length];
        int current = node;
        for (int i = length - 1; i >= 0; i--) {
            path[i] = moves[current];
            current = parents[current];
        }
        return path;
    }

    private int checked(int node) {
        if (node < 0 || node >= size) {
            throw new IndexOutOfBoundsException("Node " + node + " outside frontier of size " + size);
        }
        return node;
    }
}
