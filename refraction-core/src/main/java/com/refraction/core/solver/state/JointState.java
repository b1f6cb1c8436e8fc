package com.refraction.core.solver.state;

import com.refraction.core.Board;

/**
 * Fixed-width integer encoding of a joint token state. Each token occupies eight bits holding
 * its row-major cell index, slot {@code i} in bits {@code 8i..8i+7}. Slots follow the
 * canonical color order, so equal layouts always produce equal keys.
 */
public final class JointState {

    public static final int BITS_PER_TOKEN = 8;
    public static final int MAX_TOKENS = Integer.SIZE / BITS_PER_TOKEN;

    private static final int CELL_MASK = (1 << BITS_PER_TOKEN) - 1;

    private JointState() {
    }

    public static int pack(int[] cells, int count) {
        checkCount(count);
        int key = 0;
        for (int slot = 0; slot < count; slot++) {
            int cell = cells[slot];
            if (cell < 0 || cell >= Board.CELL_COUNT) {
                throw new IllegalArgumentException("Cell index out of range: " + cell);
            }
            key |= cell << (slot * BITS_PER_TOKEN);
        }
        return key;
    }

    public static void unpack(int key, int count, int[] into) {
        checkCount(count);
        for (int slot = 0; slot < count; slot++) {
            into[slot] = cellAt(key, slot);
        }
    }

    public static int cellAt(int key, int slot) {
        return (key >>> (slot * BITS_PER_TOKEN)) & CELL_MASK;
    }

    /**
     * Returns {@code key} with the token in {@code slot} moved to {@code cell}.
     */
    public static int withCell(int key, int slot, int cell) {
        int shift = slot * BITS_PER_TOKEN;
        return (key & ~(CELL_MASK << shift)) | (cell << shift);
    }

    private static void checkCount(int count) {
        if (count < 1 || count > MAX_TOKENS) {
            throw new IllegalArgumentException("Token count must be between 1 and " + MAX_TOKENS + ": " + count);
        }
    }
}
