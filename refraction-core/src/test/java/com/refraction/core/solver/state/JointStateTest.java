package com.refraction.core.solver.state;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class JointStateTest {

    @Test
    void packsEightBitsPerToken() {
        int key = JointState.pack(new int[] {0x01, 0x23, 0x45, 0xFF}, 4);

        assertEquals(0xFF452301, key);
        assertEquals(0x23, JointState.cellAt(key, 1));
        assertEquals(0xFF, JointState.cellAt(key, 3));

        int[] cells = new int[4];
        JointState.unpack(key, 4, cells);
        assertArrayEquals(new int[] {0x01, 0x23, 0x45, 0xFF}, cells);
    }

    @Test
    void slotOrderDistinguishesTokens() {
        assertNotEquals(JointState.pack(new int[] {3, 7}, 2), JointState.pack(new int[] {7, 3}, 2));
    }

    @Test
    void replacesSingleSlot() {
        int key = JointState.pack(new int[] {10, 20, 30}, 3);

        assertEquals(JointState.pack(new int[] {10, 99, 30}, 3), JointState.withCell(key, 1, 99));
    }

    @Test
    void rejectsOutOfRangeInput() {
        assertThrows(IllegalArgumentException.class, () -> JointState.pack(new int[] {256}, 1));
        assertThrows(IllegalArgumentException.class, () -> JointState.pack(new int[5], 5));
        assertThrows(IllegalArgumentException.class, () -> JointState.pack(new int[0], 0));
    }
}
