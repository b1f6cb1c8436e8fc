package com.refraction.core;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class RefractionCLITest {

    @Test
    void reportsMalformedConfiguration() {
        String output = run("1,2");

        assertTrue(output.startsWith("Cannot start game: "), output);
    }

    @Test
    void reportsBoardThatCannotBeAssembled() {
        String output = run("0:0,0:1,4:0,6:0");

        assertTrue(output.startsWith("Cannot start game: "), output);
    }

    @Test
    void reportsMalformedTokens() {
        String output = run("0:0,2:0,4:0,6:0", "red=zero,1");

        assertTrue(output.startsWith("Cannot start game: "), output);
    }

    @Test
    void reportsPlacementProblems() {
        String output = run("0:0,2:0,4:0,6:0", "red=7,7");

        assertTrue(output.contains("dead zone"), output);
        assertFalse(output.contains("Refraction: console edition"), output);
    }

    private static String run(String... args) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream original = System.out;
        System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            assertDoesNotThrow(() -> RefractionCLI.main(args));
        } finally {
            System.setOut(original);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
