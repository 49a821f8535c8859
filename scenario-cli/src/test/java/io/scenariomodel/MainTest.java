package io.scenariomodel;

import io.scenariomodel.output.Console;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    ByteArrayOutputStream buffer;

    @BeforeEach
    void beforeEach() {
        buffer = new ByteArrayOutputStream();
        Console.setColorsEnabled(false);
        Console.setOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void afterEach() {
        Console.setOutput(System.out);
    }

    @Test
    void testNoSubcommandPrintsUsage() {
        assertEquals(0, Main.execute("--no-color"));
        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Usage: scenario"), output);
        assertTrue(output.contains("lint"));
        assertTrue(output.contains("list"));
        assertTrue(output.contains("export"));
    }

    @Test
    void testUnknownOption() {
        assertEquals(2, Main.execute("lint", "--bogus"));
    }

}
