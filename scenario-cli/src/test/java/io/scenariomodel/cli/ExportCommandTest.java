package io.scenariomodel.cli;

import net.minidev.json.JSONArray;
import net.minidev.json.JSONObject;
import net.minidev.json.JSONValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static io.scenariomodel.cli.CliTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class ExportCommandTest {

    @TempDir
    Path tempDir;

    CliTestSupport cli;

    @BeforeEach
    void beforeEach() {
        cli = new CliTestSupport();
    }

    @AfterEach
    void afterEach() {
        cli.close();
    }

    @Test
    void testExportToFile() throws Exception {
        Path login = tempDir.resolve("login.feature");
        Files.writeString(login, LOGIN);
        Path output = tempDir.resolve("out/login.json");
        assertEquals(0, cli.run("export", login.toString(), "-o", output.toString()));
        assertTrue(cli.output().contains("written: "));
        JSONObject json = (JSONObject) JSONValue.parse(Files.readString(output));
        assertEquals("User Login", json.get("name"));
        JSONArray sections = (JSONArray) json.get("sections");
        assertEquals(3, sections.size());
        JSONObject outline = (JSONObject) sections.get(2);
        assertEquals(2, ((JSONArray) outline.get("scenarios")).size());
    }

    @Test
    void testExportToStandardOutput() throws Exception {
        Path cart = tempDir.resolve("cart.feature");
        Files.writeString(cart, CART);
        assertEquals(0, cli.run("export", cart.toString()));
        JSONObject json = (JSONObject) JSONValue.parse(cli.output());
        assertEquals("Shopping Cart", json.get("name"));
    }

    @Test
    void testExportNeedsOneFeature() throws Exception {
        Files.writeString(tempDir.resolve("a.feature"), CART);
        Files.writeString(tempDir.resolve("b.feature"), CART);
        assertEquals(1, cli.run("export", tempDir.toString()));
        assertTrue(cli.output().contains("exactly one feature file, found 2"));
        Path broken = tempDir.resolve("c.txt");
        Files.writeString(broken, "not gherkin");
        assertEquals(1, cli.run("export", broken.toString()));
        assertTrue(cli.output().contains("expected 'Feature:'"));
    }

}
