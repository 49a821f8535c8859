package io.scenariomodel.gherkin;

import io.scenariomodel.common.Resource;
import io.scenariomodel.parser.ParserException;
import io.scenariomodel.parser.SyntaxError;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GherkinParserTest {

    static final Logger logger = LoggerFactory.getLogger(GherkinParserTest.class);

    Feature feature;
    Scenario scenario;
    ScenarioOutline outline;

    private void feature(String text) {
        Resource resource = Resource.text(text);
        GherkinParser parser = new GherkinParser(resource);
        feature = parser.parse();
        scenario = null;
        outline = null;
        if (!feature.getSections().isEmpty()) {
            FeatureSection section = feature.getSections().get(0);
            scenario = section.getScenario();
            outline = section.getScenarioOutline();
        }
    }

    private <T extends ParserException> T fail(Class<T> type, String text) {
        T e = assertThrows(type, () -> feature(text));
        logger.debug("expected error: {}", e.getMessage());
        return e;
    }

    @Test
    void testFeatureBasics() {
        feature("""
                Feature:
                Scenario: s
                """);
        assertNull(feature.getName());
        assertNull(feature.getDescription());
        assertEquals(1, feature.getSections().size());

        feature("""
                Feature: foo
                Scenario: s
                """);
        assertEquals("foo", feature.getName());
        assertEquals(1, feature.getLine());

        feature("""
                Feature: foo
                    bar
                Scenario: s
                """);
        assertEquals("foo", feature.getName());
        assertEquals("bar", feature.getDescription());
        assertTrue(feature.getTags().isEmpty());

        feature("""
                @tag1 @tag2
                Feature: foo
                Scenario: s
                """);
        List<Tag> tags = feature.getTags();
        assertEquals(2, tags.size());
        assertEquals("tag1", tags.get(0).getName());
        assertEquals("tag2", tags.get(1).getName());
        assertEquals(2, feature.getLine());
    }

    @Test
    void testNarrativeIsDescription() {
        feature("""
                Feature: User Login
                  As a user of the Sauce Demo application
                  I want to be able to log in with my credentials

                  So that I can access the product inventory

                  Scenario: s
                """);
        assertEquals("User Login", feature.getName());
        assertEquals("As a user of the Sauce Demo application\n"
                + "I want to be able to log in with my credentials\n"
                + "So that I can access the product inventory", feature.getDescription());
    }

    @Test
    void testNameOnlyFromHeaderLine() {
        feature("""
                Feature:
                Scenario:
                  first line of description
                  * step one
                """);
        assertNull(scenario.getName());
        assertEquals("first line of description", scenario.getDescription());
    }

    @Test
    void testScenarioBasics() {
        feature("""
                Feature:
                Scenario: foo
                  bar
                  Given I am on the login page
                  When I enter valid credentials
                  Then I should be redirected to the home page
                  And I should see the product inventory
                  But I should not see an error
                  * I take a screenshot
                """);
        assertEquals("foo", scenario.getName());
        assertEquals("bar", scenario.getDescription());
        assertEquals(2, scenario.getLine());
        assertEquals(6, scenario.getSteps().size());
        Step step = scenario.getSteps().get(0);
        assertEquals("Given", step.getKeyword());
        assertEquals("I am on the login page", step.getText());
        assertEquals(4, step.getLine());
        assertEquals(0, step.getIndex());
        assertEquals("But", scenario.getSteps().get(4).getKeyword());
        Step star = scenario.getSteps().get(5);
        assertEquals("*", star.getKeyword());
        assertEquals("I take a screenshot", star.getText());
        assertEquals(5, star.getIndex());
        assertTrue(star.isConjunction());
    }

    @Test
    void testKeywordNeedsWordBoundary() {
        feature("""
                Feature: f
                  Givenchy is not a step
                Scenario: s
                  Given Andrew logs in
                """);
        assertEquals("Givenchy is not a step", feature.getDescription());
        assertEquals("Andrew logs in", scenario.getSteps().get(0).getText());
    }

    @Test
    void testComments() {
        feature("""
                # leading comment
                Feature: f
                # between
                Scenario: s
                  # before a step
                  Given a step # not a comment
                """);
        assertEquals(1, scenario.getSteps().size());
        assertEquals("a step # not a comment", scenario.getSteps().get(0).getText());
        assertNull(feature.getDescription());
    }

    @Test
    void testBackground() {
        feature("""
                Feature: f
                  Background:
                    Given I am logged in as a standard user
                    And I am on the home page
                  Scenario: s
                    When I click on the shopping cart
                """);
        assertTrue(feature.isBackgroundPresent());
        Background background = feature.getBackground();
        assertEquals(2, background.getLine());
        assertEquals(2, background.getSteps().size());
        List<Step> steps = feature.getStepsIncludingBackground(scenario);
        assertEquals(3, steps.size());
        assertEquals("I am logged in as a standard user", steps.get(0).getText());
        assertEquals("I click on the shopping cart", steps.get(2).getText());
        assertEquals(1, scenario.getSteps().size());
    }

    @Test
    void testScenarioTags() {
        feature("""
                @feature
                Feature: f
                  @smoke @login
                  @extra
                  Scenario: s
                    Given a step
                  Scenario: t
                    Given a step
                """);
        assertEquals(List.of(new Tag("@smoke"), new Tag("@login"), new Tag("@extra")), scenario.getTags());
        assertEquals(3, scenario.getTags().get(0).getLine());
        assertTrue(feature.getSection(1).getScenario().getTags().isEmpty());
        assertEquals(4, feature.getTagsEffective(scenario).size());
    }

    @Test
    void testTagWithValues() {
        feature("""
                Feature: f
                  @env=dev,qa @id=
                  Scenario: s
                    Given a step
                """);
        Tag env = scenario.getTags().get(0);
        assertEquals("env", env.getName());
        assertEquals(List.of("dev", "qa"), env.getValues());
        assertEquals("@env=dev,qa", env.toString());
        Tag id = scenario.getTags().get(1);
        assertEquals("id", id.getName());
        assertTrue(id.getValues().isEmpty());
    }

    @Test
    void testDataTable() {
        feature("""
                Feature: f
                  Scenario: s
                    When I add the following products to the cart:
                      | product_name          | qty |
                      | Sauce Labs Backpack   | 1   |
                      | Sauce Labs Bike Light |     |
                    Then all products should be in the cart
                """);
        Step step = scenario.getSteps().get(0);
        Table table = step.getTable();
        assertNotNull(table);
        assertEquals(3, table.getRowCount());
        assertEquals(2, table.getColumnCount());
        assertEquals(List.of("Sauce Labs Bike Light", ""), table.getRows().get(2));
        assertEquals(4, table.getLineNumberForRow(0));
        List<java.util.Map<String, String>> maps = table.getRowsAsMaps();
        assertEquals("1", maps.get(0).get("qty"));
        assertEquals(2, scenario.getSteps().size());
        assertNull(scenario.getSteps().get(1).getTable());
    }

    @Test
    void testTableEscapes() {
        feature("""
                Feature: f
                  Scenario: s
                    Given the values:
                      | a\\|b | back\\\\slash | two\\nlines | keep\\t |
                """);
        List<String> row = scenario.getSteps().get(0).getTable().getRows().get(0);
        assertEquals("a|b", row.get(0));
        assertEquals("back\\slash", row.get(1));
        assertEquals("two\nlines", row.get(2));
        assertEquals("keep\\t", row.get(3));
    }

    @Test
    void testDocString() {
        feature("""
                Feature: f
                  Scenario: s
                    Given the request body:
                      \"""json
                      {
                        "username": "standard_user"

                      }
                      \"""
                    Then it is sent
                """);
        Step step = scenario.getSteps().get(0);
        assertEquals("json", step.getDocStringType());
        assertEquals("{\n  \"username\": \"standard_user\"\n\n}", step.getDocString());
        assertNull(step.getTable());
        assertEquals("it is sent", scenario.getSteps().get(1).getText());
    }

    @Test
    void testDocStringEdges() {
        feature("""
                Feature: f
                  Scenario: s
                    Given an empty doc string
                      \"""
                      \"""
                    And an escaped delimiter
                      \"""

                      \\"\\"\\" inside
                    less indented
                      \"""
                """);
        Step empty = scenario.getSteps().get(0);
        assertEquals("", empty.getDocString());
        assertNull(empty.getDocStringType());
        Step escaped = scenario.getSteps().get(1);
        assertEquals("\n\"\"\" inside\nless indented", escaped.getDocString());
    }

    @Test
    void testScenarioOutline() {
        feature("""
                Feature: f
                  @login @regression
                  Scenario Outline: Login with different user types
                    When I login with "<username>" and "<password>"
                    Then the login result should be "<result>"

                    Examples:
                      | username        | password     | result     |
                      | standard_user   | secret_sauce | success    |
                      | locked_out_user | secret_sauce | locked_out |
                """);
        assertNull(scenario);
        assertNotNull(outline);
        assertTrue(feature.getSection(0).isOutline());
        assertEquals("Login with different user types", outline.getName());
        assertEquals(2, outline.getTags().size());
        assertEquals(List.of("username", "password", "result"), outline.getPlaceholders());
        assertEquals(1, outline.getExamplesTables().size());
        ExamplesTable examples = outline.getExamplesTables().get(0);
        assertEquals(7, examples.getLine());
        assertEquals(List.of("username", "password", "result"), examples.getColumns());
        assertEquals(2, examples.getRowCount());
        assertEquals(2, outline.getNumberOfExamples());
    }

    @Test
    void testScenarioTemplateAndExampleSynonyms() {
        feature("""
                Feature: f
                  Example: plain
                    Given a step
                  Scenario Template: templated
                    Given a <thing>
                    Scenarios:
                      | thing |
                      | cat   |
                """);
        assertEquals("plain", scenario.getName());
        assertTrue(feature.getSection(1).isOutline());
        assertEquals(1, feature.getSection(1).getScenarioOutline().getNumberOfExamples());
    }

    @Test
    void testExamplesTagsAndFollowingScenarioTags() {
        feature("""
                Feature: f
                  Scenario Outline: o
                    Given a <thing>
                    @fast
                    Examples: first
                      | thing |
                      | cat   |
                    @slow
                    Examples:
                      | thing |
                      | dog   |
                  @next
                  Scenario: s
                    Given a step
                """);
        assertEquals(2, outline.getExamplesTables().size());
        assertEquals("first", outline.getExamplesTables().get(0).getName());
        assertEquals(List.of(new Tag("@fast")), outline.getExamplesTables().get(0).getTags());
        assertEquals(List.of(new Tag("@slow")), outline.getExamplesTables().get(1).getTags());
        Scenario next = feature.getSection(1).getScenario();
        assertEquals(List.of(new Tag("@next")), next.getTags());
    }

    @Test
    void testEmptyScenarioAndBackgroundAreParsed() {
        feature("""
                Feature: f
                  Background:
                  Scenario: nothing yet
                """);
        assertNotNull(feature.getBackground());
        assertFalse(feature.isBackgroundPresent());
        assertTrue(scenario.getSteps().isEmpty());
    }

    @Test
    void testCrLfLineEndings() {
        feature("Feature: f\r\n  Scenario: s\r\n    Given a step\r\n      \"\"\"\r\n      a\r\n      b\r\n      \"\"\"\r\n");
        assertEquals("a step", scenario.getSteps().get(0).getText());
        assertEquals("a\nb", scenario.getSteps().get(0).getDocString());
    }

    // ========== syntax errors ==========

    @Test
    void testMissingFeatureKeyword() {
        SyntaxError e = fail(SyntaxError.class, """
                Scenario: orphan
                  Given a step
                """);
        assertEquals(1, e.getLine());
        assertEquals(1, e.getColumn());
        assertEquals("expected 'Feature:'", e.getDetail());
        fail(SyntaxError.class, "");
        fail(SyntaxError.class, """
                @tag
                Scenario: orphan
                """);
        fail(SyntaxError.class, """
                Feature without colon
                """);
    }

    @Test
    void testFeatureWithoutScenario() {
        SyntaxError e = fail(SyntaxError.class, """
                Feature: f
                """);
        assertEquals("expected 'Scenario:' or 'Scenario Outline:'", e.getDetail());
        assertEquals(2, e.getLine());
        e = fail(SyntaxError.class, """
                Feature: f
                  Background:
                    Given x
                """);
        assertEquals("expected 'Scenario:' or 'Scenario Outline:'", e.getDetail());
        assertEquals(4, e.getLine());
    }

    @Test
    void testBackgroundOrder() {
        SyntaxError e = fail(SyntaxError.class, """
                Feature: f
                  Scenario: s
                    Given a step
                  Background:
                    Given too late
                """);
        assertEquals(4, e.getLine());
        assertEquals(3, e.getColumn());
        assertTrue(e.getDetail().contains("must come before"));
        e = fail(SyntaxError.class, """
                Feature: f
                  Background:
                    Given one
                  Background:
                    Given two
                """);
        assertTrue(e.getDetail().contains("only one 'Background:'"));
    }

    @Test
    void testMisplacedKeywords() {
        SyntaxError e = fail(SyntaxError.class, """
                Feature: f
                  Scenario: s
                    Given a step
                    Examples:
                      | a |
                      | 1 |
                """);
        assertTrue(e.getDetail().contains("only allowed in a 'Scenario Outline:'"));
        e = fail(SyntaxError.class, """
                Feature: f
                  Given a step without a scenario
                """);
        assertTrue(e.getDetail().contains("is not inside"));
        e = fail(SyntaxError.class, """
                Feature: one
                Feature: two
                """);
        assertEquals(2, e.getLine());
        e = fail(SyntaxError.class, """
                Feature: f
                  Scenario: s
                    Given a step
                  @dangling
                """);
        assertTrue(e.getDetail().contains("tags must be followed"));
    }

    @Test
    void testStrayText() {
        SyntaxError e = fail(SyntaxError.class, """
                Feature: f
                  Scenario: s
                    Given a step
                    this line is not a step
                """);
        assertEquals(4, e.getLine());
        assertEquals("unexpected text: this line is not a step", e.getDetail());
    }

    @Test
    void testMissingStepText() {
        SyntaxError e = fail(SyntaxError.class, """
                Feature: f
                  Scenario: s
                    When
                """);
        assertEquals(3, e.getLine());
        assertEquals(5, e.getColumn());
    }

    @Test
    void testUnclosedDocString() {
        SyntaxError e = fail(SyntaxError.class, """
                Feature: f
                  Scenario: s
                    Given a body
                      \"""
                      never closed
                """);
        assertEquals(4, e.getLine());
        assertEquals("doc string is not closed", e.getDetail());
    }

    @Test
    void testTableErrors() {
        SyntaxError e = fail(SyntaxError.class, """
                Feature: f
                  Scenario: s
                    Given a table
                      | a | b |
                      | 1 | 2 | 3 |
                """);
        assertEquals(5, e.getLine());
        assertTrue(e.getDetail().contains("has 3 cell(s), expected 2"));
        e = fail(SyntaxError.class, """
                Feature: f
                  Scenario: s
                    Given a table
                      | a | b
                """);
        assertEquals("table row must end with '|'", e.getDetail());
        e = fail(SyntaxError.class, """
                Feature: f
                  Scenario: s
                    | a |
                """);
        assertEquals("table row is not attached to a step", e.getDetail());
        e = fail(SyntaxError.class, """
                Feature: f
                  Scenario Outline: o
                    Given a <x>
                    Examples:
                      | x | y |
                      | 1 |
                """);
        assertEquals(6, e.getLine());
    }

    // ========== structure errors ==========

    @Test
    void testOutlineWithoutExamples() {
        StructureError e = fail(StructureError.class, """
                Feature: f
                  Scenario Outline: o
                    When I login with "<username>"
                  Scenario: s
                    Given a step
                """);
        assertEquals(2, e.getLine());
        assertEquals("'Scenario Outline:' has no 'Examples:'", e.getDetail());
        fail(StructureError.class, """
                Feature: f
                  Scenario Outline: o
                    When I login with "<username>"
                """);
    }

    @Test
    void testExamplesWithoutTable() {
        StructureError e = fail(StructureError.class, """
                Feature: f
                  Scenario Outline: o
                    When I login with "<username>"
                    Examples:
                """);
        assertEquals(4, e.getLine());
    }

    @Test
    void testUnmatchedPlaceholder() {
        StructureError e = fail(StructureError.class, """
                Feature: f
                  Scenario Outline: o
                    When I login with "<username>" and "<password>"
                    Examples:
                      | username      |
                      | standard_user |
                """);
        assertEquals(3, e.getLine());
        assertTrue(e.getDetail().contains("<password>"));
        // placeholders in step tables are checked too
        fail(StructureError.class, """
                Feature: f
                  Scenario Outline: o
                    When I add the following products to the cart:
                      | <product> |
                    Examples:
                      | name |
                      | a    |
                """);
        // each Examples table must cover every placeholder
        fail(StructureError.class, """
                Feature: f
                  Scenario Outline: o
                    Given a <thing>
                    Examples:
                      | thing |
                      | cat   |
                    Examples:
                      | other |
                      | dog   |
                """);
    }

    @Test
    void testNotAPlaceholder() {
        feature("""
                Feature: f
                  Scenario Outline: o
                    Given a price < 10 and > 5 for <item>
                    Examples:
                      | item |
                      | pen  |
                """);
        assertEquals(List.of("item"), outline.getPlaceholders());
    }

    @Test
    void testDuplicateColumn() {
        StructureError e = fail(StructureError.class, """
                Feature: f
                  Scenario Outline: o
                    When I login with "<username>"
                    Examples:
                      | username | username |
                      | a        | b        |
                """);
        assertEquals(5, e.getLine());
        assertTrue(e.getDetail().contains("duplicate column"));
    }

    @Test
    void testErrorMessageHasPath() {
        Resource resource = Resource.text("Feature: f\n  Scenario: s\n    Given a step\n    oops\n", "features/broken.feature");
        SyntaxError e = assertThrows(SyntaxError.class, () -> Feature.read(resource));
        assertEquals("features/broken.feature:4:5 unexpected text: oops", e.getMessage());
        assertSame(resource, e.getResource());
    }

}
