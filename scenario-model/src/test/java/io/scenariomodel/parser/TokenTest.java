package io.scenariomodel.parser;

import io.scenariomodel.common.Resource;
import io.scenariomodel.gherkin.GherkinLexer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.scenariomodel.parser.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

class TokenTest {

    private static List<TokenType> types(String text) {
        List<TokenType> list = new ArrayList<>();
        for (Token token : BaseLexer.tokenize(new GherkinLexer(Resource.text(text)))) {
            list.add(token.type);
        }
        return list;
    }

    @Test
    void testPrimaryTokensOnly() {
        assertEquals(List.of(G_FEATURE, G_DESC, EOF), types("# comment\nFeature: f\n"));
        assertEquals(List.of(EOF), types(""));
        assertFalse(G_COMMENT.primary);
        assertFalse(WS.primary);
        assertTrue(G_TAG.primary);
        assertFalse(WS_LF.primary);
        assertTrue(EOF.primary);
    }

    @Test
    void testLineTypes() {
        assertEquals(List.of(G_TAG, G_TAG, G_SCENARIO, G_DESC, G_PREFIX, G_STEP_TEXT,
                        G_PIPE, G_TABLE_CELL, G_PIPE, G_PIPE, EOF),
                types("@a @b\nScenario: s\n* step\n| x || \n"));
        assertEquals(List.of(G_PREFIX, G_STEP_TEXT, G_TRIPLE_QUOTE, G_DOC_LINE, G_TRIPLE_QUOTE, EOF),
                types("Given x\n  \"\"\"xml\n  <a/>\n  \"\"\"\n"));
        assertEquals(List.of(G_SCENARIO_OUTLINE, G_EXAMPLES, G_EXAMPLES, G_SCENARIO, EOF),
                types("Scenario Outline:\nExamples:\nScenarios:\nExample:\n"));
        // no colon, so not a keyword
        assertEquals(List.of(G_DESC, G_DESC, EOF), types("Scenario Outlines\nGivens\n"));
    }

    @Test
    void testPositions() {
        List<Token> tokens = BaseLexer.tokenize(new GherkinLexer(Resource.text("Feature: f\n  Scenario: s\n")));
        Token scenario = tokens.get(2);
        assertEquals(G_SCENARIO, scenario.type);
        assertEquals(1, scenario.line);
        assertEquals(2, scenario.col);
        assertEquals("2:3", scenario.getPositionDisplay());
        assertEquals("  Scenario: s", scenario.getLineText());
        SyntaxError e = new SyntaxError(scenario, "oops");
        assertEquals("(inline):2:3 oops", e.getMessage());
    }

}
