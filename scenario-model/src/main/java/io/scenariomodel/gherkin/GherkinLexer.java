/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.scenariomodel.gherkin;

import io.scenariomodel.common.Resource;
import io.scenariomodel.parser.BaseLexer;
import io.scenariomodel.parser.TokenType;

import static io.scenariomodel.parser.TokenType.*;

/**
 * Line oriented lexer for Gherkin. The first word of a line decides what the
 * rest of the line is: a section header, a step, a tag line, a table row, a
 * doc string delimiter, a comment, or free text.
 */
public class GherkinLexer extends BaseLexer {

    private GherkinState gState = GherkinState.GHERKIN;

    private enum GherkinState {
        GHERKIN,        // start of a line
        GS_DESC,        // rest of line after Feature:, Scenario:, etc.
        GS_TAGS,        // tags line (after @)
        GS_TABLE_ROW,   // table row (after |)
        GS_DOC_STRING,  // between """
        GS_STEP         // rest of line after Given/When/Then/And/But/*
    }

    public GherkinLexer(Resource resource) {
        super(resource);
    }

    @Override
    protected TokenType scanToken() {
        if (isAtEnd()) {
            return EOF;
        }
        // doc string content keeps its indentation, so no generic white-space handling
        if (gState == GherkinState.GS_DOC_STRING) {
            return scanDocString();
        }
        char c = peek();
        if (isBlank(c)) {
            return scanWhitespace();
        }
        if (isNewLine(c)) {
            return scanWhitespaceWithNewline();
        }
        return switch (gState) {
            case GHERKIN -> scanLineStart();
            case GS_DESC -> scanDesc();
            case GS_TAGS -> scanTags();
            case GS_TABLE_ROW -> scanTableRow();
            case GS_STEP -> scanStepText();
            default -> throw new IllegalStateException("unexpected state: " + gState);
        };
    }

    private TokenType scanWhitespace() {
        while (!isAtEnd() && isBlank(peek())) {
            advance();
        }
        return WS;
    }

    private TokenType scanWhitespaceWithNewline() {
        while (!isAtEnd() && (isBlank(peek()) || isNewLine(peek()))) {
            advance();
        }
        gState = GherkinState.GHERKIN;
        return WS_LF;
    }

    // ========== GHERKIN State ==========

    private TokenType scanLineStart() {
        char c = peek();
        if (c == '#') {
            advanceToEndOfLine();
            return G_COMMENT;
        }
        if (c == '@') {
            return scanTag();
        }
        if (c == '|') {
            gState = GherkinState.GS_TABLE_ROW;
            return scanTableRow();
        }
        if (c == '"' && peek(1) == '"' && peek(2) == '"') {
            // opening delimiter, the rest of the line is the optional content type
            advanceToEndOfLine();
            gState = GherkinState.GS_DOC_STRING;
            return G_TRIPLE_QUOTE;
        }
        if (c == '*' && (isBlank(peek(1)) || isNewLine(peek(1)) || pos + 1 == length)) {
            advance();
            gState = GherkinState.GS_STEP;
            return G_PREFIX;
        }
        if (isIdentifierStart(c)) {
            TokenType keyword = scanKeyword();
            if (keyword != null) {
                return keyword;
            }
        }
        // anything else is free text, e.g. the narrative below "Feature:"
        advanceToEndOfLine();
        return G_DESC;
    }

    /**
     * @return the keyword token, or null (with the position restored) if the line does not start with one
     */
    private TokenType scanKeyword() {
        int start = pos;
        int startCol = col;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        String text = source.substring(start, pos);
        switch (text) {
            case "Given", "When", "Then", "And", "But" -> {
                if (isAtEnd() || isBlank(peek()) || isNewLine(peek())) {
                    gState = GherkinState.GS_STEP;
                    return G_PREFIX;
                }
            }
            case "Feature" -> {
                if (match(':')) {
                    gState = GherkinState.GS_DESC;
                    return G_FEATURE;
                }
            }
            case "Background" -> {
                if (match(':')) {
                    gState = GherkinState.GS_DESC;
                    return G_BACKGROUND;
                }
            }
            case "Scenario", "Example" -> {
                if (match(':')) {
                    gState = GherkinState.GS_DESC;
                    return G_SCENARIO;
                }
                if (text.equals("Scenario") && (matchWord(" Outline:") || matchWord(" Template:"))) {
                    gState = GherkinState.GS_DESC;
                    return G_SCENARIO_OUTLINE;
                }
            }
            case "Examples", "Scenarios" -> {
                if (match(':')) {
                    gState = GherkinState.GS_DESC;
                    return G_EXAMPLES;
                }
            }
            default -> {
                // not a keyword
            }
        }
        pos = start;
        col = startCol;
        return null;
    }

    private boolean matchWord(String word) {
        if (!source.startsWith(word, pos)) {
            return false;
        }
        for (int i = 0; i < word.length(); i++) {
            advance();
        }
        return true;
    }

    // ========== GS_DESC State ==========

    private TokenType scanDesc() {
        advanceToEndOfLine();
        return G_DESC;
    }

    // ========== GS_TAGS State ==========

    private TokenType scanTag() {
        advance(); // consume @
        while (!isAtEnd() && !isBlank(peek()) && !isNewLine(peek())) {
            advance();
        }
        gState = GherkinState.GS_TAGS;
        return G_TAG;
    }

    private TokenType scanTags() {
        char c = peek();
        if (c == '@') {
            return scanTag();
        }
        if (c == '#') {
            advanceToEndOfLine();
            return G_COMMENT;
        }
        // anything else on a tag line is free text
        advanceToEndOfLine();
        return G_DESC;
    }

    // ========== GS_TABLE_ROW State ==========

    private TokenType scanTableRow() {
        if (peek() == '|') {
            advance();
            return G_PIPE;
        }
        while (!isAtEnd() && peek() != '|' && !isNewLine(peek())) {
            if (peek() == '\\' && !isNewLine(peek(1)) && pos + 1 < length) {
                advance(); // escape, keep the next char in the cell
            }
            advance();
        }
        return G_TABLE_CELL;
    }

    // ========== GS_DOC_STRING State ==========

    private TokenType scanDocString() {
        char c = peek();
        if (isNewLine(c)) {
            // one line break at a time, blank lines are significant
            if (c == '\r' && peek(1) == '\n') {
                advance();
            }
            advance();
            return WS_LF;
        }
        int lookahead = pos;
        while (lookahead < length && isBlank(source.charAt(lookahead))) {
            lookahead++;
        }
        if (source.startsWith("\"\"\"", lookahead)) {
            while (pos < lookahead) {
                advance();
            }
            advance();
            advance();
            advance();
            gState = GherkinState.GHERKIN;
            return G_TRIPLE_QUOTE;
        }
        advanceToEndOfLine();
        return G_DOC_LINE;
    }

    // ========== GS_STEP State ==========

    private TokenType scanStepText() {
        advanceToEndOfLine();
        return G_STEP_TEXT;
    }

}
