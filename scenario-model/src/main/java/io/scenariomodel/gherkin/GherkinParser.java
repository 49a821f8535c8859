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
import io.scenariomodel.common.StringUtils;
import io.scenariomodel.parser.BaseLexer;
import io.scenariomodel.parser.BaseParser;
import io.scenariomodel.parser.SyntaxError;
import io.scenariomodel.parser.Token;
import io.scenariomodel.parser.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.scenariomodel.parser.TokenType.*;

/**
 * Parses one feature document into a {@link Feature}. A feature needs at least
 * one scenario or outline. The first problem found aborts the parse with a
 * {@link SyntaxError} or a {@link StructureError}.
 */
public class GherkinParser extends BaseParser {

    static final Logger logger = LoggerFactory.getLogger(GherkinParser.class);

    public GherkinParser(Resource resource) {
        super(resource, BaseLexer.tokenize(new GherkinLexer(resource)));
    }

    public Feature parse() {
        List<Tag> featureTags = tags();
        if (!peekIf(G_FEATURE)) {
            throw error(featureTags.isEmpty() ? "expected 'Feature:'" : "tags must be followed by 'Feature:'");
        }
        Token header = next();
        String name = name(header);
        String description = description();
        Background background = null;
        if (peekIf(G_BACKGROUND)) {
            background = background();
        }
        List<FeatureSection> sections = new ArrayList<>();
        while (!peekIf(EOF)) {
            List<Tag> tags = tags();
            int index = sections.size();
            switch (peek()) {
                case G_SCENARIO -> sections.add(FeatureSection.of(scenario(index, tags)));
                case G_SCENARIO_OUTLINE -> sections.add(FeatureSection.of(scenarioOutline(index, tags)));
                default -> throw unexpected(tags.isEmpty(), background != null && sections.isEmpty());
            }
        }
        if (sections.isEmpty()) {
            throw error("expected 'Scenario:' or 'Scenario Outline:'");
        }
        Feature feature = new Feature(resource, header.line + 1, featureTags, name, description, background, sections);
        logger.debug("parsed {}: {} section(s)", resource.getPathForLog(), sections.size());
        return feature;
    }

    private SyntaxError unexpected(boolean noTags, boolean afterBackground) {
        Token token = peekToken();
        return switch (token.type) {
            case EOF -> error("tags must be followed by 'Scenario:' or 'Scenario Outline:'");
            case G_BACKGROUND -> error(afterBackground
                    ? "only one 'Background:' is allowed"
                    : "'Background:' must come before the first scenario");
            case G_FEATURE -> error("only one 'Feature:' is allowed");
            case G_EXAMPLES -> error("'Examples:' is only allowed in a 'Scenario Outline:'");
            case G_PREFIX -> error(noTags
                    ? "step '" + token.text + "' is not inside a 'Scenario:' or 'Background:'"
                    : "tags must be followed by 'Scenario:' or 'Scenario Outline:'");
            case G_PIPE -> error("table row is not attached to a step");
            case G_TRIPLE_QUOTE -> error("doc string is not attached to a step");
            case G_DESC -> error("unexpected text: " + token.text.trim());
            default -> error("expected 'Scenario:' or 'Scenario Outline:'");
        };
    }

    private List<Tag> tags() {
        List<Tag> tags = new ArrayList<>();
        while (peekIf(G_TAG)) {
            Token token = next();
            if (token.text.length() == 1) {
                throw error(token, "empty tag");
            }
            tags.add(new Tag(token.line + 1, token.text));
        }
        return tags;
    }

    private String name(Token header) {
        if (peekOnLine(G_DESC, header.line)) {
            return StringUtils.trimToNull(next().text);
        }
        return null;
    }

    private String description() {
        StringBuilder desc = new StringBuilder();
        while (peekIf(G_DESC)) {
            String text = next().text.trim();
            if (desc.length() > 0) {
                desc.append('\n');
            }
            desc.append(text);
        }
        return desc.length() == 0 ? null : desc.toString();
    }

    private Background background() {
        Token header = next();
        String name = name(header);
        String description = description();
        List<Step> steps = steps();
        return new Background(header.line + 1, name, description, steps);
    }

    private Scenario scenario(int index, List<Tag> tags) {
        Token header = next();
        String name = name(header);
        String description = description();
        List<Step> steps = steps();
        return new Scenario(index, header.line + 1, name, description, tags, steps);
    }

    private ScenarioOutline scenarioOutline(int index, List<Tag> tags) {
        Token header = next();
        String name = name(header);
        String description = description();
        List<Step> steps = steps();
        List<ExamplesTable> examplesTables = new ArrayList<>();
        // tags may belong to the next Examples or to the next scenario
        while (peekIf(G_EXAMPLES) || (peekIf(G_TAG) && peekPast(G_TAG) == G_EXAMPLES)) {
            examplesTables.add(examples());
        }
        if (examplesTables.isEmpty()) {
            throw new StructureError(header, "'Scenario Outline:' has no 'Examples:'");
        }
        checkPlaceholders(steps, examplesTables);
        return new ScenarioOutline(index, header.line + 1, name, description, tags, steps, examplesTables);
    }

    private ExamplesTable examples() {
        List<Tag> tags = tags();
        Token header = next();
        String name = name(header);
        String description = description();
        if (!peekIf(G_PIPE)) {
            throw new StructureError(header, "'Examples:' has no table");
        }
        Token first = peekToken();
        Table table = table();
        Set<String> seen = new HashSet<>();
        for (String column : table.getHeader()) {
            if (!seen.add(column)) {
                throw new StructureError(first, "duplicate column in 'Examples:' header: " + column);
            }
        }
        return new ExamplesTable(header.line + 1, name, description, tags, table);
    }

    private void checkPlaceholders(List<Step> steps, List<ExamplesTable> examplesTables) {
        for (Step step : steps) {
            for (String placeholder : Placeholders.find(step)) {
                for (ExamplesTable examples : examplesTables) {
                    if (!examples.getColumns().contains(placeholder)) {
                        throw new StructureError(resource, step.getLine(), 1, "placeholder <" + placeholder
                                + "> has no matching column in 'Examples:' at line " + examples.getLine());
                    }
                }
            }
        }
    }

    private List<Step> steps() {
        List<Step> steps = new ArrayList<>();
        while (peekIf(G_PREFIX)) {
            steps.add(step(steps.size()));
        }
        return steps;
    }

    private Step step(int index) {
        Token prefix = next();
        String text = null;
        if (peekOnLine(G_STEP_TEXT, prefix.line)) {
            text = StringUtils.trimToNull(next().text);
        }
        if (text == null) {
            throw error(prefix, "missing text after '" + prefix.text + "'");
        }
        String docString = null;
        String docStringType = null;
        Table table = null;
        if (peekIf(G_TRIPLE_QUOTE)) {
            Token open = peekToken();
            docString = docString();
            docStringType = StringUtils.trimToNull(open.text.substring(3));
        } else if (peekIf(G_PIPE)) {
            table = table();
        }
        return new Step(prefix.line + 1, index, prefix.text, text, docString, docStringType, table);
    }

    private String docString() {
        Token open = next();
        StringBuilder sb = new StringBuilder();
        int lastLine = open.line;
        boolean first = true;
        while (peekIf(G_DOC_LINE)) {
            Token token = next();
            first = appendBlankLines(sb, token.line - lastLine - 1, first);
            if (!first) {
                sb.append('\n');
            }
            sb.append(stripIndent(token.text, open.col).replace("\\\"\\\"\\\"", "\"\"\""));
            first = false;
            lastLine = token.line;
        }
        if (!peekIf(G_TRIPLE_QUOTE)) {
            throw error(open, "doc string is not closed");
        }
        Token close = next();
        appendBlankLines(sb, close.line - lastLine - 1, first);
        return sb.toString();
    }

    private static boolean appendBlankLines(StringBuilder sb, int count, boolean first) {
        for (int i = 0; i < count; i++) {
            if (!first) {
                sb.append('\n');
            }
            first = false;
        }
        return first;
    }

    private static String stripIndent(String text, int indent) {
        int strip = Math.min(indent, StringUtils.indentOf(text));
        return text.substring(strip);
    }

    private Table table() {
        List<List<String>> rows = new ArrayList<>();
        List<Integer> lineNumbers = new ArrayList<>();
        while (peekIf(G_PIPE)) {
            Token first = peekToken();
            List<String> cells = tableRow();
            if (!rows.isEmpty() && cells.size() != rows.get(0).size()) {
                throw error(first, "table row has " + cells.size() + " cell(s), expected "
                        + rows.get(0).size() + " as in the first row");
            }
            rows.add(cells);
            lineNumbers.add(first.line + 1);
        }
        return new Table(rows, lineNumbers);
    }

    private List<String> tableRow() {
        Token first = next(); // the leading pipe
        int rowLine = first.line;
        List<String> cells = new ArrayList<>();
        while (true) {
            if (peekOnLine(G_TABLE_CELL, rowLine)) {
                Token cell = next();
                if (!peekOnLine(G_PIPE, rowLine)) {
                    throw error(cell, "table row must end with '|'");
                }
                next();
                cells.add(unescapeCell(cell.text.trim()));
            } else if (peekOnLine(G_PIPE, rowLine)) {
                next(); // empty cell
                cells.add("");
            } else {
                break;
            }
        }
        if (cells.isEmpty()) {
            throw error(first, "table row has no cells");
        }
        return cells;
    }

    static String unescapeCell(String text) {
        if (text.indexOf('\\') == -1) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                char n = text.charAt(i + 1);
                switch (n) {
                    case '|', '\\' -> {
                        sb.append(n);
                        i++;
                    }
                    case 'n' -> {
                        sb.append('\n');
                        i++;
                    }
                    default -> sb.append(c);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

}
