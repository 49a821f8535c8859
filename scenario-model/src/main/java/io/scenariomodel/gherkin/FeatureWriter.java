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

import io.scenariomodel.common.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a feature back to canonical Gherkin text. Comments and the original
 * layout are not kept, but parsing the output gives an equal {@link Feature}.
 */
public class FeatureWriter {

    private static final String INDENT = "  ";

    private final StringBuilder sb = new StringBuilder();

    private FeatureWriter() {
        // use write()
    }

    public static String write(Feature feature) {
        FeatureWriter writer = new FeatureWriter();
        writer.feature(feature);
        return writer.sb.toString();
    }

    private void feature(Feature feature) {
        tags(feature.getTags(), 0);
        header(Feature.KEYWORD, feature.getName(), 0);
        description(feature.getDescription(), 1);
        Background background = feature.getBackground();
        if (background != null) {
            sb.append('\n');
            header(Background.KEYWORD, background.getName(), 1);
            description(background.getDescription(), 2);
            steps(background.getSteps(), 2);
        }
        for (FeatureSection section : feature.getSections()) {
            sb.append('\n');
            if (section.isOutline()) {
                outline(section.getScenarioOutline());
            } else {
                Scenario scenario = section.getScenario();
                tags(scenario.getTags(), 1);
                header(Scenario.KEYWORD, scenario.getName(), 1);
                description(scenario.getDescription(), 2);
                steps(scenario.getSteps(), 2);
            }
        }
    }

    private void outline(ScenarioOutline outline) {
        tags(outline.getTags(), 1);
        header(ScenarioOutline.KEYWORD, outline.getName(), 1);
        description(outline.getDescription(), 2);
        steps(outline.getSteps(), 2);
        for (ExamplesTable examples : outline.getExamplesTables()) {
            sb.append('\n');
            tags(examples.getTags(), 2);
            header(ExamplesTable.KEYWORD, examples.getName(), 2);
            description(examples.getDescription(), 3);
            if (examples.getTable() != null) {
                table(examples.getTable(), 3);
            }
        }
    }

    private void tags(List<Tag> tags, int depth) {
        if (tags.isEmpty()) {
            return;
        }
        indent(depth);
        List<String> list = new ArrayList<>(tags.size());
        for (Tag tag : tags) {
            list.add(tag.toString());
        }
        sb.append(StringUtils.join(list, " ")).append('\n');
    }

    private void header(String keyword, String name, int depth) {
        indent(depth);
        sb.append(keyword).append(':');
        if (name != null) {
            sb.append(' ').append(name);
        }
        sb.append('\n');
    }

    private void description(String description, int depth) {
        if (description == null) {
            return;
        }
        for (String line : description.split("\n")) {
            if (!line.isBlank()) {
                indent(depth);
                sb.append(line.trim()).append('\n');
            }
        }
    }

    private void steps(List<Step> steps, int depth) {
        for (Step step : steps) {
            indent(depth);
            sb.append(step.getKeyword()).append(' ').append(step.getText()).append('\n');
            if (step.getDocString() != null) {
                docString(step.getDocString(), step.getDocStringType(), depth + 1);
            } else if (step.getTable() != null) {
                table(step.getTable(), depth + 1);
            }
        }
    }

    private void docString(String text, String type, int depth) {
        indent(depth);
        sb.append("\"\"\"");
        if (type != null) {
            sb.append(type);
        }
        sb.append('\n');
        if (!text.isEmpty()) {
            for (String line : text.split("\n", -1)) {
                if (!line.isEmpty()) {
                    indent(depth);
                    sb.append(line.replace("\"\"\"", "\\\"\\\"\\\""));
                }
                sb.append('\n');
            }
        }
        indent(depth);
        sb.append("\"\"\"\n");
    }

    private void table(Table table, int depth) {
        int columns = 0;
        for (List<String> row : table.getRows()) {
            columns = Math.max(columns, row.size());
        }
        int[] widths = new int[columns];
        for (List<String> row : table.getRows()) {
            for (int i = 0; i < row.size(); i++) {
                widths[i] = Math.max(widths[i], escapeCell(row.get(i)).length());
            }
        }
        for (List<String> row : table.getRows()) {
            indent(depth);
            sb.append('|');
            for (int i = 0; i < row.size(); i++) {
                String cell = escapeCell(row.get(i));
                sb.append(' ').append(cell).append(StringUtils.repeat(' ', widths[i] - cell.length())).append(" |");
            }
            sb.append('\n');
        }
    }

    static String escapeCell(String text) {
        return text.replace("\\", "\\\\").replace("|", "\\|").replace("\n", "\\n");
    }

    private void indent(int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
    }

}
