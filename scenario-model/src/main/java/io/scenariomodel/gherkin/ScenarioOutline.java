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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class ScenarioOutline {

    public static final String KEYWORD = "Scenario Outline";

    private final int sectionIndex;
    private final int line;
    private final String name;
    private final String description;
    private final List<Tag> tags;
    private final List<Step> steps;
    private final List<ExamplesTable> examplesTables;

    public ScenarioOutline(int sectionIndex, int line, String name, String description,
                           List<Tag> tags, List<Step> steps, List<ExamplesTable> examplesTables) {
        this.sectionIndex = sectionIndex;
        this.line = line;
        this.name = name;
        this.description = description;
        this.tags = tags == null ? Collections.emptyList() : List.copyOf(tags);
        this.steps = steps == null ? Collections.emptyList() : List.copyOf(steps);
        this.examplesTables = examplesTables == null ? Collections.emptyList() : List.copyOf(examplesTables);
    }

    /**
     * One scenario per Examples row: tables in declaration order, rows in file order.
     * Every call builds a fresh list of the same scenarios.
     */
    public List<Scenario> expand() {
        List<Scenario> list = new ArrayList<>(getNumberOfExamples());
        int exampleIndex = 0;
        for (ExamplesTable examples : examplesTables) {
            Table table = examples.getTable();
            List<Map<String, String>> rows = examples.getRows();
            List<Tag> scenarioTags = new ArrayList<>(tags);
            scenarioTags.addAll(examples.getTags());
            for (int i = 0; i < rows.size(); i++) {
                Map<String, String> row = rows.get(i);
                List<Step> expanded = new ArrayList<>(steps.size());
                for (Step step : steps) {
                    expanded.add(step.replace(row));
                }
                String scenarioName = name == null ? null : Placeholders.replace(name, row);
                // row 0 of the table is the header
                int rowLine = table.getLineNumberForRow(i + 1);
                list.add(new Scenario(sectionIndex, exampleIndex++, rowLine, scenarioName, description,
                        scenarioTags, expanded, row));
            }
        }
        return list;
    }

    public int getNumberOfExamples() {
        int count = 0;
        for (ExamplesTable examples : examplesTables) {
            count += examples.getRowCount();
        }
        return count;
    }

    /**
     * @return the placeholder names referenced by the template steps, in order of appearance
     */
    public List<String> getPlaceholders() {
        return Placeholders.findAll(steps);
    }

    public int getSectionIndex() {
        return sectionIndex;
    }

    public int getLine() {
        return line;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<Tag> getTags() {
        return tags;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public List<ExamplesTable> getExamplesTables() {
        return examplesTables;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sectionIndex, name, description, Tag.asSet(tags), steps, examplesTables);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ScenarioOutline)) {
            return false;
        }
        ScenarioOutline other = (ScenarioOutline) obj;
        return sectionIndex == other.sectionIndex
                && Objects.equals(name, other.name)
                && Objects.equals(description, other.description)
                && Tag.asSet(tags).equals(Tag.asSet(other.tags))
                && steps.equals(other.steps)
                && examplesTables.equals(other.examplesTables);
    }

    @Override
    public String toString() {
        return "[" + (sectionIndex + 1) + ":" + line + "] " + name;
    }

}
