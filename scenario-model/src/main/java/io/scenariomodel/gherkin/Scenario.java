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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A concrete test case: either declared with {@code Scenario:} or produced by
 * expanding one Examples row of a {@link ScenarioOutline}.
 */
public class Scenario {

    public static final String KEYWORD = "Scenario";

    private final int sectionIndex;
    private final int exampleIndex;
    private final int line;
    private final String name;
    private final String description;
    private final List<Tag> tags;
    private final List<Step> steps;
    private final Map<String, String> exampleData;

    public Scenario(int sectionIndex, int line, String name, String description, List<Tag> tags, List<Step> steps) {
        this(sectionIndex, -1, line, name, description, tags, steps, null);
    }

    public Scenario(int sectionIndex, int exampleIndex, int line, String name, String description,
                    List<Tag> tags, List<Step> steps, Map<String, String> exampleData) {
        this.sectionIndex = sectionIndex;
        this.exampleIndex = exampleIndex;
        this.line = line;
        this.name = name;
        this.description = description;
        this.tags = tags == null ? Collections.emptyList() : List.copyOf(tags);
        this.steps = steps == null ? Collections.emptyList() : List.copyOf(steps);
        this.exampleData = exampleData == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(exampleData));
    }

    /**
     * @return "[section:line]" or "[section.example:line]", 1-based
     */
    public String getRefId() {
        String meta = "[" + (sectionIndex + 1);
        if (exampleIndex != -1) {
            meta = meta + "." + (exampleIndex + 1);
        }
        return meta + ":" + line + "]";
    }

    public String getRefIdAndName() {
        if (name == null) {
            return getRefId();
        } else {
            return getRefId() + " " + name;
        }
    }

    public boolean isOutlineExample() {
        return exampleIndex != -1;
    }

    public int getSectionIndex() {
        return sectionIndex;
    }

    /**
     * @return the row index across all Examples tables of the outline, -1 for a plain scenario
     */
    public int getExampleIndex() {
        return exampleIndex;
    }

    /**
     * @return the 1-based line of the Scenario header, or of the Examples row for an expanded scenario
     */
    public int getLine() {
        return line;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return own tags, for an expanded scenario the outline tags followed by the Examples tags
     */
    public List<Tag> getTags() {
        return tags;
    }

    public List<Step> getSteps() {
        return steps;
    }

    /**
     * @return column name to value of the Examples row, null for a plain scenario
     */
    public Map<String, String> getExampleData() {
        return exampleData;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sectionIndex, exampleIndex, name, description, Tag.asSet(tags), steps, exampleData);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Scenario)) {
            return false;
        }
        Scenario other = (Scenario) obj;
        return sectionIndex == other.sectionIndex
                && exampleIndex == other.exampleIndex
                && Objects.equals(name, other.name)
                && Objects.equals(description, other.description)
                && Tag.asSet(tags).equals(Tag.asSet(other.tags))
                && steps.equals(other.steps)
                && Objects.equals(exampleData, other.exampleData);
    }

    @Override
    public String toString() {
        return getRefIdAndName();
    }

}
