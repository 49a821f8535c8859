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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.scenariomodel.gherkin.Violation.Kind.*;

/**
 * Checks the model invariants without throwing. Documents produced by the
 * parser can only show the non-error kinds, models assembled in code can show
 * any of them.
 */
public class FeatureValidator {

    private final Feature feature;
    private final List<Violation> violations = new ArrayList<>();

    private FeatureValidator(Feature feature) {
        this.feature = feature;
    }

    /**
     * @return every violation found, in document order, empty if the feature is well-formed
     */
    public static List<Violation> validate(Feature feature) {
        FeatureValidator validator = new FeatureValidator(feature);
        validator.run();
        return validator.violations;
    }

    private void run() {
        checkTags(feature.getTags(), -1, feature.getLine(), "feature");
        Background background = feature.getBackground();
        if (background != null && background.getSteps().isEmpty()) {
            add(EMPTY_STEPS, -1, -1, background.getLine(), "background has no steps");
        }
        for (FeatureSection section : feature.getSections()) {
            if (section.isOutline()) {
                checkOutline(section.getScenarioOutline());
            } else {
                checkScenario(section.getScenario());
            }
        }
    }

    private void checkScenario(Scenario scenario) {
        int index = scenario.getSectionIndex();
        checkTags(scenario.getTags(), index, scenario.getLine(), "scenario");
        if (scenario.getSteps().isEmpty()) {
            add(EMPTY_STEPS, index, -1, scenario.getLine(), "scenario has no steps");
        }
        checkStepTables(scenario.getSteps(), index);
    }

    private void checkOutline(ScenarioOutline outline) {
        int index = outline.getSectionIndex();
        checkTags(outline.getTags(), index, outline.getLine(), "scenario outline");
        if (outline.getSteps().isEmpty()) {
            add(EMPTY_STEPS, index, -1, outline.getLine(), "scenario outline has no steps");
        }
        checkStepTables(outline.getSteps(), index);
        if (outline.getExamplesTables().isEmpty()) {
            add(MISSING_EXAMPLES, index, -1, outline.getLine(), "scenario outline has no examples");
            return;
        }
        for (ExamplesTable examples : outline.getExamplesTables()) {
            checkExamples(examples, index);
        }
        for (Step step : outline.getSteps()) {
            for (String placeholder : Placeholders.find(step)) {
                for (ExamplesTable examples : outline.getExamplesTables()) {
                    if (!examples.getColumns().contains(placeholder)) {
                        add(UNMATCHED_PLACEHOLDER, index, step.getIndex(), step.getLine(), "placeholder <"
                                + placeholder + "> has no matching column in examples at line " + examples.getLine());
                    }
                }
            }
        }
    }

    private void checkExamples(ExamplesTable examples, int index) {
        checkTags(examples.getTags(), index, examples.getLine(), "examples");
        Table table = examples.getTable();
        if (table == null || table.getRowCount() == 0) {
            add(MISSING_EXAMPLES, index, -1, examples.getLine(), "examples has no table");
            return;
        }
        Set<String> seen = new HashSet<>();
        for (String column : table.getHeader()) {
            if (!seen.add(column)) {
                add(DUPLICATE_COLUMN, index, -1, table.getLineNumberForRow(0), "duplicate column: " + column);
            }
        }
        checkRowWidths(table, index, -1);
        if (table.getRowCount() == 1) {
            add(EMPTY_EXAMPLES, index, -1, examples.getLine(), "examples has a header but no rows");
        }
    }

    private void checkStepTables(List<Step> steps, int index) {
        for (Step step : steps) {
            if (step.getTable() != null) {
                checkRowWidths(step.getTable(), index, step.getIndex());
            }
        }
    }

    private void checkRowWidths(Table table, int index, int stepIndex) {
        int expected = table.getColumnCount();
        List<List<String>> rows = table.getRows();
        for (int i = 1; i < rows.size(); i++) {
            int actual = rows.get(i).size();
            if (actual != expected) {
                add(ROW_WIDTH, index, stepIndex, table.getLineNumberForRow(i),
                        "row " + (i + 1) + " has " + actual + " cell(s), expected " + expected);
            }
        }
    }

    private void checkTags(List<Tag> tags, int index, int line, String owner) {
        Set<Tag> seen = new HashSet<>();
        Set<Tag> reported = new HashSet<>();
        for (Tag tag : tags) {
            if (!seen.add(tag) && reported.add(tag)) {
                int tagLine = tag.getLine() == 0 ? line : tag.getLine();
                add(DUPLICATE_TAG, index, -1, tagLine, owner + " has duplicate tag " + tag);
            }
        }
    }

    private void add(Violation.Kind kind, int sectionIndex, int stepIndex, int line, String message) {
        violations.add(new Violation(kind, sectionIndex, stepIndex, line, message));
    }

}
