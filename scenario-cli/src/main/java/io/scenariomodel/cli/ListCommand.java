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
package io.scenariomodel.cli;

import io.scenariomodel.common.ResourceNotFoundException;
import io.scenariomodel.gherkin.Feature;
import io.scenariomodel.gherkin.FeatureSection;
import io.scenariomodel.gherkin.Scenario;
import io.scenariomodel.gherkin.ScenarioOutline;
import io.scenariomodel.gherkin.Step;
import io.scenariomodel.gherkin.TagExpression;
import io.scenariomodel.output.Console;
import io.scenariomodel.parser.ParserException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

/**
 * The 'list' subcommand: prints the scenarios selected by a tag expression,
 * one per line as {@code path:line [ref] name}.
 * <p>
 * Usage examples:
 * <pre>
 * scenario list -t @smoke src/test/resources/features
 * scenario list -t "@cart and not @regression" --steps shopping.feature
 * scenario list --no-expand login.feature
 * </pre>
 */
@Command(
        name = "list",
        mixinStandardHelpOptions = true,
        description = "List scenarios selected by a tag expression"
)
public class ListCommand extends FeatureCommand {

    @Option(
            names = {"-t", "--tags"},
            description = "Tag expression, e.g. '@smoke and not @wip' (default: from scenario-config.json or all)"
    )
    String tags;

    @Option(
            names = {"--steps"},
            description = "Print the steps of each scenario, background first"
    )
    boolean steps;

    @Option(
            names = {"--no-expand"},
            description = "List each outline once instead of one scenario per Examples row"
    )
    boolean noExpand;

    private int count;

    @Override
    public Integer call() {
        if (!loadConfig()) {
            return 1;
        }
        List<Path> roots = resolvePaths();
        if (roots.isEmpty()) {
            printNoPaths("list");
            return 0;
        }
        TagExpression expression;
        try {
            expression = TagExpression.parse(resolveTags());
        } catch (IllegalArgumentException e) {
            Console.error(e.getMessage());
            return 1;
        }
        logger.debug("tag expression: {}", expression);
        int failures = 0;
        try {
            for (Path file : findFeatureFiles(roots)) {
                try {
                    list(Feature.read(toResource(file)), expression);
                } catch (ParserException e) {
                    failures++;
                    Console.error(e.getMessage());
                }
            }
        } catch (ResourceNotFoundException e) {
            Console.error(e.getMessage());
            return 1;
        }
        Console.info(count + " scenario(s)");
        return failures > 0 ? 1 : 0;
    }

    private void list(Feature feature, TagExpression expression) {
        String path = feature.getResource().getPathForLog();
        if (resolveExpand()) {
            for (Scenario scenario : feature.filterByTag(expression)) {
                count++;
                Console.println(path + ":" + scenario.getLine() + " " + scenario.getRefIdAndName());
                if (steps) {
                    printSteps(feature.getStepsIncludingBackground(scenario));
                }
            }
            return;
        }
        List<Scenario> selected = feature.filterByTag(expression);
        for (FeatureSection section : feature.getSections()) {
            boolean matched;
            if (section.getScenarios().isEmpty()) {
                // an outline whose Examples have no rows can only match on its own tags
                matched = expression.evaluate(feature.getTagsEffective(section));
            } else {
                matched = isSelected(selected, section);
            }
            if (!matched) {
                continue;
            }
            count++;
            if (section.isOutline()) {
                ScenarioOutline outline = section.getScenarioOutline();
                Console.println(path + ":" + outline.getLine() + " " + outline
                        + Console.highlight(" (" + outline.getNumberOfExamples() + " example(s))"));
            } else {
                Scenario scenario = section.getScenario();
                Console.println(path + ":" + scenario.getLine() + " " + scenario.getRefIdAndName());
            }
            if (steps) {
                if (feature.isBackgroundPresent()) {
                    printSteps(feature.getBackground().getSteps());
                }
                printSteps(section.getSteps());
            }
        }
    }

    private static boolean isSelected(List<Scenario> selected, FeatureSection section) {
        for (Scenario scenario : selected) {
            if (scenario.getSectionIndex() == section.getIndex()) {
                return true;
            }
        }
        return false;
    }

    private static void printSteps(List<Step> list) {
        for (Step step : list) {
            Console.println("    " + step.getKeyword() + " " + step.getText());
        }
    }

    private String resolveTags() {
        if (tags != null) {
            return tags;
        }
        return config == null ? null : config.getTags();
    }

    private boolean resolveExpand() {
        if (noExpand) {
            return false;
        }
        return config == null || config.isExpand();
    }

    public int getCount() {
        return count;
    }

}
