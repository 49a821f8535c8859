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

import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Map and list view of a feature for consumers outside the JVM. Outlines are
 * listed with their template and with the scenarios expanded from every row.
 */
public class FeatureJson {

    private FeatureJson() {
        // only static methods
    }

    public static String toJson(Feature feature) {
        return JSONValue.toJSONString(toMap(feature), JSONStyle.NO_COMPRESS);
    }

    public static Map<String, Object> toMap(Feature feature) {
        Map<String, Object> map = new LinkedHashMap<>();
        // inline text has no path
        String path = feature.getResource() == null ? "" : feature.getResource().getPrefixedPath();
        if (!path.isEmpty()) {
            map.put("path", path);
        }
        map.put("line", feature.getLine());
        map.put("name", feature.getName());
        map.put("description", feature.getDescription());
        map.put("tags", tags(feature.getTags()));
        if (feature.getBackground() != null) {
            Map<String, Object> background = new LinkedHashMap<>();
            background.put("line", feature.getBackground().getLine());
            background.put("steps", steps(feature.getBackground().getSteps()));
            map.put("background", background);
        }
        List<Map<String, Object>> sections = new ArrayList<>();
        for (FeatureSection section : feature.getSections()) {
            sections.add(section.isOutline()
                    ? outline(section.getScenarioOutline())
                    : scenario(section.getScenario()));
        }
        map.put("sections", sections);
        return map;
    }

    private static Map<String, Object> scenario(Scenario scenario) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", "scenario");
        map.put("refId", scenario.getRefId());
        map.put("line", scenario.getLine());
        map.put("name", scenario.getName());
        map.put("description", scenario.getDescription());
        map.put("tags", tags(scenario.getTags()));
        if (scenario.getExampleData() != null) {
            map.put("exampleIndex", scenario.getExampleIndex());
            map.put("exampleData", new LinkedHashMap<>(scenario.getExampleData()));
        }
        map.put("steps", steps(scenario.getSteps()));
        return map;
    }

    private static Map<String, Object> outline(ScenarioOutline outline) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", "outline");
        map.put("line", outline.getLine());
        map.put("name", outline.getName());
        map.put("description", outline.getDescription());
        map.put("tags", tags(outline.getTags()));
        map.put("steps", steps(outline.getSteps()));
        List<Map<String, Object>> examples = new ArrayList<>();
        for (ExamplesTable table : outline.getExamplesTables()) {
            Map<String, Object> temp = new LinkedHashMap<>();
            temp.put("line", table.getLine());
            temp.put("name", table.getName());
            temp.put("tags", tags(table.getTags()));
            temp.put("columns", new ArrayList<>(table.getColumns()));
            List<Object> rows = new ArrayList<>();
            for (Map<String, String> row : table.getRows()) {
                rows.add(new LinkedHashMap<>(row));
            }
            temp.put("rows", rows);
            examples.add(temp);
        }
        map.put("examples", examples);
        List<Map<String, Object>> scenarios = new ArrayList<>();
        for (Scenario scenario : outline.expand()) {
            scenarios.add(scenario(scenario));
        }
        map.put("scenarios", scenarios);
        return map;
    }

    private static List<String> tags(List<Tag> tags) {
        List<String> list = new ArrayList<>(tags.size());
        for (Tag tag : tags) {
            list.add(tag.toString());
        }
        return list;
    }

    private static List<Map<String, Object>> steps(List<Step> steps) {
        List<Map<String, Object>> list = new ArrayList<>(steps.size());
        for (Step step : steps) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("line", step.getLine());
            map.put("keyword", step.getKeyword());
            map.put("text", step.getText());
            if (step.getDocString() != null) {
                map.put("docString", step.getDocString());
                if (step.getDocStringType() != null) {
                    map.put("docStringType", step.getDocStringType());
                }
            }
            if (step.getTable() != null) {
                List<Object> rows = new ArrayList<>();
                for (List<String> row : step.getTable().getRows()) {
                    rows.add(new ArrayList<>(row));
                }
                map.put("table", rows);
            }
            list.add(map);
        }
        return list;
    }

}
