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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds and substitutes {@code <name>} tokens of a scenario outline.
 */
public class Placeholders {

    // no white-space just inside the brackets, so that "a < b and c > d" is not a placeholder
    private static final Pattern PATTERN = Pattern.compile("<([^<>\\s](?:[^<>\\n]*[^<>\\s])?)>");

    private Placeholders() {
        // only static methods
    }

    public static Set<String> find(String text) {
        if (text == null) {
            return Collections.emptySet();
        }
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PATTERN.matcher(text);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    /**
     * @return the placeholder names used by the step text and table cells, in order of appearance
     */
    public static Set<String> find(Step step) {
        Set<String> names = new LinkedHashSet<>(find(step.getText()));
        if (step.getTable() != null) {
            for (List<String> row : step.getTable().getRows()) {
                for (String cell : row) {
                    names.addAll(find(cell));
                }
            }
        }
        return names;
    }

    public static List<String> findAll(List<Step> steps) {
        Set<String> names = new LinkedHashSet<>();
        for (Step step : steps) {
            names.addAll(find(step));
        }
        return new ArrayList<>(names);
    }

    /**
     * Single pass substitution, a value that itself looks like a placeholder is
     * not substituted again. Tokens with no value are left as they are.
     */
    public static String replace(String text, Map<String, String> values) {
        if (text == null || text.indexOf('<') == -1) {
            return text;
        }
        Matcher matcher = PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            String replacement = value == null ? matcher.group() : value;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

}
