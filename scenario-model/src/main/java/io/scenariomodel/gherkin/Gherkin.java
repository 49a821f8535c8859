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

import java.util.List;

/**
 * Entry points for tools that consume feature documents: parse, expand,
 * select by tag, validate and write back.
 */
public class Gherkin {

    private Gherkin() {
        // only static methods
    }

    /**
     * @throws io.scenariomodel.parser.SyntaxError on malformed grammar
     * @throws StructureError when a model invariant is broken
     */
    public static Feature parse(String text) {
        return Feature.parse(text);
    }

    public static Feature parse(Resource resource) {
        return Feature.read(resource);
    }

    public static List<Scenario> expand(ScenarioOutline outline) {
        return outline.expand();
    }

    public static List<Scenario> filterByTag(Feature feature, String tagExpression) {
        return feature.filterByTag(tagExpression);
    }

    public static List<Violation> validate(Feature feature) {
        return FeatureValidator.validate(feature);
    }

    public static String serialize(Feature feature) {
        return FeatureWriter.write(feature);
    }

}
