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
import java.util.List;
import java.util.Objects;

/**
 * A top-level entry of a feature: exactly one of scenario or outline is present.
 */
public class FeatureSection {

    private final int index;
    private final Scenario scenario;
    private final ScenarioOutline scenarioOutline;

    private FeatureSection(int index, Scenario scenario, ScenarioOutline scenarioOutline) {
        this.index = index;
        this.scenario = scenario;
        this.scenarioOutline = scenarioOutline;
    }

    public static FeatureSection of(Scenario scenario) {
        return new FeatureSection(scenario.getSectionIndex(), scenario, null);
    }

    public static FeatureSection of(ScenarioOutline outline) {
        return new FeatureSection(outline.getSectionIndex(), null, outline);
    }

    public boolean isOutline() {
        return scenarioOutline != null;
    }

    /**
     * @return the scenario itself, or the expanded outline
     */
    public List<Scenario> getScenarios() {
        return isOutline() ? scenarioOutline.expand() : Collections.singletonList(scenario);
    }

    public int getIndex() {
        return index;
    }

    public int getLine() {
        return isOutline() ? scenarioOutline.getLine() : scenario.getLine();
    }

    public List<Tag> getTags() {
        return isOutline() ? scenarioOutline.getTags() : scenario.getTags();
    }

    public List<Step> getSteps() {
        return isOutline() ? scenarioOutline.getSteps() : scenario.getSteps();
    }

    public Scenario getScenario() {
        return scenario;
    }

    public ScenarioOutline getScenarioOutline() {
        return scenarioOutline;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, scenario, scenarioOutline);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FeatureSection)) {
            return false;
        }
        FeatureSection other = (FeatureSection) obj;
        return index == other.index
                && Objects.equals(scenario, other.scenario)
                && Objects.equals(scenarioOutline, other.scenarioOutline);
    }

    @Override
    public String toString() {
        return isOutline() ? scenarioOutline.toString() : scenario.toString();
    }

}
