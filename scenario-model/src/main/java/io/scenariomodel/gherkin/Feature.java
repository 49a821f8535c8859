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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The parsed, read-only form of one feature document. Equality is structural
 * and ignores the resource and line numbers.
 */
public class Feature {

    public static final String KEYWORD = "Feature";

    private final Resource resource;
    private final int line;
    private final List<Tag> tags;
    private final String name;
    private final String description;
    private final Background background;
    private final List<FeatureSection> sections;

    public static Feature read(String path) {
        return read(Resource.path(path));
    }

    public static Feature read(Path path) {
        return read(Resource.from(path));
    }

    public static Feature read(Resource resource) {
        GherkinParser parser = new GherkinParser(resource);
        return parser.parse();
    }

    public static Feature parse(String text) {
        return read(Resource.text(text));
    }

    public Feature(Resource resource, int line, List<Tag> tags, String name, String description,
                   Background background, List<FeatureSection> sections) {
        this.resource = resource;
        this.line = line;
        this.tags = tags == null ? Collections.emptyList() : List.copyOf(tags);
        this.name = name;
        this.description = description;
        this.background = background;
        this.sections = sections == null ? Collections.emptyList() : List.copyOf(sections);
    }

    /**
     * @return every concrete scenario in declaration order, outlines expanded in place
     */
    public List<Scenario> getScenarios() {
        List<Scenario> list = new ArrayList<>();
        for (FeatureSection section : sections) {
            list.addAll(section.getScenarios());
        }
        return list;
    }

    /**
     * @param tagExpression e.g. "@smoke and not @regression", null or blank selects everything
     * @return the matching concrete scenarios in declaration order
     */
    public List<Scenario> filterByTag(String tagExpression) {
        return filterByTag(TagExpression.parse(tagExpression));
    }

    public List<Scenario> filterByTag(TagExpression expression) {
        List<Scenario> list = new ArrayList<>();
        for (Scenario scenario : getScenarios()) {
            if (expression.evaluate(getTagsEffective(scenario))) {
                list.add(scenario);
            }
        }
        return list;
    }

    /**
     * @return the feature tags followed by the scenario tags
     */
    public List<Tag> getTagsEffective(Scenario scenario) {
        return withFeatureTags(scenario.getTags());
    }

    /**
     * @return the feature tags followed by the section tags, for an outline without the Examples tags
     */
    public List<Tag> getTagsEffective(FeatureSection section) {
        return withFeatureTags(section.getTags());
    }

    private List<Tag> withFeatureTags(List<Tag> own) {
        if (tags.isEmpty()) {
            return own;
        }
        if (own.isEmpty()) {
            return tags;
        }
        List<Tag> merged = new ArrayList<>(tags);
        merged.addAll(own);
        return merged;
    }

    /**
     * @return the background steps followed by the scenario steps, in execution order
     */
    public List<Step> getStepsIncludingBackground(Scenario scenario) {
        if (!isBackgroundPresent()) {
            return scenario.getSteps();
        }
        List<Step> temp = new ArrayList<>(background.getSteps().size() + scenario.getSteps().size());
        temp.addAll(background.getSteps());
        temp.addAll(scenario.getSteps());
        return temp;
    }

    public boolean isBackgroundPresent() {
        return background != null && !background.getSteps().isEmpty();
    }

    public String getNameForReport() {
        String fileName = resource == null ? "" : resource.getFileNameWithoutExtension();
        if (StringUtils.isBlank(name)) {
            return "[" + fileName + "]";
        } else {
            return "[" + fileName + "] " + name;
        }
    }

    public Resource getResource() {
        return resource;
    }

    public int getLine() {
        return line;
    }

    public List<Tag> getTags() {
        return tags;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Background getBackground() {
        return background;
    }

    public List<FeatureSection> getSections() {
        return sections;
    }

    public FeatureSection getSection(int sectionIndex) {
        return sections.get(sectionIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Tag.asSet(tags), name, description, background, sections);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Feature)) {
            return false;
        }
        Feature other = (Feature) obj;
        return Tag.asSet(tags).equals(Tag.asSet(other.tags))
                && Objects.equals(name, other.name)
                && Objects.equals(description, other.description)
                && Objects.equals(background, other.background)
                && sections.equals(other.sections);
    }

    @Override
    public String toString() {
        return resource == null ? String.valueOf(name) : resource.getPathForLog();
    }

}
