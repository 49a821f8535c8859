package io.scenariomodel.gherkin;

import io.scenariomodel.common.Resource;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureTest {

    static final Logger logger = LoggerFactory.getLogger(FeatureTest.class);

    private static List<String> names(List<Scenario> scenarios) {
        List<String> names = new ArrayList<>(scenarios.size());
        for (Scenario scenario : scenarios) {
            names.add(scenario.getName());
        }
        return names;
    }

    @Test
    void testLoginFeature() {
        Feature feature = Feature.read("classpath:features/login.feature");
        assertEquals("User Login", feature.getName());
        assertEquals("classpath:features/login.feature", feature.getResource().getPathForLog());
        assertEquals("[login] User Login", feature.getNameForReport());
        assertEquals(6, feature.getSections().size());
        assertEquals(1, feature.getBackground().getSteps().size());
        // five declared scenarios plus three expanded rows
        assertEquals(8, feature.getScenarios().size());
    }

    @Test
    void testSmokeSelectsExactlyThree() {
        Feature feature = Feature.read("classpath:features/login.feature");
        List<Scenario> smoke = feature.filterByTag("@smoke");
        assertEquals(List.of(
                "Successful login with valid credentials",
                "Login fails with locked out user",
                "Login fails with invalid username"), names(smoke));
    }

    @Test
    void testFilterIncludesExpandedScenarios() {
        Feature feature = Feature.read("classpath:features/login.feature");
        List<Scenario> regression = feature.filterByTag("@regression");
        assertEquals(5, regression.size());
        assertFalse(regression.get(1).isOutlineExample());
        assertTrue(regression.get(2).isOutlineExample());
        assertEquals(8, feature.filterByTag("@login").size());
        assertEquals(8, feature.filterByTag((String) null).size());
        assertTrue(feature.filterByTag("@cart").isEmpty());
    }

    @Test
    void testFilterIsIdempotent() {
        Feature feature = Feature.read("classpath:features/shopping.feature");
        TagExpression expression = TagExpression.parse("@cart and not @smoke");
        List<Scenario> first = feature.filterByTag(expression);
        List<Scenario> second = feature.filterByTag(expression);
        assertEquals(first, second);
        assertEquals(List.of(
                "Add multiple products to the cart",
                "Remove a product from the cart",
                "View the cart page"), names(first));
        // filtering the already filtered result again selects the same scenarios
        List<Scenario> again = new ArrayList<>();
        for (Scenario scenario : first) {
            if (expression.evaluate(feature.getTagsEffective(scenario))) {
                again.add(scenario);
            }
        }
        assertEquals(first, again);
    }

    @Test
    void testFeatureTagsAreInherited() {
        Feature feature = Feature.parse("""
                @checkout
                Feature: f
                  @smoke
                  Scenario: one
                    Given a step
                  Scenario: two
                    Given a step
                  Scenario Outline: three
                    Given a <x>
                    @slow
                    Examples:
                      | x |
                      | 1 |
                """);
        assertEquals(3, feature.filterByTag("@checkout").size());
        assertEquals(List.of("one"), names(feature.filterByTag("@checkout and @smoke")));
        assertEquals(List.of("three"), names(feature.filterByTag("@slow")));
        List<Tag> effective = feature.getTagsEffective(feature.getScenarios().get(2));
        assertEquals(List.of(new Tag("@checkout"), new Tag("@slow")), effective);
        // the outline itself does not carry the Examples tags
        assertEquals(List.of(new Tag("@checkout")), feature.getTagsEffective(feature.getSection(2)));
        assertEquals(List.of(new Tag("@checkout"), new Tag("@smoke")), feature.getTagsEffective(feature.getSection(0)));
    }

    @Test
    void testOverlappingScenarioAndOutlineAreBothReturned() {
        Feature feature = Feature.parse("""
                Feature: f
                  @login
                  Scenario: standard user logs in
                    When I login with "standard_user"
                  @login
                  Scenario Outline: user logs in
                    When I login with "<user>"
                    Examples:
                      | user          |
                      | standard_user |
                """);
        List<Scenario> selected = feature.filterByTag("@login");
        assertEquals(2, selected.size());
        assertEquals(selected.get(0).getSteps(), selected.get(1).getSteps());
    }

    @Test
    void testEqualityIgnoresLayout() {
        Feature compact = Feature.parse("""
                Feature: f
                Scenario: s
                Given a step
                | a | b |
                """);
        Feature spaced = Feature.parse("""
                # comment
                Feature: f

                  Scenario: s

                    Given   a step
                      |  a  |  b  |
                """);
        assertEquals(compact, spaced);
        assertEquals(compact.hashCode(), spaced.hashCode());
        Feature other = Feature.parse("""
                Feature: f
                Scenario: s
                Given another step
                """);
        assertNotEquals(compact, other);
    }

    @Test
    void testEqualityIgnoresTagOrder() {
        Feature ab = Feature.parse("""
                @x @y
                Feature: f
                  @a @b
                  Scenario: s
                    Given a step
                  @c @d
                  Scenario Outline: o
                    Given <v>
                    @e @f
                    Examples:
                      | v |
                      | 1 |
                """);
        Feature ba = Feature.parse("""
                @y @x
                Feature: f
                  @b @a
                  Scenario: s
                    Given a step
                  @d
                  @c
                  Scenario Outline: o
                    Given <v>
                    @f @e
                    Examples:
                      | v |
                      | 1 |
                """);
        assertEquals(ab, ba);
        assertEquals(ab.hashCode(), ba.hashCode());
        assertEquals(ab.getScenarios(), ba.getScenarios());
        // the written order is kept
        assertEquals("b", ba.getSection(0).getScenario().getTags().get(0).getName());
        Feature other = Feature.parse("""
                Feature: f
                  @a @c
                  Scenario: s
                    Given a step
                """);
        assertNotEquals(Feature.parse("""
                Feature: f
                  @a @b
                  Scenario: s
                    Given a step
                """), other);
    }

    @Test
    void testReadFromResource() {
        Resource resource = Resource.text("Feature: in memory\nScenario: s\n", "mem/test.feature");
        Feature feature = Gherkin.parse(resource);
        assertSame(resource, feature.getResource());
        assertEquals("[test] in memory", feature.getNameForReport());
        logger.debug("feature: {}", feature);
    }

}
