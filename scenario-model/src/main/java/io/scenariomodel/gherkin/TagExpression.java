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

import io.scenariomodel.common.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Boolean expression over tags, used to select scenarios.
 * <p>
 * Grammar, lowest precedence first:
 * <pre>
 * or    := and ( ("or" | "||") and )*
 * and   := unary ( ("and" | "&amp;&amp;") unary )*
 * unary := ("not" | "!" | "~") unary | "(" or ")" | tag
 * </pre>
 * Keywords are case-insensitive, tags are compared with the leading '@'.
 * <ul>
 *   <li>"@smoke"</li>
 *   <li>"@smoke and not @regression"</li>
 *   <li>"(@login || @cart) &amp;&amp; !@wip"</li>
 * </ul>
 */
public abstract class TagExpression {

    /**
     * Matches everything, what a null or blank expression parses to.
     */
    public static final TagExpression ANY = new TagExpression() {
        @Override
        public boolean evaluate(Set<String> tags) {
            return true;
        }

        @Override
        public String toString() {
            return "true";
        }
    };

    /**
     * @param tags tag texts with the leading '@'
     */
    public abstract boolean evaluate(Set<String> tags);

    public boolean evaluate(Collection<Tag> tags) {
        Set<String> set = new HashSet<>(tags.size());
        for (Tag tag : tags) {
            set.add(tag.toString());
        }
        return evaluate(set);
    }

    public static TagExpression parse(String expression) {
        if (StringUtils.isBlank(expression)) {
            return ANY;
        }
        return new ExpressionParser(expression).parse();
    }

    static class Literal extends TagExpression {

        final String tag;

        Literal(String tag) {
            this.tag = tag.charAt(0) == '@' ? tag : '@' + tag;
        }

        @Override
        public boolean evaluate(Set<String> tags) {
            return tags.contains(tag);
        }

        @Override
        public String toString() {
            return tag;
        }

    }

    static class Not extends TagExpression {

        final TagExpression operand;

        Not(TagExpression operand) {
            this.operand = operand;
        }

        @Override
        public boolean evaluate(Set<String> tags) {
            return !operand.evaluate(tags);
        }

        @Override
        public String toString() {
            return "not " + operand;
        }

    }

    static class And extends TagExpression {

        final TagExpression left;
        final TagExpression right;

        And(TagExpression left, TagExpression right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public boolean evaluate(Set<String> tags) {
            return left.evaluate(tags) && right.evaluate(tags);
        }

        @Override
        public String toString() {
            return "(" + left + " and " + right + ")";
        }

    }

    static class Or extends TagExpression {

        final TagExpression left;
        final TagExpression right;

        Or(TagExpression left, TagExpression right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public boolean evaluate(Set<String> tags) {
            return left.evaluate(tags) || right.evaluate(tags);
        }

        @Override
        public String toString() {
            return "(" + left + " or " + right + ")";
        }

    }

    private static class ExpressionParser {

        private final String expression;
        private final List<String> tokens = new ArrayList<>();
        private final List<Integer> offsets = new ArrayList<>();
        private int position;

        ExpressionParser(String expression) {
            this.expression = expression;
            tokenize();
        }

        private void tokenize() {
            int i = 0;
            int length = expression.length();
            while (i < length) {
                char c = expression.charAt(i);
                if (Character.isWhitespace(c)) {
                    i++;
                } else if (c == '(' || c == ')' || c == '!' || c == '~') {
                    add(String.valueOf(c), i);
                    i++;
                } else if ((c == '&' || c == '|') && i + 1 < length && expression.charAt(i + 1) == c) {
                    add(expression.substring(i, i + 2), i);
                    i += 2;
                } else {
                    int start = i;
                    while (i < length && !Character.isWhitespace(expression.charAt(i))
                            && "()!~".indexOf(expression.charAt(i)) == -1
                            && !expression.startsWith("&&", i) && !expression.startsWith("||", i)) {
                        i++;
                    }
                    add(expression.substring(start, i), start);
                }
            }
        }

        private void add(String token, int offset) {
            tokens.add(token);
            offsets.add(offset);
        }

        TagExpression parse() {
            TagExpression result = or();
            if (position < tokens.size()) {
                throw error("unexpected '" + tokens.get(position) + "'");
            }
            return result;
        }

        private TagExpression or() {
            TagExpression left = and();
            while (consumeIf("or", "||")) {
                left = new Or(left, and());
            }
            return left;
        }

        private TagExpression and() {
            TagExpression left = unary();
            while (consumeIf("and", "&&")) {
                left = new And(left, unary());
            }
            return left;
        }

        private TagExpression unary() {
            if (consumeIf("not", "!", "~")) {
                return new Not(unary());
            }
            if (consumeIf("(")) {
                TagExpression inner = or();
                if (!consumeIf(")")) {
                    throw error("expected ')'");
                }
                return inner;
            }
            if (position >= tokens.size()) {
                throw error("expected a tag");
            }
            String token = tokens.get(position);
            if (token.charAt(0) != '@' || token.length() == 1) {
                throw error("expected a tag starting with '@' but found '" + token + "'");
            }
            position++;
            return new Literal(token);
        }

        private boolean consumeIf(String... candidates) {
            if (position >= tokens.size()) {
                return false;
            }
            String token = tokens.get(position);
            for (String candidate : candidates) {
                if (candidate.equalsIgnoreCase(token)) {
                    position++;
                    return true;
                }
            }
            return false;
        }

        private IllegalArgumentException error(String message) {
            int offset = position < offsets.size() ? offsets.get(position) + 1 : expression.length() + 1;
            return new IllegalArgumentException("invalid tag expression at position " + offset
                    + ": " + message + " in: " + expression);
        }

    }

}
