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

import java.util.Objects;

/**
 * A problem found by {@link FeatureValidator}, reported rather than thrown.
 */
public class Violation {

    public enum Kind {

        EMPTY_STEPS(false),
        DUPLICATE_TAG(false),
        EMPTY_EXAMPLES(false),
        MISSING_EXAMPLES(true),
        UNMATCHED_PLACEHOLDER(true),
        DUPLICATE_COLUMN(true),
        ROW_WIDTH(true);

        /**
         * True for kinds that the parser would have refused.
         */
        public final boolean error;

        Kind(boolean error) {
            this.error = error;
        }

    }

    private final Kind kind;
    private final int sectionIndex;
    private final int stepIndex;
    private final int line;
    private final String message;

    public Violation(Kind kind, int sectionIndex, int stepIndex, int line, String message) {
        this.kind = kind;
        this.sectionIndex = sectionIndex;
        this.stepIndex = stepIndex;
        this.line = line;
        this.message = message;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isError() {
        return kind.error;
    }

    /**
     * @return zero-based section index, -1 for the feature or its background
     */
    public int getSectionIndex() {
        return sectionIndex;
    }

    /**
     * @return zero-based step index, -1 when the violation is not about a step
     */
    public int getStepIndex() {
        return stepIndex;
    }

    public int getLine() {
        return line;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, sectionIndex, stepIndex, line, message);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Violation)) {
            return false;
        }
        Violation other = (Violation) obj;
        return kind == other.kind
                && sectionIndex == other.sectionIndex
                && stepIndex == other.stepIndex
                && line == other.line
                && Objects.equals(message, other.message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(line).append("] ").append(kind);
        if (sectionIndex != -1) {
            sb.append(" section ").append(sectionIndex + 1);
        }
        if (stepIndex != -1) {
            sb.append(" step ").append(stepIndex + 1);
        }
        return sb.append(": ").append(message).toString();
    }

}
