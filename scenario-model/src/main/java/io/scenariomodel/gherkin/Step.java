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

import java.util.Map;
import java.util.Objects;

public class Step {

    public static final String GIVEN = "Given";
    public static final String WHEN = "When";
    public static final String THEN = "Then";
    public static final String AND = "And";
    public static final String BUT = "But";
    public static final String STAR = "*";

    private final int line;
    private final int index;
    private final String keyword;
    private final String text;
    private final String docString;
    private final String docStringType;
    private final Table table;

    public Step(int index, String keyword, String text) {
        this(0, index, keyword, text, null, null, null);
    }

    public Step(int line, int index, String keyword, String text, String docString, String docStringType, Table table) {
        this.line = line;
        this.index = index;
        this.keyword = keyword;
        this.text = text;
        this.docString = docString;
        this.docStringType = docStringType;
        this.table = table;
    }

    /**
     * Substitutes outline placeholders in the text, the doc string and the table cells.
     */
    public Step replace(Map<String, String> values) {
        String newDocString = docString == null ? null : Placeholders.replace(docString, values);
        Table newTable = table == null ? null : table.map(cell -> Placeholders.replace(cell, values));
        return new Step(line, index, keyword, Placeholders.replace(text, values), newDocString, docStringType, newTable);
    }

    public boolean isConjunction() {
        return AND.equals(keyword) || BUT.equals(keyword) || STAR.equals(keyword);
    }

    public int getLine() {
        return line;
    }

    /**
     * @return position within the enclosing scenario, outline or background
     */
    public int getIndex() {
        return index;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getText() {
        return text;
    }

    public String getDocString() {
        return docString;
    }

    /**
     * @return the content type written after the opening doc string delimiter, e.g. "json"
     */
    public String getDocStringType() {
        return docStringType;
    }

    public Table getTable() {
        return table;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, keyword, text, docString, docStringType, table);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Step)) {
            return false;
        }
        Step other = (Step) obj;
        return index == other.index
                && Objects.equals(keyword, other.keyword)
                && Objects.equals(text, other.text)
                && Objects.equals(docString, other.docString)
                && Objects.equals(docStringType, other.docStringType)
                && Objects.equals(table, other.table);
    }

    @Override
    public String toString() {
        return keyword + " " + text;
    }

}
