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
import java.util.Map;
import java.util.Objects;

public class ExamplesTable {

    public static final String KEYWORD = "Examples";

    private final int line;
    private final String name;
    private final String description;
    private final List<Tag> tags;
    private final Table table;

    public ExamplesTable(List<Tag> tags, Table table) {
        this(0, null, null, tags, table);
    }

    public ExamplesTable(int line, String name, String description, List<Tag> tags, Table table) {
        this.line = line;
        this.name = name;
        this.description = description;
        this.tags = tags == null ? Collections.emptyList() : List.copyOf(tags);
        this.table = table;
    }

    public List<String> getColumns() {
        return table == null ? Collections.emptyList() : table.getHeader();
    }

    /**
     * @return the data rows (header excluded) keyed by column name
     */
    public List<Map<String, String>> getRows() {
        return table == null ? Collections.emptyList() : table.getRowsAsMaps();
    }

    public int getRowCount() {
        return table == null ? 0 : Math.max(0, table.getRowCount() - 1);
    }

    public int getLine() {
        return line;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<Tag> getTags() {
        return tags;
    }

    public Table getTable() {
        return table;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, Tag.asSet(tags), table);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ExamplesTable)) {
            return false;
        }
        ExamplesTable other = (ExamplesTable) obj;
        return Objects.equals(name, other.name)
                && Objects.equals(description, other.description)
                && Tag.asSet(tags).equals(Tag.asSet(other.tags))
                && Objects.equals(table, other.table);
    }

}
