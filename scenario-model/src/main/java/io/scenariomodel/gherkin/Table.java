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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Pipe-delimited rows of text cells. For an Examples table the first row is
 * the header, for a step data table every row is data.
 */
public class Table {

    private final List<List<String>> rows;
    private final List<Integer> lineNumbers;

    public Table(List<List<String>> rows) {
        this(rows, null);
    }

    public Table(List<List<String>> rows, List<Integer> lineNumbers) {
        List<List<String>> temp = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            temp.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(temp);
        if (lineNumbers == null) {
            this.lineNumbers = Collections.nCopies(rows.size(), 0);
        } else {
            this.lineNumbers = Collections.unmodifiableList(new ArrayList<>(lineNumbers));
        }
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    /**
     * @return the cell count of the first row
     */
    public int getColumnCount() {
        return rows.isEmpty() ? 0 : rows.get(0).size();
    }

    public List<String> getHeader() {
        return rows.isEmpty() ? Collections.emptyList() : rows.get(0);
    }

    /**
     * @param rowIndex zero-based, the header is row 0
     * @return the 1-based source line, 0 if unknown
     */
    public int getLineNumberForRow(int rowIndex) {
        return lineNumbers.get(rowIndex);
    }

    /**
     * Uses the first row as the header and maps every other row by column name,
     * keeping the column order. Missing trailing cells are left out of the map.
     */
    public List<Map<String, String>> getRowsAsMaps() {
        List<String> header = getHeader();
        List<Map<String, String>> list = new ArrayList<>(Math.max(0, rows.size() - 1));
        for (int i = 1; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            Map<String, String> map = new LinkedHashMap<>(header.size());
            for (int j = 0; j < header.size() && j < row.size(); j++) {
                map.put(header.get(j), row.get(j));
            }
            list.add(Collections.unmodifiableMap(map));
        }
        return list;
    }

    /**
     * @return a new table with the function applied to every cell
     */
    public Table map(UnaryOperator<String> fn) {
        List<List<String>> temp = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> cells = new ArrayList<>(row.size());
            for (String cell : row) {
                cells.add(fn.apply(cell));
            }
            temp.add(cells);
        }
        return new Table(temp, lineNumbers);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Table)) {
            return false;
        }
        return rows.equals(((Table) obj).rows);
    }

    @Override
    public String toString() {
        return rows.toString();
    }

}
