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
package io.scenariomodel.parser;

import io.scenariomodel.common.Resource;

/**
 * Base class of the errors raised while parsing a document. Carries the
 * resource and the 1-based line and column where the problem was found.
 */
public class ParserException extends RuntimeException {

    private final transient Resource resource;
    private final int line;
    private final int column;
    private final String detail;

    public ParserException(Resource resource, int line, int column, String detail) {
        super(format(resource, line, column, detail));
        this.resource = resource;
        this.line = line;
        this.column = column;
        this.detail = detail;
    }

    public ParserException(Token token, String detail) {
        this(token.resource, token.line + 1, token.col + 1, detail);
    }

    private static String format(Resource resource, int line, int column, String detail) {
        String path = resource == null ? "(inline)" : resource.getPathForLog();
        return path + ":" + line + ":" + column + " " + detail;
    }

    public Resource getResource() {
        return resource;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * @return the message without the location prefix
     */
    public String getDetail() {
        return detail;
    }

}
