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

public class Token {

    public final Resource resource;
    public final TokenType type;
    public final int pos;
    // zero-based
    public final int line;
    public final int col;
    public final String text;

    public Token(Resource resource, TokenType type, int pos, int line, int col, String text) {
        this.resource = resource;
        this.type = type;
        this.pos = pos;
        this.line = line;
        this.col = col;
        this.text = text;
    }

    public String getLineText() {
        return resource.getLine(line);
    }

    public String getPositionDisplay() {
        return (line + 1) + ":" + (col + 1);
    }

    @Override
    public String toString() {
        return switch (type) {
            case WS -> "_";
            case WS_LF -> "_\\n_";
            case EOF -> "_EOF_";
            default -> text;
        };
    }

}
