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

import java.util.List;

import static io.scenariomodel.parser.TokenType.*;

/**
 * Recursive-descent helper over a list of primary tokens. Fails fast: the
 * first error is thrown as a {@link SyntaxError}.
 */
public abstract class BaseParser {

    protected final Resource resource;
    protected final List<Token> tokens;
    private final int size;

    private int position = 0;

    protected BaseParser(Resource resource, List<Token> tokens) {
        this.resource = resource;
        this.tokens = tokens;
        this.size = tokens.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int start = Math.max(0, position - 5);
        int end = Math.min(position + 5, size);
        for (int i = start; i < end; i++) {
            if (i == position) {
                sb.append(">>");
            }
            sb.append(tokens.get(i));
            sb.append(' ');
        }
        if (position == size) {
            sb.append(">>");
        }
        return sb.toString();
    }

    protected SyntaxError error(String message) {
        return error(peekToken(), message);
    }

    protected SyntaxError error(Token token, String message) {
        return new SyntaxError(token, message);
    }

    protected TokenType peek() {
        return peekToken().type;
    }

    protected Token peekToken() {
        // the lexer always terminates the list with EOF
        return position < size ? tokens.get(position) : tokens.get(size - 1);
    }

    /**
     * @return the type of the first token after any run of the given type, without consuming anything
     */
    protected TokenType peekPast(TokenType skip) {
        int i = position;
        while (i < size && tokens.get(i).type == skip) {
            i++;
        }
        return i < size ? tokens.get(i).type : EOF;
    }

    protected boolean peekIf(TokenType token) {
        return peek() == token;
    }

    /**
     * @return true if the next token is of the given type and sits on the given (zero-based) line
     */
    protected boolean peekOnLine(TokenType token, int line) {
        Token next = peekToken();
        return next.type == token && next.line == line;
    }

    protected Token next() {
        Token token = peekToken();
        if (position < size) {
            position++;
        }
        return token;
    }

}
