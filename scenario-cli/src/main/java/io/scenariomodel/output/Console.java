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
package io.scenariomodel.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.regex.Pattern;

/**
 * What the scenario commands print. Findings share one layout,
 * {@code error|warning <path>:<line> <KIND> <message>}, so that lint output
 * can be grepped the same way whatever produced it. Each printed line also goes
 * to the "scenario.console" logger at TRACE level, without colors.
 */
public final class Console {

    private static final Logger logger = LoggerFactory.getLogger("scenario.console");

    private static final Pattern ANSI = Pattern.compile("\u001B\\[[;\\d]*m");

    static final String RESET = "\u001B[0m";
    static final String BOLD = "\u001B[1m";
    static final String RED = "\u001B[91m";
    static final String GREEN = "\u001B[92m";
    static final String YELLOW = "\u001B[93m";
    static final String CYAN = "\u001B[36m";

    private static final String ERROR = "error";
    private static final String WARNING = "warning";

    // https://no-color.org
    private static boolean colors = System.getenv("NO_COLOR") == null && System.console() != null;
    private static PrintStream out = System.out;

    private Console() {
    }

    public static void setColorsEnabled(boolean enabled) {
        colors = enabled;
    }

    public static void setOutput(PrintStream output) {
        out = output;
    }

    public static PrintStream getOutput() {
        return out;
    }

    static String paint(String text, String... codes) {
        if (!colors) {
            return text;
        }
        return String.join("", codes) + text + RESET;
    }

    static String plain(String text) {
        return ANSI.matcher(text).replaceAll("");
    }

    /**
     * For counts and other details inside a line.
     */
    public static String highlight(String text) {
        return paint(text, CYAN);
    }

    // ========== Findings ==========

    public static void error(String location, String kind, String message) {
        finding(paint(ERROR, RED, BOLD), location, kind, message);
    }

    public static void warning(String location, String kind, String message) {
        finding(paint(WARNING, YELLOW), location, kind, message);
    }

    private static void finding(String level, String location, String kind, String message) {
        println(level + " " + location + " " + kind + " " + message);
    }

    /**
     * A problem with the command itself, such as a bad option or a missing file.
     */
    public static void error(String message) {
        println(paint(ERROR, RED, BOLD) + " " + message);
    }

    public static void warning(String message) {
        println(paint(WARNING, YELLOW) + " " + message);
    }

    // ========== Other lines ==========

    public static void notice(String text) {
        println(paint(text, YELLOW));
    }

    public static void info(String text) {
        println(paint(text, CYAN));
    }

    public static void summary(String text, boolean failed) {
        println(failed ? paint(text, RED, BOLD) : paint(text, GREEN));
    }

    public static void println(String text) {
        out.println(text);
        if (logger.isTraceEnabled()) {
            logger.trace(plain(text));
        }
    }

}
