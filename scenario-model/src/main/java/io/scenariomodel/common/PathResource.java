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
package io.scenariomodel.common;

import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

public class PathResource implements Resource {

    private final Path path;
    private final Path root;
    private final boolean classPath;

    private String text;
    private String[] lines;

    PathResource(Path path) {
        this(path, FileUtils.WORKING_DIR.toPath(), false);
    }

    PathResource(Path path, Path root, boolean classPath) {
        this.path = path;
        this.root = root == null ? FileUtils.WORKING_DIR.toPath() : root;
        this.classPath = classPath;
    }

    @Override
    public boolean isFile() {
        return true;
    }

    @Override
    public boolean isClassPath() {
        return classPath;
    }

    @Override
    public URI getUri() {
        return path.toUri();
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public InputStream getStream() {
        try {
            return Files.newInputStream(path);
        } catch (Exception e) {
            throw new RuntimeException("failed to open: " + path, e);
        }
    }

    @Override
    public String getRelativePath() {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path normalizedThis = path.toAbsolutePath().normalize();
        if (normalizedThis.startsWith(normalizedRoot)) {
            return normalizedRoot.relativize(normalizedThis).toString().replace('\\', '/');
        }
        return normalizedThis.toString().replace('\\', '/');
    }

    @Override
    public String getText() {
        if (text == null) {
            try {
                text = FileUtils.toString(Files.readAllBytes(path));
            } catch (Exception e) {
                throw new RuntimeException("failed to read: " + path, e);
            }
        }
        return text;
    }

    @Override
    public String getLine(int index) {
        if (lines == null) {
            lines = getText().split("\\r?\\n");
        }
        if (index < 0 || index >= lines.length) {
            return "";
        }
        return lines[index];
    }

    @Override
    public String toString() {
        return getPathForLog();
    }

}
