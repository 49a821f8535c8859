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
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Source text of a feature document, either on the file system, on the classpath or in memory.
 */
public interface Resource {

    String CLASSPATH_COLON = "classpath:";
    String FILE_COLON = "file:";

    boolean isFile();

    boolean isClassPath();

    URI getUri();

    /**
     * @return the file system path, or null for in-memory resources
     */
    Path getPath();

    InputStream getStream();

    /**
     * @return path with forward slashes, relative to the root the resource was resolved against
     */
    String getRelativePath();

    String getText();

    /**
     * @param index zero-based line index
     * @return the line text, or an empty string if out of range
     */
    String getLine(int index);

    default String getFileNameWithoutExtension() {
        String path = getRelativePath();
        int slash = path.lastIndexOf('/');
        if (slash != -1) {
            path = path.substring(slash + 1);
        }
        int pos = path.lastIndexOf('.');
        return pos == -1 ? path : path.substring(0, pos);
    }

    default String getPrefixedPath() {
        return isClassPath() ? CLASSPATH_COLON + getRelativePath() : getRelativePath();
    }

    default String getPathForLog() {
        String path = getPrefixedPath();
        return path.isEmpty() ? "(inline)" : path;
    }

    static String removePrefix(String text) {
        if (text.startsWith(CLASSPATH_COLON) || text.startsWith(FILE_COLON)) {
            return text.substring(text.indexOf(':') + 1);
        } else {
            return text;
        }
    }

    static Resource text(String text) {
        return new MemoryResource(text);
    }

    static Resource text(String text, String relativePath) {
        return new MemoryResource(text, relativePath);
    }

    static Resource from(Path path) {
        return new PathResource(path);
    }

    static Resource from(Path path, Path root) {
        return new PathResource(path, root, false);
    }

    /**
     * Creates a resource from a path string, supporting the "classpath:" and "file:" prefixes.
     */
    static Resource path(String path) {
        if (path == null) {
            path = "";
        }
        if (path.startsWith(CLASSPATH_COLON)) {
            String relativePath = removePrefix(path);
            if (relativePath.startsWith("/")) {
                relativePath = relativePath.substring(1);
            }
            URL url = null;
            ClassLoader contextCL = Thread.currentThread().getContextClassLoader();
            if (contextCL != null) {
                url = contextCL.getResource(relativePath);
            }
            if (url == null) {
                url = ClassLoader.getSystemResource(relativePath);
            }
            if (url == null) {
                throw new ResourceNotFoundException(path);
            }
            if (!"file".equals(url.getProtocol())) {
                // inside a jar, read eagerly instead of mounting a file system
                try (InputStream is = url.openStream()) {
                    return new MemoryResource(FileUtils.toString(is), relativePath, true);
                } catch (Exception e) {
                    throw new RuntimeException("failed to read classpath resource: " + path, e);
                }
            }
            try {
                Path resourcePath = Path.of(url.toURI());
                return new PathResource(resourcePath, resolveClassPathRoot(resourcePath, relativePath), true);
            } catch (Exception e) {
                throw new RuntimeException("failed to create resource from classpath: " + path, e);
            }
        }
        Path file = Path.of(removePrefix(path));
        if (!Files.exists(file)) {
            throw new ResourceNotFoundException(path);
        }
        return new PathResource(file);
    }

    private static Path resolveClassPathRoot(Path resourcePath, String relativePath) {
        Path root = resourcePath;
        int depth = relativePath.split("/").length;
        for (int i = 0; i < depth && root != null; i++) {
            root = root.getParent();
        }
        return root == null ? FileUtils.WORKING_DIR.toPath() : root;
    }

}
