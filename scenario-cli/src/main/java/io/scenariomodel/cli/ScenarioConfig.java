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
package io.scenariomodel.cli;

import net.minidev.json.JSONValue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Project settings loaded from scenario-config.json. Command line options
 * override these values.
 * <p>
 * Example scenario-config.json:
 * <pre>
 * {
 *   "paths": ["src/test/resources/features"],
 *   "tags": "@smoke and not @wip",
 *   "expand": true,
 *   "strict": false
 * }
 * </pre>
 * "tags" may also be a list, the entries must all match. Relative paths are
 * resolved against the directory holding the file.
 */
public class ScenarioConfig {

    public static final String DEFAULT_FILE = "scenario-config.json";

    private List<String> paths = new ArrayList<>();
    private String tags;
    private boolean expand = true;
    private boolean strict;
    private Path baseDir;

    public static ScenarioConfig load(String configPath) {
        return load(Path.of(configPath));
    }

    /**
     * @throws RuntimeException if the file cannot be read or is not a valid config
     */
    public static ScenarioConfig load(Path configPath) {
        try {
            String content = Files.readString(configPath);
            ScenarioConfig config = parse(content);
            config.setBaseDir(configPath.toAbsolutePath().getParent());
            return config;
        } catch (Exception e) {
            throw new RuntimeException("failed to load config from: " + configPath, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static ScenarioConfig parse(String json) {
        Object parsed;
        try {
            parsed = JSONValue.parseWithException(json);
        } catch (Exception e) {
            throw new RuntimeException("invalid config: " + e.getMessage(), e);
        }
        if (!(parsed instanceof Map)) {
            throw new RuntimeException("invalid config: expected JSON object");
        }
        Map<String, Object> map = (Map<String, Object>) parsed;
        ScenarioConfig config = new ScenarioConfig();
        Object paths = map.get("paths");
        if (paths instanceof String) {
            config.setPaths(Collections.singletonList((String) paths));
        } else if (paths instanceof List) {
            config.setPaths(toStrings((List<Object>) paths, "paths"));
        } else if (paths != null) {
            throw new RuntimeException("invalid config: 'paths' must be a string or a list");
        }
        Object tags = map.get("tags");
        if (tags instanceof String) {
            config.setTags((String) tags);
        } else if (tags instanceof List) {
            config.setTags(allOf(toStrings((List<Object>) tags, "tags")));
        } else if (tags != null) {
            throw new RuntimeException("invalid config: 'tags' must be a string or a list");
        }
        config.setExpand(toBoolean(map.get("expand"), "expand", true));
        config.setStrict(toBoolean(map.get("strict"), "strict", false));
        return config;
    }

    private static List<String> toStrings(List<Object> list, String name) {
        List<String> result = new ArrayList<>(list.size());
        for (Object o : list) {
            if (!(o instanceof String)) {
                throw new RuntimeException("invalid config: '" + name + "' must only contain strings");
            }
            result.add((String) o);
        }
        return result;
    }

    private static boolean toBoolean(Object value, String name, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean)) {
            throw new RuntimeException("invalid config: '" + name + "' must be true or false");
        }
        return (Boolean) value;
    }

    private static String allOf(List<String> expressions) {
        if (expressions.isEmpty()) {
            return null;
        }
        if (expressions.size() == 1) {
            return expressions.get(0);
        }
        StringBuilder sb = new StringBuilder();
        for (String expression : expressions) {
            if (sb.length() > 0) {
                sb.append(" and ");
            }
            sb.append('(').append(expression).append(')');
        }
        return sb.toString();
    }

    /**
     * @return the configured paths, resolved against the directory of the config file
     */
    public List<Path> resolvePaths() {
        List<Path> list = new ArrayList<>(paths.size());
        for (String path : paths) {
            Path p = Path.of(path);
            list.add(baseDir == null || p.isAbsolute() ? p : baseDir.resolve(p));
        }
        return list;
    }

    public List<String> getPaths() {
        return paths;
    }

    public void setPaths(List<String> paths) {
        this.paths = paths;
    }

    public String getTags() {
        return tags;
    }

    public void setTags(String tags) {
        this.tags = tags;
    }

    public boolean isExpand() {
        return expand;
    }

    public void setExpand(boolean expand) {
        this.expand = expand;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(Path baseDir) {
        this.baseDir = baseDir;
    }

}
