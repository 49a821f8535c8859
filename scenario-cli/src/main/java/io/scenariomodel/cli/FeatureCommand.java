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

import io.scenariomodel.common.FileUtils;
import io.scenariomodel.common.Resource;
import io.scenariomodel.output.Console;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Options shared by the subcommands that work on feature files: the paths
 * to scan and where to find scenario-config.json when no path is given.
 */
public abstract class FeatureCommand implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(FeatureCommand.class);

    @Parameters(
            description = "Feature files or directories (default: 'paths' from scenario-config.json)",
            arity = "0..*"
    )
    List<String> paths;

    @Option(
            names = {"-c", "--config"},
            description = "Path to config file (default: scenario-config.json)"
    )
    String configFile;

    @Option(
            names = {"--no-config"},
            description = "Ignore scenario-config.json even if present"
    )
    boolean noConfig;

    // null when there is no config file or it was ignored
    protected ScenarioConfig config;

    /**
     * @return false if an explicitly requested config file could not be loaded
     */
    protected boolean loadConfig() {
        if (noConfig) {
            return true;
        }
        Path configPath = Path.of(configFile != null ? configFile : ScenarioConfig.DEFAULT_FILE);
        if (!Files.exists(configPath)) {
            if (configFile != null) {
                Console.error("config file not found: " + configPath);
                return false;
            }
            return true;
        }
        try {
            config = ScenarioConfig.load(configPath);
            logger.debug("loaded config: {}", configPath);
            return true;
        } catch (Exception e) {
            String reason = e.getCause() == null ? e.getMessage() : e.getCause().getMessage();
            if (configFile != null) {
                Console.error("failed to load " + configPath + ": " + reason);
                return false;
            }
            Console.warning("ignoring " + configPath + ": " + reason);
            return true;
        }
    }

    /**
     * @return the paths given on the command line, else the ones from the config file, else empty
     */
    protected List<Path> resolvePaths() {
        List<Path> list = new ArrayList<>();
        if (paths != null && !paths.isEmpty()) {
            for (String path : paths) {
                list.add(Path.of(path));
            }
        } else if (config != null) {
            list.addAll(config.resolvePaths());
        }
        return list;
    }

    /**
     * Walks every path for feature files, in a stable order.
     *
     * @throws io.scenariomodel.common.ResourceNotFoundException if a path does not exist
     */
    protected List<Path> findFeatureFiles(List<Path> roots) {
        List<Path> files = new ArrayList<>();
        for (Path root : roots) {
            List<Path> found = FileUtils.findFeatureFiles(root);
            logger.debug("found {} feature file(s) under {}", found.size(), root);
            files.addAll(found);
        }
        return files;
    }

    protected static Resource toResource(Path file) {
        return Resource.from(file);
    }

    protected void printNoPaths(String command) {
        Console.notice("No feature paths specified.");
        Console.println("Usage: scenario " + command + " [options] <paths...>");
        Console.println("       scenario " + command + " -c " + ScenarioConfig.DEFAULT_FILE);
        Console.println("Run 'scenario " + command + " --help' for more information.");
    }

    public List<String> getPaths() {
        return paths;
    }

    public String getConfigFile() {
        return configFile;
    }

    public ScenarioConfig getConfig() {
        return config;
    }

}
