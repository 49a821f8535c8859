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
import io.scenariomodel.common.ResourceNotFoundException;
import io.scenariomodel.gherkin.Feature;
import io.scenariomodel.gherkin.FeatureJson;
import io.scenariomodel.output.Console;
import io.scenariomodel.parser.ParserException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The 'export' subcommand: writes the JSON view of one feature, with outlines
 * expanded, for tools outside the JVM.
 * <p>
 * Usage examples:
 * <pre>
 * scenario export login.feature
 * scenario export login.feature -o target/login.json
 * </pre>
 */
@Command(
        name = "export",
        mixinStandardHelpOptions = true,
        description = "Write the JSON view of a feature file"
)
public class ExportCommand extends FeatureCommand {

    @Option(
            names = {"-o", "--output"},
            description = "File to write (default: standard output)"
    )
    String outputFile;

    @Override
    public Integer call() {
        if (!loadConfig()) {
            return 1;
        }
        List<Path> roots = resolvePaths();
        if (roots.isEmpty()) {
            printNoPaths("export");
            return 0;
        }
        try {
            List<Path> files = findFeatureFiles(roots);
            if (files.size() != 1) {
                Console.error("export needs exactly one feature file, found " + files.size());
                return 1;
            }
            Feature feature = Feature.read(toResource(files.get(0)));
            String json = FeatureJson.toJson(feature);
            if (outputFile == null) {
                Console.println(json);
            } else {
                Path output = Path.of(outputFile);
                FileUtils.writeToFile(output, json);
                Console.info("written: " + output);
            }
            return 0;
        } catch (ResourceNotFoundException | ParserException | UncheckedIOException e) {
            Console.error(e.getMessage());
            return 1;
        }
    }

    public String getOutputFile() {
        return outputFile;
    }

}
