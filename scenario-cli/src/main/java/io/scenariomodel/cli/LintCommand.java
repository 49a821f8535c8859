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

import io.scenariomodel.common.Resource;
import io.scenariomodel.common.ResourceNotFoundException;
import io.scenariomodel.gherkin.Feature;
import io.scenariomodel.gherkin.FeatureValidator;
import io.scenariomodel.gherkin.StructureError;
import io.scenariomodel.gherkin.Violation;
import io.scenariomodel.output.Console;
import io.scenariomodel.parser.ParserException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

/**
 * The 'lint' subcommand: parses and validates feature files.
 * <p>
 * Usage examples:
 * <pre>
 * # Check every feature under a directory
 * scenario lint src/test/resources/features
 *
 * # Also fail on warnings such as duplicate tags
 * scenario lint --strict login.feature
 * </pre>
 * Exit code 1 if any file has an error, or with --strict any violation.
 */
@Command(
        name = "lint",
        mixinStandardHelpOptions = true,
        description = "Parse and validate feature files"
)
public class LintCommand extends FeatureCommand {

    @Option(
            names = {"-s", "--strict"},
            arity = "0..1",
            fallbackValue = "true",
            description = "Fail on warnings too (default: from scenario-config.json or false)"
    )
    Boolean strict;

    // reported in the place of a violation kind when the file does not parse
    static final String SYNTAX_ERROR = "SYNTAX_ERROR";
    static final String STRUCTURE_ERROR = "STRUCTURE_ERROR";

    private int files;
    private int errors;
    private int warnings;

    @Override
    public Integer call() {
        if (!loadConfig()) {
            return 1;
        }
        List<Path> roots = resolvePaths();
        if (roots.isEmpty()) {
            printNoPaths("lint");
            return 0;
        }
        List<Path> featureFiles;
        try {
            featureFiles = findFeatureFiles(roots);
        } catch (ResourceNotFoundException e) {
            Console.error(e.getMessage());
            return 1;
        }
        for (Path file : featureFiles) {
            lint(toResource(file));
        }
        String summary = files + " file(s), " + errors + " error(s), " + warnings + " warning(s)";
        boolean failed = errors > 0 || (resolveStrict() && warnings > 0);
        Console.summary(summary, failed);
        return failed ? 1 : 0;
    }

    private void lint(Resource resource) {
        files++;
        Feature feature;
        try {
            feature = Feature.read(resource);
        } catch (ParserException e) {
            errors++;
            String kind = e instanceof StructureError ? STRUCTURE_ERROR : SYNTAX_ERROR;
            Console.error(resource.getPathForLog() + ":" + e.getLine(), kind, e.getDetail());
            return;
        }
        List<Violation> violations = FeatureValidator.validate(feature);
        logger.debug("{}: {} violation(s)", resource.getPathForLog(), violations.size());
        for (Violation violation : violations) {
            String location = resource.getPathForLog() + ":" + violation.getLine();
            String kind = violation.getKind().name();
            if (violation.isError()) {
                errors++;
                Console.error(location, kind, violation.getMessage());
            } else {
                warnings++;
                Console.warning(location, kind, violation.getMessage());
            }
        }
    }

    private boolean resolveStrict() {
        if (strict != null) {
            return strict;
        }
        return config != null && config.isStrict();
    }

    public int getErrors() {
        return errors;
    }

    public int getWarnings() {
        return warnings;
    }

}
