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
package io.scenariomodel;

import io.scenariomodel.cli.ExportCommand;
import io.scenariomodel.cli.LintCommand;
import io.scenariomodel.cli.ListCommand;
import io.scenariomodel.cli.ScenarioConfig;
import io.scenariomodel.output.Console;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Main entry point for the scenario command line.
 * <p>
 * When invoked without a subcommand, lints the paths of
 * {@code scenario-config.json} if that file is in the current directory.
 */
@Command(
        name = "scenario",
        mixinStandardHelpOptions = true,
        versionProvider = Main.VersionProvider.class,
        description = "Parse, validate and query Gherkin feature files",
        subcommands = {
                LintCommand.class,
                ListCommand.class,
                ExportCommand.class
        }
)
public class Main implements Callable<Integer> {

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = Main.class.getPackage().getImplementationVersion();
            return new String[]{"scenario " + (version == null ? "(development)" : version)};
        }
    }

    @Option(
            names = {"--no-color"},
            scope = CommandLine.ScopeType.INHERIT,
            description = "Disable colored output"
    )
    boolean noColor;

    public static void main(String[] args) {
        // before any subcommand prints
        for (String arg : args) {
            if ("--no-color".equals(arg)) {
                Console.setColorsEnabled(false);
                break;
            }
        }
        System.exit(execute(args));
    }

    public static int execute(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    @Override
    public Integer call() {
        if (noColor) {
            Console.setColorsEnabled(false);
        }
        if (Files.exists(Path.of(ScenarioConfig.DEFAULT_FILE))) {
            return new LintCommand().call();
        }
        CommandLine.usage(this, Console.getOutput(), noColor ? CommandLine.Help.Ansi.OFF : CommandLine.Help.Ansi.AUTO);
        return 0;
    }

}
