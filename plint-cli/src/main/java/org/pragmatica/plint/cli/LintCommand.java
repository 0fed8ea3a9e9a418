package org.pragmatica.plint.cli;

import org.pragmatica.plint.lint.DiagnosticSeverity;
import org.pragmatica.plint.lint.LintConfig;
import org.pragmatica.plint.shared.PlintException;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Lint command: report every diagnostic at or above the minimum severity.
@Command(name = "lint",
description = "Check Perl files and print all diagnostics",
mixinStandardHelpOptions = true)
public class LintCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(paramLabel = "<path>",
    description = "Files or directories to lint",
    arity = "1..*")
    List<Path> paths;

    @Option(names = {"--config", "-c"},
    description = "Path to plint.toml (default: ./plint.toml when present)")
    Path configPath;

    @Option(names = {"--format", "-f"},
    description = "Output format: ${COMPLETION-CANDIDATES}",
    defaultValue = "TEXT")
    OutputFormat format;

    @Option(names = "--severity",
    description = "Minimum severity to report: ${COMPLETION-CANDIDATES}")
    DiagnosticSeverity minimumSeverity;

    @Option(names = "--theme",
    description = "Only run rules carrying this theme (repeatable)")
    List<String> themes;

    @Option(names = "--disable",
    description = "Disable a rule by id (repeatable)")
    List<String> disabledRules;

    @Option(names = {"--fail-on-warning", "-w"},
    description = "Treat warnings as errors")
    boolean failOnWarning;

    @Option(names = "--parallel",
    description = "Lint files concurrently")
    boolean parallel;

    @Override
    public Integer call() {
        var err = spec.commandLine()
                      .getErr();
        LintRun run;
        try {
            run = LintRun.run(Optional.ofNullable(configPath), this::applyOverrides, paths);
        } catch (PlintException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return ExitCode.FAILURE;
        }
        run.collectionErrors()
           .forEach(error -> err.println("Error: " + error.message()));
        err.flush();
        var out = spec.commandLine()
                      .getOut();
        out.println(DiagnosticFormatter.diagnosticFormatter(format)
                                       .format(run.reports(), run.summary()));
        out.flush();
        return run.exitCode();
    }

    LintConfig applyOverrides(LintConfig config) {
        var result = config;
        if (minimumSeverity != null) {
            result = result.withMinimumSeverity(minimumSeverity);
        }
        if (themes != null && !themes.isEmpty()) {
            result = result.withThemes(new HashSet<>(themes));
        }
        if (disabledRules != null) {
            for (var ruleId : disabledRules) {
                result = result.withDisabledRule(ruleId);
            }
        }
        if (failOnWarning) {
            result = result.withFailOnWarning(true);
        }
        if (parallel) {
            result = result.withParallel(true);
        }
        return result;
    }
}
