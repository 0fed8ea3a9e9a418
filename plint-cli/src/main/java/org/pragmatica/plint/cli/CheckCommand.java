package org.pragmatica.plint.cli;

import org.pragmatica.plint.lint.DiagnosticSeverity;
import org.pragmatica.plint.lint.FileReport;
import org.pragmatica.plint.shared.PlintException;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Check command - lint for CI.
 * Warnings fail the run; only failing diagnostics and the summary are printed.
 */
@Command(
        name = "check",
        description = "Lint for CI: warnings fail the run",
        mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(
            paramLabel = "<path>",
            description = "Files or directories to check",
            arity = "1..*"
    )
    List<Path> paths;

    @Option(
            names = {"--config", "-c"},
            description = "Path to plint.toml (default: ./plint.toml when present)"
    )
    Path configPath;

    @Override
    public Integer call() {
        var err = spec.commandLine().getErr();
        LintRun run;
        try {
            run = LintRun.run(Optional.ofNullable(configPath), config -> config.withFailOnWarning(true), paths);
        } catch (PlintException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return ExitCode.FAILURE;
        }
        run.collectionErrors().forEach(error -> err.println("Error: " + error.message()));
        err.flush();

        var out = spec.commandLine().getOut();
        var failing = run.reports().stream()
                         .map(CheckCommand::failingOnly)
                         .toList();
        out.println(DiagnosticFormatter.diagnosticFormatter(OutputFormat.TEXT).format(failing, run.summary()));
        out.flush();
        return run.exitCode();
    }

    private static FileReport failingOnly(FileReport report) {
        if (report.failed()) {
            return report;
        }
        return FileReport.fileReport(report.path(),
                                     report.diagnostics().stream()
                                           .filter(diagnostic -> diagnostic.severity()
                                                                           .isAtLeast(DiagnosticSeverity.WARNING))
                                           .toList());
    }
}
