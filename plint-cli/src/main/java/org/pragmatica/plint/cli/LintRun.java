package org.pragmatica.plint.cli;

import org.pragmatica.plint.config.ConfigLoader;
import org.pragmatica.plint.config.PlintConfig;
import org.pragmatica.plint.lint.FileReport;
import org.pragmatica.plint.lint.LintConfig;
import org.pragmatica.plint.lint.LintSummary;
import org.pragmatica.plint.lint.Linter;
import org.pragmatica.plint.shared.FileCollector;
import org.pragmatica.plint.shared.PlintError;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Shared pipeline behind `lint` and `check`: load config, apply overrides, collect, lint, summarize.
final class LintRun {
    private static final Logger log = LoggerFactory.getLogger(LintRun.class);

    private final PlintConfig config;
    private final List<FileReport> reports;
    private final List<PlintError> collectionErrors;

    private LintRun(PlintConfig config, List<FileReport> reports, List<PlintError> collectionErrors) {
        this.config = config;
        this.reports = reports;
        this.collectionErrors = collectionErrors;
    }

    /// Throws [org.pragmatica.plint.shared.PlintException] when the configuration cannot be loaded.
    static LintRun run(Optional<Path> configPath, UnaryOperator<LintConfig> overrides, List<Path> paths) {
        var loaded = ConfigLoader.loadOrDefault(configPath);
        var config = loaded.withLint(overrides.apply(loaded.lint()));
        var errors = new ArrayList<PlintError>();
        var files = FileCollector.collectPerlFiles(paths, errors::add);
        log.debug("Linting {} file(s)", files.size());
        var reports = Linter.linter(config.toContext())
                            .lintFiles(files);
        return new LintRun(config, reports, List.copyOf(errors));
    }

    List<FileReport> reports() {
        return reports;
    }

    List<PlintError> collectionErrors() {
        return collectionErrors;
    }

    boolean failOnWarning() {
        return config.lint()
                     .failOnWarning();
    }

    LintSummary summary() {
        return LintSummary.summarize(reports);
    }

    int exitCode() {
        var summary = summary();
        if (!collectionErrors.isEmpty() || summary.failures() > 0) {
            return ExitCode.FAILURE;
        }
        return summary.hasFailures(failOnWarning())
               ? ExitCode.VIOLATIONS
               : ExitCode.CLEAN;
    }
}
