package org.pragmatica.plint.lint;

import org.pragmatica.plint.shared.PlintError;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/// Outcome of linting one file: its diagnostics, or the error that prevented linting it.
public record FileReport(Path path, List<Diagnostic> diagnostics, Optional<PlintError> error) {
    public FileReport {
        diagnostics = List.copyOf(diagnostics);
    }

    public static FileReport fileReport(Path path, List<Diagnostic> diagnostics) {
        return new FileReport(path, diagnostics, Optional.empty());
    }

    public static FileReport failed(Path path, PlintError error) {
        return new FileReport(path, List.of(), Optional.of(error));
    }

    public boolean failed() {
        return error.isPresent();
    }
}
