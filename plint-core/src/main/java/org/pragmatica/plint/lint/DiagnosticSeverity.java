package org.pragmatica.plint.lint;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/// Severity of a diagnostic, ordered from least to most severe.
public enum DiagnosticSeverity {
    INFO,
    WARNING,
    ERROR;

    public boolean isAtLeast(DiagnosticSeverity other) {
        return compareTo(other) >= 0;
    }

    /// Case-insensitive lookup by name, e.g. `"warning"`.
    public static Optional<DiagnosticSeverity> severity(String name) {
        var normalized = name.trim()
                             .toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                     .filter(value -> value.name()
                                           .equals(normalized))
                     .findFirst();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
