package org.pragmatica.plint.lint;

import java.util.Optional;

/// A single finding reported by a lint rule.
///
/// @param ruleId   rule that produced the finding
/// @param severity effective severity after configuration overrides
/// @param file     file name as given to the linter
/// @param line     1-based line
/// @param column   1-based column
/// @param message  what is wrong
/// @param detail   why it matters
/// @param example  optional before/after snippet
public record Diagnostic(String ruleId,
                         DiagnosticSeverity severity,
                         String file,
                         int line,
                         int column,
                         String message,
                         String detail,
                         Optional<String> example) {
    public static Diagnostic diagnostic(String ruleId,
                                        DiagnosticSeverity severity,
                                        String file,
                                        int line,
                                        int column,
                                        String message,
                                        String detail) {
        return new Diagnostic(ruleId, severity, file, line, column, message, detail, Optional.empty());
    }

    public Diagnostic withExample(String example) {
        return new Diagnostic(ruleId, severity, file, line, column, message, detail, Optional.of(example));
    }

    public Diagnostic withSeverity(DiagnosticSeverity severity) {
        return new Diagnostic(ruleId, severity, file, line, column, message, detail, example);
    }
}
