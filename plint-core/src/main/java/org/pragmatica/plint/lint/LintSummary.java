package org.pragmatica.plint.lint;

import java.util.List;

/// Totals over a set of file reports.
public record LintSummary(int files, int errors, int warnings, int infos, int failures) {
    public static LintSummary summarize(List<FileReport> reports) {
        int errors = 0;
        int warnings = 0;
        int infos = 0;
        int failures = 0;
        for (var report : reports) {
            if (report.failed()) {
                failures++;
            }
            for (var diagnostic : report.diagnostics()) {
                switch (diagnostic.severity()) {
                    case ERROR -> errors++;
                    case WARNING -> warnings++;
                    case INFO -> infos++;
                }
            }
        }
        return new LintSummary(reports.size(), errors, warnings, infos, failures);
    }

    /// True when the findings should fail the run: any error, or any warning with `failOnWarning`.
    public boolean hasFailures(boolean failOnWarning) {
        return errors > 0 || (failOnWarning && warnings > 0);
    }

    public int total() {
        return errors + warnings + infos;
    }
}
