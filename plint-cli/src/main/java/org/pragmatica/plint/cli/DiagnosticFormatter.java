package org.pragmatica.plint.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pragmatica.plint.lint.Diagnostic;
import org.pragmatica.plint.lint.FileReport;
import org.pragmatica.plint.lint.LintSummary;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.stream.Collectors;

/// Renders lint results as plain text or JSON.
public final class DiagnosticFormatter {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final OutputFormat format;

    private DiagnosticFormatter(OutputFormat format) {
        this.format = format;
    }

    public static DiagnosticFormatter diagnosticFormatter(OutputFormat format) {
        return new DiagnosticFormatter(format);
    }

    public String format(List<FileReport> reports, LintSummary summary) {
        return switch (format) {
            case TEXT -> text(reports, summary);
            case JSON -> json(reports, summary);
        };
    }

    /// `file:line:column: [severity] message. detail (rule)`
    public static String formatDiagnostic(Diagnostic diagnostic) {
        return diagnostic.file() + ":" + diagnostic.line() + ":" + diagnostic.column() + ": ["
               + diagnostic.severity()
                           .label() + "] " + diagnostic.message() + ". " + diagnostic.detail() + " ("
               + diagnostic.ruleId() + ")";
    }

    public static String formatSummary(LintSummary summary) {
        return summary.files() + " file(s) checked: " + summary.errors() + " error(s), " + summary.warnings()
               + " warning(s), " + summary.infos() + " info(s)" + (summary.failures() > 0
                                                                    ? ", " + summary.failures() + " file(s) failed"
                                                                    : "");
    }

    private static String text(List<FileReport> reports, LintSummary summary) {
        var lines = reports.stream()
                           .flatMap(report -> report.failed()
                                              ? report.error()
                                                      .stream()
                                                      .map(error -> report.path() + ": " + error.message())
                                              : report.diagnostics()
                                                      .stream()
                                                      .map(DiagnosticFormatter::formatDiagnostic))
                           .collect(Collectors.joining(System.lineSeparator()));
        return lines.isEmpty()
               ? formatSummary(summary)
               : lines + System.lineSeparator() + formatSummary(summary);
    }

    private static String json(List<FileReport> reports, LintSummary summary) {
        var root = MAPPER.createObjectNode();
        var files = root.putArray("files");
        reports.forEach(report -> addReport(files, report));
        var totals = root.putObject("summary");
        totals.put("files", summary.files());
        totals.put("errors", summary.errors());
        totals.put("warnings", summary.warnings());
        totals.put("infos", summary.infos());
        totals.put("failures", summary.failures());
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void addReport(ArrayNode files, FileReport report) {
        var file = files.addObject();
        file.put("path", report.path()
                               .toString());
        report.error()
              .ifPresent(error -> file.put("error", error.message()));
        var diagnostics = file.putArray("diagnostics");
        report.diagnostics()
              .forEach(diagnostic -> addDiagnostic(diagnostics.addObject(), diagnostic));
    }

    private static void addDiagnostic(ObjectNode node, Diagnostic diagnostic) {
        node.put("rule", diagnostic.ruleId());
        node.put("severity", diagnostic.severity()
                                       .label());
        node.put("line", diagnostic.line());
        node.put("column", diagnostic.column());
        node.put("message", diagnostic.message());
        node.put("detail", diagnostic.detail());
    }
}
