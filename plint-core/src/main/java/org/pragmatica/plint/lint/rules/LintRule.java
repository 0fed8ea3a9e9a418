package org.pragmatica.plint.lint.rules;

import org.pragmatica.plint.document.NodeKind;
import org.pragmatica.plint.document.SyntaxNode;
import org.pragmatica.plint.lint.Diagnostic;
import org.pragmatica.plint.lint.DiagnosticSeverity;
import org.pragmatica.plint.lint.LintContext;

import java.util.Set;
import java.util.stream.Stream;

/**
 * Interface for lint rules.
 *
 * The linter hands every element whose kind is listed in {@link #appliesTo()} to
 * {@link #analyze(SyntaxNode, LintContext)}; each call produces zero or more diagnostics.
 */
public interface LintRule {

    /**
     * Get the rule ID (e.g., "ControlStructures::ProhibitForeachHandle").
     */
    String ruleId();

    /**
     * Get a short description of what this rule checks.
     */
    String description();

    /**
     * Severity used when the configuration does not override it.
     */
    DiagnosticSeverity defaultSeverity();

    /**
     * Themes used to select groups of rules.
     */
    Set<String> themes();

    /**
     * Element kinds this rule wants to see.
     */
    Set<NodeKind> appliesTo();

    /**
     * Analyze one element and return any diagnostics.
     *
     * @param element the element to analyze, of one of the kinds from {@link #appliesTo()}
     * @param ctx     the lint context providing configuration and the file name
     * @return stream of diagnostics found
     */
    Stream<Diagnostic> analyze(SyntaxNode element, LintContext ctx);
}
