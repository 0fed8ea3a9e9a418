package org.pragmatica.plint.lint.rules;

import org.pragmatica.plint.document.NodeKind;
import org.pragmatica.plint.document.SyntaxNode;
import org.pragmatica.plint.lint.Diagnostic;
import org.pragmatica.plint.lint.DiagnosticSeverity;
import org.pragmatica.plint.lint.LintContext;
import org.pragmatica.plint.lint.Violation;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// ControlStructures::ProhibitForeachHandle: don't use `foreach` to iterate over a file handle.
///
/// `foreach (<$fh>) { ... }` works, but evaluates the readline in list context and
/// so reads the entire file into memory before the first iteration. What was
/// almost always meant is `while (<$fh>) { ... }`, which reads one line at a time.
///
/// Flagged forms:
///
///   - `foreach (<$fh>) { ... }`, `for my $line (<FH>) { ... }`
///   - `foreach (@lines, <$fh>) { ... }` (only the readline is reported)
///   - `print foreach <$fh>;`
///   - `foreach (< $fh >) { ... }`, where the readline was tokenized as `<` `$fh` `>`
///
public class ProhibitForeachHandleRule implements LintRule {
    private static final String RULE_ID = "ControlStructures::ProhibitForeachHandle";
    private static final String DESCRIPTION = "You should not use '%s' to iterate over a file";
    private static final String EXPLANATION = "Using 'while (<handle>)' only reads one line at a time";
    private static final Set<String> THEMES = Set.of("trw");
    private static final Set<NodeKind> STATEMENT_KINDS = Arrays.stream(NodeKind.values())
                                                               .filter(NodeKind::isStatement)
                                                               .collect(Collectors.toUnmodifiableSet());

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public String description() {
        return "Don't use 'foreach' to iterate over a file handle";
    }

    @Override
    public DiagnosticSeverity defaultSeverity() {
        return DiagnosticSeverity.WARNING;
    }

    @Override
    public Set<String> themes() {
        return THEMES;
    }

    @Override
    public Set<NodeKind> appliesTo() {
        return STATEMENT_KINDS;
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode element, LintContext ctx) {
        return violations(element).stream()
                                  .map(violation -> createDiagnostic(violation, ctx));
    }

    /// One violation per handle read in the iteration source of a `for`/`foreach` statement.
    public List<Violation> violations(SyntaxNode statement) {
        var keyword = LoopEntryPointLocator.locate(statement)
                                           .filter(LoopEntryPointLocator::isLoopKeyword);
        if (keyword.isEmpty()) {
            return List.of();
        }
        var description = String.format(DESCRIPTION, keyword.get()
                                                            .content());
        return keyword.flatMap(LoopEntryPointLocator::iterationSource)
                      .map(ReadlineOffenderScanner::scan)
                      .orElseGet(Stream::empty)
                      .map(offender -> new Violation(offender, description, EXPLANATION))
                      .toList();
    }

    private Diagnostic createDiagnostic(Violation violation, LintContext ctx) {
        var element = violation.element();
        return Diagnostic.diagnostic(RULE_ID,
                                     ctx.severityFor(this),
                                     ctx.fileName(),
                                     element.line(),
                                     element.column(),
                                     violation.description(),
                                     violation.explanation())
                         .withExample("""
            # Before: the whole file is read before the first iteration
            foreach my $line (<$fh>) {
                process($line);
            }

            # After: one line at a time
            while (my $line = <$fh>) {
                process($line);
            }
            """);
    }
}
