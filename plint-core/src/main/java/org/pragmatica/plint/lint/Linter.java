package org.pragmatica.plint.lint;

import org.pragmatica.plint.document.Document;
import org.pragmatica.plint.document.PerlParser;
import org.pragmatica.plint.document.SyntaxNode;
import org.pragmatica.plint.lint.rules.LintRule;
import org.pragmatica.plint.lint.rules.LintRules;
import org.pragmatica.plint.shared.PlintException;
import org.pragmatica.plint.shared.SourceFile;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Runs the enabled rules over Perl sources.
///
/// Every element of a document whose kind a rule asks for is passed to that rule.
/// Files are independent, so [#lintFiles] may process them in parallel when the
/// configuration says so.
public final class Linter {
    private static final Logger log = LoggerFactory.getLogger(Linter.class);
    private static final Comparator<Diagnostic> BY_POSITION = Comparator.comparingInt(Diagnostic::line)
                                                                        .thenComparingInt(Diagnostic::column)
                                                                        .thenComparing(Diagnostic::ruleId);

    private final List<LintRule> rules;
    private final LintContext context;

    private Linter(List<LintRule> rules, LintContext context) {
        this.rules = List.copyOf(rules);
        this.context = context;
    }

    public static Linter linter(LintContext context) {
        return linter(LintRules.all(), context);
    }

    public static Linter linter(List<LintRule> rules, LintContext context) {
        return new Linter(rules, context);
    }

    public List<LintRule> enabledRules() {
        return rules.stream()
                    .filter(context::isRuleEnabled)
                    .toList();
    }

    /// Lint every file, skipping the ones matched by the exclude globs.
    public List<FileReport> lintFiles(List<Path> files) {
        var selected = files.stream()
                            .filter(this::selected);
        if (context.config()
                   .parallel()) {
            selected = selected.parallel();
        }
        return selected.map(this::lintFile)
                       .toList();
    }

    public FileReport lintFile(Path path) {
        try {
            return lintSource(SourceFile.read(path));
        } catch (PlintException e) {
            log.warn(e.getMessage());
            return FileReport.failed(path, e.error());
        }
    }

    public FileReport lintSource(SourceFile source) {
        var document = PerlParser.parse(source.content());
        if (!document.complete()) {
            log.warn("{}: unbalanced braces, results may be incomplete", source.fileName());
        }
        var diagnostics = lintDocument(document, context.withFileName(source.fileName()));
        log.debug("{}: {} diagnostic(s)", source.fileName(), diagnostics.size());
        return FileReport.fileReport(source.path(), diagnostics);
    }

    /// Diagnostics for an already parsed document, sorted by position.
    public List<Diagnostic> lintDocument(Document document, LintContext fileContext) {
        var enabled = enabledRules();
        return allElements(document.root()).flatMap(element -> analyze(element, enabled, fileContext))
                                           .filter(diagnostic -> fileContext.isReported(diagnostic.severity()))
                                           .sorted(BY_POSITION)
                                           .toList();
    }

    private Stream<Diagnostic> analyze(SyntaxNode element, List<LintRule> enabled, LintContext fileContext) {
        return enabled.stream()
                      .filter(rule -> rule.appliesTo()
                                          .contains(element.kind()))
                      .flatMap(rule -> rule.analyze(element, fileContext));
    }

    private static Stream<SyntaxNode> allElements(SyntaxNode node) {
        return Stream.concat(Stream.of(node),
                             node.children()
                                 .stream()
                                 .flatMap(Linter::allElements));
    }

    private boolean selected(Path path) {
        if (context.shouldLint(path)) {
            return true;
        }
        log.debug("{}: excluded", path);
        return false;
    }
}
