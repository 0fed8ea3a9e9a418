package org.pragmatica.plint.lint.rules;

import org.pragmatica.plint.document.Document;
import org.pragmatica.plint.document.ElementSpec;
import org.pragmatica.plint.document.NodeKind;
import org.pragmatica.plint.document.PerlParser;
import org.pragmatica.plint.document.SyntaxNode;
import org.pragmatica.plint.lint.Diagnostic;
import org.pragmatica.plint.lint.DiagnosticSeverity;
import org.pragmatica.plint.lint.LintConfig;
import org.pragmatica.plint.lint.LintContext;
import org.pragmatica.plint.lint.Violation;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.plint.document.Elements.block;
import static org.pragmatica.plint.document.Elements.compound;
import static org.pragmatica.plint.document.Elements.condition;
import static org.pragmatica.plint.document.Elements.document;
import static org.pragmatica.plint.document.Elements.expression;
import static org.pragmatica.plint.document.Elements.forHeader;
import static org.pragmatica.plint.document.Elements.label;
import static org.pragmatica.plint.document.Elements.list;
import static org.pragmatica.plint.document.Elements.number;
import static org.pragmatica.plint.document.Elements.operator;
import static org.pragmatica.plint.document.Elements.quote;
import static org.pragmatica.plint.document.Elements.readline;
import static org.pragmatica.plint.document.Elements.semicolon;
import static org.pragmatica.plint.document.Elements.space;
import static org.pragmatica.plint.document.Elements.statement;
import static org.pragmatica.plint.document.Elements.symbol;
import static org.pragmatica.plint.document.Elements.variable;
import static org.pragmatica.plint.document.Elements.word;

class ProhibitForeachHandleRuleTest {
    private static final String EXPLANATION = "Using 'while (<handle>)' only reads one line at a time";

    private final ProhibitForeachHandleRule rule = new ProhibitForeachHandleRule();

    @ParameterizedTest
    @ValueSource(strings = {"foreach (<$fh>) { print; }",
                            "foreach my $line (<$fh>) { print $line; }",
                            "foreach (<FH>) { print; }",
                            "foreach (<>) { print; }",
                            "print foreach <$fh>;",
                            "print foreach (<$fh>);",
                            "foreach (< $fh >) { print; }",
                            "print foreach < $fh >;",
                            "foreach (@a, <$fh>, @b) { }",
                            "foreach my $zeile (<$fé>) { print $zeile; }"})
    void violations_reportForeachOverHandle(String source) {
        var violations = violations(source);
        assertThat(violations).hasSize(1);
        assertThat(violations.get(0)
                             .description()).isEqualTo("You should not use 'foreach' to iterate over a file");
        assertThat(violations.get(0)
                             .explanation()).isEqualTo(EXPLANATION);
    }

    @Test
    void violations_useTheKeywordAsWritten() {
        var violations = violations("for my $line (<$fh>) { print $line; }");
        assertThat(violations).hasSize(1);
        assertThat(violations.get(0)
                             .description()).isEqualTo("You should not use 'for' to iterate over a file");
    }

    @ParameterizedTest
    @ValueSource(strings = {"while (<$fh>) { print; }",
                            "while (my $line = <$fh>) { print $line; }",
                            "print while <$fh>;",
                            "foreach (<*.txt>) { print; }",
                            "foreach (@lines) { print; }",
                            "foreach my $line (@lines) { print $line; }",
                            "for (my $i = 0; $i < 10; $i++) { print $i; }",
                            "my @lines = <$fh>;",
                            "if (<$fh>) { print; }",
                            "LINE: foreach (<$fh>) { print; }",
                            "foreach $line (<$fh>) { print $line; }",
                            "print <<EOT;\nforeach (<$fh>) {}\nEOT\n",
                            "# foreach (<$fh>) {}\n",
                            "print 'foreach (<$fh>) {}';"})
    void violations_ignoreOtherShapes(String source) {
        assertThat(violations(source)).isEmpty();
    }

    @Test
    void violations_reportEveryHandleInTheList() {
        var violations = violations("foreach (<$a>, @lines, <$b>) { print; }");
        assertThat(violations.stream()
                             .map(violation -> violation.element()
                                                        .content()))
                  .containsExactly("<$a>", "<$b>");
    }

    @Test
    void violations_pointAtTheReadline() {
        var violations = violations("my $fh;\n\nforeach my $line (<$fh>) {\n}\n");
        assertThat(violations).hasSize(1);
        var element = violations.get(0)
                                .element();
        assertThat(element.kind()).isEqualTo(NodeKind.READLINE);
        assertThat(element.line()).isEqualTo(3);
        assertThat(element.column()).isEqualTo(19);
    }

    @Test
    void violations_pointAtTheOpeningOperator_ofMisparsedReadline() {
        var violations = violations("foreach (< $fh >) { print; }");
        assertThat(violations.get(0)
                             .element()
                             .is(NodeKind.OPERATOR, "<")).isTrue();
        assertThat(violations.get(0)
                             .element()
                             .column()).isEqualTo(10);
    }

    @Test
    void violations_findNestedLoops() {
        var document = PerlParser.parse("""
            sub slurp {
                my ($fh) = @_;
                foreach my $line (<$fh>) {
                    push @out, $line;
                }
            }
            """);
        var violations = document.statements()
                                 .stream()
                                 .flatMap(statement -> rule.violations(statement)
                                                           .stream())
                                 .toList();
        assertThat(violations).hasSize(1);
        assertThat(violations.get(0)
                             .element()
                             .line()).isEqualTo(3);
    }

    @Test
    void violations_workOnHandBuiltTrees() {
        // Tree shape the tokenizer produces for a readline with inner spaces
        var loop = Document.document(document(compound(word("foreach"),
                                                       space(),
                                                       list(expression(operator("<"),
                                                                       symbol("$fh"),
                                                                       operator(">"))),
                                                       space(),
                                                       block())))
                           .root()
                           .firstSignificantChild()
                           .orElseThrow();
        assertThat(rule.violations(loop)).hasSize(1);
    }

    @Test
    void violations_ignoreHandBuiltNonOffenders() {
        var labelled = firstStatement(compound(label("LINE:"),
                                               space(),
                                               word("foreach"),
                                               list(expression(readline("<$fh>"))),
                                               block()));
        var whileLoop = firstStatement(compound(word("while"), condition(expression(readline("<$fh>"))), block()));
        var cStyle = firstStatement(compound(word("for"),
                                             forHeader(variable(word("my"), symbol("$i"), operator("="), number("0"),
                                                                semicolon()),
                                                       statement(symbol("$i"), operator("<"), number("10"),
                                                                 semicolon()),
                                                       statement(symbol("$i"), operator("++"))),
                                             block(statement(word("print"), space(), quote("'x'"), semicolon()))));
        assertThat(rule.violations(labelled)).isEmpty();
        assertThat(rule.violations(whileLoop)).isEmpty();
        assertThat(rule.violations(cStyle)).isEmpty();
    }

    @Test
    void violations_areIdempotent() {
        var document = PerlParser.parse("foreach (<$a>, <$b>) { print; }\nprint foreach <$c>;\n");
        var first = allViolations(document);
        var second = allViolations(document);
        assertThat(first).hasSize(3);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void analyze_producesDiagnostics_withConfiguredSeverity() {
        var document = PerlParser.parse("foreach (<$fh>) { print; }");
        var statement = document.root()
                                .firstSignificantChild()
                                .orElseThrow();
        var context = LintContext.defaultContext()
                                 .withFileName("script.pl");
        var diagnostics = rule.analyze(statement, context)
                              .toList();
        assertThat(diagnostics).hasSize(1);
        Diagnostic diagnostic = diagnostics.get(0);
        assertThat(diagnostic.ruleId()).isEqualTo("ControlStructures::ProhibitForeachHandle");
        assertThat(diagnostic.severity()).isEqualTo(DiagnosticSeverity.WARNING);
        assertThat(diagnostic.file()).isEqualTo("script.pl");
        assertThat(diagnostic.line()).isEqualTo(1);
        assertThat(diagnostic.column()).isEqualTo(10);
        assertThat(diagnostic.detail()).isEqualTo(EXPLANATION);
        assertThat(diagnostic.example()).isPresent();

        var strict = context.withConfig(LintConfig.defaultConfig()
                                                  .withRuleSeverity(rule.ruleId(), DiagnosticSeverity.ERROR));
        assertThat(rule.analyze(statement, strict)
                       .map(Diagnostic::severity))
                  .containsExactly(DiagnosticSeverity.ERROR);
    }

    @Test
    void metadata_matchesThePolicy() {
        assertThat(rule.themes()).containsExactly("trw");
        assertThat(rule.defaultSeverity()).isEqualTo(DiagnosticSeverity.WARNING);
        assertThat(rule.appliesTo()).contains(NodeKind.STATEMENT, NodeKind.COMPOUND_STATEMENT)
                                    .doesNotContain(NodeKind.WORD, NodeKind.LIST);
        assertThat(LintRules.byId(rule.ruleId())).isPresent();
    }

    private static SyntaxNode firstStatement(ElementSpec statement) {
        return Document.document(document(statement))
                       .root()
                       .firstSignificantChild()
                       .orElseThrow();
    }

    private List<Violation> violations(String source) {
        return allViolations(PerlParser.parse(source));
    }

    private List<Violation> allViolations(Document document) {
        return document.statements()
                       .stream()
                       .flatMap(statement -> rule.violations(statement)
                                                 .stream())
                       .toList();
    }
}
