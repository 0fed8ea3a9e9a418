package org.pragmatica.plint.document;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class PerlTokenizerTest {

    @ParameterizedTest
    @ValueSource(strings = {"foreach (<$fh>) { print; }\n",
                            "my %h = (a => 1, 'b' => [1, 2]);\n# comment\n",
                            "print <<EOT;\nbody <$fh>\nEOT\nprint 1;\n",
                            "s/foo/bar/g; $x =~ tr{a-z}{A-Z};\n",
                            "=head1 NAME\n\nx\n\n=cut\nprint 1;\n__END__\nfor (<$fh>) {}\n",
                            "foreach (< $fh >) {\n"})
    void tokenize_isLossless(String source) {
        var text = PerlTokenizer.tokenize(source)
                                .stream()
                                .map(Token::text)
                                .collect(Collectors.joining());
        assertThat(text).isEqualTo(source);
    }

    @Test
    void tokenize_readsReadline_whereTermExpected() {
        assertThat(significant("foreach (<$fh>) {}"))
                  .contains(new Token(NodeKind.READLINE, "<$fh>"));
        assertThat(significant("print foreach <STDIN>;"))
                  .contains(new Token(NodeKind.READLINE, "<STDIN>"));
        assertThat(significant("while (<>) {}"))
                  .contains(new Token(NodeKind.READLINE, "<>"));
    }

    @Test
    void tokenize_readsGlobAsReadline() {
        assertThat(significant("for (<*.txt>) {}"))
                  .contains(new Token(NodeKind.READLINE, "<*.txt>"));
    }

    @Test
    void tokenize_splitsSpacedReadline_intoOperators() {
        assertThat(significant("foreach (< $fh >) {}"))
                  .containsExactly(new Token(NodeKind.WORD, "foreach"),
                                   new Token(NodeKind.STRUCTURE, "("),
                                   new Token(NodeKind.OPERATOR, "<"),
                                   new Token(NodeKind.SYMBOL, "$fh"),
                                   new Token(NodeKind.OPERATOR, ">"),
                                   new Token(NodeKind.STRUCTURE, ")"),
                                   new Token(NodeKind.STRUCTURE, "{"),
                                   new Token(NodeKind.STRUCTURE, "}"));
    }

    @Test
    void tokenize_readsComparison_afterOperand() {
        assertThat(significant("$i < 10 and $j > 2"))
                  .contains(new Token(NodeKind.OPERATOR, "<"), new Token(NodeKind.OPERATOR, ">"))
                  .noneMatch(token -> token.kind() == NodeKind.READLINE);
    }

    @Test
    void tokenize_recognizesLabel_atStatementStart() {
        assertThat(significant("LINE: foreach (<$fh>) {}").get(0))
                  .isEqualTo(new Token(NodeKind.LABEL, "LINE:"));
    }

    @Test
    void tokenize_keepsHeredocBody_outOfCode() {
        var tokens = PerlTokenizer.tokenize("print <<EOT;\nforeach (<$fh>) {}\nEOT\n");
        assertThat(tokens)
                  .contains(new Token(NodeKind.HEREDOC, "<<EOT"),
                            new Token(NodeKind.HEREDOC_BODY, "foreach (<$fh>) {}\nEOT\n"))
                  .noneMatch(token -> token.kind() == NodeKind.READLINE);
    }

    @Test
    void tokenize_treatsMethodName_afterArrow_asWord() {
        assertThat(significant("$obj->y(1);"))
                  .contains(new Token(NodeKind.WORD, "y"));
    }

    @Test
    void tokenize_readsQuoteLikeOperators() {
        assertThat(significant("my @w = qw(a b c); $s =~ s/a/b/gi;"))
                  .contains(new Token(NodeKind.QUOTE, "qw(a b c)"), new Token(NodeKind.QUOTE, "s/a/b/gi"));
    }

    private static List<Token> significant(String source) {
        return PerlTokenizer.tokenize(source)
                            .stream()
                            .filter(Token::isSignificant)
                            .toList();
    }
}
