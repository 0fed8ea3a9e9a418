package org.pragmatica.plint.document;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.plint.document.Elements.block;
import static org.pragmatica.plint.document.Elements.comment;
import static org.pragmatica.plint.document.Elements.compound;
import static org.pragmatica.plint.document.Elements.document;
import static org.pragmatica.plint.document.Elements.expression;
import static org.pragmatica.plint.document.Elements.list;
import static org.pragmatica.plint.document.Elements.newline;
import static org.pragmatica.plint.document.Elements.readline;
import static org.pragmatica.plint.document.Elements.space;
import static org.pragmatica.plint.document.Elements.word;

class DocumentTest {
    private final Document document = Document.document(document(comment("# read"),
                                                                 newline(),
                                                                 compound(word("foreach"),
                                                                          space(),
                                                                          list(expression(readline("<$fh>"))),
                                                                          space(),
                                                                          block())));

    @Test
    void content_concatenatesAllTokensAndBraces() {
        assertThat(document.content()).isEqualTo("# read\nforeach (<$fh>) {}");
    }

    @Test
    void positions_areOneBased() {
        var readline = document.findAll(NodeKind.READLINE)
                               .get(0);
        assertThat(readline.line()).isEqualTo(2);
        assertThat(readline.column()).isEqualTo(10);
        assertThat(document.root()
                           .line()).isEqualTo(1);
        assertThat(document.root()
                           .column()).isEqualTo(1);
    }

    @Test
    void siblings_skipCosmeticElements() {
        var loop = document.findAll(NodeKind.COMPOUND_STATEMENT)
                           .get(0);
        var keyword = loop.firstSignificantChild()
                          .orElseThrow();
        assertThat(keyword.nextSignificantSibling()
                          .map(SyntaxNode::kind)).contains(NodeKind.LIST);
        assertThat(keyword.previousSignificantSibling()).isEmpty();
        assertThat(loop.previousSignificantSibling()).isEmpty();
        assertThat(loop.children()).hasSize(5);
        assertThat(loop.significantChildren()).hasSize(3);
    }

    @Test
    void parent_leadsBackToRoot() {
        var readline = document.findAll(NodeKind.READLINE)
                               .get(0);
        assertThat(readline.parent()
                           .map(SyntaxNode::kind)).contains(NodeKind.EXPRESSION);
        assertThat(document.root()
                           .parent()).isEmpty();
    }

    @Test
    void nodes_areEqual_whenTheyPointAtTheSameElement() {
        var first = document.findAll(NodeKind.READLINE)
                            .get(0);
        var second = document.findAll(NodeKind.READLINE)
                             .get(0);
        assertThat(first).isEqualTo(second);
        assertThat(first).isNotEqualTo(Document.document(ElementSpec.node(NodeKind.DOCUMENT, java.util.List.of()))
                                               .root());
    }

    @Test
    void statements_includeNestedOnes() {
        var parsed = PerlParser.parse("foreach (@x) { print; if ($y) { last; } }");
        assertThat(parsed.statements()
                         .stream()
                         .map(SyntaxNode::kind))
                  .contains(NodeKind.COMPOUND_STATEMENT, NodeKind.STATEMENT, NodeKind.BREAK_STATEMENT);
    }
}
