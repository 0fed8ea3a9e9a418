package org.pragmatica.plint.document;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/// [SyntaxNode] backed by one slot of a [Document].
///
/// Two instances are equal when they point at the same slot of the same document,
/// so results computed twice over one document compare equal.
public record DocumentNode(Document document, int index) implements SyntaxNode {
    @Override
    public NodeKind kind() {
        return document.kind(index);
    }

    @Override
    public String content() {
        return document.content(index);
    }

    @Override
    public int line() {
        return document.line(index);
    }

    @Override
    public int column() {
        return document.column(index);
    }

    @Override
    public List<SyntaxNode> children() {
        return Arrays.stream(document.childIndices(index))
                     .mapToObj(document::node)
                     .toList();
    }

    @Override
    public List<SyntaxNode> significantChildren() {
        return Arrays.stream(document.childIndices(index))
                     .filter(child -> document.kind(child)
                                              .isSignificant())
                     .mapToObj(document::node)
                     .toList();
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return document.hasParent(index)
               ? Optional.of(document.node(document.parent(index)))
               : Optional.empty();
    }

    @Override
    public Optional<SyntaxNode> nextSignificantSibling() {
        return sibling(1);
    }

    @Override
    public Optional<SyntaxNode> previousSignificantSibling() {
        return sibling(-1);
    }

    private Optional<SyntaxNode> sibling(int direction) {
        var sibling = document.significantSibling(index, direction);
        return sibling < 0
               ? Optional.empty()
               : Optional.of(document.node(sibling));
    }

    @Override
    public String toString() {
        return kind() + "@" + line() + ":" + column() + " '" + content() + "'";
    }
}
