package org.pragmatica.plint.document;

import java.util.List;
import java.util.Optional;

/// Read-only view of one element of a parsed Perl document.
///
/// Rules see the tree only through this interface. Navigation never mutates the
/// tree and absent neighbours are reported as `Optional.empty()`.
public interface SyntaxNode {
    NodeKind kind();

    /// Source text covered by this element, including nested elements and braces.
    String content();

    /// 1-based line of the first character.
    int line();

    /// 1-based column of the first character.
    int column();

    /// All children in source order, cosmetic ones included.
    List<SyntaxNode> children();

    /// Children that are not whitespace, comments or POD.
    List<SyntaxNode> significantChildren();

    Optional<SyntaxNode> parent();

    Optional<SyntaxNode> nextSignificantSibling();

    Optional<SyntaxNode> previousSignificantSibling();

    default Optional<SyntaxNode> firstSignificantChild() {
        var children = significantChildren();
        return children.isEmpty()
               ? Optional.empty()
               : Optional.of(children.get(0));
    }

    default Optional<SyntaxNode> lastSignificantChild() {
        var children = significantChildren();
        return children.isEmpty()
               ? Optional.empty()
               : Optional.of(children.get(children.size() - 1));
    }

    default boolean is(NodeKind kind) {
        return kind() == kind;
    }

    /// Check kind and exact content in one go, e.g. `is(NodeKind.OPERATOR, ">")`.
    default boolean is(NodeKind kind, String content) {
        return kind() == kind && content().equals(content);
    }
}
