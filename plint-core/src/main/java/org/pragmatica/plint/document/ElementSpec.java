package org.pragmatica.plint.document;

import java.util.List;

/// Immutable description of a subtree before it is placed into a [Document].
///
/// For tokens `text` is the token text. For structures `text` is the opening brace
/// and `finish` the closing one (empty when the source ended before it). Other
/// interior nodes carry no text of their own.
public record ElementSpec(NodeKind kind, String text, String finish, List<ElementSpec> children) {
    public ElementSpec {
        children = List.copyOf(children);
        if (!kind.isNode() && !children.isEmpty()) {
            throw new IllegalArgumentException("Token " + kind + " cannot have children");
        }
    }

    public static ElementSpec token(NodeKind kind, String text) {
        return new ElementSpec(kind, text, "", List.of());
    }

    public static ElementSpec node(NodeKind kind, List<ElementSpec> children) {
        return new ElementSpec(kind, "", "", children);
    }

    public static ElementSpec structure(NodeKind kind, String start, String finish, List<ElementSpec> children) {
        return new ElementSpec(kind, start, finish, children);
    }

    /// Full source text of the subtree.
    public String content() {
        if (children.isEmpty()) {
            return text + finish;
        }
        var builder = new StringBuilder(text);
        children.forEach(child -> builder.append(child.content()));
        return builder.append(finish)
                      .toString();
    }
}
