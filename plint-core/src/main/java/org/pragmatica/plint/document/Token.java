package org.pragmatica.plint.document;

/// One lexical token. Concatenating the text of all tokens of a source yields the source.
public record Token(NodeKind kind, String text) {
    public boolean is(NodeKind kind, String text) {
        return this.kind == kind && this.text.equals(text);
    }

    public boolean isSignificant() {
        return kind.isSignificant();
    }

    ElementSpec toElement() {
        return ElementSpec.token(kind, text);
    }
}
