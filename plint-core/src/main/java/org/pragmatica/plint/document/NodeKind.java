package org.pragmatica.plint.document;

/// Syntactic category of a node in a Perl document.
///
/// The set is closed: code that dispatches on node kinds uses `switch` expressions
/// over this enum, so adding a kind forces every dispatch site to decide how to
/// handle it.
public enum NodeKind {
    // Interior nodes
    DOCUMENT,
    STATEMENT,
    COMPOUND_STATEMENT,
    VARIABLE_STATEMENT,
    INCLUDE_STATEMENT,
    SUB_STATEMENT,
    PACKAGE_STATEMENT,
    BREAK_STATEMENT,
    NULL_STATEMENT,
    EXPRESSION,
    BLOCK,
    LIST,
    CONDITION,
    FOR_HEADER,
    CONSTRUCTOR,
    SUBSCRIPT,
    // Tokens
    WORD,
    LABEL,
    SYMBOL,
    CAST,
    OPERATOR,
    READLINE,
    STRUCTURE,
    NUMBER,
    QUOTE,
    HEREDOC,
    WHITESPACE,
    COMMENT,
    POD,
    HEREDOC_BODY,
    END_SECTION,
    UNKNOWN;

    /// Interior node that can own children.
    public boolean isNode() {
        return switch (this) {
            case DOCUMENT, STATEMENT, COMPOUND_STATEMENT, VARIABLE_STATEMENT, INCLUDE_STATEMENT, SUB_STATEMENT,
                 PACKAGE_STATEMENT, BREAK_STATEMENT, NULL_STATEMENT, EXPRESSION, BLOCK, LIST, CONDITION, FOR_HEADER,
                 CONSTRUCTOR, SUBSCRIPT -> true;
            case WORD, LABEL, SYMBOL, CAST, OPERATOR, READLINE, STRUCTURE, NUMBER, QUOTE, HEREDOC, WHITESPACE,
                 COMMENT, POD, HEREDOC_BODY, END_SECTION, UNKNOWN -> false;
        };
    }

    public boolean isStatement() {
        return switch (this) {
            case STATEMENT, COMPOUND_STATEMENT, VARIABLE_STATEMENT, INCLUDE_STATEMENT, SUB_STATEMENT,
                 PACKAGE_STATEMENT, BREAK_STATEMENT, NULL_STATEMENT, EXPRESSION -> true;
            default -> false;
        };
    }

    /// Structures delimited by an opening and a closing brace.
    public boolean isStructure() {
        return switch (this) {
            case BLOCK, LIST, CONDITION, FOR_HEADER, CONSTRUCTOR, SUBSCRIPT -> true;
            default -> false;
        };
    }

    /// Whitespace, comments, POD and other text that carries no syntax.
    public boolean isSignificant() {
        return switch (this) {
            case WHITESPACE, COMMENT, POD, HEREDOC_BODY, END_SECTION -> false;
            default -> true;
        };
    }
}
