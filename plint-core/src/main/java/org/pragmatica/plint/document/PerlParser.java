package org.pragmatica.plint.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Builds a PPI-style [Document] from Perl source.
///
/// The parser is tolerant: it never rejects input. Stray closing braces become
/// `STRUCTURE` tokens and structures left open at the end of input are closed
/// implicitly, in which case the document reports itself as incomplete.
///
/// Statement classification follows the first significant token:
///
///   - `for foreach while until if unless` and bare blocks: compound statement, ends after its block(s)
///   - `my our local state`: variable declaration
///   - `use no require`: include
///   - `sub NAME`, `BEGIN` and friends: subroutine, ends after its block
///   - `package`: package declaration
///   - `return last next redo goto`: break
///   - anything else: plain statement, ends at `;`
///
public final class PerlParser {
    private static final Set<String> COMPOUND_WORDS = Set.of("for", "foreach", "while", "until", "if", "unless");
    private static final Set<String> LOOP_WORDS = Set.of("for", "foreach");
    private static final Set<String> CONDITION_WORDS = Set.of("while", "until", "if", "unless", "elsif");
    private static final Set<String> BRANCH_WORDS = Set.of("elsif", "else");
    private static final Set<String> VARIABLE_WORDS = Set.of("my", "our", "local", "state");
    private static final Set<String> INCLUDE_WORDS = Set.of("use", "no", "require");
    private static final Set<String> BREAK_WORDS = Set.of("return", "last", "next", "redo", "goto");
    private static final Set<String> SCHEDULED_BLOCKS = Set.of("BEGIN", "END", "INIT", "CHECK", "UNITCHECK");
    private static final Set<String> BLOCK_INTRODUCERS = Set.of("sub", "do", "eval", "map", "grep", "sort",
                                                                "BEGIN", "END", "INIT", "CHECK", "UNITCHECK");

    private final List<Token> tokens;
    private int position;
    private boolean complete = true;

    private PerlParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Document parse(String source) {
        var parser = new PerlParser(PerlTokenizer.tokenize(source));
        var children = parser.statements(null);
        return Document.document(ElementSpec.node(NodeKind.DOCUMENT, children), parser.complete);
    }

    /// Statements up to (not including) `closer`, or to end of input when `closer` is null.
    private List<ElementSpec> statements(String closer) {
        var children = new ArrayList<ElementSpec>();
        while (!atEnd()) {
            var token = current();
            if (!token.isSignificant()) {
                children.add(consume().toElement());
            } else if (closer != null && token.is(NodeKind.STRUCTURE, closer)) {
                return children;
            } else if (isClosing(token)) {
                children.add(consume().toElement());
            } else {
                children.add(statement());
            }
        }
        if (closer != null) {
            complete = false;
        }
        return children;
    }

    private ElementSpec statement() {
        var first = current();
        if (first.is(NodeKind.STRUCTURE, ";")) {
            return ElementSpec.node(NodeKind.NULL_STATEMENT, List.of(consume().toElement()));
        }
        if (first.is(NodeKind.STRUCTURE, "{")) {
            return compound();
        }
        if (first.kind() == NodeKind.LABEL) {
            var next = significantAfter(position);
            return next != null && (next.is(NodeKind.STRUCTURE, "{") || isWordIn(next, COMPOUND_WORDS))
                   ? compound()
                   : simple(NodeKind.STATEMENT, false);
        }
        if (first.kind() != NodeKind.WORD || isFatComma(significantAfter(position))) {
            return simple(NodeKind.STATEMENT, false);
        }
        var word = first.text();
        if (COMPOUND_WORDS.contains(word)) {
            return compound();
        }
        if (VARIABLE_WORDS.contains(word)) {
            return simple(NodeKind.VARIABLE_STATEMENT, false);
        }
        if (INCLUDE_WORDS.contains(word)) {
            return simple(NodeKind.INCLUDE_STATEMENT, false);
        }
        if (BREAK_WORDS.contains(word)) {
            return simple(NodeKind.BREAK_STATEMENT, false);
        }
        if (word.equals("package")) {
            return simple(NodeKind.PACKAGE_STATEMENT, true);
        }
        if (SCHEDULED_BLOCKS.contains(word) || (word.equals("sub") && isNamedSub())) {
            return simple(NodeKind.SUB_STATEMENT, true);
        }
        return simple(NodeKind.STATEMENT, false);
    }

    private boolean isNamedSub() {
        var next = significantAfter(position);
        return next != null && next.kind() == NodeKind.WORD;
    }

    /// Statement ending at `;`, at an enclosing closer, or after its first block when `endsAfterBlock`.
    private ElementSpec simple(NodeKind kind, boolean endsAfterBlock) {
        var children = new ArrayList<ElementSpec>();
        ElementSpec previous = null;
        while (!atEnd()) {
            var token = current();
            if (token.is(NodeKind.STRUCTURE, ";")) {
                children.add(consume().toElement());
                break;
            }
            if (isClosing(token)) {
                break;
            }
            var element = isOpening(token)
                          ? structure(braceKind(token, previous, kind))
                          : consume().toElement();
            children.add(element);
            if (element.kind()
                       .isSignificant()) {
                previous = element;
            }
            if (endsAfterBlock && element.kind() == NodeKind.BLOCK) {
                break;
            }
        }
        return ElementSpec.node(kind, children);
    }

    /// Loop or conditional with its block, plus `elsif`/`else`/`continue` tails.
    private ElementSpec compound() {
        var children = new ArrayList<ElementSpec>();
        String clause = null;
        while (!atEnd()) {
            var token = current();
            if (token.is(NodeKind.STRUCTURE, ";")) {
                children.add(consume().toElement());
                break;
            }
            if (isClosing(token)) {
                break;
            }
            if (token.kind() == NodeKind.WORD && (COMPOUND_WORDS.contains(token.text())
                                                  || CONDITION_WORDS.contains(token.text()))) {
                clause = token.text();
            }
            if (token.is(NodeKind.STRUCTURE, "(")) {
                children.add(structure(headerKind(clause)));
            } else if (token.is(NodeKind.STRUCTURE, "{")) {
                children.add(structure(NodeKind.BLOCK));
                if (!continuesAfterBlock(clause)) {
                    break;
                }
            } else if (isOpening(token)) {
                children.add(structure(NodeKind.CONSTRUCTOR));
            } else {
                children.add(consume().toElement());
            }
        }
        return ElementSpec.node(NodeKind.COMPOUND_STATEMENT, children);
    }

    private boolean continuesAfterBlock(String clause) {
        var next = significantAfter(position - 1);
        if (next == null || next.kind() != NodeKind.WORD) {
            return false;
        }
        if (next.text()
                .equals("continue")) {
            return true;
        }
        return BRANCH_WORDS.contains(next.text()) && clause != null && (clause.equals("if")
                                                                        || clause.equals("unless")
                                                                        || clause.equals("elsif"));
    }

    private NodeKind headerKind(String clause) {
        if (clause == null) {
            return NodeKind.LIST;
        }
        if (LOOP_WORDS.contains(clause)) {
            return hasTopLevelSemicolon()
                   ? NodeKind.FOR_HEADER
                   : NodeKind.LIST;
        }
        return CONDITION_WORDS.contains(clause)
               ? NodeKind.CONDITION
               : NodeKind.LIST;
    }

    private NodeKind braceKind(Token open, ElementSpec previous, NodeKind statementKind) {
        var text = open.text();
        if (text.equals("(")) {
            return NodeKind.LIST;
        }
        boolean afterSubscriptable = previous != null && (previous.kind() == NodeKind.SYMBOL
                                                          || previous.kind() == NodeKind.SUBSCRIPT
                                                          || (previous.kind() == NodeKind.OPERATOR && previous.text()
                                                                                                             .equals("->")));
        if (text.equals("[")) {
            return afterSubscriptable || (previous != null && previous.kind() == NodeKind.LIST)
                   ? NodeKind.SUBSCRIPT
                   : NodeKind.CONSTRUCTOR;
        }
        if (previous != null && (previous.kind() == NodeKind.CAST
                                 || (previous.kind() == NodeKind.WORD && BLOCK_INTRODUCERS.contains(previous.text())))) {
            return NodeKind.BLOCK;
        }
        if (statementKind == NodeKind.SUB_STATEMENT || statementKind == NodeKind.PACKAGE_STATEMENT) {
            return NodeKind.BLOCK;
        }
        return afterSubscriptable
               ? NodeKind.SUBSCRIPT
               : NodeKind.CONSTRUCTOR;
    }

    private ElementSpec structure(NodeKind kind) {
        var open = consume();
        var closer = closerFor(open.text());
        var children = switch (kind) {
            case BLOCK -> statements(closer);
            case FOR_HEADER -> expressions(closer, true);
            default -> expressions(closer, false);
        };
        var finish = "";
        if (!atEnd() && current().is(NodeKind.STRUCTURE, closer)) {
            finish = consume().text();
        } else {
            complete = false;
        }
        return ElementSpec.structure(kind, open.text(), finish, children);
    }

    /// Contents of a parenthesised or bracketed structure, one expression statement per `;`-separated part.
    private List<ElementSpec> expressions(String closer, boolean forHeader) {
        var children = new ArrayList<ElementSpec>();
        while (!atEnd() && !current().is(NodeKind.STRUCTURE, closer)) {
            var token = current();
            if (!token.isSignificant()) {
                children.add(consume().toElement());
            } else if (isClosing(token)) {
                children.add(consume().toElement());
            } else {
                children.add(simple(partKind(token, forHeader), false));
            }
        }
        return children;
    }

    private static NodeKind partKind(Token first, boolean forHeader) {
        if (!forHeader) {
            return NodeKind.EXPRESSION;
        }
        return isWordIn(first, VARIABLE_WORDS)
               ? NodeKind.VARIABLE_STATEMENT
               : NodeKind.STATEMENT;
    }

    private boolean hasTopLevelSemicolon() {
        int depth = 0;
        for (int i = position; i < tokens.size(); i++) {
            var token = tokens.get(i);
            if (isOpening(token)) {
                depth++;
            } else if (isClosing(token)) {
                depth--;
                if (depth == 0) {
                    return false;
                }
            } else if (depth == 1 && token.is(NodeKind.STRUCTURE, ";")) {
                return true;
            }
        }
        return false;
    }

    private Token significantAfter(int index) {
        for (int i = index + 1; i < tokens.size(); i++) {
            if (tokens.get(i)
                      .isSignificant()) {
                return tokens.get(i);
            }
        }
        return null;
    }

    private static boolean isFatComma(Token token) {
        return token != null && token.is(NodeKind.OPERATOR, "=>");
    }

    private static boolean isWordIn(Token token, Set<String> words) {
        return token.kind() == NodeKind.WORD && words.contains(token.text());
    }

    private static boolean isOpening(Token token) {
        return token.kind() == NodeKind.STRUCTURE && "([{".contains(token.text());
    }

    private static boolean isClosing(Token token) {
        return token.kind() == NodeKind.STRUCTURE && ")]}".contains(token.text());
    }

    private static String closerFor(String open) {
        return switch (open) {
            case "(" -> ")";
            case "[" -> "]";
            default -> "}";
        };
    }

    private boolean atEnd() {
        return position >= tokens.size();
    }

    private Token current() {
        return tokens.get(position);
    }

    private Token consume() {
        return tokens.get(position++);
    }
}
