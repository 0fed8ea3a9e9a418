package org.pragmatica.plint.lint.rules;

import org.pragmatica.plint.document.NodeKind;
import org.pragmatica.plint.document.SyntaxNode;

import java.util.Optional;
import java.util.Set;

/// Finds the `for`/`foreach` keyword of a statement and the expression the loop iterates over.
///
/// Compound loops start with their keyword. Plain statements are read right to
/// left: the tail of `print foreach <$fh>;` has the iteration source last, so the
/// keyword sits just before it. That tail may be a list, a readline literal, or
/// the `<` word `>` triple produced when the tokenizer did not recognize a readline.
///
/// [#locate] only returns a candidate; callers check it with [#isLoopKeyword].
public final class LoopEntryPointLocator {
    private static final Set<String> LOOP_KEYWORDS = Set.of("for", "foreach");
    private static final String BINDING = "my";
    private static final String LESS_THAN = "<";
    private static final String GREATER_THAN = ">";

    private LoopEntryPointLocator() {}

    /// Candidate keyword node of the statement, if its shape allows one.
    public static Optional<SyntaxNode> locate(SyntaxNode statement) {
        return switch (statement.kind()) {
            case COMPOUND_STATEMENT -> statement.firstSignificantChild();
            case STATEMENT -> statement.lastSignificantChild()
                                       .flatMap(LoopEntryPointLocator::skipTerminator)
                                       .flatMap(LoopEntryPointLocator::keywordBeforeTail);
            default -> Optional.empty();
        };
    }

    /// A bare word spelled exactly `for` or `foreach`.
    public static boolean isLoopKeyword(SyntaxNode node) {
        return node.kind() == NodeKind.WORD && LOOP_KEYWORDS.contains(node.content());
    }

    /// Element after the keyword, stepping over a `my $var` binding.
    public static Optional<SyntaxNode> iterationSource(SyntaxNode keyword) {
        return keyword.nextSignificantSibling()
                      .flatMap(LoopEntryPointLocator::skipBinding);
    }

    private static Optional<SyntaxNode> skipBinding(SyntaxNode item) {
        if (!item.is(NodeKind.WORD, BINDING)) {
            return Optional.of(item);
        }
        return item.nextSignificantSibling()
                   .filter(variable -> variable.is(NodeKind.SYMBOL))
                   .flatMap(SyntaxNode::nextSignificantSibling);
    }

    private static Optional<SyntaxNode> skipTerminator(SyntaxNode last) {
        return last.is(NodeKind.STRUCTURE)
               ? last.previousSignificantSibling()
               : Optional.of(last);
    }

    private static Optional<SyntaxNode> keywordBeforeTail(SyntaxNode tail) {
        if (tail.is(NodeKind.LIST) || tail.is(NodeKind.READLINE)) {
            return tail.previousSignificantSibling();
        }
        if (tail.is(NodeKind.OPERATOR, GREATER_THAN)) {
            return tail.previousSignificantSibling()
                       .flatMap(LoopEntryPointLocator::skipHandle)
                       .filter(node -> node.is(NodeKind.OPERATOR, LESS_THAN))
                       .flatMap(SyntaxNode::previousSignificantSibling);
        }
        return Optional.empty();
    }

    // Inside a mis-parsed readline: `<`, optional handle word or symbol, `>`
    private static Optional<SyntaxNode> skipHandle(SyntaxNode node) {
        return node.is(NodeKind.WORD) || node.is(NodeKind.SYMBOL)
               ? node.previousSignificantSibling()
               : Optional.of(node);
    }
}
