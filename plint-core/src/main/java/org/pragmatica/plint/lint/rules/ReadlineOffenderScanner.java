package org.pragmatica.plint.lint.rules;

import org.pragmatica.plint.document.NodeKind;
import org.pragmatica.plint.document.SyntaxNode;

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/// Finds every element under a loop's iteration source that reads lines from a handle.
///
/// The same angle-bracket syntax also means file glob, so a readline literal only
/// counts when it holds a bare handle name, a scalar, or nothing: `<FH>`, `<$fh>`,
/// `<>`. Anything else, such as `<*.txt>`, is left alone.
public final class ReadlineOffenderScanner {
    private static final Pattern HANDLE_READLINE = Pattern.compile("\\A<\\$?\\w*>\\z", Pattern.UNICODE_CHARACTER_CLASS);
    private static final String LESS_THAN = "<";
    private static final String GREATER_THAN = ">";

    private ReadlineOffenderScanner() {}

    /// Offending elements at or below `node`, in source order.
    public static Stream<SyntaxNode> scan(SyntaxNode node) {
        if (node.kind()
                .isNode()) {
            return node.significantChildren()
                       .stream()
                       .flatMap(ReadlineOffenderScanner::scan);
        }
        return switch (node.kind()) {
            case READLINE -> isHandleReadline(node)
                             ? Stream.of(node)
                             : Stream.empty();
            case OPERATOR -> isMisparsedReadline(node)
                             ? Stream.of(node)
                             : Stream.empty();
            default -> Stream.empty();
        };
    }

    static boolean isHandleReadline(SyntaxNode readline) {
        return HANDLE_READLINE.matcher(readline.content())
                              .matches();
    }

    /// `<` followed by an optional word or symbol and then `>`.
    static boolean isMisparsedReadline(SyntaxNode node) {
        if (!node.is(NodeKind.OPERATOR, LESS_THAN)) {
            return false;
        }
        return node.nextSignificantSibling()
                   .flatMap(ReadlineOffenderScanner::skipHandle)
                   .filter(next -> next.is(NodeKind.OPERATOR, GREATER_THAN))
                   .isPresent();
    }

    private static Optional<SyntaxNode> skipHandle(SyntaxNode node) {
        return node.is(NodeKind.WORD) || node.is(NodeKind.SYMBOL)
               ? node.nextSignificantSibling()
               : Optional.of(node);
    }
}
