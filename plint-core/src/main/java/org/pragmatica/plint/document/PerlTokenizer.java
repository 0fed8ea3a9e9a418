package org.pragmatica.plint.document;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/// Lossless tokenizer for Perl source.
///
/// Perl cannot be tokenized without knowing whether an operator or a term comes
/// next (`<` may start a readline or be a comparison, `/` may start a regex or
/// divide). The tokenizer tracks that from the previous significant token, the
/// same way PPI does, and inherits the same blind spots: `< $fh >` with inner
/// whitespace comes out as two operators around a symbol.
public final class PerlTokenizer {
    private static final Set<String> WORD_OPERATORS = Set.of("lt", "gt", "le", "ge", "eq", "ne", "cmp",
                                                             "and", "or", "not", "xor");
    private static final Set<String> QUOTE_WORDS = Set.of("q", "qq", "qw", "qr", "qx", "m");
    private static final Set<String> SUBSTITUTION_WORDS = Set.of("s", "tr", "y");
    private static final List<String> OPERATORS = List.of("<=>", "**=", "||=", "&&=", "//=", "<<=", ">>=", "...",
                                                          "->", "++", "--", "**", "=~", "!~", "==", "!=", "<=",
                                                          ">=", "&&", "||", "//", "..", "::", "=>", "+=", "-=",
                                                          "*=", "/=", ".=", "%=", "&=", "|=", "^=", "<<",
                                                          ">>", "+", "-", "*", "/", "%", ".", "=", "<", ">", "!",
                                                          "~", "\\", "?", ":", "&", "|", "^", ",")
                                                      .stream()
                                                      .sorted(Comparator.comparingInt(String::length)
                                                                        .reversed())
                                                      .toList();
    private static final String STRUCTURE_CHARS = "()[]{};";
    private static final String PUNCTUATION_VARIABLES = "&`'+!@/\\,;.<>0|?-";
    private static final String READLINE_STOPS = "> \t\r\n<=;";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Heredoc> pendingHeredocs = new ArrayDeque<>();
    private int position;
    private Token lastSignificant;

    private record Heredoc(String terminator, boolean indented) {}

    private PerlTokenizer(String source) {
        this.source = source;
    }

    public static List<Token> tokenize(String source) {
        var tokenizer = new PerlTokenizer(source);
        tokenizer.run();
        return List.copyOf(tokenizer.tokens);
    }

    private void run() {
        while (position < source.length()) {
            next();
        }
    }

    private void next() {
        char c = peek(0);
        if (isWhitespace(c)) {
            readWhitespace();
        } else if (c == '#') {
            emit(NodeKind.COMMENT, untilEndOfLine(position));
        } else if (c == '=' && atLineStart() && Character.isLetter(peek(1))) {
            readPod();
        } else if (isWordStart(c)) {
            readWord();
        } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)) && termExpected())) {
            readNumber();
        } else if (c == '$') {
            readScalarSigil();
        } else if (c == '@') {
            readArraySigil();
        } else if ((c == '%' || c == '&' || c == '*') && termExpected() && startsVariable(peek(1))) {
            readSigiled(1);
        } else if (c == '\'' || c == '"' || c == '`') {
            emit(NodeKind.QUOTE, delimited(position, c, c));
        } else if (c == '/' && termExpected()) {
            emit(NodeKind.QUOTE, withModifiers(delimited(position, '/', '/')));
        } else if (c == '<' && termExpected() && readHeredocOrReadline()) {
            return;
        } else if (STRUCTURE_CHARS.indexOf(c) >= 0) {
            emit(NodeKind.STRUCTURE, String.valueOf(c));
        } else {
            readOperator();
        }
    }

    private void readWhitespace() {
        int end = position;
        while (end < source.length() && isWhitespace(source.charAt(end))) {
            char c = source.charAt(end++);
            if (c == '\n' && !pendingHeredocs.isEmpty()) {
                break;
            }
        }
        emit(NodeKind.WHITESPACE, source.substring(position, end));
        if (source.charAt(end - 1) == '\n') {
            readHeredocBodies();
        }
    }

    private void readHeredocBodies() {
        while (!pendingHeredocs.isEmpty() && position < source.length()) {
            var heredoc = pendingHeredocs.removeFirst();
            int end = position;
            while (end < source.length()) {
                var line = untilEndOfLine(end);
                end += line.length();
                if (end < source.length()) {
                    end++;
                }
                var candidate = heredoc.indented()
                                ? line.strip()
                                : line;
                if (candidate.equals(heredoc.terminator())) {
                    break;
                }
            }
            emit(NodeKind.HEREDOC_BODY, source.substring(position, end));
        }
        pendingHeredocs.clear();
    }

    private void readPod() {
        int end = position;
        while (end < source.length()) {
            var line = untilEndOfLine(end);
            end += line.length();
            if (end < source.length()) {
                end++;
            }
            if (line.startsWith("=cut")) {
                break;
            }
        }
        emit(NodeKind.POD, source.substring(position, end));
    }

    private void readWord() {
        int end = position;
        while (end < source.length()) {
            if (isWordChar(source.charAt(end))) {
                end++;
            } else if (source.startsWith("::", end) && end + 2 < source.length() && isWordStart(source.charAt(end + 2))) {
                end += 2;
            } else {
                break;
            }
        }
        var word = source.substring(position, end);
        var following = end < source.length()
                        ? source.charAt(end)
                        : '\0';
        if (isFatCommaAt(end) || afterArrow()) {
            emit(NodeKind.WORD, word);
        } else if ((word.equals("__END__") || word.equals("__DATA__")) && startsStatement()) {
            emit(NodeKind.END_SECTION, source.substring(position));
        } else if (following == ':' && peekAt(end + 1) != ':' && startsStatement() && isLabelName(word)) {
            emit(NodeKind.LABEL, word + ":");
        } else if (QUOTE_WORDS.contains(word) && isQuoteDelimiter(following)) {
            emit(NodeKind.QUOTE, withModifiers(word + delimited(end, following, closingFor(following))));
        } else if (SUBSTITUTION_WORDS.contains(word) && isQuoteDelimiter(following)) {
            emit(NodeKind.QUOTE, withModifiers(word + substitution(end, following)));
        } else if (WORD_OPERATORS.contains(word) || (word.equals("x") && !termExpected())) {
            emit(NodeKind.OPERATOR, word);
        } else {
            emit(NodeKind.WORD, word);
        }
    }

    private void readNumber() {
        int end = position;
        if (source.startsWith("0x", end) || source.startsWith("0b", end)) {
            end += 2;
            while (end < source.length() && (Character.isLetterOrDigit(source.charAt(end)) || source.charAt(end) == '_')) {
                end++;
            }
            emit(NodeKind.NUMBER, source.substring(position, end));
            return;
        }
        end = digits(end);
        if (peekAt(end) == '.' && peekAt(end + 1) != '.') {
            end = digits(end + 1);
        }
        if ((peekAt(end) == 'e' || peekAt(end) == 'E')
            && (Character.isDigit(peekAt(end + 1))
                || ((peekAt(end + 1) == '-' || peekAt(end + 1) == '+') && Character.isDigit(peekAt(end + 2))))) {
            end = digits(end + 2);
        }
        emit(NodeKind.NUMBER, source.substring(position, end));
    }

    private int digits(int from) {
        int end = from;
        while (end < source.length() && (Character.isDigit(source.charAt(end)) || source.charAt(end) == '_')) {
            end++;
        }
        return end;
    }

    private void readScalarSigil() {
        char next = peek(1);
        if (next == '#') {
            if (peek(2) == '{' || peek(2) == '$') {
                emit(NodeKind.CAST, "$#");
            } else if (isWordStart(peek(2))) {
                readSigiled(2);
            } else {
                emit(NodeKind.SYMBOL, "$#");
            }
        } else if (startsVariable(next) && next != '{' && next != '$') {
            readSigiled(1);
        } else if (next == '$') {
            if (isWordStart(peek(2)) || peek(2) == '{' || peek(2) == '$' || peek(2) == ':') {
                emit(NodeKind.CAST, "$");
            } else {
                emit(NodeKind.SYMBOL, "$$");
            }
        } else if (Character.isDigit(next)) {
            emit(NodeKind.SYMBOL, "$" + source.substring(position + 1, digits(position + 1)));
        } else if (next == '^' && Character.isUpperCase(peek(2))) {
            emit(NodeKind.SYMBOL, source.substring(position, position + 3));
        } else if (next != '\0' && PUNCTUATION_VARIABLES.indexOf(next) >= 0) {
            emit(NodeKind.SYMBOL, source.substring(position, position + 2));
        } else {
            emit(NodeKind.CAST, "$");
        }
    }

    private void readArraySigil() {
        char next = peek(1);
        if (next == '{' || next == '$') {
            emit(NodeKind.CAST, "@");
        } else if (startsVariable(next)) {
            readSigiled(1);
        } else if (next == '-' || next == '+') {
            emit(NodeKind.SYMBOL, source.substring(position, position + 2));
        } else {
            emit(NodeKind.UNKNOWN, "@");
        }
    }

    private void readSigiled(int sigilLength) {
        char next = peek(sigilLength);
        if (next == '{' || next == '$') {
            emit(NodeKind.CAST, source.substring(position, position + sigilLength));
            return;
        }
        int end = position + sigilLength;
        while (end < source.length()) {
            if (isWordChar(source.charAt(end))) {
                end++;
            } else if (source.startsWith("::", end)) {
                end += 2;
            } else if (source.charAt(end) == '\'' && end + 1 < source.length() && isWordStart(source.charAt(end + 1))
                       && end > position + sigilLength) {
                // old-style package separator, $main'var
                end++;
            } else {
                break;
            }
        }
        emit(NodeKind.SYMBOL, source.substring(position, end));
    }

    /// Either emits a here-doc marker or readline literal and returns true, or leaves `<` to the operator reader.
    private boolean readHeredocOrReadline() {
        if (source.startsWith("<<", position)) {
            return readHeredocMarker();
        }
        int end = position + 1;
        while (end < source.length() && READLINE_STOPS.indexOf(source.charAt(end)) < 0) {
            end++;
        }
        if (peekAt(end) != '>' || peek(1) == '=') {
            return false;
        }
        emit(NodeKind.READLINE, source.substring(position, end + 1));
        return true;
    }

    private boolean readHeredocMarker() {
        int start = position + 2;
        boolean indented = peekAt(start) == '~';
        if (indented) {
            start++;
        }
        char quote = peekAt(start);
        String terminator;
        int end;
        if (quote == '"' || quote == '\'') {
            int close = source.indexOf(quote, start + 1);
            if (close < 0) {
                return false;
            }
            terminator = source.substring(start + 1, close);
            end = close + 1;
        } else if (isWordStart(quote)) {
            end = start;
            while (end < source.length() && isWordChar(source.charAt(end))) {
                end++;
            }
            terminator = source.substring(start, end);
        } else {
            return false;
        }
        pendingHeredocs.addLast(new Heredoc(terminator, indented));
        emit(NodeKind.HEREDOC, source.substring(position, end));
        return true;
    }

    private void readOperator() {
        for (var operator : OPERATORS) {
            if (source.startsWith(operator, position)) {
                emit(NodeKind.OPERATOR, operator);
                return;
            }
        }
        emit(NodeKind.UNKNOWN, String.valueOf(peek(0)));
    }

    /// Text from `start` up to and including the closing delimiter, honoring nesting and backslash escapes.
    private String delimited(int start, char open, char close) {
        int depth = 0;
        int end = start + 1;
        while (end < source.length()) {
            char c = source.charAt(end);
            if (c == '\\') {
                end += 2;
                continue;
            }
            if (c == close && depth == 0) {
                return source.substring(start, end + 1);
            }
            if (open != close) {
                if (c == open) {
                    depth++;
                } else if (c == close) {
                    depth--;
                }
            }
            end++;
        }
        return source.substring(start);
    }

    private String substitution(int start, char open) {
        char close = closingFor(open);
        var first = delimited(start, open, close);
        int end = start + first.length();
        if (open == close) {
            // s/a/b/: the closing delimiter of the pattern opens the replacement
            var second = delimited(end - 1, open, close);
            return first + second.substring(1);
        }
        int whitespaceEnd = end;
        while (whitespaceEnd < source.length() && isWhitespace(source.charAt(whitespaceEnd))) {
            whitespaceEnd++;
        }
        if (whitespaceEnd >= source.length()) {
            return source.substring(start);
        }
        char secondOpen = source.charAt(whitespaceEnd);
        var second = delimited(whitespaceEnd, secondOpen, closingFor(secondOpen));
        return source.substring(start, whitespaceEnd) + second;
    }

    private String withModifiers(String quoted) {
        int end = position + quoted.length();
        while (end < source.length() && Character.isLetter(source.charAt(end))) {
            end++;
        }
        return source.substring(position, end);
    }

    private void emit(NodeKind kind, String text) {
        var token = new Token(kind, text);
        tokens.add(token);
        position += text.length();
        if (token.isSignificant()) {
            lastSignificant = token;
        }
    }

    /// True when the grammar expects a term (operand) rather than an operator at this point.
    private boolean termExpected() {
        if (lastSignificant == null) {
            return true;
        }
        var text = lastSignificant.text();
        return switch (lastSignificant.kind()) {
            case OPERATOR -> !text.equals("++") && !text.equals("--");
            case STRUCTURE -> text.equals("(") || text.equals("[") || text.equals("{") || text.equals(";");
            case WORD, LABEL, CAST -> true;
            default -> false;
        };
    }

    private boolean startsStatement() {
        return lastSignificant == null
               || lastSignificant.is(NodeKind.STRUCTURE, ";")
               || lastSignificant.is(NodeKind.STRUCTURE, "{")
               || lastSignificant.is(NodeKind.STRUCTURE, "}");
    }

    private boolean afterArrow() {
        return lastSignificant != null && lastSignificant.is(NodeKind.OPERATOR, "->");
    }

    private boolean atLineStart() {
        return position == 0 || source.charAt(position - 1) == '\n';
    }

    private boolean isFatCommaAt(int index) {
        int end = index;
        while (end < source.length() && (source.charAt(end) == ' ' || source.charAt(end) == '\t')) {
            end++;
        }
        return source.startsWith("=>", end);
    }

    private String untilEndOfLine(int from) {
        int end = source.indexOf('\n', from);
        return end < 0
               ? source.substring(from)
               : source.substring(from, end);
    }

    private char peek(int offset) {
        return peekAt(position + offset);
    }

    private char peekAt(int index) {
        return index < source.length()
               ? source.charAt(index)
               : '\0';
    }

    private static boolean isLabelName(String word) {
        return word.chars()
                   .allMatch(c -> Character.isUpperCase(c) || Character.isDigit(c) || c == '_')
               && !word.equals("_");
    }

    private static boolean isQuoteDelimiter(char c) {
        return c != '\0' && !isWordChar(c) && !isWhitespace(c) && "=,;)]}>".indexOf(c) < 0;
    }

    private static boolean startsVariable(char c) {
        return isWordStart(c) || c == '{' || c == '$' || c == ':';
    }

    private static char closingFor(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            case '<' -> '>';
            default -> open;
        };
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
