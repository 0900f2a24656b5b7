package work.lcod.scriptgen.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits script text into logical lines of tokens. Handles indentation, comments, implicit line joining inside
 * brackets, backslash continuations and (possibly multi-line) string literals.
 */
final class Tokenizer {
    private static final String[] OPERATORS = {
        "**=", "//=", ">>=", "<<=", "...",
        "->", ":=", "**", "//", "==", "!=", "<=", ">=", "<<", ">>",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
        "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
        "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "="
    };

    enum Kind { NAME, NUMBER, STRING, OP }

    record Token(Kind kind, String text, int start, int end, int line) {
        boolean isOp(String op) {
            return kind == Kind.OP && text.equals(op);
        }

        boolean isName(String name) {
            return kind == Kind.NAME && text.equals(name);
        }
    }

    /**
     * One logical line. Offsets delimit the physical lines it spans: {@code startOffset} is the beginning of its
     * first physical line (indentation included), {@code endOffset} the end of its last one (newline excluded).
     */
    record LogicalLine(int indent, int firstLine, int lastLine, int startOffset, int endOffset, List<Token> tokens) {
        Token first() {
            return tokens.get(0);
        }
    }

    private final String src;
    private final int length;
    private int pos;
    private int line = 1;

    private Tokenizer(String src) {
        this.src = src;
        this.length = src.length();
    }

    static List<LogicalLine> tokenize(String source) {
        return new Tokenizer(source == null ? "" : source).run();
    }

    private List<LogicalLine> run() {
        var lines = new ArrayList<LogicalLine>();
        while (pos < length) {
            int lineStart = pos;
            int indent = 0;
            while (pos < length) {
                char c = src.charAt(pos);
                if (c == ' ') {
                    indent++;
                } else if (c == '\t') {
                    indent += 8 - (indent % 8);
                } else if (c == '\f') {
                    indent = 0;
                } else {
                    break;
                }
                pos++;
            }
            if (pos >= length) {
                break;
            }
            char c = src.charAt(pos);
            if (c == '#') {
                skipComment();
                consumeNewline();
                continue;
            }
            if (c == '\n' || c == '\r') {
                consumeNewline();
                continue;
            }
            var logical = readLogicalLine(indent, lineStart);
            if (!logical.tokens().isEmpty()) {
                lines.add(logical);
            }
        }
        return lines;
    }

    private LogicalLine readLogicalLine(int indent, int lineStart) {
        var tokens = new ArrayList<Token>();
        int depth = 0;
        int firstLine = line;
        while (true) {
            if (pos >= length) {
                if (depth > 0) {
                    throw new CodeParseException("unexpected end of input inside brackets", line);
                }
                return new LogicalLine(indent, firstLine, line, lineStart, length, tokens);
            }
            char c = src.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
                continue;
            }
            if (c == '#') {
                skipComment();
                continue;
            }
            if (c == '\\' && pos + 1 < length && (src.charAt(pos + 1) == '\n' || src.charAt(pos + 1) == '\r')) {
                pos++;
                consumeNewline();
                continue;
            }
            if (c == '\n' || c == '\r') {
                int newlineAt = pos;
                int lastLine = line;
                consumeNewline();
                if (depth > 0) {
                    continue;
                }
                return new LogicalLine(indent, firstLine, lastLine, lineStart, newlineAt, tokens);
            }
            if (isIdentifierStart(c)) {
                int start = pos;
                int end = pos + 1;
                while (end < length && isIdentifierPart(src.charAt(end))) {
                    end++;
                }
                if (end < length && isQuote(src.charAt(end)) && isStringPrefix(src.substring(start, end))) {
                    tokens.add(readString(start, end));
                } else {
                    tokens.add(new Token(Kind.NAME, src.substring(start, end), start, end, line));
                    pos = end;
                }
                continue;
            }
            if (isQuote(c)) {
                tokens.add(readString(pos, pos));
                continue;
            }
            if (Character.isDigit(c) || (c == '.' && pos + 1 < length && Character.isDigit(src.charAt(pos + 1)))) {
                tokens.add(readNumber());
                continue;
            }
            String op = matchOperator();
            if (op == null) {
                throw new CodeParseException("unexpected character '" + c + "'", line);
            }
            if ("([{".contains(op)) {
                depth++;
            } else if (")]}".contains(op)) {
                depth--;
                if (depth < 0) {
                    throw new CodeParseException("unmatched '" + op + "'", line);
                }
            }
            tokens.add(new Token(Kind.OP, op, pos, pos + op.length(), line));
            pos += op.length();
        }
    }

    private Token readString(int start, int quoteAt) {
        int startLine = line;
        char quote = src.charAt(quoteAt);
        boolean triple = src.startsWith(String.valueOf(quote).repeat(3), quoteAt);
        int i = quoteAt + (triple ? 3 : 1);
        while (true) {
            if (i >= length) {
                throw new CodeParseException("unterminated string literal", startLine);
            }
            char ch = src.charAt(i);
            if (ch == '\\') {
                if (i + 1 < length && src.charAt(i + 1) == '\r' && i + 2 < length && src.charAt(i + 2) == '\n') {
                    line++;
                    i += 3;
                    continue;
                }
                if (i + 1 < length && (src.charAt(i + 1) == '\n' || src.charAt(i + 1) == '\r')) {
                    line++;
                }
                i += 2;
                continue;
            }
            if (triple) {
                if (src.startsWith(String.valueOf(quote).repeat(3), i)) {
                    i += 3;
                    break;
                }
                if (ch == '\n') {
                    line++;
                }
                i++;
            } else {
                if (ch == quote) {
                    i++;
                    break;
                }
                if (ch == '\n' || ch == '\r') {
                    throw new CodeParseException("unterminated string literal", startLine);
                }
                i++;
            }
        }
        pos = i;
        return new Token(Kind.STRING, src.substring(start, i), start, i, startLine);
    }

    private Token readNumber() {
        int start = pos;
        int i = pos;
        if (src.charAt(i) == '0' && i + 1 < length && "xXoObB".indexOf(src.charAt(i + 1)) >= 0) {
            i += 2;
            while (i < length && (Character.isLetterOrDigit(src.charAt(i)) || src.charAt(i) == '_')) {
                i++;
            }
        } else {
            i = skipDigits(i);
            if (i < length && src.charAt(i) == '.') {
                i = skipDigits(i + 1);
            }
            if (i < length && (src.charAt(i) == 'e' || src.charAt(i) == 'E')) {
                int exp = i + 1;
                if (exp < length && (src.charAt(exp) == '+' || src.charAt(exp) == '-')) {
                    exp++;
                }
                if (exp < length && Character.isDigit(src.charAt(exp))) {
                    i = skipDigits(exp);
                }
            }
            if (i < length && (src.charAt(i) == 'j' || src.charAt(i) == 'J')) {
                i++;
            }
        }
        pos = i;
        return new Token(Kind.NUMBER, src.substring(start, i), start, i, line);
    }

    private int skipDigits(int from) {
        int i = from;
        while (i < length && (Character.isDigit(src.charAt(i)) || src.charAt(i) == '_')) {
            i++;
        }
        return i;
    }

    private String matchOperator() {
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                return op;
            }
        }
        return null;
    }

    private void skipComment() {
        while (pos < length && src.charAt(pos) != '\n' && src.charAt(pos) != '\r') {
            pos++;
        }
    }

    private void consumeNewline() {
        if (pos < length && src.charAt(pos) == '\r') {
            pos++;
        }
        if (pos < length && src.charAt(pos) == '\n') {
            pos++;
        }
        line++;
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    static boolean isStringPrefix(String candidate) {
        if (candidate.length() > 2) {
            return false;
        }
        String lower = candidate.toLowerCase(java.util.Locale.ROOT);
        return switch (lower) {
            case "r", "u", "b", "f", "br", "rb", "fr", "rf" -> true;
            default -> false;
        };
    }

    static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
