package work.lcod.scriptgen.ir;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import work.lcod.scriptgen.ir.Expr.Attribute;
import work.lcod.scriptgen.ir.Expr.BinaryOp;
import work.lcod.scriptgen.ir.Expr.BoolLiteral;
import work.lcod.scriptgen.ir.Expr.Call;
import work.lcod.scriptgen.ir.Expr.DictEntry;
import work.lcod.scriptgen.ir.Expr.DictExpr;
import work.lcod.scriptgen.ir.Expr.IfExpr;
import work.lcod.scriptgen.ir.Expr.Keyword;
import work.lcod.scriptgen.ir.Expr.ListExpr;
import work.lcod.scriptgen.ir.Expr.Name;
import work.lcod.scriptgen.ir.Expr.NoneLiteral;
import work.lcod.scriptgen.ir.Expr.NumberLiteral;
import work.lcod.scriptgen.ir.Expr.OpaqueExpr;
import work.lcod.scriptgen.ir.Expr.Slice;
import work.lcod.scriptgen.ir.Expr.Starred;
import work.lcod.scriptgen.ir.Expr.StringLiteral;
import work.lcod.scriptgen.ir.Expr.Subscript;
import work.lcod.scriptgen.ir.Expr.TupleExpr;
import work.lcod.scriptgen.ir.Expr.UnaryOp;
import work.lcod.scriptgen.ir.Tokenizer.Kind;
import work.lcod.scriptgen.ir.Tokenizer.Token;

/**
 * Recursive-descent parser for expressions over a token range of one logical line.
 */
final class ExpressionParser {
    private static final Set<String> RESERVED = Set.of(
        "and", "as", "assert", "break", "class", "continue", "def", "del", "elif", "else", "except",
        "finally", "for", "from", "global", "if", "import", "in", "is", "nonlocal", "or", "pass",
        "raise", "return", "try", "while", "with", "yield"
    );
    private static final Set<String> COMPARISONS = Set.of("<", ">", "==", ">=", "<=", "!=");

    private final String source;
    private final List<Token> tokens;
    private final int end;
    private int pos;

    private ExpressionParser(String source, List<Token> tokens, int from, int to) {
        this.source = source;
        this.tokens = tokens;
        this.pos = from;
        this.end = to;
    }

    /** Parses {@code tokens[from, to)} as an expression list; several comma-separated items form a tuple. */
    static Expr parseList(String source, List<Token> tokens, int from, int to) {
        var parser = new ExpressionParser(source, tokens, from, to);
        if (from >= to) {
            throw new CodeParseException("expected an expression", lineOf(tokens, from));
        }
        Expr result = parser.testList();
        parser.expectEnd();
        return result;
    }

    /** Parses {@code tokens[from, to)} as exactly one expression. */
    static Expr parseSingle(String source, List<Token> tokens, int from, int to) {
        var parser = new ExpressionParser(source, tokens, from, to);
        if (from >= to) {
            throw new CodeParseException("expected an expression", lineOf(tokens, from));
        }
        Expr result = parser.test();
        parser.expectEnd();
        return result;
    }

    private static int lineOf(List<Token> tokens, int index) {
        if (tokens.isEmpty()) {
            return 0;
        }
        return tokens.get(Math.min(index, tokens.size() - 1)).line();
    }

    private void expectEnd() {
        if (pos < end) {
            throw error("unexpected '" + tokens.get(pos).text() + "'");
        }
    }

    private Expr testList() {
        Expr first = testOrStar();
        if (!atOp(",")) {
            return first;
        }
        var elements = new ArrayList<Expr>();
        elements.add(first);
        while (atOp(",")) {
            pos++;
            if (atEnd() || atClosing()) {
                break;
            }
            elements.add(testOrStar());
        }
        return new TupleExpr(elements);
    }

    private Expr testOrStar() {
        if (atOp("*")) {
            pos++;
            return new Starred(bitOr());
        }
        return test();
    }

    private Expr test() {
        if (atName("lambda")) {
            return lambda();
        }
        Expr body = orTest();
        if (atName("if")) {
            pos++;
            Expr condition = orTest();
            expectName("else");
            Expr orElse = test();
            return new IfExpr(condition, body, orElse);
        }
        if (atOp(":=")) {
            throw error("assignment expressions are not supported");
        }
        return body;
    }

    private Expr orTest() {
        Expr left = andTest();
        while (atName("or")) {
            pos++;
            left = new BinaryOp("or", left, andTest());
        }
        return left;
    }

    private Expr andTest() {
        Expr left = notTest();
        while (atName("and")) {
            pos++;
            left = new BinaryOp("and", left, notTest());
        }
        return left;
    }

    private Expr notTest() {
        if (atName("not")) {
            pos++;
            return new UnaryOp("not", notTest());
        }
        return comparison();
    }

    private Expr comparison() {
        Expr left = bitOr();
        while (true) {
            String op = comparisonOperator();
            if (op == null) {
                return left;
            }
            left = new BinaryOp(op, left, bitOr());
        }
    }

    private String comparisonOperator() {
        if (atEnd()) {
            return null;
        }
        Token token = tokens.get(pos);
        if (token.kind() == Kind.OP && COMPARISONS.contains(token.text())) {
            pos++;
            return token.text();
        }
        if (token.isName("in")) {
            pos++;
            return "in";
        }
        if (token.isName("not") && pos + 1 < end && tokens.get(pos + 1).isName("in")) {
            pos += 2;
            return "not in";
        }
        if (token.isName("is")) {
            pos++;
            if (atName("not")) {
                pos++;
                return "is not";
            }
            return "is";
        }
        return null;
    }

    private Expr bitOr() {
        Expr left = bitXor();
        while (atOp("|")) {
            pos++;
            left = new BinaryOp("|", left, bitXor());
        }
        return left;
    }

    private Expr bitXor() {
        Expr left = bitAnd();
        while (atOp("^")) {
            pos++;
            left = new BinaryOp("^", left, bitAnd());
        }
        return left;
    }

    private Expr bitAnd() {
        Expr left = shift();
        while (atOp("&")) {
            pos++;
            left = new BinaryOp("&", left, shift());
        }
        return left;
    }

    private Expr shift() {
        Expr left = arith();
        while (atOp("<<") || atOp(">>")) {
            String op = tokens.get(pos++).text();
            left = new BinaryOp(op, left, arith());
        }
        return left;
    }

    private Expr arith() {
        Expr left = term();
        while (atOp("+") || atOp("-")) {
            String op = tokens.get(pos++).text();
            left = new BinaryOp(op, left, term());
        }
        return left;
    }

    private Expr term() {
        Expr left = factor();
        while (atOp("*") || atOp("/") || atOp("//") || atOp("%") || atOp("@")) {
            String op = tokens.get(pos++).text();
            left = new BinaryOp(op, left, factor());
        }
        return left;
    }

    private Expr factor() {
        if (atOp("+") || atOp("-") || atOp("~")) {
            String op = tokens.get(pos++).text();
            return new UnaryOp(op, factor());
        }
        return power();
    }

    private Expr power() {
        if (atName("await")) {
            int start = pos++;
            primary();
            return new OpaqueExpr(text(start, pos));
        }
        Expr base = primary();
        if (atOp("**")) {
            pos++;
            return new BinaryOp("**", base, factor());
        }
        return base;
    }

    private Expr primary() {
        Expr value = atom();
        while (!atEnd()) {
            if (atOp("(")) {
                pos++;
                value = callArguments(value);
            } else if (atOp("[")) {
                pos++;
                Expr index = subscriptList();
                expectOp("]");
                value = new Subscript(value, index);
            } else if (atOp(".")) {
                pos++;
                Token attr = next();
                if (attr.kind() != Kind.NAME) {
                    throw error("expected an attribute name", attr);
                }
                value = new Attribute(value, attr.text());
            } else {
                break;
            }
        }
        return value;
    }

    private Expr callArguments(Expr func) {
        var args = new ArrayList<Expr>();
        var keywords = new ArrayList<Keyword>();
        while (!atOp(")")) {
            int argStart = pos;
            if (atOp("*")) {
                pos++;
                args.add(new Starred(test()));
            } else if (atOp("**")) {
                pos++;
                keywords.add(new Keyword(null, test()));
            } else if (peekKind(Kind.NAME) && pos + 1 < end && tokens.get(pos + 1).isOp("=")) {
                String name = tokens.get(pos).text();
                pos += 2;
                keywords.add(new Keyword(name, test()));
            } else {
                Expr arg = test();
                if (atName("for") || atName("async")) {
                    int stop = argumentEnd(argStart);
                    arg = new OpaqueExpr(text(argStart, stop));
                    pos = stop;
                }
                args.add(arg);
            }
            if (atOp(",")) {
                pos++;
            } else if (!atOp(")")) {
                throw error("expected ',' or ')'");
            }
        }
        pos++;
        return new Call(func, args, keywords);
    }

    private Expr subscriptList() {
        Expr first = sliceItem();
        if (!atOp(",")) {
            return first;
        }
        var elements = new ArrayList<Expr>();
        elements.add(first);
        while (atOp(",")) {
            pos++;
            if (atOp("]")) {
                break;
            }
            elements.add(sliceItem());
        }
        return new TupleExpr(elements);
    }

    private Expr sliceItem() {
        Expr lower = null;
        if (!atOp(":")) {
            lower = test();
            if (!atOp(":")) {
                return lower;
            }
        }
        pos++;
        Expr upper = atSliceBoundary() ? null : test();
        Expr step = null;
        if (atOp(":")) {
            pos++;
            step = atSliceBoundary() ? null : test();
        }
        return new Slice(lower, upper, step);
    }

    private boolean atSliceBoundary() {
        return atOp(":") || atOp("]") || atOp(",");
    }

    private Expr atom() {
        Token token = next();
        switch (token.kind()) {
            case NAME -> {
                return switch (token.text()) {
                    case "None" -> NoneLiteral.INSTANCE;
                    case "True" -> BoolLiteral.TRUE;
                    case "False" -> BoolLiteral.FALSE;
                    default -> {
                        if (RESERVED.contains(token.text()) || token.text().equals("not")
                            || token.text().equals("lambda")) {
                            throw error("unexpected keyword '" + token.text() + "'", token);
                        }
                        yield new Name(token.text());
                    }
                };
            }
            case NUMBER -> {
                return number(token);
            }
            case STRING -> {
                return strings(token);
            }
            default -> {
                return bracketAtom(token);
            }
        }
    }

    private Expr bracketAtom(Token open) {
        int openIndex = pos - 1;
        switch (open.text()) {
            case "(" -> {
                if (atOp(")")) {
                    pos++;
                    return new TupleExpr(List.of());
                }
                Expr first = testOrStar();
                if (atName("for") || atName("async")) {
                    return opaqueUntilClose(openIndex);
                }
                if (atOp(")")) {
                    pos++;
                    return first;
                }
                var elements = new ArrayList<Expr>();
                elements.add(first);
                while (atOp(",")) {
                    pos++;
                    if (atOp(")")) {
                        break;
                    }
                    elements.add(testOrStar());
                }
                expectOp(")");
                return new TupleExpr(elements);
            }
            case "[" -> {
                var elements = new ArrayList<Expr>();
                while (!atOp("]")) {
                    elements.add(testOrStar());
                    if (elements.size() == 1 && (atName("for") || atName("async"))) {
                        return opaqueUntilClose(openIndex);
                    }
                    if (atOp(",")) {
                        pos++;
                    } else if (!atOp("]")) {
                        throw error("expected ',' or ']'");
                    }
                }
                pos++;
                return new ListExpr(elements);
            }
            case "{" -> {
                return braces(openIndex);
            }
            case "..." -> {
                return new OpaqueExpr("...");
            }
            default -> throw error("unexpected '" + open.text() + "'", open);
        }
    }

    private Expr braces(int openIndex) {
        if (atOp("}")) {
            pos++;
            return new DictExpr(List.of());
        }
        if (atOp("**") || atOp("*")) {
            return opaqueUntilClose(openIndex);
        }
        Expr key = test();
        if (!atOp(":")) {
            // set display or set comprehension
            return opaqueUntilClose(openIndex);
        }
        var entries = new ArrayList<DictEntry>();
        while (true) {
            expectOp(":");
            Expr value = test();
            if (entries.isEmpty() && (atName("for") || atName("async"))) {
                return opaqueUntilClose(openIndex);
            }
            entries.add(new DictEntry(key, value));
            if (atOp(",")) {
                pos++;
            }
            if (atOp("}")) {
                pos++;
                return new DictExpr(entries);
            }
            if (atOp("**")) {
                return opaqueUntilClose(openIndex);
            }
            key = test();
        }
    }

    private Expr lambda() {
        int start = pos;
        int depth = 0;
        while (pos < end) {
            Token token = tokens.get(pos);
            if (token.kind() == Kind.OP) {
                if ("([{".contains(token.text())) {
                    depth++;
                } else if (")]}".contains(token.text())) {
                    if (depth == 0) {
                        break;
                    }
                    depth--;
                } else if (depth == 0 && token.text().equals(",")) {
                    break;
                }
            } else if (depth == 0 && (token.isName("for") || token.isName("async")) && pos > start) {
                break;
            }
            pos++;
        }
        return new OpaqueExpr(text(start, pos));
    }

    private Expr opaqueUntilClose(int openIndex) {
        int close = matchingClose(openIndex);
        pos = close + 1;
        return new OpaqueExpr(text(openIndex, close + 1));
    }

    /** Index of the first depth-0 ',' or closing bracket at or after {@code from}. */
    private int argumentEnd(int from) {
        int depth = 0;
        for (int i = from; i < end; i++) {
            Token token = tokens.get(i);
            if (token.kind() != Kind.OP) {
                continue;
            }
            if ("([{".contains(token.text())) {
                depth++;
            } else if (")]}".contains(token.text())) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            } else if (depth == 0 && token.text().equals(",")) {
                return i;
            }
        }
        throw error("unbalanced brackets", tokens.get(from));
    }

    /** Index of the bracket closing the one at {@code openIndex}. */
    private int matchingClose(int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < end; i++) {
            Token token = tokens.get(i);
            if (token.kind() != Kind.OP) {
                continue;
            }
            if ("([{".contains(token.text())) {
                depth++;
            } else if (")]}".contains(token.text())) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw error("unbalanced brackets", tokens.get(openIndex));
    }

    private Expr strings(Token first) {
        int startIndex = pos - 1;
        var parts = new ArrayList<Token>();
        parts.add(first);
        while (peekKind(Kind.STRING)) {
            parts.add(next());
        }
        var value = new StringBuilder();
        for (Token part : parts) {
            String prefix = prefixOf(part.text()).toLowerCase(Locale.ROOT);
            if (prefix.contains("f") || prefix.contains("b")) {
                return new OpaqueExpr(text(startIndex, pos));
            }
            value.append(decodeString(part));
        }
        return new StringLiteral(value.toString());
    }

    private static String prefixOf(String text) {
        int i = 0;
        while (i < text.length() && text.charAt(i) != '\'' && text.charAt(i) != '"') {
            i++;
        }
        return text.substring(0, i);
    }

    static String decodeString(Token token) {
        String text = token.text();
        String prefix = prefixOf(text);
        boolean raw = prefix.toLowerCase(Locale.ROOT).contains("r");
        String rest = text.substring(prefix.length());
        int quoteLength = rest.length() >= 6 && (rest.startsWith("'''") || rest.startsWith("\"\"\"")) ? 3 : 1;
        String body = rest.substring(quoteLength, rest.length() - quoteLength);
        return raw ? body : unescape(body, token.line());
    }

    private static String unescape(String body, int line) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        var out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }
            char e = body.charAt(i + 1);
            i += 2;
            switch (e) {
                case '\n' -> { }
                case '\r' -> {
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                case '"' -> out.append('"');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'v' -> out.append('\u000B');
                case 'x' -> i = appendCodePoint(out, body, i, 2, line);
                case 'u' -> i = appendCodePoint(out, body, i, 4, line);
                case 'U' -> i = appendCodePoint(out, body, i, 8, line);
                default -> {
                    if (e >= '0' && e <= '7') {
                        int start = i - 1;
                        int stop = start;
                        while (stop < body.length() && stop < start + 3 && body.charAt(stop) >= '0' && body.charAt(stop) <= '7') {
                            stop++;
                        }
                        out.appendCodePoint(Integer.parseInt(body.substring(start, stop), 8));
                        i = stop;
                    } else {
                        out.append('\\').append(e);
                    }
                }
            }
        }
        return out.toString();
    }

    private static int appendCodePoint(StringBuilder out, String body, int from, int digits, int line) {
        if (from + digits > body.length()) {
            throw new CodeParseException("truncated escape sequence", line);
        }
        try {
            out.appendCodePoint(Integer.parseInt(body.substring(from, from + digits), 16));
        } catch (IllegalArgumentException e) {
            throw new CodeParseException("invalid escape sequence", line);
        }
        return from + digits;
    }

    static Expr number(Token token) {
        String text = token.text().replace("_", "");
        String lower = text.toLowerCase(Locale.ROOT);
        try {
            if (lower.endsWith("j")) {
                return new OpaqueExpr(token.text());
            }
            if (lower.startsWith("0x")) {
                return integral(new BigInteger(text.substring(2), 16));
            }
            if (lower.startsWith("0o")) {
                return integral(new BigInteger(text.substring(2), 8));
            }
            if (lower.startsWith("0b")) {
                return integral(new BigInteger(text.substring(2), 2));
            }
            if (lower.contains(".") || lower.contains("e")) {
                return new NumberLiteral(Double.parseDouble(text));
            }
            return integral(new BigInteger(text));
        } catch (NumberFormatException e) {
            throw new CodeParseException("invalid number literal '" + token.text() + "'", token.line());
        }
    }

    static NumberLiteral integral(BigInteger value) {
        if (value.bitLength() < 64) {
            return new NumberLiteral(value.longValue());
        }
        return new NumberLiteral(value);
    }

    private String text(int fromIndex, int toIndexExclusive) {
        if (toIndexExclusive <= fromIndex) {
            return "";
        }
        return source.substring(tokens.get(fromIndex).start(), tokens.get(toIndexExclusive - 1).end());
    }

    private Token next() {
        if (pos >= end) {
            throw error("unexpected end of expression");
        }
        return tokens.get(pos++);
    }

    private boolean atEnd() {
        return pos >= end;
    }

    private boolean atClosing() {
        return atOp(")") || atOp("]") || atOp("}");
    }

    private boolean atOp(String op) {
        return pos < end && tokens.get(pos).isOp(op);
    }

    private boolean atName(String name) {
        return pos < end && tokens.get(pos).isName(name);
    }

    private boolean peekKind(Kind kind) {
        return pos < end && tokens.get(pos).kind() == kind;
    }

    private void expectOp(String op) {
        if (!atOp(op)) {
            throw error("expected '" + op + "'");
        }
        pos++;
    }

    private void expectName(String name) {
        if (!atName(name)) {
            throw error("expected '" + name + "'");
        }
        pos++;
    }

    private CodeParseException error(String message) {
        if (pos < end) {
            return error(message, tokens.get(pos));
        }
        return new CodeParseException(message, lineOf(tokens, end - 1));
    }

    private static CodeParseException error(String message, Token token) {
        return new CodeParseException(message, token.line());
    }
}
