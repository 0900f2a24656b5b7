package work.lcod.scriptgen.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import work.lcod.scriptgen.ir.Expr.Attribute;
import work.lcod.scriptgen.ir.Expr.ListExpr;
import work.lcod.scriptgen.ir.Expr.Name;
import work.lcod.scriptgen.ir.Expr.Starred;
import work.lcod.scriptgen.ir.Expr.Subscript;
import work.lcod.scriptgen.ir.Expr.TupleExpr;
import work.lcod.scriptgen.ir.ParsedModule.LineSpan;
import work.lcod.scriptgen.ir.Stmt.Alias;
import work.lcod.scriptgen.ir.Stmt.Assign;
import work.lcod.scriptgen.ir.Stmt.AugAssign;
import work.lcod.scriptgen.ir.Stmt.ExprStatement;
import work.lcod.scriptgen.ir.Stmt.FromImport;
import work.lcod.scriptgen.ir.Stmt.If;
import work.lcod.scriptgen.ir.Stmt.Import;
import work.lcod.scriptgen.ir.Stmt.Pass;
import work.lcod.scriptgen.ir.Stmt.RawStatement;
import work.lcod.scriptgen.ir.Tokenizer.Kind;
import work.lcod.scriptgen.ir.Tokenizer.LogicalLine;
import work.lcod.scriptgen.ir.Tokenizer.Token;

/**
 * Parses script text into the statement IR. Compound statements other than {@code if} and simple statements the
 * IR does not model are kept as {@link RawStatement}s.
 */
public final class SourceParser {
    private static final Set<String> RAW_COMPOUND = Set.of("for", "while", "def", "class", "try", "with", "async");
    private static final Set<String> RAW_SIMPLE = Set.of(
        "return", "del", "raise", "assert", "global", "nonlocal", "break", "continue", "yield"
    );
    private static final Set<String> AUGMENTED = Set.of(
        "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@="
    );

    private final String source;
    private final List<LogicalLine> lines;
    private int index;

    private SourceParser(String source, List<LogicalLine> lines) {
        this.source = source;
        this.lines = lines;
    }

    public static ParsedModule parse(String source) {
        String text = source == null ? "" : source;
        var parser = new SourceParser(text, Tokenizer.tokenize(text));
        return parser.module();
    }

    /** Convenience for callers that only need the statements. */
    public static List<Stmt> parseStatements(String source) {
        return parse(source).body();
    }

    /** Parses a single expression. */
    public static Expr parseExpression(String source) {
        var lines = Tokenizer.tokenize(source);
        if (lines.size() != 1) {
            throw new CodeParseException("expected a single expression", lines.isEmpty() ? 0 : lines.get(0).firstLine());
        }
        var tokens = lines.get(0).tokens();
        return ExpressionParser.parseList(source, tokens, 0, tokens.size());
    }

    /** Parses text holding exactly one function definition. */
    public static FunctionDef parseFunction(String source) {
        String text = source == null ? "" : source;
        var parser = new SourceParser(text, Tokenizer.tokenize(text));
        return parser.functionDefinition();
    }

    private FunctionDef functionDefinition() {
        if (lines.isEmpty()) {
            throw new CodeParseException("expected a function definition", 0);
        }
        LogicalLine header = lines.get(0);
        var tokens = header.tokens();
        if (tokens.size() < 4 || !tokens.get(0).isName("def") || tokens.get(1).kind() != Kind.NAME
            || !tokens.get(2).isOp("(")) {
            throw new CodeParseException("expected a function definition", header.firstLine());
        }
        int close = closingParen(tokens, 2);
        var params = parameterNames(tokens, 3, close);
        int colon = headerColon(tokens, close + 1);
        int indent = header.indent();
        index = 1;
        List<Stmt> body = suite(header, colon + 1, indent);
        if (index < lines.size()) {
            throw new CodeParseException("expected a single function definition", lines.get(index).firstLine());
        }
        return new FunctionDef(tokens.get(1).text(), params, body);
    }

    private static int closingParen(List<Token> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.kind() == Kind.OP && "([{".contains(token.text())) {
                depth++;
            } else if (token.kind() == Kind.OP && ")]}".contains(token.text())) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new CodeParseException("expected ')'", tokens.get(open).line());
    }

    private static List<String> parameterNames(List<Token> tokens, int from, int to) {
        var names = new ArrayList<String>();
        int depth = 0;
        boolean expectName = true;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.kind() == Kind.OP && "([{".contains(token.text())) {
                depth++;
            } else if (token.kind() == Kind.OP && ")]}".contains(token.text())) {
                depth--;
            } else if (depth == 0 && token.isOp(",")) {
                expectName = true;
            } else if (depth == 0 && expectName && token.kind() == Kind.NAME) {
                names.add(token.text());
                expectName = false;
            } else if (depth == 0 && expectName && token.isOp("/")) {
                expectName = false;
            } else if (depth == 0 && expectName && !token.isOp("*") && !token.isOp("**")) {
                throw new CodeParseException("malformed parameter list", token.line());
            }
        }
        return names;
    }

    private ParsedModule module() {
        var body = new ArrayList<Stmt>();
        var spans = new ArrayList<LineSpan>();
        if (lines.isEmpty()) {
            return new ParsedModule(body, spans);
        }
        int baseIndent = lines.get(0).indent();
        while (index < lines.size()) {
            LogicalLine line = lines.get(index);
            if (line.indent() != baseIndent) {
                throw new CodeParseException(line.indent() > baseIndent ? "unexpected indent" : "unindent does not match any outer indentation level", line.firstLine());
            }
            int first = line.firstLine();
            var statements = statement(baseIndent);
            var span = new LineSpan(first, lines.get(index - 1).lastLine());
            for (Stmt stmt : statements) {
                body.add(stmt);
                spans.add(span);
            }
        }
        return new ParsedModule(body, spans);
    }

    private List<Stmt> block(int indent) {
        var statements = new ArrayList<Stmt>();
        while (index < lines.size()) {
            LogicalLine line = lines.get(index);
            if (line.indent() < indent) {
                break;
            }
            if (line.indent() > indent) {
                throw new CodeParseException("unexpected indent", line.firstLine());
            }
            statements.addAll(statement(indent));
        }
        return statements;
    }

    private List<Stmt> statement(int indent) {
        LogicalLine line = lines.get(index);
        Token first = line.first();
        if (first.isName("if")) {
            return List.of(ifStatement(indent));
        }
        if (first.isName("elif") || first.isName("else") || first.isName("except") || first.isName("finally")) {
            throw new CodeParseException("unexpected '" + first.text() + "'", first.line());
        }
        if (first.isOp("@") || (first.kind() == Kind.NAME && RAW_COMPOUND.contains(first.text()))) {
            return List.of(rawCompound(indent));
        }
        index++;
        return simpleStatements(line.tokens(), 0, line.tokens().size());
    }

    private If ifStatement(int indent) {
        LogicalLine line = lines.get(index);
        var tokens = line.tokens();
        int colon = headerColon(tokens, 1);
        Expr test = ExpressionParser.parseSingle(source, tokens, 1, colon);
        index++;
        List<Stmt> body = suite(line, colon + 1, indent);
        List<Stmt> orElse = List.of();
        if (index < lines.size() && lines.get(index).indent() == indent) {
            LogicalLine next = lines.get(index);
            Token head = next.first();
            if (head.isName("elif")) {
                orElse = List.of(ifStatement(indent));
            } else if (head.isName("else")) {
                if (next.tokens().size() < 2 || !next.tokens().get(1).isOp(":")) {
                    throw new CodeParseException("expected ':' after 'else'", head.line());
                }
                index++;
                orElse = suite(next, 2, indent);
            }
        }
        return new If(test, body, orElse);
    }

    /** Body of a compound statement: either inline after the colon or an indented block. */
    private List<Stmt> suite(LogicalLine header, int from, int indent) {
        var tokens = header.tokens();
        if (from < tokens.size()) {
            return simpleStatements(tokens, from, tokens.size());
        }
        if (index >= lines.size() || lines.get(index).indent() <= indent) {
            throw new CodeParseException("expected an indented block", header.lastLine());
        }
        return block(lines.get(index).indent());
    }

    private int headerColon(List<Token> tokens, int from) {
        int depth = 0;
        int lambdas = 0;
        for (int i = from; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.kind() == Kind.OP && "([{".contains(token.text())) {
                depth++;
            } else if (token.kind() == Kind.OP && ")]}".contains(token.text())) {
                depth--;
            } else if (depth == 0 && token.isName("lambda")) {
                lambdas++;
            } else if (depth == 0 && token.isOp(":")) {
                if (lambdas == 0) {
                    return i;
                }
                lambdas--;
            }
        }
        throw new CodeParseException("expected ':'", tokens.get(tokens.size() - 1).line());
    }

    private RawStatement rawCompound(int indent) {
        int start = index;
        Token head = lines.get(index).first();
        consumeClause(indent);
        if (head.isOp("@")) {
            while (index < lines.size() && lines.get(index).indent() == indent) {
                Token next = lines.get(index).first();
                if (next.isOp("@")) {
                    consumeClause(indent);
                } else if (next.isName("def") || next.isName("class") || next.isName("async")) {
                    consumeClause(indent);
                    break;
                } else {
                    throw new CodeParseException("expected a definition after decorator", next.line());
                }
            }
        } else {
            var continuations = switch (head.text()) {
                case "try" -> Set.of("except", "else", "finally");
                case "for", "while" -> Set.of("else");
                default -> Set.<String>of();
            };
            while (index < lines.size() && lines.get(index).indent() == indent
                && lines.get(index).first().kind() == Kind.NAME
                && continuations.contains(lines.get(index).first().text())) {
                consumeClause(indent);
            }
        }
        int from = lines.get(start).startOffset();
        int to = lines.get(index - 1).endOffset();
        return new RawStatement(dedent(source.substring(from, to), indent));
    }

    private void consumeClause(int indent) {
        index++;
        while (index < lines.size() && lines.get(index).indent() > indent) {
            index++;
        }
    }

    private static String dedent(String text, int indent) {
        if (indent == 0) {
            return text;
        }
        var out = new StringBuilder();
        String[] parts = text.split("\n", -1);
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            int cut = 0;
            while (cut < part.length() && cut < indent && (part.charAt(cut) == ' ' || part.charAt(cut) == '\t')) {
                cut++;
            }
            if (i > 0) {
                out.append('\n');
            }
            out.append(part.substring(cut));
        }
        return out.toString();
    }

    private List<Stmt> simpleStatements(List<Token> tokens, int from, int to) {
        var statements = new ArrayList<Stmt>();
        int depth = 0;
        int segmentStart = from;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.kind() == Kind.OP && "([{".contains(token.text())) {
                depth++;
            } else if (token.kind() == Kind.OP && ")]}".contains(token.text())) {
                depth--;
            } else if (depth == 0 && token.isOp(";")) {
                if (i > segmentStart) {
                    statements.add(simpleStatement(tokens, segmentStart, i));
                }
                segmentStart = i + 1;
            }
        }
        if (segmentStart < to) {
            statements.add(simpleStatement(tokens, segmentStart, to));
        }
        if (statements.isEmpty()) {
            throw new CodeParseException("expected a statement", tokens.get(from == to ? from - 1 : from).line());
        }
        return statements;
    }

    private Stmt simpleStatement(List<Token> tokens, int from, int to) {
        Token head = tokens.get(from);
        if (head.isName("pass") && to - from == 1) {
            return Pass.INSTANCE;
        }
        if (head.isName("import")) {
            return importStatement(tokens, from + 1, to);
        }
        if (head.isName("from")) {
            return fromImport(tokens, from + 1, to);
        }
        if (head.kind() == Kind.NAME && RAW_SIMPLE.contains(head.text())) {
            return new RawStatement(source.substring(head.start(), tokens.get(to - 1).end()));
        }
        var assignments = new ArrayList<Integer>();
        int augmented = -1;
        int depth = 0;
        boolean inLambda = false;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.kind() == Kind.OP && "([{".contains(token.text())) {
                depth++;
            } else if (token.kind() == Kind.OP && ")]}".contains(token.text())) {
                depth--;
            } else if (depth == 0 && token.isName("lambda")) {
                inLambda = true;
            } else if (depth == 0 && !inLambda && token.isOp("=")) {
                assignments.add(i);
            } else if (depth == 0 && !inLambda && token.isOp(":") && assignments.isEmpty()) {
                // annotated assignment
                return new RawStatement(source.substring(head.start(), tokens.get(to - 1).end()));
            } else if (depth == 0 && !inLambda && token.kind() == Kind.OP && AUGMENTED.contains(token.text())) {
                augmented = i;
                break;
            }
        }
        if (augmented >= 0) {
            String op = tokens.get(augmented).text();
            Expr target = ExpressionParser.parseSingle(source, tokens, from, augmented);
            checkTarget(target, head, false);
            Expr value = ExpressionParser.parseList(source, tokens, augmented + 1, to);
            return new AugAssign(target, op.substring(0, op.length() - 1), value);
        }
        if (assignments.isEmpty()) {
            return new ExprStatement(ExpressionParser.parseList(source, tokens, from, to));
        }
        var targets = new ArrayList<Expr>();
        int segmentStart = from;
        for (int at : assignments) {
            Expr target = ExpressionParser.parseList(source, tokens, segmentStart, at);
            checkTarget(target, head, true);
            targets.add(target);
            segmentStart = at + 1;
        }
        Expr value = ExpressionParser.parseList(source, tokens, segmentStart, to);
        return new Assign(targets, value);
    }

    private static void checkTarget(Expr target, Token head, boolean allowUnpacking) {
        if (target instanceof Name || target instanceof Attribute || target instanceof Subscript) {
            return;
        }
        if (allowUnpacking && target instanceof TupleExpr tuple) {
            tuple.elements().forEach(element -> checkTarget(element, head, true));
            return;
        }
        if (allowUnpacking && target instanceof ListExpr list) {
            list.elements().forEach(element -> checkTarget(element, head, true));
            return;
        }
        if (allowUnpacking && target instanceof Starred starred) {
            checkTarget(starred.value(), head, false);
            return;
        }
        throw new CodeParseException("cannot assign to expression", head.line());
    }

    private Import importStatement(List<Token> tokens, int from, int to) {
        var names = new ArrayList<Alias>();
        int i = from;
        while (true) {
            var dotted = new StringBuilder();
            i = dottedName(tokens, i, to, dotted);
            String asName = null;
            if (i < to && tokens.get(i).isName("as")) {
                asName = identifier(tokens, i + 1, to);
                i += 2;
            }
            names.add(new Alias(dotted.toString(), asName));
            if (i >= to) {
                break;
            }
            if (!tokens.get(i).isOp(",")) {
                throw new CodeParseException("expected ',' in import", tokens.get(i).line());
            }
            i++;
        }
        return new Import(names);
    }

    private FromImport fromImport(List<Token> tokens, int from, int to) {
        var module = new StringBuilder();
        int i = from;
        while (i < to && (tokens.get(i).isOp(".") || tokens.get(i).isOp("..."))) {
            module.append(tokens.get(i).text());
            i++;
        }
        if (i < to && !tokens.get(i).isName("import")) {
            i = dottedName(tokens, i, to, module);
        }
        if (module.length() == 0 || i >= to || !tokens.get(i).isName("import")) {
            throw new CodeParseException("malformed 'from' import", tokens.get(Math.min(i, to - 1)).line());
        }
        i++;
        if (i < to && tokens.get(i).isOp("*")) {
            if (i + 1 != to) {
                throw new CodeParseException("unexpected tokens after '*'", tokens.get(i).line());
            }
            return new FromImport(module.toString(), List.of(new Alias("*", null)));
        }
        int stop = to;
        if (i < to && tokens.get(i).isOp("(")) {
            if (!tokens.get(to - 1).isOp(")")) {
                throw new CodeParseException("expected ')'", tokens.get(to - 1).line());
            }
            i++;
            stop = to - 1;
        }
        var names = new ArrayList<Alias>();
        while (i < stop) {
            String name = identifier(tokens, i, stop);
            i++;
            String asName = null;
            if (i < stop && tokens.get(i).isName("as")) {
                asName = identifier(tokens, i + 1, stop);
                i += 2;
            }
            names.add(new Alias(name, asName));
            if (i < stop) {
                if (!tokens.get(i).isOp(",")) {
                    throw new CodeParseException("expected ',' in import", tokens.get(i).line());
                }
                i++;
            }
        }
        if (names.isEmpty()) {
            throw new CodeParseException("empty import list", tokens.get(to - 1).line());
        }
        return new FromImport(module.toString(), names);
    }

    private static int dottedName(List<Token> tokens, int from, int to, StringBuilder out) {
        int i = from;
        out.append(identifier(tokens, i, to));
        i++;
        while (i + 1 < to && tokens.get(i).isOp(".")) {
            out.append('.').append(identifier(tokens, i + 1, to));
            i += 2;
        }
        return i;
    }

    private static String identifier(List<Token> tokens, int at, int to) {
        if (at >= to || tokens.get(at).kind() != Kind.NAME) {
            int line = tokens.get(Math.min(at, tokens.size() - 1)).line();
            throw new CodeParseException("expected a name", line);
        }
        return tokens.get(at).text();
    }
}
