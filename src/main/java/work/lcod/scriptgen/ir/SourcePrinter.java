package work.lcod.scriptgen.ir;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import work.lcod.scriptgen.ir.Expr.Attribute;
import work.lcod.scriptgen.ir.Expr.BinaryOp;
import work.lcod.scriptgen.ir.Expr.BoolLiteral;
import work.lcod.scriptgen.ir.Expr.Call;
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
import work.lcod.scriptgen.ir.Stmt.Assign;
import work.lcod.scriptgen.ir.Stmt.AugAssign;
import work.lcod.scriptgen.ir.Stmt.ExprStatement;
import work.lcod.scriptgen.ir.Stmt.FromImport;
import work.lcod.scriptgen.ir.Stmt.If;
import work.lcod.scriptgen.ir.Stmt.Import;
import work.lcod.scriptgen.ir.Stmt.Pass;
import work.lcod.scriptgen.ir.Stmt.RawStatement;

/**
 * Renders IR back to script text. Output uses 4-space indentation, adds only the parentheses precedence
 * requires and renders literals the way the target interpreter's {@code repr} does.
 */
public final class SourcePrinter {
    private static final String INDENT = "    ";

    private static final int TUPLE = 0;
    private static final int TEST = 1;
    private static final int OR = 2;
    private static final int AND = 3;
    private static final int NOT = 4;
    private static final int COMPARE = 5;
    private static final int BIT_OR = 6;
    private static final int BIT_XOR = 7;
    private static final int BIT_AND = 8;
    private static final int SHIFT = 9;
    private static final int ARITH = 10;
    private static final int TERM = 11;
    private static final int FACTOR = 12;
    private static final int POWER = 13;
    private static final int PRIMARY = 15;

    private SourcePrinter() {}

    /** Prints a statement sequence; an empty top-level sequence prints as empty text. */
    public static String print(List<Stmt> statements) {
        if (statements.isEmpty()) {
            return "";
        }
        var out = new StringBuilder();
        block(statements, "", out);
        return out.toString();
    }

    public static String print(Stmt statement) {
        return print(List.of(statement));
    }

    public static String print(Expr expression) {
        return expr(expression, TUPLE);
    }

    private static void block(List<Stmt> statements, String indent, StringBuilder out) {
        if (statements.isEmpty()) {
            line(indent, "pass", out);
            return;
        }
        for (Stmt statement : statements) {
            statement(statement, indent, out);
        }
    }

    private static void statement(Stmt statement, String indent, StringBuilder out) {
        if (statement instanceof ExprStatement s) {
            line(indent, expr(s.value(), TUPLE), out);
        } else if (statement instanceof Assign s) {
            var text = new StringBuilder();
            for (Expr target : s.targets()) {
                text.append(expr(target, TUPLE)).append(" = ");
            }
            text.append(expr(s.value(), TUPLE));
            line(indent, text.toString(), out);
        } else if (statement instanceof AugAssign s) {
            line(indent, expr(s.target(), TEST) + " " + s.op() + "= " + expr(s.value(), TUPLE), out);
        } else if (statement instanceof If s) {
            ifChain(s, "if", indent, out);
        } else if (statement instanceof Import s) {
            line(indent, "import " + s.names().stream().map(Stmt.Alias::render).collect(Collectors.joining(", ")), out);
        } else if (statement instanceof FromImport s) {
            line(indent, "from " + s.module() + " import "
                + s.names().stream().map(Stmt.Alias::render).collect(Collectors.joining(", ")), out);
        } else if (statement instanceof Pass) {
            line(indent, "pass", out);
        } else if (statement instanceof RawStatement s) {
            for (String part : s.text().split("\n", -1)) {
                line(part.isBlank() ? "" : indent, part.isBlank() ? "" : part, out);
            }
        } else {
            throw new IllegalArgumentException("Unsupported statement: " + statement);
        }
    }

    private static void ifChain(If node, String keyword, String indent, StringBuilder out) {
        line(indent, keyword + " " + expr(node.test(), TEST) + ":", out);
        block(node.body(), indent + INDENT, out);
        var orElse = node.orElse();
        if (orElse.isEmpty()) {
            return;
        }
        if (orElse.size() == 1 && orElse.get(0) instanceof If nested) {
            ifChain(nested, "elif", indent, out);
            return;
        }
        line(indent, "else:", out);
        block(orElse, indent + INDENT, out);
    }

    private static void line(String indent, String text, StringBuilder out) {
        if (out.length() > 0) {
            out.append('\n');
        }
        out.append(indent).append(text);
    }

    private static String expr(Expr e, int context) {
        if (e instanceof NoneLiteral) {
            return "None";
        }
        if (e instanceof BoolLiteral b) {
            return b.value() ? "True" : "False";
        }
        if (e instanceof NumberLiteral n) {
            String text = number(n.value());
            return n.isNegative() && context > FACTOR ? "(" + text + ")" : text;
        }
        if (e instanceof StringLiteral s) {
            return repr(s.value());
        }
        if (e instanceof Name n) {
            return n.id();
        }
        if (e instanceof ListExpr l) {
            return "[" + elements(l.elements()) + "]";
        }
        if (e instanceof TupleExpr t) {
            String inner;
            if (t.elements().size() == 1) {
                inner = expr(t.elements().get(0), TEST) + ",";
            } else {
                inner = elements(t.elements());
            }
            return context == TUPLE && !t.elements().isEmpty() ? inner : "(" + inner + ")";
        }
        if (e instanceof DictExpr d) {
            return "{" + d.entries().stream()
                .map(entry -> expr(entry.key(), TEST) + ": " + expr(entry.value(), TEST))
                .collect(Collectors.joining(", ")) + "}";
        }
        if (e instanceof Attribute a) {
            String receiver = a.value() instanceof NumberLiteral
                ? "(" + expr(a.value(), TUPLE) + ")"
                : expr(a.value(), PRIMARY);
            return receiver + "." + a.attr();
        }
        if (e instanceof Subscript s) {
            return expr(s.value(), PRIMARY) + "[" + subscript(s.index()) + "]";
        }
        if (e instanceof Slice s) {
            return subscript(s);
        }
        if (e instanceof Starred s) {
            return "*" + expr(s.value(), BIT_OR);
        }
        if (e instanceof Call c) {
            var parts = new ArrayList<String>();
            for (Expr arg : c.args()) {
                parts.add(expr(arg, TEST));
            }
            for (Keyword keyword : c.keywords()) {
                parts.add(keyword.isUnpacking()
                    ? "**" + expr(keyword.value(), BIT_OR)
                    : keyword.name() + "=" + expr(keyword.value(), TEST));
            }
            return expr(c.func(), PRIMARY) + "(" + String.join(", ", parts) + ")";
        }
        if (e instanceof BinaryOp b) {
            int precedence = precedence(b.op());
            boolean rightAssociative = b.op().equals("**");
            String left = expr(b.left(), rightAssociative ? PRIMARY : precedence);
            String right = expr(b.right(), rightAssociative ? FACTOR : precedence + 1);
            return wrap(left + " " + b.op() + " " + right, precedence, context);
        }
        if (e instanceof UnaryOp u) {
            if (u.op().equals("not")) {
                return wrap("not " + expr(u.operand(), NOT), NOT, context);
            }
            return wrap(u.op() + expr(u.operand(), FACTOR), FACTOR, context);
        }
        if (e instanceof IfExpr i) {
            String text = expr(i.body(), OR) + " if " + expr(i.test(), OR) + " else " + expr(i.orElse(), TEST);
            return wrap(text, TEST, context);
        }
        if (e instanceof OpaqueExpr o) {
            boolean loose = o.source().startsWith("lambda") || o.source().startsWith("await");
            return loose && context > TEST ? "(" + o.source() + ")" : o.source();
        }
        throw new IllegalArgumentException("Unsupported expression: " + e);
    }

    private static String subscript(Expr index) {
        if (index instanceof Slice s) {
            var text = new StringBuilder();
            if (s.lower() != null) {
                text.append(expr(s.lower(), TEST));
            }
            text.append(':');
            if (s.upper() != null) {
                text.append(expr(s.upper(), TEST));
            }
            if (s.step() != null) {
                text.append(':').append(expr(s.step(), TEST));
            }
            return text.toString();
        }
        if (index instanceof TupleExpr t && !t.elements().isEmpty()) {
            if (t.elements().size() == 1) {
                return subscript(t.elements().get(0)) + ",";
            }
            return t.elements().stream().map(SourcePrinter::subscript).collect(Collectors.joining(", "));
        }
        return expr(index, TEST);
    }

    private static String elements(List<Expr> elements) {
        return elements.stream().map(element -> expr(element, TEST)).collect(Collectors.joining(", "));
    }

    private static String wrap(String text, int precedence, int context) {
        return precedence < context ? "(" + text + ")" : text;
    }

    private static int precedence(String op) {
        return switch (op) {
            case "or" -> OR;
            case "and" -> AND;
            case "<", ">", "==", ">=", "<=", "!=", "in", "not in", "is", "is not" -> COMPARE;
            case "|" -> BIT_OR;
            case "^" -> BIT_XOR;
            case "&" -> BIT_AND;
            case "<<", ">>" -> SHIFT;
            case "+", "-" -> ARITH;
            case "*", "/", "//", "%", "@" -> TERM;
            case "**" -> POWER;
            default -> throw new IllegalArgumentException("Unknown operator: " + op);
        };
    }

    /** Number text as the target interpreter prints it ({@code 50.0}, {@code 1e-05}, {@code 1e+16}). */
    public static String number(Number value) {
        if (!(value instanceof Double || value instanceof Float)) {
            return value.toString();
        }
        double d = value.doubleValue();
        if (Double.isNaN(d)) {
            return "float('nan')";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "1e309" : "-1e309";
        }
        if (d == 0) {
            return 1 / d < 0 ? "-0.0" : "0.0";
        }
        BigDecimal decimal = shortest(d);
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent >= -4 && exponent < 16) {
            String plain = decimal.toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        String digits = decimal.unscaledValue().abs().toString();
        String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        String sign = decimal.signum() < 0 ? "-" : "";
        String exponentText = (exponent < 0 ? "-" : "+") + String.format("%02d", Math.abs(exponent));
        return sign + mantissa + "e" + exponentText;
    }

    /** Fewest significant digits that still read back as {@code d}; ties go to the nearest decimal. */
    private static BigDecimal shortest(double d) {
        BigDecimal exact = new BigDecimal(d);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == d) {
                return candidate.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    /** String literal as the target interpreter's {@code repr} renders it. */
    public static String repr(String value) {
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        var out = new StringBuilder(value.length() + 2);
        out.append(quote);
        for (int i = 0; i < value.length(); ) {
            int cp = value.codePointAt(i);
            i += Character.charCount(cp);
            switch (cp) {
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (cp == quote) {
                        out.append('\\').append((char) cp);
                    } else if (cp < 0x20 || cp == 0x7f) {
                        out.append(String.format("\\x%02x", cp));
                    } else {
                        out.appendCodePoint(cp);
                    }
                }
            }
        }
        return out.append(quote).toString();
    }
}
