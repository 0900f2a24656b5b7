package work.lcod.scriptgen.ir;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import work.lcod.scriptgen.ir.Expr.BoolLiteral;
import work.lcod.scriptgen.ir.Expr.DictEntry;
import work.lcod.scriptgen.ir.Expr.DictExpr;
import work.lcod.scriptgen.ir.Expr.ListExpr;
import work.lcod.scriptgen.ir.Expr.NoneLiteral;
import work.lcod.scriptgen.ir.Expr.NumberLiteral;
import work.lcod.scriptgen.ir.Expr.StringLiteral;
import work.lcod.scriptgen.ir.Expr.TupleExpr;
import work.lcod.scriptgen.ir.Expr.UnaryOp;

/**
 * Conversions between runtime values and literal IR nodes.
 * <p>
 * Only {@code null}, booleans, numbers, strings, lists and maps convert faithfully. Any other value is rendered
 * as the string of its {@code toString()}; such values do not come back as their original type.
 */
public final class LiteralValues {
    private LiteralValues() {}

    public static Expr toNode(Object value) {
        if (value == null) {
            return NoneLiteral.INSTANCE;
        }
        if (value instanceof Boolean b) {
            return BoolLiteral.of(b);
        }
        if (value instanceof Double || value instanceof Float) {
            return new NumberLiteral(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            return new NumberLiteral(decimal.doubleValue());
        }
        if (value instanceof BigInteger big) {
            return ExpressionParser.integral(big);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte
            || value instanceof AtomicInteger || value instanceof AtomicLong) {
            return new NumberLiteral(((Number) value).longValue());
        }
        if (value instanceof Number n) {
            return new NumberLiteral(n.doubleValue());
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return new StringLiteral(value.toString());
        }
        if (value instanceof Collection<?> collection) {
            var elements = new ArrayList<Expr>(collection.size());
            collection.forEach(element -> elements.add(toNode(element)));
            return new ListExpr(elements);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            var elements = new ArrayList<Expr>(length);
            for (int i = 0; i < length; i++) {
                elements.add(toNode(Array.get(value, i)));
            }
            return new ListExpr(elements);
        }
        if (value instanceof Map<?, ?> map) {
            var entries = new ArrayList<DictEntry>(map.size());
            map.forEach((k, v) -> entries.add(new DictEntry(key(k), toNode(v))));
            return new DictExpr(entries);
        }
        return new StringLiteral(String.valueOf(value));
    }

    private static Expr key(Object key) {
        if (key == null || key instanceof Boolean || key instanceof Number || key instanceof CharSequence) {
            return toNode(key);
        }
        return new StringLiteral(String.valueOf(key));
    }

    /**
     * Evaluates literal syntax: scalars, lists, tuples (as lists), dicts with scalar keys and unary {@code +}/{@code -}
     * applied to numbers. Anything else is not a literal.
     */
    public static LiteralEvaluation evaluate(Expr expr) {
        try {
            return LiteralEvaluation.of(eval(expr));
        } catch (NotLiteral e) {
            return LiteralEvaluation.notLiteral();
        }
    }

    private static Object eval(Expr expr) {
        if (expr instanceof NoneLiteral) {
            return null;
        }
        if (expr instanceof BoolLiteral b) {
            return b.value();
        }
        if (expr instanceof NumberLiteral n) {
            return n.value();
        }
        if (expr instanceof StringLiteral s) {
            return s.value();
        }
        if (expr instanceof ListExpr l) {
            return evalAll(l.elements());
        }
        if (expr instanceof TupleExpr t) {
            return evalAll(t.elements());
        }
        if (expr instanceof DictExpr d) {
            var out = new LinkedHashMap<Object, Object>();
            for (DictEntry entry : d.entries()) {
                Object key = eval(entry.key());
                if (key instanceof List || key instanceof Map) {
                    throw new NotLiteral();
                }
                out.put(key, eval(entry.value()));
            }
            return out;
        }
        if (expr instanceof UnaryOp u && u.operand() instanceof NumberLiteral operand
            && (u.op().equals("-") || u.op().equals("+"))) {
            return u.op().equals("+") ? operand.value() : negate(operand.value());
        }
        throw new NotLiteral();
    }

    private static List<Object> evalAll(List<Expr> elements) {
        var out = new ArrayList<Object>(elements.size());
        for (Expr element : elements) {
            out.add(eval(element));
        }
        return out;
    }

    private static Number negate(Number number) {
        if (number instanceof Double d) {
            return -d;
        }
        if (number instanceof BigInteger big) {
            return ExpressionParser.integral(big.negate()).value();
        }
        long value = number.longValue();
        if (value == Long.MIN_VALUE) {
            return BigInteger.valueOf(value).negate();
        }
        return -value;
    }

    /** Python truthiness of a literal node; {@code null} when the node is not a scalar literal. */
    public static Boolean truthiness(Expr expr) {
        if (expr instanceof NoneLiteral) {
            return false;
        }
        if (expr instanceof BoolLiteral b) {
            return b.value();
        }
        if (expr instanceof NumberLiteral n) {
            if (n.value() instanceof BigInteger big) {
                return big.signum() != 0;
            }
            return n.isIntegral() ? n.value().longValue() != 0 : n.value().doubleValue() != 0.0;
        }
        if (expr instanceof StringLiteral s) {
            return !s.value().isEmpty();
        }
        return null;
    }

    private static final class NotLiteral extends RuntimeException {
        NotLiteral() {
            super(null, null, false, false);
        }
    }
}
