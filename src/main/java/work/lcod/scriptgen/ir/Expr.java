package work.lcod.scriptgen.ir;

import java.util.List;
import java.util.Objects;

/**
 * Expression nodes of the script IR. Only the literal kinds (none, bool, number, string, list, tuple, dict)
 * can be produced by value serialization; the remaining kinds describe call structure.
 */
public interface Expr {

    record NoneLiteral() implements Expr {
        public static final NoneLiteral INSTANCE = new NoneLiteral();
    }

    record BoolLiteral(boolean value) implements Expr {
        public static final BoolLiteral TRUE = new BoolLiteral(true);
        public static final BoolLiteral FALSE = new BoolLiteral(false);

        public static BoolLiteral of(boolean value) {
            return value ? TRUE : FALSE;
        }
    }

    /** Integral values are held as {@link Long} or {@link java.math.BigInteger}, floating ones as {@link Double}. */
    record NumberLiteral(Number value) implements Expr {
        public NumberLiteral {
            Objects.requireNonNull(value, "value");
        }

        public boolean isIntegral() {
            return !(value instanceof Double || value instanceof Float);
        }

        public boolean isNegative() {
            if (value instanceof java.math.BigInteger big) {
                return big.signum() < 0;
            }
            double d = value.doubleValue();
            return d < 0 || (d == 0 && 1 / d < 0);
        }
    }

    record StringLiteral(String value) implements Expr {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }
    }

    record ListExpr(List<Expr> elements) implements Expr {
        public ListExpr {
            elements = List.copyOf(elements);
        }
    }

    record TupleExpr(List<Expr> elements) implements Expr {
        public TupleExpr {
            elements = List.copyOf(elements);
        }
    }

    record DictEntry(Expr key, Expr value) {
        public DictEntry {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    record DictExpr(List<DictEntry> entries) implements Expr {
        public DictExpr {
            entries = List.copyOf(entries);
        }
    }

    record Name(String id) implements Expr {
        public Name {
            Objects.requireNonNull(id, "id");
        }
    }

    record Attribute(Expr value, String attr) implements Expr {
        public Attribute {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(attr, "attr");
        }
    }

    record Subscript(Expr value, Expr index) implements Expr {
        public Subscript {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(index, "index");
        }
    }

    /** Slice bounds are {@code null} when omitted. */
    record Slice(Expr lower, Expr upper, Expr step) implements Expr {}

    record Starred(Expr value) implements Expr {
        public Starred {
            Objects.requireNonNull(value, "value");
        }
    }

    /** A keyword argument; a {@code null} name stands for {@code **value}. */
    record Keyword(String name, Expr value) {
        public Keyword {
            Objects.requireNonNull(value, "value");
        }

        public boolean isUnpacking() {
            return name == null;
        }
    }

    record Call(Expr func, List<Expr> args, List<Keyword> keywords) implements Expr {
        public Call {
            Objects.requireNonNull(func, "func");
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }

        public Call withKeywords(List<Keyword> newKeywords) {
            return new Call(func, args, newKeywords);
        }
    }

    /** Binary, boolean ({@code and}/{@code or}) and comparison operators share this node. */
    record BinaryOp(String op, Expr left, Expr right) implements Expr {
        public BinaryOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record UnaryOp(String op, Expr operand) implements Expr {
        public UnaryOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }
    }

    record IfExpr(Expr test, Expr body, Expr orElse) implements Expr {
        public IfExpr {
            Objects.requireNonNull(test, "test");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(orElse, "orElse");
        }
    }

    /** Source kept verbatim for constructs the IR does not model (comprehensions, lambdas, f-strings...). */
    record OpaqueExpr(String source) implements Expr {
        public OpaqueExpr {
            Objects.requireNonNull(source, "source");
        }
    }
}
