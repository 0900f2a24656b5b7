package work.lcod.scriptgen.ir;

import java.util.List;
import java.util.Objects;

/**
 * Statement nodes of the script IR.
 */
public interface Stmt {

    record ExprStatement(Expr value) implements Stmt {
        public ExprStatement {
            Objects.requireNonNull(value, "value");
        }
    }

    /** {@code a = b = value}; targets are stores, everything else is a read. */
    record Assign(List<Expr> targets, Expr value) implements Stmt {
        public Assign {
            targets = List.copyOf(targets);
            Objects.requireNonNull(value, "value");
            if (targets.isEmpty()) {
                throw new IllegalArgumentException("assignment needs at least one target");
            }
        }
    }

    /** {@code target op= value}, where {@code op} is the operator without the trailing '='. */
    record AugAssign(Expr target, String op, Expr value) implements Stmt {
        public AugAssign {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(value, "value");
        }
    }

    /** {@code elif} chains are represented as a nested {@code If} alone in {@code orElse}. */
    record If(Expr test, List<Stmt> body, List<Stmt> orElse) implements Stmt {
        public If {
            Objects.requireNonNull(test, "test");
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }
    }

    record Alias(String name, String asName) {
        public Alias {
            Objects.requireNonNull(name, "name");
        }

        public String render() {
            return asName == null ? name : name + " as " + asName;
        }
    }

    record Import(List<Alias> names) implements Stmt {
        public Import {
            names = List.copyOf(names);
        }
    }

    /** {@code module} keeps any leading dots of a relative import. */
    record FromImport(String module, List<Alias> names) implements Stmt {
        public FromImport {
            Objects.requireNonNull(module, "module");
            names = List.copyOf(names);
        }
    }

    record Pass() implements Stmt {
        public static final Pass INSTANCE = new Pass();
    }

    /** Opaque statement text (dedented, possibly spanning several lines). */
    record RawStatement(String text) implements Stmt {
        public RawStatement {
            Objects.requireNonNull(text, "text");
        }

        public String keyword() {
            String trimmed = text.stripLeading();
            int end = 0;
            while (end < trimmed.length() && (Character.isLetterOrDigit(trimmed.charAt(end)) || trimmed.charAt(end) == '_')) {
                end++;
            }
            return end == 0 ? trimmed.substring(0, Math.min(1, trimmed.length())) : trimmed.substring(0, end);
        }
    }
}
