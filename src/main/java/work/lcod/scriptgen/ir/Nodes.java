package work.lcod.scriptgen.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
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
 * Read-only tree helpers: call walks, dotted callee names, child enumeration, index paths and canonical dumps.
 * A node is a {@link Stmt}, an {@link Expr}, a {@link Keyword} or a statement list.
 */
public final class Nodes {
    private Nodes() {}

    /** Every call in pre-order, document order. */
    public static List<Call> calls(List<Stmt> statements) {
        var out = new ArrayList<Call>();
        collectCalls(statements, out);
        return out;
    }

    private static void collectCalls(Object node, List<Call> out) {
        if (node instanceof Call call) {
            out.add(call);
        }
        for (Object child : children(node)) {
            if (child != null) {
                collectCalls(child, out);
            }
        }
    }

    /** {@code a.b.c} for a callee made only of a name and attribute accesses. */
    public static Optional<String> dottedName(Expr func) {
        var segments = new ArrayList<String>();
        Expr current = func;
        while (current instanceof Attribute attribute) {
            segments.add(0, attribute.attr());
            current = attribute.value();
        }
        if (!(current instanceof Name name)) {
            return Optional.empty();
        }
        segments.add(0, name.id());
        return Optional.of(String.join(".", segments));
    }

    /** Ordered children of a node; slice bounds that are absent show up as {@code null}. */
    public static List<Object> children(Object node) {
        if (node instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (node instanceof ExprStatement s) {
            return List.of(s.value());
        }
        if (node instanceof Assign s) {
            var out = new ArrayList<Object>(s.targets());
            out.add(s.value());
            return out;
        }
        if (node instanceof AugAssign s) {
            return List.of(s.target(), s.value());
        }
        if (node instanceof If s) {
            return List.of(s.test(), s.body(), s.orElse());
        }
        if (node instanceof ListExpr l) {
            return new ArrayList<>(l.elements());
        }
        if (node instanceof TupleExpr t) {
            return new ArrayList<>(t.elements());
        }
        if (node instanceof DictExpr d) {
            var out = new ArrayList<Object>();
            d.entries().forEach(entry -> {
                out.add(entry.key());
                out.add(entry.value());
            });
            return out;
        }
        if (node instanceof Attribute a) {
            return List.of(a.value());
        }
        if (node instanceof Subscript s) {
            return List.of(s.value(), s.index());
        }
        if (node instanceof Slice s) {
            return Arrays.asList(s.lower(), s.upper(), s.step());
        }
        if (node instanceof Starred s) {
            return List.of(s.value());
        }
        if (node instanceof Keyword k) {
            return List.of(k.value());
        }
        if (node instanceof Call c) {
            var out = new ArrayList<Object>();
            out.add(c.func());
            out.addAll(c.args());
            out.addAll(c.keywords());
            return out;
        }
        if (node instanceof BinaryOp b) {
            return List.of(b.left(), b.right());
        }
        if (node instanceof UnaryOp u) {
            return List.of(u.operand());
        }
        if (node instanceof IfExpr i) {
            return List.of(i.test(), i.body(), i.orElse());
        }
        return List.of();
    }

    /** Index paths (outermost matches only) of every expression accepted by {@code predicate}. */
    public static List<List<Integer>> findPaths(Object root, Predicate<Expr> predicate) {
        var out = new ArrayList<List<Integer>>();
        findPaths(root, predicate, new ArrayList<>(), out);
        return out;
    }

    private static void findPaths(Object node, Predicate<Expr> predicate, List<Integer> path, List<List<Integer>> out) {
        if (node instanceof Expr expr && predicate.test(expr)) {
            out.add(List.copyOf(path));
            return;
        }
        var children = children(node);
        for (int i = 0; i < children.size(); i++) {
            Object child = children.get(i);
            if (child == null) {
                continue;
            }
            path.add(i);
            findPaths(child, predicate, path, out);
            path.remove(path.size() - 1);
        }
    }

    /** Node found by following {@code path} from {@code root}, or empty when the path leaves the tree. */
    public static Optional<Object> nodeAt(Object root, List<Integer> path) {
        Object current = root;
        for (int index : path) {
            var children = children(current);
            if (index < 0 || index >= children.size() || children.get(index) == null) {
                return Optional.empty();
            }
            current = children.get(index);
        }
        return Optional.of(current);
    }

    /** Canonical, whitespace-independent description of a statement list. */
    public static String dump(List<Stmt> statements) {
        return "Module[" + statements.stream().map(Nodes::dump).collect(Collectors.joining(", ")) + "]";
    }

    public static String dump(Stmt statement) {
        if (statement instanceof ExprStatement s) {
            return "Expr(" + dump(s.value()) + ")";
        }
        if (statement instanceof Assign s) {
            return "Assign(" + dumpAll(s.targets()) + ", " + dump(s.value()) + ")";
        }
        if (statement instanceof AugAssign s) {
            return "AugAssign(" + dump(s.target()) + ", " + s.op() + ", " + dump(s.value()) + ")";
        }
        if (statement instanceof If s) {
            return "If(" + dump(s.test()) + ", " + dumpBlock(s.body()) + ", " + dumpBlock(s.orElse()) + ")";
        }
        if (statement instanceof Import s) {
            return "Import(" + s.names().stream().map(Stmt.Alias::render).collect(Collectors.joining(", ")) + ")";
        }
        if (statement instanceof FromImport s) {
            return "ImportFrom(" + s.module() + ", "
                + s.names().stream().map(Stmt.Alias::render).collect(Collectors.joining(", ")) + ")";
        }
        if (statement instanceof Pass) {
            return "Pass";
        }
        if (statement instanceof RawStatement s) {
            return "Raw(" + stripWhitespace(s.text()) + ")";
        }
        throw new IllegalArgumentException("Unsupported statement: " + statement);
    }

    public static String dump(Expr e) {
        if (e == null) {
            return "-";
        }
        if (e instanceof NoneLiteral) {
            return "Const(None)";
        }
        if (e instanceof BoolLiteral b) {
            return "Const(" + (b.value() ? "True" : "False") + ")";
        }
        if (e instanceof NumberLiteral n) {
            return "Const(" + SourcePrinter.number(n.value()) + ")";
        }
        if (e instanceof StringLiteral s) {
            return "Const(" + SourcePrinter.repr(s.value()) + ")";
        }
        if (e instanceof Name n) {
            return "Name(" + n.id() + ")";
        }
        if (e instanceof ListExpr l) {
            return "List(" + dumpAll(l.elements()) + ")";
        }
        if (e instanceof TupleExpr t) {
            return "Tuple(" + dumpAll(t.elements()) + ")";
        }
        if (e instanceof DictExpr d) {
            return "Dict(" + d.entries().stream()
                .map(entry -> dump(entry.key()) + ": " + dump(entry.value()))
                .collect(Collectors.joining(", ")) + ")";
        }
        if (e instanceof Attribute a) {
            return "Attribute(" + dump(a.value()) + ", " + a.attr() + ")";
        }
        if (e instanceof Subscript s) {
            return "Subscript(" + dump(s.value()) + ", " + dump(s.index()) + ")";
        }
        if (e instanceof Slice s) {
            return "Slice(" + dump(s.lower()) + ", " + dump(s.upper()) + ", " + dump(s.step()) + ")";
        }
        if (e instanceof Starred s) {
            return "Starred(" + dump(s.value()) + ")";
        }
        if (e instanceof Call c) {
            String keywords = c.keywords().stream()
                .map(k -> (k.isUnpacking() ? "**" : k.name() + "=") + dump(k.value()))
                .collect(Collectors.joining(", "));
            return "Call(" + dump(c.func()) + ", " + dumpAll(c.args()) + ", [" + keywords + "])";
        }
        if (e instanceof BinaryOp b) {
            return "BinOp(" + b.op() + ", " + dump(b.left()) + ", " + dump(b.right()) + ")";
        }
        if (e instanceof UnaryOp u) {
            return "UnaryOp(" + u.op() + ", " + dump(u.operand()) + ")";
        }
        if (e instanceof IfExpr i) {
            return "IfExp(" + dump(i.test()) + ", " + dump(i.body()) + ", " + dump(i.orElse()) + ")";
        }
        if (e instanceof OpaqueExpr o) {
            return "Opaque(" + stripWhitespace(o.source()) + ")";
        }
        throw new IllegalArgumentException("Unsupported expression: " + e);
    }

    private static String dumpAll(List<Expr> expressions) {
        return "[" + expressions.stream().map(Nodes::dump).collect(Collectors.joining(", ")) + "]";
    }

    private static String dumpBlock(List<Stmt> statements) {
        return "[" + statements.stream().map(Nodes::dump).collect(Collectors.joining(", ")) + "]";
    }

    public static String stripWhitespace(String text) {
        return text.replaceAll("\\s+", "");
    }
}
