package work.lcod.scriptgen.ir;

import java.util.ArrayList;
import java.util.List;

import work.lcod.scriptgen.ir.Expr.Attribute;
import work.lcod.scriptgen.ir.Expr.BinaryOp;
import work.lcod.scriptgen.ir.Expr.Call;
import work.lcod.scriptgen.ir.Expr.DictEntry;
import work.lcod.scriptgen.ir.Expr.DictExpr;
import work.lcod.scriptgen.ir.Expr.IfExpr;
import work.lcod.scriptgen.ir.Expr.Keyword;
import work.lcod.scriptgen.ir.Expr.ListExpr;
import work.lcod.scriptgen.ir.Expr.Name;
import work.lcod.scriptgen.ir.Expr.Slice;
import work.lcod.scriptgen.ir.Expr.Starred;
import work.lcod.scriptgen.ir.Expr.Subscript;
import work.lcod.scriptgen.ir.Expr.TupleExpr;
import work.lcod.scriptgen.ir.Expr.UnaryOp;
import work.lcod.scriptgen.ir.Stmt.Assign;
import work.lcod.scriptgen.ir.Stmt.AugAssign;
import work.lcod.scriptgen.ir.Stmt.ExprStatement;
import work.lcod.scriptgen.ir.Stmt.If;

/**
 * Bottom-up tree transformer. Children are rebuilt first, then the matching {@code visit*} hook sees the rebuilt
 * node. Names bound by assignments never reach {@link #visitName(Name)}.
 */
public class NodeRewriter {

    public List<Stmt> rewrite(List<Stmt> statements) {
        var out = new ArrayList<Stmt>(statements.size());
        for (Stmt statement : statements) {
            out.addAll(rewriteStatement(statement));
        }
        return out;
    }

    protected List<Stmt> rewriteStatement(Stmt statement) {
        if (statement instanceof ExprStatement s) {
            return List.of(new ExprStatement(rewriteExpr(s.value())));
        }
        if (statement instanceof Assign s) {
            var targets = s.targets().stream().map(this::rewriteTarget).toList();
            return List.of(new Assign(targets, rewriteExpr(s.value())));
        }
        if (statement instanceof AugAssign s) {
            return List.of(new AugAssign(rewriteTarget(s.target()), s.op(), rewriteExpr(s.value())));
        }
        if (statement instanceof If s) {
            return visitIf(new If(rewriteExpr(s.test()), rewrite(s.body()), rewrite(s.orElse())));
        }
        return List.of(statement);
    }

    /** Called with an {@code if} whose parts are already rewritten; may replace it by any number of statements. */
    protected List<Stmt> visitIf(If node) {
        return List.of(node);
    }

    protected Expr visitName(Name name) {
        return name;
    }

    protected Expr visitCall(Call call) {
        return call;
    }

    protected Expr rewriteTarget(Expr target) {
        if (target instanceof Name) {
            return target;
        }
        if (target instanceof TupleExpr t) {
            return new TupleExpr(t.elements().stream().map(this::rewriteTarget).toList());
        }
        if (target instanceof ListExpr l) {
            return new ListExpr(l.elements().stream().map(this::rewriteTarget).toList());
        }
        if (target instanceof Starred s) {
            return new Starred(rewriteTarget(s.value()));
        }
        if (target instanceof Attribute a) {
            return new Attribute(rewriteExpr(a.value()), a.attr());
        }
        if (target instanceof Subscript s) {
            return new Subscript(rewriteExpr(s.value()), rewriteExpr(s.index()));
        }
        return rewriteExpr(target);
    }

    public Expr rewriteExpr(Expr e) {
        if (e == null) {
            return null;
        }
        if (e instanceof Name n) {
            return visitName(n);
        }
        if (e instanceof Call c) {
            var args = c.args().stream().map(this::rewriteExpr).toList();
            var keywords = c.keywords().stream()
                .map(k -> new Keyword(k.name(), rewriteExpr(k.value())))
                .toList();
            return visitCall(new Call(rewriteExpr(c.func()), args, keywords));
        }
        if (e instanceof ListExpr l) {
            return new ListExpr(l.elements().stream().map(this::rewriteExpr).toList());
        }
        if (e instanceof TupleExpr t) {
            return new TupleExpr(t.elements().stream().map(this::rewriteExpr).toList());
        }
        if (e instanceof DictExpr d) {
            return new DictExpr(d.entries().stream()
                .map(entry -> new DictEntry(rewriteExpr(entry.key()), rewriteExpr(entry.value())))
                .toList());
        }
        if (e instanceof Attribute a) {
            return new Attribute(rewriteExpr(a.value()), a.attr());
        }
        if (e instanceof Subscript s) {
            return new Subscript(rewriteExpr(s.value()), rewriteExpr(s.index()));
        }
        if (e instanceof Slice s) {
            return new Slice(rewriteExpr(s.lower()), rewriteExpr(s.upper()), rewriteExpr(s.step()));
        }
        if (e instanceof Starred s) {
            return new Starred(rewriteExpr(s.value()));
        }
        if (e instanceof BinaryOp b) {
            return new BinaryOp(b.op(), rewriteExpr(b.left()), rewriteExpr(b.right()));
        }
        if (e instanceof UnaryOp u) {
            return new UnaryOp(u.op(), rewriteExpr(u.operand()));
        }
        if (e instanceof IfExpr i) {
            return new IfExpr(rewriteExpr(i.test()), rewriteExpr(i.body()), rewriteExpr(i.orElse()));
        }
        return e;
    }
}
