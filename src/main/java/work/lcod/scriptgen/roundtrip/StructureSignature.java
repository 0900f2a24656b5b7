package work.lcod.scriptgen.roundtrip;

import java.util.ArrayList;
import java.util.List;

import work.lcod.scriptgen.ir.CodeParseException;
import work.lcod.scriptgen.ir.Expr;
import work.lcod.scriptgen.ir.Expr.Call;
import work.lcod.scriptgen.ir.Expr.Keyword;
import work.lcod.scriptgen.ir.Expr.Name;
import work.lcod.scriptgen.ir.NodeRewriter;
import work.lcod.scriptgen.ir.Nodes;
import work.lcod.scriptgen.ir.SourceParser;
import work.lcod.scriptgen.ir.Stmt;

/**
 * Shape of code with argument values blanked out. Two fragments that differ only in the values passed to calls
 * have the same signature; keyword names, callees and everything outside call arguments still count.
 */
public final class StructureSignature {
    private static final Name PLACEHOLDER = new Name("_");

    private StructureSignature() {}

    /** Canonical dump of the normalized tree, or the text without whitespace when it does not parse. */
    public static String of(String code) {
        List<Stmt> statements;
        try {
            statements = SourceParser.parseStatements(code);
        } catch (CodeParseException e) {
            return Nodes.stripWhitespace(code);
        }
        return of(statements);
    }

    public static String of(List<Stmt> statements) {
        return Nodes.dump(new ArgumentBlanker().rewrite(statements));
    }

    /** Every positional argument and named keyword value becomes {@code _}; {@code **} entries stay. */
    private static final class ArgumentBlanker extends NodeRewriter {
        @Override
        protected Expr visitCall(Call call) {
            var args = new ArrayList<Expr>(call.args().size());
            call.args().forEach(arg -> args.add(PLACEHOLDER));
            var keywords = new ArrayList<Keyword>(call.keywords().size());
            for (Keyword keyword : call.keywords()) {
                keywords.add(keyword.name() == null ? keyword : new Keyword(keyword.name(), PLACEHOLDER));
            }
            return new Call(call.func(), args, keywords);
        }
    }
}
