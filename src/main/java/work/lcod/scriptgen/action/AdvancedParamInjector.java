package work.lcod.scriptgen.action;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.scriptgen.ir.CodeParseException;
import work.lcod.scriptgen.ir.Expr;
import work.lcod.scriptgen.ir.Expr.Call;
import work.lcod.scriptgen.ir.Expr.Keyword;
import work.lcod.scriptgen.ir.LiteralValues;
import work.lcod.scriptgen.ir.NodeRewriter;
import work.lcod.scriptgen.ir.Nodes;
import work.lcod.scriptgen.ir.SourceParser;
import work.lcod.scriptgen.ir.SourcePrinter;
import work.lcod.scriptgen.ir.Stmt;

/**
 * Appends advanced keyword arguments to the calls of rendered code whose dotted callee matches an entry exactly.
 * Keywords a call already has are never overwritten.
 */
public final class AdvancedParamInjector {
    private static final Logger LOG = LoggerFactory.getLogger(AdvancedParamInjector.class);

    private AdvancedParamInjector() {}

    public static String inject(String code, Map<String, ? extends Map<String, ?>> advanced) {
        if (advanced == null || advanced.isEmpty() || code == null || code.isBlank()) {
            return code;
        }
        List<Stmt> statements;
        try {
            statements = SourceParser.parseStatements(code);
        } catch (CodeParseException e) {
            LOG.warn("Skipping advanced parameter injection, code does not parse: {}", e.getMessage());
            return code;
        }
        var injector = new Injector(advanced);
        var rewritten = injector.rewrite(statements);
        return injector.changed ? SourcePrinter.print(rewritten) : code;
    }

    private static final class Injector extends NodeRewriter {
        private final Map<String, ? extends Map<String, ?>> advanced;
        private boolean changed;

        private Injector(Map<String, ? extends Map<String, ?>> advanced) {
            this.advanced = advanced;
        }

        @Override
        protected Expr visitCall(Call call) {
            var path = Nodes.dottedName(call.func());
            if (path.isEmpty() || !advanced.containsKey(path.get())) {
                return call;
            }
            Map<String, ?> extra = advanced.get(path.get());
            if (extra == null || extra.isEmpty()) {
                return call;
            }
            var present = new HashSet<String>();
            call.keywords().forEach(k -> {
                if (!k.isUnpacking()) {
                    present.add(k.name());
                }
            });
            var keywords = new ArrayList<>(call.keywords());
            extra.forEach((name, value) -> {
                if (!present.contains(name)) {
                    keywords.add(new Keyword(name, LiteralValues.toNode(value)));
                }
            });
            if (keywords.size() == call.keywords().size()) {
                return call;
            }
            changed = true;
            return call.withKeywords(keywords);
        }
    }
}
