package work.lcod.scriptgen.roundtrip;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import work.lcod.scriptgen.action.FunctionGroup;
import work.lcod.scriptgen.action.TemplateSchema;
import work.lcod.scriptgen.ir.CodeParseException;
import work.lcod.scriptgen.ir.Expr.Call;
import work.lcod.scriptgen.ir.Expr.Keyword;
import work.lcod.scriptgen.ir.LiteralEvaluation;
import work.lcod.scriptgen.ir.LiteralValues;
import work.lcod.scriptgen.ir.Nodes;
import work.lcod.scriptgen.ir.SourceParser;
import work.lcod.scriptgen.ir.Stmt;

/**
 * Reads parameter values back from the keyword arguments of the calls a {@link TemplateSchema} names. Only the
 * first call matching a group, in document order, is consulted; values that are not literals keep what was
 * there before.
 */
public final class ParamRecovery {
    private static final Logger LOG = LoggerFactory.getLogger(ParamRecovery.class);

    private ParamRecovery() {}

    /** {@code defaults} overlaid with the literal values of owned keywords. Unparseable code yields the defaults. */
    public static Map<String, Object> recoverParams(TemplateSchema schema, String code, Map<String, ?> defaults) {
        var result = new LinkedHashMap<String, Object>(defaults == null ? Map.of() : defaults);
        var statements = parse(code);
        if (statements.isEmpty()) {
            return result;
        }
        forEachMatchedCall(schema, statements.get(), (group, call) -> {
            for (Keyword keyword : call.keywords()) {
                if (keyword.name() != null && group.owns(keyword.name())) {
                    LiteralEvaluation value = LiteralValues.evaluate(keyword.value());
                    if (value.isLiteral()) {
                        result.put(keyword.name(), value.value());
                    }
                }
            }
        });
        return result;
    }

    /** Literal keywords of matched calls that their group does not own, by dotted path. */
    public static Map<String, Map<String, Object>> recoverAdvanced(TemplateSchema schema, String code) {
        var result = new LinkedHashMap<String, Map<String, Object>>();
        var statements = parse(code);
        if (statements.isEmpty()) {
            return result;
        }
        forEachMatchedCall(schema, statements.get(), (group, call) -> {
            var advanced = new LinkedHashMap<String, Object>();
            for (Keyword keyword : call.keywords()) {
                if (keyword.name() != null && !group.owns(keyword.name())) {
                    LiteralEvaluation value = LiteralValues.evaluate(keyword.value());
                    if (value.isLiteral()) {
                        advanced.put(keyword.name(), value.value());
                    }
                }
            }
            if (!advanced.isEmpty()) {
                result.put(group.dottedPath(), advanced);
            }
        });
        return result;
    }

    private static void forEachMatchedCall(TemplateSchema schema, List<Stmt> statements, MatchedCall action) {
        Set<String> consulted = new HashSet<>();
        for (Call call : Nodes.calls(statements)) {
            Optional<String> path = Nodes.dottedName(call.func());
            if (path.isEmpty() || consulted.contains(path.get())) {
                continue;
            }
            Optional<FunctionGroup> group = schema.group(path.get());
            if (group.isPresent()) {
                consulted.add(path.get());
                action.accept(group.get(), call);
            }
        }
    }

    private static Optional<List<Stmt>> parse(String code) {
        try {
            return Optional.of(SourceParser.parseStatements(code == null ? "" : code));
        } catch (CodeParseException e) {
            LOG.debug("Block does not parse, nothing to recover: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @FunctionalInterface
    private interface MatchedCall {
        void accept(FunctionGroup group, Call call);
    }
}
