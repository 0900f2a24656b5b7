package work.lcod.scriptgen.template;

import java.util.Map;

import work.lcod.scriptgen.ir.Expr;
import work.lcod.scriptgen.ir.Expr.Name;
import work.lcod.scriptgen.ir.NodeRewriter;

/** Replaces read references to the given names; assignment targets keep their names. */
final class NameSubstitutor extends NodeRewriter {
    private final Map<String, Expr> replacements;

    NameSubstitutor(Map<String, Expr> replacements) {
        this.replacements = Map.copyOf(replacements);
    }

    @Override
    protected Expr visitName(Name name) {
        return replacements.getOrDefault(name.id(), name);
    }
}
