package work.lcod.scriptgen.template;

import java.util.List;

import work.lcod.scriptgen.ir.LiteralValues;
import work.lcod.scriptgen.ir.NodeRewriter;
import work.lcod.scriptgen.ir.Stmt;
import work.lcod.scriptgen.ir.Stmt.If;

/**
 * Replaces every {@code if} whose test is a scalar literal by the branch it selects. Rewriting is bottom-up, so
 * one pass also settles {@code elif} chains.
 */
final class BranchPruner extends NodeRewriter {

    @Override
    protected List<Stmt> visitIf(If node) {
        Boolean truth = LiteralValues.truthiness(node.test());
        if (truth == null) {
            return List.of(node);
        }
        return truth ? node.body() : node.orElse();
    }
}
