package work.lcod.scriptgen.roundtrip;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import work.lcod.scriptgen.action.BuilderArgs;
import work.lcod.scriptgen.ir.CodeParseException;
import work.lcod.scriptgen.ir.Expr;
import work.lcod.scriptgen.ir.Expr.Attribute;
import work.lcod.scriptgen.ir.Expr.BinaryOp;
import work.lcod.scriptgen.ir.Expr.Keyword;
import work.lcod.scriptgen.ir.Expr.UnaryOp;
import work.lcod.scriptgen.ir.LiteralEvaluation;
import work.lcod.scriptgen.ir.LiteralValues;
import work.lcod.scriptgen.ir.Nodes;
import work.lcod.scriptgen.ir.SourceParser;
import work.lcod.scriptgen.ir.Stmt;
import work.lcod.scriptgen.schema.ParamSpec;
import work.lcod.scriptgen.schema.ParamsSchema;
import work.lcod.scriptgen.schema.WidgetKind;

/**
 * Recovers parameters that no function group owns by rendering the code again with trial values.
 * <p>
 * First, bool and choice parameters are enumerated (current values first, bounded) until the rendered code has
 * the block's structure. Then each parameter is rendered once more with a probe value; when exactly one node
 * changes and it is the probe literal, the block's literal at that position is the parameter's value.
 * Parameters that cannot be located keep their current value.
 */
public final class ProbeRecovery {
    static final long INT_PROBE = 7919L;
    static final double FLOAT_PROBE = 7919.625;
    static final String TEXT_PROBE = "__scriptgen_probe__";
    static final int MAX_COMBINATIONS = 256;

    private static final Logger LOG = LoggerFactory.getLogger(ProbeRecovery.class);

    private ProbeRecovery() {}

    /**
     * @param schema parameters that may be recovered
     * @param skip names already recovered elsewhere
     * @param current values to start from; also passed through to {@code render}
     * @param block code as found in the script
     * @param render renders code for a full parameter map
     */
    public static Map<String, Object> recover(ParamsSchema schema, Set<String> skip, Map<String, ?> current,
                                              String block, Function<Map<String, Object>, String> render) {
        var values = new LinkedHashMap<String, Object>(current);
        Optional<List<Stmt>> blockTree = parse(block);
        if (blockTree.isEmpty()) {
            return values;
        }
        String blockSignature = StructureSignature.of(blockTree.get());
        var candidates = new ArrayList<String>();
        for (String name : schema.names()) {
            if (!skip.contains(name)) {
                candidates.add(name);
            }
        }
        if (candidates.isEmpty()) {
            return values;
        }
        selectShape(schema, candidates, values, blockSignature, render);
        for (String name : candidates) {
            ParamSpec spec = schema.get(name).orElseThrow();
            for (Object probe : probesFor(spec, values.get(name))) {
                if (locate(name, spec, probe, values, blockTree.get(), blockSignature, render)) {
                    break;
                }
            }
        }
        return values;
    }

    private static void selectShape(ParamsSchema schema, List<String> candidates, Map<String, Object> values,
                                    String blockSignature, Function<Map<String, Object>, String> render) {
        var names = new ArrayList<String>();
        var options = new ArrayList<List<Object>>();
        for (String name : candidates) {
            List<Object> choices = discreteOptions(schema.get(name).orElseThrow(), values.get(name));
            if (choices.size() > 1) {
                names.add(name);
                options.add(choices);
            }
        }
        if (names.isEmpty()) {
            return;
        }
        int[] odometer = new int[names.size()];
        for (int attempt = 0; attempt < MAX_COMBINATIONS; attempt++) {
            var trial = new LinkedHashMap<>(values);
            for (int i = 0; i < odometer.length; i++) {
                trial.put(names.get(i), options.get(i).get(odometer[i]));
            }
            if (blockSignature.equals(signature(render, trial))) {
                values.putAll(trial);
                return;
            }
            if (!advance(odometer, options)) {
                break;
            }
        }
        LOG.debug("No combination of {} reproduces the block's structure", names);
    }

    private static boolean advance(int[] odometer, List<List<Object>> options) {
        for (int i = odometer.length - 1; i >= 0; i--) {
            if (++odometer[i] < options.get(i).size()) {
                return true;
            }
            odometer[i] = 0;
        }
        return false;
    }

    private static List<Object> discreteOptions(ParamSpec spec, Object current) {
        var out = new ArrayList<Object>();
        if (spec.kind() == WidgetKind.BOOL) {
            boolean value = BuilderArgs.truthy(current);
            out.add(value);
            out.add(!value);
        } else if (spec.kind() == WidgetKind.CHOICE && spec.choices() != null) {
            out.add(current);
            for (Object choice : spec.choices()) {
                if (!Objects.equals(choice, current)) {
                    out.add(choice);
                }
            }
        }
        return out;
    }

    private static List<Object> probesFor(ParamSpec spec, Object current) {
        return switch (spec.kind()) {
            case INT -> List.of(INT_PROBE);
            case FLOAT -> List.of(FLOAT_PROBE);
            case BOOL -> List.of(!BuilderArgs.truthy(current));
            case CHOICE -> spec.choices() == null ? List.of()
                : spec.choices().stream().filter(choice -> !Objects.equals(choice, current)).toList();
            case TEXT -> List.of(TEXT_PROBE);
            case CUSTOM -> List.of(List.of(TEXT_PROBE), Map.of(TEXT_PROBE, TEXT_PROBE), TEXT_PROBE);
        };
    }

    private static boolean locate(String name, ParamSpec spec, Object probe, Map<String, Object> values,
                                  List<Stmt> blockTree, String blockSignature,
                                  Function<Map<String, Object>, String> render) {
        var probedValues = new LinkedHashMap<>(values);
        probedValues.put(name, probe);
        Optional<List<Stmt>> base = renderTree(render, values);
        Optional<List<Stmt>> probed = renderTree(render, probedValues);
        if (base.isEmpty() || probed.isEmpty()
            || !blockSignature.equals(StructureSignature.of(base.get()))
            || !blockSignature.equals(StructureSignature.of(probed.get()))) {
            return false;
        }
        Expr expected = LiteralValues.toNode(probe);
        var hits = new ArrayList<List<Integer>>();
        for (List<Integer> path : differences(base.get(), probed.get())) {
            if (Nodes.nodeAt(probed.get(), path).map(expected::equals).orElse(false)) {
                hits.add(path);
            }
        }
        if (hits.size() != 1) {
            return false;
        }
        Optional<Object> found = Nodes.nodeAt(blockTree, hits.get(0));
        if (found.isEmpty() || !(found.get() instanceof Expr expr)) {
            return false;
        }
        LiteralEvaluation literal = LiteralValues.evaluate(expr);
        if (!literal.isLiteral() || !accepts(spec, literal.value())) {
            return false;
        }
        values.put(name, literal.value());
        return true;
    }

    static boolean accepts(ParamSpec spec, Object value) {
        if (value == null) {
            return spec.isNullable() || spec.kind() == WidgetKind.TEXT || spec.kind() == WidgetKind.CUSTOM;
        }
        return switch (spec.kind()) {
            case BOOL -> value instanceof Boolean;
            case INT, FLOAT -> value instanceof Number;
            case CHOICE -> spec.choices() != null && spec.choices().contains(value);
            case TEXT -> value instanceof String;
            case CUSTOM -> true;
        };
    }

    /** Outermost paths at which two trees differ. */
    static List<List<Integer>> differences(Object a, Object b) {
        var out = new ArrayList<List<Integer>>();
        differences(a, b, new ArrayList<>(), out);
        return out;
    }

    private static void differences(Object a, Object b, List<Integer> path, List<List<Integer>> out) {
        if (Objects.equals(a, b)) {
            return;
        }
        if (a == null || b == null || a.getClass() != b.getClass() || !sameLabel(a, b)) {
            out.add(List.copyOf(path));
            return;
        }
        List<Object> left = Nodes.children(a);
        List<Object> right = Nodes.children(b);
        if (left.isEmpty() || left.size() != right.size()) {
            out.add(List.copyOf(path));
            return;
        }
        for (int i = 0; i < left.size(); i++) {
            path.add(i);
            differences(left.get(i), right.get(i), path, out);
            path.remove(path.size() - 1);
        }
    }

    private static boolean sameLabel(Object a, Object b) {
        if (a instanceof Keyword ka) {
            return Objects.equals(ka.name(), ((Keyword) b).name());
        }
        if (a instanceof Attribute aa) {
            return aa.attr().equals(((Attribute) b).attr());
        }
        if (a instanceof BinaryOp ba) {
            return ba.op().equals(((BinaryOp) b).op());
        }
        if (a instanceof UnaryOp ua) {
            return ua.op().equals(((UnaryOp) b).op());
        }
        return true;
    }

    private static String signature(Function<Map<String, Object>, String> render, Map<String, Object> values) {
        return renderTree(render, values).map(StructureSignature::of).orElse(null);
    }

    private static Optional<List<Stmt>> renderTree(Function<Map<String, Object>, String> render, Map<String, Object> values) {
        String code;
        try {
            code = render.apply(values);
        } catch (RuntimeException e) {
            LOG.trace("Trial rendering failed: {}", e.getMessage());
            return Optional.empty();
        }
        return parse(code);
    }

    private static Optional<List<Stmt>> parse(String code) {
        try {
            return Optional.of(SourceParser.parseStatements(code == null ? "" : code));
        } catch (CodeParseException e) {
            return Optional.empty();
        }
    }
}
