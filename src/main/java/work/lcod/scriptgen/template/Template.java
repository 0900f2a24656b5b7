package work.lcod.scriptgen.template;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import work.lcod.scriptgen.ir.CodeParseException;
import work.lcod.scriptgen.ir.Expr;
import work.lcod.scriptgen.ir.Expr.OpaqueExpr;
import work.lcod.scriptgen.ir.Expr.StringLiteral;
import work.lcod.scriptgen.ir.FunctionDef;
import work.lcod.scriptgen.ir.LiteralValues;
import work.lcod.scriptgen.ir.Nodes;
import work.lcod.scriptgen.ir.SourceParser;
import work.lcod.scriptgen.ir.SourcePrinter;
import work.lcod.scriptgen.ir.Stmt;
import work.lcod.scriptgen.ir.Stmt.ExprStatement;
import work.lcod.scriptgen.ir.Stmt.If;
import work.lcod.scriptgen.ir.Stmt.RawStatement;

/**
 * A renderable code fragment: the body of a function definition whose parameters are holes. Rendering
 * substitutes literal values for the holes and drops the branches that became dead. Templates are built once
 * and rendered many times; they are never executed.
 */
public final class Template {
    /** Names resolved by the executor at run time; never substituted. */
    public static final Set<String> SCOPE_NAMES = Set.of("raw");

    private static final Set<String> DEFINITION_KEYWORDS = Set.of("def", "class", "async", "@");
    private static final Pattern NESTED_DEFINITION =
        Pattern.compile("^[ \\t]*(?:@|(?:async[ \\t]+)?def\\b|class\\b)", Pattern.MULTILINE);

    private final String name;
    private final List<String> params;
    private final List<Stmt> body;
    private final String rendered;

    private Template(String name, List<String> params, List<Stmt> body) {
        this.name = Objects.requireNonNull(name, "name");
        this.params = List.copyOf(params);
        this.body = List.copyOf(body);
        validate();
        this.rendered = SourcePrinter.print(this.body);
    }

    /** Builds a template from {@code def name(params): body} source text. */
    public static Template extract(String source) {
        FunctionDef definition;
        try {
            definition = SourceParser.parseFunction(source);
        } catch (CodeParseException e) {
            throw new TemplateException("Template source is not a single function definition: " + e.getMessage(), e);
        }
        return new Template(definition.name(), definition.params(), withoutDocstring(definition.body()));
    }

    /** Builds a template directly from IR. */
    public static Template of(String name, List<String> params, List<Stmt> body) {
        return new Template(name, params, body);
    }

    private static List<Stmt> withoutDocstring(List<Stmt> body) {
        if (!body.isEmpty() && body.get(0) instanceof ExprStatement s && s.value() instanceof StringLiteral) {
            return body.subList(1, body.size());
        }
        return body;
    }

    public String name() {
        return name;
    }

    public List<String> params() {
        return params;
    }

    public List<Stmt> body() {
        return body;
    }

    /**
     * Renders the body with the supplied values substituted for declared, non-scope parameters. Entries for other
     * names are ignored.
     */
    public String inline(Map<String, ?> substitutions) {
        var replacements = new LinkedHashMap<String, Expr>();
        for (String param : params) {
            if (SCOPE_NAMES.contains(param) || substitutions == null || !substitutions.containsKey(param)) {
                continue;
            }
            replacements.put(param, LiteralValues.toNode(substitutions.get(param)));
        }
        if (replacements.isEmpty()) {
            return rendered;
        }
        var substituted = new NameSubstitutor(replacements).rewrite(body);
        return SourcePrinter.print(new BranchPruner().rewrite(substituted));
    }

    /** Templates are rendering sources only. */
    public Object call(Object... args) {
        throw new UnsupportedOperationException("Template '" + name + "' cannot be called; render it with inline()");
    }

    private void validate() {
        checkStatements(body);
    }

    private void checkStatements(List<Stmt> statements) {
        for (Stmt statement : statements) {
            if (statement instanceof RawStatement raw) {
                if (DEFINITION_KEYWORDS.contains(raw.keyword()) || NESTED_DEFINITION.matcher(raw.text()).find()) {
                    throw new TemplateException("Template '" + name + "' contains a nested definition");
                }
                checkOpaqueText(raw.text());
            } else if (statement instanceof If node) {
                checkStatements(node.body());
                checkStatements(node.orElse());
            }
            if (!(statement instanceof RawStatement)) {
                Nodes.findPaths(statement, e -> e instanceof OpaqueExpr)
                    .forEach(path -> Nodes.nodeAt(statement, path)
                        .ifPresent(node -> checkOpaqueText(((OpaqueExpr) node).source())));
            }
        }
    }

    private void checkOpaqueText(String text) {
        for (String param : params) {
            if (SCOPE_NAMES.contains(param)) {
                continue;
            }
            if (Pattern.compile("(?<![\\w.])" + Pattern.quote(param) + "(?!\\w)").matcher(text).find()) {
                throw new TemplateException("Template '" + name + "' uses parameter '" + param
                    + "' in a construct where it cannot be substituted: " + text.strip());
            }
        }
    }

    @Override
    public String toString() {
        return "Template[" + name + params + "]";
    }
}
