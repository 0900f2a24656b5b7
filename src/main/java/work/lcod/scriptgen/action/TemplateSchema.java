package work.lcod.scriptgen.action;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import work.lcod.scriptgen.schema.ParamsSchema;

/**
 * Describes where parameter values live in generated code, for reverse parsing and editor introspection only.
 * Single-step actions list {@link FunctionGroup}s; steps that do not map onto a single call carry a flat
 * virtual schema instead.
 */
public record TemplateSchema(List<FunctionGroup> groups, ParamsSchema virtualParams) {
    private static final TemplateSchema EMPTY = new TemplateSchema(List.of(), ParamsSchema.empty());

    public TemplateSchema {
        groups = List.copyOf(groups);
        Objects.requireNonNull(virtualParams, "virtualParams");
        var seen = new HashSet<String>();
        for (FunctionGroup group : groups) {
            if (!seen.add(group.dottedPath())) {
                throw new IllegalArgumentException("Duplicate function group '" + group.dottedPath() + "'");
            }
        }
    }

    public static TemplateSchema empty() {
        return EMPTY;
    }

    public static TemplateSchema ofGroups(List<FunctionGroup> groups) {
        return new TemplateSchema(groups, ParamsSchema.empty());
    }

    public static TemplateSchema virtual(ParamsSchema params) {
        return new TemplateSchema(List.of(), params);
    }

    public Optional<FunctionGroup> group(String dottedPath) {
        return groups.stream().filter(g -> g.dottedPath().equals(dottedPath)).findFirst();
    }

    /** Every parameter name a function group owns. */
    public Set<String> allPrimaryParams() {
        var out = new LinkedHashSet<String>();
        groups.forEach(group -> out.addAll(group.ownedParams()));
        return Collections.unmodifiableSet(out);
    }

    public boolean isEmpty() {
        return groups.isEmpty() && virtualParams.isEmpty();
    }
}
