package work.lcod.scriptgen.introspect;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import work.lcod.scriptgen.ir.LiteralValues;
import work.lcod.scriptgen.ir.SourcePrinter;
import work.lcod.scriptgen.schema.Labels;
import work.lcod.scriptgen.schema.ParamSpec;
import work.lcod.scriptgen.schema.ParamsSchema;

/**
 * Lists the keyword arguments of an external call that an action does not already expose, with widget specs
 * inferred from their defaults.
 */
public final class FunctionIntrospector {
    static final Set<String> EXCLUDED = Set.of("self", "return", "inst", "raw", "epochs", "verbose", "n_jobs");

    private static final Logger LOG = LoggerFactory.getLogger(FunctionIntrospector.class);

    private final ApiCatalog catalog;

    public FunctionIntrospector(ApiCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * Advanced parameters of {@code dottedPath}, excluding {@code owned} names, plumbing parameters and
     * variadics. A path that does not resolve yields an empty schema.
     */
    public ParamsSchema advancedParams(String dottedPath, Set<String> owned) {
        Optional<ApiSymbol> symbol = resolve(dottedPath);
        if (symbol.isEmpty()) {
            return ParamsSchema.empty();
        }
        var schema = ParamsSchema.builder();
        for (ApiParameter param : symbol.get().parameters()) {
            if (EXCLUDED.contains(param.name()) || (owned != null && owned.contains(param.name())) || param.isVariadic()) {
                continue;
            }
            if (!schema.contains(param.name())) {
                schema.put(param.name(), inferSpec(param));
            }
        }
        return schema.build();
    }

    Optional<ApiSymbol> resolve(String dottedPath) {
        if (dottedPath == null || dottedPath.isBlank()) {
            return Optional.empty();
        }
        String[] segments = dottedPath.strip().split("\\.");
        Optional<String> root = catalog.root(segments[0]);
        if (root.isEmpty()) {
            LOG.debug("No catalogue root for '{}'", dottedPath);
            return Optional.empty();
        }
        String path = root.get();
        for (int i = 1; i < segments.length; i++) {
            path = path + "." + segments[i];
            if (catalog.symbol(path).isEmpty()) {
                LOG.warn("Failed to resolve '{}': no member '{}'", dottedPath, path);
                return Optional.empty();
            }
        }
        Optional<ApiSymbol> symbol = catalog.symbol(path);
        if (symbol.isEmpty() || !symbol.get().isCallable()) {
            LOG.debug("'{}' does not resolve to a callable", dottedPath);
            return Optional.empty();
        }
        return symbol;
    }

    static ParamSpec inferSpec(ApiParameter param) {
        var spec = ParamSpec.meta().label(Labels.fromIdentifier(param.name()));
        if (!param.hasDefault()) {
            return spec.type("text").defaultValue("").nullable(true).build();
        }
        Object value = param.defaultValue();
        if (value == null) {
            return spec.type("text").defaultValue(null).nullable(true).build();
        }
        if (value instanceof Boolean) {
            return spec.type("bool").defaultValue(value).build();
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof BigInteger) {
            return spec.type("int").defaultValue(value).min(-999999).max(999999).build();
        }
        if (value instanceof Number) {
            return spec.type("float").defaultValue(value).min(-999999.0).max(999999.0).build();
        }
        if (value instanceof String) {
            return spec.type("text").defaultValue(value).build();
        }
        return spec.type("text").defaultValue(SourcePrinter.print(LiteralValues.toNode(value))).build();
    }
}
