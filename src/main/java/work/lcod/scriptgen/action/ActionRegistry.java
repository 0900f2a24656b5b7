package work.lcod.scriptgen.action;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Action definitions by id. Definitions are built on first lookup, once, behind a single lock; afterwards the
 * registry is read-only and safe to share. A definition that fails to build is logged and left out.
 */
public final class ActionRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ActionRegistry.class);

    private final List<Supplier<ActionDefinition>> factories;
    private volatile Map<String, ActionDefinition> definitions;

    public ActionRegistry(List<Supplier<ActionDefinition>> factories) {
        this.factories = List.copyOf(Objects.requireNonNull(factories, "factories"));
    }

    /** Registry over definitions that are already built. */
    public static ActionRegistry of(ActionDefinition... definitions) {
        return new ActionRegistry(Arrays.stream(definitions)
            .<Supplier<ActionDefinition>>map(definition -> () -> definition)
            .toList());
    }

    public Optional<ActionDefinition> byId(String id) {
        return Optional.ofNullable(id == null ? null : definitions().get(id));
    }

    /** Exact title match; the first registered action wins. */
    public Optional<ActionDefinition> byTitle(String title) {
        if (title == null) {
            return Optional.empty();
        }
        return definitions().values().stream().filter(definition -> definition.title().equals(title)).findFirst();
    }

    public List<ActionDefinition> list() {
        return List.copyOf(definitions().values());
    }

    /** Display title: the config's override, else the definition's title, else the raw id. */
    public String titleFor(String actionId, String titleOverride) {
        if (titleOverride != null && !titleOverride.isBlank()) {
            return titleOverride;
        }
        return byId(actionId).map(ActionDefinition::title).orElse(actionId);
    }

    private Map<String, ActionDefinition> definitions() {
        Map<String, ActionDefinition> local = definitions;
        if (local == null) {
            synchronized (this) {
                local = definitions;
                if (local == null) {
                    local = load();
                    definitions = local;
                }
            }
        }
        return local;
    }

    private Map<String, ActionDefinition> load() {
        var loaded = new LinkedHashMap<String, ActionDefinition>();
        for (Supplier<ActionDefinition> factory : factories) {
            ActionDefinition definition;
            try {
                definition = factory.get();
            } catch (RuntimeException e) {
                LOG.error("Failed to build action definition: {}", e.getMessage(), e);
                continue;
            }
            if (definition == null) {
                continue;
            }
            if (loaded.containsKey(definition.id())) {
                LOG.error("Duplicate action id '{}', keeping the first registration", definition.id());
                continue;
            }
            loaded.put(definition.id(), definition);
        }
        LOG.debug("Registered {} actions", loaded.size());
        return Collections.unmodifiableMap(loaded);
    }
}
