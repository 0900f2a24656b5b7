package work.lcod.scriptgen.introspect;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Signatures of the external API that generated code calls, read from YAML:
 *
 * <pre>
 * roots:
 *   raw: mne.io.Raw
 * symbols:
 *   mne.io.Raw.filter:
 *     kind: function
 *     parameters:
 *       - name: l_freq
 *       - name: picks
 *         default: null
 * </pre>
 *
 * Roots map the first segment of a dotted call path to a symbol path.
 */
public final class ApiCatalog {
    static final String BUNDLED = "work/lcod/scriptgen/introspect/mne-api.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Map<String, String> roots;
    private final Map<String, ApiSymbol> symbols;

    private ApiCatalog(Map<String, String> roots, Map<String, ApiSymbol> symbols) {
        this.roots = Collections.unmodifiableMap(new LinkedHashMap<>(roots));
        this.symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
    }

    public static ApiCatalog bundled() {
        try (InputStream in = ApiCatalog.class.getClassLoader().getResourceAsStream(BUNDLED)) {
            if (in == null) {
                throw new IllegalStateException("Bundled API catalogue not found: " + BUNDLED);
            }
            return parse(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read API catalogue: " + BUNDLED, ex);
        }
    }

    public static ApiCatalog load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read API catalogue: " + path, ex);
        }
    }

    static ApiCatalog parse(InputStream in) throws IOException {
        JsonNode root = YAML_MAPPER.readTree(in);
        var roots = new LinkedHashMap<String, String>();
        var symbols = new LinkedHashMap<String, ApiSymbol>();
        if (root == null || !root.isObject()) {
            return new ApiCatalog(roots, symbols);
        }
        JsonNode rootsNode = root.path("roots");
        rootsNode.fields().forEachRemaining(entry -> roots.put(entry.getKey(), entry.getValue().asText()));
        JsonNode symbolsNode = root.path("symbols");
        var fields = symbolsNode.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            symbols.put(entry.getKey(), toSymbol(entry.getKey(), entry.getValue()));
        }
        return new ApiCatalog(roots, symbols);
    }

    private static ApiSymbol toSymbol(String path, JsonNode node) throws IOException {
        ApiSymbol.Kind kind = ApiSymbol.Kind.valueOf(node.path("kind").asText("function").toUpperCase(Locale.ROOT));
        var parameters = new ArrayList<ApiParameter>();
        for (JsonNode param : node.path("parameters")) {
            String name = param.path("name").asText(null);
            if (name == null || name.isBlank()) {
                throw new IOException("Parameter without a name in '" + path + "'");
            }
            ApiParameter.Kind paramKind = param.has("kind")
                ? ApiParameter.Kind.valueOf(param.get("kind").asText().toUpperCase(Locale.ROOT))
                : ApiParameter.Kind.POSITIONAL;
            boolean hasDefault = param.has("default");
            Object defaultValue = hasDefault ? YAML_MAPPER.treeToValue(param.get("default"), Object.class) : null;
            parameters.add(new ApiParameter(name, paramKind, hasDefault, defaultValue));
        }
        return new ApiSymbol(path, kind, parameters);
    }

    /** Symbol path a dotted call path's first segment stands for. */
    public Optional<String> root(String name) {
        return Optional.ofNullable(roots.get(name));
    }

    public Optional<ApiSymbol> symbol(String path) {
        return Optional.ofNullable(symbols.get(path));
    }

    public List<String> rootNames() {
        return List.copyOf(roots.keySet());
    }
}
