package work.lcod.scriptgen.codegen;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Script generation settings read from the {@code [script]} table of a TOML file. Keys missing from a user file
 * keep the bundled values.
 *
 * @param baseImports import lines every script starts with
 * @param layout layout file: a path (relative ones resolve against {@code baseDir}) or a classpath resource
 * @param loadFunction function called to load the recording
 * @param loadTarget variable the loaded recording is bound to
 * @param loadPlaceholder line written when no data path is known
 * @param baseDir directory of the settings file, or {@code null} for the bundled settings
 */
public record ScriptSettings(
    List<String> baseImports,
    String layout,
    String loadFunction,
    String loadTarget,
    String loadPlaceholder,
    Path baseDir
) {
    static final String BUNDLED = "work/lcod/scriptgen/scriptgen.toml";

    public ScriptSettings {
        baseImports = List.copyOf(baseImports);
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(loadFunction, "loadFunction");
        Objects.requireNonNull(loadTarget, "loadTarget");
        Objects.requireNonNull(loadPlaceholder, "loadPlaceholder");
    }

    public static ScriptSettings defaults() {
        String text = readResource(BUNDLED)
            .orElseThrow(() -> new IllegalStateException("Bundled settings not found: " + BUNDLED));
        return fromToml(parse(text, BUNDLED), null, null);
    }

    /** Settings from {@code file} layered over the bundled ones. */
    public static ScriptSettings load(Path file) {
        Objects.requireNonNull(file, "file");
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read settings file " + file + ": " + e.getMessage(), e);
        }
        Path dir = file.toAbsolutePath().getParent();
        return fromToml(parse(text, file.toString()), defaults(), dir);
    }

    static ScriptSettings fromToml(TomlParseResult result, ScriptSettings fallback, Path baseDir) {
        TomlTable script = result.getTable("script");
        if (script == null && fallback == null) {
            throw new IllegalStateException("Settings have no [script] table");
        }
        List<String> imports = readImports(script);
        if (imports == null && fallback == null) {
            throw new IllegalStateException("Settings are missing script.base_imports");
        }
        return new ScriptSettings(
            imports != null ? imports : fallback.baseImports(),
            text(script, "layout", fallback == null ? null : fallback.layout()),
            text(script, "load_function", fallback == null ? null : fallback.loadFunction()),
            text(script, "load_target", fallback == null ? null : fallback.loadTarget()),
            text(script, "load_placeholder", fallback == null ? null : fallback.loadPlaceholder()),
            script != null && script.contains("layout") ? baseDir : fallback == null ? null : fallback.baseDir()
        );
    }

    /** The layout text; a missing layout is a configuration error. */
    public String readLayout() {
        Path candidate = baseDir == null ? Path.of(layout) : baseDir.resolve(layout);
        if (Files.isRegularFile(candidate)) {
            try {
                return Files.readString(candidate);
            } catch (IOException e) {
                throw new IllegalStateException("Could not read script layout: " + candidate, e);
            }
        }
        return readResource(layout)
            .orElseThrow(() -> new IllegalStateException("Could not read script layout: " + layout));
    }

    private static TomlParseResult parse(String text, String source) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid settings " + source + ": " + result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; ")));
        }
        return result;
    }

    private static List<String> readImports(TomlTable script) {
        if (script == null || !script.isArray("base_imports")) {
            return null;
        }
        TomlArray array = script.getArray("base_imports");
        var imports = new ArrayList<String>();
        for (int i = 0; i < array.size(); i++) {
            imports.add(array.get(i).toString());
        }
        return imports;
    }

    private static String text(TomlTable script, String key, String fallback) {
        String value = script == null ? null : script.getString(key);
        if (value == null && fallback == null) {
            throw new IllegalStateException("Settings are missing script." + key);
        }
        return value != null ? value : fallback;
    }

    private static Optional<String> readResource(String name) {
        ClassLoader loader = ScriptSettings.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(name)) {
            if (in == null) {
                return Optional.empty();
            }
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read resource " + name, e);
        }
    }
}
