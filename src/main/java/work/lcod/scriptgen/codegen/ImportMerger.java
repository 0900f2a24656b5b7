package work.lcod.scriptgen.codegen;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import work.lcod.scriptgen.ir.CodeParseException;
import work.lcod.scriptgen.ir.ParsedModule;
import work.lcod.scriptgen.ir.SourceParser;
import work.lcod.scriptgen.ir.Stmt;
import work.lcod.scriptgen.ir.Stmt.Alias;
import work.lcod.scriptgen.ir.Stmt.FromImport;
import work.lcod.scriptgen.ir.Stmt.Import;

/**
 * Moves top-level imports out of action code and merges them into one sorted, duplicate-free block.
 */
public final class ImportMerger {
    private static final Logger LOG = LoggerFactory.getLogger(ImportMerger.class);
    private static final Comparator<Alias> BY_NAME = Comparator.comparing(Alias::name)
        .thenComparing(Alias::asName, Comparator.nullsFirst(Comparator.naturalOrder()));

    private ImportMerger() {}

    /** Imports found at the top level of some code, and the code without their lines. */
    public record Extraction(List<Stmt> imports, String code) {
        public Extraction {
            imports = List.copyOf(imports);
        }
    }

    /**
     * Removes the source lines of top-level import statements; every other line, comments included, is kept as
     * is. Code that does not parse is returned unchanged with no imports.
     */
    public static Extraction extract(String code) {
        ParsedModule module;
        try {
            module = SourceParser.parse(code);
        } catch (CodeParseException e) {
            LOG.debug("Keeping imports in place, code does not parse: {}", e.getMessage());
            return new Extraction(List.of(), code);
        }
        var imports = new ArrayList<Stmt>();
        Set<Integer> removed = new HashSet<>();
        for (int i = 0; i < module.body().size(); i++) {
            Stmt statement = module.body().get(i);
            if (statement instanceof Import || statement instanceof FromImport) {
                imports.add(statement);
                var span = module.spans().get(i);
                for (int line = span.firstLine(); line <= span.lastLine(); line++) {
                    removed.add(line);
                }
            }
        }
        if (imports.isEmpty()) {
            return new Extraction(List.of(), code);
        }
        String[] lines = code.split("\n", -1);
        var kept = new ArrayList<String>();
        for (int i = 0; i < lines.length; i++) {
            if (!removed.contains(i + 1)) {
                kept.add(lines[i]);
            }
        }
        return new Extraction(imports, String.join("\n", kept));
    }

    /**
     * Plain imports first, deduplicated and sorted as text, then one line per from-module in module order with
     * its names sorted. Other statements are ignored.
     */
    public static String merge(List<? extends Stmt> imports) {
        Set<String> plain = new TreeSet<>();
        Map<String, Set<Alias>> fromImports = new TreeMap<>();
        for (Stmt statement : imports) {
            if (statement instanceof Import node) {
                node.names().forEach(alias -> plain.add("import " + alias.render()));
            } else if (statement instanceof FromImport node) {
                fromImports.computeIfAbsent(node.module(), module -> new LinkedHashSet<>()).addAll(node.names());
            }
        }
        var lines = new ArrayList<>(plain);
        fromImports.forEach((module, names) -> lines.add("from " + module + " import "
            + names.stream().sorted(BY_NAME).map(Alias::render).collect(Collectors.joining(", "))));
        return String.join("\n", lines);
    }
}
