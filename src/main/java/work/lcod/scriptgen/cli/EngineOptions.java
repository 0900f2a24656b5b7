package work.lcod.scriptgen.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import picocli.CommandLine;
import work.lcod.scriptgen.api.EngineConfiguration;
import work.lcod.scriptgen.api.LogLevel;
import work.lcod.scriptgen.api.ScriptEngine;

/**
 * Options shared by every subcommand: engine configuration plus input and output plumbing.
 */
final class EngineOptions {
    @CommandLine.Option(
        names = "--settings",
        description = "TOML settings file overriding the bundled [script] settings.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path settings;

    @CommandLine.Option(
        names = "--api-catalog",
        description = "YAML catalogue of external function signatures (default: bundled MNE catalogue).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path apiCatalog;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String logLevelRaw;

    ScriptEngine engine() {
        var builder = EngineConfiguration.builder()
            .settingsFile(settings)
            .apiCatalog(apiCatalog);
        if (logLevelRaw != null && !logLevelRaw.isBlank()) {
            builder.logLevel(LogLevel.from(logLevelRaw));
        }
        return ScriptEngine.create(builder.build());
    }

    /** Reads a file, or standard input for {@code -}. */
    static String readInput(String source) {
        if ("-".equals(source)) {
            try {
                return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new IllegalStateException("Cannot read standard input", ex);
            }
        }
        Path path = Path.of(source).toAbsolutePath().normalize();
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Cannot read input file: " + path, ex);
        }
    }

    /** Writes to {@code output}, or prints to the command's standard output when it is {@code null}. */
    static void writeOutput(CommandLine.Model.CommandSpec spec, Path output, String text) {
        if (output == null) {
            spec.commandLine().getOut().println(text);
            spec.commandLine().getOut().flush();
            return;
        }
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, text.endsWith("\n") ? text : text + "\n", StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot write " + output, ex);
        }
    }
}
