package work.lcod.scriptgen.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of a {@link ScriptEngine}. Absent files mean the bundled defaults; an absent log level
 * leaves the logging configuration alone.
 */
public record EngineConfiguration(
    Optional<Path> settingsFile,
    Optional<Path> apiCatalog,
    Optional<LogLevel> logLevel
) {
    public EngineConfiguration {
        Objects.requireNonNull(settingsFile, "settingsFile");
        Objects.requireNonNull(apiCatalog, "apiCatalog");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static EngineConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Optional<Path> settingsFile = Optional.empty();
        private Optional<Path> apiCatalog = Optional.empty();
        private Optional<LogLevel> logLevel = Optional.ofNullable(System.getProperty("scriptgen.log.level"))
            .map(LogLevel::from);

        public Builder settingsFile(Path settingsFile) {
            this.settingsFile = Optional.ofNullable(settingsFile);
            return this;
        }

        public Builder apiCatalog(Path apiCatalog) {
            this.apiCatalog = Optional.ofNullable(apiCatalog);
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = Optional.ofNullable(logLevel);
            return this;
        }

        public EngineConfiguration build() {
            return new EngineConfiguration(settingsFile, apiCatalog, logLevel);
        }
    }
}
