package work.lcod.orbital.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of a scenario run.
 */
public record RunConfiguration(
    Path scenario,
    Optional<Path> settingsFile,
    Optional<Duration> timeout,
    LogLevel logLevel
) {
    public RunConfiguration {
        Objects.requireNonNull(scenario, "scenario");
        Objects.requireNonNull(settingsFile, "settingsFile");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path scenario;
        private Optional<Path> settingsFile = Optional.empty();
        private Optional<Duration> timeout = Optional.empty();
        private LogLevel logLevel = LogLevel.FATAL;

        public Builder scenario(Path scenario) {
            this.scenario = scenario;
            return this;
        }

        public Builder settingsFile(Optional<Path> settingsFile) {
            this.settingsFile = settingsFile;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(scenario, settingsFile, timeout, logLevel);
        }
    }
}
