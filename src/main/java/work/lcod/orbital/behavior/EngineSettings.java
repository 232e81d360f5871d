package work.lcod.orbital.behavior;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import org.tomlj.Toml;
import org.tomlj.TomlTable;
import work.lcod.orbital.shared.DurationParser;

/**
 * Engine-wide knobs. Loadable from the {@code [engine]} table of a TOML file:
 *
 * <pre>
 * [engine]
 * guardErrorPolicy = "treat-as-false"
 * frameInterval = "16ms"
 * tickThreads = 1
 * awaitAsyncEffects = true
 * maxChainedEvents = 100
 * </pre>
 */
public record EngineSettings(
    GuardErrorPolicy guardErrorPolicy,
    Duration frameInterval,
    int tickThreads,
    boolean awaitAsyncEffects,
    int maxChainedEvents
) {
    public static final Duration DEFAULT_FRAME_INTERVAL = Duration.ofMillis(16);

    public EngineSettings {
        Objects.requireNonNull(guardErrorPolicy, "guardErrorPolicy");
        Objects.requireNonNull(frameInterval, "frameInterval");
        if (frameInterval.isZero() || frameInterval.isNegative()) {
            throw new IllegalArgumentException("frameInterval must be positive");
        }
        if (tickThreads < 1) {
            throw new IllegalArgumentException("tickThreads must be at least 1");
        }
        if (maxChainedEvents < 1) {
            throw new IllegalArgumentException("maxChainedEvents must be at least 1");
        }
    }

    public static EngineSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineSettings load(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read settings " + file + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Reads the {@code [engine]} table; missing keys keep their defaults.
     */
    public static EngineSettings parse(String toml) {
        var result = Toml.parse(toml);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid settings: " + result.errors().get(0).toString());
        }
        var builder = builder();
        TomlTable engine = result.getTable("engine");
        if (engine == null) {
            return builder.build();
        }
        if (engine.contains("guardErrorPolicy")) {
            builder.guardErrorPolicy(GuardErrorPolicy.from(engine.getString("guardErrorPolicy")));
        }
        if (engine.contains("frameInterval")) {
            var raw = engine.get("frameInterval");
            builder.frameInterval(DurationParser.parse(raw)
                .orElseThrow(() -> new IllegalArgumentException("Invalid frameInterval: " + raw)));
        }
        if (engine.contains("tickThreads")) {
            builder.tickThreads(Math.toIntExact(engine.getLong("tickThreads")));
        }
        if (engine.contains("awaitAsyncEffects")) {
            builder.awaitAsyncEffects(engine.getBoolean("awaitAsyncEffects"));
        }
        if (engine.contains("maxChainedEvents")) {
            builder.maxChainedEvents(Math.toIntExact(engine.getLong("maxChainedEvents")));
        }
        return builder.build();
    }

    public static final class Builder {
        private GuardErrorPolicy guardErrorPolicy = GuardErrorPolicy.TREAT_AS_FALSE;
        private Duration frameInterval = DEFAULT_FRAME_INTERVAL;
        private int tickThreads = 1;
        private boolean awaitAsyncEffects = true;
        private int maxChainedEvents = 100;

        public Builder guardErrorPolicy(GuardErrorPolicy guardErrorPolicy) {
            this.guardErrorPolicy = guardErrorPolicy;
            return this;
        }

        public Builder frameInterval(Duration frameInterval) {
            this.frameInterval = frameInterval;
            return this;
        }

        public Builder tickThreads(int tickThreads) {
            this.tickThreads = tickThreads;
            return this;
        }

        public Builder awaitAsyncEffects(boolean awaitAsyncEffects) {
            this.awaitAsyncEffects = awaitAsyncEffects;
            return this;
        }

        public Builder maxChainedEvents(int maxChainedEvents) {
            this.maxChainedEvents = maxChainedEvents;
            return this;
        }

        public EngineSettings build() {
            return new EngineSettings(guardErrorPolicy, frameInterval, tickThreads, awaitAsyncEffects, maxChainedEvents);
        }
    }
}
