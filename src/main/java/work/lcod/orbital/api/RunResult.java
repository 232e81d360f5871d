package work.lcod.orbital.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a scenario run. {@code metadata} carries the behavior name, final state, entity,
 * transitions and recorded effects on success, and {@code error} (plus {@code errorCode} for
 * coded failures) otherwise.
 */
public record RunResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunResult success(Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    public static RunResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        return failure(null, message, metadata, startedAt);
    }

    /**
     * Failed run; an {@code error} already present in {@code metadata} wins over {@code message}.
     */
    public static RunResult failure(String code, String message, Map<String, Object> metadata, Instant startedAt) {
        var meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        if (code != null) {
            meta.putIfAbsent("errorCode", code);
        }
        return new RunResult(Status.FAILURE, meta, startedAt, Instant.now());
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    public Optional<String> finalState() {
        return Optional.ofNullable(metadata.get("finalState")).map(Object::toString);
    }

    public Optional<String> error() {
        return Optional.ofNullable(metadata.get("error")).map(Object::toString);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        var serializable = new LinkedHashMap<String, Object>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        finalState().ifPresent(state -> serializable.put("finalState", state));
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        serializable.put("elapsedMs", elapsed().toMillis());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Run result is not serializable: " + ex.getOriginalMessage(), ex);
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
