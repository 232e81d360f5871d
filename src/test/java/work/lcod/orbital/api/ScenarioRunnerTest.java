package work.lcod.orbital.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.orbital.behavior.EngineSettings;

class ScenarioRunnerTest {
    private static final Path SCENARIOS = Path.of("src", "test", "resources", "scenarios");

    private final ScenarioRunner runner = new ScenarioRunner();

    @Test
    void runsPaginationScenario() {
        var result = runner.run(configuration(SCENARIOS.resolve("pagination.yaml")));
        assertEquals(RunResult.Status.SUCCESS, result.status(), () -> String.valueOf(result.metadata()));
        assertEquals("std/Pagination", result.metadata().get("behavior"));
        assertEquals("Active", result.finalState().orElseThrow());
        assertEquals(4, ((List<?>) result.metadata().get("transitions")).size());
        assertTrue(result.metadata().get("scenario").toString().endsWith("pagination.yaml"));
    }

    @Test
    void advancesTheFixedClockOnWaits() {
        var result = runner.run(configuration(SCENARIOS.resolve("health-clock.yaml")));
        assertEquals(RunResult.Status.SUCCESS, result.status(), () -> String.valueOf(result.metadata()));
        assertEquals("Alive", result.metadata().get("finalState"));
        @SuppressWarnings("unchecked")
        var effects = (List<Map<String, Object>>) result.metadata().get("effects");
        assertEquals("render-ui", effects.get(0).get("kind"));
        assertEquals("hud.health", effects.get(0).get("slot"));
    }

    @Test
    void reportsFailedExpectations() {
        var result = runner.run(configuration(SCENARIOS.resolve("unreachable-page.yaml")));
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("Step 1: expected entity.page = 5 but was 2.0", result.metadata().get("error"));
        assertEquals(1, result.status().exitCode());
    }

    @Test
    void reportsUnknownBehaviors() {
        var scenario = Scenario.fromMap(Map.of("behavior", "std/Paginaton"));
        var result = runner.run(scenario, EngineSettings.defaults());
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("Unknown behavior 'std/Paginaton'. Did you mean: std/Pagination?", result.metadata().get("error"));
        assertEquals("UNKNOWN_BEHAVIOR", result.metadata().get("errorCode"));
    }

    @Test
    void runsInlineDefinitions() {
        var scenario = Scenario.fromMap(Map.of(
            "definition", Map.of(
                "name", "std/Switch",
                "category", "ui-interaction",
                "stateMachine", Map.of(
                    "initial", "Off",
                    "states", List.of("Off", "On"),
                    "events", List.of("FLIP"),
                    "transitions", List.of(
                        Map.of("from", "Off", "to", "On", "event", "FLIP"),
                        Map.of("from", "On", "to", "Off", "event", "FLIP")))),
            "events", List.of(
                Map.of("event", "FLIP"),
                Map.of("event", "FLIP"),
                Map.of("event", "FLIP", "expect", Map.of("state", "On")))));
        var result = runner.run(scenario, EngineSettings.defaults());
        assertEquals(RunResult.Status.SUCCESS, result.status(), () -> String.valueOf(result.metadata()));
        assertEquals("On", result.metadata().get("finalState"));
    }

    @Test
    void timesOutSlowScenarios(@TempDir Path dir) throws Exception {
        var file = dir.resolve("slow.yaml");
        Files.writeString(file, """
            behavior: std/Pagination
            events:
              - wait: 2s
            """);
        var config = RunConfiguration.builder()
            .scenario(file)
            .timeout(Optional.of(Duration.ofMillis(50)))
            .build();
        var result = runner.run(config);
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("Scenario timed out after 50ms", result.metadata().get("error"));
        assertEquals("TIMEOUT", result.metadata().get("errorCode"));
    }

    @Test
    void reportsMissingScenarioFiles() {
        var result = runner.run(configuration(Path.of("src", "test", "resources", "scenarios", "missing.yaml")));
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertTrue(result.metadata().get("error").toString().startsWith("Unable to read scenario"));
    }

    private static RunConfiguration configuration(Path scenario) {
        return RunConfiguration.builder().scenario(scenario).build();
    }
}
