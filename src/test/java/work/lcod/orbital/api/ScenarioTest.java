package work.lcod.orbital.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScenarioTest {
    @Test
    void parsesWaitStepsIntoDelays() {
        var scenario = Scenario.load(Path.of("src", "test", "resources", "scenarios", "health-clock.yaml"));
        var waits = scenario.steps().stream().filter(step -> step.kind() == Scenario.StepKind.WAIT).toList();
        assertEquals(1, waits.size());
        assertEquals(Duration.ofMillis(600), waits.get(0).delay());
    }

    @Test
    void keepsTheDelayWhenAddingExpectations() {
        var step = Scenario.Step.pause(Duration.ofSeconds(2)).expecting(Map.of("state", "Idle"));
        assertEquals(Duration.ofSeconds(2), step.delay());
        assertEquals(Map.of("state", "Idle"), step.expect());
        assertNull(Scenario.Step.event("GO", null).delay());
    }

    @Test
    void rejectsStepsWithoutAnAction() {
        var ex = assertThrows(IllegalArgumentException.class,
            () -> Scenario.fromMap(Map.of("behavior", "std/Switch", "events", List.of(Map.of("expect", Map.of())))));
        assertEquals("Step 1 must have one of event, tick or wait", ex.getMessage());
    }
}
