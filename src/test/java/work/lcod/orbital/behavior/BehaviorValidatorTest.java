package work.lcod.orbital.behavior;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.orbital.behavior.BehaviorLoaderTest.parse;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BehaviorValidatorTest {
    @Test
    void checksNameAndCategory() {
        var behavior = parse("""
            name: Toggle
            category: games
            stateMachine:
              states: [Off]
            """);
        assertEquals(List.of(
            "Behavior name should start with 'std/' (got: Toggle)",
            "Invalid category: games"
        ), BehaviorValidator.validate(behavior));
    }

    @Test
    void requiresStates() {
        var behavior = parse("""
            category: feedback
            stateMachine:
              states: []
            """);
        assertEquals(List.of(
            "Behavior must have a name",
            "State machine must have at least one state"
        ), BehaviorValidator.validateStructure(behavior));
    }

    @Test
    void reportsUndeclaredInitialStateEventsAndStates() {
        var behavior = parse("""
            name: std/Broken
            category: async
            stateMachine:
              initial: Ghost
              states: [Idle]
              events: [GO]
              transitions:
                - { from: Nowhere, to: Elsewhere, event: JUMP }
                - { from: "*", to: Idle, event: GO }
            ticks:
              - { name: Spin, appliesTo: [Moon] }
            """);
        assertEquals(List.of(
            "Initial state is not declared: Ghost",
            "Transition uses undeclared event: JUMP",
            "Transition from undeclared state: Nowhere",
            "Transition to undeclared state: Elsewhere",
            "Tick Spin applies to undeclared state: Moon"
        ), BehaviorValidator.validate(behavior));
    }

    @Test
    void requireValidCarriesTheErrors() {
        var behavior = parse("""
            name: std/Broken
            category: async
            stateMachine:
              states: [Idle]
              transitions:
                - { event: GO }
            """);
        var ex = assertThrows(BehaviorDefinitionException.class, () -> BehaviorValidator.requireValid(behavior));
        assertEquals(BehaviorDefinitionException.INVALID, ex.code());
        assertTrue(ex.getMessage().startsWith("Invalid behavior std/Broken: "));
        assertEquals(List.of("Transition uses undeclared event: GO"), ((Map<?, ?>) ex.data()).get("errors"));
    }
}
