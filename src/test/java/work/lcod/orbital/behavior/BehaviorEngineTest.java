package work.lcod.orbital.behavior;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.orbital.behavior.BehaviorLoaderTest.parse;
import static work.lcod.orbital.support.RuntimeTestSupport.awaitCondition;
import static work.lcod.orbital.support.RuntimeTestSupport.map;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;
import work.lcod.orbital.registry.BehaviorRegistry;
import work.lcod.orbital.runtime.ExpressionException;
import work.lcod.orbital.runtime.OperatorLibrary;
import work.lcod.orbital.runtime.Values;
import work.lcod.orbital.std.ObjectModule;
import work.lcod.orbital.support.RuntimeTestSupport.RecordingHost;

class BehaviorEngineTest {
    private static final BehaviorRegistry STD = BehaviorRegistry.standard();

    private static final String RELAY = """
        name: std/Relay
        category: async
        dataEntities:
          - name: RelayState
            fields:
              - { name: seenState, default: null }
        stateMachine:
          initial: Idle
          states: [Idle, Busy, Done]
          events: [START, FINISH, PING]
          transitions:
            - from: Idle
              to: Busy
              event: START
              effects:
                - [set, "@entity.seenState", "@state"]
                - [emit, FINISH]
            - { from: Busy, to: Done, event: FINISH }
            - from: "*"
              event: PING
              effects:
                - [emit, PING]
        """;

    private static final String DELAYED = """
        name: std/Delayed
        category: async
        stateMachine:
          initial: Idle
          states: [Idle, Waiting, Done]
          events: [START, DONE]
          transitions:
            - from: Idle
              to: Waiting
              event: START
              effects:
                - [async/delay, 20, [emit, DONE]]
            - { from: Waiting, to: Done, event: DONE }
        """;

    private static final String GUARDED = """
        name: std/Guarded
        category: feedback
        stateMachine:
          initial: Closed
          states: [Closed, Open]
          events: [OPEN]
          transitions:
            - from: Closed
              to: Open
              event: OPEN
              guard: [no/such-operator]
        """;

    private static final String FORM = """
        name: std/FormDraft
        category: data-management
        dataEntities:
          - name: FormState
            fields:
              - { name: form, default: {} }
              - { name: stepData, default: {} }
        stateMachine:
          initial: Editing
          states: [Editing]
          events: [RESET, FILL, SAVE_STEP]
          transitions:
            - from: Editing
              event: RESET
              effects:
                - [set, "@entity.form", {}]
            - from: Editing
              event: FILL
              effects:
                - [set, "@entity.form.name", "@payload.name"]
            - from: Editing
              event: SAVE_STEP
              effects:
                - [set, "@entity.stepData.first", "@payload"]
        """;

    @Test
    void pagesForwardUntilTheLastPage() {
        try (var engine = new BehaviorEngine()) {
            var instance = engine.create(STD.require("std/Pagination"), Map.of(), Map.of("totalItems", 45));
            assertEquals("Active", instance.state());
            assertTrue(instance.send("NEXT_PAGE").transitioned());
            assertTrue(instance.send("NEXT_PAGE").transitioned());
            assertEquals(3.0, instance.entity().get("page"));
            var blocked = instance.send("NEXT_PAGE");
            assertFalse(blocked.transitioned());
            assertEquals(3.0, instance.entity().get("page"));
            assertEquals(3.0, engine.singletons().get("PaginationState").get("page"));
        }
    }

    @Test
    void goToPageChecksThePayload() {
        try (var engine = new BehaviorEngine()) {
            var instance = engine.create(STD.require("std/Pagination"), Map.of("defaultPageSize", 10), Map.of("totalItems", 45));
            instance.send("INIT");
            assertEquals(10, instance.entity().get("pageSize"));
            assertFalse(instance.send("GO_TO_PAGE", map("page", 6)).transitioned());
            assertTrue(instance.send("GO_TO_PAGE", map("page", 5)).transitioned());
            assertEquals(5, instance.entity().get("page"));
        }
    }

    @Test
    void singleSelectionKeepsTheLatestItem() {
        try (var engine = new BehaviorEngine()) {
            var instance = engine.create(STD.require("std/Selection"), Map.of("mode", "single"));
            instance.send("SELECT", map("id", "a"));
            instance.send("SELECT", map("id", "b"));
            assertEquals(List.of("b"), instance.entity().get("selected"));
            assertEquals("b", instance.entity().get("lastSelected"));
        }
    }

    @Test
    void multiSelectionWarnsAtTheLimit() {
        var host = new RecordingHost();
        try (var engine = new BehaviorEngine()) {
            var instance = engine.create(
                STD.require("std/Selection"), Map.of("mode", "multi", "maxSelection", 2), Map.of(), host.handlers());
            instance.send("SELECT", map("id", "a"));
            instance.send("TOGGLE", map("id", "b"));
            var third = instance.send("SELECT", map("id", "c"));
            assertEquals(List.of("a", "b"), instance.entity().get("selected"));
            assertEquals(1, third.clientEffects().size());
            assertEquals("notify", third.clientEffects().get(0).kind());
            assertEquals("Maximum selection reached", third.clientEffects().get(0).data().get("message"));
            assertEquals(List.of("warning:Maximum selection reached"), host.notifications());
            instance.send("TOGGLE", map("id", "a"));
            assertEquals(List.of("b"), instance.entity().get("selected"));
        }
    }

    @Test
    void runsEffectsBeforeChangingStateAndChainsEmits() {
        try (var engine = new BehaviorEngine()) {
            var instance = engine.create(parse(RELAY));
            var result = instance.send("START");
            assertEquals("Idle", instance.entity().get("seenState"));
            assertEquals("Busy", result.toState());
            assertEquals(List.of(new TransitionResult.Emitted("FINISH", null)), result.emitted());
            assertEquals(1, result.followUps().size());
            assertEquals("Done", result.followUps().get(0).toState());
            assertEquals("Done", instance.state());
            assertNotNull(result.toMap().get("followUps"));
        }
    }

    @Test
    void stopsRunawayEventChains() {
        var settings = EngineSettings.builder().maxChainedEvents(5).build();
        try (var engine = new BehaviorEngine(settings)) {
            var instance = engine.create(parse(RELAY));
            var ex = assertThrows(IllegalStateException.class, () -> instance.send("PING"));
            assertTrue(ex.getMessage().contains("exceeded 5 events"));
            assertTrue(instance.send("START").transitioned());
        }
    }

    @Test
    void failingGuardsCountAsFalseByDefault() {
        try (var engine = new BehaviorEngine()) {
            var instance = engine.create(parse(GUARDED));
            var result = instance.send("OPEN");
            assertFalse(result.transitioned());
            assertEquals("Closed", instance.state());
            assertTrue(result.guardError().contains("Unknown operator: no/such-operator"));
        }
    }

    @Test
    void failingGuardsPropagateWhenConfigured() {
        var settings = EngineSettings.builder().guardErrorPolicy(GuardErrorPolicy.PROPAGATE).build();
        try (var engine = new BehaviorEngine(settings)) {
            var instance = engine.create(parse(GUARDED));
            var ex = assertThrows(ExpressionException.class, () -> instance.send("OPEN"));
            assertEquals(ExpressionException.UNKNOWN_OPERATOR, ex.code());
            assertEquals("Closed", instance.state());
        }
    }

    @Test
    void awaitsAsyncEffectsByDefault() {
        try (var engine = new BehaviorEngine()) {
            var instance = engine.create(parse(DELAYED));
            var result = instance.send("START");
            assertEquals("Done", instance.state());
            assertEquals("DONE", result.followUps().get(0).event());
        }
    }

    @Test
    void deliversEmitsFromTimerThreads() {
        var settings = EngineSettings.builder().awaitAsyncEffects(false).build();
        try (var engine = new BehaviorEngine(settings)) {
            var instance = engine.create(parse(DELAYED));
            var result = instance.send("START");
            assertEquals("Waiting", result.toState());
            assertTrue(awaitCondition(() -> "Done".equals(instance.state()), Duration.ofSeconds(2)));
        }
    }

    @Test
    void healthEndsInvulnerabilityOnTheClock() {
        var clock = new AtomicLong(10_000);
        try (var engine = new BehaviorEngine(OperatorLibrary.evaluator(), EngineSettings.defaults(), clock::get)) {
            var instance = engine.create(STD.require("std/Health"), Map.of("maxHealth", 50), Map.of("id", "hero"));
            var init = instance.send("INIT");
            assertEquals("render-ui", init.clientEffects().get(0).kind());
            assertEquals("hud.health", init.clientEffects().get(0).data().get("slot"));

            instance.send("DAMAGE", map("amount", 20));
            assertEquals("Damaged", instance.state());
            assertEquals(30.0, instance.entity().get("currentHealth"));
            assertEquals(true, instance.entity().get("isInvulnerable"));
            assertEquals(0, instance.runTicks());

            clock.addAndGet(600);
            assertEquals(1, instance.runTicks());
            assertEquals("Alive", instance.state());
            assertEquals(false, instance.entity().get("isInvulnerable"));
        }
    }

    @Test
    void lethalDamageChainsIntoDeath() {
        var host = new RecordingHost();
        try (var engine = new BehaviorEngine()) {
            var instance = engine.create(STD.require("std/Health"), Map.of("maxHealth", 50), Map.of("id", "hero"), host.handlers());
            instance.send("INIT");
            var result = instance.send("DAMAGE", map("amount", 80));
            assertEquals("Damaged", result.toState());
            var death = result.followUps().get(0);
            assertEquals("Dead", death.toState());
            assertEquals(new TransitionResult.Emitted("ENTITY_DIED", Map.of("entityId", "hero")), death.emitted().get(0));
            assertEquals("Dead", instance.state());
            assertEquals(List.of("DIE", "ENTITY_DIED"), host.emitted());
        }
    }

    @Test
    void runsTicksByPriority() {
        try (var engine = new BehaviorEngine()) {
            var instance = engine.create(STD.require("std/Physics2D"), Map.of(), Map.of("x", 0, "y", 10));
            assertEquals(2, instance.runTicks());
            assertEquals(0.5, instance.entity().get("vy"));
            assertEquals(10.5, instance.entity().get("y"));

            instance.send("FREEZE");
            assertEquals(0, instance.runTicks());
            assertEquals(10.5, instance.entity().get("y"));
        }
    }

    @Test
    void schedulesFrameTicks() {
        var host = new RecordingHost();
        var settings = EngineSettings.builder().frameInterval(Duration.ofMillis(5)).build();
        try (var engine = new BehaviorEngine(settings)) {
            var instance = engine.create(STD.require("std/GameLoop"), Map.of(), Map.of(), host.handlers());
            instance.send("START");
            assertEquals(1, engine.schedule(instance));
            assertTrue(awaitCondition(
                () -> Values.toNumber(instance.snapshot().entity().get("frameCount")) >= 3, Duration.ofSeconds(2)));
            assertTrue(host.emitted().contains("GAME_TICK"));
            instance.send("STOP");
            assertEquals("Stopped", instance.state());
        }
    }

    @Test
    void resolvesConfigIntervalsAndSnapshots() {
        try (var engine = new BehaviorEngine()) {
            var instance = engine.create(STD.require("std/Health"), Map.of("maxHealth", 10));
            var tick = instance.behavior().ticks().get(0);
            assertEquals(Duration.ofMillis(16), instance.tickInterval(tick).orElseThrow());

            var snapshot = instance.snapshot();
            instance.send("INIT");
            assertEquals(100, snapshot.entity().get("currentHealth"));
            assertEquals(10, instance.entity().get("currentHealth"));
            assertEquals("std/Health", snapshot.toMap().get("behavior"));
        }
    }

    @Test
    void rejectsInvalidUseOfInstancesAndSingletons() {
        try (var engine = new BehaviorEngine()) {
            assertThrows(IllegalArgumentException.class, () -> engine.registerSingleton("config", Map.of()));
            assertThrows(BehaviorConfigException.class, () -> engine.create(STD.require("std/Health")));
            var instance = engine.create(STD.require("std/Pagination"));
            instance.close();
            assertTrue(instance.isClosed());
            assertThrows(IllegalStateException.class, () -> instance.send("NEXT_PAGE"));
            assertFalse(engine.instances().contains(instance));
        }
    }

    @Test
    void storedValuesAreCopiedOutOfTheDefinition() {
        try (var engine = new BehaviorEngine()) {
            var behavior = parse(FORM);
            var first = engine.create(behavior);
            first.send("RESET");
            first.send("FILL", map("name", "alice"));
            assertEquals(Map.of("name", "alice"), first.entity().get("form"));

            var second = engine.create(behavior);
            second.send("RESET");
            assertEquals(Map.of(), second.entity().get("form"));
            assertEquals(List.of("set", "@entity.form", Map.of()), behavior.stateMachine().transitions().get(0).effects().get(0));
        }
    }

    @Test
    void storedPayloadsAreCopied() {
        try (var engine = new BehaviorEngine()) {
            var instance = engine.create(parse(FORM));
            var payload = map("email", "ada@example.org");
            instance.send("SAVE_STEP", payload);
            payload.put("email", "changed@example.org");
            assertEquals("ada@example.org", ObjectModule.getPath(instance.entity(), "stepData.first.email"));
        }
    }
}
