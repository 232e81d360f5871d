package work.lcod.orbital.behavior;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class EngineSettingsTest {
    @Test
    void defaultsMatchTheEngineContract() {
        var settings = EngineSettings.defaults();
        assertEquals(GuardErrorPolicy.TREAT_AS_FALSE, settings.guardErrorPolicy());
        assertEquals(Duration.ofMillis(16), settings.frameInterval());
        assertEquals(1, settings.tickThreads());
        assertTrue(settings.awaitAsyncEffects());
        assertEquals(100, settings.maxChainedEvents());
    }

    @Test
    void loadsTheEngineTable() {
        var settings = EngineSettings.load(Path.of("src", "test", "resources", "settings", "engine.toml"));
        assertEquals(GuardErrorPolicy.PROPAGATE, settings.guardErrorPolicy());
        assertEquals(Duration.ofMillis(20), settings.frameInterval());
        assertEquals(2, settings.tickThreads());
        assertFalse(settings.awaitAsyncEffects());
        assertEquals(25, settings.maxChainedEvents());
    }

    @Test
    void keepsDefaultsForMissingKeys() {
        var settings = EngineSettings.parse("[engine]\nframeInterval = 33\n");
        assertEquals(Duration.ofMillis(33), settings.frameInterval());
        assertEquals(GuardErrorPolicy.TREAT_AS_FALSE, settings.guardErrorPolicy());
        assertEquals(EngineSettings.defaults(), EngineSettings.parse("title = \"no engine table\"\n"));
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.parse("[engine]\nguardErrorPolicy = \"ignore\"\n"));
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.parse("[engine]\ntickThreads = 0\n"));
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.parse("[engine\n"));
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.load(Path.of("src", "test", "resources", "settings", "absent.toml")));
    }

    @Test
    void parsesGuardPolicyNames() {
        assertEquals(GuardErrorPolicy.TREAT_AS_FALSE, GuardErrorPolicy.from("treat-as-false"));
        assertEquals(GuardErrorPolicy.PROPAGATE, GuardErrorPolicy.from(" Propagate "));
        assertEquals(GuardErrorPolicy.TREAT_AS_FALSE, GuardErrorPolicy.from(null));
    }
}
