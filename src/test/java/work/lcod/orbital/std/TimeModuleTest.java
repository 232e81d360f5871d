package work.lcod.orbital.std;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.orbital.support.RuntimeTestSupport.eval;
import static work.lcod.orbital.support.RuntimeTestSupport.op;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.orbital.runtime.EvaluationContext;

class TimeModuleTest {
    private static final long MARCH_15 = Instant.parse("2024-03-15T10:30:45.123Z").toEpochMilli();
    private static final long HOUR = 3_600_000L;

    private static EvaluationContext at(long now) {
        return EvaluationContext.builder().entity(Map.of()).payload(Map.of()).now(now).build();
    }

    @Test
    void readsTheContextClock() {
        assertEquals((double) MARCH_15, eval(op("time/now"), at(MARCH_15)));
        assertEquals((double) Instant.parse("2024-03-15T00:00:00Z").toEpochMilli(), eval(op("time/today"), at(MARCH_15)));
    }

    @Test
    void parsesIsoVariantsInUtc() {
        assertEquals((double) MARCH_15, eval(op("time/parse", "2024-03-15T10:30:45.123Z")));
        assertEquals((double) MARCH_15, eval(op("time/parse", "2024-03-15T12:30:45.123+02:00")));
        assertEquals((double) MARCH_15, eval(op("time/parse", "2024-03-15T10:30:45.123")));
        assertTrue(Double.isNaN((Double) eval(op("time/parse", "soon"))));
    }

    @Test
    void formatsWithTokens() {
        assertEquals("2024-03-15 10:30:45.123", TimeModule.format(MARCH_15, "YYYY-MM-DD HH:mm:ss.SSS"));
        assertEquals("Friday, March 15", TimeModule.format(MARCH_15, "dddd, MMMM D"));
        assertEquals(5.0, eval(op("time/weekday", MARCH_15)));
    }

    @Test
    void shiftsAndComparesCalendarUnits() {
        assertEquals(Instant.parse("2024-04-15T10:30:45.123Z").toEpochMilli(), TimeModule.add(MARCH_15, 1, "month"));
        assertEquals(5.0, TimeModule.diff(MARCH_15 + 5 * 24 * HOUR + 1, MARCH_15, "day"));
        assertEquals(Instant.parse("2024-03-10T00:00:00Z").toEpochMilli(), TimeModule.startOf(MARCH_15, "week"));
        assertEquals(Instant.parse("2024-03-31T23:59:59.999Z").toEpochMilli(), TimeModule.endOf(MARCH_15, "month"));
        assertTrue(TimeModule.isSame(MARCH_15, MARCH_15 + HOUR, "day"));
    }

    @Test
    void describesRelativeTimes() {
        assertEquals("just now", eval(op("time/relative", MARCH_15 - 30_000), at(MARCH_15)));
        assertEquals("3 hours ago", eval(op("time/relative", MARCH_15 - 3 * HOUR), at(MARCH_15)));
        assertEquals("in 2 days", TimeModule.relative(MARCH_15 + 48 * HOUR, MARCH_15));
        assertEquals(true, eval(op("time/isPast", MARCH_15 - 1), at(MARCH_15)));
    }

    @Test
    void formatsDurations() {
        assertEquals("1h 30m", TimeModule.duration(90 * 60_000L));
        assertEquals("1d 1h 1m", TimeModule.duration(90_061_000L));
        assertEquals("0s", TimeModule.duration(400));
    }
}
