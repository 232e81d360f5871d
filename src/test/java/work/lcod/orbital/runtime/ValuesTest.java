package work.lcod.orbital.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValuesTest {
    @Test
    void coercesToNumbers() {
        assertEquals(12.5, Values.toNumber("12.5px"));
        assertEquals(0.0, Values.toNumber("abc"));
        assertEquals(1.0, Values.toNumber(true));
        assertEquals(0.0, Values.toNumber(null));
        assertTrue(Double.isNaN(Values.parseFloat("x1")));
        assertTrue(Double.isNaN(Values.strictNumber("12px")));
    }

    @Test
    void followsTruthiness() {
        assertFalse(Values.isTruthy(null));
        assertFalse(Values.isTruthy(0));
        assertFalse(Values.isTruthy(Double.NaN));
        assertFalse(Values.isTruthy(""));
        assertTrue(Values.isTruthy("0"));
        assertTrue(Values.isTruthy(List.of()));
        assertTrue(Values.isTruthy(Map.of()));
    }

    @Test
    void formatsNumbersWithoutTrailingZeros() {
        assertEquals("3", Values.stringify(3.0));
        assertEquals("2.5", Values.stringify(2.5));
        assertEquals("Infinity", Values.stringify(Double.POSITIVE_INFINITY));
        assertEquals("1,2", Values.stringify(List.of(1, 2)));
        assertEquals("null", Values.stringify(null));
    }

    @Test
    void comparesMixedTypes() {
        assertEquals(-1, Values.compare(1, 2));
        assertEquals(0, Values.compare("5", 5));
        assertEquals(1, Values.compare("b", "a"));
        assertNull(Values.compare("abc", 1));
        assertEquals(0, Values.compare(null, 0));
    }

    @Test
    void deepCopiesNestedStructures() {
        var inner = new ArrayList<Object>(List.of(1, 2));
        var original = new LinkedHashMap<String, Object>();
        original.put("items", inner);
        @SuppressWarnings("unchecked")
        var copy = (Map<String, Object>) Values.deepCopy(original);
        assertEquals(original, copy);
        assertNotSame(inner, copy.get("items"));
        assertTrue(Values.deepEquals(original, copy));
    }
}
