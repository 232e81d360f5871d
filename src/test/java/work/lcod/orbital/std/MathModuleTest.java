package work.lcod.orbital.std;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.orbital.support.RuntimeTestSupport.eval;
import static work.lcod.orbital.support.RuntimeTestSupport.op;

import org.junit.jupiter.api.Test;

class MathModuleTest {
    @Test
    void clampsIntoRange() {
        assertEquals(10.0, eval(op("math/clamp", 15, 0, 10)));
        assertEquals(0.0, eval(op("math/clamp", -3, 0, 10)));
        assertEquals(4.0, eval(op("math/clamp", 4, 0, 10)));
    }

    @Test
    void roundsHalfUp() {
        assertEquals(3.0, eval(op("math/round", 2.5)));
        assertEquals(-2.0, eval(op("math/round", -2.5)));
        assertEquals(1.3, eval(op("math/round", 1.26, 1)));
    }

    @Test
    void moduloTakesTheSignOfTheDivisor() {
        assertEquals(2.0, eval(op("math/mod", -1, 3)));
        assertEquals(1.0, eval(op("math/mod", 7, 3)));
    }

    @Test
    void interpolatesAndMapsRanges() {
        assertEquals(2.5, eval(op("math/lerp", 0, 10, 0.25)));
        assertEquals(50.0, eval(op("math/map", 5, 0, 10, 0, 100)));
        assertEquals(7.0, eval(op("math/map", 5, 3, 3, 7, 9)));
    }

    @Test
    void findsExtremes() {
        assertEquals(1.0, eval(op("math/min", 3, 1, 2)));
        assertEquals(3.0, eval(op("math/max", 3, "1", 2)));
        assertEquals(-1.0, eval(op("math/sign", -4)));
    }

    @Test
    void randomValuesStayInBounds() {
        assertEquals(3.0, eval(op("math/randomInt", 3, 3)));
        var value = (Double) eval(op("math/random"));
        assertTrue(value >= 0 && value < 1);
    }

    @Test
    void defaultReplacesNull() {
        assertEquals(5, eval(op("math/default", null, 5)));
        assertEquals(0, eval(op("math/default", 0, 5)));
    }
}
