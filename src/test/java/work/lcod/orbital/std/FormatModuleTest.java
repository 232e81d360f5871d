package work.lcod.orbital.std;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.orbital.support.RuntimeTestSupport.context;
import static work.lcod.orbital.support.RuntimeTestSupport.eval;
import static work.lcod.orbital.support.RuntimeTestSupport.list;
import static work.lcod.orbital.support.RuntimeTestSupport.map;
import static work.lcod.orbital.support.RuntimeTestSupport.op;

import java.util.LinkedHashMap;
import org.junit.jupiter.api.Test;
import work.lcod.orbital.runtime.ExpressionException;

class FormatModuleTest {
    @Test
    void formatsNumbersForALocale() {
        assertEquals("1,234,567.89", eval(op("format/number", 1234567.891, map("decimals", 2))));
        assertEquals("1.234,5", eval(op("format/number", 1234.5, map("decimals", 1, "locale", "de-DE"))));
        assertEquals("$1,234.50", eval(op("format/currency", 1234.5, "usd")));
        assertEquals("25.6%", eval(op("format/percent", 0.256, 1)));
    }

    @Test
    void rejectsUnknownCurrencies() {
        var ex = assertThrows(ExpressionException.class, () -> eval(op("format/currency", 1, "zzz")));
        assertEquals(2, ex.position());
    }

    @Test
    void formatsBinarySizes() {
        assertEquals("500 B", FormatModule.bytes(500));
        assertEquals("1 KB", FormatModule.bytes(1024));
        assertEquals("1.5 KB", FormatModule.bytes(1536));
        assertEquals("12 MB", FormatModule.bytes(12.3 * 1024 * 1024));
    }

    @Test
    void picksOrdinalSuffixes() {
        assertEquals("1st", FormatModule.ordinal(1));
        assertEquals("11th", FormatModule.ordinal(11));
        assertEquals("22nd", FormatModule.ordinal(22));
        assertEquals("113th", FormatModule.ordinal(113));
    }

    @Test
    void pluralizesAndJoinsLists() {
        assertEquals("1 item", eval(op("format/plural", 1, "item", "items")));
        assertEquals("3 items", eval(op("format/plural", 3, "item", "items")));
        var ctx = context(new LinkedHashMap<>(), map("names", list("Ann", "Bob", "Cy")));
        assertEquals("Ann, Bob, and Cy", eval(op("format/list", "@payload.names"), ctx));
        assertEquals("1 or 2", eval(op("format/list", list(1, 2), "or")));
    }

    @Test
    void masksContactAndCardNumbers() {
        assertEquals("(555) 123-4567", FormatModule.phone("555.123.4567", "US"));
        assertEquals("+1 (555) 123-4567", FormatModule.phone("15551234567", "US"));
        assertEquals("•••• •••• •••• 1111", FormatModule.creditCard("4111-1111-1111-1111"));
    }
}
