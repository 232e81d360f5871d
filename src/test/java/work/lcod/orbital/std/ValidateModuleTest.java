package work.lcod.orbital.std;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.orbital.support.RuntimeTestSupport.context;
import static work.lcod.orbital.support.RuntimeTestSupport.eval;
import static work.lcod.orbital.support.RuntimeTestSupport.list;
import static work.lcod.orbital.support.RuntimeTestSupport.map;
import static work.lcod.orbital.support.RuntimeTestSupport.op;

import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.Test;

class ValidateModuleTest {
    @Test
    void checksFormats() {
        assertEquals(true, eval(op("validate/email", "ada@example.com")));
        assertEquals(false, eval(op("validate/email", "not an email")));
        assertEquals(true, eval(op("validate/url", "https://example.com/a?b=c")));
        assertEquals(false, eval(op("validate/url", "relative/path")));
        assertEquals(true, eval(op("validate/uuid", "123e4567-e89b-12d3-a456-426614174000")));
        assertEquals(true, eval(op("validate/phone", "+1 (555) 123-4567")));
        assertEquals(true, eval(op("validate/creditCard", "4111 1111 1111 1111")));
        assertEquals(false, eval(op("validate/creditCard", "4111 1111 1111 1112")));
        assertEquals(true, eval(op("validate/date", "2024-02-29")));
        assertEquals(false, eval(op("validate/date", "yesterday")));
    }

    @Test
    void checksTypesAndBounds() {
        assertEquals(true, eval(op("validate/required", 0)));
        assertEquals(false, eval(op("validate/required", "")));
        assertEquals(true, eval(op("validate/range", 5, 1, 10)));
        assertEquals(false, eval(op("validate/min", "20", 18)));
        assertEquals(true, eval(op("validate/minLength", "abc", 3)));
        assertEquals(false, eval(op("validate/maxLength", 12345, 3)));
        assertEquals(true, eval(op("validate/pattern", "abc-123", "\\d+$")));
        assertEquals(false, eval(op("validate/pattern", "abc", "(")));
    }

    @Test
    void checksMembership() {
        var ctx = context(new LinkedHashMap<>(), map("roles", list("admin", "editor")));
        assertEquals(true, eval(op("validate/oneOf", "editor", "@payload.roles"), ctx));
        assertEquals(false, eval(op("validate/noneOf", "admin", "@payload.roles"), ctx));
    }

    @Test
    void collectsErrorsPerField() {
        var value = map("email", "bad", "age", 15, "name", "Ada");
        var rules = map(
            "email", list(list("required"), list("email")),
            "age", list(list("min", 18)),
            "name", list(list("required"), list("unknownRule"))
        );
        var result = eval(op("validate/check", value, rules));
        assertEquals(map("valid", false, "errors", List.of("email: email validation failed", "age: min validation failed")), result);
        assertEquals(map("valid", true, "errors", List.of()), ValidateModule.check(map("age", 20), map("age", list(list("min", 18)))));
    }
}
