package work.lcod.orbital.std;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.orbital.support.RuntimeTestSupport.eval;
import static work.lcod.orbital.support.RuntimeTestSupport.map;
import static work.lcod.orbital.support.RuntimeTestSupport.op;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringModuleTest {
    @Test
    void splitsAndJoins() {
        assertEquals(List.of("a", "b", "", "c"), eval(op("str/split", "a,b,,c", ",")));
        assertEquals(List.of("x", "y"), eval(op("str/split", "xy", "")));
        assertEquals("a+b", eval(op("str/join", op("str/split", "a-b", "-"), "+")));
    }

    @Test
    void slicesFromTheEnd() {
        assertEquals("llo", eval(op("str/slice", "hello", -3)));
        assertEquals("el", eval(op("str/slice", "hello", 1, 3)));
        assertEquals("", eval(op("str/slice", "hello", 4, 2)));
    }

    @Test
    void padsAndTruncates() {
        assertEquals("007", eval(op("str/padStart", "7", 3, "0")));
        assertEquals("ab--", eval(op("str/padEnd", "ab", 4, "-")));
        assertEquals("abc...", eval(op("str/truncate", "abcdefghij", 6)));
        assertEquals("short", eval(op("str/truncate", "short", 6)));
    }

    @Test
    void convertsCase() {
        assertEquals("helloWorldFoo", eval(op("str/camelCase", "hello world-foo")));
        assertEquals("hello-world-foo", eval(op("str/kebabCase", "helloWorld Foo")));
        assertEquals("hello_world_foo", eval(op("str/snakeCase", "helloWorld Foo")));
        assertEquals("Hello Big World", eval(op("str/titleCase", "hello bIG world")));
        assertEquals("Ada", eval(op("str/capitalize", "ada")));
    }

    @Test
    void fillsTemplates() {
        assertEquals("Hi Ada, !", eval(op("str/template", "Hi {name}, {missing}!", map("name", "Ada"))));
    }

    @Test
    void replacesFirstOrEveryOccurrence() {
        assertEquals("a.b-c", eval(op("str/replace", "a-b-c", "-", ".")));
        assertEquals("a.b.c", eval(op("str/replaceAll", "a-b-c", "-", ".")));
    }

    @Test
    void concatenatesStringForms() {
        assertEquals("a12.5", eval(op("str/concat", "a", 1, null, 2.5)));
        assertEquals("x", eval(op("str/default", "", "x")));
        assertEquals(5.0, eval(op("str/len", "hello")));
    }
}
