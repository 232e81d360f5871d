package work.lcod.orbital.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SExprTest {
    @Test
    void recognisesCallsByStringHead() {
        assertTrue(SExpr.isCall(List.of("+", 1, 2)));
        assertFalse(SExpr.isCall(List.of(1, 2)));
        assertFalse(SExpr.isCall(List.of()));
        assertFalse(SExpr.isCall("+"));
        assertEquals("+", SExpr.operatorOf(List.of("+", 1, 2)));
        assertNull(SExpr.operatorOf(List.of(1)));
        assertEquals(List.of(1, 2), SExpr.argsOf(List.of("+", 1, 2)));
        assertEquals(List.of(), SExpr.argsOf("plain"));
    }

    @Test
    void buildsCalls() {
        assertEquals(List.of("emit", "SAVE"), SExpr.call("emit", "SAVE"));
        assertThrows(IllegalArgumentException.class, () -> SExpr.call(" "));
    }

    @Test
    void collectsBindingsInOrderWithoutDuplicates() {
        var expr = List.of("+", "@entity.a", List.of("*", "@payload.b", "@entity.a"), List.of("fn", "x", "@x"));
        assertEquals(List.of("@entity.a", "@payload.b", "@x"), new ArrayList<>(SExpr.collectBindings(expr)));
    }

    @Test
    void doesNotEnterMapLiterals() {
        var expr = List.of("notify", Map.of("message", "@entity.title"), "@payload.kind");
        assertEquals(List.of("@payload.kind"), new ArrayList<>(SExpr.collectBindings(expr)));
    }

    @Test
    void walksEveryNodeWithItsParent() {
        var visited = new ArrayList<Object>();
        SExpr.walk(List.of("not", true), (node, parent, index) -> {
            if (parent != null) {
                visited.add(index + "=" + node);
            }
        });
        assertEquals(List.of("0=not", "1=true"), visited);
    }
}
