package work.lcod.orbital.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class BindingTest {
    @Test
    void parsesCoreBindings() {
        var binding = Binding.parse("@entity.user.name").orElseThrow();
        assertEquals(BindingType.CORE, binding.type());
        assertEquals("entity", binding.root());
        assertEquals(List.of("user", "name"), binding.path());
        assertEquals("@entity.user.name", binding.render());
    }

    @Test
    void treatsUnknownRootsAsSingletonEntities() {
        var binding = Binding.parse("@Pagination.page").orElseThrow();
        assertEquals(BindingType.ENTITY, binding.type());
        assertEquals("Pagination", binding.root());
        assertTrue(binding.isValid());
        assertFalse(Binding.isValid("@Pagination"));
    }

    @Test
    void stateAndNowTakeNoPath() {
        assertTrue(Binding.isValid("@state"));
        assertTrue(Binding.isValid("@now"));
        assertFalse(Binding.isValid("@state.name"));
    }

    @Test
    void rejectsNonBindings() {
        assertTrue(Binding.parse("entity.x").isEmpty());
        assertTrue(Binding.parse("@").isEmpty());
        assertTrue(Binding.parse("@.x").isEmpty());
        assertFalse(Binding.isBinding(42));
    }
}
