package work.lcod.orbital.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class EditDistanceTest {
    @Test
    void countsInsertionsDeletionsAndSubstitutions() {
        assertEquals(3, EditDistance.between("kitten", "sitting"));
        assertEquals(1, EditDistance.between("paginaton", "pagination"));
        assertEquals(0, EditDistance.between("tabs", "tabs"));
    }

    @Test
    void emptyStringsCostTheOtherLength() {
        assertEquals(4, EditDistance.between("", "poll"));
        assertEquals(4, EditDistance.between("undo", ""));
        assertEquals(0, EditDistance.between("", ""));
    }
}
