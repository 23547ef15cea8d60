package work.lcod.survey.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LooseValuesTest {
    @Test
    void coercesStringsToNumbers() {
        assertEquals(18d, LooseValues.toNumber("18"));
        assertEquals(2.5d, LooseValues.toNumber(" 2.5 "));
        assertEquals(0d, LooseValues.toNumber(""));
        assertEquals(255d, LooseValues.toNumber("0xff"));
        assertTrue(Double.isNaN(LooseValues.toNumber("abc")));
    }

    @Test
    void coercesHexWiderThanALong() {
        assertEquals(0x1p64, LooseValues.toNumber("0x10000000000000000"));
        assertTrue(LooseValues.isNumeric("0xFFFFFFFFFFFFFFFFFF"));
    }

    @Test
    void coercesBooleansNullAndLists() {
        assertEquals(1d, LooseValues.toNumber(true));
        assertEquals(0d, LooseValues.toNumber(null));
        assertEquals(0d, LooseValues.toNumber(List.of()));
        assertEquals(7d, LooseValues.toNumber(List.of("7")));
        assertTrue(Double.isNaN(LooseValues.toNumber(List.of(1, 2))));
    }

    @Test
    void stringifiesLikeFormValues() {
        assertEquals("5", LooseValues.stringify(5.0d));
        assertEquals("2.5", LooseValues.stringify(2.5d));
        assertEquals("a,b", LooseValues.stringify(List.of("a", "b")));
        assertEquals("[object Object]", LooseValues.stringify(Map.of("k", 1)));
        assertEquals("null", LooseValues.stringify(null));
    }

    @Test
    void looseEqualityCoercesAcrossTypes() {
        assertTrue(LooseValues.looseEquals("5", 5));
        assertTrue(LooseValues.looseEquals(1, true));
        assertTrue(LooseValues.looseEquals("", 0));
        assertFalse(LooseValues.looseEquals("yes", "no"));
        assertFalse(LooseValues.looseEquals(null, ""));
        assertTrue(LooseValues.looseEquals(null, null));
    }

    @Test
    void strictEqualityOnlyCoercesNumbers() {
        assertTrue(LooseValues.strictEquals(1, 1.0d));
        assertFalse(LooseValues.strictEquals("1", 1));
    }

    @Test
    void emptinessFollowsFalsiness() {
        assertTrue(LooseValues.isEmpty(null));
        assertTrue(LooseValues.isEmpty(""));
        assertTrue(LooseValues.isEmpty(0));
        assertTrue(LooseValues.isEmpty(false));
        assertTrue(LooseValues.isEmpty(List.of()));
        assertFalse(LooseValues.isEmpty("x"));
        assertFalse(LooseValues.isEmpty(List.of("x")));
        assertTrue(LooseValues.isEmpty(Double.NaN));
        assertFalse(LooseValues.isEmpty(Map.of()));
    }
}
