package com.tokgen.engine.token.primitives;

import static org.junit.jupiter.api.Assertions.*;

import com.tokgen.engine.rand.RandomRand;
import com.tokgen.engine.rand.ScriptedRand;
import com.tokgen.engine.token.InternalParser;
import com.tokgen.engine.token.ParseResult;
import com.tokgen.engine.token.ParserError;
import com.tokgen.engine.token.PermutationException;
import com.tokgen.engine.token.Token;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class RangeIntTest {

    @Test
    void permutationsCountSteppedValues() {
        assertEquals(10, new RangeInt(1, 10).permutations());
        assertEquals(5, new RangeInt(1, 10, 2).permutations());
        assertEquals(4, new RangeInt(1, 10, 3).permutations());
        assertEquals(1, new RangeInt(5, 5).permutations());
        assertEquals(1L << 32, new RangeInt(Integer.MIN_VALUE, Integer.MAX_VALUE).permutations());
    }

    @Test
    void everyPermutationIsInRangeAndOnStep() throws PermutationException {
        RangeInt token = new RangeInt(-5, 17, 4);
        Set<Integer> seen = new HashSet<>();
        for (long i = 1; i <= token.permutations(); i++) {
            token.permutation(i);
            int value = Integer.parseInt(token.render());
            assertTrue(value >= -5 && value <= 17);
            assertEquals(0, (value + 5) % 4);
            seen.add(value);
        }
        assertEquals(token.permutations(), seen.size());
    }

    @Test
    void outOfBoundPermutationKeepsValue() throws PermutationException {
        RangeInt token = new RangeInt(1, 10, 2);
        token.permutation(3);
        assertEquals("5", token.render());

        PermutationException error =
                assertThrows(PermutationException.class, () -> token.permutation(0));
        assertEquals(PermutationException.Type.INDEX_OUT_OF_BOUND, error.type());
        assertThrows(PermutationException.class, () -> token.permutation(6));
        assertEquals("5", token.render());
    }

    @Test
    void fuzzMapsDrawnIndexOntoRange() {
        RangeInt token = new RangeInt(1, 10, 3);
        token.fuzz(new ScriptedRand(2));
        assertEquals("7", token.render());

        RandomRand random = new RandomRand(3);
        for (int i = 0; i < 200; i++) {
            token.fuzzAll(random);
            int value = token.value();
            assertTrue(value >= 1 && value <= 10);
            assertEquals(0, (value - 1) % 3);
        }
    }

    @Test
    void startsAtLowerBound() {
        assertEquals("3", new RangeInt(3, 9).render());
    }

    @Test
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new RangeInt(5, 4));
        assertThrows(IllegalArgumentException.class, () -> new RangeInt(1, 4, 0));
    }

    @Test
    void parseTakesLongestRunWithinUpperBound() {
        RangeInt token = new RangeInt(0, 100);
        ParseResult result = token.parse(new InternalParser("12345"), 0);
        assertTrue(result.isSuccess());
        assertEquals(2, result.cursor());
        assertEquals(12, token.value());

        RangeInt ten = new RangeInt(1, 10);
        assertEquals(1, ten.parse(new InternalParser("15"), 0).cursor());
        assertEquals(2, ten.parse(new InternalParser("10x"), 0).cursor());
        assertEquals(10, ten.value());
    }

    @Test
    void parseChecksStepFromLowerBound() {
        RangeInt token = new RangeInt(1, 10, 3);
        ParseResult ok = token.parse(new InternalParser("7"), 0);
        assertTrue(ok.isSuccess());
        assertEquals(7, token.value());

        ParseResult off = token.parse(new InternalParser("6"), 0);
        assertFalse(off.isSuccess());
        assertEquals(0, off.cursor());
        ParserError error = off.errors().get(0);
        assertEquals(ParserError.Type.UNEXPECTED_DATA, error.type());
        assertEquals("integer in range 1-10 with step 3", error.expected());
        assertEquals(7, token.value(), "failed parse keeps the value");
    }

    @Test
    void parseReportsBelowRangeAndNonDigits() {
        RangeInt token = new RangeInt(5, 9);
        assertEquals(
                ParserError.Type.UNEXPECTED_DATA,
                token.parse(new InternalParser("3"), 0).errors().get(0).type());

        ParseResult letters = token.parse(new InternalParser("abc"), 0);
        assertEquals(ParserError.Type.UNEXPECTED_DATA, letters.errors().get(0).type());
        assertEquals("a", letters.errors().get(0).actual());
    }

    @Test
    void parseAtEndIsUnexpectedEof() {
        ParseResult result = new RangeInt(0, 9).parse(new InternalParser("12"), 2);
        assertEquals(2, result.cursor());
        assertEquals(ParserError.Type.UNEXPECTED_EOF, result.errors().get(0).type());
    }

    @Test
    void deepCopyIsIndependent() throws PermutationException {
        RangeInt original = new RangeInt(0, 9);
        original.permutation(4);
        Token copy = original.deepCopy();
        assertEquals("3", copy.render());

        copy.permutation(9);
        assertEquals("3", original.render());
        assertEquals("8", copy.render());
    }
}
