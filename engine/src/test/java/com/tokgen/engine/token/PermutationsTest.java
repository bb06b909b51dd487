package com.tokgen.engine.token;

import static org.junit.jupiter.api.Assertions.*;

import com.tokgen.engine.token.primitives.ConstantInt;
import com.tokgen.engine.token.primitives.RangeInt;
import java.util.List;
import org.junit.jupiter.api.Test;

final class PermutationsTest {

    @Test
    void multiplySaturatesInsteadOfOverflowing() {
        assertEquals(12, Permutations.multiply(3, 4));
        assertEquals(Permutations.MAX, Permutations.multiply(Long.MAX_VALUE / 2, 3));
        assertEquals(Permutations.MAX, Permutations.multiply(Permutations.MAX, Permutations.MAX));
    }

    @Test
    void allMultipliesLocalCountWithChildren() {
        Token range = new RangeInt(0, 4);
        long total = Permutations.all(new ConstantInt(1), List.of(range, new RangeInt(1, 3)));
        assertEquals(15, total);
    }

    @Test
    void checkIndexRejectsOutOfBound() {
        assertDoesNotThrow(() -> Permutations.checkIndex(1, 1));
        PermutationException zero =
                assertThrows(PermutationException.class, () -> Permutations.checkIndex(0, 3));
        assertEquals(PermutationException.Type.INDEX_OUT_OF_BOUND, zero.type());
        assertEquals(0, zero.index());
        assertEquals(3, zero.permutations());
        assertThrows(PermutationException.class, () -> Permutations.checkIndex(4, 3));
    }
}
