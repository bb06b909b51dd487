package com.tokgen.engine.token.primitives;

import static org.junit.jupiter.api.Assertions.*;

import com.tokgen.engine.rand.ScriptedRand;
import com.tokgen.engine.token.InternalParser;
import com.tokgen.engine.token.ParseResult;
import com.tokgen.engine.token.ParserError;
import com.tokgen.engine.token.PermutationException;
import com.tokgen.engine.token.Token;
import org.junit.jupiter.api.Test;

final class ConstantIntTest {

    @Test
    void rendersFixedValueRegardlessOfFuzzing() {
        ConstantInt token = new ConstantInt(42);
        token.fuzzAll(new ScriptedRand(7));
        assertEquals("42", token.render());
        assertEquals(1, token.permutations());
        assertEquals(1, token.permutationsAll());
        assertTrue(token.isEnumerable());
    }

    @Test
    void parsesExactText() {
        ParseResult result = new ConstantInt(123).parse(new InternalParser("123"), 0);
        assertTrue(result.isSuccess());
        assertEquals(3, result.cursor());

        ParseResult inside = new ConstantInt(-7).parse(new InternalParser("ab-7cd"), 2);
        assertTrue(inside.isSuccess());
        assertEquals(4, inside.cursor());
    }

    @Test
    void truncatedInputIsUnexpectedEof() {
        ParseResult result = new ConstantInt(123).parse(new InternalParser("12"), 0);
        assertFalse(result.isSuccess());
        assertEquals(0, result.cursor());
        assertEquals(ParserError.Type.UNEXPECTED_EOF, result.errors().get(0).type());
    }

    @Test
    void mismatchIsUnexpectedData() {
        ParseResult result = new ConstantInt(123).parse(new InternalParser("124"), 0);
        assertEquals(0, result.cursor());
        ParserError error = result.errors().get(0);
        assertEquals(ParserError.Type.UNEXPECTED_DATA, error.type());
        assertEquals("124", error.actual());
        assertEquals("expected \"123\" but got \"124\"", error.message());
    }

    @Test
    void permutationOnlyAcceptsFirstIndex() throws PermutationException {
        ConstantInt token = new ConstantInt(5);
        token.permutation(1);
        assertEquals("5", token.render());
        assertThrows(PermutationException.class, () -> token.permutation(0));
        assertThrows(PermutationException.class, () -> token.permutation(2));
        assertEquals("5", token.render());
    }

    @Test
    void deepCopyIsIndependent() {
        ConstantInt original = new ConstantInt(3);
        Token copy = original.deepCopy();
        assertEquals(original.render(), copy.render());

        ((ConstantInt) copy).setValue(9);
        assertEquals("3", original.render());
        assertEquals("9", copy.render());
    }
}
