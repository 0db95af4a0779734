package org.zepto8.fixer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NotEqualRewriterTest {

    @Test
    void apply_rewritesOnlyListedOffsets() {
        var code = "a != b and \"c != d\" or e != f";

        var fixed = NotEqualRewriter.apply(code, List.of(2, 25));

        assertEquals("a ~= b and \"c != d\" or e ~= f", fixed);
        assertEquals(code.length(), fixed.length());
    }

    @Test
    void apply_noOffsets_returnsSameText() {
        var code = "x = 1";

        assertSame(code, NotEqualRewriter.apply(code, List.of()));
    }

    @Test
    void apply_offsetNotAtOperator_throwsIllegalState() {
        assertThrows(IllegalStateException.class, () -> NotEqualRewriter.apply("a ~= b", List.of(2)));
        assertThrows(IllegalStateException.class, () -> NotEqualRewriter.apply("a !", List.of(2)));
    }
}
