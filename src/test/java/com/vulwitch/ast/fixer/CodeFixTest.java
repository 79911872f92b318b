package com.vulwitch.ast.fixer;

import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

class CodeFixTest {

    @Test
    void testReplacesHalfOpenByteRange() {
        CodeFix fix = new CodeFix(4, 7, "long".getBytes(StandardCharsets.UTF_8));

        byte[] result = fix.applyTo("int int x;".getBytes(StandardCharsets.UTF_8));

        assertThat(new String(result, StandardCharsets.UTF_8)).isEqualTo("int long x;");
    }

    @Test
    void testRejectsInvertedRange() {
        assertThatThrownBy(() -> new CodeFix(3, 2, new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testRejectsRangePastEndOfSource() {
        CodeFix fix = new CodeFix(0, 10, new byte[0]);

        assertThatThrownBy(() -> fix.applyTo(new byte[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testReplacementIsCopied() {
        byte[] replacement = {'a'};
        CodeFix fix = new CodeFix(0, 0, replacement);
        replacement[0] = 'b';

        assertThat(fix.getReplacement()).containsExactly((byte) 'a');
    }
}
