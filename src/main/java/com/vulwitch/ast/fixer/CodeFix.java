package com.vulwitch.ast.fixer;

import java.util.Arrays;

import lombok.Value;

/**
 * A textual repair: replace the bytes {@code [byteStart, byteEnd)} of the original source
 * with {@code replacement}.
 */
@Value
public class CodeFix {
    int byteStart;
    int byteEnd;
    byte[] replacement;

    public CodeFix(int byteStart, int byteEnd, byte[] replacement) {
        if (byteStart < 0 || byteStart > byteEnd) {
            throw new IllegalArgumentException("Invalid fix range [" + byteStart + ", " + byteEnd + ")");
        }
        this.byteStart = byteStart;
        this.byteEnd = byteEnd;
        this.replacement = replacement.clone();
    }

    public byte[] getReplacement() {
        return replacement.clone();
    }

    /**
     * Applies this fix to {@code source} and returns the repaired copy.
     */
    public byte[] applyTo(byte[] source) {
        if (byteEnd > source.length) {
            throw new IllegalArgumentException(
                    "Fix range [" + byteStart + ", " + byteEnd + ") exceeds source length " + source.length);
        }
        byte[] result = Arrays.copyOf(source, source.length - (byteEnd - byteStart) + replacement.length);
        System.arraycopy(replacement, 0, result, byteStart, replacement.length);
        System.arraycopy(source, byteEnd, result, byteStart + replacement.length, source.length - byteEnd);
        return result;
    }
}
