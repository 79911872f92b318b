package com.vulwitch.ast.location;

import lombok.Value;

/**
 * A position in a source file, as reported by the grammar engine (zero-based row and column).
 * Only used for display and ordering.
 */
@Value
public class CodeLocation implements Comparable<CodeLocation> {
    int line;
    int column;

    public static CodeLocation of(int line, int column) {
        return new CodeLocation(line, column);
    }

    @Override
    public int compareTo(CodeLocation other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(column, other.column);
    }

    public boolean isAfter(CodeLocation other) {
        return compareTo(other) > 0;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
