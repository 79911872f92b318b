package com.vulwitch.ast.location;

import lombok.NonNull;
import lombok.Value;

/**
 * A source span anchored to a file path. {@code start} never comes after {@code end}.
 */
@Value
public class CodeRange {
    @NonNull
    String file;
    @NonNull
    CodeLocation start;
    @NonNull
    CodeLocation end;

    public CodeRange(@NonNull String file, @NonNull CodeLocation start, @NonNull CodeLocation end) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException(
                    "Range start " + start + " is after range end " + end + " in " + file);
        }
        this.file = file;
        this.start = start;
        this.end = end;
    }

    public static CodeRange between(CodeRange first, CodeRange last) {
        return new CodeRange(first.getFile(), first.getStart(), last.getEnd());
    }

    public CodeRange withEnd(CodeLocation newEnd) {
        return new CodeRange(file, start, newEnd);
    }

    @Override
    public String toString() {
        return file + ":" + start + "-" + end;
    }
}
