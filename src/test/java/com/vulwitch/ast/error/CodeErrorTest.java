package com.vulwitch.ast.error;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.vulwitch.ast.location.CodeLocation;
import com.vulwitch.ast.location.CodeRange;

class CodeErrorTest {

    private final CodeRange range = new CodeRange("lib/x.h", CodeLocation.of(4, 2), CodeLocation.of(6, 1));

    @Test
    void testMessageNamesFileRangeAndReason() {
        CodeError error = new CodeError("unsupported node type: if_statement", range);

        assertThat(error.getMessage()).isEqualTo("a code error occurs at lib/x.h, from position 4:2 "
                + "to position 6:1: unsupported node type: if_statement");
        assertThat(error.getErrorMessage()).isEqualTo("unsupported node type: if_statement");
        assertThat(error.getCodeRange()).isEqualTo(range);
    }

    @Test
    void testNotYetSupportedIsNotACodeError() {
        NotYetSupportedError error = new NotYetSupportedError("function_definition", range);

        assertThat(error).isNotInstanceOf(CodeError.class);
        assertThat(error.getProduction()).isEqualTo("function_definition");
        assertThat(error.getCodeRange()).isEqualTo(range);
        assertThat(error.getMessage()).contains("function_definition", "lib/x.h");
    }

    @Test
    void testUnreachableIsAnAssertionError() {
        Unreachable bare = Unreachable.unreachable();
        Unreachable explained = Unreachable.unreachable("sized run without keywords");

        assertThat(bare).isInstanceOf(AssertionError.class).hasMessage("entered unreachable code");
        assertThat(explained).hasMessage("entered unreachable code: sized run without keywords");
    }
}
