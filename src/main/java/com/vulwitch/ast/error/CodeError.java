package com.vulwitch.ast.error;

import com.vulwitch.ast.location.CodeLocation;
import com.vulwitch.ast.location.CodeRange;

/**
 * A recoverable lowering failure tied to a source span: the input uses a shape the
 * lowering engine does not accept.
 */
public class CodeError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorMessage;
    private final transient CodeRange codeRange;

    public CodeError(String errorMessage, CodeRange codeRange) {
        super(render(errorMessage, codeRange));
        this.errorMessage = errorMessage;
        this.codeRange = codeRange;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public CodeRange getCodeRange() {
        return codeRange;
    }

    private static String render(String errorMessage, CodeRange codeRange) {
        CodeLocation start = codeRange.getStart();
        CodeLocation end = codeRange.getEnd();
        return "a code error occurs at " + codeRange.getFile()
                + ", from position " + start.getLine() + ":" + start.getColumn()
                + " to position " + end.getLine() + ":" + end.getColumn()
                + ": " + errorMessage;
    }
}
