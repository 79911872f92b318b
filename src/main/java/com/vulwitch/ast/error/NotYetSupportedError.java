package com.vulwitch.ast.error;

import com.vulwitch.ast.location.CodeRange;

/**
 * Raised for grammar productions that are valid C but whose lowering has not been built yet
 * (function definition bodies, statements, expression kinds outside the supported subset).
 * Kept apart from {@link CodeError} so callers can tell roadmap gaps from bad input.
 */
public class NotYetSupportedError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String production;
    private final transient CodeRange codeRange;

    public NotYetSupportedError(String production, CodeRange codeRange) {
        super("lowering of " + production + " is not yet supported (at " + codeRange + ")");
        this.production = production;
        this.codeRange = codeRange;
    }

    public String getProduction() {
        return production;
    }

    public CodeRange getCodeRange() {
        return codeRange;
    }
}
