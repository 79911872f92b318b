package com.vulwitch.ast.error;

/**
 * Signals that the lowering engine reached a state its own case analysis rules out.
 * This is a defect in the engine, never a property of the input, so it is an
 * {@link AssertionError} and must not be converted into a {@link CodeError}.
 */
public class Unreachable extends AssertionError {

    private static final long serialVersionUID = 1L;

    public Unreachable() {
        super("entered unreachable code");
    }

    public Unreachable(String message) {
        super("entered unreachable code: " + message);
    }

    public static Unreachable unreachable() {
        return new Unreachable();
    }

    public static Unreachable unreachable(String message) {
        return new Unreachable(message);
    }
}
