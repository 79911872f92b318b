package com.vulwitch.ast.service;

import com.vulwitch.ast.model.TranslationUnit;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Result of lowering one file without exceptions: either the unit, or the error that stopped it
 * together with what kind of failure it was.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoweringOutcome {

    public enum Status {
        LOWERED,
        /** The input uses a shape the engine rejects. */
        MALFORMED_INPUT,
        /** Valid C whose lowering has not been built yet. */
        NOT_YET_SUPPORTED,
        /** The engine contradicted its own case analysis. */
        INTERNAL_DEFECT
    }

    @NonNull
    String file;
    @NonNull
    Status status;
    TranslationUnit unit;
    Throwable error;

    public static LoweringOutcome lowered(String file, TranslationUnit unit) {
        return new LoweringOutcome(file, Status.LOWERED, unit, null);
    }

    public static LoweringOutcome failed(String file, Status status, Throwable error) {
        if (status == Status.LOWERED) {
            throw new IllegalArgumentException("a failed outcome needs a failure status");
        }
        return new LoweringOutcome(file, status, null, error);
    }

    public boolean isLowered() {
        return status == Status.LOWERED;
    }
}
