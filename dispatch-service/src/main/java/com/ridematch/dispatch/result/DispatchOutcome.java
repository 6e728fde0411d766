package com.ridematch.dispatch.result;

/**
 * Common view over the tagged results returned by the engine, so callers
 * can map any outcome to a response without knowing every variant.
 */
public interface DispatchOutcome {

    /** Stable upper-case tag of the variant, e.g. {@code ALREADY_MATCHED}. */
    String code();

    /** {@code null} for success variants. */
    ErrorKind errorKind();

    String message();

    default boolean succeeded() {
        return errorKind() == null;
    }
}
