package com.ridematch.dispatch.exception;

/**
 * Input or configuration problem that the caller has to fix, e.g. malformed
 * coordinates or an unknown driver. Domain rule violations during matching
 * are reported as outcome values instead.
 */
public class DispatchException extends RuntimeException {

    private final String code;

    public DispatchException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
