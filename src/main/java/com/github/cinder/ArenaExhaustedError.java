package com.github.cinder;

/**
 * Raised when an arena cannot satisfy a request. Compilation cannot continue
 * past this point, so it is an {@link Error} and never a return value.
 */
public class ArenaExhaustedError extends Error {

    public ArenaExhaustedError(String message) {
        super(message);
    }
}
