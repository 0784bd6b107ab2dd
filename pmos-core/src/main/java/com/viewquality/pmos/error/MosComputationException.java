package com.viewquality.pmos.error;

/**
 * Raised when a rejected computation is unwrapped as if it had succeeded,
 * and used internally to short-circuit validation.
 */
public class MosComputationException extends RuntimeException {
    private final MosError error;

    public MosComputationException(MosError error, String message) {
        super("[" + error.name() + "] " + message);
        this.error = error;
    }

    public MosError getError() {
        return error;
    }
}
