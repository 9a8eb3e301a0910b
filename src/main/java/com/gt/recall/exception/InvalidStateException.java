package com.gt.recall.exception;

// Thrown when scheduling state handed to the engine violates its invariants. Indicates corrupted persisted state.
public class InvalidStateException extends RuntimeException {

    public InvalidStateException(String errMsg) {
        super(errMsg);
    }

    public InvalidStateException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
