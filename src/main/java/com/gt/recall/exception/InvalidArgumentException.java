package com.gt.recall.exception;

// Thrown for caller supplied thresholds, limits and cutoffs that are missing or out of range
public class InvalidArgumentException extends IllegalArgumentException {

    public InvalidArgumentException(String errMsg) {
        super(errMsg);
    }

    public InvalidArgumentException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
