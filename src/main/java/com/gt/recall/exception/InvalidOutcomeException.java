package com.gt.recall.exception;

public class InvalidOutcomeException extends RuntimeException {

    public InvalidOutcomeException(String errMsg) {
        super(errMsg);
    }

    public InvalidOutcomeException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
