package com.gt.recall.exception;

public class UnknownItemException extends RuntimeException {

    public UnknownItemException(String errMsg) {
        super(errMsg);
    }

    public UnknownItemException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
