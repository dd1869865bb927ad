package com.gt.srs.exception;

public class UnknownCardException extends RuntimeException {

    public UnknownCardException(String errMsg) {
        super(errMsg);
    }

    public UnknownCardException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
