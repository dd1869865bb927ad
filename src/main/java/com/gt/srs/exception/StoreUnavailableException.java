package com.gt.srs.exception;

public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String errMsg) {
        super(errMsg);
    }

    public StoreUnavailableException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
