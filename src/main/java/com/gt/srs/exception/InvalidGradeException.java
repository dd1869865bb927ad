package com.gt.srs.exception;

// Thrown when a review is submitted with a grade outside Again..Easy. Not retryable.
public class InvalidGradeException extends RuntimeException {

    public InvalidGradeException(String errMsg) {
        super(errMsg);
    }

    public InvalidGradeException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
