package com.gt.srs.exception;

// Thrown when the stored progress for a learner/card pair changed between read and write.
// The single grade call can be retried.
public class ConcurrentGradeConflictException extends RuntimeException {

    public ConcurrentGradeConflictException(String errMsg) {
        super(errMsg);
    }

    public ConcurrentGradeConflictException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
