package com.gt.srs.model;

public record ProgressKey(long learnerId, long cardId) {

    @Override
    public String toString() {
        return "learner " + learnerId + "/card " + cardId;
    }
}
