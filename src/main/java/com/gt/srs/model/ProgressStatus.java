package com.gt.srs.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.srs.serialization.ProgressStatusSerializer;

// Declaration order is the forward direction of the lifecycle
@JsonSerialize(using = ProgressStatusSerializer.class)
public enum ProgressStatus {
    New("new"),
    Learning("learning"),
    Reviewing("reviewing"),
    Mastered("mastered");

    private final String statusValue;

    ProgressStatus(String statusValue) {
        this.statusValue = statusValue;
    }

    public String getStatusValue() {
        return statusValue;
    }

    public boolean isBefore(ProgressStatus other) {
        return this.compareTo(other) < 0;
    }

    public static ProgressStatus fromStatusValue(String statusValue) {
        for (ProgressStatus status : values()) {
            if (status.statusValue.equals(statusValue)) {
                return status;
            }
        }

        throw new IllegalArgumentException("Unknown progress status " + statusValue);
    }
}
