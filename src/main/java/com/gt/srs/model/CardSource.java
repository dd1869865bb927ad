package com.gt.srs.model;

public enum CardSource {
    Authored("authored"),
    Generated("generated");

    private final String sourceValue;

    CardSource(String sourceValue) {
        this.sourceValue = sourceValue;
    }

    public String getSourceValue() {
        return sourceValue;
    }

    public static CardSource fromSourceValue(String sourceValue) {
        for (CardSource source : values()) {
            if (source.getSourceValue().equals(sourceValue)) {
                return source;
            }
        }

        throw new IllegalArgumentException("Unknown card source " + sourceValue);
    }
}
