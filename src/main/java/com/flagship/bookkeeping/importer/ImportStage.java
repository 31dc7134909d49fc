package com.flagship.bookkeeping.importer;

/**
 * Stages of the import pipeline, recorded in the {@code stage} context entry of a failure.
 */
public enum ImportStage {
    READ("read"),
    NORMALIZE_TOP("normalize-top"),
    NORMALIZE_LINE("normalize-line"),
    BUILD("build"),
    PERSIST("persist");

    private final String label;

    ImportStage(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
