package com.xammer.probe.domain;

public enum ProbeKind {
    COMPUTE("compute"),
    STORAGE("storage");

    private final String label;

    ProbeKind(String label) {
        this.label = label;
    }

    /** Value of the {@code probe} tag on exported metrics. */
    public String getLabel() {
        return label;
    }
}
