package com.p14n.shadowsync.shadow;

public enum DeltaKind {
    REPORTED_CHANGED("reported-changed"),
    DESIRED_CHANGED("desired-changed"),
    BOTH("both");

    private final String label;

    DeltaKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @return the classification, or null when neither section changed
     */
    public static DeltaKind of(boolean reportedChanged, boolean desiredChanged) {
        if (reportedChanged && desiredChanged) {
            return BOTH;
        }
        if (reportedChanged) {
            return REPORTED_CHANGED;
        }
        return desiredChanged ? DESIRED_CHANGED : null;
    }

    public static DeltaKind fromLabel(String label) {
        for (DeltaKind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown delta kind " + label);
    }
}
