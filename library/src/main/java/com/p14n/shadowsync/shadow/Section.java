package com.p14n.shadowsync.shadow;

public enum Section {
    REPORTED("reported"),
    DESIRED("desired");

    private final String key;

    Section(String key) {
        this.key = key;
    }

    /** JSON field name of the section. */
    public String key() {
        return key;
    }

    public static Section fromKey(String key) {
        for (Section section : values()) {
            if (section.key.equals(key)) {
                return section;
            }
        }
        throw new IllegalArgumentException("Unknown shadow section " + key);
    }
}
