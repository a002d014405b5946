package com.qoeguard.core.model;

/**
 * Classification of a single detected difference.
 */
public enum ChangeKind {
    ADDED("added"),
    REMOVED("removed"),
    TYPE_CHANGED("type_changed"),
    VALUE_CHANGED("value_changed");

    private final String label;

    ChangeKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** The kind produced when baseline and candidate are swapped. */
    public ChangeKind inverse() {
        return switch (this) {
            case ADDED -> REMOVED;
            case REMOVED -> ADDED;
            default -> this;
        };
    }
}
