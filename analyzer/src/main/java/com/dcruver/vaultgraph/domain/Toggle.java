package com.dcruver.vaultgraph.domain;

/**
 * Three-state switch for options whose default differs from an explicit choice.
 */
public enum Toggle {
    UNSET,
    ENABLED,
    DISABLED;

    public static Toggle of(Boolean value) {
        if (value == null) {
            return UNSET;
        }
        return value ? ENABLED : DISABLED;
    }

    public boolean resolve(boolean defaultValue) {
        return switch (this) {
            case ENABLED -> true;
            case DISABLED -> false;
            case UNSET -> defaultValue;
        };
    }

    public boolean isSet() {
        return this != UNSET;
    }
}
