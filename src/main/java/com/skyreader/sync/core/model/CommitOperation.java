package com.skyreader.sync.core.model;

import java.util.Locale;

/**
 * Repository mutation carried by a commit frame.
 *
 * <p>{@link #UNKNOWN} is the decode fallback for operation names this service does not understand;
 * processors ignore it.</p>
 */
public enum CommitOperation {
    CREATE,
    UPDATE,
    DELETE,
    UNKNOWN;

    public static CommitOperation fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "create" -> CREATE;
            case "update" -> UPDATE;
            case "delete" -> DELETE;
            default -> UNKNOWN;
        };
    }

    public boolean isUpsert() {
        return this == CREATE || this == UPDATE;
    }
}
