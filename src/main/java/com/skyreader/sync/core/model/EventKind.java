package com.skyreader.sync.core.model;

import java.util.Locale;

/**
 * Closed set of firehose frame kinds.
 *
 * <ul>
 *   <li>{@link #COMMIT}, {@link #IDENTITY}, {@link #ACCOUNT}: the shapes the upstream log emits.</li>
 *   <li>{@link #UNKNOWN}: valid JSON with a kind we do not model. Ignored, but its time still moves the cursor.</li>
 *   <li>{@link #MALFORMED}: the frame could not be decoded at all. Counted as a processing error.</li>
 * </ul>
 */
public enum EventKind {
    COMMIT,
    IDENTITY,
    ACCOUNT,
    UNKNOWN,
    MALFORMED;

    public static EventKind fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "commit" -> COMMIT;
            case "identity" -> IDENTITY;
            case "account" -> ACCOUNT;
            default -> UNKNOWN;
        };
    }
}
