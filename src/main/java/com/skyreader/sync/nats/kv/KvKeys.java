package com.skyreader.sync.nats.kv;

import java.util.regex.Pattern;

/**
 * Key naming inside the buckets.
 *
 * <pre>
 * session.&lt;token&gt;               sessions bucket
 * jetstream.active-instance       coordination bucket
 * </pre>
 *
 * <p>NATS keys only allow {@code [-/_=.a-zA-Z0-9]}; tokens outside that alphabet are rejected rather than
 * escaped, since no issued session token contains them.</p>
 */
public final class KvKeys {

    private static final Pattern TOKEN = Pattern.compile("^[A-Za-z0-9_=-]{8,256}$");

    public static final String ACTIVE_INSTANCE = "jetstream.active-instance";

    private KvKeys() {
    }

    /**
     * @return the session key, or null when the token cannot be a valid session id
     */
    public static String session(String token) {
        if (token == null || !TOKEN.matcher(token).matches()) {
            return null;
        }
        return "session." + token;
    }
}
