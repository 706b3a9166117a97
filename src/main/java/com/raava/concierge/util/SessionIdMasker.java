package com.raava.concierge.util;

/**
 * Masks session IDs in logs.
 */
public class SessionIdMasker {

    private SessionIdMasker() {}

    /**
     * Shows the first and last 2 characters and masks the middle (e.g. "ab****yz").
     */
    public static String mask(String sessionId) {
        if (sessionId == null || sessionId.length() <= 4) {
            return "****";
        }
        return sessionId.substring(0, 2) + "****" + sessionId.substring(sessionId.length() - 2);
    }
}
