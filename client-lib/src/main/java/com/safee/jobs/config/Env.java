package com.safee.jobs.config;

/**
 * Environment lookups with defaults, as read by the *Main entry points.
 */
public final class Env {
    private Env() {
    }

    public static String env(String k, String d) {
        String v = System.getenv(k);
        return v == null || v.isBlank() ? d : v.trim();
    }

    public static int envInt(String k, int d) {
        String v = System.getenv(k);
        if (v == null || v.isBlank()) {
            return d;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(k + " must be an integer, got: " + v, e);
        }
    }

    public static long envLong(String k, long d) {
        String v = System.getenv(k);
        if (v == null || v.isBlank()) {
            return d;
        }
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(k + " must be a number, got: " + v, e);
        }
    }

    public static boolean envBool(String k, boolean d) {
        String v = System.getenv(k);
        return v == null || v.isBlank() ? d : Boolean.parseBoolean(v.trim());
    }
}
