package com.finopsguard.policy;

import java.util.Locale;

/**
 * What a failed policy means for the request.
 */
public enum ViolationMode {
    /**
     * Failure blocks the change.
     */
    BLOCK("block"),

    /**
     * Failure is reported but does not block.
     */
    ADVISORY("advisory"),

    /**
     * Non-blocking, kept for policies imported with the older wording.
     */
    WARNING("warning");

    private final String value;

    ViolationMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isBlocking() {
        return this == BLOCK;
    }

    /**
     * @throws IllegalArgumentException for an unknown mode
     */
    public static ViolationMode fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Violation mode must not be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "block", "blocking" -> BLOCK;
            case "advisory" -> ADVISORY;
            case "warning", "warn" -> WARNING;
            default -> throw new IllegalArgumentException("Unknown violation mode: " + value);
        };
    }
}
