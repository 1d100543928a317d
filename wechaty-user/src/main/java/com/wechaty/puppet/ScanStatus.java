package com.wechaty.puppet;

import java.util.Locale;

/**
 * QR-code login scan status reported by the puppet.
 */
public enum ScanStatus {
    UNKNOWN(0),
    CANCEL(1),
    WAITING(2),
    SCANNED(3),
    CONFIRMED(4),
    TIMEOUT(5);

    private final int code;

    ScanStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Parse a status from its name (case-insensitive) or its numeric code.
     *
     * @throws IllegalArgumentException if the value matches no status
     */
    public static ScanStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("scan status is empty");
        }
        String trimmed = value.trim();
        for (ScanStatus status : values()) {
            if (status.name().equals(trimmed.toUpperCase(Locale.ROOT))
                    || String.valueOf(status.code).equals(trimmed)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown scan status: " + value);
    }
}
