package com.dfdscan.models;

import java.util.Locale;

/**
 * Уровень доверия к элементу DFD
 */
public enum TrustLevel {
    TRUSTED("trusted"),
    PARTIALLY_TRUSTED("partially-trusted"),
    UNTRUSTED("untrusted");

    private final String value;

    TrustLevel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TrustLevel fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TrustLevel level : values()) {
            if (level.value.equals(normalized)) {
                return level;
            }
        }
        return null;
    }
}
