package com.prospectpulse.backend.model;

import java.util.Locale;

public enum OperationStatus {
    PENDING,
    COMPLETED,
    FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OperationStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
