package com.prospectpulse.backend.model;

import java.util.Locale;

public enum OperationKind {
    CREATE,
    READ,
    UPDATE,
    DELETE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OperationKind fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
