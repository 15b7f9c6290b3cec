package com.multipost.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PublicationAttemptStatus {
    PENDING,
    PROCESSING,
    PUBLISHED,
    FAILED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == PUBLISHED || this == FAILED;
    }

    public boolean isInFlight() {
        return this == PENDING || this == PROCESSING;
    }
}
