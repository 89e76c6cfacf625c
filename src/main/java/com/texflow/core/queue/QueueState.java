package com.texflow.core.queue;

import java.util.Locale;

/**
 * Broker-side state of a queued job. Only {@link #WAITING} and
 * {@link #DELAYED} jobs can be canceled by removing them.
 */
public enum QueueState {
    WAITING,
    DELAYED,
    ACTIVE,
    COMPLETED,
    FAILED;

    public boolean isRemovable() {
        return this == WAITING || this == DELAYED;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static QueueState fromDbValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
