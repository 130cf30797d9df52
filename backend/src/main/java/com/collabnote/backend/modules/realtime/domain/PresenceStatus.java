package com.collabnote.backend.modules.realtime.domain;

import java.util.Locale;
import java.util.Optional;

public enum PresenceStatus {
    ONLINE,
    AWAY,
    BUSY,
    OFFLINE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PresenceStatus> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (PresenceStatus status : values()) {
            if (status.wireName().equalsIgnoreCase(value.trim())) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
