package com.imperium.lexi.model.dto.context;

import java.util.Locale;
import java.util.Optional;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<MessageRole> from(String role) {
        if (role == null) {
            return Optional.empty();
        }
        for (MessageRole r : values()) {
            if (r.value().equalsIgnoreCase(role.trim())) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }
}
