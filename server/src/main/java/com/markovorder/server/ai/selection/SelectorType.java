package com.markovorder.server.ai.selection;

import java.util.Locale;
import java.util.Optional;

public enum SelectorType {
    CONSTANT("constant"),
    BIC("bic"),
    DIC("dic"),
    CV("cv");

    private final String id;

    SelectorType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<SelectorType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String key = id.trim().toLowerCase(Locale.ROOT);
        for (SelectorType t : values()) {
            if (t.id.equals(key)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
