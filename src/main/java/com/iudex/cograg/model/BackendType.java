package com.iudex.cograg.model;

import java.util.Locale;

public enum BackendType {
    LEXICAL,
    VECTOR,
    GRAPH;

    public String key() {
        return this.name().toLowerCase(Locale.ROOT);
    }

    public static BackendType fromKey(String key) {
        return BackendType.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
