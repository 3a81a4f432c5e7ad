package org.carball.deepanalysis.model.metric;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ComparatorKind {
    MOM("mom"),
    QOQ("qoq"),
    YOY("yoy"),
    TARGET("target"),
    BUDGET("budget");

    private final String value;

    ComparatorKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ComparatorKind fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Comparator must not be null");
        }
        String normalized = value.trim().toLowerCase();
        for (ComparatorKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown comparator: " + value);
    }
}
