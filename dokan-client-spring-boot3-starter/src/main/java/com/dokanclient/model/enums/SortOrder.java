package com.dokanclient.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SortOrder implements WireValue {
    ASC("asc"),
    DESC("desc");

    private final String value;

    SortOrder(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String wireValue() {
        return value;
    }

    @JsonCreator
    public static SortOrder fromWire(String v) {
        for (SortOrder e : values()) {
            if (e.value.equalsIgnoreCase(v)) {
                return e;
            }
        }
        return null;
    }
}
