package com.dokanclient.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CatalogVisibility implements WireValue {
    VISIBLE("visible"),
    CATALOG("catalog"),
    SEARCH("search"),
    HIDDEN("hidden");

    private final String value;

    CatalogVisibility(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String wireValue() {
        return value;
    }

    @JsonCreator
    public static CatalogVisibility fromWire(String v) {
        for (CatalogVisibility e : values()) {
            if (e.value.equalsIgnoreCase(v)) {
                return e;
            }
        }
        return null;
    }
}
