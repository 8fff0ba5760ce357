package com.dokanclient.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProductType implements WireValue {
    SIMPLE("simple"),
    GROUPED("grouped"),
    EXTERNAL("external"),
    VARIABLE("variable");

    private final String value;

    ProductType(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String wireValue() {
        return value;
    }

    @JsonCreator
    public static ProductType fromWire(String v) {
        for (ProductType e : values()) {
            if (e.value.equalsIgnoreCase(v)) {
                return e;
            }
        }
        return null;
    }
}
