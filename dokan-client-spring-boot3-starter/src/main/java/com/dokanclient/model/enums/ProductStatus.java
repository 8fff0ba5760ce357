package com.dokanclient.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 商品发布状态
 */
public enum ProductStatus implements WireValue {
    DRAFT("draft"),
    PENDING("pending"),
    PUBLISH("publish");

    private final String value;

    ProductStatus(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String wireValue() {
        return value;
    }

    @JsonCreator
    public static ProductStatus fromWire(String v) {
        for (ProductStatus e : values()) {
            if (e.value.equalsIgnoreCase(v)) {
                return e;
            }
        }
        return null;
    }
}
