package com.dokanclient.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 订单状态, 线上取值为小写连字符形式
 */
public enum OrderStatus implements WireValue {
    PENDING("pending"),
    PROCESSING("processing"),
    ON_HOLD("on-hold"),
    COMPLETED("completed"),
    CANCELLED("cancelled"),
    REFUNDED("refunded"),
    FAILED("failed");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String wireValue() {
        return value;
    }

    @JsonCreator
    public static OrderStatus fromWire(String v) {
        for (OrderStatus e : values()) {
            if (e.value.equalsIgnoreCase(v)) {
                return e;
            }
        }
        return null;
    }
}
