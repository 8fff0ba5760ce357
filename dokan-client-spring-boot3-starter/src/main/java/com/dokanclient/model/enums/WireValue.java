package com.dokanclient.model.enums;

/**
 * 线上取值与枚举名不同的枚举实现此接口
 */
public interface WireValue {

    String wireValue();
}
