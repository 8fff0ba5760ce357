package com.dokanclient.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记需要写入 URL 查询串的字段
 */
@Documented
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface QueryParam {

    /** 查询参数名 */
    String value();

    /** 零值(null/空串/空集合/0/false)时跳过 */
    boolean omitEmpty() default true;
}
