package com.dokanclient.core.query;

import com.dokanclient.annotation.QueryParam;
import com.dokanclient.exception.SerializationException;
import com.dokanclient.model.enums.WireValue;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 将带 {@link QueryParam} 字段的对象展开为有序的查询参数
 * 父类字段在前, 同一类内按声明顺序
 */
public final class QuerySerializer {

    private static final Map<Class<?>, List<Field>> FIELD_CACHE = new ConcurrentHashMap<>();

    private QuerySerializer() {
    }

    public static List<Map.Entry<String, String>> flatten(Object query) {
        List<Map.Entry<String, String>> out = new ArrayList<>();
        if (query == null) {
            return out;
        }
        for (Field f : fieldsOf(query.getClass())) {
            QueryParam qp = f.getAnnotation(QueryParam.class);
            Object raw;
            try {
                raw = f.get(query);
            } catch (IllegalAccessException e) {
                throw new SerializationException("failed to read query field " + f.getName(), e);
            }
            if (raw instanceof Optional<?> opt) {
                raw = opt.orElse(null);
            }
            if (raw == null) {
                continue;
            }
            if (qp.omitEmpty() && isEmpty(raw)) {
                continue;
            }
            String value = stringify(qp.value(), raw);
            // 空字符串从不输出
            if (value.isEmpty()) {
                continue;
            }
            out.add(new AbstractMap.SimpleImmutableEntry<>(qp.value(), value));
        }
        return out;
    }

    /**
     * 编码为 a=1&b=2 形式, 无参数时返回空串
     */
    public static String encode(Object query) {
        StringJoiner sj = new StringJoiner("&");
        for (Map.Entry<String, String> e : flatten(query)) {
            sj.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                    + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        return sj.toString();
    }

    private static List<Field> fieldsOf(Class<?> type) {
        return FIELD_CACHE.computeIfAbsent(type, t -> {
            Deque<Class<?>> chain = new ArrayDeque<>();
            for (Class<?> c = t; c != null && c != Object.class; c = c.getSuperclass()) {
                chain.push(c);
            }
            List<Field> fields = new ArrayList<>();
            for (Class<?> c : chain) {
                for (Field f : c.getDeclaredFields()) {
                    if (Modifier.isStatic(f.getModifiers()) || !f.isAnnotationPresent(QueryParam.class)) {
                        continue;
                    }
                    f.setAccessible(true);
                    fields.add(f);
                }
            }
            return fields;
        });
    }

    private static boolean isEmpty(Object v) {
        if (v instanceof CharSequence cs) {
            return cs.length() == 0;
        }
        if (v instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (v instanceof Map<?, ?> m) {
            return m.isEmpty();
        }
        if (v.getClass().isArray()) {
            return Array.getLength(v) == 0;
        }
        if (v instanceof Boolean b) {
            return !b;
        }
        if (v instanceof BigDecimal bd) {
            return bd.signum() == 0;
        }
        if (v instanceof Number n) {
            return n.doubleValue() == 0d;
        }
        return false;
    }

    private static String stringify(String name, Object v) {
        if (v instanceof Collection<?> c) {
            StringJoiner sj = new StringJoiner(",");
            for (Object item : c) {
                sj.add(scalar(name, item));
            }
            return sj.toString();
        }
        if (v.getClass().isArray()) {
            StringJoiner sj = new StringJoiner(",");
            for (int i = 0, n = Array.getLength(v); i < n; i++) {
                sj.add(scalar(name, Array.get(v, i)));
            }
            return sj.toString();
        }
        return scalar(name, v);
    }

    private static String scalar(String name, Object v) {
        if (v == null) {
            return "";
        }
        if (v instanceof CharSequence || v instanceof Boolean) {
            return v.toString();
        }
        if (v instanceof Byte || v instanceof Short || v instanceof Integer || v instanceof Long
                || v instanceof BigInteger) {
            return v.toString();
        }
        if (v instanceof Float || v instanceof Double || v instanceof BigDecimal) {
            if (v instanceof Double d && (d.isNaN() || d.isInfinite())
                    || v instanceof Float f && (f.isNaN() || f.isInfinite())) {
                throw new SerializationException("non-finite value for query parameter '" + name + "'");
            }
            BigDecimal bd = v instanceof BigDecimal b ? b : new BigDecimal(v.toString());
            return bd.stripTrailingZeros().toPlainString();
        }
        if (v instanceof WireValue wv) {
            return wv.wireValue();
        }
        if (v instanceof Enum<?> e) {
            return e.name();
        }
        if (v instanceof OffsetDateTime odt) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(odt.truncatedTo(ChronoUnit.SECONDS));
        }
        if (v instanceof ZonedDateTime zdt) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(zdt.toOffsetDateTime().truncatedTo(ChronoUnit.SECONDS));
        }
        if (v instanceof Instant inst) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(inst.truncatedTo(ChronoUnit.SECONDS).atOffset(ZoneOffset.UTC));
        }
        throw new SerializationException("unsupported query value type " + v.getClass().getName()
                + " for parameter '" + name + "'");
    }
}
