package com.ryuqq.gateway.core.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 검증과 기본값 적용이 끝난 인자.
 *
 * <p>값은 {@link FieldType}별로 정규화된 타입으로 저장됩니다.
 * 선언되지 않은 키는 포함되지 않습니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class ValidatedArguments {

    private static final ValidatedArguments EMPTY = new ValidatedArguments(Map.of());

    private final Map<String, Object> values;

    /**
     * 생성자.
     *
     * @param values 정규화된 값 (null 값 불가)
     * @throws IllegalArgumentException values가 null인 경우
     */
    public ValidatedArguments(Map<String, Object> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ValidatedArguments empty() {
        return EMPTY;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * 문자열 값.
     *
     * @param name 필드 이름
     * @return 값 (없으면 null)
     */
    public String string(String name) {
        return (String) values.get(name);
    }

    public Optional<String> optionalString(String name) {
        return Optional.ofNullable(string(name));
    }

    /**
     * 정수 값.
     *
     * @param name 필드 이름
     * @return 값
     * @throws IllegalStateException 값이 없거나 int 범위를 벗어나는 경우
     */
    public int integer(String name) {
        Long value = (Long) require(name);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalStateException(name + " does not fit in an int: " + value);
        }
        return value.intValue();
    }

    public double number(String name) {
        return (Double) require(name);
    }

    /**
     * 불리언 값.
     *
     * @param name 필드 이름
     * @return 값
     * @throws IllegalStateException 값이 없는 경우
     */
    public boolean bool(String name) {
        return (Boolean) require(name);
    }

    /**
     * 문자열 목록 값.
     *
     * @param name 필드 이름
     * @return 값 (없으면 빈 목록)
     * @throws ClassCastException 값이 문자열 목록이 아닌 경우
     */
    public List<String> stringList(String name) {
        Object value = values.get(name);
        if (value == null) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        for (Object item : (List<?>) value) {
            items.add((String) item);
        }
        return Collections.unmodifiableList(items);
    }

    public Map<String, String> stringMap(String name) {
        Object value = values.get(name);
        return value == null ? Map.of() : copyStringMap((Map<?, ?>) value);
    }

    /**
     * 2단 문자열 맵 값 (속성 → 값 → id).
     *
     * @param name 필드 이름
     * @return 값 (없으면 빈 맵)
     * @throws ClassCastException 값이 2단 문자열 맵이 아닌 경우
     */
    public Map<String, Map<String, String>> nestedStringMap(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Map.of();
        }
        Map<String, Map<String, String>> entries = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            entries.put((String) entry.getKey(), copyStringMap((Map<?, ?>) entry.getValue()));
        }
        return Collections.unmodifiableMap(entries);
    }

    /**
     * 전체 값의 읽기 전용 뷰.
     *
     * @return 필드 이름 → 정규화된 값
     */
    public Map<String, Object> asMap() {
        return values;
    }

    private static Map<String, String> copyStringMap(Map<?, ?> source) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            entries.put((String) entry.getKey(), (String) entry.getValue());
        }
        return Collections.unmodifiableMap(entries);
    }

    private Object require(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalStateException("argument not present: " + name);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidatedArguments that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ValidatedArguments" + values;
    }
}
