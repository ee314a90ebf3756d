package com.ryuqq.gateway.core.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 선언된 {@link InputShape}에 대해 타입이 없는 인자를 검증.
 *
 * <p><strong>검증 규칙 (선언 순서대로, 첫 위반에서 중단):</strong></p>
 * <ol>
 *   <li>null 값은 값이 없는 것으로 취급</li>
 *   <li>필수 필드가 없으면 "is required"</li>
 *   <li>선택 필드가 없으면 기본값 적용 (기본값이 없으면 생략)</li>
 *   <li>타입 불일치, 열거 집합 밖의 값, 범위 밖의 숫자, 최소 길이 미달, 형식 위반 (이메일, 속성 이름)</li>
 * </ol>
 *
 * <p>모든 필드가 통과하면 {@link InputShape#rules()}를 순서대로 적용합니다.
 * 선언되지 않은 키는 무시합니다. 순수 함수이며 외부 상태에 접근하지 않습니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class SchemaValidator {

    private SchemaValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 인자 검증 및 정규화.
     *
     * @param shape 입력 형태
     * @param rawArguments 원시 인자 (null이면 빈 맵)
     * @return 검증된 인자
     * @throws IllegalArgumentException shape가 null인 경우
     * @throws ValidationException 인자가 형태를 위반한 경우
     */
    public static ValidatedArguments validate(InputShape shape, Map<String, ?> rawArguments) {
        if (shape == null) {
            throw new IllegalArgumentException("shape cannot be null");
        }
        Map<String, ?> raw = rawArguments == null ? Map.of() : rawArguments;

        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldDescriptor field : shape.fields()) {
            Object value = raw.get(field.name());
            if (value == null) {
                if (field.required()) {
                    throw new ValidationException(field.name(), "is required");
                }
                if (field.hasDefault()) {
                    values.put(field.name(), coerce(field, field.defaultValue()));
                }
                continue;
            }
            Object coerced = coerce(field, value);
            checkConstraints(field, coerced);
            values.put(field.name(), coerced);
        }
        ValidatedArguments arguments = new ValidatedArguments(values);
        for (ArgumentRule rule : shape.rules()) {
            rule.check(arguments);
        }
        return arguments;
    }

    private static Object coerce(FieldDescriptor field, Object value) {
        return switch (field.type()) {
            case STRING -> {
                if (!(value instanceof CharSequence text)) {
                    throw new ValidationException(field.name(), "must be a string");
                }
                yield text.toString();
            }
            case INTEGER -> toLong(field, value);
            case NUMBER -> {
                if (!(value instanceof Number number)) {
                    throw new ValidationException(field.name(), "must be a number");
                }
                yield number.doubleValue();
            }
            case BOOLEAN -> {
                if (!(value instanceof Boolean flag)) {
                    throw new ValidationException(field.name(), "must be a boolean");
                }
                yield flag;
            }
            case STRING_LIST -> toStringList(field, value);
            case STRING_MAP -> toStringMap(field.name(), value, "must be a map of strings");
            case NESTED_STRING_MAP -> toNestedStringMap(field, value);
        };
    }

    private static Long toLong(FieldDescriptor field, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        try {
            if (value instanceof BigInteger big) {
                return big.longValueExact();
            }
            if (value instanceof BigDecimal decimal) {
                return decimal.longValueExact();
            }
        } catch (ArithmeticException e) {
            throw new ValidationException(field.name(), "must be an integer");
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isFinite(number) && number == Math.rint(number)
                && number >= Long.MIN_VALUE && number <= Long.MAX_VALUE) {
                return (long) number;
            }
        }
        throw new ValidationException(field.name(), "must be an integer");
    }

    private static List<String> toStringList(FieldDescriptor field, Object value) {
        if (!(value instanceof Collection<?> collection)) {
            throw new ValidationException(field.name(), "must be a list of strings");
        }
        List<String> items = new ArrayList<>(collection.size());
        for (Object item : collection) {
            if (!(item instanceof CharSequence text)) {
                throw new ValidationException(field.name(), "must be a list of strings");
            }
            items.add(text.toString());
        }
        return Collections.unmodifiableList(items);
    }

    private static Map<String, String> toStringMap(String fieldName, Object value, String reason) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new ValidationException(fieldName, reason);
        }
        Map<String, String> entries = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof CharSequence key) || !(entry.getValue() instanceof CharSequence text)) {
                throw new ValidationException(fieldName, reason);
            }
            entries.put(key.toString(), text.toString());
        }
        return Collections.unmodifiableMap(entries);
    }

    private static Map<String, Map<String, String>> toNestedStringMap(FieldDescriptor field, Object value) {
        String reason = "must be a map of string maps";
        if (!(value instanceof Map<?, ?> map)) {
            throw new ValidationException(field.name(), reason);
        }
        Map<String, Map<String, String>> entries = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof CharSequence key)) {
                throw new ValidationException(field.name(), reason);
            }
            entries.put(key.toString(), toStringMap(field.name(), entry.getValue(), reason));
        }
        return Collections.unmodifiableMap(entries);
    }

    private static void checkConstraints(FieldDescriptor field, Object value) {
        if (value instanceof String text) {
            if (!field.allowedValues().isEmpty() && !field.allowedValues().contains(text)) {
                throw new ValidationException(field.name(), "must be one of " + field.allowedValues());
            }
            if (field.minLength() != null && text.length() < field.minLength()) {
                throw new ValidationException(
                    field.name(), "must be at least " + field.minLength() + " character(s) long"
                );
            }
            if (!field.format().accepts(text)) {
                throw new ValidationException(field.name(), field.format().violation());
            }
        }
        if (value instanceof Number number) {
            double numeric = number.doubleValue();
            if (field.minimum() != null && numeric < field.minimum()) {
                throw new ValidationException(field.name(), "must be >= " + formatBound(field, field.minimum()));
            }
            if (field.maximum() != null && numeric > field.maximum()) {
                throw new ValidationException(field.name(), "must be <= " + formatBound(field, field.maximum()));
            }
        }
    }

    private static String formatBound(FieldDescriptor field, double bound) {
        return field.type() == FieldType.INTEGER ? Long.toString((long) bound) : Double.toString(bound);
    }
}
