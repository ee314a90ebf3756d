package com.ryuqq.gateway.core.schema;

import java.util.Arrays;
import java.util.List;

/**
 * Command 입력 필드 선언.
 *
 * <p><strong>제약 조건:</strong></p>
 * <ul>
 *   <li><strong>allowedValues:</strong> STRING 값이 속해야 하는 열거 집합</li>
 *   <li><strong>minimum/maximum:</strong> 숫자 값의 닫힌 구간 [min, max]</li>
 *   <li><strong>minLength:</strong> STRING 값의 최소 길이</li>
 *   <li><strong>format:</strong> STRING 값의 형식 (예: EMAIL)</li>
 * </ul>
 *
 * <p>필수 필드는 기본값을 가질 수 없습니다. 선택 필드의 기본값은 값이 없을 때 적용됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * FieldDescriptor limit = FieldDescriptor.optional("limit", FieldType.INTEGER, "Maximum number of results")
 *     .withRange(1, 200)
 *     .withDefault(50);
 * </pre>
 *
 * @param name 필드 이름
 * @param type 값 타입
 * @param description 설명
 * @param required 필수 여부
 * @param defaultValue 기본값 (null 가능)
 * @param allowedValues 허용 값 목록 (비어있으면 제한 없음)
 * @param minimum 최솟값 (null 가능)
 * @param maximum 최댓값 (null 가능)
 * @param minLength 최소 길이 (null 가능)
 * @param format 문자열 형식
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record FieldDescriptor(
    String name,
    FieldType type,
    String description,
    boolean required,
    Object defaultValue,
    List<String> allowedValues,
    Double minimum,
    Double maximum,
    Integer minLength,
    FieldFormat format
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 이름/타입이 없거나 제약 조건이 서로 모순되는 경우
     */
    public FieldDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (required && defaultValue != null) {
            throw new IllegalArgumentException("required field cannot declare a default: " + name);
        }
        if (minimum != null && maximum != null && minimum > maximum) {
            throw new IllegalArgumentException(
                "minimum must be <= maximum for " + name + " (" + minimum + " > " + maximum + ")"
            );
        }
        if ((minimum != null || maximum != null) && !type.isNumeric()) {
            throw new IllegalArgumentException("range applies to numeric fields only: " + name);
        }
        if (minLength != null && (minLength < 0 || type != FieldType.STRING)) {
            throw new IllegalArgumentException("minLength must be >= 0 on a string field: " + name);
        }
        description = description == null ? "" : description;
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        format = format == null ? FieldFormat.NONE : format;
    }

    /**
     * 필수 필드 생성.
     *
     * @param name 필드 이름
     * @param type 값 타입
     * @param description 설명
     * @return FieldDescriptor 인스턴스
     */
    public static FieldDescriptor required(String name, FieldType type, String description) {
        return new FieldDescriptor(name, type, description, true, null, List.of(), null, null, null, FieldFormat.NONE);
    }

    /**
     * 선택 필드 생성.
     *
     * @param name 필드 이름
     * @param type 값 타입
     * @param description 설명
     * @return FieldDescriptor 인스턴스
     */
    public static FieldDescriptor optional(String name, FieldType type, String description) {
        return new FieldDescriptor(name, type, description, false, null, List.of(), null, null, null, FieldFormat.NONE);
    }

    /**
     * 비어있지 않은 필수 id 문자열 필드 생성.
     *
     * @param name 필드 이름
     * @param description 설명
     * @return FieldDescriptor 인스턴스
     */
    public static FieldDescriptor requiredId(String name, String description) {
        return required(name, FieldType.STRING, description).withMinLength(1);
    }

    public FieldDescriptor withDefault(Object value) {
        return new FieldDescriptor(name, type, description, required, value, allowedValues, minimum, maximum, minLength, format);
    }

    public FieldDescriptor withAllowedValues(String... values) {
        return new FieldDescriptor(name, type, description, required, defaultValue, Arrays.asList(values), minimum, maximum, minLength, format);
    }

    public FieldDescriptor withRange(double min, double max) {
        return new FieldDescriptor(name, type, description, required, defaultValue, allowedValues, min, max, minLength, format);
    }

    public FieldDescriptor withMinLength(int length) {
        return new FieldDescriptor(name, type, description, required, defaultValue, allowedValues, minimum, maximum, length, format);
    }

    public FieldDescriptor withFormat(FieldFormat newFormat) {
        return new FieldDescriptor(name, type, description, required, defaultValue, allowedValues, minimum, maximum, minLength, newFormat);
    }

    /**
     * 기본값이 선언되어 있는지 확인.
     *
     * @return 기본값이 있으면 true
     */
    public boolean hasDefault() {
        return defaultValue != null;
    }
}
