package com.ryuqq.gateway.core.schema;

/**
 * 입력 필드의 값 타입.
 *
 * <p>각 타입은 검증 후 다음 Java 타입으로 정규화됩니다:</p>
 * <ul>
 *   <li>STRING → {@link String}</li>
 *   <li>INTEGER → {@link Long} (소수부가 0인 실수도 허용, 예: 5.0)</li>
 *   <li>NUMBER → {@link Double}</li>
 *   <li>BOOLEAN → {@link Boolean}</li>
 *   <li>STRING_LIST → {@code List<String>}</li>
 *   <li>STRING_MAP → {@code Map<String, String>}</li>
 *   <li>NESTED_STRING_MAP → {@code Map<String, Map<String, String>>} (속성 → 값 → id)</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum FieldType {

    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    STRING_LIST("array"),
    STRING_MAP("object"),
    NESTED_STRING_MAP("object");

    private final String jsonType;

    FieldType(String jsonType) {
        this.jsonType = jsonType;
    }

    /**
     * JSON Schema의 type 키워드 값.
     *
     * @return JSON 타입 이름
     */
    public String jsonType() {
        return jsonType;
    }

    /**
     * 숫자 타입인지 확인.
     *
     * @return INTEGER 또는 NUMBER인 경우 true
     */
    public boolean isNumeric() {
        return this == INTEGER || this == NUMBER;
    }
}
