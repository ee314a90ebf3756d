package com.ryuqq.gateway.core.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command 입력 형태 (선언 순서를 유지하는 필드 목록).
 *
 * <p>검증 오류는 선언 순서상 첫 번째로 위반한 필드를 보고하므로 순서가 의미를 가집니다.
 * 필드 간 규칙({@link ArgumentRule})은 모든 필드가 통과한 뒤 등록 순서대로 적용됩니다.</p>
 *
 * @param fields 필드 선언 목록
 * @param rules 필드 간 규칙 목록
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record InputShape(List<FieldDescriptor> fields, List<ArgumentRule> rules) {

    private static final InputShape EMPTY = new InputShape(List.of());

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException fields가 null이거나 이름이 중복된 경우
     */
    public InputShape {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        if (rules == null || rules.contains(null)) {
            throw new IllegalArgumentException("rules cannot be null or contain null");
        }
        Set<String> names = new HashSet<>();
        for (FieldDescriptor field : fields) {
            if (field == null) {
                throw new IllegalArgumentException("fields cannot contain null");
            }
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("duplicate field name: " + field.name());
            }
        }
        fields = List.copyOf(fields);
        rules = List.copyOf(rules);
    }

    /**
     * 필드 간 규칙이 없는 입력 형태.
     *
     * @param fields 필드 선언 목록
     */
    public InputShape(List<FieldDescriptor> fields) {
        this(fields, List.of());
    }

    public static InputShape of(FieldDescriptor... fields) {
        return new InputShape(Arrays.asList(fields));
    }

    public static InputShape empty() {
        return EMPTY;
    }

    /**
     * 필드 간 규칙 추가.
     *
     * @param rule 규칙
     * @return 규칙이 추가된 새 InputShape
     */
    public InputShape withRule(ArgumentRule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        List<ArgumentRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new InputShape(fields, extended);
    }

    /**
     * 이름으로 필드 선언 조회.
     *
     * @param name 필드 이름
     * @return 필드 선언 (없으면 empty)
     */
    public Optional<FieldDescriptor> field(String name) {
        return fields.stream().filter(field -> field.name().equals(name)).findFirst();
    }

    public int size() {
        return fields.size();
    }

    /**
     * JSON Schema 형태의 맵으로 변환.
     *
     * <p>경계 프로토콜에 Command를 광고할 때 사용합니다.
     * 모든 맵은 선언 순서를 유지합니다.</p>
     *
     * @return {@code {type: object, properties: {...}, required: [...]}}
     */
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (FieldDescriptor field : fields) {
            properties.put(field.name(), propertySchema(field));
            if (field.required()) {
                required.add(field.name());
            }
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    private static Map<String, Object> propertySchema(FieldDescriptor field) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", field.type().jsonType());
        if (!field.description().isEmpty()) {
            property.put("description", field.description());
        }
        switch (field.type()) {
            case STRING_LIST -> property.put("items", Map.of("type", "string"));
            case STRING_MAP -> property.put("additionalProperties", Map.of("type", "string"));
            case NESTED_STRING_MAP -> property.put(
                "additionalProperties",
                Map.of("type", "object", "additionalProperties", Map.of("type", "string"))
            );
            default -> {
                // scalar
            }
        }
        if (!field.allowedValues().isEmpty()) {
            property.put("enum", field.allowedValues());
        }
        if (field.minimum() != null) {
            property.put("minimum", numericLiteral(field.type(), field.minimum()));
        }
        if (field.maximum() != null) {
            property.put("maximum", numericLiteral(field.type(), field.maximum()));
        }
        if (field.minLength() != null) {
            property.put("minLength", field.minLength());
        }
        if (field.format().jsonFormat() != null) {
            property.put("format", field.format().jsonFormat());
        } else if (field.format().regex() != null) {
            property.put("pattern", field.format().regex());
        }
        if (field.hasDefault()) {
            property.put("default", field.defaultValue());
        }
        return property;
    }

    private static Number numericLiteral(FieldType type, double value) {
        return type == FieldType.INTEGER ? (Number) (long) value : (Number) value;
    }
}
