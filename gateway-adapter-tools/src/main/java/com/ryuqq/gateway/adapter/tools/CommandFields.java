package com.ryuqq.gateway.adapter.tools;

import com.ryuqq.gateway.core.schema.FieldDescriptor;
import com.ryuqq.gateway.core.schema.FieldType;
import com.ryuqq.gateway.core.search.SearchCriterion;

/**
 * 여러 Command가 공유하는 입력 필드.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
final class CommandFields {

    private CommandFields() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static FieldDescriptor limit() {
        return FieldDescriptor.optional("limit", FieldType.INTEGER, "Maximum number of results to return (1-200)")
            .withRange(1, SearchCriterion.MAX_LIMIT)
            .withDefault(SearchCriterion.DEFAULT_LIMIT);
    }

    static FieldDescriptor after() {
        return FieldDescriptor.optional("after", FieldType.STRING, "Cursor for pagination, obtained from previous response");
    }

    static FieldDescriptor sortOrder() {
        return FieldDescriptor.optional("sortOrder", FieldType.STRING, "Sort order (asc or desc, default: asc)")
            .withAllowedValues("asc", "desc")
            .withDefault("asc");
    }
}
