package com.ryuqq.gateway.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.gateway.core.model.EntityDraft;
import com.ryuqq.gateway.core.model.EntityKind;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.model.EntityStatus;
import com.ryuqq.gateway.core.model.SystemEvent;
import com.ryuqq.gateway.core.spi.DirectoryTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 디렉터리 REST 응답 JSON과 도메인 모델 사이의 변환.
 *
 * <p>Jackson 트리 모델({@link JsonNode})을 사용합니다. 응답 구조가 일부 다르거나 필드가
 * 빠져도 변환은 실패하지 않으며, 없는 값은 레코드에서 생략됩니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
final class DirectoryJsonMapper {

    private static final Logger log = LoggerFactory.getLogger(DirectoryJsonMapper.class);

    private static final List<String> USER_TIMESTAMPS = List.of(
        EntityRecord.CREATED,
        EntityRecord.ACTIVATED,
        EntityRecord.LAST_LOGIN,
        EntityRecord.LAST_UPDATED,
        EntityRecord.STATUS_CHANGED,
        EntityRecord.PASSWORD_CHANGED
    );

    private static final List<String> GROUP_TIMESTAMPS = List.of(
        EntityRecord.CREATED,
        EntityRecord.LAST_UPDATED,
        EntityRecord.LAST_MEMBERSHIP_UPDATED
    );

    private final ObjectMapper objectMapper;

    DirectoryJsonMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 응답 본문 파싱.
     *
     * @param body 응답 본문 (비어있으면 빈 객체)
     * @return JsonNode
     * @throws DirectoryTransportException JSON이 아닌 경우
     */
    JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DirectoryTransportException("Malformed directory response: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 단건 엔티티 변환.
     *
     * @param node 사용자 또는 그룹 JSON
     * @param kind 엔티티 종류
     * @return EntityRecord
     */
    EntityRecord toRecord(JsonNode node, EntityKind kind) {
        String id = node.path("id").asText(null);
        if (id == null || id.isBlank()) {
            throw new DirectoryTransportException("Directory response is missing the entity id");
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        JsonNode profile = node.path("profile");
        Iterator<Map.Entry<String, JsonNode>> fields = profile.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String value = scalarText(field.getValue());
            if (value != null) {
                attributes.put(field.getKey(), value);
            }
        }

        Map<String, Instant> timestamps = new LinkedHashMap<>();
        for (String name : kind == EntityKind.GROUP ? GROUP_TIMESTAMPS : USER_TIMESTAMPS) {
            Instant instant = instant(node.path(name));
            if (instant != null) {
                timestamps.put(name, instant);
            }
        }

        EntityStatus status = EntityStatus.UNKNOWN;
        if (kind == EntityKind.GROUP) {
            putIfPresent(attributes, "type", scalarText(node.path("type")));
            putIfPresent(attributes, "objectClass", scalarText(node.path("objectClass")));
        } else {
            status = EntityStatus.fromValue(node.path("status").asText(null));
        }
        return new EntityRecord(id, kind, status, attributes, timestamps);
    }

    /**
     * 배열 응답 변환.
     *
     * @param node JSON 배열
     * @param kind 엔티티 종류
     * @return 응답 순서의 레코드 목록
     */
    List<EntityRecord> toRecords(JsonNode node, EntityKind kind) {
        List<EntityRecord> records = new ArrayList<>();
        if (!node.isArray()) {
            throw new DirectoryTransportException("Directory response is not a list");
        }
        for (JsonNode element : node) {
            if (element.hasNonNull("id")) {
                records.add(toRecord(element, kind));
            }
        }
        return records;
    }

    /**
     * 시스템 로그 이벤트 목록 변환.
     *
     * @param node JSON 배열
     * @return 응답 순서의 이벤트 목록 (published 또는 eventType이 없는 항목은 제외)
     */
    List<SystemEvent> toEvents(JsonNode node) {
        List<SystemEvent> events = new ArrayList<>();
        if (!node.isArray()) {
            throw new DirectoryTransportException("Directory response is not a list");
        }
        for (JsonNode element : node) {
            Instant published = instant(element.path("published"));
            String eventType = element.path("eventType").asText(null);
            if (published == null || eventType == null) {
                continue;
            }
            JsonNode client = element.path("client");
            JsonNode geo = client.path("geographicalContext");
            JsonNode userAgent = client.path("userAgent");
            String targetId = element.path("target").isArray() && element.path("target").size() > 0
                ? element.path("target").get(0).path("id").asText(null)
                : null;
            events.add(new SystemEvent(
                published,
                eventType,
                targetId,
                client.path("ipAddress").asText(null),
                geo.path("city").asText(null),
                geo.path("state").asText(null),
                geo.path("country").asText(null),
                client.path("device").asText(null),
                userAgent.isObject() ? userAgent.path("rawUserAgent").asText(null) : scalarText(userAgent)
            ));
        }
        return events;
    }

    /**
     * 생성 요청 본문.
     *
     * @param draft 엔티티 초안
     * @return {@code {"profile": {...}}} JSON 문자열
     */
    String createBody(EntityDraft draft) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode profile = root.putObject("profile");
        draft.attributes().forEach(profile::put);
        if (draft.kind() == EntityKind.GROUP && !profile.has("description")) {
            profile.put("description", "");
        }
        return write(root);
    }

    /**
     * 애플리케이션 할당 요청 본문.
     *
     * @param entityKey 사용자 키
     * @return {@code {"id": "<key>"}} JSON 문자열
     */
    String appUserBody(String entityKey) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("id", entityKey);
        return write(root);
    }

    /**
     * 오류 응답 요약 추출.
     *
     * @param body 오류 응답 본문
     * @return errorSummary와 errorCauses를 이은 문자열 (없으면 null)
     */
    String errorSummary(String body) {
        JsonNode node;
        try {
            node = body == null || body.isBlank() ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
            return body;
        }
        if (node == null || !node.hasNonNull("errorSummary")) {
            return null;
        }
        StringBuilder summary = new StringBuilder(node.path("errorSummary").asText());
        for (JsonNode cause : node.path("errorCauses")) {
            String text = cause.path("errorSummary").asText(null);
            if (text != null && !text.isBlank()) {
                summary.append(" (").append(text).append(')');
            }
        }
        return summary.toString();
    }

    /**
     * 오류 응답 코드 추출.
     *
     * @param body 오류 응답 본문
     * @return errorCode (없으면 null)
     */
    String errorCode(String body) {
        try {
            return body == null || body.isBlank() ? null : objectMapper.readTree(body).path("errorCode").asText(null);
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new DirectoryTransportException("Failed to serialize request body", e);
        }
    }

    private static String scalarText(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            node.forEach(element -> values.add(element.asText()));
            return values.isEmpty() ? null : String.join(", ", values);
        }
        if (node.isObject()) {
            return node.toString();
        }
        return node.asText();
    }

    private static Instant instant(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparsable timestamp: {}", node.asText());
            return null;
        }
    }

    private static void putIfPresent(Map<String, String> attributes, String name, String value) {
        if (value != null) {
            attributes.put(name, value);
        }
    }
}
