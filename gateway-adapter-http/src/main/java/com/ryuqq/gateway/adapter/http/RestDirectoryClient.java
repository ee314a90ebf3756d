package com.ryuqq.gateway.adapter.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.gateway.adapter.http.DirectoryErrorTranslator.RequestTarget;
import com.ryuqq.gateway.core.model.EntityDraft;
import com.ryuqq.gateway.core.model.EntityKind;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.model.ListQuery;
import com.ryuqq.gateway.core.model.SystemEvent;
import com.ryuqq.gateway.core.spi.DirectoryClient;
import com.ryuqq.gateway.core.spi.DirectoryTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST 기반 {@link DirectoryClient} 구현.
 *
 * <p>JDK {@link HttpClient}로 디렉터리의 {@code /api/v1} 엔드포인트를 호출하고
 * Jackson 트리 모델로 응답을 변환합니다. 모든 요청은 {@code Authorization: SSWS <token>}
 * 헤더로 인증합니다.</p>
 *
 * <p><strong>엔드포인트:</strong></p>
 * <ul>
 *   <li>사용자: {@code /users}, {@code /users/{id}}, {@code /users/{id}/lifecycle/*}</li>
 *   <li>그룹: {@code /groups}, {@code /groups/{id}}, {@code /groups/{id}/users/{userId}}</li>
 *   <li>애플리케이션: {@code /apps/{appId}/users}</li>
 *   <li>시스템 로그: {@code /logs}</li>
 * </ul>
 *
 * <p>오류 응답은 {@link DirectoryErrorTranslator}가 타입이 있는 실패로 변환합니다.
 * 재시도하지 않으며, 호출마다 원격 요청은 최대 1회입니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public class RestDirectoryClient implements DirectoryClient {

    private static final Logger log = LoggerFactory.getLogger(RestDirectoryClient.class);

    private final DirectoryConnectionConfig config;
    private final HttpClient httpClient;
    private final DirectoryJsonMapper jsonMapper;
    private final DirectoryErrorTranslator errorTranslator;

    /**
     * 생성자 (기본 HttpClient, ObjectMapper).
     *
     * @param config 연결 설정
     */
    public RestDirectoryClient(DirectoryConnectionConfig config) {
        this(config,
            HttpClient.newBuilder().connectTimeout(requireConfig(config).requestTimeout()).build(),
            new ObjectMapper());
    }

    /**
     * 생성자.
     *
     * @param config 연결 설정
     * @param httpClient HTTP 클라이언트
     * @param objectMapper JSON 매퍼
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RestDirectoryClient(DirectoryConnectionConfig config, HttpClient httpClient, ObjectMapper objectMapper) {
        requireConfig(config);
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.config = config;
        this.httpClient = httpClient;
        this.jsonMapper = new DirectoryJsonMapper(objectMapper);
        this.errorTranslator = new DirectoryErrorTranslator(jsonMapper);
    }

    @Override
    public EntityRecord get(EntityKind kind, String entityKey) {
        String path = collection(kind) + "/" + encode(entityKey);
        JsonNode node = send("GET", path, null, RequestTarget.of(kind.displayName(), entityKey));
        return jsonMapper.toRecord(node, kind);
    }

    @Override
    public List<EntityRecord> list(EntityKind kind, ListQuery query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("limit", Integer.toString(query.limit()));
        params.put("filter", query.filter());
        params.put("search", query.search());
        params.put("q", query.query());
        params.put("after", query.after());
        if (query.sortBy() != null) {
            params.put("sortBy", query.sortBy());
            params.put("sortOrder", query.sortOrder().queryValue());
        }
        String expression = query.search() != null ? query.search() : query.filter();
        RequestTarget target = expression == null ? RequestTarget.none() : RequestTarget.search(expression);
        JsonNode node = send("GET", collection(kind) + queryString(params), null, target);
        return jsonMapper.toRecords(node, kind);
    }

    @Override
    public EntityRecord create(EntityDraft draft) {
        String path = collection(draft.kind());
        if (draft.kind() == EntityKind.USER) {
            path += "?activate=" + draft.activate();
        }
        JsonNode node = send("POST", path, jsonMapper.createBody(draft), RequestTarget.none());
        return jsonMapper.toRecord(node, draft.kind());
    }

    @Override
    public void setActivation(String entityKey, boolean notify) {
        lifecycle(entityKey, "activate?sendEmail=" + notify);
    }

    @Override
    public void suspend(String entityKey) {
        lifecycle(entityKey, "suspend");
    }

    @Override
    public void unsuspend(String entityKey) {
        lifecycle(entityKey, "unsuspend");
    }

    @Override
    public void deactivate(String entityKey) {
        lifecycle(entityKey, "deactivate");
    }

    @Override
    public void delete(EntityKind kind, String entityKey) {
        send("DELETE", collection(kind) + "/" + encode(entityKey), null, RequestTarget.of(kind.displayName(), entityKey));
    }

    @Override
    public void assignToGroup(String groupId, String entityKey) {
        send("PUT", membershipPath(groupId, entityKey), "", RequestTarget.of(EntityKind.GROUP.displayName(), groupId));
    }

    @Override
    public void removeFromGroup(String groupId, String entityKey) {
        send("DELETE", membershipPath(groupId, entityKey), null, RequestTarget.of(EntityKind.GROUP.displayName(), groupId));
    }

    @Override
    public List<EntityRecord> listGroupMembers(String groupId, ListQuery query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("limit", Integer.toString(query.limit()));
        params.put("after", query.after());
        String path = "/groups/" + encode(groupId) + "/users" + queryString(params);
        JsonNode node = send("GET", path, null, RequestTarget.of(EntityKind.GROUP.displayName(), groupId));
        return jsonMapper.toRecords(node, EntityKind.USER);
    }

    @Override
    public void grantApplication(String appId, String entityKey) {
        String path = "/apps/" + encode(appId) + "/users";
        send("POST", path, jsonMapper.appUserBody(entityKey), RequestTarget.of("Application", appId));
    }

    @Override
    public List<SystemEvent> listSystemEvents(String filter, Instant since, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("since", since == null ? null : since.toString());
        params.put("filter", filter);
        params.put("limit", Integer.toString(limit));
        params.put("sortOrder", "DESCENDING");
        JsonNode node = send("GET", "/logs" + queryString(params), null, RequestTarget.none());
        return jsonMapper.toEvents(node);
    }

    private void lifecycle(String entityKey, String action) {
        String path = "/users/" + encode(entityKey) + "/lifecycle/" + action;
        send("POST", path, "", RequestTarget.of(EntityKind.USER.displayName(), entityKey));
    }

    private JsonNode send(String method, String path, String body, RequestTarget target) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(config.apiBase() + path))
            .timeout(config.requestTimeout())
            .header("Authorization", config.authorizationHeader())
            .header("Accept", "application/json");
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        }

        HttpResponse<String> response;
        try {
            log.debug("{} {}", method, path);
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DirectoryTransportException("Directory request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DirectoryTransportException("Directory request interrupted", e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return jsonMapper.parse(response.body());
        }
        log.warn("{} {} returned status {}", method, path, status);
        throw errorTranslator.translate(status, response.body(), target);
    }

    private static String collection(EntityKind kind) {
        return kind == EntityKind.GROUP ? "/groups" : "/users";
    }

    private static String membershipPath(String groupId, String entityKey) {
        return "/groups/" + encode(groupId) + "/users/" + encode(entityKey);
    }

    private static String queryString(Map<String, String> params) {
        String joined = params.entrySet().stream()
            .filter(entry -> entry.getValue() != null)
            .map(entry -> entry.getKey() + "=" + encode(entry.getValue()))
            .collect(Collectors.joining("&"));
        return joined.isEmpty() ? "" : "?" + joined;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static DirectoryConnectionConfig requireConfig(DirectoryConnectionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }
}
