package com.ryuqq.gateway.adapter.inmemory;

import com.ryuqq.gateway.core.model.EntityDraft;
import com.ryuqq.gateway.core.model.EntityKind;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.model.EntityStatus;
import com.ryuqq.gateway.core.model.ListQuery;
import com.ryuqq.gateway.core.model.SortOrder;
import com.ryuqq.gateway.core.model.SystemEvent;
import com.ryuqq.gateway.core.search.SearchOperator;
import com.ryuqq.gateway.core.spi.CapabilityUnsupportedException;
import com.ryuqq.gateway.core.spi.DirectoryClient;
import com.ryuqq.gateway.core.spi.DirectoryTransportException;
import com.ryuqq.gateway.core.spi.EntityNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link DirectoryClient} SPI for testing and reference purposes.
 *
 * <p>Users, groups, memberships, application grants and system log events are kept in
 * insertion-ordered maps. All public methods are {@code synchronized}; the directory is small
 * and calls are never issued concurrently by the gateway itself.</p>
 *
 * <p><strong>Search Expressions:</strong></p>
 * <ul>
 *   <li>{@code profile.<attr> <op> "<value>"} and {@code profile.<attr> pr}</li>
 *   <li>Only operators in {@code supportedOperators} are honored (default: eq, sw, pr);
 *       anything else raises {@link CapabilityUnsupportedException}, mimicking a backend
 *       whose search index does not cover every operator</li>
 * </ul>
 *
 * <p><strong>Free Text:</strong> case-insensitive prefix match on firstName, lastName and email.
 * Results are a superset by nature; callers must not trust them as attribute matches.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No sorting beyond attribute-string ordering for {@code sortBy}</li>
 *   <li>System log filters understand only {@code target.id eq} and {@code eventType eq} clauses</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryDirectoryClient directory = new InMemoryDirectoryClient();
 * EntityRecord user = directory.create(EntityDraft.user(Map.of("login", "a@x.com"), true));
 * directory.registerApplication("0oa1");
 * directory.grantApplication("0oa1", user.id());
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public class InMemoryDirectoryClient implements DirectoryClient {

    private static final Pattern SEARCH_EXPRESSION = Pattern.compile(
        "^\\s*(?:profile\\.)?([A-Za-z0-9_]+)\\s+([A-Za-z]{2})(?:\\s+\"((?:[^\"\\\\]|\\\\.)*)\")?\\s*$"
    );
    private static final Pattern TARGET_CLAUSE = Pattern.compile("target\\.id\\s+eq\\s+\"([^\"]*)\"");
    private static final Pattern EVENT_TYPE_CLAUSE = Pattern.compile("eventType\\s+eq\\s+\"([^\"]*)\"");

    private static final Set<SearchOperator> DEFAULT_SUPPORTED_OPERATORS =
        EnumSet.of(SearchOperator.EQUALS, SearchOperator.STARTS_WITH, SearchOperator.PRESENT);

    private final Map<String, EntityRecord> users = new LinkedHashMap<>();
    private final Map<String, EntityRecord> groups = new LinkedHashMap<>();
    private final Map<String, Set<String>> memberships = new HashMap<>();
    private final Map<String, Set<String>> applicationGrants = new LinkedHashMap<>();
    private final List<SystemEvent> systemEvents = new ArrayList<>();
    private final AtomicLong userSequence = new AtomicLong();
    private final AtomicLong groupSequence = new AtomicLong();
    private final Set<SearchOperator> supportedOperators;
    private final Clock clock;

    /**
     * 기본 생성자 (eq, sw, pr 지원, 시스템 시계).
     */
    public InMemoryDirectoryClient() {
        this(DEFAULT_SUPPORTED_OPERATORS, Clock.systemUTC());
    }

    /**
     * 지원 연산자를 지정하는 생성자.
     *
     * @param supportedOperators 검색 표현식에서 지원할 연산자
     */
    public InMemoryDirectoryClient(Set<SearchOperator> supportedOperators) {
        this(supportedOperators, Clock.systemUTC());
    }

    /**
     * 전체 생성자.
     *
     * @param supportedOperators 검색 표현식에서 지원할 연산자
     * @param clock 타임스탬프용 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public InMemoryDirectoryClient(Set<SearchOperator> supportedOperators, Clock clock) {
        if (supportedOperators == null) {
            throw new IllegalArgumentException("supportedOperators cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.supportedOperators = supportedOperators.isEmpty()
            ? EnumSet.noneOf(SearchOperator.class)
            : EnumSet.copyOf(supportedOperators);
        this.clock = clock;
    }

    @Override
    public synchronized EntityRecord get(EntityKind kind, String entityKey) {
        if (kind == EntityKind.GROUP) {
            return requireGroup(entityKey);
        }
        return requireUser(entityKey);
    }

    @Override
    public synchronized List<EntityRecord> list(EntityKind kind, ListQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        List<EntityRecord> source = new ArrayList<>(kind == EntityKind.GROUP ? groups.values() : users.values());

        if (query.search() != null) {
            SearchClause clause = parseSearch(query.search());
            source.removeIf(record -> !clause.matches(record));
        }
        if (query.filter() != null) {
            SearchClause clause = parseSearch(query.filter());
            source.removeIf(record -> !clause.matches(record));
        }
        if (query.query() != null) {
            String prefix = query.query().toLowerCase(Locale.ROOT);
            List<String> textAttributes = kind == EntityKind.GROUP
                ? List.of("name")
                : List.of("firstName", "lastName", "email");
            source.removeIf(record -> textAttributes.stream()
                .map(name -> record.attributeOr(name, ""))
                .noneMatch(value -> value.toLowerCase(Locale.ROOT).startsWith(prefix)));
        }
        if (query.sortBy() != null) {
            Comparator<EntityRecord> comparator = Comparator.comparing(record -> sortKey(record, query.sortBy()));
            source.sort(query.sortOrder() == SortOrder.DESC ? comparator.reversed() : comparator);
        }
        return page(source, query);
    }

    @Override
    public synchronized EntityRecord create(EntityDraft draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }
        Instant now = clock.instant();
        Map<String, Instant> timestamps = new LinkedHashMap<>();
        timestamps.put(EntityRecord.CREATED, now);
        timestamps.put(EntityRecord.LAST_UPDATED, now);

        if (draft.kind() == EntityKind.GROUP) {
            String id = "00g" + groupSequence.incrementAndGet();
            EntityRecord group = new EntityRecord(id, EntityKind.GROUP, EntityStatus.UNKNOWN, draft.attributes(), timestamps);
            groups.put(id, group);
            memberships.put(id, new LinkedHashSet<>());
            return group;
        }

        String login = draft.attributes().get("login");
        if (login != null && users.values().stream().anyMatch(user -> login.equalsIgnoreCase(user.attributeOr("login", "")))) {
            throw new DirectoryTransportException(400,
                "An object with this field already exists in the current organization: login " + login, null);
        }
        String id = "00u" + userSequence.incrementAndGet();
        EntityStatus status = EntityStatus.STAGED;
        if (draft.activate()) {
            status = EntityStatus.ACTIVE;
            timestamps.put(EntityRecord.ACTIVATED, now);
        }
        timestamps.put(EntityRecord.STATUS_CHANGED, now);
        EntityRecord user = new EntityRecord(id, EntityKind.USER, status, draft.attributes(), timestamps);
        users.put(id, user);
        return user;
    }

    @Override
    public synchronized void setActivation(String entityKey, boolean notify) {
        EntityRecord user = requireUser(entityKey);
        if (user.status() == EntityStatus.ACTIVE) {
            throw new DirectoryTransportException(403, "Activation failed because the user is already active", null);
        }
        replaceStatus(user, EntityStatus.ACTIVE, EntityRecord.ACTIVATED);
    }

    @Override
    public synchronized void suspend(String entityKey) {
        EntityRecord user = requireUser(entityKey);
        if (user.status() != EntityStatus.ACTIVE) {
            throw new DirectoryTransportException(400, "Cannot suspend a user that is not active", null);
        }
        replaceStatus(user, EntityStatus.SUSPENDED, null);
    }

    @Override
    public synchronized void unsuspend(String entityKey) {
        EntityRecord user = requireUser(entityKey);
        if (user.status() != EntityStatus.SUSPENDED) {
            throw new DirectoryTransportException(400, "Cannot unsuspend a user that is not suspended", null);
        }
        replaceStatus(user, EntityStatus.ACTIVE, null);
    }

    @Override
    public synchronized void deactivate(String entityKey) {
        EntityRecord user = requireUser(entityKey);
        replaceStatus(user, EntityStatus.DEPROVISIONED, null);
    }

    @Override
    public synchronized void delete(EntityKind kind, String entityKey) {
        if (kind == EntityKind.GROUP) {
            requireGroup(entityKey);
            groups.remove(entityKey);
            memberships.remove(entityKey);
            return;
        }
        EntityRecord user = requireUser(entityKey);
        if (user.status() != EntityStatus.DEPROVISIONED) {
            throw new DirectoryTransportException(403, "User must be deactivated before deletion", null);
        }
        users.remove(entityKey);
        memberships.values().forEach(members -> members.remove(entityKey));
        applicationGrants.values().forEach(grantees -> grantees.remove(entityKey));
    }

    @Override
    public synchronized void assignToGroup(String groupId, String entityKey) {
        requireGroup(groupId);
        requireUser(entityKey);
        memberships.get(groupId).add(entityKey);
    }

    @Override
    public synchronized void removeFromGroup(String groupId, String entityKey) {
        requireGroup(groupId);
        requireUser(entityKey);
        memberships.get(groupId).remove(entityKey);
    }

    @Override
    public synchronized List<EntityRecord> listGroupMembers(String groupId, ListQuery query) {
        requireGroup(groupId);
        List<EntityRecord> members = memberships.get(groupId).stream()
            .map(users::get)
            .filter(record -> record != null)
            .collect(Collectors.toCollection(ArrayList::new));
        return page(members, query == null ? ListQuery.limit(Integer.MAX_VALUE) : query);
    }

    @Override
    public synchronized void grantApplication(String appId, String entityKey) {
        Set<String> grantees = applicationGrants.get(appId);
        if (grantees == null) {
            throw new EntityNotFoundException("Application", appId);
        }
        requireUser(entityKey);
        grantees.add(entityKey);
    }

    @Override
    public synchronized List<SystemEvent> listSystemEvents(String filter, Instant since, int limit) {
        List<String> targets = extract(TARGET_CLAUSE, filter);
        List<String> eventTypes = extract(EVENT_TYPE_CLAUSE, filter);
        return systemEvents.stream()
            .filter(event -> since == null || !event.published().isBefore(since))
            .filter(event -> targets.isEmpty() || targets.contains(event.targetId()))
            .filter(event -> eventTypes.isEmpty() || eventTypes.contains(event.eventType()))
            .sorted(Comparator.comparing(SystemEvent::published).reversed())
            .limit(Math.max(limit, 0))
            .collect(Collectors.toList());
    }

    /**
     * 애플리케이션 등록 (grant 대상).
     *
     * @param appId 애플리케이션 id
     */
    public synchronized void registerApplication(String appId) {
        if (appId == null || appId.isBlank()) {
            throw new IllegalArgumentException("appId cannot be null or blank");
        }
        applicationGrants.putIfAbsent(appId, new LinkedHashSet<>());
    }

    /**
     * 애플리케이션 권한 보유 여부.
     *
     * @param appId 애플리케이션 id
     * @param entityKey 사용자 키
     * @return 권한이 부여되었으면 true
     */
    public synchronized boolean hasGrant(String appId, String entityKey) {
        Set<String> grantees = applicationGrants.get(appId);
        return grantees != null && grantees.contains(entityKey);
    }

    /**
     * 그룹 멤버십 여부.
     *
     * @param groupId 그룹 키
     * @param entityKey 사용자 키
     * @return 멤버이면 true
     */
    public synchronized boolean isMember(String groupId, String entityKey) {
        Set<String> members = memberships.get(groupId);
        return members != null && members.contains(entityKey);
    }

    /**
     * 시스템 로그 이벤트 추가.
     *
     * @param event 이벤트
     */
    public synchronized void publishEvent(SystemEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        systemEvents.add(event);
    }

    /**
     * 사용자 레코드를 그대로 저장 (테스트 픽스처용).
     *
     * <p>id와 상태를 호출자가 지정할 수 있으며, 같은 id가 있으면 교체합니다.</p>
     *
     * @param record 사용자 레코드
     */
    public synchronized void put(EntityRecord record) {
        if (record == null || record.kind() != EntityKind.USER) {
            throw new IllegalArgumentException("record must be a user record");
        }
        users.put(record.id(), record);
    }

    /**
     * 모든 데이터 초기화 (테스트용).
     */
    public synchronized void clear() {
        users.clear();
        groups.clear();
        memberships.clear();
        applicationGrants.clear();
        systemEvents.clear();
        userSequence.set(0);
        groupSequence.set(0);
    }

    private EntityRecord requireUser(String entityKey) {
        EntityRecord user = entityKey == null ? null : users.get(entityKey);
        if (user == null && entityKey != null) {
            user = users.values().stream()
                .filter(candidate -> entityKey.equalsIgnoreCase(candidate.attributeOr("login", "")))
                .findFirst()
                .orElse(null);
        }
        if (user == null) {
            throw new EntityNotFoundException(EntityKind.USER, entityKey);
        }
        return user;
    }

    private EntityRecord requireGroup(String groupId) {
        EntityRecord group = groupId == null ? null : groups.get(groupId);
        if (group == null) {
            throw new EntityNotFoundException(EntityKind.GROUP, groupId);
        }
        return group;
    }

    private void replaceStatus(EntityRecord user, EntityStatus status, String extraTimestamp) {
        Instant now = clock.instant();
        Map<String, Instant> timestamps = new LinkedHashMap<>(user.timestamps());
        timestamps.put(EntityRecord.STATUS_CHANGED, now);
        timestamps.put(EntityRecord.LAST_UPDATED, now);
        if (extraTimestamp != null) {
            timestamps.put(extraTimestamp, now);
        }
        users.put(user.id(), new EntityRecord(user.id(), user.kind(), status, user.attributes(), timestamps));
    }

    private SearchClause parseSearch(String expression) {
        Matcher matcher = SEARCH_EXPRESSION.matcher(expression);
        if (!matcher.matches()) {
            throw new DirectoryTransportException(400, "Invalid search expression: " + expression, null);
        }
        String token = matcher.group(2).toLowerCase(Locale.ROOT);
        SearchOperator operator;
        try {
            operator = SearchOperator.fromValue(token);
        } catch (IllegalArgumentException e) {
            throw new DirectoryTransportException(400, "Invalid search operator: " + token, e);
        }
        if (!supportedOperators.contains(operator)) {
            throw new CapabilityUnsupportedException(token, "Search operator '" + token + "' is not supported");
        }
        String value = matcher.group(3);
        if (operator.requiresValue() && value == null) {
            throw new DirectoryTransportException(400, "Invalid search expression: " + expression, null);
        }
        return new SearchClause(matcher.group(1), operator, value == null ? null : unescape(value));
    }

    private static List<EntityRecord> page(List<EntityRecord> source, ListQuery query) {
        int start = 0;
        if (query.after() != null) {
            for (int i = 0; i < source.size(); i++) {
                if (source.get(i).id().equals(query.after())) {
                    start = i + 1;
                    break;
                }
            }
        }
        int end = (int) Math.min(source.size(), (long) start + query.limit());
        return List.copyOf(source.subList(start, end));
    }

    private static String sortKey(EntityRecord record, String sortBy) {
        String attribute = sortBy.startsWith("profile.") ? sortBy.substring("profile.".length()) : sortBy;
        if ("id".equals(attribute)) {
            return record.id();
        }
        if ("status".equals(attribute)) {
            return record.status().name();
        }
        return record.attributeOr(attribute, "");
    }

    private static List<String> extract(Pattern pattern, String filter) {
        List<String> values = new ArrayList<>();
        if (filter == null) {
            return values;
        }
        Matcher matcher = pattern.matcher(filter);
        while (matcher.find()) {
            values.add(matcher.group(1));
        }
        return values;
    }

    private static String unescape(String value) {
        return value.replace("\\\"", "\"").replace("\\\\", "\\");
    }

    private record SearchClause(String attribute, SearchOperator operator, String value) {

        boolean matches(EntityRecord record) {
            String actual = "status".equals(attribute)
                ? record.status().name()
                : record.attributeOr(attribute, null);
            return operator.matches(actual, value);
        }
    }
}
