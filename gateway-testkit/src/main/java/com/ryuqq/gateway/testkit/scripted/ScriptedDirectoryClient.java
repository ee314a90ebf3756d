package com.ryuqq.gateway.testkit.scripted;

import com.ryuqq.gateway.core.model.EntityDraft;
import com.ryuqq.gateway.core.model.EntityKind;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.model.ListQuery;
import com.ryuqq.gateway.core.model.SystemEvent;
import com.ryuqq.gateway.core.spi.DirectoryClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 호출 기록과 실패 주입을 지원하는 {@link DirectoryClient} 데코레이터.
 *
 * <p>실제 동작은 delegate(보통 in-memory 구현)에 위임하고, 그 앞에서 다음을 수행합니다:</p>
 * <ul>
 *   <li><strong>기록:</strong> 모든 호출을 {@link DirectoryCall}로 남김</li>
 *   <li><strong>실패 주입:</strong> {@link #failOn(DirectoryOperation, RuntimeException)},
 *       특정 인자에 대해서만 실패하는 {@link #failOn(DirectoryOperation, Object, RuntimeException)}</li>
 *   <li><strong>응답 고정:</strong> 목록 계열 호출의 결과를 {@link #respondTo(DirectoryOperation, List)}로 대체</li>
 * </ul>
 *
 * <p>listFiltered, listFreeText, listAll은 delegate의 default 구현을 거치지 않고
 * 각자의 {@link DirectoryOperation}으로 기록되어, 검색 tier별 호출 여부를 구분할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScriptedDirectoryClient directory = new ScriptedDirectoryClient(new InMemoryDirectoryClient());
 * directory.failOn(DirectoryOperation.LIST_FILTERED,
 *     new CapabilityUnsupportedException("ew", "unsupported"));
 * ...
 * assertThat(directory.callCount(DirectoryOperation.LIST_FREE_TEXT)).isEqualTo(1);
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public class ScriptedDirectoryClient implements DirectoryClient {

    private final DirectoryClient delegate;
    private final List<DirectoryCall> calls = new CopyOnWriteArrayList<>();
    private final List<ScriptedFailure> failures = new CopyOnWriteArrayList<>();
    private final Map<DirectoryOperation, List<EntityRecord>> responses = new EnumMap<>(DirectoryOperation.class);

    /**
     * 생성자.
     *
     * @param delegate 실제 동작을 수행할 클라이언트
     * @throws IllegalArgumentException delegate가 null인 경우
     */
    public ScriptedDirectoryClient(DirectoryClient delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    /**
     * 해당 종류의 모든 호출을 실패시킴.
     *
     * @param operation 호출 종류
     * @param failure 던질 예외
     * @return this
     */
    public ScriptedDirectoryClient failOn(DirectoryOperation operation, RuntimeException failure) {
        failures.add(new ScriptedFailure(operation, null, false, failure));
        return this;
    }

    /**
     * 주어진 인자를 포함한 호출만 실패시킴.
     *
     * @param operation 호출 종류
     * @param argument 인자 값 (예: 실패시킬 그룹 id)
     * @param failure 던질 예외
     * @return this
     */
    public ScriptedDirectoryClient failOn(DirectoryOperation operation, Object argument, RuntimeException failure) {
        failures.add(new ScriptedFailure(operation, argument, true, failure));
        return this;
    }

    /**
     * 목록 계열 호출의 결과를 고정.
     *
     * @param operation 목록 계열 호출 종류
     * @param records 반환할 레코드 (순서 유지)
     * @return this
     */
    public ScriptedDirectoryClient respondTo(DirectoryOperation operation, List<EntityRecord> records) {
        synchronized (responses) {
            responses.put(operation, List.copyOf(records));
        }
        return this;
    }

    /**
     * 기록된 모든 호출.
     *
     * @return 호출 순서대로의 목록
     */
    public List<DirectoryCall> calls() {
        return List.copyOf(calls);
    }

    /**
     * 해당 종류의 호출 목록.
     *
     * @param operation 호출 종류
     * @return 호출 순서대로의 목록
     */
    public List<DirectoryCall> calls(DirectoryOperation operation) {
        return calls.stream()
            .filter(call -> call.operation() == operation)
            .collect(Collectors.toList());
    }

    /**
     * 해당 종류의 호출 횟수.
     *
     * @param operation 호출 종류
     * @return 호출 횟수
     */
    public int callCount(DirectoryOperation operation) {
        return calls(operation).size();
    }

    /**
     * 기록, 실패 주입, 고정 응답을 모두 초기화.
     */
    public void reset() {
        calls.clear();
        failures.clear();
        synchronized (responses) {
            responses.clear();
        }
    }

    @Override
    public EntityRecord get(EntityKind kind, String entityKey) {
        record(DirectoryOperation.GET, kind, entityKey);
        return delegate.get(kind, entityKey);
    }

    @Override
    public List<EntityRecord> list(EntityKind kind, ListQuery query) {
        record(DirectoryOperation.LIST, kind, query);
        List<EntityRecord> scripted = scriptedResponse(DirectoryOperation.LIST, query.limit());
        return scripted != null ? scripted : delegate.list(kind, query);
    }

    @Override
    public List<EntityRecord> listFiltered(String expression, int limit) {
        record(DirectoryOperation.LIST_FILTERED, expression, limit);
        List<EntityRecord> scripted = scriptedResponse(DirectoryOperation.LIST_FILTERED, limit);
        return scripted != null ? scripted : delegate.listFiltered(expression, limit);
    }

    @Override
    public List<EntityRecord> listFreeText(String text, int limit) {
        record(DirectoryOperation.LIST_FREE_TEXT, text, limit);
        List<EntityRecord> scripted = scriptedResponse(DirectoryOperation.LIST_FREE_TEXT, limit);
        return scripted != null ? scripted : delegate.listFreeText(text, limit);
    }

    @Override
    public List<EntityRecord> listAll(int limit) {
        record(DirectoryOperation.LIST_ALL, limit);
        List<EntityRecord> scripted = scriptedResponse(DirectoryOperation.LIST_ALL, limit);
        return scripted != null ? scripted : delegate.listAll(limit);
    }

    @Override
    public EntityRecord create(EntityDraft draft) {
        record(DirectoryOperation.CREATE, draft, draft.attributes().get("login"), draft.attributes().get("email"));
        return delegate.create(draft);
    }

    @Override
    public void setActivation(String entityKey, boolean notify) {
        record(DirectoryOperation.SET_ACTIVATION, entityKey, notify);
        delegate.setActivation(entityKey, notify);
    }

    @Override
    public void suspend(String entityKey) {
        record(DirectoryOperation.SUSPEND, entityKey);
        delegate.suspend(entityKey);
    }

    @Override
    public void unsuspend(String entityKey) {
        record(DirectoryOperation.UNSUSPEND, entityKey);
        delegate.unsuspend(entityKey);
    }

    @Override
    public void deactivate(String entityKey) {
        record(DirectoryOperation.DEACTIVATE, entityKey);
        delegate.deactivate(entityKey);
    }

    @Override
    public void delete(EntityKind kind, String entityKey) {
        record(DirectoryOperation.DELETE, kind, entityKey);
        delegate.delete(kind, entityKey);
    }

    @Override
    public void assignToGroup(String groupId, String entityKey) {
        record(DirectoryOperation.ASSIGN_TO_GROUP, groupId, entityKey);
        delegate.assignToGroup(groupId, entityKey);
    }

    @Override
    public void removeFromGroup(String groupId, String entityKey) {
        record(DirectoryOperation.REMOVE_FROM_GROUP, groupId, entityKey);
        delegate.removeFromGroup(groupId, entityKey);
    }

    @Override
    public List<EntityRecord> listGroupMembers(String groupId, ListQuery query) {
        record(DirectoryOperation.LIST_GROUP_MEMBERS, groupId, query);
        List<EntityRecord> scripted = scriptedResponse(DirectoryOperation.LIST_GROUP_MEMBERS, query.limit());
        return scripted != null ? scripted : delegate.listGroupMembers(groupId, query);
    }

    @Override
    public void grantApplication(String appId, String entityKey) {
        record(DirectoryOperation.GRANT_APPLICATION, appId, entityKey);
        delegate.grantApplication(appId, entityKey);
    }

    @Override
    public List<SystemEvent> listSystemEvents(String filter, Instant since, int limit) {
        record(DirectoryOperation.LIST_SYSTEM_EVENTS, filter, since, limit);
        return delegate.listSystemEvents(filter, since, limit);
    }

    private void record(DirectoryOperation operation, Object... arguments) {
        DirectoryCall call = new DirectoryCall(operation, new ArrayList<>(Arrays.asList(arguments)));
        calls.add(call);
        for (ScriptedFailure failure : failures) {
            if (failure.appliesTo(call)) {
                throw failure.failure();
            }
        }
    }

    private List<EntityRecord> scriptedResponse(DirectoryOperation operation, int limit) {
        List<EntityRecord> scripted;
        synchronized (responses) {
            scripted = responses.get(operation);
        }
        if (scripted == null) {
            return null;
        }
        return scripted.size() <= limit ? scripted : scripted.subList(0, limit);
    }

    private record ScriptedFailure(DirectoryOperation operation, Object argument, boolean argumentBound,
                                   RuntimeException failure) {

        boolean appliesTo(DirectoryCall call) {
            if (call.operation() != operation) {
                return false;
            }
            return !argumentBound || call.involves(argument);
        }
    }
}
