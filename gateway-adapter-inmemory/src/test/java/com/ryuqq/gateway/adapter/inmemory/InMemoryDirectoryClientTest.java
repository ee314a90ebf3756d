package com.ryuqq.gateway.adapter.inmemory;

import com.ryuqq.gateway.core.model.EntityDraft;
import com.ryuqq.gateway.core.model.EntityKind;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.model.SystemEvent;
import com.ryuqq.gateway.core.search.SearchOperator;
import com.ryuqq.gateway.core.spi.CapabilityUnsupportedException;
import com.ryuqq.gateway.core.spi.DirectoryTransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryDirectoryClient 고유 동작 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class InMemoryDirectoryClientTest {

    private InMemoryDirectoryClient directory;

    @BeforeEach
    void setUp() {
        directory = new InMemoryDirectoryClient();
    }

    @Test
    @DisplayName("지원 연산자를 지정하면 기본 미지원 연산자도 검색할 수 있다")
    void 지원_연산자_확장() {
        // Given
        InMemoryDirectoryClient full = new InMemoryDirectoryClient(EnumSet.allOf(SearchOperator.class));
        EntityRecord user = full.create(EntityDraft.user(Map.of("login", "a@corp.io", "email", "a@corp.io"), true));

        // When
        List<EntityRecord> found = full.listFiltered("profile.email ew \"corp.io\"", 10);

        // Then
        assertEquals(1, found.size());
        assertEquals(user.id(), found.get(0).id());
    }

    @Test
    @DisplayName("미지원 연산자는 연산자 토큰과 함께 거부된다")
    void 미지원_연산자_거부() {
        CapabilityUnsupportedException exception = assertThrows(CapabilityUnsupportedException.class,
            () -> directory.listFiltered("profile.email co \"corp\"", 10));

        assertEquals("co", exception.getOperator());
    }

    @Test
    @DisplayName("이스케이프된 따옴표를 포함한 값을 비교한다")
    void 이스케이프_값_비교() {
        directory.create(EntityDraft.user(Map.of("login", "q@x.io", "title", "The \"Boss\""), true));

        List<EntityRecord> found = directory.listFiltered("profile.title eq \"The \\\"Boss\\\"\"", 10);

        assertEquals(1, found.size());
    }

    @Test
    @DisplayName("present 연산자는 값이 있는 사용자만 반환한다")
    void present_연산자() {
        directory.create(EntityDraft.user(Map.of("login", "a@x.io", "department", "Sales"), true));
        directory.create(EntityDraft.user(Map.of("login", "b@x.io"), true));

        List<EntityRecord> found = directory.listFiltered("profile.department pr", 10);

        assertEquals(1, found.size());
        assertEquals("a@x.io", found.get(0).attributeOr("login", null));
    }

    @Test
    @DisplayName("해석할 수 없는 표현식은 전송 오류로 거부된다")
    void 잘못된_표현식() {
        DirectoryTransportException exception = assertThrows(DirectoryTransportException.class,
            () -> directory.listFiltered("department equals Sales", 10));

        assertEquals(400, exception.getStatus());
    }

    @Test
    @DisplayName("login으로도 사용자를 조회할 수 있다")
    void login_조회() {
        EntityRecord user = directory.create(EntityDraft.user(Map.of("login", "Ada@x.io"), false));

        assertEquals(user.id(), directory.get(EntityKind.USER, "ada@x.io").id());
    }

    @Test
    @DisplayName("중복 login은 생성에 실패한다")
    void 중복_login() {
        directory.create(EntityDraft.user(Map.of("login", "dup@x.io"), false));

        assertThrows(DirectoryTransportException.class,
            () -> directory.create(EntityDraft.user(Map.of("login", "dup@x.io"), false)));
    }

    @Test
    @DisplayName("비활성화되지 않은 사용자는 삭제할 수 없다")
    void 삭제_전_비활성화_필요() {
        EntityRecord user = directory.create(EntityDraft.user(Map.of("login", "live@x.io"), true));

        assertThrows(DirectoryTransportException.class, () -> directory.delete(EntityKind.USER, user.id()));
    }

    @Test
    @DisplayName("시스템 로그는 대상, 이벤트 유형, 시작 시각으로 걸러지고 최신순으로 반환된다")
    void 시스템_로그_필터() {
        // Given
        Instant base = Instant.parse("2026-01-10T00:00:00Z");
        directory.publishEvent(event(base, "user.session.start", "00u1", "Seoul"));
        directory.publishEvent(event(base.plusSeconds(60), "user.session.start", "00u1", "Busan"));
        directory.publishEvent(event(base.plusSeconds(120), "user.lifecycle.create", "00u1", "Incheon"));
        directory.publishEvent(event(base.plusSeconds(180), "user.session.start", "00u2", "Daegu"));
        directory.publishEvent(event(base.minusSeconds(3600), "user.session.start", "00u1", "Jeju"));

        // When
        List<SystemEvent> events = directory.listSystemEvents(
            "target.id eq \"00u1\" and (eventType eq \"user.session.start\" or eventType eq \"user.authentication.sso\")",
            base.minusSeconds(1), 10);

        // Then
        assertEquals(2, events.size());
        assertEquals("Busan", events.get(0).city());
        assertEquals("Seoul", events.get(1).city());
    }

    @Test
    @DisplayName("clear 후에는 id 시퀀스도 초기화된다")
    void clear_초기화() {
        directory.create(EntityDraft.user(Map.of("login", "a@x.io"), false));
        directory.registerApplication("0oa1");

        directory.clear();
        EntityRecord next = directory.create(EntityDraft.user(Map.of("login", "b@x.io"), false));

        assertEquals("00u1", next.id());
        assertEquals(1, directory.listAll(10).size());
        assertFalse(directory.hasGrant("0oa1", next.id()));
    }

    private static SystemEvent event(Instant published, String type, String target, String city) {
        return new SystemEvent(published, type, target, "10.0.0.1", city, null, "KR", "Computer", "Mozilla/5.0");
    }
}
