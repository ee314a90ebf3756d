package com.ryuqq.gateway.adapter.tools;

import com.ryuqq.gateway.adapter.inmemory.InMemoryDirectoryClient;
import com.ryuqq.gateway.application.command.CommandDispatcher;
import com.ryuqq.gateway.core.contract.InvocationRequest;
import com.ryuqq.gateway.core.contract.InvocationResult;
import com.ryuqq.gateway.core.model.EntityDraft;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.model.SystemEvent;
import com.ryuqq.gateway.core.search.SearchOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * UserCommands 테스트.
 *
 * <p>전체 카탈로그를 In-Memory 디렉터리에 연결해 Dispatcher를 통해 호출합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class UserCommandsTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private InMemoryDirectoryClient directory;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        directory = new InMemoryDirectoryClient(
            EnumSet.of(SearchOperator.EQUALS, SearchOperator.STARTS_WITH, SearchOperator.PRESENT),
            clock
        );
        dispatcher = DirectoryCommandCatalog.create(directory, clock);
    }

    @Test
    void create_user는_login을_email로_기본_설정한다() {
        // when
        InvocationResult result = call("create_user", Map.of(
            "firstName", "Ada", "lastName", "Lovelace", "email", "ada@corp.io"));

        // then
        assertThat(result.error()).isFalse();
        assertThat(result.joinedText()).isEqualTo("User created successfully:\n"
            + "ID: 00u1\n"
            + "Login: ada@corp.io\n"
            + "Status: STAGED\n"
            + "Created: 2026-03-01T00:00:00Z");
    }

    @Test
    void create_user는_잘못된_email을_핸들러_전에_거부한다() {
        // when
        InvocationResult result = call("create_user", Map.of(
            "firstName", "Ada", "lastName", "Lovelace", "email", "not-an-email"));

        // then
        assertThat(result.error()).isTrue();
        assertThat(result.joinedText()).startsWith("Invalid arguments for create_user: email");
        assertThat(directory.listAll(10)).isEmpty();
    }

    @Test
    void get_user는_프로필_섹션을_출력하고_없는_값은_NA로_표시한다() {
        // given
        String id = createUser("ada@corp.io", "Ada", "Lovelace", "Engineering", true).id();

        // when
        InvocationResult result = call("get_user", Map.of("userId", id));

        // then
        assertThat(result.error()).isFalse();
        assertThat(result.joinedText())
            .startsWith("• User Details:\n  ID: 00u1\n  Status: ACTIVE\n")
            .contains("  Activated: 2026-03-01T00:00:00Z\n")
            .contains("  Last Login: N/A\n")
            .contains("  Department: Engineering\n")
            .contains("  Secondary Email: N/A\n")
            .endsWith("  Profile URL: N/A");
    }

    @Test
    void get_user의_NotFound는_오류가_아닌_안내_결과다() {
        // when
        InvocationResult result = call("get_user", Map.of("userId", "00u404"));

        // then
        assertThat(result.error()).isFalse();
        assertThat(result.joinedText()).isEqualTo("No user found with ID: 00u404");
    }

    @Test
    void list_users는_limit에_도달하면_다음_페이지_커서를_안내한다() {
        // given
        createUser("ada@corp.io", "Ada", "Lovelace", "Engineering", true);
        createUser("alan@corp.io", "Alan", "Turing", "Research", true);
        createUser("grace@corp.io", "Grace", "Hopper", "Engineering", false);

        // when
        InvocationResult firstPage = call("list_users", Map.of("limit", 2));
        InvocationResult lastPage = call("list_users", Map.of("limit", 2, "after", "00u2"));

        // then
        assertThat(firstPage.joinedText())
            .startsWith("Users:\n\n1. Ada Lovelace (ada@corp.io)\n - ID: 00u1\n - Status: ACTIVE\n")
            .contains("Pagination:\n- Total users shown: 2\n")
            .contains("- For next page, use 'after' parameter with value: 00u2");
        assertThat(lastPage.joinedText())
            .contains("1. Grace Hopper (grace@corp.io)")
            .endsWith("\nTotal users: 1\n");
    }

    @Test
    void list_users는_결과가_없으면_안내한다() {
        // when
        InvocationResult result = call("list_users", Map.of("search", "profile.department eq \"Nowhere\""));

        // then
        assertThat(result.joinedText()).isEqualTo("No users found matching your criteria.");
    }

    @Test
    void list_users는_허용되지_않은_sortOrder를_거부한다() {
        // when
        InvocationResult result = call("list_users", Map.of("sortOrder", "random"));

        // then
        assertThat(result.error()).isTrue();
        assertThat(result.joinedText()).startsWith("Invalid arguments for list_users: sortOrder");
    }

    @Test
    void 사용자_생명주기_Command는_상태를_변경하고_결과를_안내한다() {
        // given
        String id = createUser("ada@corp.io", "Ada", "Lovelace", "Engineering", false).id();

        // when & then
        assertThat(call("activate_user", Map.of("userId", id)).joinedText())
            .isEqualTo("User with ID 00u1 has been activated successfully. An activation email has been sent.");
        assertThat(call("suspend_user", Map.of("userId", id)).joinedText())
            .isEqualTo("User with ID 00u1 has been suspended.");
        assertThat(call("unsuspend_user", Map.of("userId", id)).joinedText())
            .isEqualTo("User with ID 00u1 has been unsuspended and is now active.");
        assertThat(call("deactivate_user", Map.of("userId", id)).joinedText())
            .isEqualTo("User with ID 00u1 has been deactivated.");
        assertThat(call("delete_user", Map.of("userId", id)).joinedText())
            .isEqualTo("User with ID 00u1 has been permanently deleted.");
        assertThat(directory.listAll(10)).isEmpty();
    }

    @Test
    void activate_user는_sendEmail이_false면_메일_안내를_생략한다() {
        // given
        String id = createUser("ada@corp.io", "Ada", "Lovelace", "Engineering", false).id();

        // when
        InvocationResult result = call("activate_user", Map.of("userId", id, "sendEmail", false));

        // then
        assertThat(result.joinedText()).isEqualTo("User with ID 00u1 has been activated successfully.");
    }

    @Test
    void 비활성화_전_삭제는_안내와_함께_오류를_반환한다() {
        // given
        String id = createUser("ada@corp.io", "Ada", "Lovelace", "Engineering", true).id();

        // when
        InvocationResult result = call("delete_user", Map.of("userId", id));

        // then
        assertThat(result.error()).isTrue();
        assertThat(result.joinedText())
            .endsWith("Note: Users must be deactivated before they can be deleted.");
    }

    @Test
    void 변경_대상이_없으면_Dispatcher가_오류로_변환한다() {
        // when
        InvocationResult result = call("suspend_user", Map.of("userId", "00u404"));

        // then
        assertThat(result.error()).isTrue();
        assertThat(result.joinedText()).isEqualTo("Error executing suspend_user: User not found: 00u404");
    }

    @Test
    void get_user_last_location은_90일_이내의_가장_최근_로그인을_보여준다() {
        // given
        String id = createUser("ada@corp.io", "Ada", "Lovelace", "Engineering", true).id();
        directory.publishEvent(new SystemEvent(NOW.minus(Duration.ofDays(120)), "user.session.start", id,
            "198.51.100.1", "Busan", "Busan", "South Korea", "Mobile", "Old/1.0"));
        directory.publishEvent(new SystemEvent(NOW.minus(Duration.ofDays(3)), "user.authentication.sso", id,
            "203.0.113.7", "Seoul", null, "South Korea", "Computer", "Mozilla/5.0"));
        directory.publishEvent(new SystemEvent(NOW.minus(Duration.ofDays(1)), "user.account.lock", id,
            "203.0.113.9", "Incheon", null, "South Korea", null, null));

        // when
        InvocationResult result = call("get_user_last_location", Map.of("userId", id));

        // then
        assertThat(result.joinedText()).isEqualTo("• Last Login Information for User ada@corp.io:\n"
            + "  Time: 2026-02-26T00:00:00Z\n"
            + "  Event Type: user.authentication.sso\n"
            + "  IP Address: 203.0.113.7\n"
            + "  City: Seoul\n"
            + "  State: N/A\n"
            + "  Country: South Korea\n"
            + "  Device: Computer\n"
            + "  User Agent: Mozilla/5.0");
    }

    @Test
    void get_user_last_location의_조회_기간은_주입된_시계를_기준으로_한다() {
        // given
        Instant later = NOW.plus(Duration.ofDays(365));
        InMemoryDirectoryClient laterDirectory = new InMemoryDirectoryClient(
            EnumSet.allOf(SearchOperator.class), Clock.fixed(later, ZoneOffset.UTC));
        String id = laterDirectory.create(EntityDraft.user(
            Map.of("login", "ada@corp.io", "email", "ada@corp.io"), true)).id();
        laterDirectory.publishEvent(new SystemEvent(NOW.minus(Duration.ofDays(3)), "user.session.start", id,
            "203.0.113.7", "Seoul", null, "South Korea", "Computer", "Mozilla/5.0"));
        CommandDispatcher laterDispatcher = DirectoryCommandCatalog.create(laterDirectory, Clock.fixed(later, ZoneOffset.UTC));

        // when
        InvocationResult result = laterDispatcher.dispatch(
            InvocationRequest.of("get_user_last_location", Map.of("userId", id)));

        // then
        assertThat(result.error()).isFalse();
        assertThat(result.joinedText()).startsWith("No login events found for user ada@corp.io in the last 90 days.");
    }

    @Test
    void get_user_last_location은_로그인_기록이_없으면_안내한다() {
        // given
        String id = createUser("ada@corp.io", "Ada", "Lovelace", "Engineering", true).id();

        // when
        InvocationResult result = call("get_user_last_location", Map.of("userId", id));

        // then
        assertThat(result.error()).isFalse();
        assertThat(result.joinedText()).startsWith("No login events found for user ada@corp.io in the last 90 days.");
    }

    @Test
    void get_user_last_location의_NotFound는_안내_결과다() {
        // when
        InvocationResult result = call("get_user_last_location", Map.of("userId", "00u404"));

        // then
        assertThat(result.error()).isFalse();
        assertThat(result.joinedText()).isEqualTo("User with ID 00u404 not found.");
    }

    @Test
    void 로그인_이벤트_필터는_대상과_세_가지_이벤트_유형을_포함한다() {
        assertThat(UserCommands.loginEventFilter("00u1")).isEqualTo(
            "target.id eq \"00u1\" and (eventType eq \"user.session.start\""
                + " or eventType eq \"user.authentication.auth_via_mfa\""
                + " or eventType eq \"user.authentication.sso\")");
    }

    @Test
    void search_users는_지원되지_않는_연산자를_강등하고_값을_마스킹해_보여준다() {
        // given
        createUser("ada@corp.io", "Ada", "Lovelace", "Engineering", true);
        createUser("alan@corp.io", "Alan", "Turing", "Research", true);

        // when
        InvocationResult result = call("search_users", Map.of(
            "attribute", "lastName", "operator", "contains", "value", "Love"));

        // then
        assertThat(result.error()).isFalse();
        assertThat(result.joinedText())
            .startsWith("Found 1 user(s) where lastName contains \"L**e\":\n")
            .contains("1. Ada Lovelace (ada@corp.io)")
            .contains("Search method: free-text search")
            .contains("- Native filter does not support operator 'co'; falling back.")
            .doesNotContain("Warning:");
    }

    @Test
    void search_users는_스캔_단계에서_상한_경고를_붙인다() {
        // given
        InMemoryDirectoryClient restrictive = new InMemoryDirectoryClient(EnumSet.noneOf(SearchOperator.class));
        restrictive.create(EntityDraft.user(Map.of("login", "x@corp.io", "email", "x@corp.io", "title", "CTO"), true));
        restrictive.create(EntityDraft.user(Map.of("login", "y@corp.io", "email", "y@corp.io"), true));
        CommandDispatcher restricted = DirectoryCommandCatalog.create(restrictive);

        // when
        InvocationResult result = restricted.dispatch(InvocationRequest.of("search_users", Map.of(
            "attribute", "title", "operator", "present")));

        // then
        assertThat(result.joinedText())
            .startsWith("Found 1 user(s) where title present:\n")
            .contains("Search method: client-side scan (2 candidate(s) examined)")
            .contains("- Free-text search skipped: operator 'present' has no value to match.")
            .contains("Warning: only the first 200 users in the directory were examined");
    }

    @Test
    void search_users는_하이픈_표기의_연산자를_받는다() {
        // given
        createUser("ada@corp.io", "Ada", "Lovelace", "Engineering", true);
        createUser("alan@corp.io", "Alan", "Turing", "Research", true);

        // when
        InvocationResult result = call("search_users", Map.of(
            "attribute", "department", "operator", "starts-with", "value", "Eng"));

        // then
        assertThat(result.error()).isFalse();
        assertThat(result.joinedText())
            .startsWith("Found 1 user(s) where department starts-with \"Eng\":\n")
            .contains("1. Ada Lovelace (ada@corp.io)")
            .contains("Search method: native filter");
    }

    @Test
    void search_users는_값이_필요한_연산자에_값이_없으면_인자_오류다() {
        // when
        InvocationResult missing = call("search_users", Map.of("attribute", "department", "operator", "equals"));
        InvocationResult empty = call("search_users", Map.of(
            "attribute", "department", "operator", "ends-with", "value", ""));

        // then
        assertThat(missing.error()).isTrue();
        assertThat(missing.joinedText())
            .isEqualTo("Invalid arguments for search_users: value is required for operator equals");
        assertThat(empty.joinedText())
            .isEqualTo("Invalid arguments for search_users: value is required for operator ends-with");
    }

    @Test
    void search_users는_식별자가_아닌_속성_이름을_거부한다() {
        // when
        InvocationResult result = call("search_users", Map.of(
            "attribute", "department eq \"x\" or profile.title", "operator", "present"));

        // then
        assertThat(result.error()).isTrue();
        assertThat(result.joinedText()).isEqualTo(
            "Invalid arguments for search_users: attribute must contain only letters, digits and underscores");
    }

    private InvocationResult call(String name, Map<String, Object> arguments) {
        return dispatcher.dispatch(InvocationRequest.of(name, arguments));
    }

    private EntityRecord createUser(String email, String firstName, String lastName, String department, boolean activate) {
        Map<String, String> profile = new LinkedHashMap<>();
        profile.put("login", email);
        profile.put("email", email);
        profile.put("firstName", firstName);
        profile.put("lastName", lastName);
        profile.put("department", department);
        return directory.create(EntityDraft.user(profile, activate));
    }
}
