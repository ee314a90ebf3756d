package com.ryuqq.gateway.adapter.tools;

import com.ryuqq.gateway.application.command.Command;
import com.ryuqq.gateway.application.command.CommandProvider;
import com.ryuqq.gateway.application.search.EntitySearch;
import com.ryuqq.gateway.core.contract.InvocationResult;
import com.ryuqq.gateway.core.model.EntityDraft;
import com.ryuqq.gateway.core.model.EntityKind;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.model.ListQuery;
import com.ryuqq.gateway.core.model.SortOrder;
import com.ryuqq.gateway.core.model.SystemEvent;
import com.ryuqq.gateway.core.schema.FieldDescriptor;
import com.ryuqq.gateway.core.schema.FieldFormat;
import com.ryuqq.gateway.core.schema.FieldType;
import com.ryuqq.gateway.core.schema.InputShape;
import com.ryuqq.gateway.core.schema.ValidatedArguments;
import com.ryuqq.gateway.core.schema.ValidationException;
import com.ryuqq.gateway.core.search.SearchCriterion;
import com.ryuqq.gateway.core.search.SearchOperator;
import com.ryuqq.gateway.core.spi.DirectoryClient;
import com.ryuqq.gateway.core.spi.DirectoryTransportException;
import com.ryuqq.gateway.core.spi.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 사용자 Command 모음.
 *
 * <p>단건 조회(get_user, get_user_last_location)의 NotFound는 오류가 아닌 안내 결과로 반환하고,
 * 변경 대상의 NotFound는 그대로 전파해 Dispatcher가 오류 결과로 변환하게 합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class UserCommands implements CommandProvider {

    private static final Logger log = LoggerFactory.getLogger(UserCommands.class);

    /**
     * 마지막 로그인 위치 조회 기간.
     */
    public static final Duration LOGIN_LOOKBACK = Duration.ofDays(90);

    static final List<String> LOGIN_EVENT_TYPES = List.of(
        "user.session.start",
        "user.authentication.auth_via_mfa",
        "user.authentication.sso"
    );

    private static final FieldDescriptor USER_ID =
        FieldDescriptor.requiredId("userId", "The unique identifier of the user");

    private final DirectoryClient directory;
    private final EntitySearch search;
    private final Clock clock;

    /**
     * 생성자 (시스템 UTC 시계).
     *
     * @param directory 디렉터리 클라이언트
     * @param search 속성 검색
     */
    public UserCommands(DirectoryClient directory, EntitySearch search) {
        this(directory, search, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param directory 디렉터리 클라이언트
     * @param search 속성 검색
     * @param clock 조회 기간 계산용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public UserCommands(DirectoryClient directory, EntitySearch search, Clock clock) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (search == null) {
            throw new IllegalArgumentException("search cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.directory = directory;
        this.search = search;
        this.clock = clock;
    }

    @Override
    public List<Command> commands() {
        return List.of(
            new Command("get_user", "Retrieve detailed user information by user ID",
                InputShape.of(USER_ID), this::getUser),
            new Command("list_users", "List users with optional filtering and pagination",
                InputShape.of(
                    CommandFields.limit(),
                    FieldDescriptor.optional("filter", FieldType.STRING, "Filter expression to filter users"),
                    FieldDescriptor.optional("search", FieldType.STRING, "Search expression across profile attributes"),
                    FieldDescriptor.optional("q", FieldType.STRING, "Simple text match on first name, last name or email"),
                    CommandFields.after(),
                    FieldDescriptor.optional("sortBy", FieldType.STRING, "Field to sort results by"),
                    CommandFields.sortOrder()
                ), this::listUsers),
            new Command("create_user", "Create a new user",
                InputShape.of(
                    FieldDescriptor.required("firstName", FieldType.STRING, "User's first name").withMinLength(1),
                    FieldDescriptor.required("lastName", FieldType.STRING, "User's last name").withMinLength(1),
                    FieldDescriptor.required("email", FieldType.STRING, "User's email address").withFormat(FieldFormat.EMAIL),
                    FieldDescriptor.optional("login", FieldType.STRING, "User's login (defaults to email if not provided)"),
                    FieldDescriptor.optional("activate", FieldType.BOOLEAN, "Whether to activate the user immediately")
                        .withDefault(false)
                ), this::createUser),
            new Command("activate_user", "Activate a user",
                InputShape.of(
                    USER_ID,
                    FieldDescriptor.optional("sendEmail", FieldType.BOOLEAN, "Whether to send an activation email")
                        .withDefault(true)
                ), this::activateUser),
            new Command("suspend_user", "Suspend a user",
                InputShape.of(USER_ID), this::suspendUser),
            new Command("unsuspend_user", "Unsuspend a user",
                InputShape.of(USER_ID), this::unsuspendUser),
            new Command("deactivate_user", "Deactivate a user",
                InputShape.of(USER_ID), this::deactivateUser),
            new Command("delete_user", "Delete a user (must be deactivated first)",
                InputShape.of(USER_ID), this::deleteUser),
            new Command("get_user_last_location", "Get the location of a user's most recent login",
                InputShape.of(USER_ID), this::getUserLastLocation),
            new Command("search_users", "Find users whose profile attribute matches a condition",
                InputShape.of(
                    FieldDescriptor.requiredId("attribute", "Profile attribute to match (e.g. department)")
                        .withFormat(FieldFormat.ATTRIBUTE_NAME),
                    FieldDescriptor.required("operator", FieldType.STRING, "Comparison operator")
                        .withAllowedValues(SearchOperator.wireValues()),
                    FieldDescriptor.optional("value", FieldType.STRING, "Value to compare (not used for 'present')"),
                    CommandFields.limit(),
                    FieldDescriptor.optional("includeInactive", FieldType.BOOLEAN,
                        "Whether suspended and deprovisioned users are included").withDefault(false)
                ).withRule(UserCommands::requireComparisonValue), this::searchUsers)
        );
    }

    private InvocationResult getUser(ValidatedArguments arguments) {
        String userId = arguments.string("userId");
        try {
            return InvocationResult.text(EntityTextRenderer.userDetails(directory.get(EntityKind.USER, userId)));
        } catch (EntityNotFoundException e) {
            return InvocationResult.text("No user found with ID: " + userId);
        }
    }

    private InvocationResult listUsers(ValidatedArguments arguments) {
        int limit = arguments.integer("limit");
        ListQuery query = new ListQuery(
            limit,
            arguments.string("filter"),
            arguments.string("search"),
            arguments.string("q"),
            arguments.string("after"),
            arguments.string("sortBy"),
            SortOrder.fromValue(arguments.string("sortOrder"))
        );
        List<EntityRecord> users = directory.list(EntityKind.USER, query);
        if (users.isEmpty()) {
            return InvocationResult.text("No users found matching your criteria.");
        }
        return InvocationResult.text(EntityTextRenderer.userList("Users:", users, limit, "Total users"));
    }

    private InvocationResult createUser(ValidatedArguments arguments) {
        String email = arguments.string("email");
        Map<String, String> profile = new LinkedHashMap<>();
        profile.put("firstName", arguments.string("firstName"));
        profile.put("lastName", arguments.string("lastName"));
        profile.put("email", email);
        profile.put("login", arguments.optionalString("login").filter(login -> !login.isBlank()).orElse(email));

        EntityRecord user = directory.create(EntityDraft.user(profile, arguments.bool("activate")));
        log.info("Created user {} ({})", user.id(), user.status());
        return InvocationResult.text("User created successfully:\n"
            + "ID: " + user.id() + "\n"
            + "Login: " + user.attributeOr("login", profile.get("login")) + "\n"
            + "Status: " + user.status().name() + "\n"
            + "Created: " + EntityTextRenderer.timestamp(user, EntityRecord.CREATED));
    }

    private InvocationResult activateUser(ValidatedArguments arguments) {
        String userId = arguments.string("userId");
        boolean sendEmail = arguments.bool("sendEmail");
        directory.setActivation(userId, sendEmail);
        return InvocationResult.text("User with ID " + userId + " has been activated successfully."
            + (sendEmail ? " An activation email has been sent." : ""));
    }

    private InvocationResult suspendUser(ValidatedArguments arguments) {
        String userId = arguments.string("userId");
        directory.suspend(userId);
        return InvocationResult.text("User with ID " + userId + " has been suspended.");
    }

    private InvocationResult unsuspendUser(ValidatedArguments arguments) {
        String userId = arguments.string("userId");
        directory.unsuspend(userId);
        return InvocationResult.text("User with ID " + userId + " has been unsuspended and is now active.");
    }

    private InvocationResult deactivateUser(ValidatedArguments arguments) {
        String userId = arguments.string("userId");
        directory.deactivate(userId);
        return InvocationResult.text("User with ID " + userId + " has been deactivated.");
    }

    private InvocationResult deleteUser(ValidatedArguments arguments) {
        String userId = arguments.string("userId");
        try {
            directory.delete(EntityKind.USER, userId);
        } catch (DirectoryTransportException e) {
            return InvocationResult.error("Failed to delete user: " + e.getMessage()
                + ". Note: Users must be deactivated before they can be deleted.");
        }
        return InvocationResult.text("User with ID " + userId + " has been permanently deleted.");
    }

    private InvocationResult getUserLastLocation(ValidatedArguments arguments) {
        String userId = arguments.string("userId");
        EntityRecord user;
        try {
            user = directory.get(EntityKind.USER, userId);
        } catch (EntityNotFoundException e) {
            return InvocationResult.text("User with ID " + userId + " not found.");
        }
        String login = user.attributeOr("login", user.id());

        Instant since = clock.instant().minus(LOGIN_LOOKBACK);
        List<SystemEvent> events = directory.listSystemEvents(loginEventFilter(user.id()), since, 1);
        if (events.isEmpty()) {
            return InvocationResult.text("No login events found for user " + login + " in the last "
                + LOGIN_LOOKBACK.toDays() + " days. This might mean the user hasn't logged in recently "
                + "or the events are not being captured in the system logs.");
        }
        return InvocationResult.text(EntityTextRenderer.lastLocation(login, events.get(0)));
    }

    private InvocationResult searchUsers(ValidatedArguments arguments) {
        SearchCriterion criterion = new SearchCriterion(
            arguments.string("attribute"),
            SearchOperator.fromValue(arguments.string("operator")),
            arguments.string("value"),
            arguments.integer("limit"),
            arguments.bool("includeInactive")
        );
        return InvocationResult.text(EntityTextRenderer.searchResult(search.search(criterion)));
    }

    private static void requireComparisonValue(ValidatedArguments arguments) {
        SearchOperator operator = SearchOperator.fromValue(arguments.string("operator"));
        boolean missing = arguments.optionalString("value").map(String::isEmpty).orElse(true);
        if (operator.requiresValue() && missing) {
            throw new ValidationException("value", "is required for operator " + operator.wireValue());
        }
    }

    static String loginEventFilter(String userId) {
        StringBuilder filter = new StringBuilder("target.id eq \"").append(userId).append("\" and (");
        for (int i = 0; i < LOGIN_EVENT_TYPES.size(); i++) {
            if (i > 0) {
                filter.append(" or ");
            }
            filter.append("eventType eq \"").append(LOGIN_EVENT_TYPES.get(i)).append('"');
        }
        return filter.append(')').toString();
    }
}
