package com.ryuqq.gateway.testkit.contract;

import com.ryuqq.gateway.core.model.EntityDraft;
import com.ryuqq.gateway.core.model.EntityKind;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.model.EntityStatus;
import com.ryuqq.gateway.core.model.ListQuery;
import com.ryuqq.gateway.core.spi.CapabilityUnsupportedException;
import com.ryuqq.gateway.core.spi.DirectoryClient;
import com.ryuqq.gateway.core.spi.EntityNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Abstract base class for {@link DirectoryClient} Contract Tests.
 *
 * <p>Every adapter that implements the directory SPI extends this class and supplies a fresh
 * client per test. The scenarios cover the behavior the gateway relies on:</p>
 * <ul>
 *   <li>Creation and lookup, including the not-found failure</li>
 *   <li>List order, limit and {@code after} paging</li>
 *   <li>Search expressions, free text and unsupported operators</li>
 *   <li>Lifecycle transitions, group membership and application grants</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyDirectoryClientContractTest extends AbstractDirectoryClientContractTest {
 *     {@literal @}Override
 *     protected DirectoryClient createClient() {
 *         return new MyDirectoryClient();
 *     }
 *     ...
 * }
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public abstract class AbstractDirectoryClientContractTest {

    protected DirectoryClient client;

    /**
     * Creates the client under test. Called before each test.
     *
     * @return a client backed by an empty directory
     */
    protected abstract DirectoryClient createClient();

    /**
     * Makes an application available for grants.
     *
     * @param directoryClient the client under test
     * @return the application id
     */
    protected abstract String registerApplication(DirectoryClient directoryClient);

    /**
     * Filter operator token the client rejects with {@link CapabilityUnsupportedException}.
     *
     * @return the token (e.g. "ew"), or null if the client supports every operator
     */
    protected abstract String unsupportedOperatorToken();

    /**
     * Releases resources held by the client. Called after each test.
     *
     * @param directoryClient the client under test
     */
    protected void cleanUp(DirectoryClient directoryClient) {
    }

    @BeforeEach
    void setUpClient() {
        client = createClient();
    }

    @AfterEach
    void tearDownClient() {
        if (client != null) {
            cleanUp(client);
        }
    }

    @Test
    void createdUserCanBeFetchedById() {
        // Given
        EntityRecord created = createUser("ada@example.com", "Ada", "Lovelace", "Engineering", false);

        // When
        EntityRecord fetched = client.get(EntityKind.USER, created.id());

        // Then
        assertNotNull(created.id());
        assertEquals(EntityKind.USER, fetched.kind());
        assertEquals("ada@example.com", fetched.attributeOr("email", null));
        assertEquals("Engineering", fetched.attributeOr("department", null));
    }

    @Test
    void createWithoutActivationLeavesUserStaged() {
        EntityRecord staged = createUser("staged@example.com", "Stay", "Staged", "Sales", false);
        EntityRecord active = createUser("active@example.com", "Ann", "Active", "Sales", true);

        assertEquals(EntityStatus.STAGED, staged.status());
        assertEquals(EntityStatus.ACTIVE, active.status());
    }

    @Test
    void getUnknownUserThrowsNotFound() {
        EntityNotFoundException exception = assertThrows(EntityNotFoundException.class,
            () -> client.get(EntityKind.USER, "missing-user"));

        assertEquals("missing-user", exception.getEntityKey());
    }

    @Test
    void listPreservesDirectoryOrderAndHonorsLimit() {
        // Given
        EntityRecord first = createUser("one@example.com", "One", "User", "Sales", true);
        EntityRecord second = createUser("two@example.com", "Two", "User", "Sales", true);
        createUser("three@example.com", "Three", "User", "Sales", true);

        // When
        List<EntityRecord> page = client.listAll(2);

        // Then
        assertEquals(List.of(first.id(), second.id()), ids(page));
    }

    @Test
    void afterCursorContinuesFromTheGivenEntity() {
        EntityRecord first = createUser("one@example.com", "One", "User", "Sales", true);
        EntityRecord second = createUser("two@example.com", "Two", "User", "Sales", true);
        EntityRecord third = createUser("three@example.com", "Three", "User", "Sales", true);

        List<EntityRecord> page = client.list(EntityKind.USER, ListQuery.limit(10).withAfter(first.id()));

        assertEquals(List.of(second.id(), third.id()), ids(page));
    }

    @Test
    void equalsExpressionMatchesCaseInsensitively() {
        // Given
        EntityRecord sales = createUser("s@example.com", "Sam", "Seller", "Sales", true);
        createUser("e@example.com", "Eve", "Engineer", "Engineering", true);

        // When
        List<EntityRecord> found = client.listFiltered("profile.department eq \"sales\"", 50);

        // Then
        assertEquals(List.of(sales.id()), ids(found));
    }

    @Test
    void unsupportedOperatorRaisesCapabilityUnsupported() {
        String token = unsupportedOperatorToken();
        assumeTrue(token != null, "client supports every operator");
        createUser("s@example.com", "Sam", "Seller", "Sales", true);

        assertThrows(CapabilityUnsupportedException.class,
            () -> client.listFiltered("profile.department " + token + " \"les\"", 50));
    }

    @Test
    void freeTextReturnsSupersetContainingPrefixMatch() {
        EntityRecord ada = createUser("ada@example.com", "Ada", "Lovelace", "Engineering", true);
        createUser("bob@example.com", "Bob", "Builder", "Facilities", true);

        List<EntityRecord> candidates = client.listFreeText("Ada", 50);

        assertTrue(ids(candidates).contains(ada.id()));
    }

    @Test
    void activationSuspensionAndDeactivationFollowLifecycle() {
        // Given
        EntityRecord user = createUser("life@example.com", "Life", "Cycle", "Ops", false);

        // When / Then
        client.setActivation(user.id(), false);
        assertEquals(EntityStatus.ACTIVE, client.get(EntityKind.USER, user.id()).status());

        client.suspend(user.id());
        assertEquals(EntityStatus.SUSPENDED, client.get(EntityKind.USER, user.id()).status());

        client.unsuspend(user.id());
        assertEquals(EntityStatus.ACTIVE, client.get(EntityKind.USER, user.id()).status());

        client.deactivate(user.id());
        assertEquals(EntityStatus.DEPROVISIONED, client.get(EntityKind.USER, user.id()).status());
    }

    @Test
    void deletedUserIsNoLongerFound() {
        EntityRecord user = createUser("gone@example.com", "Soon", "Gone", "Ops", true);

        client.deactivate(user.id());
        client.delete(EntityKind.USER, user.id());

        assertThrows(EntityNotFoundException.class, () -> client.get(EntityKind.USER, user.id()));
    }

    @Test
    void groupMembershipCanBeAssignedListedAndRemoved() {
        // Given
        EntityRecord group = client.create(EntityDraft.group("Engineering", "All engineers"));
        EntityRecord user = createUser("dev@example.com", "Dev", "Eloper", "Engineering", true);

        // When
        client.assignToGroup(group.id(), user.id());
        List<EntityRecord> members = client.listGroupMembers(group.id(), ListQuery.limit(50));
        client.removeFromGroup(group.id(), user.id());
        List<EntityRecord> afterRemoval = client.listGroupMembers(group.id(), ListQuery.limit(50));

        // Then
        assertEquals(EntityKind.GROUP, group.kind());
        assertEquals("Engineering", client.get(EntityKind.GROUP, group.id()).attributeOr("name", null));
        assertEquals(List.of(user.id()), ids(members));
        assertTrue(afterRemoval.isEmpty());
    }

    @Test
    void assignToUnknownGroupThrowsNotFound() {
        EntityRecord user = createUser("dev@example.com", "Dev", "Eloper", "Engineering", true);

        assertThrows(EntityNotFoundException.class, () -> client.assignToGroup("missing-group", user.id()));
    }

    @Test
    void grantApplicationSucceedsForKnownApplicationOnly() {
        EntityRecord user = createUser("app@example.com", "App", "User", "Engineering", true);
        String appId = registerApplication(client);

        assertDoesNotThrow(() -> client.grantApplication(appId, user.id()));
        assertThrows(EntityNotFoundException.class, () -> client.grantApplication("missing-app", user.id()));
    }

    /**
     * Creates a user with the common profile attributes.
     *
     * @param email email and login
     * @param firstName first name
     * @param lastName last name
     * @param department department
     * @param activate whether to activate on creation
     * @return the created record
     */
    protected EntityRecord createUser(String email, String firstName, String lastName,
                                      String department, boolean activate) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("login", email);
        attributes.put("email", email);
        attributes.put("firstName", firstName);
        attributes.put("lastName", lastName);
        attributes.put("department", department);
        return client.create(EntityDraft.user(attributes, activate));
    }

    /**
     * Extracts the ids of the given records in order.
     *
     * @param records records
     * @return ids
     */
    protected static List<String> ids(List<EntityRecord> records) {
        return records.stream().map(EntityRecord::id).collect(Collectors.toList());
    }
}
