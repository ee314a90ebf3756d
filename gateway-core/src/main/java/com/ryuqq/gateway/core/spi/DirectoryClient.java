package com.ryuqq.gateway.core.spi;

import com.ryuqq.gateway.core.model.EntityDraft;
import com.ryuqq.gateway.core.model.EntityKind;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.model.ListQuery;
import com.ryuqq.gateway.core.model.SystemEvent;

import java.time.Instant;
import java.util.List;

/**
 * Remote identity directory SPI.
 *
 * <p>This interface is the capability surface the gateway consumes from the remote directory.
 * Transport and authentication are the adapter's concern.</p>
 *
 * <p><strong>Failure Contract:</strong></p>
 * <ul>
 *   <li>{@link EntityNotFoundException}: the addressed entity (or application) does not exist</li>
 *   <li>{@link CapabilityUnsupportedException}: a search expression uses an operator the backend does not honor</li>
 *   <li>{@link DirectoryTransportException}: any other remote failure</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Created once at process start and shared read-only afterwards</li>
 *   <li>Every call is a blocking remote round trip; callers never issue two calls concurrently</li>
 *   <li>List results preserve the directory's order</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public interface DirectoryClient {

    /**
     * Fetches a single entity.
     *
     * @param kind entity kind
     * @param entityKey entity key
     * @return the full record
     * @throws EntityNotFoundException if the entity does not exist
     */
    EntityRecord get(EntityKind kind, String entityKey);

    /**
     * Lists entities of a kind.
     *
     * @param kind entity kind
     * @param query listing conditions
     * @return entities in directory order, at most {@code query.limit()}
     * @throws CapabilityUnsupportedException if {@code query.search()} uses an unsupported operator
     */
    List<EntityRecord> list(EntityKind kind, ListQuery query);

    /**
     * Lists users matching a server-side search expression.
     *
     * @param expression search expression (e.g. {@code profile.department eq "Sales"})
     * @param limit maximum results
     * @return matching users
     * @throws CapabilityUnsupportedException if the expression uses an unsupported operator
     */
    default List<EntityRecord> listFiltered(String expression, int limit) {
        return list(EntityKind.USER, ListQuery.search(expression, limit));
    }

    /**
     * Lists users by attribute-agnostic free-text matching.
     *
     * @param text free text
     * @param limit maximum results
     * @return candidate users (best effort, not guaranteed to match any particular attribute)
     */
    default List<EntityRecord> listFreeText(String text, int limit) {
        return list(EntityKind.USER, ListQuery.freeText(text, limit));
    }

    /**
     * Lists users without any filter.
     *
     * @param limit maximum results
     * @return the first {@code limit} users in directory order
     */
    default List<EntityRecord> listAll(int limit) {
        return list(EntityKind.USER, ListQuery.limit(limit));
    }

    /**
     * Creates an entity.
     *
     * @param draft entity attributes
     * @return the created record with its assigned key and status
     */
    EntityRecord create(EntityDraft draft);

    /**
     * Activates a user.
     *
     * @param entityKey user key
     * @param notify whether the directory sends an activation notification
     * @throws EntityNotFoundException if the user does not exist
     */
    void setActivation(String entityKey, boolean notify);

    /**
     * Suspends an active user.
     *
     * @param entityKey user key
     * @throws EntityNotFoundException if the user does not exist
     */
    void suspend(String entityKey);

    /**
     * Returns a suspended user to the active state.
     *
     * @param entityKey user key
     * @throws EntityNotFoundException if the user does not exist
     */
    void unsuspend(String entityKey);

    /**
     * Deactivates a user (required before deletion).
     *
     * @param entityKey user key
     * @throws EntityNotFoundException if the user does not exist
     */
    void deactivate(String entityKey);

    /**
     * Deletes an entity.
     *
     * @param kind entity kind
     * @param entityKey entity key
     * @throws EntityNotFoundException if the entity does not exist
     */
    void delete(EntityKind kind, String entityKey);

    /**
     * Adds a user to a group.
     *
     * @param groupId group key
     * @param entityKey user key
     * @throws EntityNotFoundException if the group or user does not exist
     */
    void assignToGroup(String groupId, String entityKey);

    /**
     * Removes a user from a group.
     *
     * @param groupId group key
     * @param entityKey user key
     * @throws EntityNotFoundException if the group or user does not exist
     */
    void removeFromGroup(String groupId, String entityKey);

    /**
     * Lists the members of a group.
     *
     * @param groupId group key
     * @param query paging conditions ({@code limit}, {@code after})
     * @return member users
     * @throws EntityNotFoundException if the group does not exist
     */
    List<EntityRecord> listGroupMembers(String groupId, ListQuery query);

    /**
     * Grants a user access to an application.
     *
     * @param appId application id
     * @param entityKey user key
     * @throws EntityNotFoundException if the application or user does not exist
     */
    void grantApplication(String appId, String entityKey);

    /**
     * Lists system log events, most recent first.
     *
     * @param filter event filter expression (null for none)
     * @param since lower bound of the publish time (null for none)
     * @param limit maximum results
     * @return matching events
     */
    List<SystemEvent> listSystemEvents(String filter, Instant since, int limit);
}
