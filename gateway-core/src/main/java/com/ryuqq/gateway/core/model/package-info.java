/**
 * Directory domain model package.
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.model.EntityRecord} - User or group as returned by the directory</li>
 *   <li>{@link com.ryuqq.gateway.core.model.EntityDraft} - Attributes of an entity to be created</li>
 *   <li>{@link com.ryuqq.gateway.core.model.ListQuery} - Listing conditions (filter, search, free text, paging)</li>
 *   <li>{@link com.ryuqq.gateway.core.model.SystemEvent} - System log entry</li>
 * </ul>
 *
 * <h2>Attribute Model</h2>
 * <p>Profiles are plain {@code Map<String, String>} values, so attribute-driven logic
 * (search verification, group mapping) is a key lookup.</p>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.model;
