/**
 * Attribute search criteria.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.search.SearchOperator} - Operator with its filter token and client-side match rule</li>
 *   <li>{@link com.ryuqq.gateway.core.search.SearchCriterion} - attribute / operator / value / limit / includeInactive</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.search;
