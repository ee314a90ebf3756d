/**
 * Per-entity processing outcomes.
 *
 * <p>Batch stages never throw on a single entity's failure. Each entity produces exactly one
 * {@link com.ryuqq.gateway.core.outcome.StageOutcome}, appended in input order.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.outcome.OutcomeStatus} - SUCCESS / FAILURE</li>
 *   <li>{@link com.ryuqq.gateway.core.outcome.StageOutcome} - One entity's result in one stage</li>
 *   <li>{@link com.ryuqq.gateway.core.outcome.SubResult} - One sub-operation (e.g. application grant)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.outcome;
