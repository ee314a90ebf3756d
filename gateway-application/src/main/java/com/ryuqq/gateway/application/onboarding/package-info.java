/**
 * Bulk onboarding contracts.
 *
 * <h2>Stages</h2>
 * <pre>
 * rows ──► Import ──(success keys)──┬──► Group Assignment
 *                                   └──► Provisioning
 * </pre>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.application.onboarding.OnboardingWorkflow} - Stage operations and full run</li>
 *   <li>{@link com.ryuqq.gateway.application.onboarding.StageReport} - Per-stage successes / failures / skip</li>
 *   <li>{@link com.ryuqq.gateway.application.onboarding.WorkflowReport} - Three stage reports plus summary</li>
 *   <li>{@link com.ryuqq.gateway.application.onboarding.GroupMappingTable} - attribute → value → group id rules</li>
 *   <li>{@link com.ryuqq.gateway.application.onboarding.TabularRowParser} - Tabular input port</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.application.onboarding;
