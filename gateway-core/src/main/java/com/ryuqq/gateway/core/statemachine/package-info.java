/**
 * Search tier and onboarding stage state machines.
 *
 * <p>Both state machines only move forward within a single invocation.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.statemachine.SearchTier} - Search strategy tiers (enum)</li>
 *   <li>{@link com.ryuqq.gateway.core.statemachine.TierTransition} - Demotion-only tier transition validation</li>
 *   <li>{@link com.ryuqq.gateway.core.statemachine.OnboardingStage} - Onboarding stages (enum)</li>
 *   <li>{@link com.ryuqq.gateway.core.statemachine.StageTransition} - Stage transition validation and execution</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * NATIVE_FILTER → FREE_TEXT → CLIENT_SIDE_SCAN   (skipping allowed, never upward)
 * IMPORT → GROUP_ASSIGNMENT → PROVISIONING        (one step at a time, never backward)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * SearchTier tier = SearchTier.NATIVE_FILTER;
 * tier = TierTransition.demote(tier, SearchTier.FREE_TEXT);
 *
 * OnboardingStage stage = OnboardingStage.IMPORT;
 * stage = StageTransition.transition(stage, OnboardingStage.GROUP_ASSIGNMENT);
 * </pre>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.statemachine;
