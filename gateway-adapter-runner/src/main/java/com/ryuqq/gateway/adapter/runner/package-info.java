/**
 * Runner Adapter Layer - dispatcher, search selector and onboarding orchestrator implementations.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.adapter.runner.ValidatingCommandDispatcher} - validate → invoke → normalize 파이프라인</li>
 *   <li>{@link com.ryuqq.gateway.adapter.runner.TieredSearchSelector} - 강등 방식 검색 + 검증 단계</li>
 *   <li>{@link com.ryuqq.gateway.adapter.runner.StagedOnboardingOrchestrator} - 3단계 온보딩</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ValidatingCommandDispatcher, TieredSearchSelector, StagedOnboardingOrchestrator)
 *   ↓ implements
 * application (CommandDispatcher, EntitySearch, OnboardingWorkflow)
 *   ↓ depends on
 * core (schema, search, outcome, statemachine)
 *   ↓ depends on
 * core/spi (DirectoryClient interface)
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
package com.ryuqq.gateway.adapter.runner;
