/**
 * Command invocation contract package.
 *
 * <p>This package defines the input and output structure of a single command invocation
 * at the protocol boundary:</p>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.contract.InvocationRequest} - Command name with untyped arguments</li>
 *   <li>{@link com.ryuqq.gateway.core.contract.InvocationResult} - Ordered content blocks with an error flag</li>
 *   <li>{@link com.ryuqq.gateway.core.contract.ContentBlock} - A single text block</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Records copy their collections on construction</li>
 *   <li><strong>Single channel:</strong> Failures travel as {@code InvocationResult} with {@code error=true}, never as exceptions</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.contract;
