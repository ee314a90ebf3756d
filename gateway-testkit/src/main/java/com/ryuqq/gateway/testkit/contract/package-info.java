/**
 * Contract Tests for the directory SPI.
 *
 * <p>Adapters extend {@link com.ryuqq.gateway.testkit.contract.AbstractDirectoryClientContractTest}
 * to verify they satisfy the behavior the gateway depends on.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
package com.ryuqq.gateway.testkit.contract;
