/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interface that infrastructure adapters implement to give the
 * gateway access to a remote identity directory.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.spi.DirectoryClient} - Users, groups, application grants and system log</li>
 * </ul>
 *
 * <h2>Failure Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.spi.DirectoryException} - Sealed base class</li>
 *   <li>{@link com.ryuqq.gateway.core.spi.EntityNotFoundException} - Addressed entity is absent</li>
 *   <li>{@link com.ryuqq.gateway.core.spi.CapabilityUnsupportedException} - Search operator not honored</li>
 *   <li>{@link com.ryuqq.gateway.core.spi.DirectoryTransportException} - Generic remote failure</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (gateway-adapter-inmemory, gateway-adapter-http) provide concrete implementations.
 * Only the adapter that knows a backend's error vocabulary turns error text into a typed failure.</p>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.spi;
