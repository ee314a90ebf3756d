/**
 * In-memory directory adapter package.
 *
 * <p>This package provides a reference implementation of the
 * {@link com.ryuqq.gateway.core.spi.DirectoryClient} SPI used by contract tests,
 * end-to-end gateway tests and local runs without a remote directory.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.adapter.inmemory.InMemoryDirectoryClient}:
 *       users, groups, memberships, application grants and system log events in memory</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Search expressions are limited to a single {@code profile.attr op "value"} clause</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @see com.ryuqq.gateway.core.spi.DirectoryClient
 * @author Gateway Team
 * @since 1.0.0
 */
package com.ryuqq.gateway.adapter.inmemory;
