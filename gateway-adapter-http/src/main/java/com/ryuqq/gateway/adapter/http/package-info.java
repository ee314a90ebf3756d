/**
 * REST directory adapter package.
 *
 * <p>Implements {@link com.ryuqq.gateway.core.spi.DirectoryClient} over the directory's HTTP API
 * with the JDK {@link java.net.http.HttpClient} and the Jackson tree model.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.adapter.http.RestDirectoryClient}: request building and dispatch</li>
 *   <li>{@link com.ryuqq.gateway.adapter.http.DirectoryConnectionConfig}: org URL and API token,
 *       loaded from {@code OKTA_ORG_URL} / {@code OKTA_API_TOKEN}</li>
 *   <li>{@code DirectoryErrorTranslator}: status/body to typed directory failures</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
package com.ryuqq.gateway.adapter.http;
