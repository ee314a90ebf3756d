/**
 * Attribute search contracts.
 *
 * <ul>
 *   <li>{@link com.ryuqq.gateway.application.search.EntitySearch} - Resolves a criterion into verified matches</li>
 *   <li>{@link com.ryuqq.gateway.application.search.SearchResult} - Matches plus tier narration</li>
 *   <li>{@link com.ryuqq.gateway.application.search.PiiMasker} - Masking of echoed PII search values</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.application.search;
