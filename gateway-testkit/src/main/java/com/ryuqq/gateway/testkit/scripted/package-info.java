/**
 * Scripted directory client for gateway tests.
 *
 * <p>{@link com.ryuqq.gateway.testkit.scripted.ScriptedDirectoryClient} decorates any
 * {@link com.ryuqq.gateway.core.spi.DirectoryClient}: it records every call and lets a test
 * inject failures or pin list responses per {@link com.ryuqq.gateway.testkit.scripted.DirectoryOperation}.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
package com.ryuqq.gateway.testkit.scripted;
