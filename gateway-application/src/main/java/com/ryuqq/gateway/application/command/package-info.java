/**
 * Command registry and dispatcher contracts.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.application.command.Command} - name, description, input shape and handler</li>
 *   <li>{@link com.ryuqq.gateway.application.command.CommandRegistry} - Registration-ordered, sealable registry</li>
 *   <li>{@link com.ryuqq.gateway.application.command.CommandDispatcher} - Never-throwing invocation entry point</li>
 *   <li>{@link com.ryuqq.gateway.application.command.CommandProvider} - Group of related commands</li>
 * </ul>
 *
 * <h2>Pipeline</h2>
 * <pre>
 * InvocationRequest
 *   → lookup (Unknown command)
 *   → SchemaValidator (Invalid arguments)
 *   → CommandHandler (Error executing)
 *   → InvocationResult
 * </pre>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.application.command;
