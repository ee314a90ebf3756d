/**
 * Argument schema package.
 *
 * <p>Declares the input shape of a command and validates untyped argument maps against it
 * before any handler runs.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.gateway.core.schema.FieldDescriptor} - One declared field with its constraints</li>
 *   <li>{@link com.ryuqq.gateway.core.schema.InputShape} - Ordered field list, renderable as JSON Schema</li>
 *   <li>{@link com.ryuqq.gateway.core.schema.SchemaValidator} - Pure validation and defaulting</li>
 *   <li>{@link com.ryuqq.gateway.core.schema.ValidatedArguments} - Typed view of the validated values</li>
 *   <li>{@link com.ryuqq.gateway.core.schema.ValidationException} - First offending field and its cause</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * InputShape shape = InputShape.of(
 *     FieldDescriptor.requiredId("userId", "The unique identifier of the user"),
 *     FieldDescriptor.optional("limit", FieldType.INTEGER, "Maximum results").withRange(1, 200).withDefault(50)
 * );
 * ValidatedArguments args = SchemaValidator.validate(shape, Map.of("userId", "00u1"));
 * args.integer("limit"); // 50
 * </pre>
 *
 * @since 1.0.0
 * @author Gateway Team
 */
package com.ryuqq.gateway.core.schema;
