package com.ryuqq.gateway.application.command;

import com.ryuqq.gateway.core.schema.InputShape;

/**
 * 이름으로 호출되는 검증된 작업.
 *
 * <p>name은 레지스트리 내에서 유일한 키입니다. 등록 후 변경되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Command getUser = new Command(
 *     "get_user",
 *     "Retrieve detailed user information from the directory by user ID",
 *     InputShape.of(FieldDescriptor.requiredId("userId", "The unique identifier of the user")),
 *     args -&gt; InvocationResult.text(render(directory.get(EntityKind.USER, args.string("userId"))))
 * );
 * </pre>
 *
 * @param name Command 이름 (예: get_user)
 * @param description 설명
 * @param inputShape 입력 형태
 * @param handler 처리기
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record Command(
    String name,
    String description,
    InputShape inputShape,
    CommandHandler handler
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name, inputShape, handler 중 하나라도 없는 경우
     */
    public Command {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (inputShape == null) {
            throw new IllegalArgumentException("inputShape cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        description = description == null ? "" : description;
    }

    /**
     * 광고용 정보.
     *
     * @return CommandDescriptor
     */
    public CommandDescriptor descriptor() {
        return new CommandDescriptor(name, description, inputShape);
    }
}
