package com.ryuqq.gateway.adapter.runner;

import com.ryuqq.gateway.application.command.Command;
import com.ryuqq.gateway.application.command.CommandDescriptor;
import com.ryuqq.gateway.application.command.CommandDispatcher;
import com.ryuqq.gateway.application.command.CommandRegistry;
import com.ryuqq.gateway.core.contract.InvocationRequest;
import com.ryuqq.gateway.core.contract.InvocationResult;
import com.ryuqq.gateway.core.schema.SchemaValidator;
import com.ryuqq.gateway.core.schema.ValidatedArguments;
import com.ryuqq.gateway.core.schema.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * validate → invoke → normalize 파이프라인을 수행하는 Dispatcher 구현체.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>이름으로 Command 조회 (없으면 {@code Unknown command: <name>})</li>
 *   <li>{@link SchemaValidator}로 인자 검증 (실패 시 {@code Invalid arguments for <name>: <field> <cause>},
 *       처리기는 호출되지 않음)</li>
 *   <li>처리기 호출 (실패 또는 null 반환 시 {@code Error executing <name>: <message>})</li>
 * </ol>
 *
 * <p>처리기에서 발생한 모든 실패는 이 클래스에서만 잡히며 로그로 남습니다.
 * {@link #dispatch(InvocationRequest)}는 예외를 던지지 않습니다.</p>
 *
 * <p>생성 시 레지스트리를 봉인합니다. 이후 레지스트리는 읽기 전용이므로
 * 여러 스레드에서 동시에 호출해도 안전합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class ValidatingCommandDispatcher implements CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ValidatingCommandDispatcher.class);

    private final CommandRegistry registry;

    /**
     * 생성자.
     *
     * @param registry Command 레지스트리 (생성 시 봉인됨)
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public ValidatingCommandDispatcher(CommandRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        registry.seal();
        this.registry = registry;
    }

    @Override
    public List<CommandDescriptor> listCommands() {
        return registry.listCommands();
    }

    @Override
    public InvocationResult dispatch(InvocationRequest request) {
        String name = request == null ? null : request.commandName();

        Optional<Command> found = registry.find(name);
        if (found.isEmpty()) {
            log.warn("Unknown command requested: {}", name);
            return InvocationResult.error("Unknown command: " + name);
        }
        Command command = found.get();

        ValidatedArguments arguments;
        try {
            arguments = SchemaValidator.validate(command.inputShape(), request.rawArguments());
        } catch (ValidationException e) {
            log.warn("Invalid arguments for {}: {}", name, e.getMessage());
            return InvocationResult.error("Invalid arguments for " + name + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Argument validation crashed for {}", name, e);
            return InvocationResult.error("Invalid arguments for " + name + ": " + describe(e));
        }

        try {
            InvocationResult result = command.handler().handle(arguments);
            if (result == null) {
                log.error("Command {} returned no result", name);
                return InvocationResult.error("Error executing " + name + ": handler returned no result");
            }
            return result;
        } catch (Exception e) {
            log.error("Command {} failed", name, e);
            return InvocationResult.error("Error executing " + name + ": " + describe(e));
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
