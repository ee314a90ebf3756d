package com.ryuqq.gateway.application.command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Command 레지스트리.
 *
 * <p><strong>생명주기:</strong></p>
 * <ol>
 *   <li>기동 시 {@link #register(Command)}로 채움</li>
 *   <li>{@link #seal()} 호출</li>
 *   <li>이후 읽기 전용 (조회만 허용)</li>
 * </ol>
 *
 * <p>등록 순서를 유지하며, {@link #listCommands()}도 같은 순서로 반환합니다.
 * 등록은 기동 시 단일 스레드에서만 수행되어야 하며, 봉인 후 조회는 여러 스레드에서 안전합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class CommandRegistry {

    private final Map<String, Command> commands = new LinkedHashMap<>();
    private volatile boolean sealed;

    /**
     * Command 등록.
     *
     * @param command 등록할 Command
     * @throws IllegalArgumentException command가 null인 경우
     * @throws IllegalStateException 이름이 이미 등록되었거나 레지스트리가 봉인된 경우
     */
    public void register(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (sealed) {
            throw new IllegalStateException("Registry is sealed, cannot register: " + command.name());
        }
        if (commands.containsKey(command.name())) {
            throw new IllegalStateException("Command already registered: " + command.name());
        }
        commands.put(command.name(), command);
    }

    /**
     * Provider가 제공하는 모든 Command 등록.
     *
     * @param provider Command 묶음
     * @throws IllegalStateException 이름이 중복되거나 레지스트리가 봉인된 경우
     */
    public void registerAll(CommandProvider provider) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        provider.commands().forEach(this::register);
    }

    /**
     * 레지스트리 봉인. 이후 등록은 실패합니다.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * 이름으로 Command 조회.
     *
     * @param name Command 이름 (null 가능)
     * @return Command (없으면 empty)
     */
    public Optional<Command> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(commands.get(name));
    }

    /**
     * 등록된 Command 정보의 스냅샷.
     *
     * @return 등록 순서의 CommandDescriptor 목록 (읽기 전용)
     */
    public List<CommandDescriptor> listCommands() {
        List<CommandDescriptor> descriptors = new ArrayList<>(commands.size());
        for (Command command : commands.values()) {
            descriptors.add(command.descriptor());
        }
        return Collections.unmodifiableList(descriptors);
    }

    public int size() {
        return commands.size();
    }
}
