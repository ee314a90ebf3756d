package com.ryuqq.gateway.application.command;

import java.util.List;

/**
 * 관련 Command 묶음을 제공하는 모듈 (예: 사용자 관리, 그룹 관리).
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public interface CommandProvider {

    /**
     * 제공하는 Command 목록 (등록 순서).
     *
     * @return Command 목록
     */
    List<Command> commands();
}
