package com.ryuqq.gateway.adapter.tools;

import com.ryuqq.gateway.adapter.http.DirectoryConnectionConfig;
import com.ryuqq.gateway.adapter.http.RestDirectoryClient;
import com.ryuqq.gateway.adapter.runner.OnboardingConfig;
import com.ryuqq.gateway.adapter.runner.SearchConfig;
import com.ryuqq.gateway.adapter.runner.StagedOnboardingOrchestrator;
import com.ryuqq.gateway.adapter.runner.TieredSearchSelector;
import com.ryuqq.gateway.adapter.runner.ValidatingCommandDispatcher;
import com.ryuqq.gateway.application.command.CommandDispatcher;
import com.ryuqq.gateway.application.command.CommandRegistry;
import com.ryuqq.gateway.core.spi.DirectoryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * 전체 Command 카탈로그 조립.
 *
 * <p>사용자, 그룹, 온보딩 Command를 하나의 레지스트리에 등록하고 봉인한 뒤
 * {@link ValidatingCommandDispatcher}로 감싸 반환합니다. 프로세스 시작 시 한 번 호출합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CommandDispatcher dispatcher = DirectoryCommandCatalog.fromEnvironment();
 * InvocationResult result = dispatcher.dispatch(InvocationRequest.of("get_user", Map.of("userId", "00u1")));
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class DirectoryCommandCatalog {

    private static final Logger log = LoggerFactory.getLogger(DirectoryCommandCatalog.class);

    private DirectoryCommandCatalog() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 프로세스 환경 변수로 REST 디렉터리에 연결한 Dispatcher 생성.
     *
     * @return CommandDispatcher
     * @throws IllegalStateException OKTA_ORG_URL 또는 OKTA_API_TOKEN이 없는 경우
     */
    public static CommandDispatcher fromEnvironment() {
        return connect(DirectoryConnectionConfig.fromEnvironment());
    }

    /**
     * 주어진 환경 맵으로 REST 디렉터리에 연결한 Dispatcher 생성.
     *
     * @param environment 환경 변수 맵
     * @return CommandDispatcher
     * @throws IllegalStateException 필요한 값이 없는 경우
     */
    public static CommandDispatcher fromEnvironment(Map<String, String> environment) {
        return connect(DirectoryConnectionConfig.fromEnvironment(environment));
    }

    /**
     * REST 디렉터리에 연결한 Dispatcher 생성.
     *
     * @param config 연결 설정
     * @return CommandDispatcher
     */
    public static CommandDispatcher connect(DirectoryConnectionConfig config) {
        log.info("Connecting to directory at {}", config.orgUrl());
        return create(new RestDirectoryClient(config));
    }

    /**
     * 기본 설정의 Dispatcher 생성.
     *
     * @param directory 디렉터리 클라이언트
     * @return CommandDispatcher
     */
    public static CommandDispatcher create(DirectoryClient directory) {
        return create(directory, Clock.systemUTC());
    }

    /**
     * 주어진 시계를 쓰는 기본 설정의 Dispatcher 생성.
     *
     * @param directory 디렉터리 클라이언트
     * @param clock 로그인 기록 조회 기간 계산용 시계
     * @return CommandDispatcher
     */
    public static CommandDispatcher create(DirectoryClient directory, Clock clock) {
        return create(directory, new SearchConfig(), new OnboardingConfig(), clock);
    }

    /**
     * Dispatcher 생성.
     *
     * @param directory 디렉터리 클라이언트
     * @param searchConfig 검색 설정
     * @param onboardingConfig 온보딩 설정
     * @param clock 로그인 기록 조회 기간 계산용 시계
     * @return 봉인된 레지스트리를 사용하는 CommandDispatcher
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static CommandDispatcher create(DirectoryClient directory, SearchConfig searchConfig,
                                           OnboardingConfig onboardingConfig, Clock clock) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        CommandRegistry registry = new CommandRegistry();
        registry.registerAll(new UserCommands(directory, new TieredSearchSelector(directory, searchConfig), clock));
        registry.registerAll(new GroupCommands(directory));
        registry.registerAll(new OnboardingCommands(
            new StagedOnboardingOrchestrator(directory, onboardingConfig),
            new CsvRowParser()
        ));
        log.info("Registered {} command(s)", registry.size());
        return new ValidatingCommandDispatcher(registry);
    }
}
