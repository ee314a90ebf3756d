package com.ryuqq.gateway.adapter.runner;

import com.ryuqq.gateway.application.search.EntitySearch;
import com.ryuqq.gateway.application.search.PiiMasker;
import com.ryuqq.gateway.application.search.SearchResult;
import com.ryuqq.gateway.core.model.EntityKind;
import com.ryuqq.gateway.core.model.EntityRecord;
import com.ryuqq.gateway.core.search.SearchCriterion;
import com.ryuqq.gateway.core.search.SearchOperator;
import com.ryuqq.gateway.core.spi.CapabilityUnsupportedException;
import com.ryuqq.gateway.core.spi.DirectoryClient;
import com.ryuqq.gateway.core.statemachine.SearchTier;
import com.ryuqq.gateway.core.statemachine.TierTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 강등 방식의 검색 전략 선택기.
 *
 * <p><strong>알고리즘 (각 tier 최대 1회):</strong></p>
 * <ol>
 *   <li><strong>NATIVE_FILTER:</strong> {@code profile.<attr> <op> "<value>"} 표현식으로 서버 측 필터.
 *       {@link CapabilityUnsupportedException} 또는 다른 실패 시 강등</li>
 *   <li><strong>FREE_TEXT:</strong> 값만으로 자유 텍스트 매칭. 실패 시 강등.
 *       PRESENT 연산자는 비교할 텍스트가 없으므로 건너뜀</li>
 *   <li><strong>CLIENT_SIDE_SCAN:</strong> 필터 없이 {@link SearchConfig#scanCap()}개 조회</li>
 * </ol>
 *
 * <p><strong>검증 단계:</strong></p>
 * <ul>
 *   <li>NATIVE_FILTER 결과는 속성 일치를 신뢰하고 상태 규칙만 적용</li>
 *   <li>그 외 tier의 후보는 전체 레코드를 다시 조회해 연산자 규칙으로 비교 (대소문자 무시)</li>
 *   <li>includeInactive=false면 SUSPENDED/DEPROVISIONED 제외 (모든 tier)</li>
 *   <li>검증된 결과가 limit개가 되면 즉시 중단</li>
 *   <li>레코드 조회에 실패한 후보는 건너뛰고 unverifiable로 집계</li>
 * </ul>
 *
 * <p>후보는 한 번에 하나씩 입력 순서대로 처리합니다. 상태를 갖지 않으므로 thread-safe합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class TieredSearchSelector implements EntitySearch {

    private static final Logger log = LoggerFactory.getLogger(TieredSearchSelector.class);

    private final DirectoryClient directory;
    private final SearchConfig config;

    /**
     * 생성자 (기본 설정).
     *
     * @param directory 디렉터리 클라이언트
     * @throws IllegalArgumentException directory가 null인 경우
     */
    public TieredSearchSelector(DirectoryClient directory) {
        this(directory, new SearchConfig());
    }

    /**
     * 생성자.
     *
     * @param directory 디렉터리 클라이언트
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TieredSearchSelector(DirectoryClient directory, SearchConfig config) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.directory = directory;
        this.config = config;
    }

    @Override
    public SearchResult search(SearchCriterion criterion) {
        if (criterion == null) {
            throw new IllegalArgumentException("criterion cannot be null");
        }
        List<String> notes = new ArrayList<>();
        SearchTier tier = SearchTier.NATIVE_FILTER;

        List<EntityRecord> candidates = tryNativeFilter(criterion, notes);

        if (candidates == null && criterion.operator().requiresValue()) {
            tier = TierTransition.demote(tier, SearchTier.FREE_TEXT);
            candidates = tryFreeText(criterion, notes);
        } else if (candidates == null) {
            notes.add("Free-text search skipped: operator 'present' has no value to match.");
        }

        if (candidates == null) {
            tier = TierTransition.demote(tier, SearchTier.CLIENT_SIDE_SCAN);
            candidates = directory.listAll(config.scanCap());
        }

        return verify(criterion, tier, candidates, notes);
    }

    /**
     * 서버 측 필터 표현식 생성.
     *
     * <p>값의 역슬래시와 큰따옴표는 이스케이프합니다.</p>
     *
     * @param criterion 검색 조건
     * @return 필터 표현식 (예: {@code profile.department eq "Sales"}, {@code profile.manager pr})
     */
    static String buildExpression(SearchCriterion criterion) {
        String base = "profile." + criterion.attribute() + " " + criterion.operator().filterToken();
        if (criterion.operator() == SearchOperator.PRESENT) {
            return base;
        }
        String escaped = criterion.value().replace("\\", "\\\\").replace("\"", "\\\"");
        return base + " \"" + escaped + "\"";
    }

    private List<EntityRecord> tryNativeFilter(SearchCriterion criterion, List<String> notes) {
        String expression = buildExpression(criterion);
        try {
            return directory.listFiltered(expression, criterion.limit());
        } catch (CapabilityUnsupportedException e) {
            log.warn("Native filter rejected operator {} for attribute {}, demoting",
                criterion.operator().filterToken(), criterion.attribute());
            notes.add("Native filter does not support operator '" + criterion.operator().filterToken()
                + "'; falling back.");
        } catch (RuntimeException e) {
            log.warn("Native filter failed for attribute {}, demoting: {}", criterion.attribute(), e.getMessage());
            notes.add("Native filter failed (" + describe(e) + "); falling back.");
        }
        return null;
    }

    private List<EntityRecord> tryFreeText(SearchCriterion criterion, List<String> notes) {
        try {
            return directory.listFreeText(criterion.value(), criterion.limit());
        } catch (RuntimeException e) {
            log.warn("Free-text search failed for attribute {}, demoting: {}", criterion.attribute(), e.getMessage());
            notes.add("Free-text search failed (" + describe(e) + "); falling back.");
            return null;
        }
    }

    private SearchResult verify(SearchCriterion criterion, SearchTier tier, List<EntityRecord> candidates, List<String> notes) {
        List<EntityRecord> matches = new ArrayList<>();
        int examined = 0;
        int unverifiable = 0;

        for (EntityRecord candidate : candidates) {
            if (matches.size() >= criterion.limit()) {
                break;
            }
            examined++;

            EntityRecord record = candidate;
            if (!tier.trustsAttributeMatch()) {
                try {
                    record = directory.get(EntityKind.USER, candidate.id());
                } catch (RuntimeException e) {
                    unverifiable++;
                    log.warn("Skipping unverifiable candidate {}: {}", candidate.id(), e.getMessage());
                    continue;
                }
                if (!criterion.matches(record.attribute(criterion.attribute()).orElse(null))) {
                    continue;
                }
            }
            if (!criterion.includeInactive() && record.status().isInactive()) {
                continue;
            }
            matches.add(record);
        }

        if (unverifiable > 0) {
            notes.add(unverifiable + " candidate(s) could not be verified and were skipped.");
        }
        log.info("Search on {} served by {}: {} match(es) from {} candidate(s)",
            criterion.attribute(), tier, matches.size(), examined);

        return new SearchResult(
            criterion,
            matches,
            tier,
            notes,
            examined,
            unverifiable,
            tier == SearchTier.CLIENT_SIDE_SCAN ? config.scanCap() : 0,
            PiiMasker.maskIfPii(criterion.attribute(), criterion.value())
        );
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
