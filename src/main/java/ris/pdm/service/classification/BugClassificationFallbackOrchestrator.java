package ris.pdm.service.classification;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ris.pdm.external.dto.WorkItemQuery;
import ris.pdm.global.cache.CacheBackedFetcher;
import ris.pdm.global.cache.CacheNamespace;
import ris.pdm.global.error.exception.InternalSystemException;
import ris.pdm.global.executor.LogicExecutor;
import ris.pdm.global.executor.TaskContext;
import ris.pdm.service.classification.dto.BugClassificationPayload;
import ris.pdm.service.classification.dto.BugClassificationPayload.DateRange;
import ris.pdm.service.classification.dto.BugClassificationPayload.FilterInfo;
import ris.pdm.service.classification.dto.BugClassificationPayload.Insights;
import ris.pdm.service.classification.dto.BugClassificationPayload.Metadata;
import ris.pdm.service.classification.dto.BugClassificationSummary;
import ris.pdm.service.classification.dto.BugSummary;
import ris.pdm.service.classification.dto.BugTypeDistribution;
import ris.pdm.service.classification.dto.ClassificationFilters;
import ris.pdm.service.classification.dto.EnvironmentBugs;
import ris.pdm.service.classification.dto.TaskDistribution;
import ris.pdm.service.classification.dto.TaskDistributionQuery;
import ris.pdm.service.project.ProjectMapper;
import ris.pdm.service.workitem.WorkItemService;

/**
 * 버그 분류 3단계 Fallback
 *
 * <pre>
 * PRIMARY      버그 유형 분포 + 환경별 버그 목록 (실시간)
 *    │ 예외
 *    ▼
 * FALLBACK     current 이터레이션 작업 분포의 버그 요약 (버그 목록 없음)
 *    │ 예외
 *    ▼
 * LAST_RESORT  0으로 채운 고정 형태 (실패하지 않음)
 * </pre>
 *
 * <p>각 tier는 최대 1회 실행되며 어떤 예외도 호출자에게 전파되지 않습니다. 세 tier 모두 같은 {@link
 * BugClassificationPayload} 형태를 반환합니다. PRIMARY 결과만 {@code bugClassification} 네임스페이스에 캐시됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BugClassificationFallbackOrchestrator {

    private static final String COMPONENT = "BugClassification";
    private static final String FALLBACK_ITERATION = "current";
    private static final double HEALTHY_RATE = 80.0;
    private static final int TOP_SOURCES = 5;

    private final TaskDistributionService taskDistributionService;
    private final WorkItemService workItemService;
    private final ProjectMapper projectMapper;
    private final CacheBackedFetcher fetcher;
    private final LogicExecutor executor;
    private final FallbackTierMetrics metrics;

    public FallbackResult<BugClassificationPayload> classifyWithFallback(
            String projectId, ClassificationFilters filters) {
        ClassificationFilters effective = normalize(filters);
        String project = projectMapper.toTrackerProject(projectId);

        return executor.executeOrCatch(
                () -> primary(projectId, project, effective),
                primaryError ->
                        executor.executeOrCatch(
                                () -> fallback(projectId, project, effective, primaryError),
                                fallbackError -> lastResort(projectId, project, effective, fallbackError),
                                TaskContext.of(COMPONENT, "fallback", projectId)),
                TaskContext.of(COMPONENT, "primary", projectId));
    }

    // ==================== Tier 1: PRIMARY ====================

    private FallbackResult<BugClassificationPayload> primary(
            String projectId, String project, ClassificationFilters filters) {
        BugClassificationPayload payload =
                fetcher.fetchWithCache(
                        CacheNamespace.BUG_CLASSIFICATION,
                        projectId,
                        filters.toCacheParams(),
                        BugClassificationPayload.class,
                        () -> buildPrimary(projectId, project, filters));
        metrics.record(FallbackTier.PRIMARY);
        return FallbackResult.of(FallbackTier.PRIMARY, payload);
    }

    private BugClassificationPayload buildPrimary(
            String projectId, String project, ClassificationFilters filters) {
        BugTypeDistribution distribution = taskDistributionService.getBugTypeDistribution(project, filters);
        WorkItemQuery bugQuery = taskDistributionService.bugQuery(project, filters);

        Map<String, EnvironmentBugs> byEnvironment = emptyEnvironments(filters);
        for (String env : requestedEnvironments(filters)) {
            byEnvironment.put(env, environmentBugs(project, env, bugQuery, distribution.totalBugs()));
        }
        return payload(projectId, project, filters, distribution, byEnvironment);
    }

    private List<String> requestedEnvironments(ClassificationFilters filters) {
        if (filters.environment() != null) {
            return List.of(filters.environment());
        }
        return BugEnvironment.FIXED.stream().map(BugEnvironment::getLabel).toList();
    }

    /** 환경 하나의 실패는 빈 항목으로 대체 */
    private EnvironmentBugs environmentBugs(String project, String env, WorkItemQuery bugQuery, long totalBugs) {
        return executor.executeOrDefault(
                () -> {
                    List<BugSummary> bugs =
                            workItemService.getBugsByEnvironment(project, env, bugQuery).stream()
                                    .map(BugSummary::from)
                                    .toList();
                    return new EnvironmentBugs(bugs.size(), ClassificationMath.percentage(bugs.size(), totalBugs), bugs);
                },
                EnvironmentBugs.empty(),
                TaskContext.of(COMPONENT, "environmentBugs", env));
    }

    // ==================== Tier 2: FALLBACK ====================

    private FallbackResult<BugClassificationPayload> fallback(
            String projectId, String project, ClassificationFilters filters, Throwable primaryError) {
        log.warn("[BugClassification] primary 실패, fallback 전환: projectId={}, cause={}", projectId, primaryError.toString());

        TaskDistribution distribution =
                taskDistributionService.calculateTaskDistribution(new TaskDistributionQuery(project, FALLBACK_ITERATION));
        BugClassificationSummary summary = distribution == null ? null : distribution.bugClassification();
        if (summary == null) {
            throw new InternalSystemException(COMPONENT + ":fallback:missing-bug-classification");
        }

        long total = ClassificationMath.clampCount(summary.totalBugs());
        long unclassified = Math.min(ClassificationMath.clampCount(summary.unclassified()), total);
        long classified = ClassificationMath.classified(total, unclassified);
        double rate =
                summary.classificationRate() != null
                        ? ClassificationMath.roundRate(summary.classificationRate())
                        : ClassificationMath.percentage(classified, total);

        Map<String, EnvironmentBugs> byEnvironment = emptyEnvironments(filters);
        Map<String, Long> environments = new LinkedHashMap<>();
        summary.environmentBreakdown().forEach(
                (env, stats) -> {
                    long count = ClassificationMath.clampCount(stats.count());
                    environments.put(env, count);
                    String key = BugEnvironment.fromLabel(env).map(BugEnvironment::getLabel).orElse(env);
                    if (byEnvironment.containsKey(key)) {
                        byEnvironment.put(key, new EnvironmentBugs(count, ClassificationMath.roundRate(stats.percentage()), List.of()));
                    }
                });

        BugTypeDistribution bugTypes =
                new BugTypeDistribution(
                        projectId,
                        total,
                        classified,
                        unclassified,
                        rate,
                        new LinkedHashMap<>(summary.classificationBreakdown()),
                        environments,
                        Map.of());

        metrics.record(FallbackTier.FALLBACK);
        return FallbackResult.of(FallbackTier.FALLBACK, payload(projectId, project, filters, bugTypes, byEnvironment));
    }

    // ==================== Tier 3: LAST_RESORT ====================

    private FallbackResult<BugClassificationPayload> lastResort(
            String projectId, String project, ClassificationFilters filters, Throwable fallbackError) {
        log.warn("[BugClassification] fallback 실패, 기본 응답 반환: projectId={}, cause={}", projectId, fallbackError.toString());
        BugTypeDistribution empty = new BugTypeDistribution(projectId, 0, 0, 0, 0.0, Map.of(), Map.of(), Map.of());
        metrics.record(FallbackTier.LAST_RESORT);
        return FallbackResult.of(
                FallbackTier.LAST_RESORT, payload(projectId, project, filters, empty, emptyEnvironments(filters)));
    }

    // ==================== Payload ====================

    /** 환경 필터를 라벨로 정규화. 알 수 없는 값은 {@code Other}, 빈 값은 필터 없음 */
    static ClassificationFilters normalize(ClassificationFilters filters) {
        if (filters == null) {
            return ClassificationFilters.none();
        }
        String environment = filters.environment();
        String label =
                environment == null || environment.isBlank()
                        ? null
                        : BugEnvironment.fromLabel(environment.trim()).orElse(BugEnvironment.OTHER).getLabel();
        return new ClassificationFilters(
                label, filters.severity(), filters.startDate(), filters.endDate(), filters.iterationPath());
    }

    /** 모든 tier가 공유하는 환경 키: 고정 4개 + 요청 환경 */
    static List<String> environmentKeys(ClassificationFilters filters) {
        List<String> keys = new ArrayList<>(BugEnvironment.FIXED.stream().map(BugEnvironment::getLabel).toList());
        if (filters.environment() != null && !keys.contains(filters.environment())) {
            keys.add(filters.environment());
        }
        return keys;
    }

    private static Map<String, EnvironmentBugs> emptyEnvironments(ClassificationFilters filters) {
        Map<String, EnvironmentBugs> map = new LinkedHashMap<>();
        for (String key : environmentKeys(filters)) {
            map.put(key, EnvironmentBugs.empty());
        }
        return map;
    }

    static BugClassificationPayload payload(
            String projectId,
            String project,
            ClassificationFilters filters,
            BugTypeDistribution distribution,
            Map<String, EnvironmentBugs> byEnvironment) {
        double rate = distribution.classificationRate();
        List<String> topSources =
                distribution.bugTypes().entrySet().stream()
                        .sorted(
                                Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                                        .thenComparing(Map.Entry.comparingByKey()))
                        .limit(TOP_SOURCES)
                        .map(Map.Entry::getKey)
                        .toList();
        List<String> recommendations =
                rate < HEALTHY_RATE
                        ? List.of("Improve bug classification rate by training team on custom field usage")
                        : List.of("Bug classification is healthy");

        DateRange dateRange =
                new DateRange(
                        filters.startDate() == null ? null : filters.startDate().toString(),
                        filters.endDate() == null ? null : filters.endDate().toString());

        return new BugClassificationPayload(
                distribution,
                byEnvironment,
                new Insights(topSources, recommendations),
                new FilterInfo(BugEnvironment.AVAILABLE, dateRange, project),
                new Metadata(projectId, project, distribution.totalBugs(), rate));
    }
}
