package ris.pdm.service.classification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static ris.pdm.support.WorkItemFixtures.bug;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import ris.pdm.config.CacheProperties;
import ris.pdm.config.ProjectMappingProperties;
import ris.pdm.external.dto.WorkItemQuery;
import ris.pdm.global.cache.CacheBackedFetcher;
import ris.pdm.global.cache.CacheKeyGenerator;
import ris.pdm.global.cache.CacheStore;
import ris.pdm.global.cache.LocalCacheBackend;
import ris.pdm.global.error.exception.BatchExecutionException;
import ris.pdm.global.error.exception.UpstreamUnavailableException;
import ris.pdm.global.executor.DefaultLogicExecutor;
import ris.pdm.global.executor.LogicExecutor;
import ris.pdm.service.classification.dto.BugClassificationPayload;
import ris.pdm.service.classification.dto.BugClassificationSummary;
import ris.pdm.service.classification.dto.BugTypeDistribution;
import ris.pdm.service.classification.dto.ClassificationFilters;
import ris.pdm.service.classification.dto.EnvironmentBugs;
import ris.pdm.service.classification.dto.TaskDistribution;
import ris.pdm.service.classification.dto.TaskDistributionQuery;
import ris.pdm.service.project.ProjectMapper;
import ris.pdm.service.workitem.WorkItemService;

/**
 * 버그 분류 3단계 Fallback 테스트
 *
 * <h4>테스트 범위</h4>
 *
 * <ul>
 *   <li>PRIMARY: 분포 + 환경별 버그 목록, 결과 캐시
 *   <li>FALLBACK: 작업 분포 요약에서 파생 (버그 목록 없음)
 *   <li>LAST_RESORT: 0으로 채운 고정 형태
 *   <li>어떤 tier에서도 예외가 호출자에게 전파되지 않음
 * </ul>
 */
@Tag("unit")
class BugClassificationFallbackOrchestratorTest {

    private static final String PROJECT_ID = "Team - Engineering";
    private static final String PROJECT = "Product - Partner Management Platform";
    private static final WorkItemQuery BUG_QUERY = WorkItemQuery.bugs();

    private TaskDistributionService taskDistributionService;
    private WorkItemService workItemService;
    private FallbackTierMetrics metrics;
    private BugClassificationFallbackOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        taskDistributionService = mock(TaskDistributionService.class);
        workItemService = mock(WorkItemService.class);

        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        metrics = new FallbackTierMetrics(meterRegistry);
        metrics.init();

        LogicExecutor executor = new DefaultLogicExecutor(meterRegistry);
        CacheStore store =
                new CacheStore(null, new LocalCacheBackend(1_000), new ObjectMapper().findAndRegisterModules(), executor, meterRegistry, 300);
        CacheBackedFetcher fetcher =
                new CacheBackedFetcher(store, new CacheKeyGenerator(new CacheProperties(), executor), executor);

        orchestrator =
                new BugClassificationFallbackOrchestrator(
                        taskDistributionService,
                        workItemService,
                        new ProjectMapper(new ProjectMappingProperties()),
                        fetcher,
                        executor,
                        metrics);

        given(taskDistributionService.bugQuery(eq(PROJECT), any())).willReturn(BUG_QUERY);
    }

    private static BugTypeDistribution primaryDistribution() {
        return new BugTypeDistribution(
                PROJECT, 4, 3, 1, 75.0,
                Map.of("production", 2L, "deployment", 1L),
                Map.of("Prod", 2L, "Deploy", 1L, "Unclassified", 1L),
                Map.of());
    }

    private void givenPrimaryAvailable() {
        given(taskDistributionService.getBugTypeDistribution(eq(PROJECT), any())).willReturn(primaryDistribution());
        given(workItemService.getBugsByEnvironment(PROJECT, "Prod", BUG_QUERY))
                .willReturn(List.of(bug(1, "PROD Issues"), bug(2, "PROD Issues")));
        given(workItemService.getBugsByEnvironment(PROJECT, "Deploy", BUG_QUERY)).willReturn(List.of(bug(3, "Deploy Bug")));
    }

    private void givenPrimaryDown() {
        given(taskDistributionService.getBugTypeDistribution(eq(PROJECT), any()))
                .willThrow(new UpstreamUnavailableException("wiql", "HTTP 503"));
    }

    private static TaskDistribution distributionWithSummary(Double rate) {
        Map<String, EnvironmentBugs> breakdown = new LinkedHashMap<>();
        breakdown.put("Prod", new EnvironmentBugs(4, 66.7, List.of()));
        breakdown.put("SIT", new EnvironmentBugs(1, 16.7, List.of()));
        breakdown.put("Unclassified", new EnvironmentBugs(1, 16.7, List.of()));
        return new TaskDistribution(
                PROJECT, 20, Map.of(),
                new BugClassificationSummary(6, 1, rate, Map.of("production", 4L, "system_integration_test", 1L), breakdown));
    }

    @Nested
    @DisplayName("PRIMARY tier")
    class PrimaryTest {

        @Test
        @DisplayName("분포와 환경별 버그 목록을 반환, 고정 환경 키는 항상 존재")
        void shouldReturnPrimaryPayload() {
            givenPrimaryAvailable();

            FallbackResult<BugClassificationPayload> result = orchestrator.classifyWithFallback(PROJECT_ID, null);

            assertThat(result.tier()).isEqualTo(FallbackTier.PRIMARY);
            assertThat(result.degraded()).isFalse();
            BugClassificationPayload payload = result.payload();
            assertThat(payload.bugsByEnvironment()).containsKeys("Deploy", "Prod", "SIT", "UAT");
            assertThat(payload.bugsByEnvironment().get("Prod").count()).isEqualTo(2);
            assertThat(payload.bugsByEnvironment().get("Prod").percentage()).isEqualTo(50.0);
            assertThat(payload.bugsByEnvironment().get("SIT").count()).isZero();
            assertThat(payload.insights().topBugSources()).containsExactly("production", "deployment");
            assertThat(payload.insights().recommendations()).singleElement().asString().contains("Improve");
            assertThat(payload.filters().projectName()).isEqualTo(PROJECT);
            assertThat(payload.metadata().projectId()).isEqualTo(PROJECT_ID);
        }

        @Test
        @DisplayName("환경 하나의 조회 실패는 빈 항목으로 대체하고 PRIMARY 유지")
        void shouldTolerateSingleEnvironmentFailure() {
            givenPrimaryAvailable();
            given(workItemService.getBugsByEnvironment(PROJECT, "UAT", BUG_QUERY))
                    .willThrow(new BatchExecutionException(0, 1, 100, new IllegalStateException("timeout")));

            FallbackResult<BugClassificationPayload> result = orchestrator.classifyWithFallback(PROJECT_ID, null);

            assertThat(result.tier()).isEqualTo(FallbackTier.PRIMARY);
            assertThat(result.payload().bugsByEnvironment().get("UAT")).isEqualTo(EnvironmentBugs.empty());
        }

        @Test
        @DisplayName("환경 필터가 있으면 해당 환경만 조회")
        void shouldQueryRequestedEnvironmentOnly() {
            givenPrimaryAvailable();
            ClassificationFilters filters = new ClassificationFilters("Prod", null, null, null, null);

            orchestrator.classifyWithFallback(PROJECT_ID, filters);

            verify(workItemService, times(1)).getBugsByEnvironment(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("같은 입력의 반복 호출은 같은 결과, 두 번째는 캐시에서 반환")
        void shouldBeIdempotent() {
            givenPrimaryAvailable();

            FallbackResult<BugClassificationPayload> first = orchestrator.classifyWithFallback(PROJECT_ID, null);
            FallbackResult<BugClassificationPayload> second = orchestrator.classifyWithFallback(PROJECT_ID, null);

            assertThat(second).isEqualTo(first);
            verify(taskDistributionService, times(1)).getBugTypeDistribution(eq(PROJECT), any());
            assertThat(metrics.count(FallbackTier.PRIMARY)).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("FALLBACK tier")
    class FallbackTest {

        @Test
        @DisplayName("primary 실패 시 current 작업 분포 요약에서 분류 수치를 파생")
        void shouldDeriveFromTaskDistribution() {
            givenPrimaryDown();
            given(taskDistributionService.calculateTaskDistribution(new TaskDistributionQuery(PROJECT, "current")))
                    .willReturn(distributionWithSummary(null));

            FallbackResult<BugClassificationPayload> result = orchestrator.classifyWithFallback(PROJECT_ID, null);

            assertThat(result.tier()).isEqualTo(FallbackTier.FALLBACK);
            assertThat(result.degraded()).isTrue();
            BugTypeDistribution bugTypes = result.payload().bugTypes();
            assertThat(bugTypes.totalBugs()).isEqualTo(6);
            assertThat(bugTypes.classified()).isEqualTo(5);
            assertThat(bugTypes.classificationRate()).isEqualTo(83.3);
            assertThat(result.payload().bugsByEnvironment()).containsKeys("Deploy", "Prod", "SIT", "UAT");
            assertThat(result.payload().bugsByEnvironment().get("Prod").count()).isEqualTo(4);
            assertThat(result.payload().bugsByEnvironment().get("Prod").bugs()).isEmpty();
            assertThat(metrics.count(FallbackTier.FALLBACK)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("요약에 분류율이 있으면 그대로 사용")
        void shouldKeepProvidedRate() {
            givenPrimaryDown();
            given(taskDistributionService.calculateTaskDistribution(any())).willReturn(distributionWithSummary(90.04));

            FallbackResult<BugClassificationPayload> result = orchestrator.classifyWithFallback(PROJECT_ID, null);

            assertThat(result.payload().metadata().classificationRate()).isEqualTo(90.0);
            assertThat(result.payload().insights().recommendations()).containsExactly("Bug classification is healthy");
        }
    }

    @Nested
    @DisplayName("LAST_RESORT tier")
    class LastResortTest {

        @Test
        @DisplayName("두 tier 모두 실패하면 0으로 채운 고정 형태, 예외는 전파되지 않음")
        void shouldReturnZeroedPayload() {
            givenPrimaryDown();
            given(taskDistributionService.calculateTaskDistribution(any()))
                    .willThrow(new UpstreamUnavailableException("wiql", "connection refused"));

            FallbackResult<BugClassificationPayload> result = orchestrator.classifyWithFallback(PROJECT_ID, null);

            assertThat(result.tier()).isEqualTo(FallbackTier.LAST_RESORT);
            assertThat(result.degraded()).isTrue();
            BugClassificationPayload payload = result.payload();
            assertThat(payload.bugTypes().totalBugs()).isZero();
            assertThat(payload.bugTypes().classificationRate()).isZero();
            assertThat(payload.bugsByEnvironment())
                    .containsOnlyKeys("Deploy", "Prod", "SIT", "UAT")
                    .allSatisfy((env, bugs) -> assertThat(bugs).isEqualTo(EnvironmentBugs.empty()));
            assertThat(payload.filters().availableEnvironments()).containsExactly("Deploy", "Prod", "SIT", "UAT", "Other");
            assertThat(metrics.count(FallbackTier.LAST_RESORT)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("fallback 요약이 비어 있으면 LAST_RESORT")
        void shouldTreatMissingSummaryAsFailure() {
            givenPrimaryDown();
            given(taskDistributionService.calculateTaskDistribution(any()))
                    .willReturn(new TaskDistribution(PROJECT, 0, Map.of(), null));

            assertThat(orchestrator.classifyWithFallback(PROJECT_ID, null).tier()).isEqualTo(FallbackTier.LAST_RESORT);
        }
    }

    @Nested
    @DisplayName("환경 키 구성")
    class EnvironmentKeyTest {

        private final ClassificationFilters otherOnly = new ClassificationFilters("Other", null, null, null, null);
        private final List<String> expectedKeys = List.of("Deploy", "Prod", "SIT", "UAT", "Other");

        @Test
        @DisplayName("PRIMARY: 고정 4개 + 요청 환경")
        void primaryShouldIncludeRequestedKey() {
            givenPrimaryAvailable();

            FallbackResult<BugClassificationPayload> result = orchestrator.classifyWithFallback(PROJECT_ID, otherOnly);

            assertThat(result.tier()).isEqualTo(FallbackTier.PRIMARY);
            assertThat(result.payload().bugsByEnvironment()).containsOnlyKeys(expectedKeys);
        }

        @Test
        @DisplayName("FALLBACK: 요약에 없는 요청 환경도 빈 항목으로 포함")
        void fallbackShouldIncludeRequestedKey() {
            givenPrimaryDown();
            given(taskDistributionService.calculateTaskDistribution(any())).willReturn(distributionWithSummary(null));

            FallbackResult<BugClassificationPayload> result = orchestrator.classifyWithFallback(PROJECT_ID, otherOnly);

            assertThat(result.tier()).isEqualTo(FallbackTier.FALLBACK);
            assertThat(result.payload().bugsByEnvironment()).containsOnlyKeys(expectedKeys);
            assertThat(result.payload().bugsByEnvironment().get("Other")).isEqualTo(EnvironmentBugs.empty());
        }

        @Test
        @DisplayName("LAST_RESORT: 요청 환경을 빈 항목으로 포함")
        void lastResortShouldIncludeRequestedKey() {
            givenPrimaryDown();
            given(taskDistributionService.calculateTaskDistribution(any()))
                    .willThrow(new UpstreamUnavailableException("wiql", "connection refused"));

            FallbackResult<BugClassificationPayload> result = orchestrator.classifyWithFallback(PROJECT_ID, otherOnly);

            assertThat(result.tier()).isEqualTo(FallbackTier.LAST_RESORT);
            assertThat(result.payload().bugsByEnvironment()).containsOnlyKeys(expectedKeys);
        }

        @Test
        @DisplayName("소문자 필터는 라벨로 정규화되어 중복 키가 생기지 않음")
        void shouldNormalizeFilterLabel() {
            givenPrimaryAvailable();

            FallbackResult<BugClassificationPayload> result =
                    orchestrator.classifyWithFallback(PROJECT_ID, new ClassificationFilters("prod", null, null, null, null));

            assertThat(result.payload().bugsByEnvironment()).containsOnlyKeys("Deploy", "Prod", "SIT", "UAT");
            assertThat(result.payload().bugsByEnvironment().get("Prod").count()).isEqualTo(2);
            verify(workItemService).getBugsByEnvironment(PROJECT, "Prod", BUG_QUERY);
        }

        @Test
        @DisplayName("알 수 없는 환경은 Other, 빈 값은 필터 없음")
        void shouldMapUnknownAndBlankEnvironment() {
            assertThat(BugClassificationFallbackOrchestrator.normalize(
                            new ClassificationFilters("Staging", null, null, null, null)).environment())
                    .isEqualTo("Other");
            assertThat(BugClassificationFallbackOrchestrator.normalize(
                            new ClassificationFilters(" ", null, null, null, null)).environment())
                    .isNull();
            assertThat(BugClassificationFallbackOrchestrator.environmentKeys(ClassificationFilters.none()))
                    .containsExactly("Deploy", "Prod", "SIT", "UAT");
        }
    }

    @Test
    @DisplayName("degraded 플래그는 tier와 불일치할 수 없음")
    void shouldRejectInconsistentResult() {
        assertThatThrownBy(
                        () -> new FallbackResult<>(FallbackTier.FALLBACK, "x", false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
