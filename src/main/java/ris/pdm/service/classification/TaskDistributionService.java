package ris.pdm.service.classification;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ris.pdm.external.dto.WorkItem;
import ris.pdm.external.dto.WorkItemQuery;
import ris.pdm.global.cache.CacheBackedFetcher;
import ris.pdm.global.cache.CacheNamespace;
import ris.pdm.service.classification.dto.BugClassificationSummary;
import ris.pdm.service.classification.dto.BugSummary;
import ris.pdm.service.classification.dto.BugTypeDistribution;
import ris.pdm.service.classification.dto.CategoryStats;
import ris.pdm.service.classification.dto.ClassificationFilters;
import ris.pdm.service.classification.dto.EnvironmentBugs;
import ris.pdm.service.classification.dto.TaskDistribution;
import ris.pdm.service.classification.dto.TaskDistributionQuery;
import ris.pdm.service.iteration.IterationResolver;
import ris.pdm.service.workitem.WorkItemService;

/**
 * 작업 분포 / 버그 유형 분포 계산
 *
 * <p>조회는 {@link WorkItemService}(캐시 + 배치 + 호출 한도)에 위임하고, 집계는 순수 함수로 분리되어 있습니다. 결과는
 * {@code metrics} 네임스페이스에 캐시됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskDistributionService {

    private static final Set<String> TASK_TYPES =
            Set.of("Task", "User Story", "Feature", "Epic", "Product Backlog Item", "Development Task");
    private static final Set<String> BUG_TYPES = Set.of("Bug", "Issue", "Defect");
    private static final Set<String> DESIGN_TYPES = Set.of("Design", "Design Task", "Documentation", "Document");
    private static final List<String> CATEGORIES = List.of("tasks", "bugs", "design", "others");
    private static final List<String> DISTRIBUTION_STATES = List.of("Active", "New", "Committed", "Done", "Closed");

    private final WorkItemService workItemService;
    private final IterationResolver iterationResolver;
    private final CacheBackedFetcher fetcher;

    /** 프로젝트 버그 유형 분포 (필터 적용) */
    public BugTypeDistribution getBugTypeDistribution(String project, ClassificationFilters filters) {
        return fetcher.fetchWithCache(
                CacheNamespace.METRICS,
                "bugTypeDistribution:" + project,
                filters.toCacheParams(),
                BugTypeDistribution.class,
                () -> {
                    List<WorkItem> bugs = workItemService.findWorkItems(project, bugQuery(project, filters));
                    return summarizeBugs(project, filterByEnvironment(bugs, filters.environment()));
                });
    }

    /** 작업 유형 분포 + 버그 분류 요약 */
    public TaskDistribution calculateTaskDistribution(TaskDistributionQuery query) {
        String project = query.projectName();
        return fetcher.fetchWithCache(
                CacheNamespace.METRICS,
                "distribution:" + project,
                query.toCacheParams(),
                TaskDistribution.class,
                () -> {
                    WorkItemQuery workItemQuery =
                            WorkItemQuery.builder()
                                    .states(DISTRIBUTION_STATES)
                                    .iterationPath(iterationResolver.resolvePath(project, query.iterationPath(), null))
                                    .maxResults(2000)
                                    .build();
                    return distribute(project, workItemService.findWorkItems(project, workItemQuery));
                });
    }

    /** 환경 필터를 WIQL이 아닌 결과 단계에서 적용하기 위한 버그 조회 조건 */
    public WorkItemQuery bugQuery(String project, ClassificationFilters filters) {
        return WorkItemQuery.bugs().toBuilder()
                .severity(filters.severity())
                .createdFrom(filters.startDate())
                .createdTo(filters.endDate())
                .iterationPath(iterationResolver.resolvePath(project, filters.iterationPath(), null))
                .build();
    }

    // ==================== 순수 집계 ====================

    static List<WorkItem> filterByEnvironment(List<WorkItem> bugs, String environment) {
        if (environment == null || environment.isBlank()) {
            return bugs;
        }
        BugEnvironment target = BugEnvironment.fromLabel(environment).orElse(BugEnvironment.OTHER);
        return bugs.stream().filter(bug -> BugEnvironment.fromBugType(bug.bugType()) == target).toList();
    }

    /** 버그 목록 → 유형/환경 분포 */
    static BugTypeDistribution summarizeBugs(String projectId, List<WorkItem> bugs) {
        long total = bugs.size();
        long unclassified = bugs.stream().filter(bug -> !bug.hasBugType()).count();
        long classified = ClassificationMath.classified(total, unclassified);

        Map<String, Long> bugTypes = new LinkedHashMap<>();
        for (WorkItem bug : bugs) {
            if (bug.hasBugType()) {
                bugTypes.merge(BugTypeCatalog.classify(bug.bugType()), 1L, Long::sum);
            }
        }

        Map<BugEnvironment, List<WorkItem>> byEnvironment = groupByEnvironment(bugs);
        Map<String, Long> environments = new LinkedHashMap<>();
        byEnvironment.forEach((env, items) -> environments.put(env.getLabel(), (long) items.size()));

        return new BugTypeDistribution(
                projectId,
                total,
                classified,
                unclassified,
                ClassificationMath.percentage(classified, total),
                bugTypes,
                environments,
                environmentBreakdown(byEnvironment, total));
    }

    /** 작업 항목 → 유형 분포 + 버그 분류 요약 */
    static TaskDistribution distribute(String projectName, List<WorkItem> items) {
        long total = items.size();
        Map<String, Long> counts = new LinkedHashMap<>();
        Map<String, Double> points = new LinkedHashMap<>();
        for (WorkItem item : items) {
            String category = category(item.type());
            counts.merge(category, 1L, Long::sum);
            points.merge(category, item.storyPoints(), Double::sum);
        }

        Map<String, CategoryStats> distribution = new LinkedHashMap<>();
        for (String category : CATEGORIES) {
            long count = counts.getOrDefault(category, 0L);
            distribution.put(
                    category,
                    new CategoryStats(
                            count, ClassificationMath.percentage(count, total), points.getOrDefault(category, 0.0)));
        }

        List<WorkItem> bugs = items.stream().filter(item -> BUG_TYPES.contains(item.type())).toList();
        return new TaskDistribution(projectName, total, distribution, breakdown(bugs));
    }

    /** 버그 분류 요약 (작업 분포용) */
    static BugClassificationSummary breakdown(List<WorkItem> bugs) {
        long total = bugs.size();
        Map<BugEnvironment, List<WorkItem>> byEnvironment = groupByEnvironment(bugs);
        long unclassified = byEnvironment.getOrDefault(BugEnvironment.UNCLASSIFIED, List.of()).size();

        Map<String, Long> classificationBreakdown = new LinkedHashMap<>();
        for (WorkItem bug : bugs) {
            classificationBreakdown.merge(BugTypeCatalog.classify(bug.bugType()), 1L, Long::sum);
        }

        return new BugClassificationSummary(
                total,
                unclassified,
                ClassificationMath.percentage(ClassificationMath.classified(total, unclassified), total),
                classificationBreakdown,
                environmentBreakdown(byEnvironment, total));
    }

    private static Map<BugEnvironment, List<WorkItem>> groupByEnvironment(List<WorkItem> bugs) {
        Map<BugEnvironment, List<WorkItem>> grouped = new EnumMap<>(BugEnvironment.class);
        for (BugEnvironment env : BugEnvironment.values()) {
            grouped.put(env, new ArrayList<>());
        }
        for (WorkItem bug : bugs) {
            grouped.get(BugEnvironment.fromBugType(bug.bugType())).add(bug);
        }
        return grouped;
    }

    private static Map<String, EnvironmentBugs> environmentBreakdown(
            Map<BugEnvironment, List<WorkItem>> byEnvironment, long total) {
        Map<String, EnvironmentBugs> breakdown = new LinkedHashMap<>();
        byEnvironment.forEach(
                (env, items) ->
                        breakdown.put(
                                env.getLabel(),
                                new EnvironmentBugs(
                                        items.size(),
                                        ClassificationMath.percentage(items.size(), total),
                                        items.stream().map(BugSummary::from).toList())));
        return breakdown;
    }

    private static String category(String type) {
        if (type == null) {
            return "others";
        }
        if (TASK_TYPES.contains(type)) {
            return "tasks";
        }
        if (BUG_TYPES.contains(type)) {
            return "bugs";
        }
        if (DESIGN_TYPES.contains(type)) {
            return "design";
        }
        return "others";
    }
}
