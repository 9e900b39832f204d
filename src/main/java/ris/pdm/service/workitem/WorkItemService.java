package ris.pdm.service.workitem;

import com.fasterxml.jackson.core.type.TypeReference;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ris.pdm.config.TrackerApiProperties;
import ris.pdm.external.BatchCoordinator;
import ris.pdm.external.RateLimitedClient;
import ris.pdm.external.TrackerSource;
import ris.pdm.external.dto.Team;
import ris.pdm.external.dto.TeamMember;
import ris.pdm.external.dto.WorkItem;
import ris.pdm.external.dto.WorkItemQuery;
import ris.pdm.external.dto.WorkItemReference;
import ris.pdm.global.cache.CacheBackedFetcher;
import ris.pdm.global.cache.CacheNamespace;
import ris.pdm.global.executor.TaskContext;
import ris.pdm.service.classification.BugEnvironment;

/**
 * 작업 항목 조회 서비스
 *
 * <ul>
 *   <li>WIQL 조회: {@code workItems} 네임스페이스 (5분)
 *   <li>상세 조회: ID 정렬 후 배치 분할, {@code workItemDetails} 네임스페이스 (15분)
 *   <li>팀 멤버: {@code teamMembers} 네임스페이스 (30분)
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkItemService {

    private static final TypeReference<List<WorkItemReference>> REFERENCE_LIST = new TypeReference<>() {};
    private static final TypeReference<List<WorkItem>> WORK_ITEM_LIST = new TypeReference<>() {};
    private static final TypeReference<List<TeamMember>> MEMBER_LIST = new TypeReference<>() {};

    private final TrackerSource trackerSource;
    private final RateLimitedClient client;
    private final BatchCoordinator batchCoordinator;
    private final CacheBackedFetcher fetcher;
    private final TrackerApiProperties properties;

    public List<WorkItemReference> queryWorkItems(String project, WorkItemQuery query) {
        return fetcher.fetchWithCache(
                CacheNamespace.WORK_ITEMS,
                "query:" + project,
                query.toCacheParams(),
                REFERENCE_LIST,
                () ->
                        client.call(
                                TaskContext.of("Tracker", "wiql", project),
                                () -> trackerSource.queryWorkItems(project, query)));
    }

    /**
     * ID 목록의 상세 정보 (ID 오름차순)
     */
    public List<WorkItem> getWorkItemDetails(String project, List<Integer> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<Integer> sorted = ids.stream().distinct().sorted().toList();
        TrackerApiProperties.Batch batch = properties.getBatch();
        return fetcher.fetchWithCache(
                CacheNamespace.WORK_ITEM_DETAILS,
                "details:" + project,
                Map.of("ids", sorted),
                WORK_ITEM_LIST,
                () ->
                        batchCoordinator.runBatched(
                                sorted,
                                batch.getMaxBatchSize(),
                                batch.getDelay(),
                                chunk -> trackerSource.getWorkItemDetails(project, chunk)));
    }

    /** WIQL 조회 + 상세 조회 */
    public List<WorkItem> findWorkItems(String project, WorkItemQuery query) {
        List<Integer> ids = queryWorkItems(project, query).stream().map(WorkItemReference::id).toList();
        return getWorkItemDetails(project, ids);
    }

    /**
     * 특정 환경으로 분류되는 버그 목록
     *
     * @param environment 환경 라벨 (예: {@code Prod})
     */
    public List<WorkItem> getBugsByEnvironment(String project, String environment, WorkItemQuery bugQuery) {
        BugEnvironment target =
                BugEnvironment.fromLabel(environment).orElse(BugEnvironment.OTHER);
        List<WorkItem> bugs = findWorkItems(project, bugQuery).stream().filter(WorkItem::isBug).toList();
        return bugs.stream().filter(bug -> BugEnvironment.fromBugType(bug.bugType()) == target).toList();
    }

    /** 프로젝트 전체 팀의 멤버 (uniqueName 기준 중복 제거) */
    public List<TeamMember> getTeamMembers(String project) {
        return fetcher.fetchWithCache(
                CacheNamespace.TEAM_MEMBERS,
                "members:" + project,
                Map.of(),
                MEMBER_LIST,
                () -> loadTeamMembers(project));
    }

    private List<TeamMember> loadTeamMembers(String project) {
        List<Team> teams =
                client.call(TaskContext.of("Tracker", "teams", project), () -> trackerSource.getTeams(project));
        Map<String, TeamMember> unique = new LinkedHashMap<>();
        for (Team team : teams) {
            List<TeamMember> members =
                    client.call(
                            TaskContext.of("Tracker", "teamMembers", project + "/" + team.name()),
                            () -> trackerSource.getTeamMembers(project, team.id()));
            for (TeamMember member : members) {
                String key = member.uniqueName() != null ? member.uniqueName() : member.id();
                unique.putIfAbsent(key, member);
            }
        }
        log.info("[WorkItemService] 팀 멤버 조회: project={}, teams={}, members={}", project, teams.size(), unique.size());
        return List.copyOf(unique.values());
    }
}
