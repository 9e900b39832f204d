package ris.pdm.external.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import ris.pdm.external.TrackerSource;
import ris.pdm.external.dto.Iteration;
import ris.pdm.external.dto.Team;
import ris.pdm.external.dto.TeamMember;
import ris.pdm.external.dto.WorkItem;
import ris.pdm.external.dto.WorkItemQuery;
import ris.pdm.external.dto.WorkItemReference;

/**
 * 클래스패스 JSON 픽스처 기반 트래커 소스 (개발/데모용)
 *
 * <p>픽스처는 실제 REST 응답과 같은 형식이며 기동 시 한 번 로드됩니다.
 *
 * <pre>
 * fixtures/tracker/
 *   work-items.json     {"value": [작업 항목...]}            (System.TeamProject로 프로젝트 구분)
 *   teams.json          {"&lt;project&gt;": {"value": [팀...]}}
 *   iterations.json     {"&lt;project&gt;": {"&lt;team&gt;": {"value": [이터레이션...]}}}
 *   team-members.json   {"&lt;teamId&gt;": {"value": [멤버...]}}
 * </pre>
 *
 * <p>등록되지 않은 팀의 이터레이션 조회는 실제 API의 404처럼 예외를 던집니다.
 */
@Slf4j
public class StaticFixtureTrackerSource implements TrackerSource {

    private final List<FixtureItem> workItems;
    private final JsonNode teams;
    private final JsonNode iterations;
    private final JsonNode teamMembers;

    public StaticFixtureTrackerSource(ObjectMapper objectMapper, String fixturePath) {
        JsonNode rawItems = load(objectMapper, fixturePath, "work-items.json");
        this.workItems = new ArrayList<>();
        for (JsonNode node : rawItems.path("value")) {
            String project = node.path("fields").path("System.TeamProject").asText(null);
            workItems.add(new FixtureItem(project, TrackerResponseMapper.toWorkItem(node)));
        }
        this.teams = load(objectMapper, fixturePath, "teams.json");
        this.iterations = load(objectMapper, fixturePath, "iterations.json");
        this.teamMembers = load(objectMapper, fixturePath, "team-members.json");
        log.info("[FixtureTracker] 픽스처 로드 완료: path={}, workItems={}", fixturePath, workItems.size());
    }

    @Override
    public List<WorkItemReference> queryWorkItems(String project, WorkItemQuery query) {
        Predicate<WorkItem> filter = matches(query);
        return workItems.stream()
                .filter(f -> f.project() == null || f.project().equals(project))
                .map(FixtureItem::item)
                .filter(filter)
                .limit(query.maxResults())
                .map(item -> new WorkItemReference(item.id(), "fixture://workitems/" + item.id()))
                .toList();
    }

    @Override
    public List<WorkItem> getWorkItemDetails(String project, List<Integer> ids) {
        Set<Integer> wanted = new HashSet<>(ids);
        return workItems.stream().map(FixtureItem::item).filter(item -> wanted.contains(item.id())).toList();
    }

    @Override
    public List<Iteration> getIterations(String project, String team, String timeframe) {
        JsonNode teamNode = iterations.path(project).path(team);
        if (teamNode.isMissingNode()) {
            throw new IllegalStateException("404 team not found: " + project + "/" + team);
        }
        List<Iteration> all = TrackerResponseMapper.toIterations(teamNode);
        if (timeframe == null) {
            return all;
        }
        return all.stream().filter(it -> timeframe.equalsIgnoreCase(it.timeFrame())).toList();
    }

    @Override
    public List<Team> getTeams(String project) {
        return TrackerResponseMapper.toTeams(teams.path(project));
    }

    @Override
    public List<TeamMember> getTeamMembers(String project, String teamId) {
        return TrackerResponseMapper.toTeamMembers(teamMembers.path(teamId));
    }

    private static Predicate<WorkItem> matches(WorkItemQuery query) {
        Predicate<WorkItem> predicate = item -> query.workItemTypes().contains(item.type());
        if (query.states() == null) {
            predicate = predicate.and(item -> !"Removed".equals(item.state()));
        } else {
            predicate = predicate.and(item -> query.states().contains(item.state()));
        }
        if (query.iterationPath() != null) {
            predicate = predicate.and(item -> under(item.iterationPath(), query.iterationPath()));
        }
        if (query.areaPath() != null) {
            predicate = predicate.and(item -> under(item.areaPath(), query.areaPath()));
        }
        if (query.assignedTo() != null) {
            predicate =
                    predicate.and(
                            item ->
                                    query.assignedTo().equals(item.assignee())
                                            || query.assignedTo().equals(item.assigneeEmail()));
        }
        if (query.severity() != null) {
            predicate = predicate.and(item -> query.severity().equals(item.severity()));
        }
        if (query.createdFrom() != null) {
            LocalDate from = query.createdFrom();
            predicate = predicate.and(item -> item.createdDate() != null && !item.createdDate().toLocalDate().isBefore(from));
        }
        if (query.createdTo() != null) {
            LocalDate to = query.createdTo();
            predicate = predicate.and(item -> item.createdDate() != null && !item.createdDate().toLocalDate().isAfter(to));
        }
        return predicate;
    }

    private static boolean under(String path, String parent) {
        return path != null && (path.equals(parent) || path.startsWith(parent + "\\"));
    }

    private static JsonNode load(ObjectMapper objectMapper, String fixturePath, String fileName) {
        ClassPathResource resource = new ClassPathResource(fixturePath + "/" + fileName);
        if (!resource.exists()) {
            log.warn("[FixtureTracker] 픽스처 없음, 빈 데이터 사용: {}", resource.getPath());
            return MissingNode.getInstance();
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("픽스처 로드 실패: " + resource.getPath(), e);
        }
    }

    private record FixtureItem(String project, WorkItem item) {}
}
