package ris.pdm.external.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import ris.pdm.external.TrackerSource;
import ris.pdm.external.dto.Iteration;
import ris.pdm.external.dto.Team;
import ris.pdm.external.dto.TeamMember;
import ris.pdm.external.dto.WorkItem;
import ris.pdm.external.dto.WorkItemQuery;
import ris.pdm.external.dto.WorkItemReference;

/**
 * 트래커 REST API 실제 호출 구현체 (Azure DevOps 호환)
 *
 * <p>모든 요청은 {@code requestTimeout}으로 제한되며, 타임아웃/non-2xx/네트워크 오류는 WebClient 예외 그대로 던져
 * {@link ris.pdm.external.RateLimitedClient}에서 규격화됩니다.
 */
@Slf4j
public class LiveTrackerSource implements TrackerSource {

    private static final String API_VERSION = "api-version";

    private final WebClient trackerWebClient;
    private final String apiVersion;
    private final Duration requestTimeout;

    public LiveTrackerSource(WebClient trackerWebClient, String apiVersion, Duration requestTimeout) {
        this.trackerWebClient = trackerWebClient;
        this.apiVersion = apiVersion;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public List<WorkItemReference> queryWorkItems(String project, WorkItemQuery query) {
        log.info("[TrackerApi] WIQL query: project={}", project);
        JsonNode response =
                trackerWebClient
                        .post()
                        .uri(b -> withVersion(b.path("/{project}/_apis/wit/wiql")).build(project))
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(Map.of("query", query.toWiql(project)))
                        .retrieve()
                        .bodyToMono(JsonNode.class)
                        .timeout(requestTimeout)
                        .block();
        return TrackerResponseMapper.toReferences(orEmpty(response), query.maxResults());
    }

    @Override
    public List<WorkItem> getWorkItemDetails(String project, List<Integer> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        String joined = ids.stream().map(String::valueOf).collect(Collectors.joining(","));
        log.info("[TrackerApi] Work item details: project={}, count={}", project, ids.size());
        JsonNode response =
                get(
                        b ->
                                withVersion(
                                                b.path("/{project}/_apis/wit/workitems")
                                                        .queryParam("ids", joined)
                                                        .queryParam("$expand", "all"))
                                        .build(project));
        return TrackerResponseMapper.toWorkItems(response);
    }

    @Override
    public List<Iteration> getIterations(String project, String team, String timeframe) {
        log.info("[TrackerApi] Iterations: project={}, team={}, timeframe={}", project, team, timeframe);
        JsonNode response =
                get(
                        b -> {
                            UriBuilder builder = b.path("/{project}/{team}/_apis/work/teamsettings/iterations");
                            if (timeframe != null) {
                                builder.queryParam("$timeframe", timeframe);
                            }
                            return withVersion(builder).build(project, team);
                        });
        return TrackerResponseMapper.toIterations(response);
    }

    @Override
    public List<Team> getTeams(String project) {
        log.info("[TrackerApi] Teams: project={}", project);
        JsonNode response = get(b -> withVersion(b.path("/_apis/projects/{project}/teams")).build(project));
        return TrackerResponseMapper.toTeams(response);
    }

    @Override
    public List<TeamMember> getTeamMembers(String project, String teamId) {
        log.info("[TrackerApi] Team members: project={}, teamId={}", project, teamId);
        JsonNode response =
                get(
                        b ->
                                withVersion(b.path("/_apis/projects/{project}/teams/{teamId}/members"))
                                        .build(project, teamId));
        return TrackerResponseMapper.toTeamMembers(response);
    }

    private JsonNode get(Function<UriBuilder, URI> uri) {
        JsonNode response =
                trackerWebClient
                        .get()
                        .uri(uri)
                        .retrieve()
                        .bodyToMono(JsonNode.class)
                        .timeout(requestTimeout)
                        .block();
        return orEmpty(response);
    }

    private UriBuilder withVersion(UriBuilder builder) {
        return builder.queryParam(API_VERSION, apiVersion);
    }

    private static JsonNode orEmpty(JsonNode response) {
        return response != null ? response : MissingNode.getInstance();
    }
}
