package ris.pdm.external;

import java.util.List;
import ris.pdm.external.dto.Iteration;
import ris.pdm.external.dto.Team;
import ris.pdm.external.dto.TeamMember;
import ris.pdm.external.dto.WorkItem;
import ris.pdm.external.dto.WorkItemQuery;
import ris.pdm.external.dto.WorkItemReference;

/**
 * 트래커 데이터 소스
 *
 * <p>구현체는 기동 시 {@code tracker.api.source} 설정으로 한 번만 선택됩니다.
 *
 * <ul>
 *   <li>{@link ris.pdm.external.impl.LiveTrackerSource}: 실제 REST API
 *   <li>{@link ris.pdm.external.impl.StaticFixtureTrackerSource}: 클래스패스 JSON 픽스처
 * </ul>
 *
 * <p>호출 한도/예외 규격화는 {@link RateLimitedClient}가 담당하므로 구현체는 원본 예외를 그대로 던집니다.
 */
public interface TrackerSource {

    List<WorkItemReference> queryWorkItems(String project, WorkItemQuery query);

    /** 한 번에 최대 200건. 배치 분할은 호출자 책임 */
    List<WorkItem> getWorkItemDetails(String project, List<Integer> ids);

    /**
     * @param timeframe {@code current} 또는 null(전체)
     */
    List<Iteration> getIterations(String project, String team, String timeframe);

    List<Team> getTeams(String project);

    List<TeamMember> getTeamMembers(String project, String teamId);
}
