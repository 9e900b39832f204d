package ris.pdm.external.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import ris.pdm.external.dto.Iteration;
import ris.pdm.external.dto.WorkItem;
import ris.pdm.external.dto.WorkItemQuery;
import ris.pdm.external.dto.WorkItemReference;

@Tag("unit")
class StaticFixtureTrackerSourceTest {

    private static final String PROJECT = "Product - Data as a Service";

    private static StaticFixtureTrackerSource source;

    @BeforeAll
    static void load() {
        source = new StaticFixtureTrackerSource(new ObjectMapper(), "fixtures/tracker");
    }

    private List<Integer> ids(WorkItemQuery query) {
        return source.queryWorkItems(PROJECT, query).stream().map(WorkItemReference::id).toList();
    }

    @Test
    @DisplayName("버그 조회는 Bug 유형만 반환")
    void shouldFilterByType() {
        assertThat(ids(WorkItemQuery.bugs())).containsExactly(201, 202, 203, 204, 205, 206, 207);
    }

    @Test
    @DisplayName("이터레이션 경로는 하위 경로까지 포함 (UNDER)")
    void shouldFilterByIterationPath() {
        WorkItemQuery query = WorkItemQuery.bugs().toBuilder().iterationPath(PROJECT + "\\DaaS 11").build();

        assertThat(ids(query)).containsExactly(207);
    }

    @Test
    @DisplayName("심각도 + 생성일 범위 필터")
    void shouldFilterBySeverityAndDate() {
        WorkItemQuery query =
                WorkItemQuery.bugs().toBuilder()
                        .severity("1 - Critical")
                        .createdFrom(LocalDate.of(2025, 6, 1))
                        .createdTo(LocalDate.of(2025, 6, 30))
                        .build();

        assertThat(ids(query)).containsExactly(201, 205);
    }

    @Test
    @DisplayName("다른 프로젝트는 빈 결과")
    void shouldIsolateProjects() {
        assertThat(source.queryWorkItems("Product - New OMS", WorkItemQuery.bugs())).isEmpty();
    }

    @Test
    @DisplayName("상세 조회는 버그 유형 커스텀 필드를 읽음")
    void shouldReadBugTypeField() {
        List<WorkItem> details = source.getWorkItemDetails(PROJECT, List.of(201, 206));

        assertThat(details).extracting(WorkItem::bugType).containsExactly("PROD Issues", null);
    }

    @Test
    @DisplayName("존재하는 팀의 이터레이션, timeframe 필터")
    void shouldReturnTeamIterations() {
        List<Iteration> all = source.getIterations(PROJECT, "Data as a Service", null);
        List<Iteration> current = source.getIterations(PROJECT, "Data as a Service", "current");

        assertThat(all).extracting(Iteration::name).containsExactly("DaaS 11", "DaaS 12", "DaaS 13");
        assertThat(current).extracting(Iteration::name).containsExactly("DaaS 12");
    }

    @Test
    @DisplayName("없는 팀은 404 성격의 예외")
    void shouldFailForUnknownTeam() {
        assertThatThrownBy(() -> source.getIterations(PROJECT, PROJECT, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("404");
    }

    @Test
    @DisplayName("팀 목록과 멤버")
    void shouldReturnTeamsAndMembers() {
        assertThat(source.getTeams(PROJECT)).singleElement().satisfies(team ->
                assertThat(source.getTeamMembers(PROJECT, team.id())).hasSize(2));
    }
}
