package ris.pdm.external.dto;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class WorkItemQueryTest {

    @Test
    @DisplayName("기본 조건: 기본 유형, Removed 제외, 최대 1000건")
    void shouldApplyDefaults() {
        WorkItemQuery query = WorkItemQuery.builder().build();

        assertThat(query.workItemTypes()).isEqualTo(WorkItemQuery.DEFAULT_TYPES);
        assertThat(query.maxResults()).isEqualTo(1000);
        assertThat(query.toWiql("P")).contains("[System.State] <> 'Removed'");
    }

    @Test
    @DisplayName("작은따옴표는 WIQL 문자열 규칙대로 이스케이프")
    void shouldEscapeQuotes() {
        WorkItemQuery query = WorkItemQuery.builder().assignedTo("O'Brien").build();

        assertThat(query.toWiql("Team's Project"))
                .contains("[System.TeamProject] = 'Team''s Project'")
                .contains("[System.AssignedTo] = 'O''Brien'");
    }

    @Test
    @DisplayName("경로 조건은 UNDER, 날짜는 ISO 형식")
    void shouldBuildPathAndDateClauses() {
        WorkItemQuery query =
                WorkItemQuery.bugs().toBuilder()
                        .states(List.of("Active", "New"))
                        .iterationPath("P\\Sprint 12")
                        .createdFrom(LocalDate.of(2025, 6, 1))
                        .build();

        assertThat(query.toWiql("P"))
                .contains("[System.WorkItemType] IN ('Bug')")
                .contains("[System.State] IN ('Active', 'New')")
                .contains("[System.IterationPath] UNDER 'P\\Sprint 12'")
                .contains("[System.CreatedDate] >= '2025-06-01'")
                .endsWith("ORDER BY [System.ChangedDate] DESC");
    }
}
