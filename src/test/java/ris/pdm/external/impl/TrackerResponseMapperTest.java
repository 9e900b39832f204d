package ris.pdm.external.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import ris.pdm.external.dto.WorkItem;

@Tag("unit")
class TrackerResponseMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw);
    }

    @Test
    @DisplayName("알려진 필드 이름이 없으면 bug + type을 포함하는 필드에서 버그 유형을 읽음")
    void shouldFindBugTypeHeuristically() throws Exception {
        JsonNode fields = json("{\"Custom.DefectBugTypeV2\":\"UAT Bug\"}");

        assertThat(TrackerResponseMapper.bugType(fields)).isEqualTo("UAT Bug");
    }

    @Test
    @DisplayName("빈 값 후보는 건너뜀")
    void shouldSkipBlankCandidates() throws Exception {
        JsonNode fields = json("{\"Bug types\":\" \",\"Custom.BugType\":\"Deploy Bug\"}");

        assertThat(TrackerResponseMapper.bugType(fields)).isEqualTo("Deploy Bug");
    }

    @Test
    @DisplayName("누락 필드는 기본값, 잘못된 날짜는 null")
    void shouldApplyDefaults() throws Exception {
        WorkItem item =
                TrackerResponseMapper.toWorkItem(
                        json("{\"id\":9,\"fields\":{\"System.CreatedDate\":\"yesterday\",\"System.Tags\":\"a; ;b\"}}"));

        assertThat(item.id()).isEqualTo(9);
        assertThat(item.assignee()).isEqualTo("Unassigned");
        assertThat(item.priority()).isEqualTo(4);
        assertThat(item.storyPoints()).isZero();
        assertThat(item.createdDate()).isNull();
        assertThat(item.tags()).containsExactly("a", "b");
        assertThat(item.hasBugType()).isFalse();
    }
}
