package ris.pdm.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import ris.pdm.global.error.GlobalExceptionHandler;
import ris.pdm.service.classification.BugClassificationFallbackOrchestrator;
import ris.pdm.service.classification.FallbackResult;
import ris.pdm.service.classification.FallbackTier;
import ris.pdm.service.classification.dto.BugClassificationPayload;
import ris.pdm.service.classification.dto.BugClassificationPayload.DateRange;
import ris.pdm.service.classification.dto.BugClassificationPayload.FilterInfo;
import ris.pdm.service.classification.dto.BugClassificationPayload.Insights;
import ris.pdm.service.classification.dto.BugClassificationPayload.Metadata;
import ris.pdm.service.classification.dto.BugTypeDistribution;
import ris.pdm.service.classification.dto.ClassificationFilters;

@Tag("unit")
class BugClassificationControllerTest {

    private BugClassificationFallbackOrchestrator orchestrator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(BugClassificationFallbackOrchestrator.class);
        mockMvc =
                MockMvcBuilders.standaloneSetup(new BugClassificationController(orchestrator))
                        .setControllerAdvice(new GlobalExceptionHandler())
                        .build();
    }

    private static BugClassificationPayload zeroed(String projectId) {
        return new BugClassificationPayload(
                new BugTypeDistribution(projectId, 0, 0, 0, 0.0, Map.of(), Map.of(), Map.of()),
                Map.of(),
                new Insights(List.of(), List.of()),
                new FilterInfo(List.of("Deploy", "Prod", "SIT", "UAT", "Other"), new DateRange(null, null), projectId),
                new Metadata(projectId, projectId, 0, 0.0));
    }

    @Test
    @DisplayName("degraded 응답도 200으로 반환하고 tier를 노출")
    void shouldExposeTier() throws Exception {
        given(orchestrator.classifyWithFallback(eq("p1"), any()))
                .willReturn(FallbackResult.of(FallbackTier.LAST_RESORT, zeroed("p1")));

        mockMvc
                .perform(get("/api/metrics/bug-classification/p1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tier").value("LAST_RESORT"))
                .andExpect(jsonPath("$.data.degraded").value(true))
                .andExpect(jsonPath("$.data.payload.metadata.totalBugs").value(0));
    }

    @Test
    @DisplayName("쿼리 파라미터는 필터로 전달 (ISO 날짜)")
    void shouldBindFilters() throws Exception {
        given(orchestrator.classifyWithFallback(eq("p1"), any()))
                .willReturn(FallbackResult.of(FallbackTier.PRIMARY, zeroed("p1")));

        mockMvc
                .perform(
                        get("/api/metrics/bug-classification/p1")
                                .param("environment", "Prod")
                                .param("startDate", "2025-06-01")
                                .param("iterationPath", "current"))
                .andExpect(status().isOk());

        ArgumentCaptor<ClassificationFilters> captor = ArgumentCaptor.forClass(ClassificationFilters.class);
        verify(orchestrator).classifyWithFallback(eq("p1"), captor.capture());
        assertThat(captor.getValue().environment()).isEqualTo("Prod");
        assertThat(captor.getValue().startDate()).isEqualTo(LocalDate.of(2025, 6, 1));
        assertThat(captor.getValue().iterationPath()).isEqualTo("current");
        assertThat(captor.getValue().endDate()).isNull();
    }
}
