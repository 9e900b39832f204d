package ris.pdm.controller;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import ris.pdm.global.cache.CacheStats;
import ris.pdm.global.error.GlobalExceptionHandler;
import ris.pdm.global.error.exception.UnknownCacheNamespaceException;
import ris.pdm.service.cache.CacheAdminService;

@Tag("unit")
class CacheAdminControllerTest {

    private CacheAdminService cacheAdminService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        cacheAdminService = mock(CacheAdminService.class);
        mockMvc =
                MockMvcBuilders.standaloneSetup(new CacheAdminController(cacheAdminService))
                        .setControllerAdvice(new GlobalExceptionHandler())
                        .build();
    }

    @Test
    @DisplayName("GET /stats: 통계와 백엔드 상태")
    void shouldReturnStats() throws Exception {
        given(cacheAdminService.getCacheStats())
                .willReturn(new CacheStats(8, 2, 6, 2, 5, 0, 1, 80.0, "degraded", "redis", 3));

        mockMvc
                .perform(get("/api/admin/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.hitRate").value(80.0))
                .andExpect(jsonPath("$.data.status").value("degraded"));
    }

    @Test
    @DisplayName("DELETE /{namespace}: 삭제 건수 반환")
    void shouldInvalidateNamespace() throws Exception {
        given(cacheAdminService.invalidateNamespace("workItems")).willReturn(4L);

        mockMvc
                .perform(delete("/api/admin/cache/workItems"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.namespace").value("workItems"))
                .andExpect(jsonPath("$.data.removed").value(4));
    }

    @Test
    @DisplayName("알 수 없는 네임스페이스는 404 + C002")
    void shouldRejectUnknownNamespace() throws Exception {
        given(cacheAdminService.invalidateNamespace("nope")).willThrow(new UnknownCacheNamespaceException("nope"));

        mockMvc
                .perform(delete("/api/admin/cache/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("C002"));
    }
}
