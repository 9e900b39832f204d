package ris.pdm.controller;

import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import ris.pdm.global.response.ApiResponse;
import ris.pdm.service.classification.BugClassificationFallbackOrchestrator;
import ris.pdm.service.classification.FallbackResult;
import ris.pdm.service.classification.dto.BugClassificationPayload;
import ris.pdm.service.classification.dto.ClassificationFilters;

/**
 * 버그 분류 메트릭 API
 *
 * <p>업스트림 장애 시에도 fallback tier 응답을 200으로 반환합니다. 응답의 {@code degraded}로 품질을 구분하세요.
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class BugClassificationController {

    private final BugClassificationFallbackOrchestrator orchestrator;

    @GetMapping("/bug-classification/{projectId}")
    public ResponseEntity<ApiResponse<FallbackResult<BugClassificationPayload>>> getBugClassification(
            @PathVariable String projectId,
            @RequestParam(required = false) String environment,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String iterationPath) {
        ClassificationFilters filters =
                new ClassificationFilters(environment, severity, startDate, endDate, iterationPath);
        return ResponseEntity.ok(ApiResponse.success(orchestrator.classifyWithFallback(projectId, filters)));
    }
}
