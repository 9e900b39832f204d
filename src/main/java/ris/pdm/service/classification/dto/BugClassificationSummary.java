package ris.pdm.service.classification.dto;

import java.util.Map;

/**
 * 작업 분포 계산에 포함되는 버그 분류 요약
 *
 * @param classificationRate 분류율 (%). 원천 데이터에 없으면 null
 */
public record BugClassificationSummary(
    long totalBugs,
    long unclassified,
    Double classificationRate,
    Map<String, Long> classificationBreakdown,
    Map<String, EnvironmentBugs> environmentBreakdown) {

  public BugClassificationSummary {
    classificationBreakdown = classificationBreakdown == null ? Map.of() : classificationBreakdown;
    environmentBreakdown = environmentBreakdown == null ? Map.of() : environmentBreakdown;
  }
}
