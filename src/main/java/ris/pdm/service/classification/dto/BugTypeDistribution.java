package ris.pdm.service.classification.dto;

import java.util.Map;

/**
 * 프로젝트 버그 유형 분포 (primary tier 원천 데이터)
 *
 * @param bugTypes 분류 키 → 건수 (예: {@code production → 3})
 * @param environments 환경 라벨 → 건수
 * @param environmentBreakdown 환경 라벨 → 건수/비율/버그 목록
 */
public record BugTypeDistribution(
    String projectId,
    long totalBugs,
    long classified,
    long unclassified,
    double classificationRate,
    Map<String, Long> bugTypes,
    Map<String, Long> environments,
    Map<String, EnvironmentBugs> environmentBreakdown) {

  public BugTypeDistribution {
    bugTypes = bugTypes == null ? Map.of() : bugTypes;
    environments = environments == null ? Map.of() : environments;
    environmentBreakdown = environmentBreakdown == null ? Map.of() : environmentBreakdown;
  }
}
