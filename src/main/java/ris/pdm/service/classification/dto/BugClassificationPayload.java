package ris.pdm.service.classification.dto;

import java.util.List;
import java.util.Map;

/**
 * 버그 분류 응답 본문 (모든 fallback tier에서 동일한 형태)
 *
 * <p>타임스탬프를 포함하지 않으므로 같은 입력이면 같은 값입니다.
 */
public record BugClassificationPayload(
    BugTypeDistribution bugTypes,
    Map<String, EnvironmentBugs> bugsByEnvironment,
    Insights insights,
    FilterInfo filters,
    Metadata metadata) {

  public record Insights(List<String> topBugSources, List<String> recommendations) {}

  public record DateRange(String start, String end) {}

  public record FilterInfo(List<String> availableEnvironments, DateRange dateRange, String projectName) {}

  public record Metadata(String projectId, String projectName, long totalBugs, double classificationRate) {}
}
