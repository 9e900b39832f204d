package ris.pdm.service.classification.dto;

import java.util.List;

/**
 * 환경별 버그 집계
 *
 * @param percentage 전체 버그 대비 비율 (%, 소수점 1자리)
 */
public record EnvironmentBugs(long count, double percentage, List<BugSummary> bugs) {

    private static final EnvironmentBugs EMPTY = new EnvironmentBugs(0, 0.0, List.of());

    public EnvironmentBugs {
        count = Math.max(0, count);
        percentage = Math.max(0.0, percentage);
        bugs = bugs == null ? List.of() : List.copyOf(bugs);
    }

    public static EnvironmentBugs empty() {
        return EMPTY;
    }
}
