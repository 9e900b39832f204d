package ris.pdm.service.classification.dto;

import java.util.Map;

/** 작업 유형 분포 + 버그 분류 요약 */
public record TaskDistribution(
    String projectName,
    long totalItems,
    Map<String, CategoryStats> distribution,
    BugClassificationSummary bugClassification) {}
