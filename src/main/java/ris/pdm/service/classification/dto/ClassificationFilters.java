package ris.pdm.service.classification.dto;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 버그 분류 조회 필터 (모두 선택)
 *
 * @param environment Deploy / Prod / SIT / UAT / Other
 * @param iterationPath 논리 참조 또는 구체 경로
 */
public record ClassificationFilters(
    String environment,
    String severity,
    LocalDate startDate,
    LocalDate endDate,
    String iterationPath) {

  public static ClassificationFilters none() {
    return new ClassificationFilters(null, null, null, null, null);
  }

  public Map<String, Object> toCacheParams() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("environment", environment);
    params.put("severity", severity);
    params.put("startDate", startDate == null ? null : startDate.toString());
    params.put("endDate", endDate == null ? null : endDate.toString());
    params.put("iterationPath", iterationPath);
    return params;
  }
}
