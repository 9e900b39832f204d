package ris.pdm.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * 트래커 작업 항목 상세
 *
 * @param bugType 버그 유형 커스텀 필드 값 (없으면 null)
 * @param severity {@code Microsoft.VSTS.Common.Severity} (없으면 null)
 */
public record WorkItem(
    int id,
    String title,
    String type,
    String state,
    String assignee,
    String assigneeEmail,
    double storyPoints,
    int priority,
    OffsetDateTime createdDate,
    OffsetDateTime changedDate,
    OffsetDateTime closedDate,
    List<String> tags,
    String areaPath,
    String iterationPath,
    String bugType,
    String severity) {

  public static final String TYPE_BUG = "Bug";

  public WorkItem {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  @JsonIgnore
  public boolean isBug() {
    return TYPE_BUG.equals(type);
  }

  public boolean hasBugType() {
    return bugType != null && !bugType.isBlank();
  }
}
