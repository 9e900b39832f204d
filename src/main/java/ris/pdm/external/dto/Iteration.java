package ris.pdm.external.dto;

import java.time.OffsetDateTime;

/**
 * 팀 이터레이션 (스프린트)
 *
 * @param path 이터레이션 경로 (예: {@code Product - New OMS\Sprint 12})
 * @param startDate 시작일 (미정이면 null)
 * @param finishDate 종료일 (미정이면 null)
 * @param timeFrame {@code past | current | future}
 */
public record Iteration(
    String id,
    String name,
    String path,
    OffsetDateTime startDate,
    OffsetDateTime finishDate,
    String timeFrame) {

  /** 시작일~종료일 범위에 {@code instant}가 포함되는지 여부 (날짜 미정이면 false) */
  public boolean contains(OffsetDateTime instant) {
    if (startDate == null || finishDate == null) {
      return false;
    }
    return !instant.isBefore(startDate) && !instant.isAfter(finishDate);
  }
}
