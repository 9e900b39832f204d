package ris.pdm.external.dto;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;

/**
 * 작업 항목 조회 조건
 *
 * <p>{@link #toWiql(String)}로 WIQL 문을 만들고, {@link #toCacheParams()}로 캐시 키 파라미터를 만듭니다.
 *
 * @param states null이면 {@code Removed}만 제외
 * @param iterationPath 구체 경로만 허용 (논리 토큰은 IterationResolver에서 해석 후 전달)
 */
@Builder(toBuilder = true)
public record WorkItemQuery(
    List<String> workItemTypes,
    List<String> states,
    String iterationPath,
    String areaPath,
    String assignedTo,
    String severity,
    LocalDate createdFrom,
    LocalDate createdTo,
    Integer maxResults) {

  public static final List<String> DEFAULT_TYPES = List.of("Task", "Bug", "User Story", "Feature");
  public static final int DEFAULT_MAX_RESULTS = 1000;

  public WorkItemQuery {
    workItemTypes = workItemTypes == null || workItemTypes.isEmpty() ? DEFAULT_TYPES : List.copyOf(workItemTypes);
    states = states == null ? null : List.copyOf(states);
    maxResults = maxResults == null || maxResults <= 0 ? DEFAULT_MAX_RESULTS : maxResults;
  }

  public static WorkItemQuery bugs() {
    return WorkItemQuery.builder().workItemTypes(List.of(WorkItem.TYPE_BUG)).build();
  }

  public String toWiql(String project) {
    StringBuilder wiql =
        new StringBuilder(
            "SELECT [System.Id] FROM WorkItems WHERE [System.TeamProject] = " + quote(project));
    wiql.append(" AND [System.WorkItemType] IN (").append(quoteAll(workItemTypes)).append(')');
    if (states == null) {
      wiql.append(" AND [System.State] <> 'Removed'");
    } else {
      wiql.append(" AND [System.State] IN (").append(quoteAll(states)).append(')');
    }
    if (iterationPath != null) {
      wiql.append(" AND [System.IterationPath] UNDER ").append(quote(iterationPath));
    }
    if (areaPath != null) {
      wiql.append(" AND [System.AreaPath] UNDER ").append(quote(areaPath));
    }
    if (assignedTo != null) {
      wiql.append(" AND [System.AssignedTo] = ").append(quote(assignedTo));
    }
    if (severity != null) {
      wiql.append(" AND [Microsoft.VSTS.Common.Severity] = ").append(quote(severity));
    }
    if (createdFrom != null) {
      wiql.append(" AND [System.CreatedDate] >= ").append(quote(createdFrom.toString()));
    }
    if (createdTo != null) {
      wiql.append(" AND [System.CreatedDate] <= ").append(quote(createdTo.toString()));
    }
    wiql.append(" ORDER BY [System.ChangedDate] DESC");
    return wiql.toString();
  }

  /** null 값은 키 생성 시 제거됩니다. */
  public Map<String, Object> toCacheParams() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("types", workItemTypes);
    params.put("states", states);
    params.put("iterationPath", iterationPath);
    params.put("areaPath", areaPath);
    params.put("assignedTo", assignedTo);
    params.put("severity", severity);
    params.put("from", createdFrom == null ? null : createdFrom.toString());
    params.put("to", createdTo == null ? null : createdTo.toString());
    params.put("max", maxResults);
    return params;
  }

  private static String quote(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  private static String quoteAll(List<String> values) {
    return values.stream().map(WorkItemQuery::quote).collect(Collectors.joining(", "));
  }
}
