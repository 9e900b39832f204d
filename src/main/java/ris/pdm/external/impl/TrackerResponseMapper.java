package ris.pdm.external.impl;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import ris.pdm.external.dto.Iteration;
import ris.pdm.external.dto.Team;
import ris.pdm.external.dto.TeamMember;
import ris.pdm.external.dto.WorkItem;
import ris.pdm.external.dto.WorkItemReference;

/**
 * 트래커 REST 응답(JSON) → DTO 변환
 *
 * <p>Live/Fixture 소스가 같은 원본 형식을 공유하므로 변환 규칙도 한 곳에 둡니다.
 */
@Slf4j
final class TrackerResponseMapper {

    /** 인스턴스마다 이름이 다른 버그 유형 커스텀 필드 후보 (우선순위 순) */
    private static final List<String> BUG_TYPE_FIELDS =
            List.of(
                    "bug types",
                    "Bug types",
                    "Bug Types",
                    "Custom.BugType",
                    "Custom.BugTypes",
                    "Custom.bug types",
                    "Microsoft.VSTS.Common.BugType",
                    "System.BugType",
                    "WEF.BugType",
                    "WEF.Bug_Type",
                    "Custom.Bug_Type");

    private static final String UNASSIGNED = "Unassigned";
    private static final int DEFAULT_PRIORITY = 4;

    private TrackerResponseMapper() {
    }

    static List<WorkItemReference> toReferences(JsonNode wiqlResponse, int maxResults) {
        List<WorkItemReference> refs = new ArrayList<>();
        for (JsonNode node : wiqlResponse.path("workItems")) {
            if (refs.size() >= maxResults) {
                break;
            }
            refs.add(new WorkItemReference(node.path("id").asInt(), text(node, "url")));
        }
        return refs;
    }

    static List<WorkItem> toWorkItems(JsonNode response) {
        List<WorkItem> items = new ArrayList<>();
        for (JsonNode node : response.path("value")) {
            items.add(toWorkItem(node));
        }
        return items;
    }

    static WorkItem toWorkItem(JsonNode node) {
        JsonNode fields = node.path("fields");
        JsonNode assignedTo = fields.path("System.AssignedTo");
        String assignee = assignedTo.isObject() ? text(assignedTo, "displayName") : text(fields, "System.AssignedTo");
        int id = fields.has("System.Id") ? fields.path("System.Id").asInt() : node.path("id").asInt();

        return new WorkItem(
                id,
                text(fields, "System.Title"),
                text(fields, "System.WorkItemType"),
                text(fields, "System.State"),
                assignee != null ? assignee : UNASSIGNED,
                assignedTo.isObject() ? text(assignedTo, "uniqueName") : null,
                fields.path("Microsoft.VSTS.Scheduling.StoryPoints").asDouble(0),
                fields.path("Microsoft.VSTS.Common.Priority").asInt(DEFAULT_PRIORITY),
                dateTime(fields, "System.CreatedDate"),
                dateTime(fields, "System.ChangedDate"),
                dateTime(fields, "Microsoft.VSTS.Common.ClosedDate"),
                tags(text(fields, "System.Tags")),
                text(fields, "System.AreaPath"),
                text(fields, "System.IterationPath"),
                bugType(fields),
                text(fields, "Microsoft.VSTS.Common.Severity"));
    }

    static List<Iteration> toIterations(JsonNode response) {
        List<Iteration> iterations = new ArrayList<>();
        for (JsonNode node : response.path("value")) {
            JsonNode attributes = node.path("attributes");
            iterations.add(
                    new Iteration(
                            text(node, "id"),
                            text(node, "name"),
                            text(node, "path"),
                            dateTime(attributes, "startDate"),
                            dateTime(attributes, "finishDate"),
                            text(attributes, "timeFrame")));
        }
        return iterations;
    }

    static List<Team> toTeams(JsonNode response) {
        List<Team> teams = new ArrayList<>();
        for (JsonNode node : response.path("value")) {
            teams.add(new Team(text(node, "id"), text(node, "name")));
        }
        return teams;
    }

    static List<TeamMember> toTeamMembers(JsonNode response) {
        List<TeamMember> members = new ArrayList<>();
        for (JsonNode node : response.path("value")) {
            JsonNode identity = node.has("identity") ? node.path("identity") : node;
            members.add(
                    new TeamMember(
                            text(identity, "id"),
                            text(identity, "displayName"),
                            text(identity, "uniqueName"),
                            text(identity, "imageUrl")));
        }
        return members;
    }

    /** 정확한 후보 이름 우선, 없으면 {@code bug}와 {@code type}을 모두 포함하는 필드 */
    static String bugType(JsonNode fields) {
        for (String name : BUG_TYPE_FIELDS) {
            String value = text(fields, name);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            String lower = field.getKey().toLowerCase(Locale.ROOT);
            if (lower.contains("bug") && lower.contains("type") && field.getValue().isTextual()) {
                String value = field.getValue().asText();
                if (!value.isBlank()) {
                    return value;
                }
            }
        }
        return null;
    }

    private static List<String> tags(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(";")).map(String::trim).filter(t -> !t.isEmpty()).toList();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value.asText();
    }

    private static OffsetDateTime dateTime(JsonNode node, String field) {
        String raw = text(node, field);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw);
        } catch (DateTimeParseException e) {
            log.debug("[TrackerMapper] 날짜 형식 무시: field={}, value={}", field, raw);
            return null;
        }
    }
}
