package ris.pdm.support;

import java.time.OffsetDateTime;
import java.util.List;
import ris.pdm.external.dto.WorkItem;

/** 테스트용 작업 항목 생성 헬퍼 */
public final class WorkItemFixtures {

    private static final OffsetDateTime CREATED = OffsetDateTime.parse("2025-06-03T09:00:00Z");

    private WorkItemFixtures() {
    }

    public static WorkItem item(int id, String type, double storyPoints) {
        return new WorkItem(
                id, type + " " + id, type, "Active", "Dana Kim", "dana@example.com", storyPoints, 2,
                CREATED, CREATED, null, List.of(), "P", "P\\Sprint 12", null, null);
    }

    public static WorkItem bug(int id, String bugType) {
        return new WorkItem(
                id, "Bug " + id, WorkItem.TYPE_BUG, "Active", "Dana Kim", "dana@example.com", 0, 2,
                CREATED, CREATED, null, List.of(), "P", "P\\Sprint 12", bugType, "2 - High");
    }
}
