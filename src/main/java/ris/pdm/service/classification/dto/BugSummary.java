package ris.pdm.service.classification.dto;

import ris.pdm.external.dto.WorkItem;

/** 환경별 버그 목록 항목 */
public record BugSummary(int id, String title, String state, String assignee) {

    public static BugSummary from(WorkItem item) {
        return new BugSummary(item.id(), item.title(), item.state(), item.assignee());
    }
}
