package ris.pdm.external.dto;

/** WIQL 조회 결과의 작업 항목 참조 (ID만 포함) */
public record WorkItemReference(int id, String url) {}
