package ris.pdm.service.classification.dto;

/** 작업 유형 분류별 집계 (tasks / bugs / design / others) */
public record CategoryStats(long count, double percentage, double storyPoints) {}
