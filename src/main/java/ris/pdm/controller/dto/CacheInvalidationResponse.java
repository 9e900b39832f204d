package ris.pdm.controller.dto;

/**
 * @param namespace 무효화 대상 (전체 삭제 시 {@code *})
 * @param removed 삭제된 엔트리 수
 */
public record CacheInvalidationResponse(String namespace, long removed) {}
