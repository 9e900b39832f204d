package ris.pdm.service.iteration;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 논리 이터레이션 참조의 해석 결과
 *
 * @param logicalRef 요청된 참조 (예: {@code current}, {@code Sprint 12}, 구체 경로)
 * @param resolvedPath 구체 경로. {@code null}이면 이터레이션 필터를 적용하지 않음
 * @param team 경로를 찾은 팀 (구체 경로 입력이거나 해석 실패 시 null)
 */
public record ResolvedIteration(String logicalRef, String resolvedPath, String team) {

    public static ResolvedIteration unresolved(String logicalRef) {
        return new ResolvedIteration(logicalRef, null, null);
    }

    @JsonIgnore
    public boolean isResolved() {
        return resolvedPath != null;
    }
}
