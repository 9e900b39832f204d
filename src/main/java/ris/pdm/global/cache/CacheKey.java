package ris.pdm.global.cache;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * 구조화된 캐시 키
 *
 * <p>동일한 (namespace, identifier, params) 요청은 항상 같은 키가 되고, 파라미터 값이 하나라도 다르면 다른 키가 됩니다.
 *
 * @param namespace 논리 그룹 (예: workItems, iterations)
 * @param identifier 네임스페이스 내 하위 식별자 (예: query, batch, 팀 이름)
 * @param paramsHash 정렬/null 필터링된 파라미터의 안정적 표현 (파라미터가 없으면 빈 문자열)
 */
public record CacheKey(String namespace, String identifier, String paramsHash) {

    public CacheKey {
        Objects.requireNonNull(namespace, "namespace");
        identifier = identifier == null ? "" : identifier;
        paramsHash = paramsHash == null ? "" : paramsHash;
    }

    /**
     * 저장소 키로 변환: {@code <prefix>:<namespace>:<identifier>:<paramsHash>}
     *
     * <p>빈 구성 요소는 생략됩니다.
     */
    public String toStorageKey(String prefix) {
        StringJoiner joiner = new StringJoiner(":");
        joiner.add(prefix).add(namespace);
        if (!identifier.isEmpty()) {
            joiner.add(identifier);
        }
        if (!paramsHash.isEmpty()) {
            joiner.add(paramsHash);
        }
        return joiner.toString();
    }
}
