package ris.pdm.global.cache;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * CacheStore가 사용하는 단일 저장소 백엔드
 *
 * <p>값은 항상 JSON 문자열로 저장됩니다. 구현체는 장애 시 예외를 그대로 던지고, 장애 흡수는 {@link CacheStore}가 담당합니다.
 */
public interface CacheBackend {

    /** 백엔드 이름 (로그/통계용) */
    String name();

    Optional<String> get(String key);

    /** TTL은 매 쓰기마다 명시적으로 적용됩니다. */
    void set(String key, String json, long ttlSeconds);

    /**
     * 남은 TTL (초)
     *
     * @return 키가 없거나 만료가 설정되지 않았으면 비어 있음
     */
    OptionalLong remainingTtlSeconds(String key);

    boolean delete(String key);

    /**
     * glob 패턴({@code *}, {@code ?})에 일치하는 키 삭제
     *
     * @return 삭제된 키 수
     */
    long deleteMatching(String globPattern);

    /** 연결 상태 확인 (ping) */
    boolean isAvailable();
}
