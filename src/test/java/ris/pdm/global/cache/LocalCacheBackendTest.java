package ris.pdm.global.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class LocalCacheBackendTest {

    private final AtomicLong nanos = new AtomicLong();
    private LocalCacheBackend backend;

    @BeforeEach
    void setUp() {
        backend = new LocalCacheBackend(1_000, nanos::get);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    @Test
    @DisplayName("엔트리별 TTL이 지나면 조회되지 않음")
    void shouldExpirePerEntry() {
        backend.set("short", "\"a\"", 10);
        backend.set("long", "\"b\"", 60);

        advance(Duration.ofSeconds(11));

        assertThat(backend.get("short")).isEmpty();
        assertThat(backend.get("long")).contains("\"b\"");
    }

    @Test
    @DisplayName("읽기는 만료 시간을 연장하지 않음")
    void shouldNotExtendOnRead() {
        backend.set("key", "1", 10);
        advance(Duration.ofSeconds(9));
        assertThat(backend.get("key")).isPresent();

        advance(Duration.ofSeconds(2));

        assertThat(backend.get("key")).isEmpty();
    }

    @Test
    @DisplayName("setIfAbsent는 기존 엔트리를 덮어쓰지 않음")
    void shouldKeepExistingOnSetIfAbsent() {
        backend.set("key", "old", 60);

        backend.setIfAbsent("key", "new", 60);

        assertThat(backend.get("key")).contains("old");
    }

    @Test
    @DisplayName("glob 패턴과 일치하는 키만 삭제하고 건수 반환")
    void shouldDeleteMatchingGlob() {
        backend.set("ris:cache:workItems:a", "1", 60);
        backend.set("ris:cache:workItems:b", "2", 60);
        backend.set("ris:cache:metrics:a", "3", 60);

        long removed = backend.deleteMatching("ris:cache:workItems:*");

        assertThat(removed).isEqualTo(2);
        assertThat(backend.get("ris:cache:metrics:a")).contains("3");
        assertThat(backend.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("정규식 특수문자는 리터럴로 취급")
    void shouldQuoteRegexCharacters() {
        backend.set("ris:cache:x.y", "1", 60);
        backend.set("ris:cache:xzy", "2", 60);

        assertThat(backend.deleteMatching("ris:cache:x.y")).isEqualTo(1);
        assertThat(backend.get("ris:cache:xzy")).isPresent();
    }

    @Test
    @DisplayName("delete는 존재 여부를 반환")
    void shouldReportDeletion() {
        backend.set("key", "1", 60);

        assertThat(backend.delete("key")).isTrue();
        assertThat(backend.delete("key")).isFalse();
    }
}
