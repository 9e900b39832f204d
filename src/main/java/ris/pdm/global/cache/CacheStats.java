package ris.pdm.global.cache;

/**
 * CacheStore 누적 통계 스냅샷
 *
 * @param hitRate 히트율 (%, 소수점 1자리)
 * @param status {@code healthy} (primary 연결) 또는 {@code degraded} (로컬 전용)
 */
public record CacheStats(
    long hits,
    long misses,
    long primaryHits,
    long localHits,
    long sets,
    long deletes,
    long errors,
    double hitRate,
    String status,
    String primaryBackend,
    long localEntries) {

  static double hitRate(long hits, long misses) {
    long total = hits + misses;
    if (total == 0) {
      return 0.0;
    }
    return Math.round(hits * 1000.0 / total) / 10.0;
  }
}
