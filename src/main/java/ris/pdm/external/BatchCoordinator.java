package ris.pdm.external;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ris.pdm.global.error.exception.BatchExecutionException;
import ris.pdm.global.error.exception.InvalidInputException;
import ris.pdm.global.executor.TaskContext;
import ris.pdm.global.ratelimit.Sleeper;

/**
 * 대량 ID 조회를 순차 배치로 분할 실행
 *
 * <ul>
 *   <li>배치 수 = {@code ceil(n / maxBatchSize)}, 결과는 입력 순서대로 연결
 *   <li>배치 간 {@code perBatchDelay} 만큼 대기 (배치가 2개 이상일 때만)
 *   <li>각 배치는 {@link RateLimitedClient}를 통과하므로 호출 예산을 공유
 *   <li>한 배치라도 실패하면 즉시 중단하고 {@link BatchExecutionException}
 * </ul>
 */
@Slf4j
@Component
public class BatchCoordinator {

    private final RateLimitedClient client;
    private final Sleeper sleeper;

    public BatchCoordinator(RateLimitedClient client, Sleeper sleeper) {
        this.client = client;
        this.sleeper = sleeper;
    }

    public <I, R> List<R> runBatched(
            List<I> ids, int maxBatchSize, Duration perBatchDelay, Function<List<I>, List<R>> batchFn) {
        List<List<I>> batches = partition(ids, maxBatchSize);
        if (batches.isEmpty()) {
            return List.of();
        }

        int batchCount = batches.size();
        List<R> results = new ArrayList<>();
        for (int index = 0; index < batchCount; index++) {
            List<I> batch = batches.get(index);
            if (index > 0) {
                pause(perBatchDelay);
            }
            results.addAll(runOne(batch, index, batchCount, batchFn));
        }
        log.debug("[Batch] 완료: items={}, batches={}, results={}", ids.size(), batchCount, results.size());
        return results;
    }

    /**
     * 입력 순서를 유지하는 분할
     *
     * @throws InvalidInputException {@code maxBatchSize <= 0}
     */
    public static <I> List<List<I>> partition(List<I> ids, int maxBatchSize) {
        if (maxBatchSize <= 0) {
            throw new InvalidInputException("maxBatchSize must be positive: " + maxBatchSize);
        }
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<List<I>> batches = new ArrayList<>((ids.size() + maxBatchSize - 1) / maxBatchSize);
        for (int from = 0; from < ids.size(); from += maxBatchSize) {
            batches.add(List.copyOf(ids.subList(from, Math.min(from + maxBatchSize, ids.size()))));
        }
        return batches;
    }

    private <I, R> List<R> runOne(
            List<I> batch, int index, int batchCount, Function<List<I>, List<R>> batchFn) {
        TaskContext context = TaskContext.of("Batch", "runBatched", (index + 1) + "/" + batchCount);
        try {
            List<R> result = client.call(context, () -> batchFn.apply(batch));
            return result == null ? List.of() : result;
        } catch (RuntimeException e) {
            log.warn("[Batch] 배치 실패, 중단: batch={}/{}, size={}", index + 1, batchCount, batch.size());
            throw new BatchExecutionException(index, batchCount, batch.size(), e);
        }
    }

    private void pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Batch] 배치 간 대기 중 인터럽트, 다음 배치를 즉시 실행합니다.");
        }
    }
}
