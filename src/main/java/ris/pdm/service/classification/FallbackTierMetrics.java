package ris.pdm.service.classification;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fallback tier 메트릭
 *
 * <ul>
 *   <li>fallback.tier{tier=primary|fallback|last_resort}: tier별 응답 횟수
 * </ul>
 *
 * <p>{@code last_resort} 비율이 오르면 트래커 API 장애를 의심합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallbackTierMetrics {

    private final MeterRegistry registry;

    private final Map<FallbackTier, Counter> counters = new EnumMap<>(FallbackTier.class);

    @PostConstruct
    public void init() {
        for (FallbackTier tier : FallbackTier.values()) {
            counters.put(tier, registry.counter("fallback.tier", Tags.of("tier", tier.name().toLowerCase(Locale.ROOT))));
        }
        log.info("[FallbackTierMetrics] Initialized");
    }

    public void record(FallbackTier tier) {
        Counter counter = counters.get(tier);
        if (counter != null) {
            counter.increment();
        }
    }

    public double count(FallbackTier tier) {
        Counter counter = counters.get(tier);
        return counter == null ? 0.0 : counter.count();
    }
}
