package ris.pdm.service.classification;

import java.util.Objects;

/**
 * Tier 정보가 붙은 결과
 *
 * @param degraded {@code tier != PRIMARY}와 항상 같음
 */
public record FallbackResult<T>(FallbackTier tier, T payload, boolean degraded) {

    public FallbackResult {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(payload, "payload");
        if (degraded != (tier != FallbackTier.PRIMARY)) {
            throw new IllegalArgumentException("degraded must reflect tier: " + tier);
        }
    }

    public static <T> FallbackResult<T> of(FallbackTier tier, T payload) {
        return new FallbackResult<>(tier, payload, tier != FallbackTier.PRIMARY);
    }
}
