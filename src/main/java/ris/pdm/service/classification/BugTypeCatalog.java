package ris.pdm.service.classification;

import java.util.Locale;
import java.util.Map;

/**
 * 트래커 버그 유형 필드 값 → 내부 분류 키
 *
 * <p>등록되지 않은 값은 소문자 snake_case로 정규화합니다. 값이 없으면 {@code unclassified}.
 */
final class BugTypeCatalog {

    static final String UNCLASSIFIED = "unclassified";
    static final String OTHER = "other";

    private static final Map<String, String> MAPPING =
            Map.ofEntries(
                    Map.entry("PROD Issues", "production"),
                    Map.entry("Production Bug", "production"),
                    Map.entry("Deploy Bug", "deployment"),
                    Map.entry("Deployment Bug", "deployment"),
                    Map.entry("SIT Bug", "system_integration_test"),
                    Map.entry("UAT Bug", "user_acceptance_test"),
                    Map.entry("Integration Bug", "integration"),
                    Map.entry("Regression Bug", "regression"),
                    Map.entry("Performance Bug", "performance"),
                    Map.entry("Security Bug", "security"),
                    Map.entry("Data Bug", "data"),
                    Map.entry("UI Bug", "ui"),
                    Map.entry("Functional", "functional"));

    private BugTypeCatalog() {
    }

    static String classify(String bugTypeField) {
        if (bugTypeField == null || bugTypeField.isBlank()) {
            return UNCLASSIFIED;
        }
        String trimmed = bugTypeField.trim();
        String mapped = MAPPING.get(trimmed);
        if (mapped != null) {
            return mapped;
        }
        String normalized = trimmed.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_|_$", "");
        return normalized.isEmpty() ? OTHER : normalized;
    }
}
