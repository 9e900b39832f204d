package ris.pdm.service.classification;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 버그 발견 환경 분류
 *
 * <p>버그 유형 필드 값에서 환경을 추론합니다. 예: {@code Deploy Bug → Deploy}, {@code PROD Issues → Prod}.
 */
public enum BugEnvironment {
    DEPLOY("Deploy", Pattern.compile("\\bdeploy(ment)?\\b")),
    PROD("Prod", Pattern.compile("\\bprod(uction)?\\b")),
    SIT("SIT", Pattern.compile("\\bsit\\b|system integration")),
    UAT("UAT", Pattern.compile("\\buat\\b|user acceptance")),
    OTHER("Other", null),
    UNCLASSIFIED("Unclassified", null);

    /** 응답에 항상 포함되는 고정 환경 키 */
    public static final List<BugEnvironment> FIXED = List.of(DEPLOY, PROD, SIT, UAT);

    /** 필터로 선택 가능한 환경 */
    public static final List<String> AVAILABLE = List.of("Deploy", "Prod", "SIT", "UAT", "Other");

    private final String label;
    private final Pattern pattern;

    BugEnvironment(String label, Pattern pattern) {
        this.label = label;
        this.pattern = pattern;
    }

    public String getLabel() {
        return label;
    }

    public static BugEnvironment fromBugType(String bugType) {
        if (bugType == null || bugType.isBlank()) {
            return UNCLASSIFIED;
        }
        String lower = bugType.toLowerCase(Locale.ROOT);
        for (BugEnvironment env : FIXED) {
            if (env.pattern.matcher(lower).find()) {
                return env;
            }
        }
        return OTHER;
    }

    public static Optional<BugEnvironment> fromLabel(String label) {
        for (BugEnvironment env : values()) {
            if (env.label.equalsIgnoreCase(label)) {
                return Optional.of(env);
            }
        }
        return Optional.empty();
    }
}
