package ris.pdm.service.iteration;

import java.util.Optional;

/**
 * 프로젝트 이름에서 팀 이름 후보를 만드는 전략 (시도 순서 = 선언 순서)
 *
 * <p>후보가 만들어지지 않는 전략은 {@link Optional#empty()}를 반환합니다.
 */
public enum TeamNameStrategy {

    /** 프로젝트 이름 그대로 (기본 팀) */
    EXACT_PROJECT {
        @Override
        public Optional<String> candidate(String project) {
            return Optional.of(project);
        }
    },

    /** {@code <project> Team} */
    PROJECT_TEAM_SUFFIX {
        @Override
        public Optional<String> candidate(String project) {
            return Optional.of(project + " Team");
        }
    },

    /** 마지막 {@code " - "} 뒤 구간 (예: {@code Product - New OMS} → {@code New OMS}) */
    LAST_PATH_SEGMENT {
        @Override
        public Optional<String> candidate(String project) {
            int idx = project.lastIndexOf(SEPARATOR);
            if (idx < 0) {
                return Optional.empty();
            }
            return nonBlank(project.substring(idx + SEPARATOR.length()));
        }
    },

    /** {@code Product - } 접두어 제거 */
    STRIPPED_PRODUCT_PREFIX {
        @Override
        public Optional<String> candidate(String project) {
            if (!project.contains(PRODUCT_PREFIX)) {
                return Optional.empty();
            }
            return nonBlank(project.replace(PRODUCT_PREFIX, ""));
        }
    };

    private static final String SEPARATOR = " - ";
    private static final String PRODUCT_PREFIX = "Product - ";

    public abstract Optional<String> candidate(String project);

    private static Optional<String> nonBlank(String value) {
        String trimmed = value.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }
}
