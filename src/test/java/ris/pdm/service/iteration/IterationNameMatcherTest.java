package ris.pdm.service.iteration;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import ris.pdm.external.dto.Iteration;

@Tag("unit")
class IterationNameMatcherTest {

    private static final List<Iteration> ITERATIONS =
            List.of(
                    named("Delivery 3"),
                    named("Sprint 04"),
                    named("DaaS 12"),
                    named("Hardening Week"));

    private static Iteration named(String name) {
        return new Iteration(name, name, "P\\" + name, null, null, null);
    }

    private static String match(String pattern, List<String> projectTemplates) {
        return IterationNameMatcher.match(ITERATIONS, pattern, projectTemplates, List.of("Sprint {n:02d}", "Sprint {n}"))
                .map(Iteration::name)
                .orElse(null);
    }

    @Test
    @DisplayName("이름 완전 일치가 우선 (대소문자 무시)")
    void shouldPreferExactName() {
        assertThat(match("daas 12", List.of())).isEqualTo("DaaS 12");
    }

    @Test
    @DisplayName("프로젝트 템플릿이 공통 템플릿보다 먼저")
    void shouldTryProjectTemplatesFirst() {
        assertThat(match("3", List.of("Delivery {n}"))).isEqualTo("Delivery 3");
    }

    @Test
    @DisplayName("공통 템플릿의 0 패딩")
    void shouldExpandPaddedTemplate() {
        assertThat(match("Sprint 4", List.of())).isEqualTo("Sprint 04");
        assertThat(IterationNameMatcher.expand("S{n:02d}-{n}", 7)).isEqualTo("S07-7");
    }

    @Test
    @DisplayName("마지막으로 부분 일치")
    void shouldFallBackToContains() {
        assertThat(match("hardening", List.of())).isEqualTo("Hardening Week");
        assertThat(match("release", List.of())).isNull();
    }

    @Test
    @DisplayName("번호 추출: 앞의 0은 무시하고 int 범위를 넘으면 비어 있음")
    void shouldExtractNumberWithinIntRange() {
        assertThat(IterationNameMatcher.extractNumber("Sprint 0007")).hasValue(7);
        assertThat(IterationNameMatcher.extractNumber("Sprint 99999999999")).isEmpty();
        assertThat(IterationNameMatcher.extractNumber("Sprint")).isEmpty();
        assertThat(match("Sprint 99999999999", List.of())).isNull();
    }
}
