package ris.pdm.service.iteration;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import ris.pdm.external.dto.Iteration;

/**
 * 이름 패턴으로 이터레이션 찾기
 *
 * <ol>
 *   <li>이름 완전 일치 (대소문자 무시)
 *   <li>패턴의 숫자를 추출해 프로젝트 템플릿 → 공통 템플릿 순으로 이름 생성 후 일치 확인
 *   <li>이름 부분 일치 (대소문자 무시)
 * </ol>
 *
 * <p>템플릿: {@code {n}} 은 번호, {@code {n:02d}} 는 2자리 0 패딩 번호
 */
@Slf4j
final class IterationNameMatcher {

    private static final Pattern NUMBER = Pattern.compile("(\\d+)");

    /** int 범위를 넘지 않는 최대 자릿수 */
    private static final int MAX_NUMBER_DIGITS = 9;

    private IterationNameMatcher() {
    }

    static Optional<Iteration> match(
            List<Iteration> iterations,
            String pattern,
            List<String> projectTemplates,
            List<String> commonTemplates) {
        Optional<Iteration> exact = findByName(iterations, pattern);
        if (exact.isPresent()) {
            return exact;
        }

        OptionalInt number = extractNumber(pattern);
        if (number.isPresent()) {
            int n = number.getAsInt();
            Optional<Iteration> templated = matchTemplates(iterations, projectTemplates, n);
            if (templated.isPresent()) {
                return templated;
            }
            templated = matchTemplates(iterations, commonTemplates, n);
            if (templated.isPresent()) {
                return templated;
            }
        }

        String needle = pattern.toLowerCase(Locale.ROOT);
        return iterations.stream()
                .filter(it -> it.name() != null && it.name().toLowerCase(Locale.ROOT).contains(needle))
                .findFirst();
    }

    /** 첫 번째 숫자 토큰. 자릿수가 범위를 넘으면 템플릿 단계를 건너뛰도록 비어 있는 값을 반환합니다. */
    static OptionalInt extractNumber(String pattern) {
        Matcher number = NUMBER.matcher(pattern);
        if (!number.find()) {
            return OptionalInt.empty();
        }
        String digits = number.group(1).replaceFirst("^0+(?=\\d)", "");
        if (digits.length() > MAX_NUMBER_DIGITS) {
            log.debug("[IterationMatcher] 번호 범위 초과로 템플릿 생략: pattern={}", pattern);
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(digits));
    }

    static String expand(String template, int n) {
        return template.replace("{n:02d}", String.format("%02d", n)).replace("{n}", String.valueOf(n));
    }

    private static Optional<Iteration> matchTemplates(List<Iteration> iterations, List<String> templates, int n) {
        for (String template : templates) {
            Optional<Iteration> found = findByName(iterations, expand(template, n));
            if (found.isPresent()) {
                log.debug("[IterationMatcher] 템플릿 일치: template={}, name={}", template, found.get().name());
                return found;
            }
        }
        return Optional.empty();
    }

    private static Optional<Iteration> findByName(List<Iteration> iterations, String name) {
        return iterations.stream().filter(it -> name.equalsIgnoreCase(it.name())).findFirst();
    }
}
