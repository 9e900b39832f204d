package ris.pdm.service.iteration;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ris.pdm.external.RateLimitedClient;
import ris.pdm.external.TrackerSource;
import ris.pdm.external.dto.Iteration;
import ris.pdm.global.cache.CacheBackedFetcher;
import ris.pdm.global.cache.CacheNamespace;
import ris.pdm.global.error.exception.UpstreamUnavailableException;
import ris.pdm.global.executor.TaskContext;
import ris.pdm.service.project.ProjectMapper;

/**
 * 논리 이터레이션 참조({@code current}, {@code latest}, 이름 패턴)를 구체 경로로 해석
 *
 * <h4>상태 흐름</h4>
 *
 * <pre>
 * START ──(경로에 '\' 포함)──────────────▶ 그대로 반환
 *   │
 *   ▼
 * TRY_TEAM: teamHint 또는 TeamNameStrategy 순서대로 후보 팀 조회 (후보당 업스트림 1회)
 *   │  실패/빈 목록 → 다음 후보
 *   ▼
 * SUCCESS: 첫 번째 비어있지 않은 목록에서 선택 → iterations 네임스페이스에 30분 캐시
 *   │
 * EXHAUSTED: 모든 후보 실패 또는 선택 실패 → resolvedPath = null (캐시하지 않음)
 * </pre>
 *
 * <p>{@code null} 경로는 "이터레이션 필터 미적용"을 뜻하며 에러가 아닙니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IterationResolver {

    public static final String CURRENT = "current";
    public static final String LATEST = "latest";

    private static final String PATH_SEPARATOR = "\\";

    private final TrackerSource trackerSource;
    private final RateLimitedClient client;
    private final CacheBackedFetcher fetcher;
    private final ProjectMapper projectMapper;
    private final Clock clock;

    public ResolvedIteration resolve(String project, String logicalRef, String teamHint) {
        if (logicalRef == null || logicalRef.isBlank()) {
            return ResolvedIteration.unresolved(logicalRef);
        }
        String ref = logicalRef.trim();
        if (isConcretePath(ref)) {
            return new ResolvedIteration(ref, ref, null);
        }

        Map<String, String> params = teamHint == null ? Map.of("ref", ref) : Map.of("ref", ref, "team", teamHint);
        ResolvedIteration resolved =
                fetcher.fetchWithCache(
                        CacheNamespace.ITERATIONS,
                        "resolved:" + project,
                        params,
                        ResolvedIteration.class,
                        () -> lookup(project, ref, teamHint));
        return resolved != null ? resolved : ResolvedIteration.unresolved(ref);
    }

    /** 해석된 경로만 반환 (null = 필터 미적용) */
    public String resolvePath(String project, String logicalRef, String teamHint) {
        return resolve(project, logicalRef, teamHint).resolvedPath();
    }

    public static boolean isConcretePath(String ref) {
        return ref.contains(PATH_SEPARATOR);
    }

    /**
     * 팀 후보 목록 (중복 제거, 순서 유지)
     */
    public static List<String> teamCandidates(String project, String teamHint) {
        if (teamHint != null && !teamHint.isBlank()) {
            return List.of(teamHint);
        }
        Set<String> candidates = new LinkedHashSet<>();
        for (TeamNameStrategy strategy : TeamNameStrategy.values()) {
            strategy.candidate(project).ifPresent(candidates::add);
        }
        return List.copyOf(candidates);
    }

    /** @return 해석 실패 시 null (캐시되지 않음) */
    private ResolvedIteration lookup(String project, String ref, String teamHint) {
        for (String team : teamCandidates(project, teamHint)) {
            List<Iteration> iterations = fetchIterations(project, team);
            if (iterations.isEmpty()) {
                continue;
            }
            Optional<Iteration> selected = select(project, iterations, ref);
            if (selected.isEmpty()) {
                log.warn("[IterationResolver] 일치하는 이터레이션 없음: project={}, ref={}, team={}", project, ref, team);
                return null;
            }
            String path = selected.get().path();
            log.info("[IterationResolver] 해석 완료: project={}, ref={} → {} (team={})", project, ref, path, team);
            return new ResolvedIteration(ref, path, team);
        }
        log.warn("[IterationResolver] 모든 팀 후보 실패, 필터 미적용: project={}, ref={}", project, ref);
        return null;
    }

    private List<Iteration> fetchIterations(String project, String team) {
        try {
            List<Iteration> iterations =
                    client.call(
                            TaskContext.of("Tracker", "iterations", project + "/" + team),
                            () -> trackerSource.getIterations(project, team, null));
            return iterations == null ? List.of() : iterations;
        } catch (UpstreamUnavailableException e) {
            log.warn("[IterationResolver] 팀 후보 실패, 다음 후보 시도: team={}, cause={}", team, e.getMessage());
            return List.of();
        }
    }

    private Optional<Iteration> select(String project, List<Iteration> iterations, String ref) {
        String token = ref.toLowerCase(Locale.ROOT);
        if (CURRENT.equals(token)) {
            OffsetDateTime now = OffsetDateTime.now(clock);
            return iterations.stream()
                    .filter(it -> it.contains(now))
                    .findFirst()
                    .or(() -> mostRecent(iterations));
        }
        if (LATEST.equals(token)) {
            return mostRecent(iterations);
        }
        return IterationNameMatcher.match(
                iterations,
                ref,
                projectMapper.iterationTemplates(project),
                projectMapper.commonIterationTemplates());
    }

    private static Optional<Iteration> mostRecent(List<Iteration> iterations) {
        return iterations.stream()
                .filter(it -> it.startDate() != null)
                .max(Comparator.comparing(Iteration::startDate));
    }
}
