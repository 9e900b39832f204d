package ris.pdm.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import ris.pdm.global.response.ApiResponse;
import ris.pdm.service.iteration.IterationResolver;
import ris.pdm.service.iteration.ResolvedIteration;
import ris.pdm.service.project.ProjectMapper;

/** 이터레이션 경로 해석 API (경로를 찾지 못하면 resolvedPath = null) */
@RestController
@RequestMapping("/api/iterations")
@RequiredArgsConstructor
public class IterationController {

    private final IterationResolver iterationResolver;
    private final ProjectMapper projectMapper;

    @GetMapping("/resolve")
    public ResponseEntity<ApiResponse<ResolvedIteration>> resolve(
            @RequestParam String project,
            @RequestParam(defaultValue = IterationResolver.CURRENT) String ref,
            @RequestParam(required = false) String team) {
        String trackerProject = projectMapper.toTrackerProject(project);
        return ResponseEntity.ok(ApiResponse.success(iterationResolver.resolve(trackerProject, ref, team)));
    }
}
