package ris.pdm.service.project;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import ris.pdm.config.ProjectMappingProperties;

/**
 * 대시보드 프로젝트 ID → 트래커 프로젝트 이름 변환
 *
 * <p>매핑되지 않은 ID는 그대로 트래커 프로젝트 이름으로 사용합니다.
 */
@Component
@RequiredArgsConstructor
public class ProjectMapper {

    private final ProjectMappingProperties properties;

    public String toTrackerProject(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            return projectId;
        }
        return properties.getProjects().getOrDefault(projectId, projectId);
    }

    /** 프로젝트 전용 이터레이션 이름 템플릿 (없으면 빈 목록) */
    public List<String> iterationTemplates(String trackerProject) {
        return properties.getIterationTemplates().getOrDefault(trackerProject, List.of());
    }

    public List<String> commonIterationTemplates() {
        return properties.getCommonIterationTemplates();
    }
}
