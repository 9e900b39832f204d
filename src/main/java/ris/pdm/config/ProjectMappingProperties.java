package ris.pdm.config;

import jakarta.validation.constraints.NotNull;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 대시보드 프로젝트 ID → 트래커 프로젝트 매핑 및 이터레이션 이름 템플릿
 *
 * <p>키에 공백/하이픈이 포함되므로 YAML에서는 {@code "[Team - Engineering]"} 처럼 대괄호 표기를 사용합니다.
 *
 * <p>템플릿 문법: {@code {n}} 은 스프린트 번호, {@code {n:02d}} 는 2자리 0 패딩 번호
 */
@Validated
@ConfigurationProperties(prefix = "project-mapping")
public class ProjectMappingProperties {

    @NotNull private Map<String, String> projects = new LinkedHashMap<>(defaultProjects());

    /** 프로젝트별 이터레이션 이름 템플릿 (공통 템플릿보다 먼저 시도) */
    @NotNull private Map<String, List<String>> iterationTemplates = new LinkedHashMap<>(defaultTemplates());

    @NotNull
    private List<String> commonIterationTemplates =
            List.of(
                    "Sprint {n}",
                    "Sprint-{n}",
                    "Sprint {n:02d}",
                    "S{n}",
                    "Iteration {n}",
                    "DaaS {n}",
                    "Delivery {n}");

    private static Map<String, String> defaultProjects() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("Product - Data as a Service", "Product - Data as a Service");
        map.put("Product - Supplier Connect", "Product - Supplier Connect");
        map.put("Product - CFG Workflow", "Product - CFG Workflow");
        map.put("Product - New OMS", "Product - New OMS");
        map.put("Team - Product Management", "Product - Partner Management Platform");
        map.put("Team - Engineering", "Product - Partner Management Platform");
        map.put("Team - QA Testing", "Product - Partner Management Platform");
        map.put("Team - DevOps", "Product - Partner Management Platform");
        return map;
    }

    private static Map<String, List<String>> defaultTemplates() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("Product - Data as a Service", List.of("DaaS {n}"));
        map.put("Product - Partner Management Platform", List.of("Delivery {n}", "Sprint {n}"));
        return map;
    }

    public Map<String, String> getProjects() {
        return projects;
    }

    public void setProjects(Map<String, String> projects) {
        this.projects = projects;
    }

    public Map<String, List<String>> getIterationTemplates() {
        return iterationTemplates;
    }

    public void setIterationTemplates(Map<String, List<String>> iterationTemplates) {
        this.iterationTemplates = iterationTemplates;
    }

    public List<String> getCommonIterationTemplates() {
        return commonIterationTemplates;
    }

    public void setCommonIterationTemplates(List<String> commonIterationTemplates) {
        this.commonIterationTemplates = commonIterationTemplates;
    }
}
