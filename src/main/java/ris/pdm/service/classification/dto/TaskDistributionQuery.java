package ris.pdm.service.classification.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param iterationPath 논리 참조({@code current} 등) 또는 구체 경로. null이면 전체
 */
public record TaskDistributionQuery(String projectName, String iterationPath) {

    public Map<String, Object> toCacheParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("iterationPath", iterationPath);
        return params;
    }
}
