package ris.pdm.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ris.pdm.controller.dto.CacheInvalidationResponse;
import ris.pdm.global.cache.CacheStats;
import ris.pdm.global.response.ApiResponse;
import ris.pdm.service.cache.CacheAdminService;

/**
 * 캐시 관리 API
 *
 * <p>엔드포인트:
 *
 * <ul>
 *   <li>GET /api/admin/cache/stats - 통계 및 백엔드 상태
 *   <li>DELETE /api/admin/cache/{namespace} - 네임스페이스 무효화
 *   <li>DELETE /api/admin/cache - 전체 삭제
 * </ul>
 */
@RestController
@RequestMapping("/api/admin/cache")
@RequiredArgsConstructor
public class CacheAdminController {

    private final CacheAdminService cacheAdminService;

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<CacheStats>> getStats() {
        return ResponseEntity.ok(ApiResponse.success(cacheAdminService.getCacheStats()));
    }

    @DeleteMapping("/{namespace}")
    public ResponseEntity<ApiResponse<CacheInvalidationResponse>> invalidate(@PathVariable String namespace) {
        long removed = cacheAdminService.invalidateNamespace(namespace);
        return ResponseEntity.ok(ApiResponse.success(new CacheInvalidationResponse(namespace, removed)));
    }

    @DeleteMapping
    public ResponseEntity<ApiResponse<CacheInvalidationResponse>> clearAll() {
        long removed = cacheAdminService.clearAll();
        return ResponseEntity.ok(ApiResponse.success(new CacheInvalidationResponse("*", removed)));
    }
}
