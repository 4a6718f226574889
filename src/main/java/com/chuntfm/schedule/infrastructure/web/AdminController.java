package com.chuntfm.schedule.infrastructure.web;

import com.chuntfm.schedule.application.RefreshScheduleCache;
import com.chuntfm.schedule.domain.model.RefreshResult;
import com.chuntfm.schedule.infrastructure.cache.CacheStats;
import com.chuntfm.schedule.infrastructure.cache.RefreshCoordinator;
import com.chuntfm.schedule.infrastructure.web.dto.CacheRefreshResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final RefreshScheduleCache refreshScheduleCache;
    private final RefreshCoordinator refreshCoordinator;

    public AdminController(RefreshScheduleCache refreshScheduleCache, RefreshCoordinator refreshCoordinator) {
        this.refreshScheduleCache = refreshScheduleCache;
        this.refreshCoordinator = refreshCoordinator;
    }

    @PostMapping("/refresh-cache")
    public ResponseEntity<CacheRefreshResponse> refreshCache() {
        RefreshResult result = refreshScheduleCache.execute();
        return ResponseEntity.ok(CacheRefreshResponse.fromResult(result));
    }

    @GetMapping("/cache-stats")
    public ResponseEntity<CacheStats> cacheStats() {
        CacheStats stats = refreshCoordinator.getStats();
        logger.debug("Cache stats: {}", stats.summary());
        return ResponseEntity.ok(stats);
    }
}
