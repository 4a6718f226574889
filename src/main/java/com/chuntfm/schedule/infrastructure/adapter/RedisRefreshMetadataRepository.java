package com.chuntfm.schedule.infrastructure.adapter;

import com.chuntfm.schedule.domain.port.out.RefreshMetadataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Publishes the outcome of snapshot rebuilds to Redis for operators.
 * Writes run on the async executor so a slow or absent Redis never delays a rebuild.
 */
@Repository
public class RedisRefreshMetadataRepository implements RefreshMetadataService {

    private static final Logger logger = LoggerFactory.getLogger(RedisRefreshMetadataRepository.class);

    static final String LAST_REFRESH_KEY = "chuntfm:cache:last_refresh";
    static final String REFRESH_STATUS_KEY = "chuntfm:cache:status";
    static final String ENTRY_COUNT_KEY = "chuntfm:cache:entry_count";
    static final String LAST_FAILURE_KEY = "chuntfm:cache:last_failure";
    private static final long METADATA_TTL_HOURS = 24;

    private final StringRedisTemplate redisTemplate;

    public RedisRefreshMetadataRepository(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    @Async("asyncExecutor")
    public void recordRefresh(Instant takenAt, int entryCount) {
        try {
            redisTemplate.opsForValue().set(LAST_REFRESH_KEY, takenAt.toString(), METADATA_TTL_HOURS, TimeUnit.HOURS);
            redisTemplate.opsForValue().set(ENTRY_COUNT_KEY, String.valueOf(entryCount), METADATA_TTL_HOURS, TimeUnit.HOURS);
            redisTemplate.opsForValue().set(REFRESH_STATUS_KEY, "OK", METADATA_TTL_HOURS, TimeUnit.HOURS);
            logger.debug("Recorded refresh at {} with {} entries", takenAt, entryCount);
        } catch (Exception e) {
            logger.error("Failed to record refresh metadata", e);
        }
    }

    @Override
    @Async("asyncExecutor")
    public void recordFailure(Instant attemptedAt, String reason) {
        try {
            redisTemplate.opsForValue().set(REFRESH_STATUS_KEY, "FAILED", METADATA_TTL_HOURS, TimeUnit.HOURS);
            redisTemplate.opsForValue().set(LAST_FAILURE_KEY, attemptedAt + " " + reason, METADATA_TTL_HOURS, TimeUnit.HOURS);
            logger.debug("Recorded refresh failure at {}: {}", attemptedAt, reason);
        } catch (Exception e) {
            logger.error("Failed to record refresh failure", e);
        }
    }
}
