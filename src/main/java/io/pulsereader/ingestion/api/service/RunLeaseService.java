package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.api.exception.ErrorCode;
import io.pulsereader.ingestion.api.exception.IngestionException;
import io.pulsereader.ingestion.config.IngestionConfig;
import io.pulsereader.ingestion.config.LeaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Keeps runs from overlapping. The lease is a Redis key holding the run id,
 * with a TTL so a crashed run cannot block ingestion forever.
 */
@Service
public class RunLeaseService {

    private static final Logger logger = LoggerFactory.getLogger(RunLeaseService.class);

    // delete only if the lease still belongs to this run
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            else
                return 0
            end""", Long.class);

    private final LeaseConfig config;
    private final RedisTemplate<String, String> redisTemplate;

    public RunLeaseService(IngestionConfig ingestionConfig,
                           @Qualifier("leaseRedisTemplate") ObjectProvider<RedisTemplate<String, String>> redisTemplate) {
        this.config = ingestionConfig.lease();
        this.redisTemplate = config.enabled() ? redisTemplate.getIfAvailable() : null;
    }

    public boolean isEnabled() {
        return redisTemplate != null;
    }

    /**
     * @throws IngestionException RUN_IN_PROGRESS when another run holds the lease,
     *                            STORAGE_UNAVAILABLE when the lease store cannot be reached
     */
    public void acquire(String runId) {
        if (!isEnabled()) {
            return;
        }

        Boolean acquired;
        try {
            acquired = redisTemplate.opsForValue().setIfAbsent(config.key(), runId, config.ttl());
        } catch (DataAccessException e) {
            throw new IngestionException("Run lease store unavailable", e, ErrorCode.STORAGE_UNAVAILABLE);
        }

        if (!Boolean.TRUE.equals(acquired)) {
            logger.warn("Run {} rejected: another run holds the lease", runId);
            throw new IngestionException("Another ingestion run is in progress", ErrorCode.RUN_IN_PROGRESS);
        }
        logger.debug("Run {} acquired lease {} for {}", runId, config.key(), config.ttl());
    }

    public void release(String runId) {
        if (!isEnabled()) {
            return;
        }

        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(config.key()), runId);
            if (deleted == null || deleted == 0L) {
                logger.warn("Lease for run {} had already expired or changed hands", runId);
            }
        } catch (DataAccessException e) {
            logger.warn("Failed to release lease for run {}, it will expire after {}: {}",
                    runId, config.ttl(), e.getMessage());
        }
    }
}
