package com.outbound.routing.adapters.out.redis;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import com.outbound.routing.application.port.out.SweepCheckpointStore;
import com.outbound.routing.bootstrap.config.RoutingProperties;

/**
 * Keeps the reconciliation sweep's keyset cursor in Redis so an interrupted
 * sweep resumes where it stopped, even on another instance.
 */
@Component
public class RedisSweepCheckpointStore implements SweepCheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSweepCheckpointStore.class);

    private final StringRedisTemplate redisTemplate;
    private final String cursorKey;
    private final long ttlHours;

    public RedisSweepCheckpointStore(StringRedisTemplate redisTemplate, RoutingProperties routingProperties) {
        this.redisTemplate = redisTemplate;
        this.cursorKey = routingProperties.getRedis().getSweepCursorKey();
        this.ttlHours = routingProperties.getRedis().getSweepCursorTtlHours();
    }

    @Override
    public Optional<String> loadCursor() {
        String cursor = redisTemplate.opsForValue().get(cursorKey);
        if (cursor != null) {
            log.debug("action=sweep_cursor_loaded cursor={}", cursor);
        }
        return Optional.ofNullable(cursor);
    }

    @Override
    public void saveCursor(String lastLeadId) {
        redisTemplate.opsForValue().set(cursorKey, lastLeadId, ttlHours, TimeUnit.HOURS);
        log.debug("action=sweep_cursor_saved cursor={}", lastLeadId);
    }

    @Override
    public void clear() {
        redisTemplate.delete(cursorKey);
        log.debug("action=sweep_cursor_cleared");
    }
}
