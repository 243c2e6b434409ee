package com.company.errorbudget.cache;

import com.company.errorbudget.domain.BurnRateSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Last completed snapshot per (service, SLO), written through on every evaluation
 * so release checks read last-known-good state without touching the database.
 * One Redis hash per service, keyed by SLO target id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedisSnapshotCache {

    private static final String LATEST_SNAPSHOT_HASH = "eb:snapshot:latest:";
    private static final Duration TTL = Duration.ofHours(2);

    private final RedisTemplate<String, Object> redisTemplate;

    public void put(BurnRateSnapshot snapshot) {
        try {
            String key = LATEST_SNAPSHOT_HASH + snapshot.getServiceId();
            redisTemplate.opsForHash().put(key, String.valueOf(snapshot.getSloTargetId()), snapshot);
            redisTemplate.expire(key, TTL);
            log.debug("Cached snapshot for service {} target {}", snapshot.getServiceId(), snapshot.getSloTargetId());
        } catch (Exception e) {
            // Non-fatal: readers fall back to the database
            log.warn("Failed to cache snapshot for service {}: {}", snapshot.getServiceId(), e.getMessage());
        }
    }

    /**
     * Returns empty on miss or Redis failure; callers then query the database.
     */
    public Optional<List<BurnRateSnapshot>> getLatest(Long serviceId) {
        try {
            Map<Object, Object> entries = redisTemplate.opsForHash().entries(LATEST_SNAPSHOT_HASH + serviceId);
            if (entries == null || entries.isEmpty()) {
                return Optional.empty();
            }

            List<BurnRateSnapshot> result = new ArrayList<>();
            for (Object value : entries.values()) {
                if (value instanceof BurnRateSnapshot) {
                    result.add((BurnRateSnapshot) value);
                }
            }
            return result.isEmpty() ? Optional.empty() : Optional.of(result);

        } catch (Exception e) {
            log.warn("Failed to read cached snapshots for service {}: {}", serviceId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Drops cached state of a target that was deactivated or redefined.
     */
    public void evictTarget(Long serviceId, Long sloTargetId) {
        try {
            redisTemplate.opsForHash().delete(LATEST_SNAPSHOT_HASH + serviceId, String.valueOf(sloTargetId));
        } catch (Exception e) {
            log.warn("Failed to evict cached snapshot for service {} target {}: {}",
                    serviceId, sloTargetId, e.getMessage());
        }
    }

    public void evictService(Long serviceId) {
        try {
            redisTemplate.delete(LATEST_SNAPSHOT_HASH + serviceId);
        } catch (Exception e) {
            log.warn("Failed to evict cached snapshots for service {}: {}", serviceId, e.getMessage());
        }
    }
}
