package com.jasmin.floodguard.services;

import com.jasmin.floodguard.services.mitigation.MitigationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Redis-backed block list. Entries expire on their own; failures are logged and treated as "not blocked".
 * <p>
 * Next to each TTL key the source is indexed in a sorted set scored by its expiry, so the
 * number of active blocks is read with ZCARD instead of scanning the keyspace.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlockListService {

    private final StringRedisTemplate redisTemplate;
    private final MitigationProperties props;
    private final Clock clock;

    public void block(String sourceKey, String reason, Duration ttl) {
        try {
            long expiresAt = clock.millis() + ttl.toMillis();
            String indexKey = KeyManager.getBlockIndexKey(props.getKeyPrefix());

            redisTemplate.opsForValue().set(KeyManager.getBlockKey(props.getKeyPrefix(), sourceKey), reason, ttl);
            redisTemplate.opsForZSet().add(indexKey, sourceKey, expiresAt);
            redisTemplate.expire(indexKey, ttl);
        } catch (Exception e) {
            log.error("Error blocking source: {} {}", sourceKey, reason, e);
        }
    }

    public boolean isBlocked(String sourceKey) {
        try {
            Boolean exists = redisTemplate.hasKey(KeyManager.getBlockKey(props.getKeyPrefix(), sourceKey));
            return Boolean.TRUE.equals(exists);
        } catch (Exception e) {
            log.error("Error checking block list: {}", sourceKey, e);
            return false;
        }
    }

    public void unblock(String sourceKey) {
        try {
            redisTemplate.delete(KeyManager.getBlockKey(props.getKeyPrefix(), sourceKey));
            redisTemplate.opsForZSet().remove(KeyManager.getBlockIndexKey(props.getKeyPrefix()), sourceKey);
        } catch (Exception e) {
            log.error("Error unblocking source: {}", sourceKey, e);
        }
    }

    /** Active blocks: expired index members are trimmed first, then counted. */
    public long countBlocked() {
        try {
            String indexKey = KeyManager.getBlockIndexKey(props.getKeyPrefix());
            redisTemplate.opsForZSet().removeRangeByScore(indexKey, Double.NEGATIVE_INFINITY, clock.millis());
            Long count = redisTemplate.opsForZSet().zCard(indexKey);
            return count == null ? 0L : count;
        } catch (Exception e) {
            log.error("Error counting blocked sources", e);
            return 0L;
        }
    }
}
