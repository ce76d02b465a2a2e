package com.jasmin.floodguard.services;

import com.jasmin.floodguard.services.mitigation.MitigationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BlockListServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private ValueOperations<String, String> valueOps;

    @Mock
    private ZSetOperations<String, String> zSetOps;

    private BlockListService blockList;

    @BeforeEach
    void setUp() {
        blockList = new BlockListService(redis, new MitigationProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void blockWritesKeyWithTtlAndIndexesExpiry() {
        when(redis.opsForValue()).thenReturn(valueOps);
        when(redis.opsForZSet()).thenReturn(zSetOps);

        blockList.block("10.0.0.1", "Threat score: 0.93", Duration.ofMinutes(10));

        verify(valueOps).set("fg:block:10.0.0.1", "Threat score: 0.93", Duration.ofMinutes(10));
        verify(zSetOps).add("fg:blocked", "10.0.0.1", NOW.plusSeconds(600).toEpochMilli());
        verify(redis).expire("fg:blocked", Duration.ofMinutes(10));
    }

    @Test
    void isBlockedReadsKeyPresence() {
        when(redis.hasKey("fg:block:10.0.0.1")).thenReturn(true);
        when(redis.hasKey("fg:block:10.0.0.2")).thenReturn(false);

        assertThat(blockList.isBlocked("10.0.0.1")).isTrue();
        assertThat(blockList.isBlocked("10.0.0.2")).isFalse();
    }

    @Test
    void redisOutageIsTreatedAsNotBlocked() {
        when(redis.hasKey(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(blockList.isBlocked("10.0.0.1")).isFalse();
    }

    @Test
    void blockSurvivesRedisOutage() {
        when(redis.opsForValue()).thenThrow(new RedisConnectionFailureException("connection refused"));

        blockList.block("10.0.0.1", "reason", Duration.ofMinutes(1));
    }

    @Test
    void unblockDeletesKeyAndIndexEntry() {
        when(redis.opsForZSet()).thenReturn(zSetOps);

        blockList.unblock("10.0.0.1");

        verify(redis).delete("fg:block:10.0.0.1");
        verify(zSetOps).remove("fg:blocked", "10.0.0.1");
    }

    @Test
    void countTrimsExpiredEntriesThenReadsIndexSize() {
        when(redis.opsForZSet()).thenReturn(zSetOps);
        when(zSetOps.zCard("fg:blocked")).thenReturn(2L);

        assertThat(blockList.countBlocked()).isEqualTo(2L);

        verify(zSetOps).removeRangeByScore("fg:blocked", Double.NEGATIVE_INFINITY, (double) NOW.toEpochMilli());
        verify(redis, never()).keys(anyString());
    }

    @Test
    void countIsZeroWhenRedisIsDown() {
        when(redis.opsForZSet()).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(blockList.countBlocked()).isZero();
    }
}
