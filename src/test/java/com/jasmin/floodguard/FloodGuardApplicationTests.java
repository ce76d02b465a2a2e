package com.jasmin.floodguard;

import com.jasmin.floodguard.config.SchedulingProperties;
import com.jasmin.floodguard.models.DetectionVerdict;
import com.jasmin.floodguard.models.MitigationAction;
import com.jasmin.floodguard.models.SourceRecord;
import com.jasmin.floodguard.models.ThreatEntry;
import com.jasmin.floodguard.scheduling.EvaluationScheduler;
import com.jasmin.floodguard.services.FloodGuardService;
import com.jasmin.floodguard.services.mitigation.MitigationService;
import com.jasmin.floodguard.services.sourcestate.SourceStateCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class FloodGuardApplicationTests {

	private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

	@TestConfiguration
	static class FixedClockConfig {
		@Bean
		@Primary
		Clock fixedClock() {
			return Clock.fixed(NOW, ZoneOffset.UTC);
		}
	}

	@MockBean
	private StringRedisTemplate redisTemplate;

	@Autowired
	private ApplicationContext context;

	@Autowired
	private FloodGuardService floodGuardService;

	@Autowired
	private MitigationService mitigationService;

	@Autowired
	private SourceStateCache sourceStateCache;

	@Autowired
	private SchedulingProperties schedulingProperties;

	@Mock
	private ValueOperations<String, String> valueOps;

	@Mock
	private ZSetOperations<String, String> zSetOps;

	@BeforeEach
	void setUp() {
		floodGuardService.reset();
	}

	@Test
	void bindsTestProfileAndLeavesSchedulingOff() {
		assertThat(sourceStateCache.capacity()).isEqualTo(5);
		assertThat(schedulingProperties.isEnabled()).isFalse();
		assertThat(context.getBeansOfType(EvaluationScheduler.class)).isEmpty();
	}

	@Test
	void detectsAndBlocksFloodEndToEnd() {
		when(redisTemplate.opsForValue()).thenReturn(valueOps);
		when(redisTemplate.opsForZSet()).thenReturn(zSetOps);

		for (int i = 0; i < 300; i++) {
			floodGuardService.ingest("203.0.113.7", NOW.minusMillis(1_000 + i));
		}
		floodGuardService.ingest("198.51.100.1", NOW.minusSeconds(2));
		floodGuardService.ingest("198.51.100.2", NOW.minusSeconds(2));

		List<ThreatEntry> queued = floodGuardService.evaluate(NOW);
		List<DetectionVerdict> verdicts = mitigationService.drainAndMitigate();

		assertThat(queued).extracting(ThreatEntry::getSourceKey).containsExactly("203.0.113.7");
		assertThat(verdicts).extracting(DetectionVerdict::getAction).containsExactly(MitigationAction.BLOCK);
		verify(valueOps).set(eq("fg:block:203.0.113.7"), any(String.class), any(Duration.class));
		verify(zSetOps).add(eq("fg:blocked"), eq("203.0.113.7"), anyDouble());
		assertThat(floodGuardService.topOffenders(1)).extracting(SourceRecord::getKey).containsExactly("203.0.113.7");
		assertThat(floodGuardService.history(Duration.ofMinutes(1))).hasSize(1);
	}
}
