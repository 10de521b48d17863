package com.grc.riskengine.dedup;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.persistence.entity.RiskEntity;
import com.grc.riskengine.persistence.repository.RiskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.serializer.SerializationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DedupeKeyCache with mocked Redis and database.
 */
@ExtendWith(MockitoExtension.class)
class DedupeKeyCacheTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private RedisTemplate<String, DedupeRecord> redisTemplate;

    @Mock
    private ValueOperations<String, DedupeRecord> valueOps;

    @Mock
    private RiskRepository riskRepository;

    private DedupeKeyCache cache;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOps);
        cache = new DedupeKeyCache(redisTemplate, riskRepository, new RiskEngineProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void findReturnsRedisHitWithinWindow() {
        DedupeRecord cached = DedupeRecord.builder().dedupeKey("k1").riskId(5L).createdAt(NOW.minusSeconds(3600)).build();
        when(valueOps.get("risk:dedupe:k1")).thenReturn(cached);

        Optional<DedupeRecord> result = cache.find("k1");

        assertThat(result).contains(cached);
        verifyNoInteractions(riskRepository);
    }

    @Test
    void findIgnoresRedisEntryOlderThanWindow() {
        DedupeRecord stale = DedupeRecord.builder().dedupeKey("k2").riskId(5L).createdAt(NOW.minus(Duration.ofHours(30))).build();
        when(valueOps.get("risk:dedupe:k2")).thenReturn(stale);
        when(riskRepository.findFirstByDedupeKeyAndCreatedAtAfterOrderByCreatedAtDesc(eq("k2"), any())).thenReturn(Optional.empty());

        assertThat(cache.find("k2")).isEmpty();
    }

    @Test
    void findFallsBackToDatabaseAndWarmsCache() {
        when(valueOps.get("risk:dedupe:k3")).thenReturn(null);
        RiskEntity risk = RiskEntity.builder().id(8L).dedupeKey("k3").createdAt(NOW.minusSeconds(600)).build();
        when(riskRepository.findFirstByDedupeKeyAndCreatedAtAfterOrderByCreatedAtDesc("k3", NOW.minus(Duration.ofHours(24))))
                .thenReturn(Optional.of(risk));

        Optional<DedupeRecord> result = cache.find("k3");

        assertThat(result).isPresent();
        assertThat(result.get().getRiskId()).isEqualTo(8L);
        verify(valueOps).set(eq("risk:dedupe:k3"), any(DedupeRecord.class), eq(Duration.ofHours(24).minusSeconds(600)));
    }

    @Test
    void unreadableRedisEntryFallsBackToDatabase() {
        when(valueOps.get("risk:dedupe:k4")).thenThrow(new SerializationException("bad bytes"));
        when(riskRepository.findFirstByDedupeKeyAndCreatedAtAfterOrderByCreatedAtDesc(eq("k4"), any())).thenReturn(Optional.empty());

        assertThat(cache.find("k4")).isEmpty();
    }

    @Test
    void redisAndDatabaseDownIsAMiss() {
        when(valueOps.get("risk:dedupe:k5")).thenThrow(new RuntimeException("Connection refused"));
        when(riskRepository.findFirstByDedupeKeyAndCreatedAtAfterOrderByCreatedAtDesc(eq("k5"), any()))
                .thenThrow(new RuntimeException("Database unavailable"));

        assertThat(cache.find("k5")).isEmpty();
    }

    @Test
    void storeUsesRemainingWindowAsTtl() {
        DedupeRecord record = DedupeRecord.builder().dedupeKey("k6").riskId(1L).createdAt(NOW.minus(Duration.ofHours(4))).build();

        cache.store(record);

        verify(valueOps).set("risk:dedupe:k6", record, Duration.ofHours(20));
    }

    @Test
    void storeSkipsRecordsPastTheWindow() {
        DedupeRecord record = DedupeRecord.builder().dedupeKey("k7").riskId(1L).createdAt(NOW.minus(Duration.ofHours(25))).build();

        cache.store(record);

        verify(valueOps, never()).set(any(), any(), any(Duration.class));
    }

    @Test
    void storeSwallowsRedisFailure() {
        DedupeRecord record = DedupeRecord.builder().dedupeKey("k8").riskId(1L).createdAt(NOW).build();
        doThrow(new RuntimeException("Connection refused")).when(valueOps).set(eq("risk:dedupe:k8"), eq(record), any(Duration.class));

        cache.store(record);

        verify(valueOps).set(eq("risk:dedupe:k8"), eq(record), any(Duration.class));
    }
}
