package com.grc.riskengine.dedup;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.persistence.entity.RiskEntity;
import com.grc.riskengine.persistence.repository.RiskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Exact-duplicate lookup for dedupe keys. Redis is the fast path, the risks table the
 * source of truth. If both are unavailable the lookup reports a miss (fail-open: the
 * signal becomes a new risk rather than being dropped).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DedupeKeyCache {

    private static final String KEY_PREFIX = "risk:dedupe:";

    private final RedisTemplate<String, DedupeRecord> redisTemplate;
    private final RiskRepository riskRepository;
    private final RiskEngineProperties properties;
    private final Clock clock;

    public Optional<DedupeRecord> find(String dedupeKey) {
        Duration window = properties.getDedupe().getExactWindow();
        Instant since = Instant.now(clock).minus(window);
        String key = KEY_PREFIX + dedupeKey;
        try {
            DedupeRecord cached = redisTemplate.opsForValue().get(key);
            if (cached != null && (cached.getCreatedAt() == null || cached.getCreatedAt().isAfter(since))) {
                log.debug("Dedupe hit in Redis for key={}", dedupeKey);
                return Optional.of(cached);
            }
        } catch (SerializationException e) {
            log.error("Dedupe cache entry for key={} cannot be read, falling back to database", dedupeKey, e);
        } catch (Exception e) {
            log.warn("Dedupe cache read failed for key={} (Redis unavailable), falling back to database: {}",
                    dedupeKey, e.getMessage());
        }

        try {
            Optional<RiskEntity> existing = riskRepository.findFirstByDedupeKeyAndCreatedAtAfterOrderByCreatedAtDesc(dedupeKey, since);
            if (existing.isPresent()) {
                DedupeRecord record = toRecord(existing.get());
                log.debug("Dedupe hit in database for key={}, riskId={}", dedupeKey, record.getRiskId());
                store(record);
                return Optional.of(record);
            }
        } catch (Exception e) {
            log.error("Database dedupe check failed for key={}: {}", dedupeKey, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Caches the key until the exact-duplicate window after creation closes.
     */
    public void store(DedupeRecord record) {
        Duration window = properties.getDedupe().getExactWindow();
        Instant createdAt = record.getCreatedAt() != null ? record.getCreatedAt() : Instant.now(clock);
        Duration ttl = Duration.between(Instant.now(clock), createdAt.plus(window));
        if (ttl.isNegative() || ttl.isZero()) return;
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + record.getDedupeKey(), record, ttl);
            log.debug("Stored dedupe key={} riskId={}", record.getDedupeKey(), record.getRiskId());
        } catch (Exception e) {
            log.warn("Could not cache dedupe key={} in Redis: {}", record.getDedupeKey(), e.getMessage());
        }
    }

    private static DedupeRecord toRecord(RiskEntity risk) {
        return DedupeRecord.builder()
                .dedupeKey(risk.getDedupeKey())
                .riskId(risk.getId())
                .createdAt(risk.getCreatedAt())
                .build();
    }
}
