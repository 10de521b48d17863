package com.grc.riskengine.persistence.repository;

import com.grc.riskengine.domain.EventStatus;
import com.grc.riskengine.persistence.entity.RiskUpdateEventEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Event queue. State changes are conditional updates so an event is claimed and
 * completed at most once even when two processors race.
 */
@Repository
public interface RiskUpdateEventRepository extends JpaRepository<RiskUpdateEventEntity, String> {

    @Query("SELECT e FROM RiskUpdateEventEntity e WHERE e.status = :status " +
            "ORDER BY e.priorityRank ASC, e.timestamp ASC")
    List<RiskUpdateEventEntity> findNextBatch(@Param("status") EventStatus status, Pageable pageable);

    @Modifying
    @Query("UPDATE RiskUpdateEventEntity e SET e.status = :processing, e.processingStartedAt = :now, " +
            "e.attempts = e.attempts + 1 WHERE e.eventId = :eventId AND e.status = :pending AND e.processed = false")
    int claim(@Param("eventId") String eventId,
              @Param("pending") EventStatus pending,
              @Param("processing") EventStatus processing,
              @Param("now") Instant now);

    @Modifying
    @Query("UPDATE RiskUpdateEventEntity e SET e.status = :status, e.processed = true, " +
            "e.processingCompletedAt = :now, e.error = :error " +
            "WHERE e.eventId = :eventId AND e.status = :processing AND e.processed = false")
    int markProcessed(@Param("eventId") String eventId,
                      @Param("processing") EventStatus processing,
                      @Param("status") EventStatus status,
                      @Param("error") String error,
                      @Param("now") Instant now);

    @Modifying
    @Query("UPDATE RiskUpdateEventEntity e SET e.status = :pending, e.error = :error " +
            "WHERE e.eventId = :eventId AND e.processed = false")
    int releaseForRetry(@Param("eventId") String eventId,
                        @Param("pending") EventStatus pending,
                        @Param("error") String error);

    List<RiskUpdateEventEntity> findByStatusAndProcessingStartedAtBefore(EventStatus status, Instant cutoff);

    List<RiskUpdateEventEntity> findByTimestampGreaterThanEqual(Instant since);

    long countByStatus(EventStatus status);
}
