package com.workerq;

import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Every query spelling out "pending" uses the same predicate: the row is unfinished and
 * either unclaimed or claimed before {@code staleBefore}.
 */
@Repository
public interface WorkerJobRepository extends JpaRepository<WorkerJob, Long> {

    /**
     * Aggregated lifecycle counters fetched in a single query.
     */
    interface LifecycleCounts {
        Long getPendingCount();

        Long getRunningCount();

        Long getSucceededCount();

        Long getFailedCount();
    }

    @Query("""
            SELECT j FROM WorkerJob j
            WHERE j.finished IS NULL
              AND (j.started IS NULL OR j.started <= :staleBefore)
            ORDER BY j.due ASC, j.id ASC
            """)
    List<WorkerJob> findPending(@Param("staleBefore") OffsetDateTime staleBefore, Pageable pageable);

    @Query("""
            SELECT COUNT(j) FROM WorkerJob j
            WHERE j.finished IS NULL
              AND (j.started IS NULL OR j.started <= :staleBefore)
            """)
    long countPending(@Param("staleBefore") OffsetDateTime staleBefore);

    @Query("""
            SELECT j FROM WorkerJob j
            WHERE j.type = :type
              AND j.ownerId = :ownerId
            ORDER BY j.id ASC
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<WorkerJob> findByTypeAndOwner(@Param("type") String type, @Param("ownerId") int ownerId);

    boolean existsByTypeAndOwnerIdAndIdGreaterThan(String type, int ownerId, Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE WorkerJob j
            SET j.started = :now,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.finished IS NULL
              AND (j.started IS NULL OR j.started <= :staleBefore)
            """)
    int claim(@Param("id") Long id, @Param("now") OffsetDateTime now,
            @Param("staleBefore") OffsetDateTime staleBefore);

    @Query("""
            SELECT j FROM WorkerJob j
            WHERE j.type = :type
              AND j.ownerId = :ownerId
              AND j.finished IS NULL
              AND (j.started IS NULL OR j.started <= :staleBefore)
            ORDER BY j.id ASC
            """)
    List<WorkerJob> findPendingByTypeAndOwner(@Param("type") String type, @Param("ownerId") int ownerId,
            @Param("staleBefore") OffsetDateTime staleBefore);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE WorkerJob j
            SET j.cronSchedule = NULL,
                j.autoRescheduleOnFailure = false,
                j.updatedAt = :now
            WHERE j.type = :type
              AND j.ownerId = :ownerId
              AND j.finished IS NULL
              AND (j.cronSchedule IS NOT NULL OR j.autoRescheduleOnFailure = true)
            """)
    int detachSuccessors(@Param("type") String type, @Param("ownerId") int ownerId,
            @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            DELETE FROM WorkerJob j
            WHERE j.removeAt <= :now
              AND j.started IS NOT NULL
              AND j.finished IS NOT NULL
              AND j.persistent = false
            """)
    int deleteExpired(@Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            DELETE FROM WorkerJob j
            WHERE j.removeAt <= :now
              AND j.started IS NOT NULL
              AND j.finished IS NOT NULL
              AND j.persistent = false
              AND j.id NOT IN :excludedIds
            """)
    int deleteExpiredExcluding(@Param("now") OffsetDateTime now,
            @Param("excludedIds") Collection<Long> excludedIds);

    @Query("""
            SELECT
              COALESCE(SUM(CASE
                WHEN j.finished IS NULL AND (j.started IS NULL OR j.started <= :staleBefore)
                THEN 1 ELSE 0 END), 0) AS pendingCount,
              COALESCE(SUM(CASE
                WHEN j.finished IS NULL AND j.started > :staleBefore
                THEN 1 ELSE 0 END), 0) AS runningCount,
              COALESCE(SUM(CASE
                WHEN j.finished IS NOT NULL AND j.success = true
                THEN 1 ELSE 0 END), 0) AS succeededCount,
              COALESCE(SUM(CASE
                WHEN j.finished IS NOT NULL AND j.success = false
                THEN 1 ELSE 0 END), 0) AS failedCount
            FROM WorkerJob j
            """)
    LifecycleCounts countLifecycleCounts(@Param("staleBefore") OffsetDateTime staleBefore);
}
