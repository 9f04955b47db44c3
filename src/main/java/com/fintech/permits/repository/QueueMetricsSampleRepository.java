package com.fintech.permits.repository;

import com.fintech.permits.dto.QueueMetricsAggregate;
import com.fintech.permits.entity.QueueMetricsSample;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface QueueMetricsSampleRepository extends JpaRepository<QueueMetricsSample, Long> {

    @Query("SELECT new com.fintech.permits.dto.QueueMetricsAggregate(" +
            "COUNT(s), AVG(s.queueLength), MAX(s.queueLength), AVG(s.activeJobs), " +
            "AVG(s.avgWaitMs), AVG(s.avgProcessingMs)) " +
            "FROM QueueMetricsSample s WHERE s.createdAt >= :since")
    QueueMetricsAggregate aggregateSince(@Param("since") LocalDateTime since);

    Optional<QueueMetricsSample> findFirstByCreatedAtGreaterThanEqualOrderByCreatedAtAscIdAsc(LocalDateTime since);

    Optional<QueueMetricsSample> findFirstByOrderByCreatedAtDescIdDesc();

    Optional<QueueMetricsSample> findFirstByCreatedAtLessThanOrderByCreatedAtDescIdDesc(LocalDateTime before);

    @Modifying
    @Transactional
    @Query("DELETE FROM QueueMetricsSample s WHERE s.createdAt < :before")
    int deleteOlderThan(@Param("before") LocalDateTime before);
}
