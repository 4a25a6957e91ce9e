package com.bookindexer.ingest.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.bookindexer.ingest.model.ScheduledJob;

@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, String> {

    @Query("SELECT j FROM ScheduledJob j WHERE j.status = :status ORDER BY j.createdAt ASC")
    List<ScheduledJob> findOldestByStatus(ScheduledJob.JobStatus status, Pageable pageable);

    long countByStatus(ScheduledJob.JobStatus status);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("DELETE FROM ScheduledJob j WHERE j.status <> :pending AND j.updatedAt < :cutoff")
    int deleteFinishedBefore(ScheduledJob.JobStatus pending, Instant cutoff);
}
