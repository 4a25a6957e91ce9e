package com.bookindexer.ingest.service;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.bookindexer.ingest.config.IndexerProperties;
import com.bookindexer.ingest.model.EnqueueResult;
import com.bookindexer.ingest.model.ScheduledJob;
import com.bookindexer.ingest.model.ScrapeJob;
import com.bookindexer.ingest.model.ScrapeRequest;
import com.bookindexer.ingest.repository.ScheduledJobRepository;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Task queue backed by the scheduled_jobs table. The job name is the primary key, so a
 * second insert for the same identity (including one racing in from a concurrent batch)
 * is reported as a duplicate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaTaskQueue implements TaskQueue {

    private final ScheduledJobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final IndexerProperties properties;
    private final MeterRegistry meterRegistry;

    @Override
    public EnqueueResult enqueue(ScrapeJob job) {
        String jobName = job.jobName();
        try {
            if (jobRepository.existsById(jobName)) {
                return duplicate(job);
            }

            ScheduledJob scheduledJob = ScheduledJob.builder()
                    .jobName(jobName)
                    .kind(job.kind())
                    .targetId(job.targetId())
                    .payload(toPayload(job))
                    .build();
            jobRepository.saveAndFlush(scheduledJob);

            String handle = properties.getTasks().getQueueName() + "/jobs/" + jobName;
            log.info("Scheduled job {}", handle);
            incrementCounter("indexer.tasks.enqueued", job);
            return EnqueueResult.scheduled(jobName, handle);

        } catch (DataIntegrityViolationException e) {
            // A concurrent batch inserted the same identity between the check and the insert
            log.debug("Lost insert race for job {}", jobName);
            return duplicate(job);
        } catch (DataAccessException e) {
            log.error("Failed to enqueue job {}: {}", jobName, e.getMessage());
            throw new TaskQueueException("Failed to enqueue job " + jobName, e);
        }
    }

    @Override
    public boolean isReady() {
        try {
            jobRepository.countByStatus(ScheduledJob.JobStatus.PENDING);
            return true;
        } catch (DataAccessException e) {
            log.error("Job queue not reachable for readiness check: {}", e.getMessage());
            return false;
        }
    }

    private EnqueueResult duplicate(ScrapeJob job) {
        log.info("Job {} already exists, not scheduling again", job.jobName());
        incrementCounter("indexer.tasks.duplicate", job);
        return EnqueueResult.duplicate(job.jobName());
    }

    private String toPayload(ScrapeJob job) {
        try {
            return objectMapper.writeValueAsString(ScrapeRequest.of(job, properties.getTasks()));
        } catch (JacksonException e) {
            throw new TaskQueueException("Failed to serialize payload for job " + job.jobName(), e);
        }
    }

    private void incrementCounter(String name, ScrapeJob job) {
        Counter.builder(name)
                .tag("kind", job.kind().name())
                .register(meterRegistry)
                .increment();
    }
}
