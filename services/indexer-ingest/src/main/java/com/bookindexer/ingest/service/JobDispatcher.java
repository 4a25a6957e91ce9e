package com.bookindexer.ingest.service;

import java.time.Instant;
import java.util.List;

import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import com.bookindexer.ingest.client.ScraperClient;
import com.bookindexer.ingest.config.IndexerProperties;
import com.bookindexer.ingest.model.ScheduledJob;
import com.bookindexer.ingest.model.ScheduledJob.JobStatus;
import com.bookindexer.ingest.repository.ScheduledJobRepository;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drains the scheduled_jobs table into the scraper.
 *
 * Pending jobs are sent oldest first. A failed send leaves the job pending for the next poll
 * until it has used up its attempts, after which it is parked as FAILED. Finished jobs are
 * purged after the retention window, which also frees their identity for rescheduling.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobDispatcher {

    private final ScheduledJobRepository jobRepository;
    private final ScraperClient scraperClient;
    private final IndexerProperties properties;
    private final MeterRegistry meterRegistry;

    @Scheduled(fixedDelayString = "${indexer.tasks.dispatcher.poll-interval-ms:5000}",
            initialDelayString = "${indexer.tasks.dispatcher.initial-delay-ms:10000}")
    public void scheduledDispatch() {
        if (!properties.getTasks().getDispatcher().isEnabled()) {
            return;
        }
        try {
            dispatchPending();
        } catch (Exception e) {
            log.error("Job dispatch cycle failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Sends one page of pending jobs. Returns how many were accepted by the scraper.
     */
    public int dispatchPending() {
        IndexerProperties.Tasks.Dispatcher settings = properties.getTasks().getDispatcher();
        List<ScheduledJob> jobs = jobRepository.findOldestByStatus(
                JobStatus.PENDING, PageRequest.of(0, settings.getBatchSize()));

        if (jobs.isEmpty()) {
            return 0;
        }

        log.debug("Dispatching {} pending jobs", jobs.size());
        int dispatched = 0;
        for (ScheduledJob job : jobs) {
            if (dispatch(job, settings.getMaxAttempts())) {
                dispatched++;
            }
        }
        return dispatched;
    }

    @Scheduled(cron = "${indexer.tasks.dispatcher.purge-cron:0 30 3 * * *}", zone = "UTC")
    public int purgeFinished() {
        Instant cutoff = Instant.now().minus(properties.getTasks().getDispatcher().getRetention());
        int purged = jobRepository.deleteFinishedBefore(JobStatus.PENDING, cutoff);
        if (purged > 0) {
            log.info("Purged {} finished jobs older than {}", purged, cutoff);
        }
        return purged;
    }

    private boolean dispatch(ScheduledJob job, int maxAttempts) {
        boolean accepted;
        try {
            scraperClient.startCrawl(job.getPayload());
            job.setStatus(JobStatus.DISPATCHED);
            job.setDispatchedAt(Instant.now());
            job.setLastError(null);
            log.info("Dispatched job {}", job.getJobName());
            incrementCounter("indexer.tasks.dispatched", job);
            accepted = true;

        } catch (RestClientException e) {
            int attempts = job.getAttempts() + 1;
            job.setAttempts(attempts);
            job.setLastError(abbreviate(e.getMessage()));
            if (attempts >= maxAttempts) {
                job.setStatus(JobStatus.FAILED);
                log.error("Job {} failed after {} attempts: {}", job.getJobName(), attempts, e.getMessage());
                incrementCounter("indexer.tasks.failed", job);
            } else {
                log.warn("Job {} dispatch attempt {} failed, will retry: {}", job.getJobName(), attempts, e.getMessage());
            }
            accepted = false;
        }

        jobRepository.save(job);
        return accepted;
    }

    private static String abbreviate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= 500 ? message : message.substring(0, 500);
    }

    private void incrementCounter(String name, ScheduledJob job) {
        Counter.builder(name)
                .tag("kind", job.getKind().name())
                .register(meterRegistry)
                .increment();
    }
}
