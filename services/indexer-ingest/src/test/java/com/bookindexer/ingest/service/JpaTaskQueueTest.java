package com.bookindexer.ingest.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.data.jpa.test.autoconfigure.DataJpaTest;
import org.springframework.data.domain.PageRequest;

import com.bookindexer.ingest.config.IndexerProperties;
import com.bookindexer.ingest.model.EnqueueResult;
import com.bookindexer.ingest.model.JobKind;
import com.bookindexer.ingest.model.ScheduledJob;
import com.bookindexer.ingest.model.ScheduledJob.JobStatus;
import com.bookindexer.ingest.model.ScrapeJob;
import com.bookindexer.ingest.repository.ScheduledJobRepository;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@DataJpaTest
class JpaTaskQueueTest {

    @Autowired
    private ScheduledJobRepository jobRepository;

    private final ObjectMapper objectMapper = JsonMapper.builder().build();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private JpaTaskQueue taskQueue;

    @BeforeEach
    void setUp() {
        taskQueue = new JpaTaskQueue(jobRepository, objectMapper, new IndexerProperties(), meterRegistry);
    }

    @Test
    void schedulesEntityJobWithBookSpiderPayload() throws Exception {
        EnqueueResult result = taskQueue.enqueue(ScrapeJob.forEntity(2L));

        assertThat(result.duplicate()).isFalse();
        assertThat(result.label()).isEqualTo("scrape-jobs/jobs/entity-2");

        ScheduledJob stored = jobRepository.findById("entity-2").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(stored.getAttempts()).isZero();
        assertThat(stored.getKind()).isEqualTo(JobKind.ENTITY);

        JsonNode payload = objectMapper.readTree(stored.getPayload());
        assertThat(payload.get("spider_name").asString()).isEqualTo("book");
        assertThat(payload.get("start_requests").asBoolean()).isTrue();
        assertThat(payload.at("/crawl_args/books").asString()).isEqualTo("2");
        assertThat(payload.at("/crawl_args/project_id").asString()).isEqualTo("book-indexer");
        assertThat(payload.at("/crawl_args/topic_name").asString()).isEqualTo("scraper.catalog.v1");
    }

    @Test
    void schedulesOwnerJobWithReviewSpiderPayload() throws Exception {
        taskQueue.enqueue(ScrapeJob.forOwner(9L));

        JsonNode payload = objectMapper.readTree(jobRepository.findById("owner-9").orElseThrow().getPayload());
        assertThat(payload.get("spider_name").asString()).isEqualTo("user_reviews");
        assertThat(payload.at("/crawl_args/users").asString()).isEqualTo("9");
        assertThat(payload.at("/crawl_args/topic_name").asString()).isEqualTo("scraper.activity.v1");
    }

    @Test
    void secondEnqueueOfSameIdentityIsDuplicate() {
        taskQueue.enqueue(ScrapeJob.forEntity(2L));
        EnqueueResult again = taskQueue.enqueue(ScrapeJob.forEntity(2L));

        assertThat(again.duplicate()).isTrue();
        assertThat(again.label()).isEqualTo(EnqueueResult.DUPLICATE);
        assertThat(jobRepository.count()).isEqualTo(1);
        assertThat(meterRegistry.get("indexer.tasks.duplicate").tag("kind", "ENTITY").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void entityAndOwnerWithSameIdAreDistinctJobs() {
        assertThat(taskQueue.enqueue(ScrapeJob.forEntity(3L)).duplicate()).isFalse();
        assertThat(taskQueue.enqueue(ScrapeJob.forOwner(3L)).duplicate()).isFalse();
    }

    @Test
    void pendingJobsComeBackOldestFirst() {
        Instant now = Instant.now();
        jobRepository.saveAndFlush(job("entity-1", JobStatus.PENDING, now.minusSeconds(10)));
        jobRepository.saveAndFlush(job("entity-2", JobStatus.PENDING, now.minusSeconds(30)));
        jobRepository.saveAndFlush(job("entity-3", JobStatus.DISPATCHED, now.minusSeconds(60)));

        List<ScheduledJob> pending = jobRepository.findOldestByStatus(JobStatus.PENDING, PageRequest.of(0, 10));

        assertThat(pending).extracting(ScheduledJob::getJobName).containsExactly("entity-2", "entity-1");
    }

    @Test
    void purgeRemovesOnlyOldFinishedJobs() {
        Instant old = Instant.now().minus(Duration.ofDays(8));
        jobRepository.saveAndFlush(job("entity-1", JobStatus.DISPATCHED, old));
        jobRepository.saveAndFlush(job("entity-2", JobStatus.FAILED, old));
        jobRepository.saveAndFlush(job("entity-3", JobStatus.PENDING, old));
        jobRepository.saveAndFlush(job("entity-4", JobStatus.DISPATCHED, Instant.now()));

        int purged = jobRepository.deleteFinishedBefore(JobStatus.PENDING, Instant.now().minus(Duration.ofDays(7)));

        assertThat(purged).isEqualTo(2);
        assertThat(jobRepository.findAll()).extracting(ScheduledJob::getJobName)
                .containsExactlyInAnyOrder("entity-3", "entity-4");
        assertThat(taskQueue.enqueue(ScrapeJob.forEntity(1L)).duplicate()).isFalse();
    }

    @Test
    void reportsReadyWhenTableIsReachable() {
        assertThat(taskQueue.isReady()).isTrue();
    }

    private static ScheduledJob job(String name, JobStatus status, Instant at) {
        return ScheduledJob.builder()
                .jobName(name)
                .kind(JobKind.ENTITY)
                .targetId(Long.parseLong(name.substring("entity-".length())))
                .payload("{}")
                .status(status)
                .attempts(0)
                .createdAt(at)
                .updatedAt(at)
                .build();
    }
}
