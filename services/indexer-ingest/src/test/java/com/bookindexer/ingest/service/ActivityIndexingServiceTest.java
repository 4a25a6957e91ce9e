package com.bookindexer.ingest.service;

import static com.bookindexer.ingest.service.RecordValidatorTest.activityJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.bookindexer.common.model.ActivityRecordDTO;
import com.bookindexer.ingest.cache.EntityExistenceCache;
import com.bookindexer.ingest.cache.OwnerActivityCache;
import com.bookindexer.ingest.client.CatalogApiClient;
import com.bookindexer.ingest.client.DownstreamClientException;
import com.bookindexer.ingest.client.DownstreamServerException;
import com.bookindexer.ingest.client.PopularityClient;
import com.bookindexer.ingest.config.IndexerProperties;
import com.bookindexer.ingest.model.EnqueueResult;
import com.bookindexer.ingest.model.ScrapeJob;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;

@ExtendWith(MockitoExtension.class)
class ActivityIndexingServiceTest {

    private static final String ACTIVITY_TOPIC = "indexer.activity.audit";

    @Mock
    private CatalogApiClient catalogApiClient;
    @Mock
    private PopularityClient popularityClient;
    @Mock
    private TaskQueue taskQueue;
    @Mock
    private AuditPublisher auditPublisher;

    private final ObjectMapper objectMapper = JsonMapper.builder().build();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private ValidatorFactory validatorFactory;
    private ActivityIndexingService service;

    @BeforeEach
    void setUp() {
        IndexerProperties properties = new IndexerProperties();
        validatorFactory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
        RecordValidator recordValidator = new RecordValidator(objectMapper, validatorFactory.getValidator(), meterRegistry);
        ExistenceService existenceService = new ExistenceService(catalogApiClient,
                new OwnerActivityCache(properties.getCache(), () -> 0L),
                new EntityExistenceCache(properties.getCache()));
        EntityAcquisitionService acquisitionService =
                new EntityAcquisitionService(popularityClient, existenceService, taskQueue, properties);
        service = new ActivityIndexingService(recordValidator, existenceService, catalogApiClient,
                acquisitionService, auditPublisher, properties, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void indexesNewActivityAndSchedulesPopularMissingEntity() throws Exception {
        when(catalogApiClient.findEntityIdsForOwner(1L)).thenReturn(Set.of());
        when(catalogApiClient.createActivityBatch(anyList())).thenReturn(1);
        when(popularityClient.getPopularity(anyCollection())).thenReturn(Map.of(2L, 5));
        when(catalogApiClient.findExistingEntities(anyCollection())).thenReturn(Set.of());
        when(taskQueue.enqueue(ScrapeJob.forEntity(2L)))
                .thenReturn(EnqueueResult.scheduled("entity-2", "scrape-jobs/jobs/entity-2"));

        IndexResult result = service.index(items(activityJson(1, 2, 4)));

        assertThat(result.indexed()).isEqualTo(1);
        assertThat(result.tasks()).containsExactly("scrape-jobs/jobs/entity-2");
        verify(auditPublisher).sendBatch(eq(ACTIVITY_TOPIC), argThat(list -> list.size() == 1), any());
    }

    @Test
    void redeliveredBatchWritesNothingAndReportsDuplicateJob() throws Exception {
        when(catalogApiClient.findEntityIdsForOwner(1L)).thenReturn(Set.of());
        when(catalogApiClient.createActivityBatch(anyList())).thenReturn(1);
        when(popularityClient.getPopularity(anyCollection())).thenReturn(Map.of(2L, 9));
        when(catalogApiClient.findExistingEntities(anyCollection())).thenReturn(Set.of());
        when(taskQueue.enqueue(ScrapeJob.forEntity(2L)))
                .thenReturn(EnqueueResult.scheduled("entity-2", "scrape-jobs/jobs/entity-2"))
                .thenReturn(EnqueueResult.duplicate("entity-2"));

        service.index(items(activityJson(1, 2, 4)));
        IndexResult second = service.index(items(activityJson(1, 2, 4)));

        assertThat(second.indexed()).isZero();
        assertThat(second.tasks()).containsExactly(EnqueueResult.DUPLICATE);
        verify(catalogApiClient, times(1)).createActivityBatch(anyList());
        verify(catalogApiClient, times(1)).findEntityIdsForOwner(1L);
    }

    @Test
    void skipsActivityTheOwnerAlreadyHas() throws Exception {
        when(catalogApiClient.findEntityIdsForOwner(1L)).thenReturn(Set.of(2L));
        when(catalogApiClient.createActivityBatch(anyList())).thenReturn(1);
        when(popularityClient.getPopularity(anyCollection())).thenReturn(Map.of());

        IndexResult result = service.index(items(activityJson(1, 2, 4), activityJson(1, 3, 5)));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ActivityRecordDTO>> written = ArgumentCaptor.forClass(List.class);
        verify(catalogApiClient).createActivityBatch(written.capture());
        assertThat(written.getValue()).extracting(ActivityRecordDTO::getEntityId).containsExactly(3L);
        assertThat(result.indexed()).isEqualTo(1);
        assertThat(result.tasks()).isEmpty();
    }

    @Test
    void rejectedOwnerIsDroppedWhileOthersAreWritten() throws Exception {
        when(catalogApiClient.findEntityIdsForOwner(anyLong())).thenReturn(Set.of());
        when(catalogApiClient.createActivityBatch(anyList()))
                .thenThrow(new DownstreamClientException("rejected", 400, null))
                .thenReturn(1);
        when(popularityClient.getPopularity(anyCollection())).thenReturn(Map.of());

        IndexResult result = service.index(items(activityJson(1, 2, 4), activityJson(3, 4, 5)));

        assertThat(result.indexed()).isEqualTo(1);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ActivityRecordDTO>> audited = ArgumentCaptor.forClass(List.class);
        verify(auditPublisher).sendBatch(eq(ACTIVITY_TOPIC), audited.capture(), any());
        assertThat(audited.getValue()).extracting(ActivityRecordDTO::getOwnerId).containsExactly(3L);
        assertThat(meterRegistry.get("indexer.records.rejected")
                .tag("domain", "activity").tag("status", "400").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void serverErrorAbortsBatchBeforeAuditOrScheduling() throws Exception {
        when(catalogApiClient.findEntityIdsForOwner(1L)).thenReturn(Set.of());
        when(catalogApiClient.createActivityBatch(anyList())).thenThrow(new DownstreamServerException("boom", null));

        assertThatThrownBy(() -> service.index(items(activityJson(1, 2, 4))))
                .isInstanceOf(DownstreamServerException.class);

        verifyNoInteractions(auditPublisher, popularityClient, taskQueue);
    }

    @Test
    void repeatedReferencesScheduleAtMostOneJob() throws Exception {
        when(catalogApiClient.findEntityIdsForOwner(anyLong())).thenReturn(Set.of());
        when(catalogApiClient.createActivityBatch(anyList())).thenReturn(1);
        when(popularityClient.getPopularity(anyCollection())).thenReturn(Map.of(2L, 6));
        when(catalogApiClient.findExistingEntities(anyCollection())).thenReturn(Set.of());
        when(taskQueue.enqueue(ScrapeJob.forEntity(2L)))
                .thenReturn(EnqueueResult.scheduled("entity-2", "scrape-jobs/jobs/entity-2"));

        IndexResult result = service.index(items(
                activityJson(1, 2, 4), activityJson(1, 2, 3), activityJson(5, 2, 5)));

        assertThat(result.indexed()).isEqualTo(2);
        assertThat(result.tasks()).containsExactly("scrape-jobs/jobs/entity-2");
        verify(taskQueue, times(1)).enqueue(any());
        verify(popularityClient).getPopularity(argThat(ids -> ids.size() == 1 && ids.contains(2L)));
    }

    @Test
    void unpopularOrExistingEntitiesAreNotScheduled() throws Exception {
        when(catalogApiClient.findEntityIdsForOwner(1L)).thenReturn(Set.of());
        when(catalogApiClient.createActivityBatch(anyList())).thenReturn(3);
        when(popularityClient.getPopularity(anyCollection())).thenReturn(Map.of(2L, 4, 3L, 5, 4L, 8));
        when(catalogApiClient.findExistingEntities(List.of(3L, 4L))).thenReturn(Set.of(3L));
        when(taskQueue.enqueue(ScrapeJob.forEntity(4L)))
                .thenReturn(EnqueueResult.scheduled("entity-4", "scrape-jobs/jobs/entity-4"));

        IndexResult result = service.index(items(
                activityJson(1, 2, 4), activityJson(1, 3, 4), activityJson(1, 4, 4)));

        assertThat(result.tasks()).containsExactly("scrape-jobs/jobs/entity-4");
        verify(taskQueue, never()).enqueue(ScrapeJob.forEntity(3L));
    }

    @Test
    void batchOfOnlyInvalidRecordsDoesNothing() throws Exception {
        IndexResult result = service.index(items("{\"owner_id\": -1, \"entity_id\": 2}"));

        assertThat(result).isEqualTo(IndexResult.empty());
        verifyNoInteractions(catalogApiClient, auditPublisher, popularityClient, taskQueue);
    }

    private List<JsonNode> items(String... json) throws Exception {
        List<JsonNode> nodes = new ArrayList<>();
        for (String item : json) {
            nodes.add(objectMapper.readTree(item));
        }
        return nodes;
    }
}
