package com.pricewatch.pipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricewatch.config.PipelineProperties;
import com.pricewatch.pipeline.TestJobs;
import com.pricewatch.pipeline.alert.AlertEvaluatorService;
import com.pricewatch.pipeline.catalog.EntityCatalog;
import com.pricewatch.pipeline.catalog.EntityCatalogException;
import com.pricewatch.pipeline.fetch.FetchAdapter;
import com.pricewatch.pipeline.fetch.FetchAdapterException;
import com.pricewatch.pipeline.fetch.FetchAdapterRegistry;
import com.pricewatch.pipeline.model.FetchResult;
import com.pricewatch.pipeline.model.Job;
import com.pricewatch.pipeline.model.JobExecutionResult;
import com.pricewatch.pipeline.model.JobRunErrorType;
import com.pricewatch.pipeline.model.JobRunStatus;
import com.pricewatch.pipeline.model.Observation;
import com.pricewatch.pipeline.model.Snapshot;
import com.pricewatch.pipeline.model.SourceType;
import com.pricewatch.pipeline.model.TrackedEntity;
import com.pricewatch.pipeline.persistence.SnapshotJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobExecutorServiceTest {
    private static final Instant OBSERVED_AT = Instant.parse("2026-05-01T12:00:00Z");

    @Mock
    private EntityCatalog catalog;

    @Mock
    private SnapshotJdbcRepository snapshots;

    @Mock
    private JobRunLifecycleService lifecycle;

    @Mock
    private AlertEvaluatorService alerts;

    private final PipelineProperties properties = new PipelineProperties();
    private final Set<String> storedKeys = new HashSet<>();
    private final AtomicLong ids = new AtomicLong();

    @BeforeEach
    void setUp() {
        properties.getFetch().setMinCallDelayMs(1);
        lenient().when(snapshots.insertIfAbsent(any(), any(), any(), any(), any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            String entityRef = invocation.getArgument(3);
            Instant observedAt = invocation.getArgument(7);
            if (!storedKeys.add(entityRef + "@" + observedAt)) {
                return Optional.empty();
            }
            return Optional.of(new Snapshot(
                ids.incrementAndGet(),
                invocation.getArgument(0),
                invocation.getArgument(1),
                invocation.getArgument(2),
                entityRef,
                invocation.getArgument(4),
                invocation.getArgument(5),
                invocation.getArgument(6),
                observedAt,
                invocation.getArgument(8),
                Instant.now()
            ));
        });
    }

    @Test
    void pacesAdapterCallsToTheJobRateLimit() {
        RecordingAdapter adapter = new RecordingAdapter(Set.of(), Set.of());
        Job job = TestJobs.job(1L, "t1", SourceType.HTML_PRICE_PAGE, Map.of(), 600);
        when(catalog.resolveEntities(job)).thenReturn(entities("a", "b", "c"));

        JobExecutionResult result = executor(adapter).execute(job, 11L);

        assertThat(result.status()).isEqualTo(JobRunStatus.COMPLETED);
        assertThat(result.error()).isNull();
        assertThat(result.snapshotsWritten()).isEqualTo(3);
        assertThat(adapter.callNanos).hasSize(3);
        for (int i = 1; i < adapter.callNanos.size(); i++) {
            long gapMs = (adapter.callNanos.get(i) - adapter.callNanos.get(i - 1)) / 1_000_000L;
            assertThat(gapMs).isGreaterThanOrEqualTo(99L);
        }
        verify(lifecycle).completeRun(eq(11L), eq(result));
        verify(alerts).evaluate(result.newSnapshots());
    }

    @Test
    void someFailedEntitiesCompleteTheRunAsPartialFailure() {
        RecordingAdapter adapter = new RecordingAdapter(Set.of("b"), Set.of());
        Job job = TestJobs.job(2L, "t1", SourceType.HTML_PRICE_PAGE, Map.of(), 6000);
        when(catalog.resolveEntities(job)).thenReturn(entities("a", "b", "c"));

        JobExecutionResult result = executor(adapter).execute(job, 12L);

        assertThat(result.status()).isEqualTo(JobRunStatus.COMPLETED);
        assertThat(result.entitiesAttempted()).isEqualTo(3);
        assertThat(result.entitiesFailed()).isEqualTo(1);
        assertThat(result.snapshotsWritten()).isEqualTo(2);
        assertThat(result.error().type()).isEqualTo(JobRunErrorType.PARTIAL_FAILURE);
        assertThat(result.error().entityErrors()).containsKey("b");
    }

    @Test
    void everyBatchFailingFailsTheRun() {
        RecordingAdapter adapter = new RecordingAdapter(Set.of(), Set.of("a", "b"));
        Job job = TestJobs.job(3L, "t1", SourceType.HTML_PRICE_PAGE, Map.of(), 6000);
        when(catalog.resolveEntities(job)).thenReturn(entities("a", "b"));

        JobExecutionResult result = executor(adapter).execute(job, 13L);

        assertThat(result.status()).isEqualTo(JobRunStatus.FAILED);
        assertThat(result.error().type()).isEqualTo(JobRunErrorType.ADAPTER_ERROR);
        assertThat(result.transientFailure()).isTrue();
        assertThat(result.entitiesFailed()).isEqualTo(2);
        verify(alerts, never()).evaluate(anyList());
    }

    @Test
    void runStopsAtTheTimeoutAndKeepsWhatWasWritten() {
        properties.getScheduler().setRunTimeoutSeconds(1);
        RecordingAdapter adapter = new RecordingAdapter(Set.of(), Set.of());
        Job job = TestJobs.job(4L, "t1", SourceType.HTML_PRICE_PAGE, Map.of(), 30);
        when(catalog.resolveEntities(job)).thenReturn(entities("a", "b", "c"));

        JobExecutionResult result = executor(adapter).execute(job, 14L);

        assertThat(result.status()).isEqualTo(JobRunStatus.FAILED);
        assertThat(result.error().type()).isEqualTo(JobRunErrorType.TIMEOUT);
        assertThat(result.error().partialCount()).isEqualTo(1);
        assertThat(result.snapshotsWritten()).isEqualTo(1);
        assertThat(adapter.callNanos).hasSize(1);
    }

    @Test
    void repeatedObservationIsNotStoredTwice() {
        RecordingAdapter adapter = new RecordingAdapter(Set.of(), Set.of());
        Job job = TestJobs.job(5L, "t1", SourceType.HTML_PRICE_PAGE, Map.of(), 6000);
        when(catalog.resolveEntities(job)).thenReturn(entities("a"));
        JobExecutorService executor = executor(adapter);

        JobExecutionResult first = executor.execute(job, 15L);
        JobExecutionResult second = executor.execute(job, 16L);

        assertThat(first.snapshotsWritten()).isEqualTo(1);
        assertThat(second.status()).isEqualTo(JobRunStatus.COMPLETED);
        assertThat(second.snapshotsWritten()).isZero();
    }

    @Test
    void emptyTargetIsATerminalConfigurationFailure() {
        Job job = TestJobs.job(6L, "t1", SourceType.HTML_PRICE_PAGE, Map.of(), 60);
        when(catalog.resolveEntities(job)).thenReturn(List.of());

        JobExecutionResult result = executor(new RecordingAdapter(Set.of(), Set.of())).execute(job, 17L);

        assertThat(result.status()).isEqualTo(JobRunStatus.FAILED);
        assertThat(result.error().type()).isEqualTo(JobRunErrorType.CONFIGURATION);
        assertThat(result.transientFailure()).isFalse();
    }

    @Test
    void unreachableCatalogIsTransient() {
        Job job = TestJobs.job(7L, "t1", SourceType.HTML_PRICE_PAGE, Map.of(), 60);
        when(catalog.resolveEntities(job)).thenThrow(new EntityCatalogException("catalog down", null));

        JobExecutionResult result = executor(new RecordingAdapter(Set.of(), Set.of())).execute(job, 18L);

        assertThat(result.error().type()).isEqualTo(JobRunErrorType.CATALOG);
        assertThat(result.transientFailure()).isTrue();
    }

    @Test
    void missingAdapterIsAConfigurationFailure() {
        Job job = TestJobs.job(8L, "t1", SourceType.JSON_PRICE_FEED, Map.of(), 60);
        when(catalog.resolveEntities(job)).thenReturn(entities("a"));

        JobExecutionResult result = executor(new RecordingAdapter(Set.of(), Set.of())).execute(job, 19L);

        assertThat(result.error().type()).isEqualTo(JobRunErrorType.CONFIGURATION);
        verify(lifecycle).completeRun(anyLong(), any());
    }

    private JobExecutorService executor(FetchAdapter adapter) {
        return new JobExecutorService(
            catalog,
            new FetchAdapterRegistry(List.of(adapter)),
            snapshots,
            lifecycle,
            alerts,
            new ObjectMapper(),
            properties
        );
    }

    private static List<TrackedEntity> entities(String... refs) {
        List<TrackedEntity> entities = new ArrayList<>();
        for (String ref : refs) {
            entities.add(new TrackedEntity(ref, "t1", "target", ref, "http://shop.test/" + ref, ref.toUpperCase()));
        }
        return entities;
    }

    private static final class RecordingAdapter implements FetchAdapter {
        private final Set<String> entityFailures;
        private final Set<String> batchFailures;
        private final List<Long> callNanos = new ArrayList<>();

        private RecordingAdapter(Set<String> entityFailures, Set<String> batchFailures) {
            this.entityFailures = entityFailures;
            this.batchFailures = batchFailures;
        }

        @Override
        public SourceType sourceType() {
            return SourceType.HTML_PRICE_PAGE;
        }

        @Override
        public FetchResult fetch(Job job, List<TrackedEntity> entities) throws FetchAdapterException {
            callNanos.add(System.nanoTime());
            TrackedEntity entity = entities.get(0);
            if (batchFailures.contains(entity.entityRef())) {
                throw new FetchAdapterException("http_503", true);
            }
            if (entityFailures.contains(entity.entityRef())) {
                return new FetchResult(List.of(), Map.of(entity.entityRef(), "no_price_found"));
            }
            return FetchResult.of(List.of(new Observation(
                entity.entityRef(),
                new BigDecimal("9.99"),
                "USD",
                true,
                OBSERVED_AT,
                Map.of("source", "test")
            )));
        }
    }
}
