package com.waqiti.auditpipeline.scheduler;

import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditEventCategory;
import com.waqiti.auditpipeline.service.AuditPipelineService;
import com.waqiti.auditpipeline.service.PipelineMetrics;
import com.waqiti.auditpipeline.store.AuditEventStore;
import com.waqiti.auditpipeline.support.InMemoryAuditEventStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetentionSweeper")
class RetentionSweeperTest {

    private static final Instant NOW = Instant.parse("2026-06-01T03:00:00Z");

    @Mock
    private AuditPipelineService auditPipelineService;

    @Mock
    private TaskScheduler scheduler;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final AuditPipelineProperties properties = new AuditPipelineProperties();
    private final PipelineMetrics metrics = new PipelineMetrics(new SimpleMeterRegistry(), clock);

    private RetentionSweeper sweeper(AuditEventStore store) {
        return new RetentionSweeper(store, auditPipelineService, metrics, scheduler, clock, properties);
    }

    private static AuditEvent event(String requestId, boolean requiresRetention, int retentionYears) {
        return AuditEvent.builder()
            .requestId(requestId)
            .eventType("LOGIN_SUCCEEDED")
            .eventCategory(AuditEventCategory.AUTHENTICATION)
            .description("User logged in")
            .requiresRetention(requiresRetention)
            .retentionYears(retentionYears)
            .build();
    }

    @Nested
    @DisplayName("sweepOnce")
    class SweepOnce {

        @Test
        @DisplayName("Should delete only expired records that do not require retention")
        void shouldDeleteOnlyExpiredRecords() {
            // Given
            InMemoryAuditEventStore store = new InMemoryAuditEventStore(clock);
            store.seed(event("expired", false, 3), Instant.parse("2020-01-01T00:00:00Z"));
            store.seed(event("retained", true, 1), Instant.parse("2000-01-01T00:00:00Z"));
            store.seed(event("fresh", false, 5), Instant.parse("2025-01-01T00:00:00Z"));

            // When
            long deleted = sweeper(store).sweepOnce();

            // Then
            assertThat(deleted).isEqualTo(1);
            assertThat(store.events()).extracting(AuditEvent::getRequestId).containsExactlyInAnyOrder("retained", "fresh");

            ArgumentCaptor<AuditEvent> cleanup = ArgumentCaptor.forClass(AuditEvent.class);
            verify(auditPipelineService).logInternal(cleanup.capture());
            assertThat(cleanup.getValue().getEventType()).isEqualTo(RetentionSweeper.CLEANUP_EVENT_TYPE);
            assertThat(cleanup.getValue().getEventCategory()).isEqualTo(AuditEventCategory.SYSTEM_OPERATION);
            assertThat(cleanup.getValue().getMetadata()).containsEntry("deletedCount", 1L);
        }

        @Test
        @DisplayName("Should never delete retained records however old")
        void shouldKeepRetainedRecords() {
            InMemoryAuditEventStore store = new InMemoryAuditEventStore(clock);
            store.seed(event("ancient", true, 1), Instant.parse("1990-01-01T00:00:00Z"));

            assertThat(sweeper(store).sweepOnce()).isZero();
            assertThat(store.events()).hasSize(1);
        }

        @Test
        @DisplayName("Should not emit a cleanup event when nothing was deleted")
        void shouldStayQuietWhenNothingDeleted() {
            sweeper(new InMemoryAuditEventStore(clock)).sweepOnce();

            verifyNoInteractions(auditPipelineService);
        }
    }

    @Nested
    @DisplayName("tick")
    class Tick {

        @Test
        @DisplayName("Should catch sweep failures")
        void shouldCatchFailures() {
            AuditEventStore store = mock(AuditEventStore.class);
            when(store.deleteExpired(NOW)).thenThrow(new IllegalStateException("db down"));

            assertThatCode(() -> sweeper(store).tick()).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should skip a tick while a sweep is in progress")
        void shouldRunSingleFlight() throws Exception {
            // Given
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            AuditEventStore store = mock(AuditEventStore.class);
            when(store.deleteExpired(NOW)).thenAnswer(invocation -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return 0L;
            });
            RetentionSweeper sweeper = sweeper(store);

            // When
            CompletableFuture<Boolean> first = CompletableFuture.supplyAsync(sweeper::tick);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            boolean second = sweeper.tick();
            release.countDown();

            // Then
            assertThat(second).isFalse();
            assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(sweeper.tick()).isTrue();
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should schedule at the configured interval and cancel on stop")
        void shouldScheduleAndCancel() {
            // Given
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            doReturn(future).when(scheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
            RetentionSweeper sweeper = sweeper(mock(AuditEventStore.class));

            // When
            sweeper.start();

            // Then
            verify(scheduler).scheduleAtFixedRate(any(Runnable.class),
                eq(NOW.plus(Duration.ofMinutes(5))), eq(Duration.ofHours(24)));
            assertThat(sweeper.isRunning()).isTrue();

            sweeper.stop();
            verify(future).cancel(false);
            assertThat(sweeper.isRunning()).isFalse();
        }

        @Test
        @DisplayName("Should not schedule when retention is disabled")
        void shouldNotScheduleWhenDisabled() {
            properties.getRetention().setEnabled(false);
            RetentionSweeper sweeper = sweeper(mock(AuditEventStore.class));

            sweeper.start();

            verify(scheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
            assertThat(sweeper.isRunning()).isFalse();
        }
    }
}
