package com.inboxsync.ingestion.job;

import com.inboxsync.domain.SyncOutcome;
import com.inboxsync.domain.SyncRun;
import com.inboxsync.domain.SyncRunRepository;
import com.inboxsync.domain.SyncTrigger;
import com.inboxsync.ingestion.config.SyncJobProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SyncJobTest {

    private static final SyncRunReport FULL = new SyncRunReport(SyncOutcome.FULLY_SYNCED, 3, 1, 0, 2, 2, 2, 0, 0, null);

    @Mock
    private SyncOrchestrator orchestrator;
    @Mock
    private SyncRunRepository repository;

    private SyncJobProperties properties;
    private SyncJob job;

    @BeforeEach
    void setUp() {
        properties = new SyncJobProperties();
        job = new SyncJob(orchestrator, repository, properties);
        when(repository.save(any(SyncRun.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void trigger_runsAndRecordsHistory() {
        when(orchestrator.run()).thenReturn(FULL);

        SyncRun run = job.trigger(SyncTrigger.MANUAL);

        ArgumentCaptor<SyncRun> saved = ArgumentCaptor.forClass(SyncRun.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getTrigger()).isEqualTo(SyncTrigger.MANUAL);
        assertThat(saved.getValue().getOutcome()).isEqualTo(SyncOutcome.FULLY_SYNCED);
        assertThat(saved.getValue().getDiscovered()).isEqualTo(3);
        assertThat(saved.getValue().getSkippedDuplicate()).isEqualTo(1);
        assertThat(run.getStartedAt()).isNotNull();
        assertThat(run.getFinishedAt()).isAfterOrEqualTo(run.getStartedAt());
        assertThat(job.isRunning()).isFalse();
    }

    @Test
    void trigger_historySaveFails_runStillReturned() {
        when(orchestrator.run()).thenReturn(FULL);
        when(repository.save(any(SyncRun.class))).thenThrow(new IllegalStateException("mongo down"));

        SyncRun run = job.trigger(SyncTrigger.SCHEDULED);

        assertThat(run.getOutcome()).isEqualTo(SyncOutcome.FULLY_SYNCED);
        assertThat(job.isRunning()).isFalse();
    }

    @Test
    void trigger_orchestratorThrows_guardReleased() {
        when(orchestrator.run()).thenThrow(new IllegalStateException("bug"));

        assertThatThrownBy(() -> job.trigger(SyncTrigger.MANUAL)).isInstanceOf(IllegalStateException.class);
        assertThat(job.isRunning()).isFalse();
    }

    @Test
    void trigger_whileRunning_rejected() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(orchestrator.run()).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return FULL;
        });
        AtomicReference<SyncRun> first = new AtomicReference<>();
        Thread runner = new Thread(() -> first.set(job.trigger(SyncTrigger.SCHEDULED)));
        runner.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(() -> job.trigger(SyncTrigger.MANUAL)).isInstanceOf(SyncAlreadyRunningException.class);
            assertThat(job.isRunning()).isTrue();
        } finally {
            release.countDown();
            runner.join(5_000);
        }
        assertThat(first.get().getOutcome()).isEqualTo(SyncOutcome.FULLY_SYNCED);
    }

    @Test
    void runScheduled_disabled_doesNothing() {
        properties.setScheduleEnabled(false);

        job.runScheduled();

        verify(orchestrator, never()).run();
    }

    @Test
    void onApplicationReady_runOnStartupOff_doesNothing() {
        job.onApplicationReady();

        verify(orchestrator, never()).run();
    }

    @Test
    void onApplicationReady_runOnStartupOn_runsWithStartupTrigger() {
        properties.setRunOnStartup(true);
        when(orchestrator.run()).thenReturn(FULL);

        job.onApplicationReady();

        ArgumentCaptor<SyncRun> saved = ArgumentCaptor.forClass(SyncRun.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getTrigger()).isEqualTo(SyncTrigger.STARTUP);
    }
}
