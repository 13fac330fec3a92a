package com.openrangelabs.ingestor.scheduler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Instant;
import java.time.ZoneId;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class TaskSchedulerJobRegistrarTest {

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> first;

    @Mock
    private ScheduledFuture<Object> second;

    @Test
    void addOrUpdate_ReplacesAndCancelsPreviousTrigger() {
        // Arrange
        TaskSchedulerJobRegistrar registrar = new TaskSchedulerJobRegistrar(taskScheduler, "Europe/Berlin", true);
        UUID jobId = UUID.randomUUID();
        doReturn(first, second).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));

        // Act
        registrar.addOrUpdate(jobId, "0 2 * * *", () -> { });
        registrar.addOrUpdate(jobId, "0 3 * * *", () -> { });

        // Assert
        verify(first).cancel(false);
        verify(second, never()).cancel(false);
        assertThat(registrar.isRegistered(jobId)).isTrue();
        assertThat(registrar.getZone()).isEqualTo(ZoneId.of("Europe/Berlin"));

        ArgumentCaptor<Trigger> trigger = ArgumentCaptor.forClass(Trigger.class);
        verify(taskScheduler, times(2)).schedule(any(Runnable.class), trigger.capture());
        assertThat(((CronTrigger) trigger.getValue()).getExpression()).isEqualTo("0 0 3 * * *");
    }

    @Test
    void removeIfExists_CancelsRegisteredTrigger() {
        TaskSchedulerJobRegistrar registrar = new TaskSchedulerJobRegistrar(taskScheduler, "UTC", true);
        UUID jobId = UUID.randomUUID();
        doReturn(first).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        registrar.addOrUpdate(jobId, "*/10 * * * *", () -> { });

        registrar.removeIfExists(jobId);
        registrar.removeIfExists(jobId);

        verify(first).cancel(false);
        assertThat(registrar.isRegistered(jobId)).isFalse();
    }

    @Test
    void disabledScheduling_ValidatesButRegistersNothing() {
        TaskSchedulerJobRegistrar registrar = new TaskSchedulerJobRegistrar(taskScheduler, "UTC", false);

        registrar.addOrUpdate(UUID.randomUUID(), "0 0 * * *", () -> { });

        verifyNoInteractions(taskScheduler);
    }

    @Test
    void enqueue_SchedulesImmediately() {
        TaskSchedulerJobRegistrar registrar = new TaskSchedulerJobRegistrar(taskScheduler, "UTC", true);

        registrar.enqueue(() -> { });

        verify(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    }
}
