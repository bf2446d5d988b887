package github.sarthakdev143.slideshow_factory.orchestrator;

import github.sarthakdev143.slideshow_factory.model.BuildRecord;
import github.sarthakdev143.slideshow_factory.model.RejectionReason;
import github.sarthakdev143.slideshow_factory.model.SubmissionResult;
import github.sarthakdev143.slideshow_factory.model.TriggerSource;
import github.sarthakdev143.slideshow_factory.settings.ConfigurationResolver;
import github.sarthakdev143.slideshow_factory.settings.ResolvedSetting;
import github.sarthakdev143.slideshow_factory.settings.SettingKey;
import github.sarthakdev143.slideshow_factory.settings.SettingSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduledTriggersTest {

    // Wednesday
    private static final Instant NOW = Instant.parse("2026-10-14T10:00:00Z");

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private BuildOrchestrator orchestrator;

    @Mock
    private ConfigurationResolver configurationResolver;

    private ScheduledTriggers triggers;

    @BeforeEach
    void setUp() {
        triggers = new ScheduledTriggers(
                taskScheduler,
                orchestrator,
                configurationResolver,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void nextRunFollowsDefaultSchedule() {
        schedule("0 1 * * 5");

        assertThat(triggers.nextScheduledRun())
                .contains(ZonedDateTime.parse("2026-10-16T01:00:00Z"));
    }

    @Test
    void triggerResolvesScheduleAgainForEveryFire() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        schedule("0 1 * * 5");
        triggers.start();

        ArgumentCaptor<Trigger> trigger = ArgumentCaptor.forClass(Trigger.class);
        verify(taskScheduler).schedule(any(Runnable.class), trigger.capture());
        TriggerContext context = mock(TriggerContext.class);

        assertThat(trigger.getValue().nextExecution(context)).isEqualTo(Instant.parse("2026-10-16T01:00:00Z"));

        schedule("30 12 * * *");
        assertThat(trigger.getValue().nextExecution(context)).isEqualTo(Instant.parse("2026-10-14T12:30:00Z"));
    }

    @Test
    void rescheduleReplacesPendingFire() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        schedule("0 1 * * 5");
        triggers.start();

        triggers.reschedule();

        verify(future).cancel(false);
        verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Trigger.class));
    }

    @Test
    void rescheduleBeforeStartDoesNothing() {
        triggers.reschedule();

        verify(taskScheduler, times(0)).schedule(any(Runnable.class), any(Trigger.class));
    }

    @Test
    void invalidStoredScheduleFallsBackToDefault() {
        schedule("every friday");

        assertThat(triggers.currentSchedule().expression()).isEqualTo("0 1 * * 5");
    }

    @Test
    void fireSubmitsScheduledBuildAndToleratesRejection() {
        BuildRecord running = BuildRecord.started("b-1", TriggerSource.MANUAL, NOW);
        when(orchestrator.submit(TriggerSource.SCHEDULED))
                .thenReturn(SubmissionResult.rejected(RejectionReason.ALREADY_RUNNING, running));

        triggers.fire();

        verify(orchestrator).submit(TriggerSource.SCHEDULED);
    }

    private void schedule(String expression) {
        when(configurationResolver.resolve(SettingKey.CRON_SCHEDULE))
                .thenReturn(new ResolvedSetting(SettingKey.CRON_SCHEDULE, expression, SettingSource.OVERRIDE));
    }
}
