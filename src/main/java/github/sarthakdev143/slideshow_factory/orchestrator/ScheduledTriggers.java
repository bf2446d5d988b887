package github.sarthakdev143.slideshow_factory.orchestrator;

import github.sarthakdev143.slideshow_factory.exception.SettingValidationException;
import github.sarthakdev143.slideshow_factory.model.SubmissionResult;
import github.sarthakdev143.slideshow_factory.model.TriggerSource;
import github.sarthakdev143.slideshow_factory.settings.ConfigurationResolver;
import github.sarthakdev143.slideshow_factory.settings.CronSchedule;
import github.sarthakdev143.slideshow_factory.settings.SettingKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Fires scheduled builds from {@code CRON_SCHEDULE}. The expression is resolved again for
 * every fire, and {@link #reschedule()} picks up a change immediately.
 */
@Component
public class ScheduledTriggers implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledTriggers.class);

    private final TaskScheduler taskScheduler;
    private final BuildOrchestrator orchestrator;
    private final ConfigurationResolver configurationResolver;
    private final Clock clock;
    private final Object lifecycleLock = new Object();
    private ScheduledFuture<?> scheduledFuture;
    private volatile boolean running;

    public ScheduledTriggers(
            TaskScheduler taskScheduler,
            BuildOrchestrator orchestrator,
            ConfigurationResolver configurationResolver,
            Clock clock) {
        this.taskScheduler = taskScheduler;
        this.orchestrator = orchestrator;
        this.configurationResolver = configurationResolver;
        this.clock = clock;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            scheduledFuture = taskScheduler.schedule(this::fire, new ResolvingCronTrigger());
            running = true;
        }
        logger.info("Build schedule registered with expression '{}'", currentSchedule().expression());
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (scheduledFuture != null) {
                scheduledFuture.cancel(false);
                scheduledFuture = null;
            }
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Drops the pending fire and schedules again from now.
     */
    public void reschedule() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            if (scheduledFuture != null) {
                scheduledFuture.cancel(false);
            }
            scheduledFuture = taskScheduler.schedule(this::fire, new ResolvingCronTrigger());
        }
        logger.info("Build schedule changed to '{}'", currentSchedule().expression());
    }

    public Optional<ZonedDateTime> nextScheduledRun() {
        return currentSchedule().nextAfter(ZonedDateTime.now(clock));
    }

    CronSchedule currentSchedule() {
        String expression = configurationResolver.resolve(SettingKey.CRON_SCHEDULE).value();
        try {
            return CronSchedule.parse(expression);
        } catch (SettingValidationException e) {
            logger.warn("Invalid schedule '{}', using the default: {}", expression, e.getMessage());
            return CronSchedule.parse(SettingKey.CRON_SCHEDULE.defaultValue().orElseThrow());
        }
    }

    void fire() {
        SubmissionResult result = orchestrator.submit(TriggerSource.SCHEDULED);
        if (!result.accepted()) {
            logger.info(
                    "Skipped scheduled build; build {} is still running",
                    result.build() == null ? "?" : result.build().buildId());
        }
    }

    private final class ResolvingCronTrigger implements Trigger {

        @Override
        public Instant nextExecution(TriggerContext triggerContext) {
            Instant lastCompletion = triggerContext.lastCompletion();
            ZonedDateTime reference = lastCompletion == null
                    ? ZonedDateTime.now(clock)
                    : lastCompletion.atZone(clock.getZone());
            return currentSchedule().nextAfter(reference)
                    .map(ZonedDateTime::toInstant)
                    .orElse(null);
        }
    }
}
