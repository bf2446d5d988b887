package github.sarthakdev143.slideshow_factory.orchestrator;

import github.sarthakdev143.slideshow_factory.config.SlideshowProperties;
import github.sarthakdev143.slideshow_factory.settings.ConfigurationResolver;
import github.sarthakdev143.slideshow_factory.settings.SettingKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Touches the heartbeat file on a fixed interval while {@code ENABLE_HEARTBEAT} is on,
 * whether or not a build is running.
 */
@Component
public class LivenessPulse implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(LivenessPulse.class);

    private final TaskScheduler taskScheduler;
    private final ConfigurationResolver configurationResolver;
    private final SlideshowProperties properties;
    private final Clock clock;
    private volatile ScheduledFuture<?> scheduledFuture;
    private volatile Instant lastPulse;

    public LivenessPulse(
            TaskScheduler taskScheduler,
            ConfigurationResolver configurationResolver,
            SlideshowProperties properties,
            Clock clock) {
        this.taskScheduler = taskScheduler;
        this.configurationResolver = configurationResolver;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void start() {
        scheduledFuture = taskScheduler.scheduleAtFixedRate(this::pulse, properties.heartbeat().interval());
        logger.info(
                "Liveness pulse every {} to {}",
                properties.heartbeat().interval(),
                properties.heartbeat().file());
    }

    @Override
    public void stop() {
        ScheduledFuture<?> future = scheduledFuture;
        if (future != null) {
            future.cancel(false);
        }
        scheduledFuture = null;
    }

    @Override
    public boolean isRunning() {
        return scheduledFuture != null;
    }

    public boolean isEnabled() {
        return Boolean.parseBoolean(configurationResolver.resolve(SettingKey.ENABLE_HEARTBEAT).value());
    }

    public Optional<Instant> lastPulse() {
        return Optional.ofNullable(lastPulse);
    }

    public Path heartbeatFile() {
        return Path.of(properties.heartbeat().file());
    }

    /**
     * Failures are logged and retried on the next tick; a missed pulse is what the
     * supervisor is meant to notice.
     */
    public void pulse() {
        if (!isEnabled()) {
            return;
        }
        Path file = heartbeatFile();
        Instant now = clock.instant();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.notExists(file)) {
                Files.createFile(file);
            }
            Files.setLastModifiedTime(file, FileTime.from(now));
            lastPulse = now;
        } catch (IOException e) {
            logger.warn("Unable to refresh heartbeat file {}: {}", file, e.getMessage());
        }
    }
}
