package github.sarthakdev143.slideshow_factory.health;

import github.sarthakdev143.slideshow_factory.config.SlideshowProperties;
import github.sarthakdev143.slideshow_factory.orchestrator.LivenessPulse;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * DOWN when the heartbeat file is older than {@code slideshow.heartbeat.stale-after}. Exposed
 * as the {@code heartbeat} health contributor.
 */
@Component("heartbeat")
public class HeartbeatHealthIndicator implements HealthIndicator {

    private final LivenessPulse livenessPulse;
    private final Duration staleAfter;
    private final Clock clock;

    public HeartbeatHealthIndicator(LivenessPulse livenessPulse, SlideshowProperties properties, Clock clock) {
        this.livenessPulse = livenessPulse;
        this.staleAfter = properties.heartbeat().staleAfter();
        this.clock = clock;
    }

    @Override
    public Health health() {
        if (!livenessPulse.isEnabled()) {
            return Health.up().withDetail("heartbeat", "disabled").build();
        }

        Path file = livenessPulse.heartbeatFile();
        try {
            Instant modified = Files.getLastModifiedTime(file).toInstant();
            Duration age = Duration.between(modified, clock.instant());
            Health.Builder builder = age.compareTo(staleAfter) > 0 ? Health.down() : Health.up();
            return builder
                    .withDetail("file", file.toString())
                    .withDetail("lastPulse", modified.toString())
                    .withDetail("ageSeconds", age.toSeconds())
                    .build();
        } catch (IOException e) {
            return Health.down()
                    .withDetail("file", file.toString())
                    .withDetail("error", "heartbeat file unreadable: " + e.getMessage())
                    .build();
        }
    }
}
