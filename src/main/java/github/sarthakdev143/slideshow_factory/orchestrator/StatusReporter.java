package github.sarthakdev143.slideshow_factory.orchestrator;

import github.sarthakdev143.slideshow_factory.config.SlideshowProperties;
import github.sarthakdev143.slideshow_factory.integration.nextcloud.NextcloudMediaStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
public class StatusReporter {

    private final BuildOrchestrator orchestrator;
    private final ScheduledTriggers scheduledTriggers;
    private final LivenessPulse livenessPulse;
    private final NextcloudMediaStore nextcloudMediaStore;
    private final SlideshowProperties properties;
    private final Clock clock;

    public StatusReporter(
            BuildOrchestrator orchestrator,
            ScheduledTriggers scheduledTriggers,
            LivenessPulse livenessPulse,
            NextcloudMediaStore nextcloudMediaStore,
            SlideshowProperties properties,
            Clock clock) {
        this.orchestrator = orchestrator;
        this.scheduledTriggers = scheduledTriggers;
        this.livenessPulse = livenessPulse;
        this.nextcloudMediaStore = nextcloudMediaStore;
        this.properties = properties;
        this.clock = clock;
    }

    public StatusSnapshot snapshot() {
        Instant now = clock.instant();
        Boolean nextcloudReachable = nextcloudMediaStore.isConfigured() ? nextcloudMediaStore.isReachable() : null;
        BuildStatus builds = orchestrator.currentStatus();
        return new StatusSnapshot(
                properties.version(),
                now,
                Duration.between(orchestrator.startedAt(), now),
                builds.activeBuild(),
                builds.progress(),
                builds.lastBuild(),
                builds.lastSuccessfulBuild(),
                livenessPulse.isEnabled(),
                livenessPulse.lastPulse().orElse(null),
                scheduledTriggers.nextScheduledRun().orElse(null),
                nextcloudReachable);
    }
}
