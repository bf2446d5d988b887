package github.sarthakdev143.slideshow_factory.orchestrator;

import github.sarthakdev143.slideshow_factory.model.BuildRecord;
import github.sarthakdev143.slideshow_factory.model.ProgressState;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Everything {@code !status} and the HTTP status endpoint report, captured at one instant.
 * {@code nextcloudReachable} is null when Nextcloud is not configured.
 */
public record StatusSnapshot(
        String version,
        Instant capturedAt,
        Duration uptime,
        BuildRecord activeBuild,
        ProgressState progress,
        BuildRecord lastBuild,
        BuildRecord lastSuccessfulBuild,
        boolean heartbeatEnabled,
        Instant lastHeartbeat,
        ZonedDateTime nextScheduledRun,
        Boolean nextcloudReachable) {

    public Optional<BuildRecord> active() {
        return Optional.ofNullable(activeBuild);
    }

    public Optional<BuildRecord> last() {
        return Optional.ofNullable(lastBuild);
    }

    public Optional<BuildRecord> lastSuccess() {
        return Optional.ofNullable(lastSuccessfulBuild);
    }
}
