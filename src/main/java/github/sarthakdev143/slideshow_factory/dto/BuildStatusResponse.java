package github.sarthakdev143.slideshow_factory.dto;

import github.sarthakdev143.slideshow_factory.model.BuildStage;
import github.sarthakdev143.slideshow_factory.model.ProgressState;
import github.sarthakdev143.slideshow_factory.orchestrator.StatusSnapshot;

import java.time.Instant;
import java.time.OffsetDateTime;

public record BuildStatusResponse(
        String version,
        long uptimeSeconds,
        boolean building,
        BuildStage currentStage,
        int progressPercent,
        String progressDetail,
        BuildSummaryResponse activeBuild,
        BuildSummaryResponse lastBuild,
        Instant lastSuccessAt,
        boolean heartbeatEnabled,
        Instant lastHeartbeat,
        OffsetDateTime nextScheduledRun,
        Boolean nextcloudReachable) {

    public static BuildStatusResponse from(StatusSnapshot status) {
        ProgressState progress = status.progress();
        return new BuildStatusResponse(
                status.version(),
                status.uptime().toSeconds(),
                status.activeBuild() != null,
                progress.stage(),
                progress.percent(),
                progress.detail(),
                BuildSummaryResponse.from(status.activeBuild()),
                BuildSummaryResponse.from(status.lastBuild()),
                status.lastSuccess().map(build -> build.finishedAt()).orElse(null),
                status.heartbeatEnabled(),
                status.lastHeartbeat(),
                status.nextScheduledRun() == null ? null : status.nextScheduledRun().toOffsetDateTime(),
                status.nextcloudReachable());
    }
}
