package github.sarthakdev143.slideshow_factory.dto;

import github.sarthakdev143.slideshow_factory.model.BuildOutcome;
import github.sarthakdev143.slideshow_factory.model.BuildRecord;
import github.sarthakdev143.slideshow_factory.model.BuildStage;
import github.sarthakdev143.slideshow_factory.model.TriggerSource;

import java.time.Instant;

public record BuildSummaryResponse(
        String buildId,
        TriggerSource trigger,
        BuildStage stage,
        BuildOutcome outcome,
        Instant startedAt,
        Instant finishedAt,
        String failureReason,
        String outputLocation,
        int slideCount) {

    public static BuildSummaryResponse from(BuildRecord build) {
        if (build == null) {
            return null;
        }
        return new BuildSummaryResponse(
                build.buildId(),
                build.trigger(),
                build.stage(),
                build.outcome(),
                build.startedAt(),
                build.finishedAt(),
                build.failureReason(),
                build.outputLocation(),
                build.includedSlides().size());
    }
}
