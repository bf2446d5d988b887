package github.sarthakdev143.slideshow_factory.model;

import java.time.Instant;
import java.util.List;

/**
 * Lifecycle of one accepted build. Immutable; every transition produces a new record.
 */
public record BuildRecord(
        String buildId,
        TriggerSource trigger,
        Instant startedAt,
        BuildStage stage,
        Instant finishedAt,
        BuildOutcome outcome,
        String failureReason,
        String outputLocation,
        List<String> includedSlides) {

    public BuildRecord {
        includedSlides = includedSlides == null ? List.of() : List.copyOf(includedSlides);
    }

    public static BuildRecord started(String buildId, TriggerSource trigger, Instant startedAt) {
        return new BuildRecord(
                buildId,
                trigger,
                startedAt,
                BuildStage.VALIDATING,
                null,
                BuildOutcome.RUNNING,
                null,
                null,
                List.of());
    }

    public BuildRecord atStage(BuildStage nextStage) {
        return new BuildRecord(
                buildId,
                trigger,
                startedAt,
                nextStage,
                finishedAt,
                outcome,
                failureReason,
                outputLocation,
                includedSlides);
    }

    public BuildRecord succeeded(Instant finishedAt, String outputLocation, List<String> includedSlides) {
        return new BuildRecord(
                buildId,
                trigger,
                startedAt,
                stage,
                finishedAt,
                BuildOutcome.SUCCEEDED,
                null,
                outputLocation,
                includedSlides);
    }

    public BuildRecord failed(Instant finishedAt, String reason) {
        return new BuildRecord(
                buildId,
                trigger,
                startedAt,
                stage,
                finishedAt,
                BuildOutcome.FAILED,
                reason,
                outputLocation,
                includedSlides);
    }

    public boolean isRunning() {
        return outcome == BuildOutcome.RUNNING;
    }
}
