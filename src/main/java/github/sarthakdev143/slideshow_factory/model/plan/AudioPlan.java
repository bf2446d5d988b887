package github.sarthakdev143.slideshow_factory.model.plan;

import github.sarthakdev143.slideshow_factory.model.MediaItem;

/**
 * Background track under the slideshow. The track loops until {@code fadeStartSeconds +
 * fadeSeconds}, fades out, then {@code trailingSilenceSeconds} of silence close the sequence.
 */
public record AudioPlan(
        MediaItem track,
        double fadeStartSeconds,
        double fadeSeconds,
        double trailingSilenceSeconds,
        double sequenceSeconds) {

    public double audioEndSeconds() {
        return fadeStartSeconds + fadeSeconds;
    }
}
