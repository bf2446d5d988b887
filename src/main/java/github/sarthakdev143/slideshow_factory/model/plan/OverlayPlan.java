package github.sarthakdev143.slideshow_factory.model.plan;

import github.sarthakdev143.slideshow_factory.model.OverlayPosition;

/**
 * Countdown shown from {@code startSeconds} to {@code endSeconds}; it reads 00:00 at the end.
 */
public record OverlayPlan(double startSeconds, double endSeconds, OverlayPosition position) {

    public double durationSeconds() {
        return endSeconds - startSeconds;
    }
}
