package github.sarthakdev143.slideshow_factory.model.plan;

import github.sarthakdev143.slideshow_factory.model.MediaItem;

/**
 * Clip played after the slideshow. {@code durationSeconds} is the part that is kept;
 * {@code trimmed} is set when the source is longer than the remaining target time.
 */
public record AppendedClipPlan(MediaItem clip, double startSeconds, double durationSeconds, boolean trimmed) {
}
