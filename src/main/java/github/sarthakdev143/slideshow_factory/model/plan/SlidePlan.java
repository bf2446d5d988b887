package github.sarthakdev143.slideshow_factory.model.plan;

import github.sarthakdev143.slideshow_factory.model.MediaItem;

public record SlidePlan(MediaItem image, double displaySeconds) {
}
