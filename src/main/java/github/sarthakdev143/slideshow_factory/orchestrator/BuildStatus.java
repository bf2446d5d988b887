package github.sarthakdev143.slideshow_factory.orchestrator;

import github.sarthakdev143.slideshow_factory.model.BuildRecord;
import github.sarthakdev143.slideshow_factory.model.ProgressState;

/**
 * Consistent view of the build gate. {@code activeBuild} is null when idle.
 */
public record BuildStatus(
        BuildRecord activeBuild,
        ProgressState progress,
        BuildRecord lastBuild,
        BuildRecord lastSuccessfulBuild) {
}
