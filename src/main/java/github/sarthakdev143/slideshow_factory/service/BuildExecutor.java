package github.sarthakdev143.slideshow_factory.service;

import github.sarthakdev143.slideshow_factory.model.BuildRecord;
import github.sarthakdev143.slideshow_factory.settings.EffectiveConfig;

public interface BuildExecutor {

    /**
     * Runs one build to completion. Never throws for build failures; the returned record
     * carries the outcome, the stage reached and the failure reason.
     */
    BuildRecord execute(BuildRecord build, EffectiveConfig config, BuildProgress progress);
}
