package github.sarthakdev143.slideshow_factory.service;

import github.sarthakdev143.slideshow_factory.model.BuildStage;

/**
 * Sink for stage transitions and progress inside a stage of the running build.
 */
public interface BuildProgress {

    void enterStage(BuildStage stage, String detail);

    void update(BuildStage stage, double fraction, String detail);
}
