package github.sarthakdev143.slideshow_factory.model;

public enum BuildOutcome {
    RUNNING,
    SUCCEEDED,
    FAILED
}
