package github.sarthakdev143.slideshow_factory.model;

public enum RejectionReason {
    ALREADY_RUNNING
}
