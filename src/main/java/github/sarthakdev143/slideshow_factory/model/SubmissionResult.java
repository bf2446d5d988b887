package github.sarthakdev143.slideshow_factory.model;

/**
 * Answer to a build trigger. A rejection carries the build that is already running.
 */
public record SubmissionResult(boolean accepted, BuildRecord build, RejectionReason rejectionReason) {

    public static SubmissionResult accepted(BuildRecord build) {
        return new SubmissionResult(true, build, null);
    }

    public static SubmissionResult rejected(RejectionReason reason, BuildRecord activeBuild) {
        return new SubmissionResult(false, activeBuild, reason);
    }
}
