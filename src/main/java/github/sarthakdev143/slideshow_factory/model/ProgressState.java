package github.sarthakdev143.slideshow_factory.model;

import java.time.Instant;

/**
 * Read-only progress snapshot. {@code sequence} grows with every stage transition so a
 * reader can tell a fresh stage from a stale one.
 */
public record ProgressState(
        long sequence,
        BuildStage stage,
        double fraction,
        String detail,
        Instant updatedAt) {

    public static ProgressState idle(long sequence, Instant now) {
        return new ProgressState(sequence, null, 0.0, null, now);
    }

    public boolean isActive() {
        return stage != null;
    }

    public int percent() {
        return (int) Math.round(Math.max(0.0, Math.min(1.0, fraction)) * 100.0);
    }
}
