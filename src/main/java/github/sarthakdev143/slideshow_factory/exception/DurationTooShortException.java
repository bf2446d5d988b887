package github.sarthakdev143.slideshow_factory.exception;

import java.util.Locale;

public class DurationTooShortException extends SlideshowException {

    private final double availableSeconds;
    private final double minimumSeconds;

    public DurationTooShortException(double availableSeconds, double minimumSeconds) {
        super(String.format(
                Locale.ROOT,
                "Slideshow time budget of %.1fs is shorter than the %.1fs minimum slide duration.",
                availableSeconds,
                minimumSeconds));
        this.availableSeconds = availableSeconds;
        this.minimumSeconds = minimumSeconds;
    }

    public double availableSeconds() {
        return availableSeconds;
    }

    public double minimumSeconds() {
        return minimumSeconds;
    }
}
