package github.sarthakdev143.slideshow_factory.model;

import java.util.Locale;

public enum TriggerSource {
    SCHEDULED,
    MANUAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
