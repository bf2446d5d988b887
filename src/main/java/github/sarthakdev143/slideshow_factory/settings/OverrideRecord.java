package github.sarthakdev143.slideshow_factory.settings;

import java.time.Instant;

public record OverrideRecord(String key, String value, Instant updatedAt) {
}
