package github.sarthakdev143.slideshow_factory.model;

import java.util.Locale;

public enum MediaSource {
    LOCAL,
    NEXTCLOUD;

    public static MediaSource fromSetting(String value) {
        if (value == null || value.isBlank()) {
            return LOCAL;
        }
        return MediaSource.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String toSettingValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
