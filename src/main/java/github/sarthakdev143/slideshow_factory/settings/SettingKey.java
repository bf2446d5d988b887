package github.sarthakdev143.slideshow_factory.settings;

import github.sarthakdev143.slideshow_factory.exception.SettingValidationException;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The complete runtime-overridable configuration surface. Anything not listed here is
 * rejected by {@link ConfigurationResolver#setOverride(String, String)}.
 */
public enum SettingKey {
    IMAGE_DURATION(SettingType.INTEGER, SettingCategory.GENERAL, "10"),
    TARGET_VIDEO_DURATION(SettingType.INTEGER, SettingCategory.GENERAL, "600"),
    MIN_SLIDE_SECONDS(SettingType.INTEGER, SettingCategory.GENERAL, "2"),
    VIDEO_FPS(SettingType.INTEGER, SettingCategory.GENERAL, "5"),
    CRON_SCHEDULE(SettingType.CRON, SettingCategory.GENERAL, "0 1 * * 5"),

    IMAGE_SOURCE(SettingType.CHOICE, SettingCategory.SOURCES, "local", "local", "nextcloud"),
    IMAGE_FOLDER(SettingType.PATH, SettingCategory.SOURCES, "images/"),
    NEXTCLOUD_IMAGE_PATH(SettingType.PATH, SettingCategory.SOURCES, null),
    APPEND_VIDEO_SOURCE(SettingType.CHOICE, SettingCategory.SOURCES, "local", "local", "nextcloud"),
    APPEND_VIDEO_PATH(SettingType.PATH, SettingCategory.SOURCES, null),
    OUTPUT_FILEPATH(SettingType.PATH, SettingCategory.SOURCES, null),
    NEXTCLOUD_UPLOAD_PATH(SettingType.PATH, SettingCategory.SOURCES, null),

    ENABLE_MUSIC(SettingType.BOOLEAN, SettingCategory.AUDIO, "true"),
    MUSIC_SOURCE(SettingType.CHOICE, SettingCategory.AUDIO, "local", "local", "nextcloud"),
    MUSIC_FOLDER(SettingType.PATH, SettingCategory.AUDIO, null),
    AUDIO_FADE_SECONDS(SettingType.INTEGER, SettingCategory.AUDIO, "10"),
    AUDIO_TRAILING_SILENCE_SECONDS(SettingType.INTEGER, SettingCategory.AUDIO, "5"),

    ENABLE_TIMER(SettingType.BOOLEAN, SettingCategory.TIMER, "false"),
    TIMER_MINUTES(SettingType.INTEGER, SettingCategory.TIMER, "5"),
    TIMER_POSITION(SettingType.CHOICE, SettingCategory.TIMER, "top-middle", "top-middle", "bottom-right"),

    ENABLE_HEARTBEAT(SettingType.BOOLEAN, SettingCategory.HEARTBEAT, "true"),

    ENABLE_NTFY(SettingType.BOOLEAN, SettingCategory.NOTIFICATIONS, "true"),
    NTFY_TOPIC(SettingType.TEXT, SettingCategory.NOTIFICATIONS, null);

    private final SettingType type;
    private final SettingCategory category;
    private final String defaultValue;
    private final List<String> allowedValues;

    SettingKey(SettingType type, SettingCategory category, String defaultValue, String... allowedValues) {
        this.type = type;
        this.category = category;
        this.defaultValue = defaultValue;
        this.allowedValues = List.of(allowedValues);
    }

    public SettingType type() {
        return type;
    }

    public SettingCategory category() {
        return category;
    }

    public Optional<String> defaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public List<String> allowedValues() {
        return allowedValues;
    }

    public String normalize(String rawValue) {
        return type.normalize(this, rawValue);
    }

    public static Optional<SettingKey> find(String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(SettingKey.valueOf(input.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    public static SettingKey fromInput(String input) {
        return find(input).orElseThrow(() -> new SettingValidationException(
                "'" + input + "' is not a configurable setting."));
    }
}
