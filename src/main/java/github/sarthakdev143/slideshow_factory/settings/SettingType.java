package github.sarthakdev143.slideshow_factory.settings;

import github.sarthakdev143.slideshow_factory.exception.SettingValidationException;

import java.util.List;
import java.util.Locale;

public enum SettingType {
    INTEGER,
    BOOLEAN,
    CHOICE,
    PATH,
    CRON,
    TEXT;

    /**
     * Converts raw input into the canonical stored form for this type.
     *
     * @param key the setting the value is meant for, used for choices and messages
     * @param rawValue operator or environment input, possibly quoted
     * @return canonical value
     * @throws SettingValidationException when the value does not convert
     */
    public String normalize(SettingKey key, String rawValue) {
        String value = unquote(rawValue);
        if (value.isEmpty()) {
            throw new SettingValidationException(key.name() + " must not be blank.");
        }

        return switch (this) {
            case INTEGER -> normalizeInteger(key, value);
            case BOOLEAN -> normalizeBoolean(key, value);
            case CHOICE -> normalizeChoice(key, value);
            case PATH -> normalizePath(key, value);
            case CRON -> CronSchedule.parse(value).expression();
            case TEXT -> value;
        };
    }

    private static String normalizeInteger(SettingKey key, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new SettingValidationException(key.name() + " must be a whole number, got '" + value + "'.", ex);
        }
        if (parsed < 0) {
            throw new SettingValidationException(key.name() + " must not be negative.");
        }
        return Integer.toString(parsed);
    }

    private static String normalizeBoolean(SettingKey key, String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        return switch (lower) {
            case "true", "yes", "on", "1" -> "true";
            case "false", "no", "off", "0" -> "false";
            default -> throw new SettingValidationException(key.name() + " must be true or false, got '" + value + "'.");
        };
    }

    private static String normalizeChoice(SettingKey key, String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        List<String> allowed = key.allowedValues();
        if (!allowed.contains(lower)) {
            throw new SettingValidationException(
                    key.name() + " must be one of " + String.join(", ", allowed) + ", got '" + value + "'.");
        }
        return lower;
    }

    private static String normalizePath(SettingKey key, String value) {
        if (value.indexOf('\0') >= 0) {
            throw new SettingValidationException(key.name() + " contains an invalid character.");
        }
        return value;
    }

    private static String unquote(String rawValue) {
        if (rawValue == null) {
            return "";
        }
        String value = rawValue.strip();
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                value = value.substring(1, value.length() - 1).strip();
            }
        }
        return value;
    }
}
