package github.sarthakdev143.slideshow_factory.settings;

import java.util.Optional;

public record ResolvedSetting(SettingKey key, String value, SettingSource source) {

    public boolean isSet() {
        return value != null;
    }

    public boolean isOverride() {
        return source == SettingSource.OVERRIDE;
    }

    public Optional<String> optionalValue() {
        return Optional.ofNullable(value);
    }

    public String displayValue() {
        return value == null ? "Not set" : value;
    }
}
