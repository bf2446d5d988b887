package github.sarthakdev143.slideshow_factory.settings;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of every {@link SettingKey} with the layer it was resolved from.
 * One snapshot is taken per build; later overrides do not leak into a running build.
 */
public final class EffectiveConfig {

    private final Map<SettingKey, ResolvedSetting> settings;
    private final Instant resolvedAt;

    public EffectiveConfig(Map<SettingKey, ResolvedSetting> settings, Instant resolvedAt) {
        EnumMap<SettingKey, ResolvedSetting> copy = new EnumMap<>(SettingKey.class);
        copy.putAll(settings);
        for (SettingKey key : SettingKey.values()) {
            copy.putIfAbsent(key, new ResolvedSetting(key, key.defaultValue().orElse(null), SettingSource.DEFAULT));
        }
        this.settings = Collections.unmodifiableMap(copy);
        this.resolvedAt = resolvedAt;
    }

    public static EffectiveConfig defaults() {
        return new EffectiveConfig(Map.of(), Instant.EPOCH);
    }

    public ResolvedSetting get(SettingKey key) {
        return settings.get(key);
    }

    public Optional<String> text(SettingKey key) {
        return get(key).optionalValue();
    }

    public int intValue(SettingKey key) {
        String value = get(key).value();
        if (value == null) {
            throw new IllegalStateException(key.name() + " has no value.");
        }
        return Integer.parseInt(value);
    }

    public boolean isEnabled(SettingKey key) {
        return Boolean.parseBoolean(get(key).value());
    }

    public List<ResolvedSetting> all() {
        return List.copyOf(settings.values());
    }

    public List<ResolvedSetting> overrides() {
        return settings.values()
                .stream()
                .filter(ResolvedSetting::isOverride)
                .toList();
    }

    public Instant resolvedAt() {
        return resolvedAt;
    }

    /**
     * Copy with the given values layered on top as overrides. Used by tests and by
     * callers that need a what-if snapshot without touching the store.
     */
    public EffectiveConfig with(Map<SettingKey, String> overrides) {
        EnumMap<SettingKey, ResolvedSetting> copy = new EnumMap<>(settings);
        overrides.forEach((key, value) -> copy.put(
                key,
                new ResolvedSetting(key, key.normalize(value), SettingSource.OVERRIDE)));
        return new EffectiveConfig(copy, resolvedAt);
    }
}
