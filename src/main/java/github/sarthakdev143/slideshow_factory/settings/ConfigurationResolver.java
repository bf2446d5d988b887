package github.sarthakdev143.slideshow_factory.settings;

import github.sarthakdev143.slideshow_factory.exception.SettingValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves settings as override store, then environment, then compiled default.
 * Every call reads through to the store so a committed write is visible to the next read.
 * When the store cannot be read, resolution continues as if no override were set; writes
 * still fail with the store's {@link DataAccessException}.
 */
@Service
public class ConfigurationResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationResolver.class);

    private final OverrideStore overrideStore;
    private final Environment environment;
    private final Clock clock;

    public ConfigurationResolver(OverrideStore overrideStore, Environment environment, Clock clock) {
        this.overrideStore = overrideStore;
        this.environment = environment;
        this.clock = clock;
    }

    public ResolvedSetting resolve(SettingKey key) {
        Optional<OverrideRecord> override;
        try {
            override = overrideStore.find(key.name());
        } catch (DataAccessException e) {
            logger.warn("Override store unreadable, resolving {} without overrides: {}", key.name(), e.getMessage());
            override = Optional.empty();
        }
        return resolve(key, override.map(OverrideRecord::value).orElse(null));
    }

    public ResolvedSetting resolve(String key) {
        return resolve(SettingKey.fromInput(key));
    }

    public EffectiveConfig resolveAll() {
        Map<String, String> overrides = listOverrides()
                .stream()
                .collect(Collectors.toMap(OverrideRecord::key, OverrideRecord::value));

        Map<SettingKey, ResolvedSetting> resolved = new EnumMap<>(SettingKey.class);
        for (SettingKey key : SettingKey.values()) {
            resolved.put(key, resolve(key, overrides.get(key.name())));
        }
        return new EffectiveConfig(resolved, clock.instant());
    }

    public ResolvedSetting setOverride(String key, String value) {
        SettingKey settingKey = SettingKey.fromInput(key);
        String normalized = settingKey.normalize(value);
        overrideStore.save(settingKey.name(), normalized, clock.instant());
        logger.info("Override stored {}={}", settingKey.name(), normalized);
        return new ResolvedSetting(settingKey, normalized, SettingSource.OVERRIDE);
    }

    public boolean clearOverride(String key) {
        SettingKey settingKey = SettingKey.fromInput(key);
        boolean removed = overrideStore.delete(settingKey.name());
        if (removed) {
            logger.info("Override cleared for {}", settingKey.name());
        }
        return removed;
    }

    public int clearAll() {
        int removed = overrideStore.deleteAll();
        logger.info("Cleared {} override(s)", removed);
        return removed;
    }

    public List<OverrideRecord> listOverrides() {
        try {
            return overrideStore.findAll();
        } catch (DataAccessException e) {
            logger.warn("Override store unreadable, using environment and defaults only: {}", e.getMessage());
            return List.of();
        }
    }

    private ResolvedSetting resolve(SettingKey key, String overrideValue) {
        if (overrideValue != null) {
            Optional<String> normalized = tryNormalize(key, overrideValue, SettingSource.OVERRIDE);
            if (normalized.isPresent()) {
                return new ResolvedSetting(key, normalized.get(), SettingSource.OVERRIDE);
            }
        }

        String environmentValue = environment.getProperty(key.name());
        if (environmentValue != null && !environmentValue.isBlank()) {
            Optional<String> normalized = tryNormalize(key, environmentValue, SettingSource.ENVIRONMENT);
            if (normalized.isPresent()) {
                return new ResolvedSetting(key, normalized.get(), SettingSource.ENVIRONMENT);
            }
        }

        return new ResolvedSetting(key, key.defaultValue().orElse(null), SettingSource.DEFAULT);
    }

    private Optional<String> tryNormalize(SettingKey key, String value, SettingSource source) {
        try {
            return Optional.of(key.normalize(value));
        } catch (SettingValidationException ex) {
            logger.warn("Ignoring invalid {} value for {}: {}", source, key.name(), ex.getMessage());
            return Optional.empty();
        }
    }
}
