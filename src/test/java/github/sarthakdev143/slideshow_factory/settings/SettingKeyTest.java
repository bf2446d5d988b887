package github.sarthakdev143.slideshow_factory.settings;

import github.sarthakdev143.slideshow_factory.exception.SettingValidationException;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingKeyTest {

    @Test
    void fromInputIsCaseInsensitive() {
        assertThat(SettingKey.fromInput(" image_duration ")).isEqualTo(SettingKey.IMAGE_DURATION);
    }

    @Test
    void booleanAcceptsCommonSpellings() {
        assertThat(SettingKey.ENABLE_TIMER.normalize("YES")).isEqualTo("true");
        assertThat(SettingKey.ENABLE_TIMER.normalize("on")).isEqualTo("true");
        assertThat(SettingKey.ENABLE_TIMER.normalize("0")).isEqualTo("false");
        assertThatThrownBy(() -> SettingKey.ENABLE_TIMER.normalize("maybe"))
                .isInstanceOf(SettingValidationException.class);
    }

    @Test
    void integerRejectsNegativeAndBlank() {
        assertThatThrownBy(() -> SettingKey.IMAGE_DURATION.normalize("-1"))
                .isInstanceOf(SettingValidationException.class);
        assertThatThrownBy(() -> SettingKey.IMAGE_DURATION.normalize("  "))
                .isInstanceOf(SettingValidationException.class);
    }

    @Test
    void choiceIsLowercased() {
        assertThat(SettingKey.IMAGE_SOURCE.normalize("NextCloud")).isEqualTo("nextcloud");
    }

    @Test
    void cronNeedsFiveFields() {
        assertThat(SettingKey.CRON_SCHEDULE.normalize("0   1 * *  5")).isEqualTo("0 1 * * 5");
        assertThatThrownBy(() -> SettingKey.CRON_SCHEDULE.normalize("0 0 1 * * 5"))
                .isInstanceOf(SettingValidationException.class)
                .hasMessageContaining("5 fields");
    }

    @Test
    void cronScheduleComputesNextFire() {
        CronSchedule schedule = CronSchedule.parse("0 1 * * 5");
        ZonedDateTime wednesday = ZonedDateTime.of(2026, 10, 14, 12, 0, 0, 0, ZoneOffset.UTC);

        assertThat(schedule.nextAfter(wednesday))
                .contains(ZonedDateTime.of(2026, 10, 16, 1, 0, 0, 0, ZoneOffset.UTC));
    }

    @Test
    void everyKeyHasACategoryAndValidDefault() {
        for (SettingKey key : SettingKey.values()) {
            assertThat(key.category()).as(key.name()).isNotNull();
            key.defaultValue().ifPresent(value -> assertThat(key.normalize(value)).as(key.name()).isEqualTo(value));
        }
    }
}
