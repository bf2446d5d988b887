package github.sarthakdev143.slideshow_factory.settings;

import github.sarthakdev143.slideshow_factory.exception.SettingValidationException;
import org.springframework.scheduling.support.CronExpression;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Five-field crontab expression ({@code minute hour day month weekday}). Spring's
 * {@link CronExpression} expects a leading seconds field, so one is pinned to zero.
 */
public final class CronSchedule {

    private final String expression;
    private final CronExpression cronExpression;

    private CronSchedule(String expression, CronExpression cronExpression) {
        this.expression = expression;
        this.cronExpression = cronExpression;
    }

    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new SettingValidationException("Schedule expression must not be blank.");
        }

        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new SettingValidationException(
                    "Schedule must have 5 fields (minute hour day month weekday), got '" + expression.trim() + "'.");
        }

        String normalized = String.join(" ", fields);
        try {
            return new CronSchedule(normalized, CronExpression.parse("0 " + normalized));
        } catch (IllegalArgumentException ex) {
            throw new SettingValidationException("Invalid schedule '" + normalized + "': " + ex.getMessage(), ex);
        }
    }

    public Optional<ZonedDateTime> nextAfter(ZonedDateTime reference) {
        return Optional.ofNullable(cronExpression.next(reference));
    }

    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}
