package github.sarthakdev143.slideshow_factory.command;

import github.sarthakdev143.slideshow_factory.model.BuildOutcome;
import github.sarthakdev143.slideshow_factory.model.BuildRecord;
import github.sarthakdev143.slideshow_factory.model.ProgressState;
import github.sarthakdev143.slideshow_factory.orchestrator.StatusSnapshot;
import github.sarthakdev143.slideshow_factory.settings.EffectiveConfig;
import github.sarthakdev143.slideshow_factory.settings.ResolvedSetting;
import github.sarthakdev143.slideshow_factory.settings.SettingCategory;
import github.sarthakdev143.slideshow_factory.settings.SettingKey;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Plain-text renderings of status, settings and help for the chat room.
 */
@Component
public class StatusFormatter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter SCHEDULE = DateTimeFormatter.ofPattern("EEE yyyy-MM-dd HH:mm z");
    private static final int PROGRESS_CELLS = 10;

    private final ZoneId zone;

    public StatusFormatter(Clock clock) {
        this.zone = clock.getZone();
    }

    public String formatStatus(StatusSnapshot status) {
        StringBuilder message = new StringBuilder("🤖 **Slideshow Bot Status**\n")
                .append("Version: ").append(status.version()).append('\n')
                .append("Uptime: ").append(formatDuration(status.uptime())).append('\n')
                .append("Last success: ")
                .append(status.lastSuccess().map(build -> formatInstant(build.finishedAt())).orElse("Never"))
                .append('\n')
                .append("Heartbeat active: ").append(status.heartbeatEnabled() ? "Yes" : "No");
        if (status.heartbeatEnabled() && status.lastHeartbeat() != null) {
            message.append(" (last pulse ").append(formatInstant(status.lastHeartbeat())).append(')');
        }
        message.append('\n');

        status.active().ifPresent(build -> appendActiveBuild(message, build, status.progress()));

        status.last().ifPresent(build -> {
            message.append("\nLast build: ").append(describeOutcome(build));
            if (build.finishedAt() != null) {
                message.append(" at ").append(formatInstant(build.finishedAt()));
            }
            message.append('\n');
        });

        message.append("Next scheduled run: ")
                .append(status.nextScheduledRun() == null ? "None" : status.nextScheduledRun().format(SCHEDULE))
                .append('\n');

        if (status.nextcloudReachable() != null) {
            message.append("Nextcloud: ").append(status.nextcloudReachable() ? "Connected" : "Connection failed").append('\n');
        }
        return message.toString().trim();
    }

    public String formatSetting(ResolvedSetting setting) {
        return setting.key().name() + " = " + setting.displayValue() + " (" + sourceLabel(setting) + ")";
    }

    public String formatFullConfig(EffectiveConfig config) {
        StringBuilder message = new StringBuilder("📋 **Full Configuration Status**\n");
        for (SettingCategory category : SettingCategory.values()) {
            message.append('\n').append("**").append(category.label()).append("**\n");
            for (SettingKey key : SettingKey.values()) {
                if (key.category() != category) {
                    continue;
                }
                ResolvedSetting setting = config.get(key);
                message.append(setting.isOverride() ? "🔹 " : "▫️ ")
                        .append(formatSetting(setting))
                        .append('\n');
            }
        }
        message.append("\n🔹 = runtime override active\n▫️ = environment or built-in default");
        return message.toString();
    }

    public String formatOverrides(List<ResolvedSetting> overrides) {
        if (overrides.isEmpty()) {
            return "No active overrides. Every setting uses its environment or built-in default.";
        }
        return overrides.stream()
                .map(setting -> "• " + setting.key().name() + " = " + setting.displayValue())
                .collect(Collectors.joining("\n", "⚙️ **Active overrides**\n", ""));
    }

    public String formatHelp() {
        StringBuilder message = new StringBuilder("🤖 **Slideshow Bot Help**\n\n");
        for (ChatCommand command : ChatCommand.values()) {
            message.append("• `").append(command.usage()).append("` - ").append(command.description()).append('\n');
        }
        message.append("\n**Configurable settings**\n");
        for (SettingCategory category : SettingCategory.values()) {
            String keys = Arrays.stream(SettingKey.values())
                    .filter(key -> key.category() == category)
                    .map(key -> "`" + key.name() + "`")
                    .collect(Collectors.joining(", "));
            message.append(category.label()).append(": ").append(keys).append('\n');
        }
        return message.toString().trim();
    }

    String progressBar(int percent) {
        int filled = Math.max(0, Math.min(PROGRESS_CELLS, percent / 10));
        return "▓".repeat(filled) + "░".repeat(PROGRESS_CELLS - filled);
    }

    String formatDuration(Duration duration) {
        long days = duration.toDays();
        long hours = duration.toHoursPart();
        long minutes = duration.toMinutesPart();
        if (days > 0) {
            return days + "d " + hours + "h " + minutes + "m";
        }
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        return minutes + "m " + duration.toSecondsPart() + "s";
    }

    private void appendActiveBuild(StringBuilder message, BuildRecord build, ProgressState progress) {
        String stage = progress.isActive() ? progress.stage().label() : build.stage().label();
        message.append("\n🚀 Current activity: ").append(stage).append(" (").append(build.trigger().label()).append(")\n")
                .append("Started at: ").append(formatInstant(build.startedAt())).append('\n');
        if (progress.detail() != null) {
            message.append("Task: ").append(progress.detail()).append('\n');
        }
        if (progress.percent() > 0) {
            message.append("Progress: [").append(progressBar(progress.percent())).append("] ")
                    .append(progress.percent()).append("%\n");
        }
    }

    private String describeOutcome(BuildRecord build) {
        if (build.outcome() == BuildOutcome.SUCCEEDED) {
            return "succeeded (" + build.includedSlides().size() + " slides)";
        }
        if (build.outcome() == BuildOutcome.FAILED) {
            return "failed during " + build.stage().label() + ": " + build.failureReason();
        }
        return "running";
    }

    private String sourceLabel(ResolvedSetting setting) {
        return switch (setting.source()) {
            case OVERRIDE -> "override";
            case ENVIRONMENT -> "environment";
            case DEFAULT -> "default";
        };
    }

    private String formatInstant(Instant instant) {
        return instant == null ? "Unknown" : TIMESTAMP.format(instant.atZone(zone));
    }
}
