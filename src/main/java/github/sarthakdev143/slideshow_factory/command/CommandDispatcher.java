package github.sarthakdev143.slideshow_factory.command;

import github.sarthakdev143.slideshow_factory.config.SlideshowProperties;
import github.sarthakdev143.slideshow_factory.exception.SettingValidationException;
import github.sarthakdev143.slideshow_factory.exception.SlideshowException;
import github.sarthakdev143.slideshow_factory.model.ChatMessage;
import github.sarthakdev143.slideshow_factory.model.SubmissionResult;
import github.sarthakdev143.slideshow_factory.model.TriggerSource;
import github.sarthakdev143.slideshow_factory.orchestrator.BuildOrchestrator;
import github.sarthakdev143.slideshow_factory.orchestrator.ScheduledTriggers;
import github.sarthakdev143.slideshow_factory.orchestrator.StatusReporter;
import github.sarthakdev143.slideshow_factory.settings.ConfigurationResolver;
import github.sarthakdev143.slideshow_factory.settings.ResolvedSetting;
import github.sarthakdev143.slideshow_factory.settings.SettingKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns chat messages into actions. Messages from senders outside the allow-list get no
 * reply and change nothing.
 */
@Component
public class CommandDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private final BuildOrchestrator orchestrator;
    private final ConfigurationResolver configurationResolver;
    private final StatusReporter statusReporter;
    private final StatusFormatter statusFormatter;
    private final ScheduledTriggers scheduledTriggers;
    private final Set<String> allowedSenders;

    public CommandDispatcher(
            BuildOrchestrator orchestrator,
            ConfigurationResolver configurationResolver,
            StatusReporter statusReporter,
            StatusFormatter statusFormatter,
            ScheduledTriggers scheduledTriggers,
            SlideshowProperties properties) {
        this.orchestrator = orchestrator;
        this.configurationResolver = configurationResolver;
        this.statusReporter = statusReporter;
        this.statusFormatter = statusFormatter;
        this.scheduledTriggers = scheduledTriggers;
        this.allowedSenders = Set.copyOf(properties.matrix().allowedSenders());
    }

    /**
     * @return the reply to post, or empty when the message is not a command or must be ignored
     */
    public Optional<String> handle(ChatMessage message) {
        String body = message.body() == null ? "" : message.body().trim();
        if (!body.startsWith("!")) {
            return Optional.empty();
        }
        if (!isAuthorized(message.sender())) {
            logger.warn("Ignoring command from unauthorized sender {}", message.sender());
            return Optional.empty();
        }

        String[] parts = body.split("\\s+", 3);
        Optional<ChatCommand> command = ChatCommand.fromInput(parts[0]);
        if (command.isEmpty()) {
            return Optional.of("Unknown command `" + parts[0] + "`. Send `!help` for the list.");
        }

        logger.info("Command {} from {}", command.get().verb(), message.sender());
        try {
            return Optional.of(execute(command.get(), parts));
        } catch (SettingValidationException e) {
            return Optional.of("❌ " + e.getMessage());
        } catch (SlideshowException e) {
            logger.error("Command {} failed", command.get().verb(), e);
            return Optional.of("❌ " + e.getMessage());
        } catch (DataAccessException e) {
            logger.error("Command {} could not reach the settings store", command.get().verb(), e);
            return Optional.of("❌ Settings store unavailable, nothing was changed.");
        }
    }

    public boolean isAuthorized(String sender) {
        return sender != null && allowedSenders.contains(sender);
    }

    private String execute(ChatCommand command, String[] parts) {
        return switch (command) {
            case REBUILD -> rebuild();
            case STATUS -> statusFormatter.formatStatus(statusReporter.snapshot());
            case SET -> set(parts);
            case GET -> get(parts);
            case UNSET -> unset(parts);
            case CONFIG -> statusFormatter.formatOverrides(configurationResolver.resolveAll().overrides());
            case DEFAULTS -> defaults();
            case HELP -> statusFormatter.formatHelp();
        };
    }

    private String rebuild() {
        SubmissionResult result = orchestrator.submit(TriggerSource.MANUAL);
        if (result.accepted()) {
            return "🚀 Rebuild started. I'll post here when it finishes.";
        }
        String stage = result.build() == null ? "progress" : result.build().stage().label();
        return "⏳ A build is already running (" + stage + "). Try again when it finishes.";
    }

    private String set(String[] parts) {
        if (parts.length < 3) {
            return "Usage: `" + ChatCommand.SET.usage() + "`";
        }
        ResolvedSetting stored = configurationResolver.setOverride(parts[1], parts[2]);
        afterChange(stored.key());
        return "✅ " + stored.key().name() + " set to " + stored.displayValue();
    }

    private String get(String[] parts) {
        if (parts.length < 2) {
            return "Usage: `" + ChatCommand.GET.usage() + "`";
        }
        if ("all".equals(parts[1].toLowerCase(Locale.ROOT))) {
            return statusFormatter.formatFullConfig(configurationResolver.resolveAll());
        }
        return statusFormatter.formatSetting(configurationResolver.resolve(parts[1]));
    }

    private String unset(String[] parts) {
        if (parts.length < 2) {
            return "Usage: `" + ChatCommand.UNSET.usage() + "`";
        }
        SettingKey key = SettingKey.fromInput(parts[1]);
        boolean removed = configurationResolver.clearOverride(key.name());
        if (!removed) {
            return key.name() + " has no override.";
        }
        afterChange(key);
        return "✅ Override removed. " + statusFormatter.formatSetting(configurationResolver.resolve(key));
    }

    private String defaults() {
        int removed = configurationResolver.clearAll();
        scheduledTriggers.reschedule();
        return "✅ Cleared " + removed + " override(s). All settings are back to their defaults.";
    }

    private void afterChange(SettingKey key) {
        if (key == SettingKey.CRON_SCHEDULE) {
            scheduledTriggers.reschedule();
        }
    }
}
