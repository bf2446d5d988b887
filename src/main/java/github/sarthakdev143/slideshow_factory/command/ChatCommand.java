package github.sarthakdev143.slideshow_factory.command;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ChatCommand {
    REBUILD("!rebuild", "Trigger a manual video build"),
    STATUS("!status", "Check the bot's health, uptime and current build"),
    SET("!set KEY VALUE", "Override a setting"),
    GET("!get KEY", "View the current value of a setting (`!get all` for everything)"),
    UNSET("!unset KEY", "Drop one override"),
    CONFIG("!config", "List active overrides"),
    DEFAULTS("!defaults", "Reset every setting to its environment or built-in default"),
    HELP("!help", "Show this message");

    private final String usage;
    private final String description;

    ChatCommand(String usage, String description) {
        this.usage = usage;
        this.description = description;
    }

    public String usage() {
        return usage;
    }

    public String description() {
        return description;
    }

    public String verb() {
        return "!" + name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ChatCommand> fromInput(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(command -> command.verb().equals(normalized))
                .findFirst();
    }
}
