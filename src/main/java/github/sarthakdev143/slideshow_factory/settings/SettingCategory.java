package github.sarthakdev143.slideshow_factory.settings;

public enum SettingCategory {
    GENERAL("General"),
    SOURCES("Sources"),
    AUDIO("Audio"),
    TIMER("Timer"),
    HEARTBEAT("Heartbeat"),
    NOTIFICATIONS("Notifications");

    private final String label;

    SettingCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
