package github.sarthakdev143.slideshow_factory.settings;

public enum SettingSource {
    OVERRIDE,
    ENVIRONMENT,
    DEFAULT
}
