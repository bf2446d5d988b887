package github.sarthakdev143.slideshow_factory.model;

import java.util.Locale;

public enum OverlayPosition {
    TOP_MIDDLE,
    BOTTOM_RIGHT;

    public static OverlayPosition fromSetting(String value) {
        if (value == null || value.isBlank()) {
            return TOP_MIDDLE;
        }
        return OverlayPosition.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }

    public String xExpression() {
        return switch (this) {
            case TOP_MIDDLE -> "(w-text_w)/2";
            case BOTTOM_RIGHT -> "w-text_w-50";
        };
    }

    public String yExpression() {
        return switch (this) {
            case TOP_MIDDLE -> "50";
            case BOTTOM_RIGHT -> "h-text_h-50";
        };
    }
}
