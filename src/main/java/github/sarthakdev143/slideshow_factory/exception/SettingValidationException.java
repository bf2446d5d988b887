package github.sarthakdev143.slideshow_factory.exception;

/**
 * Rejected override: unknown key or a value that does not convert to the key's type.
 * The override store is left untouched when this is thrown.
 */
public class SettingValidationException extends SlideshowException {

    public SettingValidationException(String message) {
        super(message);
    }

    public SettingValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
