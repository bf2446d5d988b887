package github.sarthakdev143.slideshow_factory.exception;

public class SlideshowException extends RuntimeException {

    public SlideshowException(String message) {
        super(message);
    }

    public SlideshowException(String message, Throwable cause) {
        super(message, cause);
    }
}
