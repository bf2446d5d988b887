package github.sarthakdev143.slideshow_factory.exception;

public class TransportException extends SlideshowException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
