package github.sarthakdev143.slideshow_factory.exception;

public class EmptyInventoryException extends SlideshowException {

    public EmptyInventoryException(String message) {
        super(message);
    }
}
