package github.sarthakdev143.slideshow_factory.exception;

import java.util.List;

/**
 * Pre-flight failure listing every missing resource, not only the first one found.
 */
public class ResourceNotFoundException extends SlideshowException {

    private final List<String> missingResources;

    public ResourceNotFoundException(List<String> missingResources) {
        super("Missing resources: " + String.join(", ", missingResources));
        this.missingResources = List.copyOf(missingResources);
    }

    public List<String> missingResources() {
        return missingResources;
    }
}
