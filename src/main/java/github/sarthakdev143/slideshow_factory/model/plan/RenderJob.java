package github.sarthakdev143.slideshow_factory.model.plan;

import java.nio.file.Path;
import java.util.Map;

/**
 * A plan plus the local copies of its media, keyed by {@code MediaItem.location()}.
 */
public record RenderJob(AssemblyPlan plan, Map<String, Path> localFiles, Path outputPath) {

    public RenderJob {
        localFiles = localFiles == null ? Map.of() : Map.copyOf(localFiles);
    }

    public Path localFile(String location) {
        Path path = localFiles.get(location);
        if (path == null) {
            throw new IllegalArgumentException("No local copy for " + location);
        }
        return path;
    }
}
