package github.sarthakdev143.slideshow_factory.integration.local;

import github.sarthakdev143.slideshow_factory.exception.ResourceNotFoundException;
import github.sarthakdev143.slideshow_factory.exception.TransportException;
import github.sarthakdev143.slideshow_factory.model.MediaItem;
import github.sarthakdev143.slideshow_factory.model.MediaKind;
import github.sarthakdev143.slideshow_factory.model.MediaSource;
import github.sarthakdev143.slideshow_factory.service.MediaStore;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

@Component
public class LocalMediaStore implements MediaStore {

    @Override
    public MediaSource source() {
        return MediaSource.LOCAL;
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public List<MediaItem> list(String folder, MediaKind kind) {
        Path directory = Path.of(folder);
        if (!Files.isDirectory(directory)) {
            throw new ResourceNotFoundException(List.of("local folder " + folder));
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> kind.matches(path.getFileName().toString()))
                    .map(path -> new MediaItem(
                            path.getFileName().toString(),
                            path.toString(),
                            kind,
                            MediaSource.LOCAL))
                    .sorted(MediaItem.ORDER)
                    .toList();
        } catch (IOException e) {
            throw new TransportException("Unable to list local folder " + folder, e);
        }
    }

    @Override
    public boolean exists(String location) {
        return Files.exists(Path.of(location));
    }

    /**
     * Local files are read in place; nothing is copied.
     */
    @Override
    public Path fetch(MediaItem item, Path targetDirectory) {
        Path path = Path.of(item.location());
        if (!Files.isRegularFile(path)) {
            throw new ResourceNotFoundException(List.of("local file " + item.location()));
        }
        return path;
    }

    @Override
    public void upload(Path localFile, String destination) {
        Path target = Path.of(destination);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null && !Files.isDirectory(parent)) {
                throw new ResourceNotFoundException(List.of("local folder " + parent));
            }
            Files.copy(localFile, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new TransportException("Unable to write " + destination, e);
        }
    }
}
