package github.sarthakdev143.slideshow_factory.service;

import github.sarthakdev143.slideshow_factory.model.MediaItem;
import github.sarthakdev143.slideshow_factory.model.MediaKind;
import github.sarthakdev143.slideshow_factory.model.MediaSource;

import java.nio.file.Path;
import java.util.List;

/**
 * Where source media is read from and finished videos are written to. Transport problems
 * surface as {@code TransportException}.
 */
public interface MediaStore {

    MediaSource source();

    /**
     * Whether enough connection details exist to talk to this store at all.
     */
    boolean isConfigured();

    /**
     * Files of the given kind directly inside {@code folder}; subfolders are not walked.
     */
    List<MediaItem> list(String folder, MediaKind kind);

    boolean exists(String location);

    /**
     * Copies {@code item} into {@code targetDirectory} and returns the local file.
     */
    Path fetch(MediaItem item, Path targetDirectory);

    void upload(Path localFile, String destination);
}
