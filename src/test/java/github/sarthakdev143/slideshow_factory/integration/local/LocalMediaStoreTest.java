package github.sarthakdev143.slideshow_factory.integration.local;

import github.sarthakdev143.slideshow_factory.exception.ResourceNotFoundException;
import github.sarthakdev143.slideshow_factory.model.MediaItem;
import github.sarthakdev143.slideshow_factory.model.MediaKind;
import github.sarthakdev143.slideshow_factory.model.MediaSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalMediaStoreTest {

    private final LocalMediaStore store = new LocalMediaStore();

    @TempDir
    Path tempDir;

    @Test
    void listReturnsMatchingFilesOfTopLevelOnly() throws Exception {
        Files.writeString(tempDir.resolve("10.jpg"), "x");
        Files.writeString(tempDir.resolve("2.PNG"), "x");
        Files.writeString(tempDir.resolve("cover.jpeg"), "x");
        Files.writeString(tempDir.resolve("theme.mp3"), "x");
        Files.createDirectories(tempDir.resolve("nested.jpg"));
        Files.writeString(Files.createDirectories(tempDir.resolve("archive")).resolve("1.jpg"), "x");

        List<MediaItem> images = store.list(tempDir.toString(), MediaKind.IMAGE);

        assertThat(images).extracting(MediaItem::name).containsExactly("2.PNG", "10.jpg", "cover.jpeg");
        assertThat(images).allSatisfy(item -> assertThat(item.source()).isEqualTo(MediaSource.LOCAL));
        assertThat(store.list(tempDir.toString(), MediaKind.AUDIO)).extracting(MediaItem::name)
                .containsExactly("theme.mp3");
    }

    @Test
    void listOfMissingFolderIsResourceNotFound() {
        assertThatThrownBy(() -> store.list(tempDir.resolve("missing").toString(), MediaKind.IMAGE))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void fetchReadsFileInPlace() throws Exception {
        Path image = Files.writeString(tempDir.resolve("1.jpg"), "x");
        MediaItem item = new MediaItem("1.jpg", image.toString(), MediaKind.IMAGE, MediaSource.LOCAL);

        assertThat(store.fetch(item, tempDir.resolve("work"))).isEqualTo(image);
        assertThat(tempDir.resolve("work")).doesNotExist();
    }

    @Test
    void fetchOfVanishedFileIsResourceNotFound() {
        MediaItem item = new MediaItem("gone.jpg", tempDir.resolve("gone.jpg").toString(), MediaKind.IMAGE, MediaSource.LOCAL);

        assertThatThrownBy(() -> store.fetch(item, tempDir))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("gone.jpg");
    }

    @Test
    void uploadReplacesExistingOutput() throws Exception {
        Path rendered = Files.writeString(tempDir.resolve("render.mp4"), "new");
        Path destination = Files.writeString(tempDir.resolve("slideshow.mp4"), "old");

        store.upload(rendered, destination.toString());

        assertThat(destination).hasContent("new");
    }

    @Test
    void uploadIntoMissingFolderIsResourceNotFound() throws Exception {
        Path rendered = Files.writeString(tempDir.resolve("render.mp4"), "new");

        assertThatThrownBy(() -> store.upload(rendered, tempDir.resolve("nope/slideshow.mp4").toString()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void existsReflectsFileSystem() {
        assertThat(store.exists(tempDir.toString())).isTrue();
        assertThat(store.exists(tempDir.resolve("missing").toString())).isFalse();
    }
}
