package github.sarthakdev143.slideshow_factory.service.impl;

import github.sarthakdev143.slideshow_factory.exception.ResourceNotFoundException;
import github.sarthakdev143.slideshow_factory.model.MediaItem;
import github.sarthakdev143.slideshow_factory.model.MediaKind;
import github.sarthakdev143.slideshow_factory.model.MediaSource;
import github.sarthakdev143.slideshow_factory.service.MediaStore;
import github.sarthakdev143.slideshow_factory.settings.EffectiveConfig;
import github.sarthakdev143.slideshow_factory.settings.SettingKey;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pre-flight: resolves every folder, file and destination a build will touch and lists the
 * media. Every missing item is collected before failing, so one report names them all.
 */
@Component
public class MediaInventoryCollector {

    private final MediaStoreRegistry stores;

    public MediaInventoryCollector(MediaStoreRegistry stores) {
        this.stores = stores;
    }

    public record OutputTarget(MediaSource source, String destination) {

        public String describe() {
            return source.toSettingValue() + ":" + destination;
        }
    }

    public record BuildInputs(List<MediaItem> inventory, List<OutputTarget> outputs) {

        public BuildInputs {
            inventory = List.copyOf(inventory);
            outputs = List.copyOf(outputs);
        }
    }

    public BuildInputs collect(EffectiveConfig config) {
        List<String> missing = new ArrayList<>();
        List<MediaItem> inventory = new ArrayList<>();

        MediaSource imageSource = MediaSource.fromSetting(config.get(SettingKey.IMAGE_SOURCE).value());
        SettingKey imageFolderKey = imageSource == MediaSource.LOCAL
                ? SettingKey.IMAGE_FOLDER
                : SettingKey.NEXTCLOUD_IMAGE_PATH;
        Optional<String> imageFolder = config.text(imageFolderKey);
        collectFolder(imageSource, imageFolder, imageFolderKey, MediaKind.IMAGE, missing, inventory);

        if (config.isEnabled(SettingKey.ENABLE_MUSIC)) {
            MediaSource musicSource = MediaSource.fromSetting(config.get(SettingKey.MUSIC_SOURCE).value());
            Optional<String> musicFolder = config.text(SettingKey.MUSIC_FOLDER);
            if (musicFolder.isEmpty() && musicSource == imageSource) {
                musicFolder = imageFolder;
            }
            if (musicFolder.isPresent()) {
                collectFolder(musicSource, musicFolder, SettingKey.MUSIC_FOLDER, MediaKind.AUDIO, missing, inventory);
            }
        }

        config.text(SettingKey.APPEND_VIDEO_PATH).ifPresent(path -> {
            MediaSource clipSource = MediaSource.fromSetting(config.get(SettingKey.APPEND_VIDEO_SOURCE).value());
            MediaStore store = stores.forSource(clipSource);
            if (!store.isConfigured()) {
                missing.add(connectionLabel(clipSource));
            } else if (!store.exists(path)) {
                missing.add("appended clip " + describe(clipSource, path));
            } else {
                inventory.add(new MediaItem(fileName(path), path, MediaKind.APPENDED_VIDEO, clipSource));
            }
        });

        List<OutputTarget> outputs = new ArrayList<>();
        config.text(SettingKey.OUTPUT_FILEPATH)
                .ifPresent(path -> checkDestination(new OutputTarget(MediaSource.LOCAL, path), missing, outputs));
        config.text(SettingKey.NEXTCLOUD_UPLOAD_PATH)
                .ifPresent(path -> checkDestination(new OutputTarget(MediaSource.NEXTCLOUD, path), missing, outputs));
        if (config.text(SettingKey.OUTPUT_FILEPATH).isEmpty() && config.text(SettingKey.NEXTCLOUD_UPLOAD_PATH).isEmpty()) {
            missing.add("output destination (set OUTPUT_FILEPATH or NEXTCLOUD_UPLOAD_PATH)");
        }

        if (!missing.isEmpty()) {
            throw new ResourceNotFoundException(missing);
        }
        return new BuildInputs(inventory, outputs);
    }

    private void collectFolder(
            MediaSource source,
            Optional<String> folder,
            SettingKey folderKey,
            MediaKind kind,
            List<String> missing,
            List<MediaItem> inventory) {
        if (folder.isEmpty()) {
            missing.add(folderKey.name() + " is not set");
            return;
        }
        MediaStore store = stores.forSource(source);
        if (!store.isConfigured()) {
            missing.add(connectionLabel(source));
            return;
        }
        if (!store.exists(folder.get())) {
            missing.add(kind.name().toLowerCase(Locale.ROOT) + " folder " + describe(source, folder.get()));
            return;
        }
        inventory.addAll(store.list(folder.get(), kind));
    }

    private void checkDestination(OutputTarget target, List<String> missing, List<OutputTarget> outputs) {
        MediaStore store = stores.forSource(target.source());
        if (!store.isConfigured()) {
            missing.add(connectionLabel(target.source()));
            return;
        }
        String parent = parentOf(target.source(), target.destination());
        if (!store.exists(parent)) {
            missing.add("upload destination folder " + describe(target.source(), parent));
            return;
        }
        outputs.add(target);
    }

    static String parentOf(MediaSource source, String location) {
        if (source == MediaSource.LOCAL) {
            Path parent = Path.of(location).toAbsolutePath().getParent();
            return parent == null ? "/" : parent.toString();
        }
        String trimmed = location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
        int slash = trimmed.lastIndexOf('/');
        return slash <= 0 ? "/" : trimmed.substring(0, slash);
    }

    private static String fileName(String location) {
        String trimmed = location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    private static String connectionLabel(MediaSource source) {
        return source.toSettingValue() + " connection settings";
    }

    private static String describe(MediaSource source, String location) {
        return source.toSettingValue() + ":" + location;
    }
}
