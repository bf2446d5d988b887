package github.sarthakdev143.slideshow_factory.model;

import java.util.Locale;
import java.util.Set;

public enum MediaKind {
    IMAGE(Set.of(".jpg", ".jpeg", ".png")),
    AUDIO(Set.of(".mp3", ".m4a", ".ogg", ".wav")),
    APPENDED_VIDEO(Set.of(".mp4", ".mov", ".mkv", ".webm"));

    private final Set<String> extensions;

    MediaKind(Set<String> extensions) {
        this.extensions = extensions;
    }

    public Set<String> extensions() {
        return extensions;
    }

    public boolean matches(String fileName) {
        if (fileName == null) {
            return false;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(lower::endsWith);
    }
}
