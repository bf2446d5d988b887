package github.sarthakdev143.slideshow_factory.model;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One source file. {@code location} is the path inside its {@link MediaSource}; {@code name}
 * is the bare file name used for ordering and reporting. {@code durationSeconds} is only
 * known for appended clips, after probing.
 */
public record MediaItem(
        String name,
        String location,
        MediaKind kind,
        MediaSource source,
        Double durationSeconds) {

    private static final Pattern NUMERIC_PREFIX = Pattern.compile("^(\\d+)");

    /**
     * Numbered names first, ascending by number; everything else after, by name.
     */
    public static final Comparator<MediaItem> ORDER = Comparator
            .comparing((MediaItem item) -> numericPrefix(item.name()) == null)
            .thenComparing(
                    item -> numericPrefix(item.name()),
                    Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(MediaItem::name);

    public MediaItem {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Media item name is required.");
        }
        location = location == null ? name : location;
        source = source == null ? MediaSource.LOCAL : source;
    }

    public MediaItem(String name, String location, MediaKind kind, MediaSource source) {
        this(name, location, kind, source, null);
    }

    public MediaItem withDuration(double seconds) {
        return new MediaItem(name, location, kind, source, seconds);
    }

    static BigInteger numericPrefix(String fileName) {
        Matcher matcher = NUMERIC_PREFIX.matcher(fileName);
        return matcher.find() ? new BigInteger(matcher.group(1)) : null;
    }
}
