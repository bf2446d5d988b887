package github.sarthakdev143.slideshow_factory.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class MediaItemTest {

    @Test
    void numberedNamesSortNumericallyBeforeOthers() {
        List<MediaItem> items = new ArrayList<>(Stream.of("1.jpg", "2.jpg", "10.jpg", "cover.jpg", "a.jpg")
                .map(name -> new MediaItem(name, null, MediaKind.IMAGE, MediaSource.LOCAL))
                .toList());

        items.sort(MediaItem.ORDER);

        assertThat(items).extracting(MediaItem::name)
                .containsExactly("1.jpg", "2.jpg", "10.jpg", "a.jpg", "cover.jpg");
    }

    @Test
    void sameNumberFallsBackToName() {
        List<MediaItem> items = new ArrayList<>(Stream.of("3b.jpg", "03a.jpg", "3.png")
                .map(name -> new MediaItem(name, null, MediaKind.IMAGE, MediaSource.LOCAL))
                .toList());

        items.sort(MediaItem.ORDER);

        assertThat(items).extracting(MediaItem::name).containsExactly("03a.jpg", "3.png", "3b.jpg");
    }

    @Test
    void numericPrefixHandlesVeryLongNumbers() {
        assertThat(MediaItem.numericPrefix("123456789012345678901234567890-final.jpg"))
                .isEqualTo(new BigInteger("123456789012345678901234567890"));
        assertThat(MediaItem.numericPrefix("slide-1.jpg")).isNull();
    }

    @Test
    void locationDefaultsToName() {
        MediaItem item = new MediaItem("a.jpg", null, MediaKind.IMAGE, null);

        assertThat(item.location()).isEqualTo("a.jpg");
        assertThat(item.source()).isEqualTo(MediaSource.LOCAL);
    }

    @Test
    void mediaKindMatchesExtensionsCaseInsensitively() {
        assertThat(MediaKind.IMAGE.matches("HOLIDAY.JPEG")).isTrue();
        assertThat(MediaKind.AUDIO.matches("track.m4a")).isTrue();
        assertThat(MediaKind.IMAGE.matches("notes.txt")).isFalse();
    }
}
