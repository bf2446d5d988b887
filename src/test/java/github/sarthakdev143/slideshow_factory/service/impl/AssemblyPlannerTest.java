package github.sarthakdev143.slideshow_factory.service.impl;

import github.sarthakdev143.slideshow_factory.exception.DurationTooShortException;
import github.sarthakdev143.slideshow_factory.exception.EmptyInventoryException;
import github.sarthakdev143.slideshow_factory.model.MediaItem;
import github.sarthakdev143.slideshow_factory.model.MediaKind;
import github.sarthakdev143.slideshow_factory.model.MediaSource;
import github.sarthakdev143.slideshow_factory.model.OverlayPosition;
import github.sarthakdev143.slideshow_factory.model.plan.AssemblyPlan;
import github.sarthakdev143.slideshow_factory.model.plan.AudioPlan;
import github.sarthakdev143.slideshow_factory.model.plan.OverlayPlan;
import github.sarthakdev143.slideshow_factory.model.plan.SlidePlan;
import github.sarthakdev143.slideshow_factory.settings.EffectiveConfig;
import github.sarthakdev143.slideshow_factory.settings.SettingKey;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AssemblyPlannerTest {

    private final AssemblyPlanner planner = new AssemblyPlanner(new Random(7));

    @Test
    void stretchesSlidesInsteadOfRepeatingWhenOnePassFits() {
        EffectiveConfig config = config(Map.of(
                SettingKey.TARGET_VIDEO_DURATION, "600",
                SettingKey.MIN_SLIDE_SECONDS, "5"));

        AssemblyPlan plan = planner.plan(images(20), config);

        assertThat(plan.repeatCount()).isEqualTo(1);
        assertThat(plan.slides()).hasSize(20)
                .allSatisfy(slide -> assertThat(slide.displaySeconds()).isCloseTo(30.0, within(1e-9)));
        assertThat(plan.totalSeconds()).isCloseTo(600.0, within(1e-9));
    }

    @Test
    void prefersSinglePassForSmallInventory() {
        EffectiveConfig config = config(Map.of(SettingKey.TARGET_VIDEO_DURATION, "100"));

        AssemblyPlan plan = planner.plan(images(5), config);

        assertThat(plan.repeatCount()).isEqualTo(1);
        assertThat(plan.slides()).allSatisfy(slide -> assertThat(slide.displaySeconds()).isCloseTo(20.0, within(1e-9)));
    }

    @Test
    void smallInventoryPlaysOnceWithLongSlides() {
        EffectiveConfig config = config(Map.of(
                SettingKey.TARGET_VIDEO_DURATION, "600",
                SettingKey.MIN_SLIDE_SECONDS, "5"));

        AssemblyPlan plan = planner.plan(images(3), config);

        assertThat(plan.repeatCount()).isEqualTo(1);
        assertThat(plan.slides()).hasSize(3)
                .allSatisfy(slide -> assertThat(slide.displaySeconds()).isCloseTo(200.0, within(1e-9)));
        assertThat(plan.totalSeconds()).isCloseTo(600.0, within(1e-9));
    }

    @Test
    void highFloorStillPlaysOnce() {
        EffectiveConfig config = config(Map.of(
                SettingKey.TARGET_VIDEO_DURATION, "600",
                SettingKey.MIN_SLIDE_SECONDS, "150"));

        AssemblyPlan plan = planner.plan(images(3), config);

        assertThat(plan.repeatCount()).isEqualTo(1);
        assertThat(plan.slides()).allSatisfy(slide -> assertThat(slide.displaySeconds()).isGreaterThanOrEqualTo(150.0));
        assertThat(plan.totalSeconds()).isCloseTo(600.0, within(1e-9));
    }

    @Test
    void cutsSinglePassWhenInventoryExceedsTarget() {
        AssemblyPlan plan = planner.plan(images(100), config(Map.of()));

        assertThat(plan.repeatCount()).isEqualTo(1);
        assertThat(plan.slides()).hasSize(60);
        assertThat(plan.slideNames()).startsWith("1.jpg", "2.jpg", "3.jpg");
        assertThat(plan.totalSeconds()).isCloseTo(600.0, within(1e-9));
    }

    @Test
    void shortTailIsFoldedIntoPreviousSlide() {
        AssemblyPlan plan = planner.plan(images(100), config(Map.of(SettingKey.TARGET_VIDEO_DURATION, "601")));

        assertThat(plan.slides()).hasSize(60);
        assertThat(plan.slides().get(59).displaySeconds()).isCloseTo(11.0, within(1e-9));
        assertThat(plan.totalSeconds()).isCloseTo(601.0, within(1e-9));
    }

    @Test
    void tailAboveFloorIsKept() {
        AssemblyPlan plan = planner.plan(images(100), config(Map.of(SettingKey.TARGET_VIDEO_DURATION, "605")));

        assertThat(plan.slides()).hasSize(61);
        assertThat(plan.slides().get(60).displaySeconds()).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void ordersImagesBeforePlanning() {
        List<MediaItem> inventory = new ArrayList<>(List.of(
                image("cover.jpg"), image("10.jpg"), image("a.jpg"), image("2.jpg"), image("1.jpg")));
        Collections.shuffle(inventory, new Random(3));

        AssemblyPlan plan = planner.plan(inventory, config(Map.of(SettingKey.TARGET_VIDEO_DURATION, "50")));

        assertThat(plan.slideNames()).containsExactly("1.jpg", "2.jpg", "10.jpg", "a.jpg", "cover.jpg");
    }

    @Test
    void appendedClipTakesTimeFromSlideshow() {
        List<MediaItem> inventory = new ArrayList<>(images(20));
        inventory.add(clip(120.0));

        AssemblyPlan plan = planner.plan(inventory, config(Map.of()));

        assertThat(plan.slideshowSeconds()).isCloseTo(480.0, within(1e-9));
        assertThat(plan.appended()).get().satisfies(appended -> {
            assertThat(appended.startSeconds()).isCloseTo(480.0, within(1e-9));
            assertThat(appended.durationSeconds()).isCloseTo(120.0, within(1e-9));
            assertThat(appended.trimmed()).isFalse();
        });
        assertThat(plan.totalSeconds()).isCloseTo(600.0, within(1e-9));
    }

    @Test
    void appendedClipLongerThanTargetIsTrimmedAndReplacesSlides() {
        List<MediaItem> inventory = new ArrayList<>(images(3));
        inventory.add(clip(700.0));

        AssemblyPlan plan = planner.plan(inventory, config(Map.of()));

        assertThat(plan.slides()).isEmpty();
        assertThat(plan.repeatCount()).isZero();
        assertThat(plan.audio()).isNull();
        assertThat(plan.appendedClip().trimmed()).isTrue();
        assertThat(plan.appendedClip().durationSeconds()).isCloseTo(600.0, within(1e-9));
        assertThat(plan.totalSeconds()).isCloseTo(600.0, within(1e-9));
    }

    @Test
    void remainderBelowFloorAfterAppendedClipIsRejected() {
        List<MediaItem> inventory = new ArrayList<>(images(3));
        inventory.add(clip(599.0));

        assertThatThrownBy(() -> planner.plan(inventory, config(Map.of())))
                .isInstanceOf(DurationTooShortException.class)
                .satisfies(error -> assertThat(((DurationTooShortException) error).availableSeconds())
                        .isCloseTo(1.0, within(1e-9)));
    }

    @Test
    void appendedClipWithoutProbedDurationIsRejected() {
        List<MediaItem> inventory = new ArrayList<>(images(3));
        inventory.add(new MediaItem("outro.mp4", "/media/outro.mp4", MediaKind.APPENDED_VIDEO, MediaSource.LOCAL));

        assertThatThrownBy(() -> planner.plan(inventory, config(Map.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outro.mp4");
    }

    @Test
    void emptyInventoryIsReported() {
        List<MediaItem> onlyAudio = List.of(track("song.mp3"));

        assertThatThrownBy(() -> planner.plan(onlyAudio, config(Map.of())))
                .isInstanceOf(EmptyInventoryException.class);
        assertThatThrownBy(() -> planner.checkFeasible(onlyAudio, config(Map.of())))
                .isInstanceOf(EmptyInventoryException.class);
    }

    @Test
    void targetBelowFloorIsReportedNotClamped() {
        EffectiveConfig config = config(Map.of(
                SettingKey.TARGET_VIDEO_DURATION, "1",
                SettingKey.MIN_SLIDE_SECONDS, "2"));

        assertThatThrownBy(() -> planner.checkFeasible(images(4), config))
                .isInstanceOf(DurationTooShortException.class);
        assertThatThrownBy(() -> planner.plan(images(4), config))
                .isInstanceOf(DurationTooShortException.class);
    }

    @Test
    void fadeEndsBeforeTrailingSilence() {
        List<MediaItem> inventory = new ArrayList<>(images(20));
        inventory.add(track("a.mp3"));
        inventory.add(track("b.mp3"));

        AssemblyPlan plan = planner.plan(inventory, config(Map.of()));

        AudioPlan audio = plan.backgroundAudio().orElseThrow();
        assertThat(audio.fadeStartSeconds()).isCloseTo(600.0 - 10.0 - 5.0, within(1e-9));
        assertThat(audio.fadeSeconds()).isCloseTo(10.0, within(1e-9));
        assertThat(audio.trailingSilenceSeconds()).isCloseTo(5.0, within(1e-9));
        assertThat(audio.audioEndSeconds()).isCloseTo(595.0, within(1e-9));
        assertThat(audio.track().name()).isIn("a.mp3", "b.mp3");
    }

    @Test
    void sameSeedPicksSameTrack() {
        List<MediaItem> inventory = new ArrayList<>(images(5));
        IntStream.range(0, 8).forEach(index -> inventory.add(track("track-" + index + ".mp3")));

        AssemblyPlan first = new AssemblyPlanner(new Random(99)).plan(inventory, config(Map.of()));
        AssemblyPlan second = new AssemblyPlanner(new Random(99)).plan(inventory, config(Map.of()));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void audioDisabledOrMissingProducesSilentPlan() {
        List<MediaItem> withTrack = new ArrayList<>(images(5));
        withTrack.add(track("song.mp3"));

        assertThat(planner.plan(withTrack, config(Map.of(SettingKey.ENABLE_MUSIC, "false"))).audio()).isNull();
        assertThat(planner.plan(images(5), config(Map.of())).audio()).isNull();
    }

    @Test
    void shortSequenceShrinksFadeInsteadOfGoingNegative() {
        List<MediaItem> inventory = new ArrayList<>(images(1));
        inventory.add(track("song.mp3"));

        AssemblyPlan plan = planner.plan(inventory, config(Map.of(SettingKey.TARGET_VIDEO_DURATION, "8")));

        AudioPlan audio = plan.audio();
        assertThat(audio.fadeStartSeconds()).isZero();
        assertThat(audio.fadeSeconds()).isCloseTo(3.0, within(1e-9));
        assertThat(audio.audioEndSeconds() + audio.trailingSilenceSeconds()).isCloseTo(8.0, within(1e-9));
    }

    @Test
    void countdownCoversLastMinutes() {
        EffectiveConfig config = config(Map.of(
                SettingKey.ENABLE_TIMER, "true",
                SettingKey.TIMER_MINUTES, "5",
                SettingKey.TIMER_POSITION, "bottom-right"));

        OverlayPlan overlay = planner.plan(images(20), config).overlay();

        assertThat(overlay.startSeconds()).isCloseTo(300.0, within(1e-9));
        assertThat(overlay.endSeconds()).isCloseTo(600.0, within(1e-9));
        assertThat(overlay.position()).isEqualTo(OverlayPosition.BOTTOM_RIGHT);
    }

    @Test
    void countdownLongerThanVideoIsClipped() {
        EffectiveConfig config = config(Map.of(
                SettingKey.ENABLE_TIMER, "true",
                SettingKey.TIMER_MINUTES, "20"));

        OverlayPlan overlay = planner.plan(images(20), config).overlay();

        assertThat(overlay.startSeconds()).isZero();
        assertThat(overlay.durationSeconds()).isCloseTo(600.0, within(1e-9));
        assertThat(overlay.position()).isEqualTo(OverlayPosition.TOP_MIDDLE);
    }

    @Test
    void timerDisabledByDefault() {
        assertThat(planner.plan(images(20), config(Map.of())).countdown()).isEmpty();
    }

    @Test
    void totalMatchesTargetWithinOneFrameAcrossInputs() {
        int[] imageCounts = {1, 2, 3, 7, 20, 50};
        int[] targets = {2, 5, 59, 60, 61, 100, 333, 600, 3600};
        int[] floors = {1, 2, 5};

        for (int imageCount : imageCounts) {
            for (int target : targets) {
                for (int floor : floors) {
                    if (target < floor) {
                        continue;
                    }
                    EffectiveConfig config = config(Map.of(
                            SettingKey.TARGET_VIDEO_DURATION, String.valueOf(target),
                            SettingKey.MIN_SLIDE_SECONDS, String.valueOf(floor)));

                    AssemblyPlan plan = planner.plan(images(imageCount), config);

                    String label = "n=" + imageCount + " target=" + target + " floor=" + floor;
                    assertThat(plan.totalSeconds()).as(label).isCloseTo(target, within(plan.frameIntervalSeconds()));
                    assertThat(plan.repeatCount()).as(label).isGreaterThanOrEqualTo(1);
                    assertThat(plan.slides()).as(label)
                            .extracting(SlidePlan::displaySeconds)
                            .allSatisfy(seconds -> assertThat(seconds).isGreaterThanOrEqualTo(floor - 1e-9));
                }
            }
        }
    }

    private static EffectiveConfig config(Map<SettingKey, String> overrides) {
        return EffectiveConfig.defaults().with(overrides);
    }

    private static List<MediaItem> images(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(index -> image(index + ".jpg"))
                .toList();
    }

    private static MediaItem image(String name) {
        return new MediaItem(name, "/media/images/" + name, MediaKind.IMAGE, MediaSource.LOCAL);
    }

    private static MediaItem track(String name) {
        return new MediaItem(name, "/media/music/" + name, MediaKind.AUDIO, MediaSource.LOCAL);
    }

    private static MediaItem clip(double seconds) {
        return new MediaItem("outro.mp4", "/media/outro.mp4", MediaKind.APPENDED_VIDEO, MediaSource.LOCAL)
                .withDuration(seconds);
    }
}
