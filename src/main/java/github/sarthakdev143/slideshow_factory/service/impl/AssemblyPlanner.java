package github.sarthakdev143.slideshow_factory.service.impl;

import github.sarthakdev143.slideshow_factory.exception.DurationTooShortException;
import github.sarthakdev143.slideshow_factory.exception.EmptyInventoryException;
import github.sarthakdev143.slideshow_factory.model.MediaItem;
import github.sarthakdev143.slideshow_factory.model.MediaKind;
import github.sarthakdev143.slideshow_factory.model.OverlayPosition;
import github.sarthakdev143.slideshow_factory.model.plan.AppendedClipPlan;
import github.sarthakdev143.slideshow_factory.model.plan.AssemblyPlan;
import github.sarthakdev143.slideshow_factory.model.plan.AudioPlan;
import github.sarthakdev143.slideshow_factory.model.plan.OverlayPlan;
import github.sarthakdev143.slideshow_factory.model.plan.SlidePlan;
import github.sarthakdev143.slideshow_factory.settings.EffectiveConfig;
import github.sarthakdev143.slideshow_factory.settings.SettingKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Turns an inventory and a settings snapshot into an {@link AssemblyPlan}. No I/O; the
 * appended clip's duration must already be on its {@link MediaItem}.
 */
@Component
public class AssemblyPlanner {

    private static final double EPSILON = 1e-9;

    private final Random random;

    public AssemblyPlanner() {
        this(new Random());
    }

    public AssemblyPlanner(Random random) {
        this.random = random;
    }

    /**
     * Rejects inventories that can never be planned, before anything is downloaded.
     */
    public void checkFeasible(List<MediaItem> inventory, EffectiveConfig config) {
        long imageCount = inventory.stream().filter(item -> item.kind() == MediaKind.IMAGE).count();
        if (imageCount == 0) {
            throw new EmptyInventoryException("No images found in the configured image source.");
        }

        boolean hasAppendedClip = inventory.stream().anyMatch(item -> item.kind() == MediaKind.APPENDED_VIDEO);
        int target = config.intValue(SettingKey.TARGET_VIDEO_DURATION);
        int floor = config.intValue(SettingKey.MIN_SLIDE_SECONDS);
        if (!hasAppendedClip && target < floor) {
            throw new DurationTooShortException(target, floor);
        }
    }

    public AssemblyPlan plan(List<MediaItem> inventory, EffectiveConfig config) {
        List<MediaItem> images = new ArrayList<>();
        List<MediaItem> audioCandidates = new ArrayList<>();
        MediaItem appendedClip = null;

        for (MediaItem item : inventory) {
            switch (item.kind()) {
                case IMAGE -> images.add(item);
                case AUDIO -> audioCandidates.add(item);
                case APPENDED_VIDEO -> {
                    if (appendedClip == null) {
                        appendedClip = item;
                    }
                }
            }
        }

        if (images.isEmpty()) {
            throw new EmptyInventoryException("No images found in the configured image source.");
        }
        images.sort(MediaItem.ORDER);
        audioCandidates.sort(MediaItem.ORDER);

        double target = config.intValue(SettingKey.TARGET_VIDEO_DURATION);
        double floor = config.intValue(SettingKey.MIN_SLIDE_SECONDS);
        double preferred = Math.max(config.intValue(SettingKey.IMAGE_DURATION), floor);
        int fps = Math.max(1, config.intValue(SettingKey.VIDEO_FPS));

        if (target <= EPSILON) {
            throw new DurationTooShortException(target, floor);
        }

        AppendedClipPlan appendedPlan = null;
        double remainder = target;
        if (appendedClip != null) {
            appendedPlan = planAppendedClip(appendedClip, target);
            remainder = target - appendedPlan.durationSeconds();
        }

        List<SlidePlan> slides = List.of();
        int repeatCount = 0;
        if (remainder > EPSILON) {
            if (remainder < floor - EPSILON) {
                throw new DurationTooShortException(remainder, floor);
            }
            repeatCount = 1;
            if (images.size() * preferred >= remainder - EPSILON) {
                slides = cutSinglePass(images, remainder, preferred, floor);
            } else {
                // stretched slides are longer than IMAGE_DURATION, hence above the floor
                double perSlideSeconds = remainder / images.size();
                slides = images.stream()
                        .map(image -> new SlidePlan(image, perSlideSeconds))
                        .toList();
            }
        }

        double slideshowSeconds = remainder > EPSILON ? remainder : 0.0;
        AudioPlan audioPlan = planAudio(audioCandidates, slideshowSeconds, config);
        OverlayPlan overlayPlan = planOverlay(target, config);

        return new AssemblyPlan(slides, repeatCount, appendedPlan, audioPlan, overlayPlan, target, fps);
    }

    private AppendedClipPlan planAppendedClip(MediaItem clip, double target) {
        if (clip.durationSeconds() == null) {
            throw new IllegalArgumentException("Appended clip " + clip.name() + " has no probed duration.");
        }
        double clipSeconds = clip.durationSeconds();
        boolean trimmed = clipSeconds > target + EPSILON;
        double keptSeconds = Math.min(clipSeconds, target);
        return new AppendedClipPlan(clip, target - keptSeconds, keptSeconds, trimmed);
    }

    /**
     * Slides at the preferred duration until the budget runs out. A tail shorter than the
     * floor is folded into the slide before it.
     */
    private List<SlidePlan> cutSinglePass(List<MediaItem> images, double budget, double preferred, double floor) {
        List<SlidePlan> slides = new ArrayList<>();
        double elapsed = 0.0;
        for (MediaItem image : images) {
            double left = budget - elapsed;
            if (left <= EPSILON) {
                break;
            }
            double seconds = Math.min(preferred, left);
            slides.add(new SlidePlan(image, seconds));
            elapsed += seconds;
        }

        int last = slides.size() - 1;
        if (last > 0 && slides.get(last).displaySeconds() < floor - EPSILON) {
            SlidePlan tail = slides.remove(last);
            SlidePlan previous = slides.remove(last - 1);
            slides.add(new SlidePlan(previous.image(), previous.displaySeconds() + tail.displaySeconds()));
        }
        return slides;
    }

    private AudioPlan planAudio(List<MediaItem> candidates, double sequenceSeconds, EffectiveConfig config) {
        if (!config.isEnabled(SettingKey.ENABLE_MUSIC) || candidates.isEmpty() || sequenceSeconds <= EPSILON) {
            return null;
        }

        MediaItem track = candidates.get(random.nextInt(candidates.size()));
        double fadeSeconds = config.intValue(SettingKey.AUDIO_FADE_SECONDS);
        double silenceSeconds = Math.min(config.intValue(SettingKey.AUDIO_TRAILING_SILENCE_SECONDS), sequenceSeconds);
        double audioEnd = sequenceSeconds - silenceSeconds;
        double fadeStart = Math.max(0.0, audioEnd - fadeSeconds);
        return new AudioPlan(track, fadeStart, audioEnd - fadeStart, silenceSeconds, sequenceSeconds);
    }

    private OverlayPlan planOverlay(double totalSeconds, EffectiveConfig config) {
        if (!config.isEnabled(SettingKey.ENABLE_TIMER)) {
            return null;
        }
        double windowSeconds = config.intValue(SettingKey.TIMER_MINUTES) * 60.0;
        if (windowSeconds <= EPSILON) {
            return null;
        }
        double start = Math.max(0.0, totalSeconds - windowSeconds);
        OverlayPosition position = OverlayPosition.fromSetting(config.get(SettingKey.TIMER_POSITION).value());
        return new OverlayPlan(start, totalSeconds, position);
    }
}
