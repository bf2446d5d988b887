package github.sarthakdev143.slideshow_factory.model.plan;

import java.util.List;
import java.util.Optional;

/**
 * Timeline for one build. {@code slides} is a single pass; the pass is played
 * {@code repeatCount} times, then the appended clip (if any) follows.
 */
public record AssemblyPlan(
        List<SlidePlan> slides,
        int repeatCount,
        AppendedClipPlan appendedClip,
        AudioPlan audio,
        OverlayPlan overlay,
        double targetSeconds,
        int fps) {

    public AssemblyPlan {
        slides = slides == null ? List.of() : List.copyOf(slides);
    }

    public double passSeconds() {
        return slides.stream().mapToDouble(SlidePlan::displaySeconds).sum();
    }

    public double slideshowSeconds() {
        return passSeconds() * repeatCount;
    }

    public double totalSeconds() {
        double appended = appendedClip == null ? 0.0 : appendedClip.durationSeconds();
        return slideshowSeconds() + appended;
    }

    public double frameIntervalSeconds() {
        return 1.0 / fps;
    }

    public Optional<AppendedClipPlan> appended() {
        return Optional.ofNullable(appendedClip);
    }

    public Optional<AudioPlan> backgroundAudio() {
        return Optional.ofNullable(audio);
    }

    public Optional<OverlayPlan> countdown() {
        return Optional.ofNullable(overlay);
    }

    public List<String> slideNames() {
        return slides.stream()
                .map(slide -> slide.image().name())
                .toList();
    }
}
