package github.sarthakdev143.slideshow_factory.orchestrator;

import github.sarthakdev143.slideshow_factory.model.BuildStage;
import github.sarthakdev143.slideshow_factory.model.ProgressState;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single owner of the live {@link ProgressState}. Writers swap whole snapshots; readers
 * never see a half-applied update.
 */
public class ProgressTracker {

    private final Clock clock;
    private final AtomicReference<ProgressState> state;

    public ProgressTracker(Clock clock) {
        this.clock = clock;
        this.state = new AtomicReference<>(ProgressState.idle(0, clock.instant()));
    }

    public ProgressState snapshot() {
        return state.get();
    }

    public ProgressState enterStage(BuildStage stage, String detail) {
        return state.updateAndGet(current -> new ProgressState(
                current.sequence() + 1,
                stage,
                0.0,
                detail,
                clock.instant()));
    }

    /**
     * Ignored when {@code stage} is no longer the current stage, so a late report from a
     * finished stage cannot overwrite the next one.
     */
    public ProgressState update(BuildStage stage, double fraction, String detail) {
        return state.updateAndGet(current -> {
            if (current.stage() != stage) {
                return current;
            }
            double bounded = Math.max(current.fraction(), Math.min(1.0, Math.max(0.0, fraction)));
            return new ProgressState(
                    current.sequence(),
                    stage,
                    bounded,
                    detail == null ? current.detail() : detail,
                    clock.instant());
        });
    }

    public ProgressState clear() {
        return state.updateAndGet(current -> ProgressState.idle(current.sequence() + 1, clock.instant()));
    }
}
