package github.sarthakdev143.slideshow_factory.orchestrator;

import github.sarthakdev143.slideshow_factory.config.SchedulingConfig;
import github.sarthakdev143.slideshow_factory.exception.SlideshowException;
import github.sarthakdev143.slideshow_factory.model.BuildOutcome;
import github.sarthakdev143.slideshow_factory.model.BuildRecord;
import github.sarthakdev143.slideshow_factory.model.BuildStage;
import github.sarthakdev143.slideshow_factory.model.ProgressState;
import github.sarthakdev143.slideshow_factory.model.RejectionReason;
import github.sarthakdev143.slideshow_factory.model.SubmissionResult;
import github.sarthakdev143.slideshow_factory.model.TriggerSource;
import github.sarthakdev143.slideshow_factory.service.BuildExecutor;
import github.sarthakdev143.slideshow_factory.service.BuildProgress;
import github.sarthakdev143.slideshow_factory.settings.ConfigurationResolver;
import github.sarthakdev143.slideshow_factory.settings.EffectiveConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Single-flight build gate. {@code activeBuild} is the only mutual-exclusion state: a
 * trigger claims it under {@code monitor} and the worker releases it when the build ends,
 * however the build ends. Every state change and {@link #currentStatus()} share the same
 * monitor, so a status read never mixes two builds.
 */
@Service
public class BuildOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(BuildOrchestrator.class);

    private final ConfigurationResolver configurationResolver;
    private final BuildExecutor buildExecutor;
    private final TaskExecutor taskExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ProgressTracker progressTracker;
    private final Instant startedAt;
    private final Object monitor = new Object();
    private BuildRecord activeBuild;
    private BuildRecord lastBuild;
    private BuildRecord lastSuccessfulBuild;
    private final Counter acceptedCounter;
    private final Counter rejectedCounter;
    private final Counter completedCounter;

    public BuildOrchestrator(
            ConfigurationResolver configurationResolver,
            BuildExecutor buildExecutor,
            @Qualifier(SchedulingConfig.BUILD_EXECUTOR) TaskExecutor taskExecutor,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.configurationResolver = configurationResolver;
        this.buildExecutor = buildExecutor;
        this.taskExecutor = taskExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.progressTracker = new ProgressTracker(clock);
        this.startedAt = clock.instant();
        this.acceptedCounter = meterRegistry.counter("slideshow.builds.accepted");
        this.rejectedCounter = meterRegistry.counter("slideshow.builds.rejected");
        this.completedCounter = meterRegistry.counter("slideshow.builds.completed");
    }

    /**
     * Accepts the trigger when no build is running and hands the build to the worker;
     * otherwise returns immediately with {@link RejectionReason#ALREADY_RUNNING}.
     */
    public SubmissionResult submit(TriggerSource trigger) {
        BuildRecord candidate = BuildRecord.started(UUID.randomUUID().toString(), trigger, clock.instant());
        synchronized (monitor) {
            if (activeBuild != null) {
                rejectedCounter.increment();
                logger.info(
                        "Rejected {} build trigger; build {} is still running",
                        trigger.label(),
                        activeBuild.buildId());
                return SubmissionResult.rejected(RejectionReason.ALREADY_RUNNING, activeBuild);
            }
            activeBuild = candidate;
            progressTracker.enterStage(BuildStage.VALIDATING, "Build accepted");
        }

        acceptedCounter.increment();
        logger.info("Accepted {} build {}", trigger.label(), candidate.buildId());

        try {
            taskExecutor.execute(() -> runBuild(candidate));
        } catch (RuntimeException e) {
            logger.error("Unable to hand build {} to the worker", candidate.buildId(), e);
            complete(candidate.failed(clock.instant(), "Build worker unavailable: " + describe(e)));
            throw new SlideshowException("Unable to start build: " + e.getMessage(), e);
        } catch (Error e) {
            logger.error("Build {} crashed on hand-off", candidate.buildId(), e);
            complete(candidate.failed(clock.instant(), "Build worker crashed: " + describe(e)));
            throw e;
        }
        return SubmissionResult.accepted(candidate);
    }

    public boolean isRunning() {
        synchronized (monitor) {
            return activeBuild != null;
        }
    }

    public Optional<BuildRecord> activeBuild() {
        synchronized (monitor) {
            return Optional.ofNullable(activeBuild);
        }
    }

    public Optional<BuildRecord> lastBuild() {
        synchronized (monitor) {
            return Optional.ofNullable(lastBuild);
        }
    }

    public Optional<BuildRecord> lastSuccessfulBuild() {
        synchronized (monitor) {
            return Optional.ofNullable(lastSuccessfulBuild);
        }
    }

    public ProgressState progress() {
        return progressTracker.snapshot();
    }

    /**
     * Active build, its progress and the last finished builds, all taken from one state.
     */
    public BuildStatus currentStatus() {
        synchronized (monitor) {
            return new BuildStatus(activeBuild, progressTracker.snapshot(), lastBuild, lastSuccessfulBuild);
        }
    }

    public Instant startedAt() {
        return startedAt;
    }

    private void runBuild(BuildRecord build) {
        BuildRecord finished = null;
        try {
            EffectiveConfig config = configurationResolver.resolveAll();
            finished = buildExecutor.execute(build, config, new TrackingProgress(build.buildId()));
        } catch (RuntimeException e) {
            logger.error("Build {} aborted unexpectedly", build.buildId(), e);
            finished = currentRecord(build).failed(clock.instant(), describe(e));
        } catch (Error e) {
            logger.error("Build {} crashed", build.buildId(), e);
            finished = currentRecord(build).failed(clock.instant(), "Build worker crashed: " + describe(e));
            throw e;
        } finally {
            if (finished == null) {
                finished = currentRecord(build).failed(clock.instant(), "Build ended without a result");
            }
            complete(finished);
        }
    }

    private BuildRecord currentRecord(BuildRecord build) {
        synchronized (monitor) {
            return activeBuild != null && activeBuild.buildId().equals(build.buildId()) ? activeBuild : build;
        }
    }

    /**
     * Releases the gate for {@code finished}. A build that is no longer active is ignored,
     * so the worker and the hand-off path can both report the same crash.
     */
    private void complete(BuildRecord finished) {
        synchronized (monitor) {
            if (activeBuild == null || !activeBuild.buildId().equals(finished.buildId())) {
                return;
            }
            lastBuild = finished;
            if (finished.outcome() == BuildOutcome.SUCCEEDED) {
                lastSuccessfulBuild = finished;
            }
            progressTracker.clear();
            activeBuild = null;
        }

        if (finished.outcome() == BuildOutcome.SUCCEEDED) {
            completedCounter.increment();
            logger.info("Build {} finished successfully: {}", finished.buildId(), finished.outputLocation());
        } else {
            meterRegistry.counter(
                    "slideshow.builds.failed",
                    "stage",
                    finished.stage().name().toLowerCase(Locale.ROOT)).increment();
            logger.error(
                    "Build {} failed during {}: {}",
                    finished.buildId(),
                    finished.stage().label(),
                    finished.failureReason());
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private final class TrackingProgress implements BuildProgress {

        private final String buildId;

        private TrackingProgress(String buildId) {
            this.buildId = buildId;
        }

        @Override
        public void enterStage(BuildStage stage, String detail) {
            synchronized (monitor) {
                if (activeBuild != null && activeBuild.buildId().equals(buildId)) {
                    activeBuild = activeBuild.atStage(stage);
                    progressTracker.enterStage(stage, detail);
                }
            }
        }

        @Override
        public void update(BuildStage stage, double fraction, String detail) {
            synchronized (monitor) {
                if (activeBuild != null && activeBuild.buildId().equals(buildId)) {
                    progressTracker.update(stage, fraction, detail);
                }
            }
        }
    }
}
