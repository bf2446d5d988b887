package github.sarthakdev143.slideshow_factory.service.impl;

import github.sarthakdev143.slideshow_factory.model.BuildRecord;
import github.sarthakdev143.slideshow_factory.model.BuildStage;
import github.sarthakdev143.slideshow_factory.model.MediaItem;
import github.sarthakdev143.slideshow_factory.model.MediaKind;
import github.sarthakdev143.slideshow_factory.model.plan.AssemblyPlan;
import github.sarthakdev143.slideshow_factory.model.plan.RenderJob;
import github.sarthakdev143.slideshow_factory.service.BuildExecutor;
import github.sarthakdev143.slideshow_factory.service.BuildProgress;
import github.sarthakdev143.slideshow_factory.service.SlideshowRenderer;
import github.sarthakdev143.slideshow_factory.service.impl.MediaInventoryCollector.BuildInputs;
import github.sarthakdev143.slideshow_factory.service.impl.MediaInventoryCollector.OutputTarget;
import github.sarthakdev143.slideshow_factory.settings.EffectiveConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class DefaultBuildExecutor implements BuildExecutor {

    private static final Logger logger = LoggerFactory.getLogger(DefaultBuildExecutor.class);

    private final MediaInventoryCollector inventoryCollector;
    private final MediaStoreRegistry stores;
    private final AssemblyPlanner planner;
    private final SlideshowRenderer renderer;
    private final BuildNotifier notifier;
    private final Clock clock;

    public DefaultBuildExecutor(
            MediaInventoryCollector inventoryCollector,
            MediaStoreRegistry stores,
            AssemblyPlanner planner,
            SlideshowRenderer renderer,
            BuildNotifier notifier,
            Clock clock) {
        this.inventoryCollector = inventoryCollector;
        this.stores = stores;
        this.planner = planner;
        this.renderer = renderer;
        this.notifier = notifier;
        this.clock = clock;
    }

    @Override
    public BuildRecord execute(BuildRecord build, EffectiveConfig config, BuildProgress progress) {
        BuildStage stage = BuildStage.VALIDATING;
        Path workDir = null;
        try {
            progress.enterStage(stage, "Checking sources and destinations");
            notifier.buildStarted(build, config);
            BuildInputs inputs = inventoryCollector.collect(config);
            planner.checkFeasible(inputs.inventory(), config);

            stage = BuildStage.FETCHING;
            workDir = Files.createTempDirectory("slideshow-build-");
            List<MediaItem> toFetch = inputs.inventory()
                    .stream()
                    .filter(item -> item.kind() != MediaKind.AUDIO)
                    .toList();
            progress.enterStage(stage, "Fetching " + toFetch.size() + " file(s)");
            Map<String, Path> localFiles = new HashMap<>();
            List<MediaItem> inventory = new ArrayList<>();
            for (int index = 0; index < toFetch.size(); index++) {
                MediaItem item = toFetch.get(index);
                Path localFile = fetch(item, workDir);
                localFiles.put(item.location(), localFile);
                if (item.kind() == MediaKind.APPENDED_VIDEO) {
                    item = item.withDuration(renderer.probeDurationSeconds(localFile));
                }
                inventory.add(item);
                progress.update(stage, (index + 1) / (double) toFetch.size(), "Fetched " + item.name());
            }
            inputs.inventory()
                    .stream()
                    .filter(item -> item.kind() == MediaKind.AUDIO)
                    .forEach(inventory::add);

            stage = BuildStage.ASSEMBLING;
            progress.enterStage(stage, "Planning the timeline");
            AssemblyPlan plan = planner.plan(inventory, config);
            if (plan.audio() != null) {
                MediaItem track = plan.audio().track();
                localFiles.put(track.location(), fetch(track, workDir));
            }
            logger.info(
                    "Build {} plan: {} slide(s) x {} pass(es), appended={}, total={}s",
                    build.buildId(),
                    plan.slides().size(),
                    plan.repeatCount(),
                    plan.appendedClip() != null,
                    String.format(Locale.ROOT, "%.1f", plan.totalSeconds()));

            stage = BuildStage.ENCODING;
            progress.enterStage(stage, "Rendering " + plan.slides().size() + " slide(s)");
            Path rendered = workDir.resolve("slideshow.mp4");
            BuildStage encoding = stage;
            renderer.render(
                    new RenderJob(plan, localFiles, rendered),
                    (fraction, detail) -> progress.update(encoding, fraction, detail));

            stage = BuildStage.UPLOADING;
            progress.enterStage(stage, "Delivering the video");
            for (int index = 0; index < inputs.outputs().size(); index++) {
                OutputTarget target = inputs.outputs().get(index);
                stores.forSource(target.source()).upload(rendered, target.destination());
                progress.update(stage, (index + 1) / (double) inputs.outputs().size(), "Saved " + target.describe());
            }
            String destination = inputs.outputs()
                    .stream()
                    .map(OutputTarget::describe)
                    .collect(Collectors.joining(", "));

            stage = BuildStage.NOTIFYING;
            progress.enterStage(stage, "Sending notifications");
            BuildRecord succeeded = build.atStage(stage).succeeded(clock.instant(), destination, plan.slideNames());
            notifier.buildSucceeded(succeeded, config);
            return succeeded;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(build, stage, "Build was interrupted.", config);
        } catch (IOException | RuntimeException e) {
            logger.error("Build {} failed during {}", build.buildId(), stage.label(), e);
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return fail(build, stage, reason, config);
        } finally {
            deleteRecursively(workDir);
        }
    }

    private Path fetch(MediaItem item, Path workDir) throws IOException {
        Path target = workDir.resolve(item.kind().name().toLowerCase(Locale.ROOT));
        Files.createDirectories(target);
        return stores.forSource(item.source()).fetch(item, target);
    }

    private BuildRecord fail(BuildRecord build, BuildStage stage, String reason, EffectiveConfig config) {
        BuildRecord failed = build.atStage(stage).failed(clock.instant(), reason);
        notifier.buildFailed(failed, config);
        return failed;
    }

    private void deleteRecursively(Path directory) {
        if (directory == null) {
            return;
        }
        try (var pathStream = Files.walk(directory)) {
            pathStream
                    .sorted((left, right) -> right.compareTo(left))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            logger.debug("Unable to delete {}: {}", path, e.getMessage());
                        }
                    });
        } catch (IOException e) {
            logger.debug("Unable to clean up {}: {}", directory, e.getMessage());
        }
    }
}
