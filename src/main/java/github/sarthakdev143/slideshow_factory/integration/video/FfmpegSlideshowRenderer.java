package github.sarthakdev143.slideshow_factory.integration.video;

import github.sarthakdev143.slideshow_factory.config.SlideshowProperties;
import github.sarthakdev143.slideshow_factory.model.OverlayPosition;
import github.sarthakdev143.slideshow_factory.model.plan.AppendedClipPlan;
import github.sarthakdev143.slideshow_factory.model.plan.AssemblyPlan;
import github.sarthakdev143.slideshow_factory.model.plan.AudioPlan;
import github.sarthakdev143.slideshow_factory.model.plan.OverlayPlan;
import github.sarthakdev143.slideshow_factory.model.plan.RenderJob;
import github.sarthakdev143.slideshow_factory.model.plan.SlidePlan;
import github.sarthakdev143.slideshow_factory.service.RenderProgressListener;
import github.sarthakdev143.slideshow_factory.service.SlideshowRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleConsumer;

@Component
public class FfmpegSlideshowRenderer implements SlideshowRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegSlideshowRenderer.class);
    private static final int OUTPUT_TAIL_LINES = 40;
    private static final double EPSILON = 1e-9;

    private static final Band SLIDES = new Band(0.0, 0.45);
    private static final Band SEQUENCE = new Band(0.45, 0.5);
    private static final Band AUDIO = new Band(0.5, 0.7);
    private static final Band APPENDED = new Band(0.7, 0.8);
    private static final Band JOIN = new Band(0.8, 0.85);
    private static final Band COUNTDOWN = new Band(0.85, 1.0);

    private final SlideshowProperties.Render settings;

    public FfmpegSlideshowRenderer(SlideshowProperties properties) {
        this.settings = properties.render();
    }

    @Override
    public void render(RenderJob job, RenderProgressListener listener) throws IOException, InterruptedException {
        AssemblyPlan plan = job.plan();
        if (plan.slides().isEmpty() && plan.appendedClip() == null) {
            throw new IllegalArgumentException("Assembly plan has neither slides nor an appended clip.");
        }

        Path workDir = Files.createTempDirectory("slideshow-render-");
        try {
            List<Path> segments = new ArrayList<>();
            if (!plan.slides().isEmpty()) {
                segments.add(renderSequence(job, workDir, listener));
            }

            if (plan.appendedClip() != null) {
                AppendedClipPlan appended = plan.appendedClip();
                Path normalized = workDir.resolve("appended.mp4");
                runCommand(
                        buildAppendedClipCommand(job.localFile(appended.clip().location()), appended, plan.fps(), normalized),
                        "normalize appended clip",
                        appended.durationSeconds(),
                        fraction -> listener.onProgress(APPENDED.at(fraction), "Preparing appended clip"));
                segments.add(normalized);
            }

            Path joined = segments.get(0);
            if (segments.size() > 1) {
                joined = workDir.resolve("joined.mp4");
                Path listFile = writeConcatList(segments, 1, workDir.resolve("joined.txt"));
                runCommand(buildConcatCommand(listFile, joined), "join segments", 0.0, null);
            }
            listener.onProgress(JOIN.end(), "Segments joined");

            if (plan.overlay() != null) {
                runCommand(
                        buildCountdownCommand(joined, plan.overlay(), job.outputPath()),
                        "draw countdown",
                        plan.totalSeconds(),
                        fraction -> listener.onProgress(COUNTDOWN.at(fraction), "Drawing countdown"));
            } else {
                Files.copy(joined, job.outputPath(), StandardCopyOption.REPLACE_EXISTING);
            }
            listener.onProgress(1.0, "Encoded");
        } finally {
            deleteRecursively(workDir);
        }
    }

    @Override
    public double probeDurationSeconds(Path media) throws IOException, InterruptedException {
        String output = runCommand(buildProbeCommand(media), "probe " + media.getFileName(), 0.0, null);
        for (String line : output.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                logger.debug("Skipping ffprobe line '{}'", trimmed);
            }
        }
        throw new IOException("ffprobe reported no duration for " + media);
    }

    /**
     * One clip per distinct slide, the pass repeated through the concat demuxer, then the
     * background track (or silence) laid under it.
     */
    private Path renderSequence(RenderJob job, Path workDir, RenderProgressListener listener)
            throws IOException, InterruptedException {
        AssemblyPlan plan = job.plan();
        List<Path> slideClips = new ArrayList<>();
        for (int index = 0; index < plan.slides().size(); index++) {
            SlidePlan slide = plan.slides().get(index);
            Path clip = workDir.resolve("slide-" + index + ".mp4");
            runCommand(
                    buildSlideCommand(job.localFile(slide.image().location()), slide.displaySeconds(), plan.fps(), clip),
                    "render slide " + index,
                    0.0,
                    null);
            slideClips.add(clip);
            listener.onProgress(
                    SLIDES.at((index + 1) / (double) plan.slides().size()),
                    "Rendered slide " + (index + 1) + "/" + plan.slides().size());
        }

        Path sequence = workDir.resolve("sequence.mp4");
        Path listFile = writeConcatList(slideClips, plan.repeatCount(), workDir.resolve("sequence.txt"));
        runCommand(buildConcatCommand(listFile, sequence), "repeat slide pass", 0.0, null);
        listener.onProgress(SEQUENCE.end(), "Slide sequence assembled");

        Path withAudio = workDir.resolve("sequence-audio.mp4");
        double sequenceSeconds = plan.slideshowSeconds();
        List<String> audioCommand = plan.audio() != null
                ? buildBackgroundAudioCommand(sequence, plan.audio(), job.localFile(plan.audio().track().location()), withAudio)
                : buildSilentAudioCommand(sequence, sequenceSeconds, withAudio);
        runCommand(
                audioCommand,
                "mux background audio",
                sequenceSeconds,
                fraction -> listener.onProgress(AUDIO.at(fraction), "Mixing audio"));
        return withAudio;
    }

    List<String> buildSlideCommand(Path imagePath, double seconds, int fps, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(settings.ffmpegPath());
        command.add("-y");
        command.add("-loop");
        command.add("1");
        command.add("-framerate");
        command.add(String.valueOf(fps));
        command.add("-i");
        command.add(imagePath.toString());
        command.add("-t");
        command.add(formatSeconds(seconds));
        command.add("-vf");
        command.add(buildScaleFilter() + ",format=yuv420p");
        command.add("-r");
        command.add(String.valueOf(fps));
        command.add("-an");
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-tune");
        command.add("stillimage");
        command.add("-crf");
        command.add("23");
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildConcatCommand(Path listFile, Path outputPath) {
        return List.of(
                settings.ffmpegPath(),
                "-y",
                "-f",
                "concat",
                "-safe",
                "0",
                "-i",
                listFile.toString(),
                "-c",
                "copy",
                outputPath.toString());
    }

    /**
     * Loops the track, cuts it where the fade ends, fades it out and pads with silence up
     * to the end of the sequence.
     */
    List<String> buildBackgroundAudioCommand(Path sequencePath, AudioPlan audio, Path trackPath, Path outputPath) {
        StringBuilder filter = new StringBuilder("[1:a]atrim=0:")
                .append(formatSeconds(audio.audioEndSeconds()))
                .append(",asetpts=PTS-STARTPTS");
        if (audio.fadeSeconds() > EPSILON) {
            filter.append(",afade=t=out:st=")
                    .append(formatSeconds(audio.fadeStartSeconds()))
                    .append(":d=")
                    .append(formatSeconds(audio.fadeSeconds()));
        }
        filter.append(",apad[a]");

        List<String> command = new ArrayList<>();
        command.add(settings.ffmpegPath());
        command.add("-y");
        command.add("-i");
        command.add(sequencePath.toString());
        command.add("-stream_loop");
        command.add("-1");
        command.add("-i");
        command.add(trackPath.toString());
        command.add("-filter_complex");
        command.add(filter.toString());
        command.add("-map");
        command.add("0:v:0");
        command.add("-map");
        command.add("[a]");
        command.add("-c:v");
        command.add("copy");
        addAudioEncoding(command);
        command.add("-t");
        command.add(formatSeconds(audio.sequenceSeconds()));
        addProgress(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildSilentAudioCommand(Path sequencePath, double sequenceSeconds, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(settings.ffmpegPath());
        command.add("-y");
        command.add("-i");
        command.add(sequencePath.toString());
        command.add("-f");
        command.add("lavfi");
        command.add("-i");
        command.add("anullsrc=channel_layout=stereo:sample_rate=44100");
        command.add("-map");
        command.add("0:v:0");
        command.add("-map");
        command.add("1:a:0");
        command.add("-c:v");
        command.add("copy");
        addAudioEncoding(command);
        command.add("-t");
        command.add(formatSeconds(sequenceSeconds));
        addProgress(command);
        command.add(outputPath.toString());
        return command;
    }

    /**
     * Re-encodes the clip to the slide format so the concat demuxer can join it without
     * another pass. A clip without sound simply has no audio stream.
     */
    List<String> buildAppendedClipCommand(Path clipPath, AppendedClipPlan appended, int fps, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(settings.ffmpegPath());
        command.add("-y");
        command.add("-i");
        command.add(clipPath.toString());
        command.add("-t");
        command.add(formatSeconds(appended.durationSeconds()));
        command.add("-map");
        command.add("0:v:0");
        command.add("-map");
        command.add("0:a:0?");
        command.add("-vf");
        command.add(buildScaleFilter() + ",format=yuv420p");
        command.add("-r");
        command.add(String.valueOf(fps));
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-crf");
        command.add("23");
        command.add("-pix_fmt");
        command.add("yuv420p");
        addAudioEncoding(command);
        addProgress(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildCountdownCommand(Path inputPath, OverlayPlan overlay, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(settings.ffmpegPath());
        command.add("-y");
        command.add("-i");
        command.add(inputPath.toString());
        command.add("-vf");
        command.add(buildCountdownFilter(overlay));
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-crf");
        command.add("23");
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-c:a");
        command.add("copy");
        addProgress(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildProbeCommand(Path media) {
        return List.of(
                settings.ffprobePath(),
                "-v",
                "error",
                "-show_entries",
                "format=duration",
                "-of",
                "default=noprint_wrappers=1:nokey=1",
                media.toString());
    }

    /**
     * Remaining time as mm:ss, counting down to the end of the overlay window.
     */
    String buildCountdownFilter(OverlayPlan overlay) {
        OverlayPosition position = overlay.position() == null ? OverlayPosition.TOP_MIDDLE : overlay.position();
        String end = formatSeconds(overlay.endSeconds());
        String remaining = "max(" + end + "-t,0)";
        return "drawtext=text='%{eif\\:trunc(" + remaining + "/60)\\:d\\:2}"
                + "\\:%{eif\\:mod(trunc(" + remaining + "),60)\\:d\\:2}'"
                + ":fontcolor=white:fontsize="
                + settings.height() / 12
                + ":box=1:boxcolor=black@0.45:boxborderw=12:x="
                + position.xExpression()
                + ":y="
                + position.yExpression()
                + ":enable='between(t,"
                + formatSeconds(overlay.startSeconds())
                + ","
                + end
                + ")'";
    }

    String buildScaleFilter() {
        int width = settings.width();
        int height = settings.height();
        return "scale="
                + width
                + ":"
                + height
                + ":force_original_aspect_ratio=decrease,pad="
                + width
                + ":"
                + height
                + ":(ow-iw)/2:(oh-ih)/2:black,setsar=1";
    }

    Path writeConcatList(List<Path> clips, int repeatCount, Path listFile) throws IOException {
        List<String> lines = new ArrayList<>();
        for (int pass = 0; pass < Math.max(1, repeatCount); pass++) {
            for (Path clip : clips) {
                lines.add("file '" + clip.toAbsolutePath().toString().replace("'", "'\\''") + "'");
            }
        }
        Files.write(listFile, lines, StandardCharsets.UTF_8);
        return listFile;
    }

    /**
     * Parses {@code out_time_us} lines of {@code -progress pipe:1} into a 0..1 fraction of
     * {@code expectedSeconds}.
     */
    static Double parseProgress(String line, double expectedSeconds) {
        if (expectedSeconds <= EPSILON) {
            return null;
        }
        String prefix;
        if (line.startsWith("out_time_us=")) {
            prefix = "out_time_us=";
        } else if (line.startsWith("out_time_ms=")) {
            // ffmpeg reports microseconds under this key too
            prefix = "out_time_ms=";
        } else {
            return null;
        }
        try {
            long micros = Long.parseLong(line.substring(prefix.length()).trim());
            return Math.max(0.0, Math.min(1.0, micros / 1_000_000.0 / expectedSeconds));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void addAudioEncoding(List<String> command) {
        command.add("-c:a");
        command.add("aac");
        command.add("-b:a");
        command.add("192k");
        command.add("-ar");
        command.add("44100");
        command.add("-ac");
        command.add("2");
    }

    private void addProgress(List<String> command) {
        command.add("-progress");
        command.add("pipe:1");
        command.add("-nostats");
    }

    private String runCommand(
            List<String> command,
            String stage,
            double expectedSeconds,
            DoubleConsumer progress) throws IOException, InterruptedException {
        logger.info("Running FFmpeg command for stage {}: {}", stage, String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();

        Deque<String> tail = new ArrayDeque<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (progress != null) {
                    Double fraction = parseProgress(line, expectedSeconds);
                    if (fraction != null) {
                        progress.accept(fraction);
                        continue;
                    }
                }
                tail.addLast(line);
                if (tail.size() > OUTPUT_TAIL_LINES) {
                    tail.removeFirst();
                }
            }
        }

        boolean finished = process.waitFor(settings.commandTimeout().toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            throw new IOException("FFmpeg timed out during stage: " + stage);
        }

        String output = String.join(System.lineSeparator(), tail);
        if (process.exitValue() != 0) {
            throw new IOException(
                    "FFmpeg failed during stage "
                            + stage
                            + " with exit code "
                            + process.exitValue()
                            + ". Output: "
                            + output);
        }
        return output;
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    private void deleteRecursively(Path directory) {
        try {
            if (Files.notExists(directory)) {
                return;
            }
            try (var pathStream = Files.walk(directory)) {
                pathStream
                        .sorted((left, right) -> right.compareTo(left))
                        .forEach(this::deleteIfExists);
            }
        } catch (IOException e) {
            logger.debug("Unable to clean up {}: {}", directory, e.getMessage());
        }
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Unable to delete {}: {}", path, e.getMessage());
        }
    }

    private record Band(double start, double end) {

        double at(double fraction) {
            return start + (end - start) * Math.max(0.0, Math.min(1.0, fraction));
        }
    }
}
