package github.sarthakdev143.slideshow_factory.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "slideshow.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final int BINARY_CHECK_TIMEOUT_SECONDS = 10;

    private final SlideshowProperties properties;

    public StartupPreflightChecks(SlideshowProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkBinary(properties.render().ffmpegPath(), "FFMPEG_PATH");
        checkBinary(properties.render().ffprobePath(), "FFPROBE_PATH");
        checkDataDirectory();
        if (!properties.matrix().isConfigured()) {
            logger.warn("Matrix is not configured; running in scheduler-only mode");
        } else if (properties.matrix().allowedSenders().isEmpty()) {
            logger.warn("No allowed Matrix senders configured; every chat command will be ignored");
        }
    }

    private void checkBinary(String binary, String environmentVariable) {
        try {
            Process process = new ProcessBuilder(binary, "-version")
                    .redirectErrorStream(true)
                    .start();
            boolean finished = process.waitFor(BINARY_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        binary + " is not runnable. Install FFmpeg or set " + environmentVariable + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    binary + " is not runnable. Install FFmpeg or set " + environmentVariable + ".",
                    e);
        }
    }

    private void checkDataDirectory() {
        Path dataDir = Path.of(properties.dataDir());
        if (!Files.isDirectory(dataDir) || !Files.isWritable(dataDir)) {
            throw new IllegalStateException(
                    "Data directory " + dataDir.toAbsolutePath() + " is missing or not writable.");
        }
    }
}
