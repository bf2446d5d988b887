package github.sarthakdev143.slideshow_factory.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Process-level settings: endpoints, credentials and file locations. None of these can be
 * changed from chat; the overridable surface lives in {@code SettingKey}.
 */
@Validated
@ConfigurationProperties(prefix = "slideshow")
public record SlideshowProperties(
        @NotBlank String dataDir,
        String version,
        @Valid Render render,
        @Valid Nextcloud nextcloud,
        @Valid Matrix matrix,
        @Valid Ntfy ntfy,
        @Valid Heartbeat heartbeat) {

    public SlideshowProperties {
        dataDir = dataDir == null || dataDir.isBlank() ? "/data" : dataDir;
        version = version == null || version.isBlank() ? "dev" : version;
        render = render == null ? new Render(null, null, 0, 0, null) : render;
        nextcloud = nextcloud == null ? new Nextcloud(null, null, null, false, null) : nextcloud;
        matrix = matrix == null ? new Matrix(null, null, null, null, null, null) : matrix;
        ntfy = ntfy == null ? new Ntfy(null, null) : ntfy;
        heartbeat = heartbeat == null ? new Heartbeat(null, null, null) : heartbeat;
    }

    public record Render(
            String ffmpegPath,
            String ffprobePath,
            @Positive int width,
            @Positive int height,
            Duration commandTimeout) {

        public Render {
            ffmpegPath = ffmpegPath == null || ffmpegPath.isBlank() ? "ffmpeg" : ffmpegPath;
            ffprobePath = ffprobePath == null || ffprobePath.isBlank() ? "ffprobe" : ffprobePath;
            width = width <= 0 ? 1920 : width;
            height = height <= 0 ? 1080 : height;
            commandTimeout = commandTimeout == null ? Duration.ofMinutes(60) : commandTimeout;
        }
    }

    public record Nextcloud(
            String url,
            String username,
            String password,
            boolean insecureSsl,
            Duration timeout) {

        public Nextcloud {
            timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        }

        public boolean isConfigured() {
            return url != null && !url.isBlank() && username != null && !username.isBlank();
        }
    }

    public record Matrix(
            String homeserver,
            String accessToken,
            String roomId,
            String userId,
            List<String> allowedSenders,
            Duration syncTimeout) {

        public Matrix {
            allowedSenders = allowedSenders == null ? List.of() : List.copyOf(allowedSenders);
            syncTimeout = syncTimeout == null ? Duration.ofSeconds(30) : syncTimeout;
        }

        public boolean isConfigured() {
            return homeserver != null && !homeserver.isBlank()
                    && accessToken != null && !accessToken.isBlank()
                    && roomId != null && !roomId.isBlank();
        }
    }

    public record Ntfy(String url, String token) {

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }
    }

    public record Heartbeat(String file, Duration interval, Duration staleAfter) {

        public Heartbeat {
            file = file == null || file.isBlank() ? "/tmp/heartbeat" : file;
            interval = interval == null ? Duration.ofMinutes(1) : interval;
            staleAfter = staleAfter == null ? Duration.ofMinutes(5) : staleAfter;
        }
    }
}
