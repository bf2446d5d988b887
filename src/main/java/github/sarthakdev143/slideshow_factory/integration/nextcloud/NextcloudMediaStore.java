package github.sarthakdev143.slideshow_factory.integration.nextcloud;

import github.sarthakdev143.slideshow_factory.config.SlideshowProperties;
import github.sarthakdev143.slideshow_factory.exception.ResourceNotFoundException;
import github.sarthakdev143.slideshow_factory.exception.TransportException;
import github.sarthakdev143.slideshow_factory.model.MediaItem;
import github.sarthakdev143.slideshow_factory.model.MediaKind;
import github.sarthakdev143.slideshow_factory.model.MediaSource;
import github.sarthakdev143.slideshow_factory.service.MediaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.StreamingHttpOutputMessage;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriUtils;

import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Nextcloud over WebDAV: {@code <url>/remote.php/dav/files/<user>/<path>}.
 */
@Component
public class NextcloudMediaStore implements MediaStore {

    private static final Logger logger = LoggerFactory.getLogger(NextcloudMediaStore.class);
    private static final HttpMethod PROPFIND = HttpMethod.valueOf("PROPFIND");
    private static final String PROPFIND_BODY = """
            <?xml version="1.0" encoding="utf-8"?>
            <d:propfind xmlns:d="DAV:">
              <d:prop><d:resourcetype/></d:prop>
            </d:propfind>
            """;

    private final RestTemplate restTemplate;
    private final SlideshowProperties.Nextcloud settings;
    private final WebDavListingParser listingParser = new WebDavListingParser();

    public NextcloudMediaStore(
            @Qualifier("nextcloudRestTemplate") RestTemplate restTemplate,
            SlideshowProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.nextcloud();
    }

    @Override
    public MediaSource source() {
        return MediaSource.NEXTCLOUD;
    }

    @Override
    public boolean isConfigured() {
        return settings.isConfigured();
    }

    @Override
    public List<MediaItem> list(String folder, MediaKind kind) {
        String body = propfind(folder, "1");
        if (body == null) {
            throw new ResourceNotFoundException(List.of("Nextcloud folder " + folder));
        }
        return listingParser.parse(body)
                .stream()
                .filter(entry -> !entry.collection())
                .filter(entry -> kind.matches(entry.name()))
                .map(entry -> new MediaItem(entry.name(), join(folder, entry.name()), kind, MediaSource.NEXTCLOUD))
                .sorted(MediaItem.ORDER)
                .toList();
    }

    @Override
    public boolean exists(String location) {
        return propfind(location, "0") != null;
    }

    /**
     * Whether the server answers for the user's root folder. Used by the status report.
     */
    public boolean isReachable() {
        if (!isConfigured()) {
            return false;
        }
        try {
            return exists("/");
        } catch (TransportException e) {
            logger.debug("Nextcloud unreachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Path fetch(MediaItem item, Path targetDirectory) {
        Path target = targetDirectory.resolve(item.name());
        try {
            restTemplate.execute(
                    fileUri(item.location()),
                    HttpMethod.GET,
                    request -> request.getHeaders().setBasicAuth(
                            settings.username(),
                            settings.password(),
                            StandardCharsets.UTF_8),
                    response -> {
                        try (InputStream body = response.getBody()) {
                            Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
                        }
                        return target;
                    });
            return target;
        } catch (HttpClientErrorException.NotFound e) {
            throw new ResourceNotFoundException(List.of("Nextcloud file " + item.location()));
        } catch (RestClientException e) {
            throw new TransportException("Download of " + item.location() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void upload(Path localFile, String destination) {
        try {
            restTemplate.execute(
                    fileUri(destination),
                    HttpMethod.PUT,
                    request -> {
                        HttpHeaders headers = request.getHeaders();
                        headers.setBasicAuth(settings.username(), settings.password(), StandardCharsets.UTF_8);
                        headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
                        headers.setContentLength(Files.size(localFile));
                        if (request instanceof StreamingHttpOutputMessage streaming) {
                            streaming.setBody(body -> Files.copy(localFile, body));
                        } else {
                            Files.copy(localFile, request.getBody());
                        }
                    },
                    response -> null);
            logger.info("Uploaded {} to Nextcloud {}", localFile.getFileName(), destination);
        } catch (HttpClientErrorException.Conflict | HttpClientErrorException.NotFound e) {
            throw new ResourceNotFoundException(List.of("Nextcloud folder " + parentOf(destination)));
        } catch (RestClientException e) {
            throw new TransportException("Upload to " + destination + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * @return the multistatus body, or {@code null} when the resource does not exist
     */
    private String propfind(String location, String depth) {
        if (!isConfigured()) {
            throw new TransportException("Nextcloud connection is not configured.");
        }
        try {
            return restTemplate.execute(
                    fileUri(location),
                    PROPFIND,
                    request -> {
                        HttpHeaders headers = request.getHeaders();
                        headers.setBasicAuth(settings.username(), settings.password(), StandardCharsets.UTF_8);
                        headers.set("Depth", depth);
                        headers.setContentType(MediaType.APPLICATION_XML);
                        request.getBody().write(PROPFIND_BODY.getBytes(StandardCharsets.UTF_8));
                    },
                    response -> new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8));
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                return null;
            }
            throw new TransportException("PROPFIND " + location + " failed: " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new TransportException("PROPFIND " + location + " failed: " + e.getMessage(), e);
        }
    }

    URI fileUri(String location) {
        String base = settings.url().endsWith("/")
                ? settings.url().substring(0, settings.url().length() - 1)
                : settings.url();
        String encodedPath = Arrays.stream(location.split("/"))
                .filter(segment -> !segment.isEmpty())
                .map(segment -> UriUtils.encodePathSegment(segment, StandardCharsets.UTF_8))
                .collect(Collectors.joining("/"));
        String user = UriUtils.encodePathSegment(settings.username(), StandardCharsets.UTF_8);
        return URI.create(base + "/remote.php/dav/files/" + user + "/" + encodedPath);
    }

    static String join(String folder, String name) {
        return folder.endsWith("/") ? folder + name : folder + "/" + name;
    }

    static String parentOf(String location) {
        String trimmed = location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
        int slash = trimmed.lastIndexOf('/');
        return slash <= 0 ? "/" : trimmed.substring(0, slash);
    }
}
