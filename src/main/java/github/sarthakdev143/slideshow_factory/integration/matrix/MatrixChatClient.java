package github.sarthakdev143.slideshow_factory.integration.matrix;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.slideshow_factory.config.SlideshowProperties;
import github.sarthakdev143.slideshow_factory.exception.TransportException;
import github.sarthakdev143.slideshow_factory.model.ChatMessage;
import github.sarthakdev143.slideshow_factory.service.ChatChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal Matrix client-server API client: join, long-poll sync and plain-text sends in
 * one room. Encrypted rooms are not supported.
 */
@Component
public class MatrixChatClient implements ChatChannel {

    private static final Logger logger = LoggerFactory.getLogger(MatrixChatClient.class);
    private static final String API_PREFIX = "/_matrix/client/v3";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final SlideshowProperties.Matrix settings;
    private final AtomicLong transactionCounter = new AtomicLong();
    private final String transactionPrefix = UUID.randomUUID().toString().substring(0, 8);
    private volatile String roomId;
    private volatile String userId;

    public MatrixChatClient(
            @Qualifier("matrixRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            SlideshowProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settings = properties.matrix();
        this.roomId = settings.roomId();
        this.userId = settings.userId();
    }

    @Override
    public boolean isConfigured() {
        return settings.isConfigured();
    }

    public String roomId() {
        return roomId;
    }

    public String userId() {
        return userId;
    }

    /**
     * Joins the configured room (a no-op when already joined) and learns the bot's own
     * user id when it was not configured.
     */
    public void connect() {
        JsonNode joined = call(
                HttpMethod.POST,
                URI.create(baseUrl() + API_PREFIX + "/join/" + encodePath(settings.roomId())),
                Map.of());
        String joinedRoom = joined.path("room_id").asText(null);
        if (joinedRoom != null) {
            roomId = joinedRoom;
        }
        if (userId == null || userId.isBlank()) {
            userId = call(HttpMethod.GET, URI.create(baseUrl() + API_PREFIX + "/account/whoami"), null)
                    .path("user_id")
                    .asText(null);
        }
        logger.info("Joined Matrix room {} as {}", roomId, userId);
    }

    public SyncBatch sync(String since, Duration timeout) {
        StringBuilder uri = new StringBuilder(baseUrl())
                .append(API_PREFIX)
                .append("/sync?timeout=")
                .append(timeout.toMillis())
                .append("&filter=")
                .append(UriUtils.encodeQueryParam(timelineFilter(), StandardCharsets.UTF_8));
        if (since != null) {
            uri.append("&since=").append(UriUtils.encodeQueryParam(since, StandardCharsets.UTF_8));
        }
        return parseSync(call(HttpMethod.GET, URI.create(uri.toString()), null), roomId);
    }

    @Override
    public void send(String text) {
        String transactionId = transactionPrefix + "-" + transactionCounter.incrementAndGet();
        URI uri = URI.create(baseUrl()
                + API_PREFIX
                + "/rooms/"
                + encodePath(roomId)
                + "/send/m.room.message/"
                + encodePath(transactionId));
        call(HttpMethod.PUT, uri, Map.of("msgtype", "m.text", "body", text));
    }

    /**
     * Text messages of {@code room} from a sync response, in timeline order.
     */
    static SyncBatch parseSync(JsonNode response, String room) {
        String nextBatch = response.path("next_batch").asText(null);
        List<ChatMessage> messages = new ArrayList<>();
        JsonNode events = response.path("rooms").path("join").path(room).path("timeline").path("events");
        for (JsonNode event : events) {
            if (!"m.room.message".equals(event.path("type").asText())) {
                continue;
            }
            JsonNode content = event.path("content");
            if (!"m.text".equals(content.path("msgtype").asText())) {
                continue;
            }
            messages.add(new ChatMessage(
                    event.path("event_id").asText(null),
                    room,
                    event.path("sender").asText(null),
                    content.path("body").asText("")));
        }
        return new SyncBatch(nextBatch, messages);
    }

    private String timelineFilter() {
        try {
            return objectMapper.writeValueAsString(Map.of(
                    "presence", Map.of("types", List.of()),
                    "account_data", Map.of("types", List.of()),
                    "room", Map.of(
                            "rooms", List.of(roomId),
                            "state", Map.of("types", List.of()),
                            "ephemeral", Map.of("types", List.of()),
                            "timeline", Map.of("types", List.of("m.room.message")))));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize sync filter", e);
        }
    }

    private JsonNode call(HttpMethod method, URI uri, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(settings.accessToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        try {
            String response = restTemplate.exchange(uri, method, new HttpEntity<>(body, headers), String.class).getBody();
            return response == null ? objectMapper.createObjectNode() : objectMapper.readTree(response);
        } catch (RestClientException e) {
            throw new TransportException("Matrix " + method + " " + uri.getPath() + " failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new TransportException("Matrix returned unreadable JSON for " + uri.getPath(), e);
        }
    }

    private String baseUrl() {
        String homeserver = settings.homeserver();
        return homeserver.endsWith("/") ? homeserver.substring(0, homeserver.length() - 1) : homeserver;
    }

    private static String encodePath(String segment) {
        return UriUtils.encodePathSegment(segment, StandardCharsets.UTF_8);
    }
}
