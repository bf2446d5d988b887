package github.sarthakdev143.slideshow_factory.integration.ntfy;

import github.sarthakdev143.slideshow_factory.config.SlideshowProperties;
import github.sarthakdev143.slideshow_factory.exception.TransportException;
import github.sarthakdev143.slideshow_factory.model.PushMessage;
import github.sarthakdev143.slideshow_factory.service.PushNotifier;
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

@Component
public class NtfyPushNotifier implements PushNotifier {

    private final RestTemplate restTemplate;
    private final SlideshowProperties.Ntfy settings;

    public NtfyPushNotifier(@Qualifier("ntfyRestTemplate") RestTemplate restTemplate, SlideshowProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.ntfy();
    }

    @Override
    public boolean isConfigured() {
        return settings.isConfigured();
    }

    @Override
    public void publish(String topic, PushMessage message) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("ntfy topic is required.");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8));
        headers.set("Title", message.title());
        headers.set("Priority", message.priority().headerValue());
        if (!message.tags().isEmpty()) {
            headers.set("Tags", String.join(",", message.tags()));
        }
        if (settings.token() != null && !settings.token().isBlank()) {
            headers.setBearerAuth(settings.token());
        }

        try {
            restTemplate.exchange(topicUri(topic), HttpMethod.POST, new HttpEntity<>(message.body(), headers), Void.class);
        } catch (RestClientException e) {
            throw new TransportException("ntfy publish to " + topic + " failed: " + e.getMessage(), e);
        }
    }

    URI topicUri(String topic) {
        String base = settings.url().endsWith("/")
                ? settings.url().substring(0, settings.url().length() - 1)
                : settings.url();
        return URI.create(base + "/" + UriUtils.encodePathSegment(topic.trim(), StandardCharsets.UTF_8));
    }
}
