package github.sarthakdev143.slideshow_factory.service.impl;

import github.sarthakdev143.slideshow_factory.model.BuildRecord;
import github.sarthakdev143.slideshow_factory.model.PushMessage;
import github.sarthakdev143.slideshow_factory.model.TriggerSource;
import github.sarthakdev143.slideshow_factory.service.ChatChannel;
import github.sarthakdev143.slideshow_factory.service.PushNotifier;
import github.sarthakdev143.slideshow_factory.settings.EffectiveConfig;
import github.sarthakdev143.slideshow_factory.settings.SettingKey;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Best-effort build announcements on chat and push. A failing channel is logged and
 * counted, never rethrown.
 */
@Component
public class BuildNotifier {

    private static final Logger logger = LoggerFactory.getLogger(BuildNotifier.class);
    private static final int LISTED_SLIDES = 20;

    private final ChatChannel chatChannel;
    private final PushNotifier pushNotifier;
    private final MeterRegistry meterRegistry;

    public BuildNotifier(ChatChannel chatChannel, PushNotifier pushNotifier, MeterRegistry meterRegistry) {
        this.chatChannel = chatChannel;
        this.pushNotifier = pushNotifier;
        this.meterRegistry = meterRegistry;
    }

    public void buildStarted(BuildRecord build, EffectiveConfig config) {
        if (build.trigger() == TriggerSource.SCHEDULED) {
            sendChat("⏰ Scheduled build started.");
        }
        sendPush(config, new PushMessage(
                "Rebuild Started",
                "A " + build.trigger().label().toLowerCase(Locale.ROOT) + " slideshow build has started.",
                PushMessage.Priority.LOW,
                List.of("hourglass_flowing_sand")));
    }

    public void buildSucceeded(BuildRecord build, EffectiveConfig config) {
        sendChat("✅ Slideshow ready with "
                + build.includedSlides().size()
                + " slide(s): "
                + listSlides(build.includedSlides())
                + "\nSaved to "
                + build.outputLocation());
        sendPush(config, new PushMessage(
                "Production Complete",
                "Slideshow with " + build.includedSlides().size() + " slide(s) saved to " + build.outputLocation(),
                PushMessage.Priority.DEFAULT,
                List.of("white_check_mark")));
    }

    public void buildFailed(BuildRecord build, EffectiveConfig config) {
        String reason = "Build failed during " + build.stage().label() + ": " + build.failureReason();
        sendChat("❌ " + reason);
        sendPush(config, new PushMessage(
                "Slideshow Failed",
                reason,
                PushMessage.Priority.HIGH,
                List.of("x")));
    }

    static String listSlides(List<String> slides) {
        if (slides.isEmpty()) {
            return "none";
        }
        if (slides.size() <= LISTED_SLIDES) {
            return String.join(", ", slides);
        }
        return String.join(", ", slides.subList(0, LISTED_SLIDES))
                + " and " + (slides.size() - LISTED_SLIDES) + " more";
    }

    private void sendChat(String text) {
        if (!chatChannel.isConfigured()) {
            return;
        }
        try {
            chatChannel.send(text);
        } catch (RuntimeException e) {
            meterRegistry.counter("slideshow.notifications.failures", "channel", "matrix").increment();
            logger.warn("Chat notification failed: {}", e.getMessage());
        }
    }

    private void sendPush(EffectiveConfig config, PushMessage message) {
        Optional<String> topic = config.text(SettingKey.NTFY_TOPIC);
        if (!config.isEnabled(SettingKey.ENABLE_NTFY) || topic.isEmpty() || !pushNotifier.isConfigured()) {
            return;
        }
        try {
            pushNotifier.publish(topic.get(), message);
        } catch (RuntimeException e) {
            meterRegistry.counter("slideshow.notifications.failures", "channel", "ntfy").increment();
            logger.warn("Push notification '{}' failed: {}", message.title(), e.getMessage());
        }
    }
}
