package github.sarthakdev143.slideshow_factory.integration.matrix;

import github.sarthakdev143.slideshow_factory.command.CommandDispatcher;
import github.sarthakdev143.slideshow_factory.config.SlideshowProperties;
import github.sarthakdev143.slideshow_factory.exception.TransportException;
import github.sarthakdev143.slideshow_factory.model.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Long-polls the room on a daemon thread and feeds every message to the
 * {@link CommandDispatcher}. The thread only ever waits on the network; builds run elsewhere.
 */
@Component
public class MatrixSyncLoop implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(MatrixSyncLoop.class);
    private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(5);
    private static final Duration MAX_BACKOFF = Duration.ofMinutes(2);

    private final MatrixChatClient client;
    private final CommandDispatcher dispatcher;
    private final SlideshowProperties properties;
    private volatile boolean running;
    private Thread thread;

    public MatrixSyncLoop(MatrixChatClient client, CommandDispatcher dispatcher, SlideshowProperties properties) {
        this.client = client;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (!client.isConfigured()) {
            logger.warn("Matrix is not configured; chat commands are disabled");
            return;
        }
        running = true;
        thread = new Thread(this::runLoop, "matrix-sync");
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (thread != null) {
            thread.interrupt();
            thread = null;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void runLoop() {
        String since = null;
        boolean connected = false;
        Duration backoff = INITIAL_BACKOFF;
        while (running) {
            try {
                if (!connected) {
                    client.connect();
                    // skip the backlog: only messages sent after start-up are commands
                    since = client.sync(null, Duration.ZERO).nextBatch();
                    connected = true;
                    backoff = INITIAL_BACKOFF;
                    client.send("🤖 Slideshow bot " + properties.version() + " is online. Send `!help` for commands.");
                    logger.info("Listening for commands in {}", client.roomId());
                }

                SyncBatch batch = client.sync(since, properties.matrix().syncTimeout());
                if (batch.nextBatch() != null) {
                    since = batch.nextBatch();
                }
                for (ChatMessage message : batch.messages()) {
                    handle(message);
                }
            } catch (TransportException e) {
                if (!running) {
                    return;
                }
                logger.warn("Matrix sync failed, retrying in {}: {}", backoff, e.getMessage());
                if (!sleep(backoff)) {
                    return;
                }
                backoff = backoff.multipliedBy(2).compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : backoff.multipliedBy(2);
            } catch (RuntimeException e) {
                logger.error("Unexpected error in Matrix sync loop", e);
                if (!sleep(backoff)) {
                    return;
                }
            }
        }
    }

    void handle(ChatMessage message) {
        if (message.sender() != null && message.sender().equals(client.userId())) {
            return;
        }
        Optional<String> reply = dispatcher.handle(message);
        reply.ifPresent(text -> {
            try {
                client.send(text);
            } catch (TransportException e) {
                logger.warn("Unable to send reply to {}: {}", message.sender(), e.getMessage());
            }
        });
    }

    private boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
