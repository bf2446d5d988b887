package github.sarthakdev143.slideshow_factory.model;

/**
 * Inbound text message from the chat room.
 */
public record ChatMessage(String eventId, String roomId, String sender, String body) {
}
