package github.sarthakdev143.slideshow_factory.integration.matrix;

import github.sarthakdev143.slideshow_factory.model.ChatMessage;

import java.util.List;

public record SyncBatch(String nextBatch, List<ChatMessage> messages) {

    public SyncBatch {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
