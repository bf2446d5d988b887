package github.sarthakdev143.slideshow_factory.model;

import java.util.List;

public record PushMessage(String title, String body, Priority priority, List<String> tags) {

    public PushMessage {
        priority = priority == null ? Priority.DEFAULT : priority;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public enum Priority {
        MIN("1"),
        LOW("2"),
        DEFAULT("3"),
        HIGH("4"),
        URGENT("5");

        private final String headerValue;

        Priority(String headerValue) {
            this.headerValue = headerValue;
        }

        public String headerValue() {
            return headerValue;
        }
    }
}
