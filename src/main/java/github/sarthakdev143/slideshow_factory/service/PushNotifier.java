package github.sarthakdev143.slideshow_factory.service;

import github.sarthakdev143.slideshow_factory.model.PushMessage;

public interface PushNotifier {

    boolean isConfigured();

    void publish(String topic, PushMessage message);
}
