package github.sarthakdev143.slideshow_factory.service;

public interface ChatChannel {

    boolean isConfigured();

    void send(String text);
}
