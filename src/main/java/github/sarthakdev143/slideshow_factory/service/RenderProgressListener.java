package github.sarthakdev143.slideshow_factory.service;

@FunctionalInterface
public interface RenderProgressListener {

    RenderProgressListener NONE = (fraction, detail) -> {
    };

    /**
     * @param fraction overall rendering progress between 0 and 1
     */
    void onProgress(double fraction, String detail);
}
