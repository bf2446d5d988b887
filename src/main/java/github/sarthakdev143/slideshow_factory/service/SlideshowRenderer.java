package github.sarthakdev143.slideshow_factory.service;

import github.sarthakdev143.slideshow_factory.model.plan.RenderJob;

import java.io.IOException;
import java.nio.file.Path;

public interface SlideshowRenderer {

    void render(RenderJob job, RenderProgressListener listener) throws IOException, InterruptedException;

    double probeDurationSeconds(Path media) throws IOException, InterruptedException;
}
