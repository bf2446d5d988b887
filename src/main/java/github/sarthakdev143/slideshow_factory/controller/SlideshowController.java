package github.sarthakdev143.slideshow_factory.controller;

import github.sarthakdev143.slideshow_factory.dto.BuildStatusResponse;
import github.sarthakdev143.slideshow_factory.orchestrator.StatusReporter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the build state. Builds are started by the schedule or from chat only.
 */
@RestController
@RequestMapping("/api/slideshow")
public class SlideshowController {

    private final StatusReporter statusReporter;

    public SlideshowController(StatusReporter statusReporter) {
        this.statusReporter = statusReporter;
    }

    @GetMapping("/status")
    public ResponseEntity<BuildStatusResponse> getStatus() {
        return ResponseEntity.ok(BuildStatusResponse.from(statusReporter.snapshot()));
    }
}
