package github.sarthakdev143.slideshow_factory.controller;

import github.sarthakdev143.slideshow_factory.model.BuildRecord;
import github.sarthakdev143.slideshow_factory.model.BuildStage;
import github.sarthakdev143.slideshow_factory.model.ProgressState;
import github.sarthakdev143.slideshow_factory.model.TriggerSource;
import github.sarthakdev143.slideshow_factory.orchestrator.StatusReporter;
import github.sarthakdev143.slideshow_factory.orchestrator.StatusSnapshot;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SlideshowController.class)
class SlideshowControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-06T01:30:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StatusReporter statusReporter;

    @Test
    void getStatusReportsRunningBuildAndHistory() throws Exception {
        BuildRecord running = BuildRecord.started("b-2", TriggerSource.MANUAL, NOW.minusSeconds(300))
                .atStage(BuildStage.ENCODING);
        BuildRecord failed = BuildRecord.started("b-1", TriggerSource.SCHEDULED, NOW.minusSeconds(3600))
                .atStage(BuildStage.UPLOADING)
                .failed(NOW.minusSeconds(3000), "Nextcloud returned 507");
        BuildRecord succeeded = BuildRecord.started("b-0", TriggerSource.SCHEDULED, Instant.parse("2026-03-05T01:00:00Z"))
                .succeeded(Instant.parse("2026-03-05T01:12:00Z"), "local:/srv/out/slideshow.mp4", List.of("1.jpg", "2.jpg"));
        when(statusReporter.snapshot()).thenReturn(new StatusSnapshot(
                "1.4.0",
                NOW,
                Duration.ofMinutes(90),
                running,
                new ProgressState(7, BuildStage.ENCODING, 0.4, "Rendered slide 8/20", NOW),
                failed,
                succeeded,
                true,
                NOW.minusSeconds(20),
                ZonedDateTime.parse("2026-03-13T01:00:00Z"),
                null));

        mockMvc.perform(get("/api/slideshow/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value("1.4.0"))
                .andExpect(jsonPath("$.uptimeSeconds").value(5400))
                .andExpect(jsonPath("$.building").value(true))
                .andExpect(jsonPath("$.currentStage").value("ENCODING"))
                .andExpect(jsonPath("$.progressPercent").value(40))
                .andExpect(jsonPath("$.progressDetail").value("Rendered slide 8/20"))
                .andExpect(jsonPath("$.activeBuild.buildId").value("b-2"))
                .andExpect(jsonPath("$.activeBuild.trigger").value("MANUAL"))
                .andExpect(jsonPath("$.lastBuild.outcome").value("FAILED"))
                .andExpect(jsonPath("$.lastBuild.stage").value("UPLOADING"))
                .andExpect(jsonPath("$.lastBuild.failureReason").value("Nextcloud returned 507"))
                .andExpect(jsonPath("$.lastSuccessAt").value("2026-03-05T01:12:00Z"))
                .andExpect(jsonPath("$.heartbeatEnabled").value(true));
    }

    @Test
    void getStatusWhenIdle() throws Exception {
        when(statusReporter.snapshot()).thenReturn(new StatusSnapshot(
                "dev",
                NOW,
                Duration.ofSeconds(5),
                null,
                ProgressState.idle(0, NOW),
                null,
                null,
                false,
                null,
                null,
                Boolean.FALSE));

        mockMvc.perform(get("/api/slideshow/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.building").value(false))
                .andExpect(jsonPath("$.progressPercent").value(0))
                .andExpect(jsonPath("$.nextcloudReachable").value(false));
    }

    @Test
    void buildsCannotBeStartedOverHttp() throws Exception {
        mockMvc.perform(post("/api/slideshow/status"))
                .andExpect(status().isMethodNotAllowed());

        verifyNoInteractions(statusReporter);
    }
}
