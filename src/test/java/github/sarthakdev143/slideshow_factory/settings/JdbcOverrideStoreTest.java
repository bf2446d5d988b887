package github.sarthakdev143.slideshow_factory.settings;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcOverrideStoreTest {

    @TempDir
    Path tempDir;

    private Path databaseFile;
    private JdbcOverrideStore store;

    @BeforeEach
    void setUp() {
        databaseFile = tempDir.resolve("settings.db");
        store = new JdbcOverrideStore(jdbcTemplate(databaseFile));
    }

    @Test
    void saveReplacesExistingValueForSameKey() {
        store.save("IMAGE_DURATION", "12", Instant.parse("2026-01-01T10:00:00Z"));
        store.save("IMAGE_DURATION", "15", Instant.parse("2026-01-01T11:00:00Z"));

        assertThat(store.findAll()).hasSize(1);
        OverrideRecord stored = store.find("IMAGE_DURATION").orElseThrow();
        assertThat(stored.value()).isEqualTo("15");
        assertThat(stored.updatedAt()).isEqualTo(Instant.parse("2026-01-01T11:00:00Z"));
    }

    @Test
    void deleteReportsWhetherARowWasRemoved() {
        store.save("ENABLE_TIMER", "true", Instant.parse("2026-01-01T10:00:00Z"));

        assertThat(store.delete("ENABLE_TIMER")).isTrue();
        assertThat(store.delete("ENABLE_TIMER")).isFalse();
        assertThat(store.find("ENABLE_TIMER")).isEmpty();
    }

    @Test
    void deleteAllReturnsRemovedCount() {
        store.save("IMAGE_DURATION", "12", Instant.parse("2026-01-01T10:00:00Z"));
        store.save("VIDEO_FPS", "10", Instant.parse("2026-01-01T10:00:00Z"));

        assertThat(store.deleteAll()).isEqualTo(2);
        assertThat(store.findAll()).isEmpty();
    }

    @Test
    void overridesSurviveReopeningTheDatabase() {
        store.save("NTFY_TOPIC", "slides", Instant.parse("2026-01-01T10:00:00Z"));

        JdbcOverrideStore reopened = new JdbcOverrideStore(jdbcTemplate(databaseFile));

        assertThat(reopened.find("NTFY_TOPIC")).get().extracting(OverrideRecord::value).isEqualTo("slides");
    }

    static JdbcTemplate jdbcTemplate(Path databaseFile) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + databaseFile.toAbsolutePath());
        dataSource.setDriverClassName("org.sqlite.JDBC");
        return new JdbcTemplate(dataSource);
    }
}
