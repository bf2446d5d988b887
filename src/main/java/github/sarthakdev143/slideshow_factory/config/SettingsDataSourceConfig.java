package github.sarthakdev143.slideshow_factory.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * SQLite file for runtime overrides, kept under the data directory so it survives
 * container restarts when that directory is a mounted volume.
 */
@Configuration
public class SettingsDataSourceConfig {

    private static final Logger logger = LoggerFactory.getLogger(SettingsDataSourceConfig.class);
    private static final String DATABASE_FILE = "settings.db";

    @Bean
    public DataSource settingsDataSource(SlideshowProperties properties) {
        Path dataDir = Path.of(properties.dataDir());
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to create data directory " + dataDir.toAbsolutePath(), e);
        }

        Path databaseFile = dataDir.resolve(DATABASE_FILE);
        logger.info("Using settings database {}", databaseFile.toAbsolutePath());
        return DataSourceBuilder.create()
                .driverClassName("org.sqlite.JDBC")
                .url("jdbc:sqlite:" + databaseFile.toAbsolutePath())
                .build();
    }
}
