package github.sarthakdev143.slideshow_factory.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcOverrideStore implements OverrideStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcOverrideStore.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS settings (
                setting_key   TEXT PRIMARY KEY,
                setting_value TEXT NOT NULL,
                updated_at    TEXT NOT NULL
            )
            """;

    private static final String UPSERT_SQL = """
            INSERT INTO settings (setting_key, setting_value, updated_at) VALUES (?, ?, ?)
            ON CONFLICT(setting_key) DO UPDATE SET
                setting_value = excluded.setting_value,
                updated_at = excluded.updated_at
            """;

    private static final RowMapper<OverrideRecord> ROW_MAPPER = (rs, rowNum) -> new OverrideRecord(
            rs.getString("setting_key"),
            rs.getString("setting_value"),
            Instant.parse(rs.getString("updated_at")));

    private final JdbcTemplate jdbcTemplate;

    public JdbcOverrideStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        initializeSchema();
    }

    private void initializeSchema() {
        jdbcTemplate.execute(CREATE_TABLE_SQL);
        logger.info("Settings table ready");
    }

    @Override
    public Optional<OverrideRecord> find(String key) {
        List<OverrideRecord> rows = jdbcTemplate.query(
                "SELECT setting_key, setting_value, updated_at FROM settings WHERE setting_key = ?",
                ROW_MAPPER,
                key);
        return rows.stream().findFirst();
    }

    @Override
    public List<OverrideRecord> findAll() {
        return jdbcTemplate.query(
                "SELECT setting_key, setting_value, updated_at FROM settings ORDER BY setting_key",
                ROW_MAPPER);
    }

    @Override
    public synchronized void save(String key, String value, Instant updatedAt) {
        jdbcTemplate.update(UPSERT_SQL, key, value, updatedAt.toString());
    }

    @Override
    public synchronized boolean delete(String key) {
        return jdbcTemplate.update("DELETE FROM settings WHERE setting_key = ?", key) > 0;
    }

    @Override
    public synchronized int deleteAll() {
        return jdbcTemplate.update("DELETE FROM settings");
    }
}
