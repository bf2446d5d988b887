package github.sarthakdev143.slideshow_factory.settings;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable key/value table behind the override layer. One row per key, last write wins.
 */
public interface OverrideStore {

    Optional<OverrideRecord> find(String key);

    List<OverrideRecord> findAll();

    void save(String key, String value, Instant updatedAt);

    boolean delete(String key);

    int deleteAll();
}
