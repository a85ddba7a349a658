package com.demo.altcredit.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.Optional;

/** {@link KeyValueStore} over table {@code core.KvEntries} (see db/mssql/kv-store.sql). */
@RequiredArgsConstructor
public class JdbcKeyValueStore implements KeyValueStore {

    private final JdbcTemplate jdbc;
    private final Clock clock;

    @Override
    public Optional<String> get(String key) {
        String sql = """
            SELECT entry_value
            FROM core.KvEntries
            WHERE entry_key = ?
        """;
        return jdbc.query(sql, (rs, i) -> rs.getString("entry_value"), key).stream().findFirst();
    }

    @Override
    public void set(String key, String value) {
        Timestamp now = Timestamp.from(clock.instant());
        int updated = jdbc.update("""
            UPDATE core.KvEntries SET entry_value = ?, updated_at = ?
            WHERE entry_key = ?
        """, value, now, key);
        if (updated == 0) {
            jdbc.update("""
                INSERT INTO core.KvEntries (entry_key, entry_value, updated_at)
                VALUES (?, ?, ?)
            """, key, value, now);
        }
    }

    @Override
    public void remove(String key) {
        jdbc.update("DELETE FROM core.KvEntries WHERE entry_key = ?", key);
    }
}
