package com.harvester.services.database;

import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * DatabaseService - embedded H2 database holding the processed links ledger.
 * The schema is created on first start and migrated forward on every start.
 */
public class DatabaseService {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseService.class);

    static final String TABLE = "PROCESSED_LINKS";

    // Columns added after the first release, in the order they were introduced
    private static final Map<String, String> MIGRATED_COLUMNS = new LinkedHashMap<>();

    static {
        MIGRATED_COLUMNS.put("KIND", "VARCHAR(32)");
        MIGRATED_COLUMNS.put("DOWNLOADED_AT", "TIMESTAMP");
    }

    private final Jdbi jdbi;

    public DatabaseService(String dbPath) {
        File dbFile = new File(dbPath);
        File parent = dbFile.getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();

        // H2 2.x requires an explicit ./ prefix for relative paths
        String location = dbFile.isAbsolute() ? dbPath : "./" + dbPath;
        String url = "jdbc:h2:" + location +
                ";DB_CLOSE_DELAY=-1" + // Keep DB open between handles
                ";CACHE_SIZE=8192";    // 8MB cache

        this.jdbi = Jdbi.create(url);

        logger.info("🗄️ Database initialized: {}", dbPath);
        initializeSchema();
    }

    /**
     * Create the ledger table and add any column an older store is missing.
     * Existing rows are left untouched.
     */
    private void initializeSchema() {
        jdbi.useHandle(handle -> {
            handle.execute("CREATE TABLE IF NOT EXISTS processed_links (link VARCHAR(2048) PRIMARY KEY)");

            Set<String> existing = readColumns(handle);
            for (Map.Entry<String, String> column : MIGRATED_COLUMNS.entrySet()) {
                if (!existing.contains(column.getKey())) {
                    handle.execute("ALTER TABLE processed_links ADD COLUMN "
                            + column.getKey().toLowerCase(Locale.ROOT) + " " + column.getValue());
                    logger.info("🔧 Migrated ledger schema: added column {}", column.getKey());
                }
            }

            handle.execute("CREATE INDEX IF NOT EXISTS idx_processed_kind ON processed_links(kind)");
            logger.info("✅ Database schema initialized");
        });
    }

    private Set<String> readColumns(Handle handle) {
        return handle.createQuery("""
                        SELECT COLUMN_NAME FROM INFORMATION_SCHEMA.COLUMNS
                        WHERE TABLE_SCHEMA = 'PUBLIC' AND TABLE_NAME = :table
                    """)
                .bind("table", TABLE)
                .mapTo(String.class)
                .stream()
                .map(name -> name.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Column names of the ledger table, upper case.
     */
    public Set<String> getLedgerColumns() {
        return jdbi.withHandle(this::readColumns);
    }

    public Jdbi getJdbi() {
        return jdbi;
    }

    public boolean hasLink(String link) {
        return jdbi.withHandle(handle -> handle
                .createQuery("SELECT COUNT(*) FROM processed_links WHERE link = :link")
                .bind("link", link)
                .mapTo(Integer.class)
                .one() > 0);
    }

    /**
     * Plain insert. Fails with a constraint violation if the link is already stored.
     */
    public void insertLink(String link, String kind, Instant downloadedAt) {
        jdbi.useHandle(handle -> handle
                .createUpdate("INSERT INTO processed_links (link, kind, downloaded_at) VALUES (:link, :kind, :at)")
                .bind("link", link)
                .bind("kind", kind)
                .bind("at", downloadedAt)
                .execute());
    }

    public long countLinks() {
        return jdbi.withHandle(handle -> handle
                .createQuery("SELECT COUNT(*) FROM processed_links")
                .mapTo(Long.class)
                .one());
    }

    public List<String> listLinks(String kind) {
        return jdbi.withHandle(handle -> handle
                .createQuery("SELECT link FROM processed_links WHERE kind = :kind ORDER BY downloaded_at")
                .bind("kind", kind)
                .mapTo(String.class)
                .list());
    }

    public void shutdown() {
        try {
            jdbi.useHandle(handle -> handle.execute("SHUTDOWN"));
        } catch (Exception e) {
            logger.warn("Error shutting down database: {}", e.getMessage());
        }
        logger.info("✅ Database shutdown complete");
    }
}
