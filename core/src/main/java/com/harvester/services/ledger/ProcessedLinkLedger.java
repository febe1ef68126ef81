package com.harvester.services.ledger;

import com.harvester.services.database.DatabaseService;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Optional;

/**
 * Durable record of links that were fully processed.
 * Safe for concurrent use; a second mark of the same link is a silent no-op.
 */
public class ProcessedLinkLedger implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProcessedLinkLedger.class);
    private static final String DUPLICATE_KEY_STATE = "23505";

    private final DatabaseService databaseService;
    private final Clock clock;

    public ProcessedLinkLedger(DatabaseService databaseService) {
        this(databaseService, Clock.systemUTC());
    }

    public ProcessedLinkLedger(DatabaseService databaseService, Clock clock) {
        this.databaseService = databaseService;
        this.clock = clock;
    }

    public boolean isProcessed(String link) {
        if (link == null || link.isEmpty())
            return false;
        return databaseService.hasLink(link);
    }

    /**
     * Record a link as processed with the current time.
     * A record that already exists is left as it is.
     */
    public void markProcessed(String link, ProcessedLink.Kind kind) {
        if (link == null || link.isEmpty())
            return;
        if (databaseService.hasLink(link)) {
            logger.debug("Already recorded: {}", link);
            return;
        }
        try {
            databaseService.insertLink(link, kind.value(), clock.instant());
            logger.debug("Marked as processed: {} ({})", link, kind.value());
        } catch (UnableToExecuteStatementException e) {
            // Lost a race against another fetch of the same link
            if (!isDuplicateKey(e)) throw e;
            logger.debug("Concurrent mark ignored: {}", link);
        }
    }

    public Optional<ProcessedLink> find(String link) {
        return databaseService.getJdbi().withHandle(handle -> handle
                .createQuery("SELECT link, kind, downloaded_at FROM processed_links WHERE link = :link")
                .bind("link", link)
                .map((rs, ctx) -> {
                    Timestamp at = rs.getTimestamp("downloaded_at");
                    return new ProcessedLink(
                            rs.getString("link"),
                            ProcessedLink.Kind.fromValue(rs.getString("kind")),
                            at != null ? at.toInstant() : null);
                })
                .findOne());
    }

    public long count() {
        return databaseService.countLinks();
    }

    @Override
    public void close() {
        databaseService.shutdown();
    }

    private static boolean isDuplicateKey(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException && DUPLICATE_KEY_STATE.equals(((SQLException) t).getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
