package com.strata.eventstore.jdbc;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the event store schema with Flyway.
 *
 * <p>Migrations live under {@value #LOCATION} and are tracked in their own history table, so the
 * event store can share a database with other Flyway-managed schemas.
 */
public final class EventStoreSchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(EventStoreSchemaMigrator.class);

    public static final String LOCATION = "classpath:db/migration/eventstore";
    public static final String HISTORY_TABLE = "event_store_schema_history";

    private final Flyway flyway;

    public EventStoreSchemaMigrator(DataSource dataSource) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        this.flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations(LOCATION)
                .table(HISTORY_TABLE)
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .cleanDisabled(true)
                .load();
    }

    /**
     * Applies pending migrations.
     *
     * @return number of migrations executed
     */
    public int migrate() {
        MigrateResult result = flyway.migrate();
        log.info("Event store schema at version {} ({} migration(s) applied)",
                result.targetSchemaVersion, result.migrationsExecuted);
        return result.migrationsExecuted;
    }

    /** Number of migrations found but not applied yet. */
    public int pendingMigrations() {
        return flyway.info().pending().length;
    }
}
