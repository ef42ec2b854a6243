package com.strata.eventhost;

import com.strata.eventhost.config.EventHostProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Runs the JDBC event store with its catch-up subscription.
 *
 * <p>Flyway auto-configuration is excluded: the event store schema has its own history table and is
 * migrated by {@link com.strata.eventstore.jdbc.EventStoreSchemaMigrator}. Applications add their
 * aggregates, event types, handlers and projections through
 * {@link com.strata.eventhost.config.EventSourcingModule} beans.
 */
@SpringBootApplication(exclude = FlywayAutoConfiguration.class)
@EnableConfigurationProperties(EventHostProperties.class)
public class EventHostApplication {

    private static final Logger log = LoggerFactory.getLogger(EventHostApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(EventHostApplication.class, args);
        log.info("Strata event host started");
    }
}
