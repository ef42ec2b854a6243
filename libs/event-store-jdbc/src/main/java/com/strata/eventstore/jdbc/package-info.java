/**
 * Relational event store.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.strata.eventstore.jdbc.JdbcEventStore}: append and read over plain JDBC, with
 *       stream versions and global positions assigned inside the append transaction
 *   <li>{@link com.strata.eventstore.jdbc.EventStoreSchemaMigrator}: Flyway migration of the
 *       event store tables
 * </ul>
 */
package com.strata.eventstore.jdbc;
