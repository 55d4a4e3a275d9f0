/**
 * Durable broker transport over a relational table.
 *
 * <p>{@link courier.jdbc.broker.JdbcBroker} implements the broker and redelivery contracts;
 * {@link courier.jdbc.broker.AbstractJdbcQueueStore} subclasses hold the per-database SQL and
 * are discovered through {@link courier.jdbc.broker.JdbcQueueStores}. Table definitions ship as
 * {@code /schema/h2.sql}, {@code /schema/mysql.sql} and {@code /schema/postgresql.sql}.
 */
package courier.jdbc.broker;
