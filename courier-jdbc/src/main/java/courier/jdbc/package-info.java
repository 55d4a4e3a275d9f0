/**
 * JDBC plumbing shared by the durable broker and the reconciliation store: statement helpers,
 * connection providers and the store exception.
 *
 * @see courier.jdbc.broker.JdbcBroker
 */
package courier.jdbc;
