/**
 * JDBC-based {@link worklease.spi.WorkStore} implementations.
 *
 * <p>{@link worklease.jdbc.store.AbstractJdbcWorkStore} provides shared SQL and row mapping;
 * subclasses supply database-specific claim strategies: H2 (compare-and-swap loop),
 * MySQL ({@code SELECT ... FOR UPDATE SKIP LOCKED} then {@code UPDATE}), and PostgreSQL
 * ({@code UPDATE ... FOR UPDATE SKIP LOCKED ... RETURNING}).
 *
 * @see worklease.jdbc.store.AbstractJdbcWorkStore
 * @see worklease.jdbc.store.H2WorkStore
 * @see worklease.jdbc.store.MySqlWorkStore
 * @see worklease.jdbc.store.PostgresWorkStore
 * @see worklease.jdbc.store.JdbcWorkStores
 */
package worklease.jdbc.store;
