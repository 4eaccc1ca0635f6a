/**
 * JDBC plumbing shared by the work stores: connection provisioning, statement helpers,
 * and table name validation.
 *
 * @see worklease.jdbc.store
 */
package worklease.jdbc;
