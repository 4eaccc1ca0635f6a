package worklease.benchmark;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.h2.jdbcx.JdbcDataSource;
import worklease.jdbc.store.AbstractJdbcWorkStore;
import worklease.jdbc.store.H2WorkStore;
import worklease.jdbc.store.MySqlWorkStore;
import worklease.jdbc.store.PostgresWorkStore;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Logger;

/**
 * Creates a {@link DatabaseSetup} for the requested database type, with the
 * {@code work_unit} table recreated from the DDL shipped in {@code worklease-jdbc}.
 *
 * <p>Supported types: {@code "h2"} (in-memory), {@code "mysql"}, and {@code "postgresql"} (external servers).
 * External database connection details are read from system properties:
 * <ul>
 *   <li>{@code bench.mysql.url}: default {@code jdbc:mysql://localhost:3306/worklease_bench}</li>
 *   <li>{@code bench.mysql.user}: default {@code root}</li>
 *   <li>{@code bench.mysql.password}: default {@code ""} (empty)</li>
 *   <li>{@code bench.pg.url}: default {@code jdbc:postgresql://localhost:5432/worklease_bench}</li>
 *   <li>{@code bench.pg.user}: default {@code postgres}</li>
 *   <li>{@code bench.pg.password}: default {@code postgres}</li>
 * </ul>
 */
final class BenchmarkDataSourceFactory {

  record DatabaseSetup(DataSource dataSource, AbstractJdbcWorkStore store) {}

  static DatabaseSetup create(String database, String dbName) {
    return switch (database) {
      case "h2" -> createH2(dbName);
      case "mysql" -> createMySql();
      case "postgresql" -> createPostgresql();
      default -> throw new IllegalArgumentException("Unsupported database: " + database);
    };
  }

  private static DatabaseSetup createH2(String dbName) {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + dbName + ";DB_CLOSE_DELAY=-1");
    initSchema(ds, "schema/h2.sql");
    return new DatabaseSetup(wrapWithPool(ds, "bench-h2"), new H2WorkStore());
  }

  private static DatabaseSetup createMySql() {
    String url = System.getProperty("bench.mysql.url", "jdbc:mysql://localhost:3306/worklease_bench");
    String user = System.getProperty("bench.mysql.user", "root");
    String password = System.getProperty("bench.mysql.password", "");

    DataSource rawDs = new DriverManagerDataSource(url, user, password);
    initSchema(rawDs, "schema/mysql.sql");
    return new DatabaseSetup(wrapWithPool(rawDs, "bench-mysql"), new MySqlWorkStore());
  }

  private static DatabaseSetup createPostgresql() {
    String url = System.getProperty("bench.pg.url", "jdbc:postgresql://localhost:5432/worklease_bench");
    String user = System.getProperty("bench.pg.user", "postgres");
    String password = System.getProperty("bench.pg.password", "postgres");

    DataSource rawDs = new DriverManagerDataSource(url, user, password);
    initSchema(rawDs, "schema/postgresql.sql");
    return new DatabaseSetup(wrapWithPool(rawDs, "bench-pg"), new PostgresWorkStore());
  }

  private static DataSource wrapWithPool(DataSource dataSource, String poolName) {
    HikariConfig config = new HikariConfig();
    config.setDataSource(dataSource);
    config.setPoolName(poolName);
    config.setMaximumPoolSize(10);
    config.setMinimumIdle(2);
    return new HikariDataSource(config);
  }

  private static class DriverManagerDataSource implements DataSource {
    private final String url;
    private final String user;
    private final String password;

    DriverManagerDataSource(String url, String user, String password) {
      this.url = url;
      this.user = user;
      this.password = password;
    }

    @Override
    public Connection getConnection() throws SQLException {
      return DriverManager.getConnection(url, user, password);
    }

    @Override
    public Connection getConnection(String username, String pw) throws SQLException {
      return DriverManager.getConnection(url, username, pw);
    }

    @Override public PrintWriter getLogWriter() { return null; }
    @Override public void setLogWriter(PrintWriter out) {}
    @Override public void setLoginTimeout(int seconds) {}
    @Override public int getLoginTimeout() { return 0; }
    @Override public Logger getParentLogger() { return Logger.getLogger("worklease.benchmark"); }
    @Override public <T> T unwrap(Class<T> iface) { throw new UnsupportedOperationException(); }
    @Override public boolean isWrapperFor(Class<?> iface) { return false; }
  }

  private static void initSchema(DataSource ds, String resource) {
    String ddl = readResource(resource);
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("DROP TABLE IF EXISTS work_unit");
      for (String statement : ddl.split(";")) {
        if (!statement.isBlank()) {
          stmt.execute(statement);
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to initialize benchmark schema", e);
    }
  }

  private static String readResource(String resource) {
    try (InputStream in = BenchmarkDataSourceFactory.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Schema resource not found: " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + resource, e);
    }
  }

  static void truncate(DataSource ds) {
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("TRUNCATE TABLE work_unit");
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to truncate benchmark table", e);
    }
  }

  private BenchmarkDataSourceFactory() {}
}
