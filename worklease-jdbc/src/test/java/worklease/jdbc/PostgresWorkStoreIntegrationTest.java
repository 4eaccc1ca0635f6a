package worklease.jdbc;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import worklease.jdbc.store.AbstractJdbcWorkStore;
import worklease.jdbc.store.PostgresWorkStore;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class PostgresWorkStoreIntegrationTest extends AbstractWorkStoreIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("worklease_test");

    private static final PostgresWorkStore STORE = new PostgresWorkStore();
    private static SimpleDataSource dataSource;

    @BeforeAll
    static void initSchema() {
        dataSource = new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        TestSchemas.apply(dataSource, "postgresql");
    }

    @BeforeEach
    void truncate() {
        TestSchemas.execute(dataSource, "TRUNCATE TABLE work_unit");
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcWorkStore store() {
        return STORE;
    }
}
