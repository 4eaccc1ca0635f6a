package worklease.benchmark;

import worklease.benchmark.BenchmarkDataSourceFactory.DatabaseSetup;
import org.openjdk.jmh.annotations.*;
import worklease.jdbc.DataSourceConnectionProvider;
import worklease.lease.LeaseManager;
import worklease.model.LeasedUnit;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Measures claim-then-complete throughput per batch size, with several threads claiming
 * from the same pool.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar ClaimBenchmark}
 * <p>PostgreSQL: {@code java -jar benchmarks/target/benchmarks.jar -p database=postgresql ClaimBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Threads(4)
@Fork(1)
public class ClaimBenchmark {

  private static final int POOL_SIZE = 100_000;

  private DataSource dataSource;
  private LeaseManager leaseManager;

  @Param({"h2"})
  private String database;

  @Param({"1", "10", "50"})
  private int batchSize;

  @State(Scope.Thread)
  public static class Worker {
    private static final AtomicInteger OWNERS = new AtomicInteger();

    String owner;

    @Setup(Level.Trial)
    public void setup() {
      owner = "bench-" + OWNERS.incrementAndGet();
    }
  }

  @Setup(Level.Trial)
  public void setup() {
    DatabaseSetup db = BenchmarkDataSourceFactory.create(database, "bench_claim");
    dataSource = db.dataSource();
    leaseManager = LeaseManager.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .workStore(db.store())
        .build();
  }

  @Setup(Level.Iteration)
  public void refill() {
    BenchmarkDataSourceFactory.truncate(dataSource);
    List<String> ids = new ArrayList<>(10_000);
    for (int i = 0; i < POOL_SIZE; i++) {
      ids.add(String.format("dev-%07d", i));
      if (ids.size() == 10_000) {
        leaseManager.enqueue(ids);
        ids.clear();
      }
    }
  }

  @TearDown(Level.Trial)
  public void tearDown() throws Exception {
    if (dataSource instanceof AutoCloseable ac) ac.close();
  }

  @Benchmark
  public int claimAndComplete(Worker worker) {
    List<LeasedUnit> batch = leaseManager.claimStage(1, batchSize, worker.owner);
    for (LeasedUnit unit : batch) {
      leaseManager.complete(unit);
    }
    return batch.size();
  }
}
