package worklease.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import worklease.jdbc.store.H2WorkStore;
import worklease.lease.LeaseManager;
import worklease.model.LeasedUnit;
import worklease.model.WorkStatus;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentClaimTest {
  private HikariDataSource dataSource;
  private LeaseManager manager;

  @BeforeEach
  void setUp() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:claim_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(8);
    config.setMinimumIdle(1);
    config.setPoolName("worklease-test-pool");
    dataSource = new HikariDataSource(config);
    TestSchemas.apply(dataSource, "h2");

    manager = LeaseManager.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .workStore(new H2WorkStore())
        .build();
  }

  @AfterEach
  void tearDown() {
    if (dataSource != null && !dataSource.isClosed()) {
      dataSource.close();
    }
  }

  @Test
  void concurrentClaimsReceiveDisjointUnits() throws Exception {
    enqueue(100);
    ExecutorService pool = Executors.newFixedThreadPool(2);
    CountDownLatch start = new CountDownLatch(1);
    try {
      Future<List<LeasedUnit>> a = pool.submit(claimAfter(start, "worker-a"));
      Future<List<LeasedUnit>> b = pool.submit(claimAfter(start, "worker-b"));
      start.countDown();

      List<LeasedUnit> claimedA = a.get(30, TimeUnit.SECONDS);
      List<LeasedUnit> claimedB = b.get(30, TimeUnit.SECONDS);

      assertTrue(claimedA.size() <= 50);
      assertTrue(claimedB.size() <= 50);
      Set<String> idsA = ids(claimedA);
      Set<String> idsB = ids(claimedB);
      idsA.retainAll(idsB);
      assertTrue(idsA.isEmpty(), "Units leased twice: " + idsA);

      long processing = manager.stats().count(WorkStatus.PROCESSING);
      assertEquals(claimedA.size() + claimedB.size(), processing);
      for (LeasedUnit unit : claimedA) {
        assertEquals("worker-a", manager.find(unit.unitId()).orElseThrow().leaseOwner());
      }
      for (LeasedUnit unit : claimedB) {
        assertEquals("worker-b", manager.find(unit.unitId()).orElseThrow().leaseOwner());
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void twoClaimsOfFiftySplitEightyUnitsCompletely() throws Exception {
    enqueue(80);
    ExecutorService pool = Executors.newFixedThreadPool(2);
    CountDownLatch start = new CountDownLatch(1);
    try {
      Future<List<LeasedUnit>> a = pool.submit(claimAfter(start, "worker-a"));
      Future<List<LeasedUnit>> b = pool.submit(claimAfter(start, "worker-b"));
      start.countDown();

      List<LeasedUnit> claimedA = a.get(30, TimeUnit.SECONDS);
      List<LeasedUnit> claimedB = b.get(30, TimeUnit.SECONDS);

      Set<String> all = ids(claimedA);
      all.addAll(ids(claimedB));
      assertEquals(80, claimedA.size() + claimedB.size());
      assertEquals(80, all.size(), "Units leased twice");
      assertEquals(80L, manager.stats().count(WorkStatus.PROCESSING));
      assertEquals(0L, manager.stats().count(WorkStatus.PENDING));
      assertEquals(0, countLeaseMismatches());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void competingWorkersProcessEachUnitOnce() throws Exception {
    enqueue(100);
    int workers = 4;
    ExecutorService pool = Executors.newFixedThreadPool(workers + 1);
    CountDownLatch start = new CountDownLatch(1);
    AtomicBoolean done = new AtomicBoolean();
    ConcurrentHashMap<String, String> completedBy = new ConcurrentHashMap<>();
    List<String> duplicates = new ArrayList<>();
    Future<Integer> sampler = pool.submit(() -> {
      start.await();
      int mismatches = 0;
      while (!done.get()) {
        mismatches += countLeaseMismatches();
      }
      return mismatches;
    });
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int w = 0; w < workers; w++) {
        String owner = "worker-" + w;
        futures.add(pool.submit(() -> {
          start.await();
          List<LeasedUnit> batch;
          while (!(batch = manager.claimStage(1, 7, owner)).isEmpty()) {
            for (LeasedUnit unit : batch) {
              manager.complete(unit);
              if (completedBy.putIfAbsent(unit.unitId(), owner) != null) {
                synchronized (duplicates) {
                  duplicates.add(unit.unitId());
                }
              }
            }
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> f : futures) {
        f.get(60, TimeUnit.SECONDS);
      }
      done.set(true);
      assertEquals(0, sampler.get(30, TimeUnit.SECONDS), "Rows with lease_owner set outside PROCESSING");
    } finally {
      done.set(true);
      pool.shutdownNow();
    }

    assertTrue(duplicates.isEmpty(), "Units processed twice: " + duplicates);
    assertEquals(100, completedBy.size());
    assertEquals(100L, manager.stats().count(WorkStatus.stageDone(1)));
  }

  private void enqueue(int count) {
    List<String> ids = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      ids.add(String.format("unit-%03d", i));
    }
    assertEquals(count, manager.enqueue(ids));
  }

  /** Rows where a lease owner is present without PROCESSING, or missing with it. */
  private int countLeaseMismatches() throws SQLException {
    String sql = "SELECT COUNT(*) FROM work_unit WHERE " +
        "(status='PROCESSING' AND (lease_owner IS NULL OR lease_started_at IS NULL)) OR " +
        "(status<>'PROCESSING' AND (lease_owner IS NOT NULL OR lease_started_at IS NOT NULL))";
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      rs.next();
      return rs.getInt(1);
    }
  }

  private Callable<List<LeasedUnit>> claimAfter(CountDownLatch start, String owner) {
    return () -> {
      start.await();
      return manager.claimStage(1, 50, owner);
    };
  }

  private static Set<String> ids(List<LeasedUnit> units) {
    Set<String> ids = new HashSet<>();
    for (LeasedUnit unit : units) {
      ids.add(unit.unitId());
    }
    return ids;
  }
}
