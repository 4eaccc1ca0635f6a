/**
 * Claim-and-lease work coordination for a multi-stage enrichment pipeline backed by a
 * relational table.
 *
 * <p>Many worker processes share one {@code work_unit} table. A worker leases a batch of
 * units waiting for its stage in one transaction, skipping rows a concurrent claimer holds
 * locked, processes them, and commits each outcome. Leases abandoned by crashed workers are
 * returned to the pool by the {@linkplain worklease.reclaim.StaleLeaseReclaimer reclaimer}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>worklease-core</b>: model, SPI, lease manager, reclaimer, workers (zero external deps)</li>
 *   <li><b>worklease-jdbc</b>: {@linkplain worklease.jdbc JDBC work stores} (H2, MySQL, PostgreSQL)</li>
 *   <li><b>worklease-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>worklease-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var workStore    = JdbcWorkStores.detect(dataSource);
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 *
 * var leaseManager = LeaseManager.builder()
 *     .connectionProvider(connProvider)
 *     .workStore(workStore)
 *     .maxRetries(3)
 *     .build();
 * leaseManager.enqueue(List.of("octocat", "torvalds"));
 *
 * var reclaimer = new StaleLeaseReclaimer(connProvider, workStore, LeaseTimeouts.defaults());
 *
 * try (var worker = StageWorker.builder()
 *         .leaseManager(leaseManager)
 *         .stage(1)
 *         .processor(username -> fetchProfile(username)
 *             ? StageResult.success()
 *             : StageResult.failure("profile not found"))
 *         .reclaimBeforeClaim(reclaimer)
 *         .build()) {
 *     worker.start();
 *     ...
 * }
 * }</pre>
 */
package worklease;
