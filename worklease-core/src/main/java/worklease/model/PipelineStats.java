package worklease.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Number of units per status. Statuses of the pipeline with no units report zero.
 */
public final class PipelineStats {
  private final Map<WorkStatus, Long> counts;

  public PipelineStats(Pipeline pipeline, Map<WorkStatus, Long> counts) {
    Map<WorkStatus, Long> ordered = new LinkedHashMap<>();
    for (WorkStatus status : pipeline.statuses()) {
      ordered.put(status, counts.getOrDefault(status, 0L));
    }
    // keep statuses outside the pipeline (e.g. rows left by a longer pipeline) visible
    counts.forEach(ordered::putIfAbsent);
    this.counts = Collections.unmodifiableMap(ordered);
  }

  public long count(WorkStatus status) {
    return counts.getOrDefault(status, 0L);
  }

  public long total() {
    long total = 0;
    for (long c : counts.values()) {
      total += c;
    }
    return total;
  }

  public Map<WorkStatus, Long> asMap() {
    return counts;
  }

  @Override
  public String toString() {
    return "PipelineStats" + counts;
  }
}
