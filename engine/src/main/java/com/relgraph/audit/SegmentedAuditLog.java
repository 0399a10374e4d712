package com.relgraph.audit;

import com.google.common.collect.ImmutableList;
import com.relgraph.common.status.Status;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.tinylog.Logger;

/**
 * In-memory audit log split into one segment per UTC calendar month. Old segments are dropped
 * whole, so retention never rewrites live data.
 */
public final class SegmentedAuditLog implements AuditSink {

  public static final int DEFAULT_RETENTION_MONTHS = 84;

  private final NavigableMap<YearMonth, List<AuditEvent>> segments =
      new ConcurrentSkipListMap<>();
  private final Clock clock;

  public SegmentedAuditLog(Clock clock) {
    this.clock = clock;
  }

  /** {@code audit_events_y2025m03} for March 2025. */
  public static String segmentName(YearMonth month) {
    return String.format("audit_events_y%04dm%02d", month.getYear(), month.getMonthValue());
  }

  @Override
  public Status record(AuditEvent event) {
    YearMonth month = YearMonth.from(event.eventTime().atOffset(ZoneOffset.UTC));
    segments.computeIfAbsent(month, m -> new CopyOnWriteArrayList<>()).add(event);
    return Status.ok();
  }

  public List<String> segmentNames() {
    return segments.keySet().stream()
        .map(SegmentedAuditLog::segmentName)
        .collect(ImmutableList.toImmutableList());
  }

  public List<AuditEvent> events(YearMonth month) {
    List<AuditEvent> segment = segments.get(month);
    return segment == null ? ImmutableList.of() : ImmutableList.copyOf(segment);
  }

  /** Every retained event, oldest segment first. */
  public List<AuditEvent> events() {
    ImmutableList.Builder<AuditEvent> all = ImmutableList.builder();
    segments.values().forEach(all::addAll);
    return all.build();
  }

  public int size() {
    return segments.values().stream().mapToInt(List::size).sum();
  }

  /**
   * Drops every segment whose month lies more than {@code months} months before the current
   * month.
   *
   * @return names of the dropped segments, oldest first
   */
  public List<String> dropSegmentsOlderThan(int months) {
    YearMonth cutoff = YearMonth.now(clock.withZone(ZoneOffset.UTC)).minusMonths(months);
    List<String> dropped = new ArrayList<>();
    Map<YearMonth, List<AuditEvent>> expired = segments.headMap(cutoff, false);
    for (YearMonth month : new ArrayList<>(expired.keySet())) {
      segments.remove(month);
      dropped.add(segmentName(month));
    }
    if (!dropped.isEmpty()) {
      Logger.info("Dropped {} audit segments older than {}: {}", dropped.size(), cutoff, dropped);
    }
    return dropped;
  }

  public List<String> applyRetention() {
    return dropSegmentsOlderThan(DEFAULT_RETENTION_MONTHS);
  }
}
