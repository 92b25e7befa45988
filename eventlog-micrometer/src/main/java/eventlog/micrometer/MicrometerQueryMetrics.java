package eventlog.micrometer;

import eventlog.SliceRange;
import eventlog.spi.QueryMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link QueryMetrics}.
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code eventlog.poll}: slice cursor polls, tagged {@code entity_type} and {@code slices}</li>
 *   <li>{@code eventlog.replay}: per-identity replay pages</li>
 *   <li>{@code eventlog.persistence-ids}: identity enumeration pages</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code eventlog.poll.batch}: events per poll, tagged like {@code eventlog.poll}</li>
 * </ul>
 *
 * <h3>Counters and Gauges</h3>
 * <ul>
 *   <li>{@code eventlog.store.failures}: failed store round trips</li>
 *   <li>{@code eventlog.poll.lag.ms}: lag of the newest delivered event behind the database clock</li>
 * </ul>
 */
public final class MicrometerQueryMetrics implements QueryMetrics, AutoCloseable {

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Timer replay;
    private final Timer persistenceIds;
    private final Counter storeFailures;
    private final Gauge lagGauge;
    private final AtomicLong pollLagMs = new AtomicLong();
    private final Map<SliceRange, RangeMeters> byRange = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * Creates metrics with the default name prefix {@code "eventlog"}.
     */
    public MicrometerQueryMetrics(MeterRegistry registry) {
        this(registry, "eventlog");
    }

    /**
     * Creates metrics with a custom name prefix, for several journals in one registry.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "billing.eventlog"})
     */
    public MicrometerQueryMetrics(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }
        this.registry = registry;
        this.namePrefix = namePrefix;
        this.replay = Timer.builder(namePrefix + ".replay")
                .description("Per-identity replay round trips")
                .register(registry);
        this.persistenceIds = Timer.builder(namePrefix + ".persistence-ids")
                .description("Persistence id enumeration round trips")
                .register(registry);
        this.storeFailures = Counter.builder(namePrefix + ".store.failures")
                .description("Failed journal round trips")
                .register(registry);
        this.lagGauge = Gauge.builder(namePrefix + ".poll.lag.ms", pollLagMs, AtomicLong::get)
                .description("Lag of the newest polled event behind the database clock")
                .register(registry);
    }

    @Override
    public void recordPoll(SliceRange range, int batchSize, long elapsedMs) {
        if (closed) return;
        RangeMeters meters = byRange.computeIfAbsent(range, this::registerRange);
        meters.poll.record(elapsedMs, TimeUnit.MILLISECONDS);
        meters.batch.record(batchSize);
    }

    @Override
    public void recordReplay(int rows, long elapsedMs) {
        if (closed) return;
        replay.record(elapsedMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordPersistenceIds(int rows, long elapsedMs) {
        if (closed) return;
        persistenceIds.record(elapsedMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void incrementStoreFailure() {
        if (closed) return;
        storeFailures.increment();
    }

    @Override
    public void recordPollLagMs(long lagMs) {
        if (closed) return;
        pollLagMs.set(lagMs);
    }

    private RangeMeters registerRange(SliceRange range) {
        Tags tags = Tags.of("entity_type", range.entityType(),
                "slices", range.minSlice() + "-" + range.maxSlice());
        Timer poll = Timer.builder(namePrefix + ".poll")
                .description("Slice cursor polls")
                .tags(tags)
                .register(registry);
        DistributionSummary batch = DistributionSummary.builder(namePrefix + ".poll.batch")
                .description("Events returned per poll")
                .tags(tags)
                .register(registry);
        return new RangeMeters(poll, batch);
    }

    /**
     * Removes all meters registered by this instance from the registry.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(List.of(replay, persistenceIds, storeFailures, lagGauge));
        for (RangeMeters range : byRange.values()) {
            meters.add(range.poll);
            meters.add(range.batch);
        }
        byRange.clear();
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }

    private record RangeMeters(Timer poll, DistributionSummary batch) {
    }
}
