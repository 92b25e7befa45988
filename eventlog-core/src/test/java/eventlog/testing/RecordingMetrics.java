package eventlog.testing;

import eventlog.SliceRange;
import eventlog.spi.QueryMetrics;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public class RecordingMetrics implements QueryMetrics {
    public final AtomicInteger polls = new AtomicInteger();
    public final AtomicInteger polledEvents = new AtomicInteger();
    public final AtomicInteger replays = new AtomicInteger();
    public final AtomicInteger persistenceIdPages = new AtomicInteger();
    public final AtomicInteger storeFailures = new AtomicInteger();
    public final AtomicLong lastLagMs = new AtomicLong(-1);

    @Override
    public void recordPoll(SliceRange range, int batchSize, long elapsedMs) {
        polls.incrementAndGet();
        polledEvents.addAndGet(batchSize);
    }

    @Override
    public void recordReplay(int rows, long elapsedMs) {
        replays.incrementAndGet();
    }

    @Override
    public void recordPersistenceIds(int rows, long elapsedMs) {
        persistenceIdPages.incrementAndGet();
    }

    @Override
    public void incrementStoreFailure() {
        storeFailures.incrementAndGet();
    }

    @Override
    public void recordPollLagMs(long lagMs) {
        lastLagMs.set(lagMs);
    }
}
