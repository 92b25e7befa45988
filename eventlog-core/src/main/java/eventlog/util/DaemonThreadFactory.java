package eventlog.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates daemon threads named {@code <prefix>1}, {@code <prefix>2}, ... so poller workers never
 * keep the JVM alive. Uncaught exceptions are logged rather than printed to stderr.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private final String namePrefix;
    private final AtomicInteger sequence = new AtomicInteger(1);

    public DaemonThreadFactory(String namePrefix) {
        this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread worker = new Thread(task, namePrefix + sequence.getAndIncrement());
        worker.setDaemon(true);
        worker.setUncaughtExceptionHandler((t, e) ->
                logger.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
        return worker;
    }
}
