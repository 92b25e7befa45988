package eventlog.testing;

import eventlog.spi.ConnectionProvider;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ConnectionProvider handing out inert proxy connections and counting their lifecycle calls.
 */
public class StubConnections implements ConnectionProvider {
    public final AtomicInteger opened = new AtomicInteger();
    public final AtomicInteger closed = new AtomicInteger();
    public final AtomicInteger aborted = new AtomicInteger();

    private volatile Runnable onAbort = () -> { };
    private volatile boolean unavailable;

    public void onAbort(Runnable onAbort) {
        this.onAbort = onAbort;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    @Override
    public Connection getConnection() throws SQLException {
        if (unavailable) {
            throw new SQLException("pool exhausted");
        }
        opened.incrementAndGet();
        return (Connection) Proxy.newProxyInstance(
                StubConnections.class.getClassLoader(),
                new Class<?>[]{Connection.class},
                (proxy, method, args) -> {
                    switch (method.getName()) {
                        case "close":
                            closed.incrementAndGet();
                            return null;
                        case "abort":
                            aborted.incrementAndGet();
                            onAbort.run();
                            return null;
                        case "isClosed":
                        case "isReadOnly":
                        case "getAutoCommit":
                            return false;
                        case "equals":
                            return proxy == args[0];
                        case "hashCode":
                            return System.identityHashCode(proxy);
                        case "toString":
                            return "StubConnection";
                        default:
                            return null;
                    }
                });
    }
}
