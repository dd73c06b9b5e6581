package respite.server;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters reported by INFO and the periodic stats line.
 */
public class ServerStats {
    public final AtomicLong totalCommands = new AtomicLong(0);
    public final AtomicLong totalConnections = new AtomicLong(0);
    public final AtomicInteger activeConnections = new AtomicInteger(0);
    public final AtomicLong keyspaceHits = new AtomicLong(0);
    public final AtomicLong keyspaceMisses = new AtomicLong(0);
    public final AtomicLong rejectedWrites = new AtomicLong(0);
    public final AtomicLong protocolErrors = new AtomicLong(0);
}
