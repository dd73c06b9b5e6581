package respite;

import respite.db.RespiteDatabase;
import respite.server.ServerStats;

import java.lang.management.ManagementFactory;

public class RespiteServerContext implements ServerContext {
    private final Config config;
    private final RespiteDatabase db;
    private final ServerStats stats;

    public RespiteServerContext(Config config, RespiteDatabase db, ServerStats stats) {
        this.config = config;
        this.db = db;
        this.stats = stats;
    }

    @Override
    public String getVersion() {
        return config.version;
    }

    @Override
    public int getPort() {
        return config.port;
    }

    @Override
    public long getUptime() {
        return ManagementFactory.getRuntimeMXBean().getUptime();
    }

    @Override
    public String getOsName() {
        return System.getProperty("os.name");
    }

    @Override
    public String getOsArch() {
        return System.getProperty("os.arch");
    }

    @Override
    public String getJavaVersion() {
        return System.getProperty("java.version");
    }

    @Override
    public int getActiveConnections() {
        return stats.activeConnections.get();
    }

    @Override
    public int getMaxConnections() {
        return config.maxConnections;
    }

    @Override
    public long getUsedMemory() {
        return db.memoryUsage();
    }

    @Override
    public long getMaxMemory() {
        return db.getMaxMemory();
    }

    @Override
    public long getTotalConnectionsReceived() {
        return stats.totalConnections.get();
    }

    @Override
    public long getTotalCommandsProcessed() {
        return stats.totalCommands.get();
    }

    @Override
    public long getKeyspaceHits() {
        return stats.keyspaceHits.get();
    }

    @Override
    public long getKeyspaceMisses() {
        return stats.keyspaceMisses.get();
    }

    @Override
    public long getRejectedWrites() {
        return stats.rejectedWrites.get();
    }

    @Override
    public long getProtocolErrors() {
        return stats.protocolErrors.get();
    }

    @Override
    public boolean isPersistenceEnabled() {
        return db.isPersistenceEnabled();
    }

    @Override
    public long getLastSaveTime() {
        return db.getLastSaveTime();
    }

    @Override
    public int getAvailableProcessors() {
        return Runtime.getRuntime().availableProcessors();
    }

    @Override
    public int getDbSize() {
        return db.size();
    }
}
