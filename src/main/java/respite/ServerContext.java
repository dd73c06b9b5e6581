package respite;

public interface ServerContext {
    // Server
    String getVersion();
    int getPort();
    long getUptime();
    String getOsName();
    String getOsArch();
    String getJavaVersion();

    // Clients
    int getActiveConnections();
    int getMaxConnections();

    // Memory
    long getUsedMemory();
    long getMaxMemory();

    // Stats
    long getTotalConnectionsReceived();
    long getTotalCommandsProcessed();
    long getKeyspaceHits();
    long getKeyspaceMisses();
    long getRejectedWrites();
    long getProtocolErrors();

    // Persistence
    boolean isPersistenceEnabled();
    long getLastSaveTime();

    // CPU
    int getAvailableProcessors();

    // Storage
    int getDbSize();
}
