package respite.commands.server;

import respite.ServerContext;

class MockServerContext implements ServerContext {
    int dbSize = 2;
    boolean persistence = true;

    @Override public String getVersion() { return "1.0.0-TEST"; }
    @Override public int getPort() { return 6379; }
    @Override public long getUptime() { return 10000; }
    @Override public String getOsName() { return "TestOS"; }
    @Override public String getOsArch() { return "x64"; }
    @Override public String getJavaVersion() { return "17"; }
    @Override public int getActiveConnections() { return 5; }
    @Override public int getMaxConnections() { return 1000; }
    @Override public long getUsedMemory() { return 1024; }
    @Override public long getMaxMemory() { return 2048; }
    @Override public long getTotalConnectionsReceived() { return 50; }
    @Override public long getTotalCommandsProcessed() { return 100; }
    @Override public long getKeyspaceHits() { return 7; }
    @Override public long getKeyspaceMisses() { return 3; }
    @Override public long getRejectedWrites() { return 4; }
    @Override public long getProtocolErrors() { return 2; }
    @Override public boolean isPersistenceEnabled() { return persistence; }
    @Override public long getLastSaveTime() { return 123456789; }
    @Override public int getAvailableProcessors() { return 4; }
    @Override public int getDbSize() { return dbSize; }
}
